package com.example.monitoring.features;

import com.example.monitoring.model.ConditionedSignals;
import com.example.monitoring.model.FeatureSet;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Derives rhythm, variability, spectral and morphology descriptors from one conditioned window.
 * Fewer than two detected beats yields {@link FeatureSet#EMPTY}.
 */
@ApplicationScoped
public class FeatureExtractor {

    static final double TACHOGRAM_RATE_HZ = 4.0;
    static final double LF_LOW = 0.04;
    static final double LF_HIGH = 0.15;
    static final double HF_HIGH = 0.40;

    public FeatureSet extract(ConditionedSignals signals) {
        float[] ecg = signals.ecg();
        double fs = signals.ecgSampleRate();
        int[] peaks = RPeakDetector.detect(ecg, fs);
        if (peaks.length < 2) {
            return FeatureSet.EMPTY;
        }

        double[] rr = new double[peaks.length - 1];
        for (int i = 1; i < peaks.length; i++) {
            rr[i - 1] = (peaks[i] - peaks[i - 1]) / fs;
        }
        double meanRr = mean(rr);
        double sdnn = standardDeviation(rr, meanRr);
        double rmssd = rmssd(rr);

        double lf = 0;
        double hf = 0;
        double respiratoryRate = 0;
        double[] tachogram = resampleTachogram(peaks, rr, fs);
        if (tachogram.length >= 8) {
            Spectrum spectrum = Spectrum.of(tachogram, TACHOGRAM_RATE_HZ);
            lf = spectrum.bandPower(LF_LOW, LF_HIGH);
            hf = spectrum.bandPower(LF_HIGH, HF_HIGH);
            if (hf > 0) {
                respiratoryRate = spectrum.peakFrequency(LF_HIGH, HF_HIGH) * 60.0;
            }
        }

        return new FeatureSet(
            meanRr,
            sdnn,
            rmssd,
            lf,
            hf,
            hf > 0 ? lf / hf : 0,
            sampleEntropy(rr, 2, 0.2 * sdnn),
            lempelZivComplexity(ecg),
            60.0 / meanRr,
            meanRr > 0 ? sdnn / meanRr : 0,
            stDeviation(ecg, peaks, fs),
            pulseTransitTimeMs(peaks, fs, signals.ppg(), signals.ppgSampleRate()),
            respiratoryRate,
            peaks.length
        );
    }

    static double mean(double[] x) {
        double sum = 0;
        for (double v : x) {
            sum += v;
        }
        return x.length == 0 ? 0 : sum / x.length;
    }

    static double standardDeviation(double[] x, double mean) {
        if (x.length < 2) return 0;
        double acc = 0;
        for (double v : x) {
            acc += (v - mean) * (v - mean);
        }
        return Math.sqrt(acc / (x.length - 1));
    }

    static double rmssd(double[] rr) {
        if (rr.length < 2) return 0;
        double acc = 0;
        for (int i = 1; i < rr.length; i++) {
            double d = rr[i] - rr[i - 1];
            acc += d * d;
        }
        return Math.sqrt(acc / (rr.length - 1));
    }

    /** RR series placed at the time of the closing beat, linearly resampled at 4 Hz. */
    static double[] resampleTachogram(int[] peaks, double[] rr, double fs) {
        if (rr.length < 4) return new double[0];
        double t0 = peaks[1] / fs;
        double tEnd = peaks[peaks.length - 1] / fs;
        int count = (int) Math.floor((tEnd - t0) * TACHOGRAM_RATE_HZ) + 1;
        double[] out = new double[count];
        int k = 0;
        for (int i = 0; i < count; i++) {
            double t = t0 + i / TACHOGRAM_RATE_HZ;
            while (k < rr.length - 2 && peaks[k + 2] / fs < t) {
                k++;
            }
            double ta = peaks[k + 1] / fs;
            double tb = peaks[k + 2] / fs;
            double frac = tb > ta ? (t - ta) / (tb - ta) : 0;
            frac = Math.max(0, Math.min(1, frac));
            out[i] = rr[k] + frac * (rr[k + 1] - rr[k]);
        }
        return out;
    }

    /** SampEn(m, r); 0 when undefined (too short, flat, or no matches). */
    static double sampleEntropy(double[] x, int m, double r) {
        int n = x.length;
        if (n < m + 2 || r <= 0) return 0;
        long b = 0;
        long a = 0;
        for (int i = 0; i < n - m; i++) {
            for (int j = i + 1; j < n - m; j++) {
                boolean match = true;
                for (int k = 0; k < m && match; k++) {
                    match = Math.abs(x[i + k] - x[j + k]) <= r;
                }
                if (!match) continue;
                b++;
                if (Math.abs(x[i + m] - x[j + m]) <= r) {
                    a++;
                }
            }
        }
        if (a == 0 || b == 0) return 0;
        return -Math.log((double) a / b);
    }

    /** Normalized LZ76 complexity of the median-binarized signal, roughly in [0, 1]. */
    static double lempelZivComplexity(float[] signal) {
        int n = signal.length;
        if (n < 2) return 0;
        float[] sorted = signal.clone();
        Arrays.sort(sorted);
        float median = sorted[n / 2];
        boolean[] s = new boolean[n];
        for (int i = 0; i < n; i++) {
            s[i] = signal[i] > median;
        }

        // Kaspar-Schuster
        int c = 1;
        int l = 1;
        int i = 0;
        int k = 1;
        int kMax = 1;
        while (l + k <= n) {
            if (s[i + k - 1] == s[l + k - 1]) {
                k++;
            } else {
                kMax = Math.max(k, kMax);
                i++;
                if (i == l) {
                    c++;
                    l += kMax;
                    i = 0;
                    kMax = 1;
                }
                k = 1;
            }
        }
        if (k != 1) {
            c++;
        }
        return c * (Math.log(n) / Math.log(2)) / n;
    }

    /** Mean of ECG at R+80 ms minus the PR baseline around R-60 ms, over all complete beats. */
    static double stDeviation(float[] ecg, int[] peaks, double fs) {
        int stOffset = (int) Math.round(0.080 * fs);
        int prOffset = (int) Math.round(0.060 * fs);
        int half = Math.max(1, (int) Math.round(0.010 * fs));
        double total = 0;
        int beats = 0;
        for (int r : peaks) {
            if (r - prOffset - half < 0 || r + stOffset + half >= ecg.length) continue;
            total += windowMean(ecg, r + stOffset, half) - windowMean(ecg, r - prOffset, half);
            beats++;
        }
        return beats == 0 ? 0 : total / beats;
    }

    private static double windowMean(float[] x, int centre, int half) {
        double sum = 0;
        for (int i = centre - half; i <= centre + half; i++) {
            sum += x[i];
        }
        return sum / (2 * half + 1);
    }

    /** Mean delay from each R peak to the next PPG systolic peak within 100-500 ms; 0 if none pair up. */
    static double pulseTransitTimeMs(int[] rPeaks, double ecgFs, float[] ppg, double ppgFs) {
        if (ppg.length == 0 || rPeaks.length == 0) return 0;
        List<Double> ppgPeakTimes = ppgPeakTimes(ppg, ppgFs);
        if (ppgPeakTimes.isEmpty()) return 0;

        double total = 0;
        int pairs = 0;
        int j = 0;
        for (int r : rPeaks) {
            double tr = r / ecgFs;
            while (j < ppgPeakTimes.size() && ppgPeakTimes.get(j) < tr + 0.100) {
                j++;
            }
            if (j < ppgPeakTimes.size() && ppgPeakTimes.get(j) <= tr + 0.500) {
                total += (ppgPeakTimes.get(j) - tr) * 1000.0;
                pairs++;
            }
        }
        return pairs == 0 ? 0 : total / pairs;
    }

    private static List<Double> ppgPeakTimes(float[] ppg, double fs) {
        double mean = 0;
        for (float v : ppg) {
            mean += v;
        }
        mean /= ppg.length;
        double var = 0;
        for (float v : ppg) {
            var += (v - mean) * (v - mean);
        }
        double threshold = mean + 0.5 * Math.sqrt(var / ppg.length);
        int minDistance = (int) Math.max(1, Math.round(0.30 * fs));

        List<Double> times = new ArrayList<>();
        int last = -minDistance - 1;
        for (int i = 1; i < ppg.length - 1; i++) {
            if (ppg[i] > threshold && ppg[i] >= ppg[i - 1] && ppg[i] > ppg[i + 1] && i - last > minDistance) {
                times.add(i / fs);
                last = i;
            }
        }
        return times;
    }
}
