package com.example.monitoring.features;

import java.util.ArrayList;
import java.util.List;

/**
 * Adaptive-threshold R-peak search over a conditioned ECG: squared slope, moving-window
 * integration, threshold at {@code max(mean + k*sd, fraction * max)}, refractory skip, then
 * refinement onto the local maximum of the ECG itself.
 */
final class RPeakDetector {

    private static final double INTEGRATION_SECONDS = 0.110;
    private static final double REFRACTORY_SECONDS = 0.200;
    private static final double REFINE_SECONDS = 0.050;
    private static final double MIN_PEAK_DISTANCE_SECONDS = 0.250;

    private RPeakDetector() {}

    static int[] detect(float[] ecg, double fs) {
        int n = ecg.length;
        if (n < Math.max(8, (int) (fs * 0.5))) {
            return new int[0];
        }

        double[] energy = new double[n];
        for (int i = 1; i < n; i++) {
            double d = ecg[i] - ecg[i - 1];
            energy[i] = d * d;
        }
        double[] integ = movingAverage(energy, window(INTEGRATION_SECONDS, fs));

        double sum = 0;
        double max = 0;
        for (double v : integ) {
            sum += v;
            max = Math.max(max, v);
        }
        double mean = sum / n;
        double var = 0;
        for (double v : integ) {
            var += (v - mean) * (v - mean);
        }
        double sd = Math.sqrt(var / Math.max(1, n - 1));
        if (max <= 1e-12) {
            return new int[0];
        }

        int[] peaks = search(ecg, integ, Math.max(mean + 1.5 * sd, 0.25 * max), fs);
        if (peaks.length < 2) {
            // Relax once for low-amplitude recordings.
            peaks = search(ecg, integ, Math.max(mean + sd, 0.15 * max), fs);
        }
        return peaks;
    }

    private static int[] search(float[] ecg, double[] integ, double threshold, double fs) {
        int n = ecg.length;
        int refractory = window(REFRACTORY_SECONDS, fs);
        int refine = window(REFINE_SECONDS, fs);
        int minDistance = window(MIN_PEAK_DISTANCE_SECONDS, fs);

        List<Integer> peaks = new ArrayList<>();
        int i = 1;
        while (i < n - 1) {
            if (integ[i] > threshold && integ[i] >= integ[i - 1] && integ[i] >= integ[i + 1]) {
                int best = refineOnto(ecg, i, refine);
                if (peaks.isEmpty() || best - peaks.get(peaks.size() - 1) > minDistance) {
                    peaks.add(best);
                } else if (ecg[best] > ecg[peaks.get(peaks.size() - 1)]) {
                    peaks.set(peaks.size() - 1, best);
                }
                i += refractory;
            } else {
                i++;
            }
        }
        return peaks.stream().mapToInt(Integer::intValue).toArray();
    }

    private static int refineOnto(float[] ecg, int centre, int halfWidth) {
        int from = Math.max(0, centre - halfWidth);
        int to = Math.min(ecg.length - 1, centre + halfWidth);
        int best = from;
        for (int k = from + 1; k <= to; k++) {
            if (ecg[k] > ecg[best]) {
                best = k;
            }
        }
        return best;
    }

    private static int window(double seconds, double fs) {
        return (int) Math.max(1, Math.round(seconds * fs));
    }

    /** Centered moving average with a running sum. */
    static double[] movingAverage(double[] x, int width) {
        int n = x.length;
        double[] out = new double[n];
        int half = width / 2;
        double acc = 0;
        int lo = 0;
        int hi = -1;
        for (int i = 0; i < n; i++) {
            int wantLo = Math.max(0, i - half);
            int wantHi = Math.min(n - 1, i + half);
            while (hi < wantHi) {
                acc += x[++hi];
            }
            while (lo < wantLo) {
                acc -= x[lo++];
            }
            out[i] = acc / (hi - lo + 1);
        }
        return out;
    }
}
