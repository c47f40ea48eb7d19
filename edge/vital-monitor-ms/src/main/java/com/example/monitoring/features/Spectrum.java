package com.example.monitoring.features;

/**
 * Power spectrum of an evenly sampled series via an in-place radix-2 FFT.
 */
final class Spectrum {

    private final double[] power;
    private final double binHz;

    private Spectrum(double[] power, double binHz) {
        this.power = power;
        this.binHz = binHz;
    }

    /**
     * Mean-removed, Hann-windowed, zero-padded to the next power of two.
     */
    static Spectrum of(double[] series, double sampleRate) {
        int size = 2;
        while (size < series.length) {
            size <<= 1;
        }
        int n = series.length;
        double mean = 0;
        for (int i = 0; i < n; i++) {
            mean += series[i];
        }
        mean /= Math.max(1, n);

        double[] re = new double[size];
        double[] im = new double[size];
        for (int i = 0; i < n; i++) {
            double w = n > 1 ? 0.5 - 0.5 * Math.cos(2 * Math.PI * i / (n - 1)) : 1.0;
            re[i] = (series[i] - mean) * w;
        }
        fft(re, im);

        double[] power = new double[size / 2 + 1];
        for (int k = 0; k < power.length; k++) {
            power[k] = (re[k] * re[k] + im[k] * im[k]) / size;
        }
        return new Spectrum(power, sampleRate / size);
    }

    double bandPower(double lowHz, double highHz) {
        double total = 0;
        for (int k = 0; k < power.length; k++) {
            double f = k * binHz;
            if (f >= lowHz && f < highHz) {
                total += power[k];
            }
        }
        return total;
    }

    /** Frequency of the strongest bin inside the band, or 0 when the band holds no energy. */
    double peakFrequency(double lowHz, double highHz) {
        double best = 0;
        double bestFreq = 0;
        for (int k = 0; k < power.length; k++) {
            double f = k * binHz;
            if (f >= lowHz && f < highHz && power[k] > best) {
                best = power[k];
                bestFreq = f;
            }
        }
        return bestFreq;
    }

    private static void fft(double[] re, double[] im) {
        int n = re.length;
        int levels = 31 - Integer.numberOfLeadingZeros(n);

        for (int i = 0; i < n; i++) {
            int j = Integer.reverse(i) >>> (32 - levels);
            if (j > i) {
                double tr = re[i];
                re[i] = re[j];
                re[j] = tr;
                double ti = im[i];
                im[i] = im[j];
                im[j] = ti;
            }
        }

        for (int size = 2; size <= n; size <<= 1) {
            int half = size / 2;
            double step = -2 * Math.PI / size;
            for (int i = 0; i < n; i += size) {
                for (int j = 0; j < half; j++) {
                    double cos = Math.cos(j * step);
                    double sin = Math.sin(j * step);
                    int a = i + j;
                    int b = a + half;
                    double tr = cos * re[b] - sin * im[b];
                    double ti = sin * re[b] + cos * im[b];
                    re[b] = re[a] - tr;
                    im[b] = im[a] - ti;
                    re[a] += tr;
                    im[a] += ti;
                }
            }
        }
    }
}
