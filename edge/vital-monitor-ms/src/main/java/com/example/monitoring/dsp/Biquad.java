package com.example.monitoring.dsp;

/**
 * Second-order IIR section in direct form II transposed, designed with the bilinear transform
 * (RBJ cookbook). Q = 1/sqrt(2) gives a 2nd-order Butterworth response.
 */
final class Biquad {

    static final double BUTTERWORTH_Q = 1.0 / Math.sqrt(2.0);

    private final double b0;
    private final double b1;
    private final double b2;
    private final double a1;
    private final double a2;

    private Biquad(double b0, double b1, double b2, double a0, double a1, double a2) {
        this.b0 = b0 / a0;
        this.b1 = b1 / a0;
        this.b2 = b2 / a0;
        this.a1 = a1 / a0;
        this.a2 = a2 / a0;
    }

    static Biquad lowPass(double cutoffHz, double sampleRate) {
        double w0 = 2 * Math.PI * clampCutoff(cutoffHz, sampleRate) / sampleRate;
        double cos = Math.cos(w0);
        double alpha = Math.sin(w0) / (2 * BUTTERWORTH_Q);
        return new Biquad((1 - cos) / 2, 1 - cos, (1 - cos) / 2, 1 + alpha, -2 * cos, 1 - alpha);
    }

    static Biquad highPass(double cutoffHz, double sampleRate) {
        double w0 = 2 * Math.PI * clampCutoff(cutoffHz, sampleRate) / sampleRate;
        double cos = Math.cos(w0);
        double alpha = Math.sin(w0) / (2 * BUTTERWORTH_Q);
        return new Biquad((1 + cos) / 2, -(1 + cos), (1 + cos) / 2, 1 + alpha, -2 * cos, 1 - alpha);
    }

    // Cut-offs at or above Nyquist would fold; keep them just under it.
    private static double clampCutoff(double cutoffHz, double sampleRate) {
        return Math.min(cutoffHz, sampleRate * 0.49);
    }

    /** DC gain of the section, used to seed the state at the first sample. */
    double dcGain() {
        return (b0 + b1 + b2) / (1 + a1 + a2);
    }

    /**
     * Filters {@code data} in place, forward then backward, so the result has zero phase and
     * the squared magnitude response.
     */
    void filtfilt(float[] data) {
        if (data.length == 0) return;
        run(data, true);
        run(data, false);
    }

    private void run(float[] data, boolean forward) {
        int n = data.length;
        int start = forward ? 0 : n - 1;
        int step = forward ? 1 : -1;

        // Steady state for a constant input equal to the first sample.
        double x0 = data[start];
        double y0 = x0 * dcGain();
        double z1 = y0 - b0 * x0;
        double z2 = b2 * x0 - a2 * y0;

        for (int i = start, k = 0; k < n; i += step, k++) {
            double x = data[i];
            double y = b0 * x + z1;
            z1 = b1 * x - a1 * y + z2;
            z2 = b2 * x - a2 * y;
            data[i] = (float) y;
        }
    }
}
