package com.example.monitoring.dsp;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.monitoring.model.ConditionedSignals;
import org.junit.jupiter.api.Test;

class SignalConditionerTest {

    private final SignalConditioner conditioner = SignalConditioner.withDefaults();

    @Test
    void keepsLengthAndLeavesInputAlone() {
        float[] ecg = sine(2500, 250, 5, 1.0);
        float[] ppg = sine(1000, 100, 1.2, 1.0);
        float[] ecgCopy = ecg.clone();

        ConditionedSignals out = conditioner.condition(ecg, ppg);

        assertEquals(2500, out.ecg().length);
        assertEquals(1000, out.ppg().length);
        assertArrayEquals(ecgCopy, ecg);
        assertEquals(250.0, out.ecgSampleRate());
        assertEquals(100.0, out.ppgSampleRate());
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        ConditionedSignals out = conditioner.condition(new float[0], null);

        assertEquals(0, out.ecg().length);
        assertEquals(0, out.ppg().length);
    }

    @Test
    void removesOffsetAndDrift() {
        float[] ecg = new float[2500];
        for (int i = 0; i < ecg.length; i++) {
            double t = i / 250.0;
            ecg[i] = (float) (2.0 + 0.5 * Math.sin(2 * Math.PI * 0.05 * t));
        }

        float[] out = conditioner.condition(ecg, new float[0]).ecg();

        assertTrue(rms(out, 500, 2000) < 0.1, "residual baseline " + rms(out, 500, 2000));
    }

    @Test
    void passesTheQrsBand() {
        float[] ecg = sine(2500, 250, 10, 1.0);

        float[] out = conditioner.condition(ecg, new float[0]).ecg();

        double ratio = rms(out, 500, 2000) / rms(ecg, 500, 2000);
        assertTrue(ratio > 0.9, "10 Hz gain " + ratio);
    }

    @Test
    void attenuatesHighFrequencyNoise() {
        float[] ecg = sine(2500, 250, 90, 1.0);

        float[] out = conditioner.condition(ecg, new float[0]).ecg();

        double ratio = rms(out, 500, 2000) / rms(ecg, 500, 2000);
        assertTrue(ratio < 0.1, "90 Hz gain " + ratio);
    }

    @Test
    void ppgLowPassIsTighter() {
        float[] ppg = sine(1000, 100, 30, 1.0);

        float[] out = conditioner.condition(new float[0], ppg).ppg();

        double ratio = rms(out, 200, 800) / rms(ppg, 200, 800);
        assertTrue(ratio < 0.15, "30 Hz PPG gain " + ratio);
    }

    @Test
    void isDeterministic() {
        float[] ecg = sine(1000, 250, 7, 0.8);

        assertArrayEquals(conditioner.condition(ecg, ecg).ecg(), conditioner.condition(ecg, ecg).ecg());
    }

    private static float[] sine(int n, double fs, double hz, double amplitude) {
        float[] out = new float[n];
        for (int i = 0; i < n; i++) {
            out[i] = (float) (amplitude * Math.sin(2 * Math.PI * hz * i / fs));
        }
        return out;
    }

    private static double rms(float[] x, int from, int to) {
        double acc = 0;
        for (int i = from; i < to; i++) {
            acc += x[i] * x[i];
        }
        return Math.sqrt(acc / (to - from));
    }
}
