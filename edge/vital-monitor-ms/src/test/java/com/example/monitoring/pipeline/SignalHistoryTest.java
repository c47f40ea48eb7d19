package com.example.monitoring.pipeline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.example.monitoring.model.SensorPacket;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class SignalHistoryTest {

    private final SignalHistory history = new SignalHistory(5, 3, 2, 3);

    @Test
    void windowsKeepNewestSamplesInOrder() {
        history.append(packet(new float[] {1, 2, 3}, new float[] {1, 2}, new float[] {100}, new float[] {97, 98}));
        history.append(packet(new float[] {4, 5, 6, 7}, new float[] {3, 4}, new float[] {101, 102}, new float[] {96, 95}));

        assertArrayEquals(new float[] {3, 4, 5, 6, 7}, history.ecgWindow());
        assertArrayEquals(new float[] {2, 3, 4}, history.ppgWindow());
        assertEquals(List.of(101.0, 102.0), history.glucose());
        assertEquals(List.of(98.0, 96.0, 95.0), history.spo2());
    }

    @Test
    void partialWindowsReturnWhatTheyHave() {
        history.append(packet(new float[] {1, 2}, new float[0], new float[0], new float[] {99}));

        assertArrayEquals(new float[] {1, 2}, history.ecgWindow());
        assertEquals(0, history.ppgWindow().length);
        assertEquals(List.of(), history.glucose());
        assertEquals(List.of(99.0), history.spo2());
    }

    @Test
    void returnedWindowsAreCopies() {
        history.append(packet(new float[] {1, 2}, new float[0], new float[0], new float[0]));

        history.ecgWindow()[0] = 42;

        assertEquals(1f, history.ecgWindow()[0]);
    }

    private static SensorPacket packet(float[] ecg, float[] ppg, float[] glucose, float[] spo2) {
        return new SensorPacket(Instant.EPOCH, ecg, ppg, new float[0], spo2, glucose, 36.6f, 80f);
    }
}
