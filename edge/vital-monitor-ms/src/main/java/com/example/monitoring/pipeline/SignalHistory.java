package com.example.monitoring.pipeline;

import com.example.monitoring.dsp.SignalConditioner;
import com.example.monitoring.model.SensorPacket;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Bounded rolling windows of raw samples for the periodic passes. Oldest samples fall off once a
 * window is full.
 */
@ApplicationScoped
public class SignalHistory {

    private final FloatWindow ecg;
    private final FloatWindow ppg;
    private final Deque<Double> glucose = new ArrayDeque<>();
    private final Deque<Double> spo2 = new ArrayDeque<>();
    private final int glucoseCapacity;
    private final int spo2Capacity;

    @Inject
    public SignalHistory(
        SignalConditioner conditioner,
        @ConfigProperty(name = "monitoring.history.waveform-seconds", defaultValue = "10") int waveformSeconds,
        @ConfigProperty(name = "monitoring.history.glucose-readings", defaultValue = "20") int glucoseCapacity,
        @ConfigProperty(name = "monitoring.history.spo2-readings", defaultValue = "100") int spo2Capacity
    ) {
        this(
            (int) Math.round(conditioner.ecgSampleRate() * waveformSeconds),
            (int) Math.round(conditioner.ppgSampleRate() * waveformSeconds),
            glucoseCapacity,
            spo2Capacity
        );
    }

    public SignalHistory(int ecgCapacity, int ppgCapacity, int glucoseCapacity, int spo2Capacity) {
        this.ecg = new FloatWindow(ecgCapacity);
        this.ppg = new FloatWindow(ppgCapacity);
        this.glucoseCapacity = glucoseCapacity;
        this.spo2Capacity = spo2Capacity;
    }

    public synchronized void append(SensorPacket packet) {
        ecg.append(packet.ecg());
        ppg.append(packet.ppg());
        appendBounded(glucose, packet.glucose(), glucoseCapacity);
        appendBounded(spo2, packet.spo2(), spo2Capacity);
    }

    private static void appendBounded(Deque<Double> window, float[] values, int capacity) {
        for (float v : values) {
            window.addLast((double) v);
            if (window.size() > capacity) {
                window.removeFirst();
            }
        }
    }

    public synchronized float[] ecgWindow() {
        return ecg.toArray();
    }

    public synchronized float[] ppgWindow() {
        return ppg.toArray();
    }

    public synchronized List<Double> glucose() {
        return new ArrayList<>(glucose);
    }

    public synchronized List<Double> spo2() {
        return new ArrayList<>(spo2);
    }

    /** Ring buffer over a primitive array. */
    static final class FloatWindow {

        private final float[] buffer;
        private int start;
        private int size;

        FloatWindow(int capacity) {
            this.buffer = new float[Math.max(1, capacity)];
        }

        void append(float[] values) {
            for (float v : values) {
                int end = (start + size) % buffer.length;
                buffer[end] = v;
                if (size < buffer.length) {
                    size++;
                } else {
                    start = (start + 1) % buffer.length;
                }
            }
        }

        float[] toArray() {
            float[] out = new float[size];
            for (int i = 0; i < size; i++) {
                out[i] = buffer[(start + i) % buffer.length];
            }
            return out;
        }
    }
}
