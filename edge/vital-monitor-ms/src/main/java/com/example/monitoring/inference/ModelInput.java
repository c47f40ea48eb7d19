package com.example.monitoring.inference;

import com.example.monitoring.model.FeatureSet;
import com.example.monitoring.model.SensorPacket;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a scoring model may look at. Periodic passes have no packet; glucose and SpO2
 * windows come from the rolling history, oldest first.
 */
public final class ModelInput {

    private final FeatureSet features;
    private final SensorPacket packet;
    private final List<Double> glucoseHistory;
    private final List<Double> spo2Window;

    public ModelInput(FeatureSet features, SensorPacket packet, List<Double> glucoseHistory, List<Double> spo2Window) {
        this.features = Objects.requireNonNull(features, "features");
        this.packet = packet;
        this.glucoseHistory = List.copyOf(glucoseHistory);
        this.spo2Window = List.copyOf(spo2Window);
    }

    public static ModelInput of(FeatureSet features, SensorPacket packet) {
        return new ModelInput(features, packet, toList(packet.glucose()), toList(packet.spo2()));
    }

    private static List<Double> toList(float[] values) {
        Double[] boxed = new Double[values.length];
        for (int i = 0; i < values.length; i++) {
            boxed[i] = (double) values[i];
        }
        return List.of(boxed);
    }

    public FeatureSet features() {
        return features;
    }

    public Optional<SensorPacket> packet() {
        return Optional.ofNullable(packet);
    }

    public List<Double> glucoseHistory() {
        return glucoseHistory;
    }

    public List<Double> spo2Window() {
        return spo2Window;
    }
}
