package com.example.monitoring.inference;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class Spo2DesaturationModelTest {

    private final Spo2DesaturationModel model = new Spo2DesaturationModel();

    @Test
    void singleDeepDipIsCritical() {
        Spo2Assessment s = model.assess(List.of(96.0, 95.0, 96.0, 84.0, 95.0, 96.0));

        assertEquals(Spo2AlertLevel.CRITICAL, s.level());
        assertEquals(84.0, s.min());
    }

    @Test
    void lowAverageIsWarning() {
        Spo2Assessment s = model.assess(List.of(91.0, 91.0, 92.0, 91.0, 91.0));

        assertEquals(Spo2AlertLevel.WARNING, s.level());
        assertEquals(91.2, s.mean(), 1e-9);
    }

    @Test
    void normalSaturationIsNone() {
        assertEquals(Spo2AlertLevel.NONE, model.assess(List.of(97.0, 98.0, 97.0, 96.0, 98.0)).level());
    }

    @Test
    void onlyTheLastFiveSamplesCount() {
        assertEquals(Spo2AlertLevel.NONE, model.assess(List.of(80.0, 97.0, 98.0, 97.0, 96.0, 98.0)).level());
    }

    @Test
    void fewerThanFiveSamplesIsNone() {
        assertEquals(Spo2AlertLevel.NONE, model.assess(List.of(80.0, 80.0)).level());
    }
}
