package com.example.monitoring.inference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.monitoring.model.FeatureSet;
import java.util.List;
import org.junit.jupiter.api.Test;

class HypoglycemiaModelTest {

    private final HypoglycemiaModel model = new HypoglycemiaModel();

    @Test
    void fastDropIsCriticalEvenAboveSeventy() {
        HypoglycemiaAssessment h = model.assess(List.of(140.0, 100.0, 95.0, 88.0));

        assertEquals(HypoglycemiaRisk.CRITICAL, h.risk());
        assertEquals(88.0, h.currentMgDl());
        assertEquals(-12.0, h.trend(), 1e-9);
        assertEquals(-6.0, h.rate(), 1e-9);
    }

    @Test
    void lowReadingIsCritical() {
        assertEquals(HypoglycemiaRisk.CRITICAL, model.assess(List.of(72.0, 70.0, 69.0)).risk());
        assertEquals(HypoglycemiaRisk.CRITICAL, model.assess(List.of(65.0)).risk());
    }

    @Test
    void moderateDropIsHigh() {
        assertEquals(HypoglycemiaRisk.HIGH, model.assess(List.of(120.0, 117.0, 114.0)).risk());
        assertEquals(HypoglycemiaRisk.HIGH, model.assess(List.of(89.0, 89.0, 89.0)).risk());
    }

    @Test
    void slowDropIsModerate() {
        assertEquals(HypoglycemiaRisk.MODERATE, model.assess(List.of(120.0, 119.0, 117.0)).risk());
    }

    @Test
    void stableOrRisingIsLow() {
        assertEquals(HypoglycemiaRisk.LOW, model.assess(List.of(110.0, 111.0, 110.0)).risk());
        assertEquals(HypoglycemiaRisk.LOW, model.assess(List.of(100.0, 105.0, 112.0)).risk());
    }

    @Test
    void emptyHistoryHasNoReading() {
        HypoglycemiaAssessment h = model.assess(List.of());

        assertEquals(HypoglycemiaRisk.LOW, h.risk());
        assertTrue(Double.isNaN(h.currentMgDl()));
    }

    @Test
    void usesHistoryFromInput() {
        ModelInput input = new ModelInput(
            FeatureSet.EMPTY,
            null,
            List.of(100.0, 95.0, 88.0),
            List.of()
        );

        assertEquals(HypoglycemiaRisk.CRITICAL, model.score(input).risk());
    }
}
