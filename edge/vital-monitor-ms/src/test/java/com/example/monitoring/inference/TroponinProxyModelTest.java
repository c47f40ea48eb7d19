package com.example.monitoring.inference;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.monitoring.model.FeatureSet;
import java.util.List;
import org.junit.jupiter.api.Test;

class TroponinProxyModelTest {

    private final TroponinProxyModel model = new TroponinProxyModel();

    @Test
    void quietRhythmIsLowRisk() {
        TroponinEstimate t = score(Features.of(70, 0.02, 10, 0.0, 200));

        assertTrue(t.miRisk() < 0.1, "risk " + t.miRisk());
    }

    @Test
    void stElevationWithTachycardiaIsHighRisk() {
        TroponinEstimate t = score(Features.of(130, 0.05, 20, 0.25, 200));

        assertTrue(t.miRisk() > 0.7, "risk " + t.miRisk());
        assertTrue(t.level() > 70);
    }

    @Test
    void needsBeats() {
        assertThrows(InsufficientSignalException.class, () -> score(FeatureSet.EMPTY));
    }

    private TroponinEstimate score(FeatureSet f) {
        return model.score(new ModelInput(f, null, List.of(), List.of()));
    }
}
