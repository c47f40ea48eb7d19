package com.example.monitoring.inference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.monitoring.model.FeatureSet;
import java.util.List;
import org.junit.jupiter.api.Test;

class ArrhythmiaModelTest {

    private final ArrhythmiaModel model = new ArrhythmiaModel();

    @Test
    void flagsIrregularRhythmWithScaledConfidence() {
        ArrhythmiaAssessment a = score(Features.rhythm(80, 0.225, 12));

        assertTrue(a.detected());
        assertEquals(0.75, a.confidence(), 1e-9);
    }

    @Test
    void confidenceSaturatesAtTwiceTheThreshold() {
        assertEquals(1.0, score(Features.rhythm(80, 0.40, 12)).confidence(), 1e-9);
    }

    @Test
    void regularRhythmIsNotFlagged() {
        ArrhythmiaAssessment a = score(Features.rhythm(70, 0.03, 12));

        assertFalse(a.detected());
        assertTrue(a.confidence() < 0.5);
    }

    @Test
    void needsFourIntervals() {
        assertEquals(ArrhythmiaAssessment.none(), score(Features.rhythm(80, 0.5, 4)));
        assertTrue(score(Features.rhythm(80, 0.5, 5)).detected());
    }

    private ArrhythmiaAssessment score(FeatureSet f) {
        return model.score(new ModelInput(f, null, List.of(), List.of()));
    }
}
