package com.example.monitoring.schedule;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.monitoring.model.RiskLevel;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class CadencePolicyTest {

    private final CadencePolicy policy = new CadencePolicy(30, 20);

    @Test
    void bandsFollowThresholds() {
        assertEquals(BatteryBand.NORMAL, policy.bandFor(100));
        assertEquals(BatteryBand.NORMAL, policy.bandFor(30));
        assertEquals(BatteryBand.LOW, policy.bandFor(29.9));
        assertEquals(BatteryBand.LOW, policy.bandFor(20));
        assertEquals(BatteryBand.CRITICAL, policy.bandFor(19.9));
        assertEquals(BatteryBand.CRITICAL, policy.bandFor(0));
    }

    @Test
    void normalBandIntervals() {
        Cadence c = policy.cadenceFor(80, RiskLevel.NORMAL);

        assertEquals(Duration.ofSeconds(30), c.vitalSigns());
        assertEquals(Duration.ofMinutes(5), c.biomarkers());
        assertEquals(Duration.ofSeconds(15), c.patternDetection());
        assertEquals(Duration.ofSeconds(60), c.cloudSync());
    }

    @Test
    void lowAndCriticalBandsSlowDown() {
        assertEquals(Duration.ofSeconds(60), policy.cadenceFor(25, RiskLevel.NORMAL).vitalSigns());
        assertEquals(Duration.ofMinutes(5), policy.cadenceFor(25, RiskLevel.NORMAL).cloudSync());
        assertEquals(Duration.ofSeconds(120), policy.cadenceFor(10, RiskLevel.NORMAL).vitalSigns());
        assertEquals(Duration.ofMinutes(20), policy.cadenceFor(10, RiskLevel.NORMAL).biomarkers());
    }

    @Test
    void criticalRiskTightensOnlyWithHealthyBattery() {
        Cadence c = policy.cadenceFor(50, RiskLevel.CRITICAL);

        assertEquals(Duration.ofSeconds(10), c.vitalSigns());
        assertEquals(Duration.ofSeconds(5), c.patternDetection());
        assertEquals(Duration.ofMinutes(5), c.biomarkers());
        assertEquals(policy.cadenceFor(50, RiskLevel.NORMAL), policy.cadenceFor(50, RiskLevel.HIGH));
    }

    @Test
    void batteryWinsOverCriticalRisk() {
        assertEquals(Duration.ofSeconds(10), policy.cadenceFor(50, RiskLevel.CRITICAL).vitalSigns());
        assertEquals(Duration.ofSeconds(120), policy.cadenceFor(15, RiskLevel.CRITICAL).vitalSigns());
        assertEquals(Duration.ofSeconds(60), policy.cadenceFor(25, RiskLevel.CRITICAL).vitalSigns());
    }

    @Test
    void rejectsInvertedThresholds() {
        assertThrows(IllegalArgumentException.class, () -> new CadencePolicy(20, 30));
    }
}
