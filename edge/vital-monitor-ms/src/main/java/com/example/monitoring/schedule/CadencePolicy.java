package com.example.monitoring.schedule;

import com.example.monitoring.model.RiskLevel;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Pure mapping from battery level and risk to the four periodic intervals.
 *
 * <ul>
 *   <li>NORMAL band (battery at or above the low threshold): 30 s / 5 min / 15 s / 60 s</li>
 *   <li>LOW band: 60 s / 10 min / 45 s / 5 min</li>
 *   <li>CRITICAL band (below the critical threshold): 120 s / 20 min / 90 s / 15 min</li>
 * </ul>
 *
 * Critical risk shortens vital-signs to 10 s and pattern detection to 5 s, but only in the
 * NORMAL band. Below the low threshold the battery band wins and its vital-signs interval is the
 * ceiling.
 */
@ApplicationScoped
public class CadencePolicy {

    static final Cadence NORMAL = new Cadence(
        Duration.ofSeconds(30),
        Duration.ofMinutes(5),
        Duration.ofSeconds(15),
        Duration.ofSeconds(60)
    );
    static final Cadence LOW = new Cadence(
        Duration.ofSeconds(60),
        Duration.ofMinutes(10),
        Duration.ofSeconds(45),
        Duration.ofMinutes(5)
    );
    static final Cadence CRITICAL = new Cadence(
        Duration.ofSeconds(120),
        Duration.ofMinutes(20),
        Duration.ofSeconds(90),
        Duration.ofMinutes(15)
    );
    static final Duration CRITICAL_RISK_VITALS = Duration.ofSeconds(10);
    static final Duration CRITICAL_RISK_PATTERN = Duration.ofSeconds(5);

    private final double lowBatteryPct;
    private final double criticalBatteryPct;

    @Inject
    public CadencePolicy(
        @ConfigProperty(name = "monitoring.schedule.low-battery-pct", defaultValue = "30") double lowBatteryPct,
        @ConfigProperty(name = "monitoring.schedule.critical-battery-pct", defaultValue = "20") double criticalBatteryPct
    ) {
        if (criticalBatteryPct > lowBatteryPct) {
            throw new IllegalArgumentException("critical battery threshold must not exceed the low threshold");
        }
        this.lowBatteryPct = lowBatteryPct;
        this.criticalBatteryPct = criticalBatteryPct;
    }

    public BatteryBand bandFor(double batteryPct) {
        if (batteryPct < criticalBatteryPct) return BatteryBand.CRITICAL;
        if (batteryPct < lowBatteryPct) return BatteryBand.LOW;
        return BatteryBand.NORMAL;
    }

    public Cadence cadenceFor(double batteryPct, RiskLevel risk) {
        return switch (bandFor(batteryPct)) {
            case CRITICAL -> CRITICAL;
            case LOW -> LOW;
            case NORMAL -> risk == RiskLevel.CRITICAL
                ? new Cadence(CRITICAL_RISK_VITALS, NORMAL.biomarkers(), CRITICAL_RISK_PATTERN, NORMAL.cloudSync())
                : NORMAL;
        };
    }
}
