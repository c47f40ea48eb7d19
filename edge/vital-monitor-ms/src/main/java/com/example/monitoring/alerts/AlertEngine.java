package com.example.monitoring.alerts;

import com.example.monitoring.inference.HypertensionStage;
import com.example.monitoring.inference.InferenceResult;
import com.example.monitoring.model.AlertSeverity;
import com.example.monitoring.model.AlertType;
import com.example.monitoring.model.CriticalAlert;
import com.example.monitoring.model.RiskLevel;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Turns inference results into graded alerts and owns the list of unacknowledged ones.
 *
 * <p>Writers serialize on a private lock; readers get the current immutable list without locking.
 */
@ApplicationScoped
public class AlertEngine {

    static final double EMERGENCY_CONFIDENCE = 0.9;
    static final double MI_RISK_THRESHOLD = 0.7;

    private static final Logger LOG = Logger.getLogger(AlertEngine.class);

    private final Clock clock;
    private final Duration cooldown;
    private final Object writeLock = new Object();
    private volatile List<CriticalAlert> active = List.of();

    @Inject
    public AlertEngine(
        Clock clock,
        @ConfigProperty(name = "monitoring.alerts.cooldown", defaultValue = "PT2M") Duration cooldown
    ) {
        this.clock = clock;
        this.cooldown = cooldown;
    }

    /**
     * @return the alerts actually raised, after deduplication; at most one per detection category
     */
    public List<CriticalAlert> evaluate(InferenceResult result) {
        List<CriticalAlert> raised = new ArrayList<>();
        for (CriticalAlert candidate : candidates(result, clock.instant())) {
            raise(candidate).ifPresent(raised::add);
        }
        return raised;
    }

    static List<CriticalAlert> candidates(InferenceResult r, Instant now) {
        List<CriticalAlert> out = new ArrayList<>();

        r.arrhythmia().filter(a -> a.detected()).ifPresent(a -> {
            boolean emergency = a.confidence() > EMERGENCY_CONFIDENCE;
            out.add(CriticalAlert.create(
                now,
                AlertType.CARDIAC,
                emergency ? AlertSeverity.EMERGENCY : AlertSeverity.URGENT,
                "Irregular heart rhythm detected (confidence %.0f%%)".formatted(a.confidence() * 100),
                true,
                emergency
            ));
        });

        r.stElevation().filter(s -> s.detected()).ifPresent(s ->
            out.add(CriticalAlert.create(
                now,
                AlertType.CARDIAC,
                AlertSeverity.CRITICAL,
                "ST segment elevation of %.2f mV".formatted(s.deviationMv()),
                true,
                true
            ))
        );

        r.bloodPressure().ifPresent(bp -> {
            if (bp.stage() == HypertensionStage.CRISIS) {
                out.add(CriticalAlert.create(
                    now,
                    AlertType.CARDIAC,
                    AlertSeverity.CRITICAL,
                    "Hypertensive crisis: %d/%d mmHg".formatted(bp.systolic(), bp.diastolic()),
                    true,
                    true
                ));
            } else if (bp.stage() == HypertensionStage.STAGE_2) {
                out.add(CriticalAlert.create(
                    now,
                    AlertType.CARDIAC,
                    AlertSeverity.WARNING,
                    "Blood pressure in stage 2 range: %d/%d mmHg".formatted(bp.systolic(), bp.diastolic()),
                    false,
                    false
                ));
            }
        });

        r.hypoglycemia().ifPresent(h -> {
            switch (h.risk()) {
                case CRITICAL -> out.add(CriticalAlert.create(
                    now,
                    AlertType.GLUCOSE,
                    AlertSeverity.EMERGENCY,
                    "Severe hypoglycemia risk, glucose %.0f mg/dL".formatted(h.currentMgDl()),
                    true,
                    true
                ));
                case HIGH -> out.add(CriticalAlert.create(
                    now,
                    AlertType.GLUCOSE,
                    AlertSeverity.URGENT,
                    "High hypoglycemia risk, glucose %.0f mg/dL".formatted(h.currentMgDl()),
                    true,
                    false
                ));
                case MODERATE -> out.add(CriticalAlert.create(
                    now,
                    AlertType.GLUCOSE,
                    AlertSeverity.WARNING,
                    "Glucose falling (%.1f mg/dL over last readings)".formatted(h.trend()),
                    false,
                    false
                ));
                default -> {
                }
            }
        });

        r.spo2().ifPresent(s -> {
            switch (s.level()) {
                case CRITICAL -> out.add(CriticalAlert.create(
                    now,
                    AlertType.RESPIRATORY,
                    AlertSeverity.CRITICAL,
                    "Critical SpO2 drop to %.0f%%".formatted(s.min()),
                    true,
                    true
                ));
                case WARNING -> out.add(CriticalAlert.create(
                    now,
                    AlertType.RESPIRATORY,
                    AlertSeverity.WARNING,
                    "Low SpO2, average %.0f%%".formatted(s.mean()),
                    false,
                    false
                ));
                default -> {
                }
            }
        });

        r.fall().filter(f -> f.detected()).ifPresent(f ->
            out.add(CriticalAlert.create(
                now,
                AlertType.FALL,
                AlertSeverity.URGENT,
                "Possible fall, impact %.1f g".formatted(f.peakG()),
                true,
                true
            ))
        );

        r.troponin().filter(t -> t.miRisk() > MI_RISK_THRESHOLD).ifPresent(t ->
            out.add(CriticalAlert.create(
                now,
                AlertType.CARDIAC,
                AlertSeverity.EMERGENCY,
                "High myocardial injury risk (%.0f%%)".formatted(t.miRisk() * 100),
                true,
                true
            ))
        );

        return out;
    }

    /**
     * Adds the alert unless one of the same type and severity is still unacknowledged and was
     * created within the cooldown window.
     */
    public Optional<CriticalAlert> raise(CriticalAlert candidate) {
        synchronized (writeLock) {
            Instant windowStart = candidate.createdAt().minus(cooldown);
            for (CriticalAlert existing : active) {
                if (existing.type() == candidate.type()
                    && existing.severity() == candidate.severity()
                    && existing.createdAt().isAfter(windowStart)) {
                    LOG.debugf("Suppressing duplicate %s %s alert", candidate.type(), candidate.severity());
                    return Optional.empty();
                }
            }
            List<CriticalAlert> next = new ArrayList<>(active);
            next.add(candidate);
            active = List.copyOf(next);
        }
        LOG.infof(
            "Raised %s %s alert %s: %s",
            candidate.severity(),
            candidate.type(),
            candidate.id(),
            candidate.message()
        );
        return Optional.of(candidate);
    }

    public boolean acknowledge(UUID id) {
        synchronized (writeLock) {
            List<CriticalAlert> next = new ArrayList<>(active);
            boolean removed = next.removeIf(a -> a.id().equals(id));
            if (removed) {
                active = List.copyOf(next);
                LOG.infof("Alert %s acknowledged", id);
            }
            return removed;
        }
    }

    /** Drops alerts created before {@code cutoff}; returns how many were dropped. */
    public int expireBefore(Instant cutoff) {
        synchronized (writeLock) {
            List<CriticalAlert> next = new ArrayList<>(active);
            next.removeIf(a -> a.createdAt().isBefore(cutoff));
            int dropped = active.size() - next.size();
            if (dropped > 0) {
                active = List.copyOf(next);
            }
            return dropped;
        }
    }

    public List<CriticalAlert> activeAlerts() {
        return active;
    }

    public RiskLevel currentRiskLevel() {
        AlertSeverity worst = null;
        for (CriticalAlert a : active) {
            if (worst == null || a.severity().compareTo(worst) > 0) {
                worst = a.severity();
            }
        }
        if (worst == null) return RiskLevel.NORMAL;
        return switch (worst) {
            case CRITICAL, EMERGENCY -> RiskLevel.CRITICAL;
            case URGENT -> RiskLevel.HIGH;
            case WARNING -> RiskLevel.ELEVATED;
        };
    }
}
