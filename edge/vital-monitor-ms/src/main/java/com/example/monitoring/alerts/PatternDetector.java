package com.example.monitoring.alerts;

import com.example.monitoring.model.AlertSeverity;
import com.example.monitoring.model.AlertType;
import com.example.monitoring.model.CriticalAlert;
import com.example.monitoring.model.HealthMetricsSnapshot;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Looks for sustained rate abnormalities across consecutive snapshots rather than within one pass.
 * A snapshot is counted once; observing it again before a newer one is committed changes nothing.
 */
@ApplicationScoped
public class PatternDetector {

    static final int SUSTAINED_SAMPLES = 5;
    static final int TACHYCARDIA_BPM = 120;
    static final int BRADYCARDIA_BPM = 40;

    private final Deque<Integer> heartRates = new ArrayDeque<>();
    private Instant lastObserved;

    public synchronized Optional<CriticalAlert> observe(HealthMetricsSnapshot snapshot, Instant now) {
        if (snapshot.heartRate <= 0 || snapshot.updatedAt.equals(lastObserved)) {
            return Optional.empty();
        }
        lastObserved = snapshot.updatedAt;
        heartRates.addLast(snapshot.heartRate);
        if (heartRates.size() > SUSTAINED_SAMPLES) {
            heartRates.removeFirst();
        }
        if (heartRates.size() < SUSTAINED_SAMPLES) {
            return Optional.empty();
        }
        if (heartRates.stream().allMatch(hr -> hr > TACHYCARDIA_BPM)) {
            return Optional.of(CriticalAlert.create(
                now,
                AlertType.CARDIAC,
                AlertSeverity.WARNING,
                "Sustained tachycardia, heart rate above %d bpm".formatted(TACHYCARDIA_BPM),
                false,
                false
            ));
        }
        if (heartRates.stream().allMatch(hr -> hr < BRADYCARDIA_BPM)) {
            return Optional.of(CriticalAlert.create(
                now,
                AlertType.CARDIAC,
                AlertSeverity.WARNING,
                "Sustained bradycardia, heart rate below %d bpm".formatted(BRADYCARDIA_BPM),
                false,
                false
            ));
        }
        return Optional.empty();
    }

    public synchronized void reset() {
        heartRates.clear();
        lastObserved = null;
    }
}
