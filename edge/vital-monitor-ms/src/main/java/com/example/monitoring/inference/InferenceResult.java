package com.example.monitoring.inference;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Joined outcome of one inference pass. A model that missed the budget or failed is listed in
 * {@link #unavailable()} and has no value here; consumers keep their last-known value for it.
 */
public final class InferenceResult {

    private final Map<ModelId, Object> values;
    private final Set<ModelId> unavailable;
    private final Instant completedAt;
    private final Duration latency;

    private InferenceResult(Map<ModelId, Object> values, Set<ModelId> unavailable, Instant completedAt, Duration latency) {
        this.values = Collections.unmodifiableMap(values);
        this.unavailable = Collections.unmodifiableSet(unavailable);
        this.completedAt = completedAt;
        this.latency = latency;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A single late model value, delivered after its pass already returned. */
    public static InferenceResult late(ModelId id, Object value, Instant completedAt, Duration latency) {
        return builder().put(id, value).completedAt(completedAt).latency(latency).build();
    }

    public Optional<ArrhythmiaAssessment> arrhythmia() {
        return get(ModelId.ARRHYTHMIA, ArrhythmiaAssessment.class);
    }

    public Optional<StElevationAssessment> stElevation() {
        return get(ModelId.ST_ELEVATION, StElevationAssessment.class);
    }

    public Optional<BloodPressureEstimate> bloodPressure() {
        return get(ModelId.BLOOD_PRESSURE, BloodPressureEstimate.class);
    }

    public Optional<HypoglycemiaAssessment> hypoglycemia() {
        return get(ModelId.HYPOGLYCEMIA, HypoglycemiaAssessment.class);
    }

    public Optional<Spo2Assessment> spo2() {
        return get(ModelId.SPO2, Spo2Assessment.class);
    }

    public Optional<FallAssessment> fall() {
        return get(ModelId.FALL, FallAssessment.class);
    }

    public Optional<TroponinEstimate> troponin() {
        return get(ModelId.TROPONIN, TroponinEstimate.class);
    }

    private <T> Optional<T> get(ModelId id, Class<T> type) {
        return Optional.ofNullable(values.get(id)).map(type::cast);
    }

    /** Values of the models that completed, keyed by model. */
    public Map<ModelId, Object> values() {
        return values;
    }

    public Set<ModelId> available() {
        return values.keySet();
    }

    public Set<ModelId> unavailable() {
        return unavailable;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public Duration latency() {
        return latency;
    }

    @Override
    public String toString() {
        return "InferenceResult{available=%s, unavailable=%s, latency=%dms}"
            .formatted(values.keySet(), unavailable, latency.toMillis());
    }

    public static final class Builder {

        private final Map<ModelId, Object> values = new EnumMap<>(ModelId.class);
        private final Set<ModelId> unavailable = EnumSet.noneOf(ModelId.class);
        private Instant completedAt = Instant.EPOCH;
        private Duration latency = Duration.ZERO;

        public Builder put(ModelId id, Object value) {
            values.put(id, value);
            unavailable.remove(id);
            return this;
        }

        public Builder unavailable(ModelId id) {
            values.remove(id);
            unavailable.add(id);
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder latency(Duration latency) {
            this.latency = latency;
            return this;
        }

        public InferenceResult build() {
            return new InferenceResult(new EnumMap<>(values), unavailable.isEmpty()
                ? EnumSet.noneOf(ModelId.class)
                : EnumSet.copyOf(unavailable), completedAt, latency);
        }
    }
}
