package com.example.monitoring.inference;

import com.example.monitoring.config.ModelPool;
import com.example.monitoring.model.FeatureSet;
import com.example.monitoring.model.SensorPacket;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Fans the selected scoring models out onto the model pool and joins them against the latency
 * budget. A model still running at the deadline is reported unavailable for the pass; its value,
 * when it eventually arrives, goes to the caller's {@link LateResultListener}. Models are never
 * cancelled.
 */
@ApplicationScoped
public class InferenceOrchestrator {

    public static final Set<ModelId> PACKET_MODELS = EnumSet.of(
        ModelId.ARRHYTHMIA,
        ModelId.ST_ELEVATION,
        ModelId.BLOOD_PRESSURE,
        ModelId.HYPOGLYCEMIA,
        ModelId.SPO2,
        ModelId.FALL
    );

    private static final Logger LOG = Logger.getLogger(InferenceOrchestrator.class);

    private final Map<ModelId, ScoringModel<?>> models = new EnumMap<>(ModelId.class);
    private final ModelPool pool;
    private final Clock clock;
    private final LatencyTracker latencyTracker;
    private final Duration budget;

    @FunctionalInterface
    public interface LateResultListener {
        void onLateResult(ModelId model, Object value, Duration latency);
    }

    @Inject
    public InferenceOrchestrator(
        ModelPool pool,
        Clock clock,
        LatencyTracker latencyTracker,
        @ConfigProperty(name = "monitoring.inference.budget", defaultValue = "PT0.1S") Duration budget
    ) {
        this(defaultModels(), pool, clock, latencyTracker, budget);
    }

    public InferenceOrchestrator(
        List<ScoringModel<?>> models,
        ModelPool pool,
        Clock clock,
        LatencyTracker latencyTracker,
        Duration budget
    ) {
        for (ScoringModel<?> model : models) {
            this.models.put(model.id(), model);
        }
        this.pool = pool;
        this.clock = clock;
        this.latencyTracker = latencyTracker;
        this.budget = budget;
    }

    public static List<ScoringModel<?>> defaultModels() {
        return List.of(
            new ArrhythmiaModel(),
            new StElevationModel(),
            new BloodPressureModel(),
            new HypoglycemiaModel(),
            new Spo2DesaturationModel(),
            new FallModel(),
            new TroponinProxyModel()
        );
    }

    /** Packet pass with the budget starting now and late results discarded. */
    public InferenceResult infer(FeatureSet features, SensorPacket packet) {
        return infer(ModelInput.of(features, packet), clock.instant(), PACKET_MODELS, null);
    }

    public InferenceResult infer(
        ModelInput input,
        Instant arrivedAt,
        Set<ModelId> selection,
        LateResultListener lateListener
    ) {
        Map<ModelId, CompletableFuture<Object>> running = new EnumMap<>(ModelId.class);
        for (ModelId id : selection) {
            ScoringModel<?> model = models.get(id);
            if (model == null) {
                continue;
            }
            running.put(id, pool.<Object>supply(() -> model.score(input)));
        }

        Duration alreadySpent = Duration.between(arrivedAt, clock.instant());
        long deadline = System.nanoTime() + Math.max(0, budget.minus(alreadySpent).toNanos());

        InferenceResult.Builder result = InferenceResult.builder();
        for (Map.Entry<ModelId, CompletableFuture<Object>> entry : running.entrySet()) {
            ModelId id = entry.getKey();
            CompletableFuture<Object> future = entry.getValue();
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                result.put(id, future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                result.unavailable(id);
                LOG.debugf("Model %s missed the %d ms budget, keeping its last value", id, budget.toMillis());
                if (lateListener != null) {
                    future.thenAccept(value ->
                        lateListener.onLateResult(id, value, Duration.between(arrivedAt, clock.instant()))
                    );
                }
            } catch (ExecutionException e) {
                result.unavailable(id);
                Throwable cause = e.getCause();
                if (cause instanceof InsufficientSignalException) {
                    LOG.debugf("Model %s unavailable: %s", id, cause.getMessage());
                } else {
                    LOG.warnf(cause, "Model %s failed, keeping its last value", id);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result.unavailable(id);
            }
        }

        Instant completedAt = clock.instant();
        Duration latency = Duration.between(arrivedAt, completedAt);
        latencyTracker.record(latency, budget);
        return result.completedAt(completedAt).latency(latency).build();
    }

    public Duration budget() {
        return budget;
    }
}
