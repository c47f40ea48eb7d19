package com.example.monitoring.pipeline;

import com.example.monitoring.model.HealthMetricsSnapshot;
import com.example.monitoring.model.RiskLevel;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Holds the published {@link HealthMetricsSnapshot}. Updates are compare-and-set on an immutable
 * state, so readers never see a half-applied pass. A commit is refused when its epoch is no
 * longer the open one or when a later sequence of the same stream has already been committed.
 * Updaters may run more than once under contention and must not have side effects.
 */
@ApplicationScoped
public class MetricsBoard {

    private record State(
        HealthMetricsSnapshot snapshot,
        long epoch,
        boolean open,
        Map<MetricStream, Long> committed
    ) {}

    private final AtomicReference<State> state = new AtomicReference<>(
        new State(HealthMetricsSnapshot.INITIAL, 0, false, Map.of())
    );
    private final Map<MetricStream, AtomicLong> issued = new EnumMap<>(MetricStream.class);

    public MetricsBoard() {
        for (MetricStream s : MetricStream.values()) {
            issued.put(s, new AtomicLong());
        }
    }

    public long nextSequence(MetricStream stream) {
        return issued.get(stream).incrementAndGet();
    }

    public void open(long epoch) {
        state.updateAndGet(s -> new State(s.snapshot(), epoch, true, s.committed()));
    }

    public void close() {
        state.updateAndGet(s -> new State(s.snapshot(), s.epoch(), false, s.committed()));
    }

    public boolean commit(MetricStream stream, long seq, long epoch, UnaryOperator<HealthMetricsSnapshot> updater) {
        while (true) {
            State cur = state.get();
            if (!accepts(cur, epoch) || seq <= cur.committed().getOrDefault(stream, 0L)) {
                return false;
            }
            Map<MetricStream, Long> committed = new EnumMap<>(MetricStream.class);
            committed.putAll(cur.committed());
            committed.put(stream, seq);
            State next = new State(updater.apply(cur.snapshot()), epoch, true, Map.copyOf(committed));
            if (state.compareAndSet(cur, next)) {
                return true;
            }
        }
    }

    /**
     * Merges a model value that arrived after its pass returned. Dropped once a later pass of the
     * same stream has committed, since that pass carries fresher data.
     */
    public boolean commitLate(MetricStream stream, long seq, long epoch, UnaryOperator<HealthMetricsSnapshot> updater) {
        while (true) {
            State cur = state.get();
            if (!accepts(cur, epoch) || seq < cur.committed().getOrDefault(stream, 0L)) {
                return false;
            }
            State next = new State(updater.apply(cur.snapshot()), epoch, true, cur.committed());
            if (state.compareAndSet(cur, next)) {
                return true;
            }
        }
    }

    public void updateRiskLevel(RiskLevel level) {
        state.updateAndGet(s -> s.snapshot().riskLevel == level
            ? s
            : new State(s.snapshot().toBuilder().riskLevel(level).build(), s.epoch(), s.open(), s.committed()));
    }

    private static boolean accepts(State s, long epoch) {
        return s.open() && s.epoch() == epoch;
    }

    public HealthMetricsSnapshot current() {
        return state.get().snapshot();
    }
}
