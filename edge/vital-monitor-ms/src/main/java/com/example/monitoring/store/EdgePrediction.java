package com.example.monitoring.store;

import com.example.monitoring.inference.ModelId;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Model outputs as produced on the device, kept for later comparison with cloud models. A late
 * value is stored on its own with {@code late} set.
 */
public record EdgePrediction(
    Instant recordedAt,
    Map<ModelId, Object> values,
    Set<ModelId> unavailable,
    long latencyMs,
    boolean late
) {}
