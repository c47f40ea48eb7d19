package com.example.monitoring.inference;

/**
 * A replaceable scoring strategy. Implementations are pure functions of their input and must
 * be safe to call from several threads at once.
 */
public interface ScoringModel<T> {

    ModelId id();

    /**
     * @throws InsufficientSignalException when the input cannot support an estimate; the
     *                                     orchestrator then reports the model as unavailable
     */
    T score(ModelInput input);
}
