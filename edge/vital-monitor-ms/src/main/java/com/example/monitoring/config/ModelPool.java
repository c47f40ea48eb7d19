package com.example.monitoring.config;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Runs scoring models only. Packet tasks and periodic passes block on model futures from the
 * {@link WorkerPool}, so the models must never queue behind them on the same threads.
 */
@ApplicationScoped
public class ModelPool {

    private static final Logger LOG = Logger.getLogger(ModelPool.class);

    private final WorkerPool delegate;

    @Inject
    public ModelPool(
        @ConfigProperty(name = "monitoring.workers", defaultValue = "4") int workers,
        @ConfigProperty(name = "monitoring.inference.models-per-pass", defaultValue = "7") int modelsPerPass
    ) {
        this(Executors.newFixedThreadPool(workers * modelsPerPass, WorkerPool.namedThreads("monitoring-model")));
        LOG.infof("Model pool started with %d threads", workers * modelsPerPass);
    }

    public ModelPool(ExecutorService executor) {
        this.delegate = new WorkerPool(executor);
    }

    public <T> CompletableFuture<T> supply(Supplier<T> task) {
        return delegate.supply(task);
    }

    @PreDestroy
    public void shutdown() {
        delegate.shutdown();
    }
}
