package com.example.monitoring.config;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Shared pool for packet processing, periodic passes, escalation and sync. Model fan-out has its
 * own {@link ModelPool}.
 */
@ApplicationScoped
public class WorkerPool implements Executor {

    private static final Logger LOG = Logger.getLogger(WorkerPool.class);

    private final ExecutorService executor;

    @Inject
    public WorkerPool(@ConfigProperty(name = "monitoring.workers", defaultValue = "4") int workers) {
        this(Executors.newFixedThreadPool(workers, namedThreads("monitoring-worker")));
        LOG.infof("Worker pool started with %d threads", workers);
    }

    public WorkerPool(ExecutorService executor) {
        this.executor = executor;
    }

    public static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void execute(Runnable command) {
        executor.execute(command);
    }

    public <T> CompletableFuture<T> supply(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, executor);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Worker pool did not drain within 5s, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
