package com.codebox.engine.service;

import com.codebox.engine.config.CodeboxProperties;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool that runs sandboxed executions.
 *
 * {@code workers} threads, each running one sandboxed process at a time,
 * in front of a queue of {@code queueCapacity} waiting submissions. When both
 * are full the submission is refused immediately (AbortPolicy) instead of
 * piling up: the caller gets capacity_exceeded and decides whether to retry.
 */
@Component
public class ExecutionWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(ExecutionWorkerPool.class);

    private final ThreadPoolExecutor executor;

    public ExecutionWorkerPool(CodeboxProperties properties, MeterRegistry meterRegistry) {
        CodeboxProperties.Pool pool = properties.getPool();
        AtomicInteger n = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
                pool.getWorkers(), pool.getWorkers(),
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(pool.getQueueCapacity()),
                r -> new Thread(r, "execution-worker-" + n.incrementAndGet()),
                new ThreadPoolExecutor.AbortPolicy());

        Gauge.builder("codebox.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .register(meterRegistry);
        Gauge.builder("codebox.pool.queued", executor, e -> e.getQueue().size())
                .register(meterRegistry);

        log.info("Execution worker pool started: {} workers, queue capacity {}",
                pool.getWorkers(), pool.getQueueCapacity());
    }

    /**
     * Queue a task. The submitting thread's MDC is carried over to the worker.
     *
     * @throws CapacityExceededException when all workers are busy and the queue is full
     */
    public <T> Future<T> submit(Callable<T> task) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        try {
            return executor.submit(() -> {
                if (mdc != null) MDC.setContextMap(mdc);
                try {
                    return task.call();
                } finally {
                    MDC.clear();
                }
            });
        } catch (RejectedExecutionException e) {
            throw new CapacityExceededException("all " + executor.getMaximumPoolSize()
                    + " workers are busy and " + executor.getQueue().size() + " submissions are queued", e);
        }
    }

    public int activeCount() { return executor.getActiveCount(); }
    public int queuedCount() { return executor.getQueue().size(); }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                // Interrupting a worker cancels its execution and kills the process tree.
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
