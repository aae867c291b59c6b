/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Radiance.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.radiance.spectral.dispatch;

import com.hellblazer.radiance.spectral.SpectralEngineException.IndexEvaluationException;
import com.hellblazer.radiance.spectral.index.IndexResult;
import com.hellblazer.radiance.spectral.index.SpectralIndex;
import com.hellblazer.radiance.spectral.index.SpectralPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a {@link SpectralKernel} over a list of spectral indices and collects one {@link IndexResult} per index.
 * <p>
 * With a parallelism of 1 the indices are evaluated in order on the calling thread. Otherwise they are evaluated on a
 * fixed worker pool owned by the dispatcher, and each index must complete within the index timeout measured from the
 * moment a worker starts it; time spent queued behind other indices does not count. A timed out index is cancelled and
 * reported as failed. Each index is attempted at most {@code 1 + maxRetries} times, all within one timeout.
 * Results are keyed by index, never by position.
 *
 * @author hal.hildebrand
 */
public class KernelDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KernelDispatcher.class);

    private final int             parallelism;
    private final int             maxRetries;
    private final Duration        indexTimeout;
    private final ExecutorService executor;

    public KernelDispatcher(int parallelism, int maxRetries, Duration indexTimeout) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be positive, got " + parallelism);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Retries must not be negative, got " + maxRetries);
        }
        if (indexTimeout == null || indexTimeout.isNegative() || indexTimeout.isZero()) {
            throw new IllegalArgumentException("Index timeout must be positive, got " + indexTimeout);
        }
        this.parallelism = parallelism;
        this.maxRetries = maxRetries;
        this.indexTimeout = indexTimeout;
        if (parallelism == 1) {
            this.executor = null;
        } else {
            var counter = new AtomicInteger();
            this.executor = Executors.newFixedThreadPool(parallelism, r -> {
                var thread = new Thread(r, "spectral-kernel-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
        }
    }

    public static KernelDispatcher sequential() {
        return new KernelDispatcher(1, 0, Duration.ofMinutes(10));
    }

    public int parallelism() {
        return parallelism;
    }

    public Map<SpectralIndex, IndexResult> dispatch(SpectralPlan plan, SpectralKernel kernel) {
        return dispatch(plan.indices(), kernel);
    }

    /**
     * @return one result per index, in the order of {@code indices}
     * @throws IndexEvaluationException if the calling thread is interrupted while waiting
     */
    public Map<SpectralIndex, IndexResult> dispatch(List<? extends SpectralIndex> indices, SpectralKernel kernel) {
        var results = new LinkedHashMap<SpectralIndex, IndexResult>();
        if (executor == null) {
            for (var index : indices) {
                results.put(index, evaluate(index, kernel));
            }
        } else {
            var tasks = new ArrayList<TimedEvaluation>(indices.size());
            for (var index : indices) {
                var task = new TimedEvaluation();
                task.future = executor.submit(() -> {
                    task.start();
                    return evaluate(index, kernel);
                });
                tasks.add(task);
            }
            for (int i = 0; i < indices.size(); i++) {
                var index = indices.get(i);
                try {
                    results.put(index, await(index, tasks.get(i)));
                } catch (InterruptedException e) {
                    tasks.forEach(t -> t.future.cancel(true));
                    Thread.currentThread().interrupt();
                    throw new IndexEvaluationException(index, "Interrupted while waiting for spectral index " + index,
                                                       e);
                }
            }
        }
        long failed = results.values().stream().filter(r -> r instanceof IndexResult.Failed).count();
        log.debug("Dispatched {} spectral indices, {} failed", indices.size(), failed);
        return results;
    }

    /**
     * Wait for a pooled evaluation until its deadline, which is fixed once a worker has started it.
     */
    private IndexResult await(SpectralIndex index, TimedEvaluation task) throws InterruptedException {
        long timeout = indexTimeout.toNanos();
        while (true) {
            boolean running = task.isStarted();
            long remaining = running ? task.startNanos + timeout - System.nanoTime() : timeout;
            try {
                return task.future.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                if (running) {
                    task.future.cancel(true);
                    log.warn("Spectral index {} timed out after {}", index, indexTimeout);
                    return IndexResult.failed(e);
                }
                // still queued, or started while we waited
            } catch (ExecutionException e) {
                return IndexResult.failed(e.getCause());
            }
        }
    }

    private IndexResult evaluate(SpectralIndex index, SpectralKernel kernel) {
        Exception last = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                return IndexResult.failed(new InterruptedException("Evaluation of " + index + " interrupted"));
            }
            double[] values;
            try {
                values = kernel.evaluate(index);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return IndexResult.failed(e);
            } catch (Exception e) {
                last = e;
                log.debug("Attempt {} of {} failed for spectral index {}: {}", attempt + 1, maxRetries + 1, index,
                          e.toString());
                continue;
            }
            // malformed output is not retried
            try {
                return IndexResult.value(values);
            } catch (IllegalArgumentException | NullPointerException e) {
                log.warn("Kernel returned malformed values for spectral index {}: {}", index, e.getMessage());
                return IndexResult.failed(e);
            }
        }
        log.warn("Spectral index {} failed after {} attempts", index, maxRetries + 1, last);
        return IndexResult.failed(last);
    }

    private static final class TimedEvaluation {
        private volatile long    startNanos;
        private volatile boolean started;
        private Future<IndexResult> future;

        void start() {
            startNanos = System.nanoTime();
            started = true;
        }

        boolean isStarted() {
            return started;
        }
    }

    @Override
    public void close() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
