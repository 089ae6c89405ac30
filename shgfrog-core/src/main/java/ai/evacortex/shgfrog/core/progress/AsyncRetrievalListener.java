/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.progress;

import ai.evacortex.shgfrog.core.IterationSnapshot;
import ai.evacortex.shgfrog.core.RetrievalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fire-and-forget adapter: hands every notification to one worker thread and
 * returns at once. When the bounded queue is full the oldest pending snapshot
 * is dropped, so a slow consumer only sees fewer frames.
 */
public class AsyncRetrievalListener implements RetrievalListener, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(AsyncRetrievalListener.class);

    private final RetrievalListener delegate;
    private final ThreadPoolExecutor worker;
    private final AtomicLong dropped = new AtomicLong();
    private final Duration closeTimeout;

    public AsyncRetrievalListener(RetrievalListener delegate, int capacity) {
        this(delegate, capacity, Duration.ofSeconds(5));
    }

    public AsyncRetrievalListener(RetrievalListener delegate, int capacity, Duration closeTimeout) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        this.delegate = GuardedListener.wrap(Objects.requireNonNull(delegate, "delegate must not be null"));
        this.closeTimeout = Objects.requireNonNull(closeTimeout, "closeTimeout must not be null");
        this.worker = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(capacity),
                r -> {
                    Thread t = new Thread(r, "shgfrog-listener");
                    t.setDaemon(true);
                    return t;
                },
                (task, executor) -> {
                    if (executor.isShutdown()) return;
                    executor.getQueue().poll();
                    dropped.incrementAndGet();
                    executor.execute(task);
                });
    }

    @Override
    public void onIteration(IterationSnapshot snapshot) {
        submit(() -> delegate.onIteration(snapshot));
    }

    @Override
    public void onComplete(RetrievalResult result) {
        submit(() -> delegate.onComplete(result));
    }

    /**
     * Snapshots discarded because the queue was full.
     */
    public long droppedCount() {
        return dropped.get();
    }

    private void submit(Runnable task) {
        try {
            worker.execute(task);
        } catch (RejectedExecutionException e) {
            LOG.debug("Listener already closed, notification dropped");
        }
    }

    /**
     * Delivers what is still queued, then stops the worker.
     */
    @Override
    public void close() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(closeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Listener worker did not drain within {}", closeTimeout);
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
