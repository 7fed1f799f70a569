/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.livesync.core;

import dev.mars.livesync.api.error.LiveSyncErrorCodes;
import dev.mars.livesync.core.metrics.LiveSyncMetrics;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Bounded FIFO of asynchronous tasks drained one at a time on a single Vert.x context.
 *
 * <p>A task is a supplier of a {@link Future}. The next task is started only when
 * the previous task's future has completed, so an asynchronous write and the
 * events that arrive while it is in flight cannot interleave. Tasks may be
 * submitted from any thread.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public class SingleWriterQueue {
    private static final Logger logger = LoggerFactory.getLogger(SingleWriterQueue.class);

    private final Context context;
    private final String name;
    private final int capacity;
    private final LiveSyncMetrics metrics;

    // Confined to the writer context
    private final Deque<Entry<?>> pending = new ArrayDeque<>();
    private boolean running;

    public SingleWriterQueue(Context context, String name, int capacity, LiveSyncMetrics metrics) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be positive, got: " + capacity);
        }
        this.context = context;
        this.name = name;
        this.capacity = capacity;
        this.metrics = metrics;
    }

    /**
     * Enqueues a task. The returned future completes with the task's result, or
     * fails with {@link RejectedExecutionException} if the queue is full.
     */
    public <T> Future<T> submit(Supplier<Future<T>> task) {
        Promise<T> promise = Promise.promise();
        execute(() -> {
            if (pending.size() >= capacity) {
                logger.warn("{} write queue {} is full ({} tasks), rejecting task",
                    LiveSyncErrorCodes.QUEUE_FULL, name, capacity);
                metrics.recordQueueRejection(name);
                promise.fail(new RejectedExecutionException("Write queue " + name + " is full"));
                return;
            }
            pending.addLast(new Entry<>(task, promise));
            drain();
        });
        return promise.future();
    }

    /**
     * @return a future completing once every task submitted before this call has completed
     */
    public Future<Void> whenIdle() {
        return submit(Future::succeededFuture);
    }

    /**
     * Runs the action on the writer context, inline if already there.
     */
    public void execute(Runnable action) {
        if (isWriterContext()) {
            action.run();
        } else {
            context.runOnContext(v -> action.run());
        }
    }

    public boolean isWriterContext() {
        return Vertx.currentContext() == context;
    }

    public Context context() {
        return context;
    }

    public String name() {
        return name;
    }

    /**
     * Number of tasks waiting, including the running one. Only meaningful on the writer context.
     */
    int size() {
        return pending.size();
    }

    private void drain() {
        while (!running && !pending.isEmpty()) {
            running = true;
            Future<Void> done = pending.peekFirst().run();
            if (done.isComplete()) {
                // synchronous task, keep draining without growing the stack
                pending.pollFirst();
                running = false;
            } else {
                done.onComplete(ar -> execute(() -> {
                    pending.pollFirst();
                    running = false;
                    drain();
                }));
            }
        }
    }

    private static final class Entry<T> {
        private final Supplier<Future<T>> task;
        private final Promise<T> promise;

        private Entry(Supplier<Future<T>> task, Promise<T> promise) {
            this.task = task;
            this.promise = promise;
        }

        private Future<Void> run() {
            Future<T> result;
            try {
                result = task.get();
                if (result == null) {
                    result = Future.failedFuture(new IllegalStateException("Task returned a null future"));
                }
            } catch (Throwable t) {
                result = Future.failedFuture(t);
            }
            Promise<Void> done = Promise.promise();
            result.onComplete(ar -> {
                if (ar.succeeded()) {
                    promise.complete(ar.result());
                } else {
                    promise.fail(ar.cause());
                }
                done.complete();
            });
            return done.future();
        }
    }
}
