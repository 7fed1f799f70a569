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

import dev.mars.livesync.core.metrics.LiveSyncMetrics;
import dev.mars.livesync.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;

import static dev.mars.livesync.core.SyncFixture.await;
import static dev.mars.livesync.core.SyncFixture.awaitFailure;
import static dev.mars.livesync.core.SyncFixture.onContext;
import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class SingleWriterQueueTest {

    private Vertx vertx;
    private Context context;
    private SimpleMeterRegistry registry;
    private LiveSyncMetrics metrics;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        context = vertx.getOrCreateContext();
        registry = new SimpleMeterRegistry();
        metrics = new LiveSyncMetrics("test");
        metrics.bindTo(registry);
    }

    @AfterEach
    void tearDown() {
        await(vertx.close());
    }

    @Test
    @DisplayName("A task starts only after the previous task's future completes")
    void asyncTasks_doNotInterleave() {
        SingleWriterQueue queue = new SingleWriterQueue(context, "test", 16, metrics);
        List<String> trace = new CopyOnWriteArrayList<>();

        Future<String> slow = queue.submit(() -> {
            trace.add("slow-start");
            Promise<String> promise = Promise.promise();
            vertx.setTimer(50, id -> {
                trace.add("slow-end");
                promise.complete("slow");
            });
            return promise.future();
        });
        Future<String> fast = queue.submit(() -> {
            trace.add("fast");
            return Future.succeededFuture("fast");
        });

        assertEquals("fast", await(fast));
        assertEquals("slow", await(slow));
        assertEquals(List.of("slow-start", "slow-end", "fast"), trace);
    }

    @Test
    void whenIdle_waitsForEarlierTasks() {
        SingleWriterQueue queue = new SingleWriterQueue(context, "test", 16, metrics);
        Promise<Void> gate = Promise.promise();
        queue.submit(gate::future);

        Future<Void> idle = queue.whenIdle();
        boolean completedEarly = onContext(context, idle::isComplete);
        assertFalse(completedEarly);

        context.runOnContext(v -> gate.complete());
        await(idle);
    }

    @Test
    @DisplayName("A full queue rejects new tasks and counts the rejection")
    void fullQueue_rejects() {
        SingleWriterQueue queue = new SingleWriterQueue(context, "test", 1, metrics);
        Promise<Void> gate = Promise.promise();
        queue.submit(gate::future);

        Throwable failure = awaitFailure(queue.submit(Future::succeededFuture));

        assertInstanceOf(RejectedExecutionException.class, failure);
        assertEquals(1.0, registry.get("livesync.queue.rejected").counter().count());
        context.runOnContext(v -> gate.complete());
        await(queue.whenIdle());
    }

    @Test
    @DisplayName("A failing task fails its own future and the queue keeps draining")
    void failingTask_doesNotStopQueue() {
        SingleWriterQueue queue = new SingleWriterQueue(context, "test", 16, metrics);

        Future<String> thrown = queue.submit(() -> {
            throw new IllegalStateException("boom");
        });
        Future<String> nullFuture = queue.submit(() -> null);
        Future<String> next = queue.submit(() -> Future.succeededFuture("ok"));

        assertEquals("boom", awaitFailure(thrown).getMessage());
        assertInstanceOf(IllegalStateException.class, awaitFailure(nullFuture));
        assertEquals("ok", await(next));
    }

    @Test
    void manySynchronousTasks_drainWithoutOverflow() {
        SingleWriterQueue queue = new SingleWriterQueue(context, "test", 100_000, metrics);
        int[] counter = new int[1];

        onContext(context, () -> {
            for (int i = 0; i < 50_000; i++) {
                queue.submit(() -> {
                    counter[0]++;
                    return Future.succeededFuture();
                });
            }
            return null;
        });
        await(queue.whenIdle());

        int executed = onContext(context, () -> counter[0]);
        assertEquals(50_000, executed);
    }

    @Test
    void execute_runsInlineOnWriterContext() {
        SingleWriterQueue queue = new SingleWriterQueue(context, "test", 16, metrics);

        boolean ranInline = onContext(context, () -> {
            boolean[] ran = new boolean[1];
            queue.execute(() -> ran[0] = true);
            return ran[0] && queue.isWriterContext();
        });

        assertTrue(ranInline);
        assertFalse(queue.isWriterContext());
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new SingleWriterQueue(context, "test", 0, metrics));
    }
}
