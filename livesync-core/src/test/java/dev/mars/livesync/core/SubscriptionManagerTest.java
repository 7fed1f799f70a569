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

import dev.mars.livesync.api.change.ChangeEvent;
import dev.mars.livesync.api.change.ChangeStreamClient;
import dev.mars.livesync.api.change.ChangeSubscription;
import dev.mars.livesync.api.change.ChannelStatus;
import dev.mars.livesync.api.change.SubscriptionHandle;
import dev.mars.livesync.api.error.LiveSyncErrorCodes;
import dev.mars.livesync.api.error.LiveSyncException;
import dev.mars.livesync.api.model.NotificationRow;
import dev.mars.livesync.api.query.QuerySnapshot;
import dev.mars.livesync.core.config.ReconnectPolicy;
import dev.mars.livesync.core.metrics.LiveSyncMetrics;
import dev.mars.livesync.test.InMemoryBackend;
import dev.mars.livesync.test.RecordingCacheInvalidator;
import dev.mars.livesync.test.categories.TestCategories;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import static dev.mars.livesync.core.SyncFixture.await;
import static dev.mars.livesync.core.SyncFixture.awaitFailure;
import static dev.mars.livesync.core.SyncFixture.waitUntil;
import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class SubscriptionManagerTest {

    private static final String USER = "user-1";

    private Vertx vertx;
    private Context context;
    private InMemoryBackend backend;
    private SimpleMeterRegistry registry;
    private LiveSyncMetrics metrics;
    private SingleWriterQueue queue;
    private UnreadCounter counter;
    private UnreadCountBinding binding;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        context = vertx.getOrCreateContext();
        backend = new InMemoryBackend();
        registry = new SimpleMeterRegistry();
        metrics = new LiveSyncMetrics("test");
        metrics.bindTo(registry);
        queue = new SingleWriterQueue(context, "notifications", 64, metrics);
        counter = new UnreadCounter(context, "notifications");
        RowMapper rowMapper = new RowMapper();
        UnreadCountApplier applier = new UnreadCountApplier(counter, rowMapper, new RecordingCacheInvalidator(),
            new EventDeduplicator(128));
        binding = new UnreadCountBinding(counter, applier, new BaselineFetcher(backend, rowMapper));
    }

    @AfterEach
    void tearDown() {
        await(vertx.close());
    }

    private SubscriptionManager<Long> manager(ChangeStreamClient client, ReconnectPolicy policy, int holdCapacity) {
        return new SubscriptionManager<>(vertx, client, binding, queue, policy, holdCapacity, metrics);
    }

    private SubscriptionManager<Long> manager(ReconnectPolicy policy) {
        return manager(backend, policy, 1024);
    }

    private SubscriptionManager<Long> manager() {
        return manager(ReconnectPolicy.fixed(Duration.ofMillis(20)));
    }

    private void unread() {
        backend.insert(NotificationRow.TABLE, SyncFixture.notification(USER, false));
    }

    private double count(String name) {
        Counter found = registry.find(name).counter();
        return found != null ? found.count() : 0.0;
    }

    @Test
    @DisplayName("Start applies the baseline and goes live")
    void start_appliesBaseline() {
        unread();
        unread();
        SubscriptionManager<Long> manager = manager();

        await(manager.start(USER));
        await(queue.whenIdle());

        assertEquals(SubscriptionManager.Phase.LIVE, manager.phase());
        assertTrue(manager.isSubscribed());
        assertEquals(2, counter.value());
        assertEquals(USER, counter.ownerUserId());
        assertEquals(1, metrics.getActiveSubscriptions());
    }

    @Test
    @DisplayName("A channel error reconnects and re-fetches the baseline")
    void channelError_reconnects() {
        unread();
        SubscriptionManager<Long> manager = manager(ReconnectPolicy.fixed(Duration.ofMillis(200)));
        await(manager.start(USER));

        backend.emitStatus(ChannelStatus.CHANNEL_ERROR);
        waitUntil(manager::hasPendingReconnect, "reconnect scheduled");
        // written while no subscription is open
        unread();
        waitUntil(() -> backend.subscribeCount() == 2 && manager.phase() == SubscriptionManager.Phase.LIVE,
            "reconnected");
        await(queue.whenIdle());

        assertEquals(2, counter.value());
        assertTrue(manager.isSubscribed());
        assertEquals(1, backend.activeSubscriptions());
        assertEquals(0, manager.reconnectAttempts());
        assertEquals(1.0, count("livesync.channel.errors"));
        assertEquals(1.0, count("livesync.reconnects"));
    }

    @Test
    @DisplayName("Stopping while a reconnect is pending cancels it")
    void stop_cancelsPendingReconnect() throws InterruptedException {
        SubscriptionManager<Long> manager = manager(ReconnectPolicy.fixed(Duration.ofMillis(300)));
        await(manager.start(USER));

        backend.emitStatus(ChannelStatus.CHANNEL_ERROR);
        waitUntil(manager::hasPendingReconnect, "reconnect scheduled");
        assertEquals(SubscriptionManager.Phase.RECONNECT_PENDING, manager.phase());

        await(manager.stop());
        assertFalse(manager.hasPendingReconnect());
        Thread.sleep(500);

        assertEquals(1, backend.subscribeCount());
        assertEquals(0, backend.activeSubscriptions());
        assertEquals(SubscriptionManager.Phase.CLOSED, manager.phase());
    }

    @Test
    @DisplayName("Stop is idempotent and safe without a session")
    void stop_isIdempotent() {
        SubscriptionManager<Long> manager = manager();
        await(manager.stop());

        await(manager.start(USER));
        await(manager.stop());
        await(manager.stop());

        assertEquals(1, backend.unsubscribeCount());
        assertFalse(manager.isSubscribed());
        assertEquals(0, counter.value());
        assertNull(counter.ownerUserId());
    }

    @Test
    @DisplayName("Reconnecting gives up after the maximum attempts and refetch recovers")
    void reconnect_exhaustedThenRefetchRecovers() {
        unread();
        SubscriptionManager<Long> manager = manager(ReconnectPolicy.builder()
            .initialDelay(Duration.ofMillis(20))
            .maxAttempts(1)
            .build());
        backend.failNextQueries(2);

        Throwable failure = awaitFailure(manager.start(USER));
        assertInstanceOf(LiveSyncException.class, failure);
        assertEquals(LiveSyncErrorCodes.BASELINE_FAILED, ((LiveSyncException) failure).getCode());

        waitUntil(() -> manager.phase() == SubscriptionManager.Phase.FAILED, "reconnects exhausted");
        assertEquals(2, backend.subscribeCount());
        assertEquals(0, backend.activeSubscriptions());
        assertFalse(manager.hasPendingReconnect());
        assertEquals(2.0, count("livesync.baseline.failures"));

        await(manager.refetch());
        await(queue.whenIdle());

        assertEquals(SubscriptionManager.Phase.LIVE, manager.phase());
        assertEquals(1, counter.value());
        assertEquals(1, backend.activeSubscriptions());
    }

    @Test
    @DisplayName("A subscription closed by the backend is not reopened")
    void backendClose_isTerminal() throws InterruptedException {
        SubscriptionManager<Long> manager = manager();
        await(manager.start(USER));
        await(queue.whenIdle());

        backend.emitStatus(ChannelStatus.CLOSED);
        waitUntil(() -> manager.phase() == SubscriptionManager.Phase.CLOSED, "closed");
        Thread.sleep(100);

        assertFalse(manager.isSubscribed());
        assertFalse(manager.hasPendingReconnect());
        assertEquals(1, backend.subscribeCount());
    }

    @Test
    @DisplayName("Starting again leaves exactly one open subscription")
    void restart_keepsSingleHandle() {
        SubscriptionManager<Long> manager = manager();

        await(manager.start(USER));
        await(manager.start(USER));
        await(manager.start("user-2"));
        await(queue.whenIdle());

        assertEquals(3, backend.subscribeCount());
        assertEquals(1, backend.activeSubscriptions());
        SubscriptionHandle open = backend.openHandles().get(0);
        assertEquals("user-2", open.ownerUserId());
        assertEquals("user-2", counter.ownerUserId());
        assertEquals(1, metrics.getActiveSubscriptions());
    }

    @Test
    @DisplayName("A superseded session reports closed and its close does not affect the new one")
    void supersededSession_closeIsHarmless() {
        SubscriptionManager<Long> manager = manager();
        SyncSession first = manager.open(USER);
        await(first.ready());
        SyncSession second = manager.open(USER);
        await(second.ready());

        assertFalse(first.isOpen());
        await(first.closeReactive());
        await(queue.whenIdle());

        assertTrue(second.isOpen());
        assertTrue(manager.isSubscribed());
        assertEquals(1, backend.activeSubscriptions());
    }

    @Test
    @DisplayName("Events held while the baseline is in flight are replayed once it is applied")
    void heldEvents_replayed() {
        unread();
        SubscriptionManager<Long> manager = manager();
        backend.deferQueries(true);

        Future<Void> started = manager.start(USER);
        waitUntil(() -> backend.pendingQueries() == 1, "baseline query issued");
        unread();
        assertEquals(SubscriptionManager.Phase.SYNCING, manager.phase());

        backend.deferQueries(false);
        backend.releaseQueries();
        await(started);
        await(queue.whenIdle());

        assertEquals(2, counter.value());
    }

    @Test
    @DisplayName("An overflowing hold buffer triggers a fresh baseline")
    void holdOverflow_refetchesBaseline() {
        SubscriptionManager<Long> manager = manager(backend, ReconnectPolicy.fixed(Duration.ofMillis(20)), 2);
        backend.deferQueries(true);

        Future<Void> started = manager.start(USER);
        waitUntil(() -> backend.pendingQueries() == 1, "baseline query issued");
        unread();
        unread();
        unread();

        backend.deferQueries(false);
        backend.releaseQueries();
        await(started);
        await(queue.whenIdle());

        assertEquals(3, counter.value());
        assertEquals(SubscriptionManager.Phase.LIVE, manager.phase());
    }

    @Test
    @DisplayName("Refetch corrects a value that missed events")
    void refetch_correctsDrift() {
        SubscriptionManager<Long> manager = manager();
        await(manager.start(USER));

        backend.dropEvents(true);
        unread();
        unread();
        backend.dropEvents(false);
        await(queue.whenIdle());
        assertEquals(0, counter.value());

        await(manager.refetch());
        assertEquals(2, counter.value());

        // the refetched baseline covers everything committed before it
        backend.publish(backend.publishedEvents().get(0));
        await(queue.whenIdle());
        assertEquals(2, counter.value());
    }

    @Test
    @DisplayName("A failed refetch keeps the live subscription and the last value")
    void refetchFailure_staysLive() {
        unread();
        SubscriptionManager<Long> manager = manager();
        await(manager.start(USER));

        backend.failNextQueries(1);
        Throwable failure = awaitFailure(manager.refetch());

        assertInstanceOf(LiveSyncException.class, failure);
        assertEquals(SubscriptionManager.Phase.LIVE, manager.phase());
        assertEquals(1, counter.value());
        assertEquals(1, backend.activeSubscriptions());

        unread();
        await(queue.whenIdle());
        assertEquals(2, counter.value());
    }

    @Test
    @DisplayName("Refetch without a session does nothing")
    void refetch_withoutSession_isNoop() {
        SubscriptionManager<Long> manager = manager();

        await(manager.refetch());

        assertEquals(0, backend.subscribeCount());
        assertEquals(SubscriptionManager.Phase.IDLE, manager.phase());
    }

    @Test
    @DisplayName("A subscribe call that throws is retried")
    void subscribeFailure_isRetried() {
        AtomicBoolean failOnce = new AtomicBoolean(true);
        ChangeStreamClient flaky = new ChangeStreamClient() {
            @Override
            public SubscriptionHandle subscribe(ChangeSubscription subscription, Handler<ChangeEvent> eventHandler,
                                                Handler<ChannelStatus> statusHandler) {
                if (failOnce.getAndSet(false)) {
                    throw new IllegalStateException("connection refused");
                }
                return backend.subscribe(subscription, eventHandler, statusHandler);
            }

            @Override
            public Future<Void> unsubscribe(SubscriptionHandle handle) {
                return backend.unsubscribe(handle);
            }
        };
        unread();
        SubscriptionManager<Long> manager = manager(flaky, ReconnectPolicy.fixed(Duration.ofMillis(20)), 1024);

        Throwable failure = awaitFailure(manager.start(USER));
        assertEquals(LiveSyncErrorCodes.CHANNEL_ERROR, ((LiveSyncException) failure).getCode());

        waitUntil(() -> manager.phase() == SubscriptionManager.Phase.LIVE, "reconnected");
        await(queue.whenIdle());
        assertEquals(1, counter.value());
        assertEquals(1, backend.activeSubscriptions());
    }

    @Test
    @DisplayName("A channel error during the first baseline fails the start and reconnects")
    void channelErrorDuringFirstBaseline_failsStart() {
        unread();
        unread();
        SubscriptionManager<Long> manager = manager(ReconnectPolicy.fixed(Duration.ofMillis(200)));
        backend.deferQueries(true);

        Future<Void> started = manager.start(USER);
        waitUntil(() -> backend.pendingQueries() == 1, "baseline query issued");
        backend.emitStatus(ChannelStatus.CHANNEL_ERROR);
        waitUntil(manager::hasPendingReconnect, "reconnect scheduled");

        backend.deferQueries(false);
        backend.releaseQueries();

        Throwable failure = awaitFailure(started);
        assertEquals(LiveSyncErrorCodes.CHANNEL_ERROR, ((LiveSyncException) failure).getCode());

        waitUntil(() -> manager.phase() == SubscriptionManager.Phase.LIVE, "reconnected");
        await(queue.whenIdle());
        assertEquals(2, counter.value());
        assertEquals(1, backend.activeSubscriptions());
    }

    @Test
    @DisplayName("A baseline that cannot be applied fails the start without blocking the queue")
    void unappliableBaseline_failsStartAndReconnects() {
        AtomicBoolean failOnce = new AtomicBoolean(true);
        SyncBinding<Long> flaky = new SyncBinding<>() {
            @Override
            public String feed() {
                return binding.feed();
            }

            @Override
            public ChangeSubscription subscription(String userId) {
                return binding.subscription(userId);
            }

            @Override
            public Future<QuerySnapshot<Long>> fetchBaseline(String userId) {
                return binding.fetchBaseline(userId);
            }

            @Override
            public void applyBaseline(QuerySnapshot<Long> snapshot) {
                if (failOnce.getAndSet(false)) {
                    throw new IllegalArgumentException("count out of range");
                }
                binding.applyBaseline(snapshot);
            }

            @Override
            public ApplyOutcome applyEvent(ChangeEvent event) {
                return binding.applyEvent(event);
            }

            @Override
            public void begin(String userId) {
                binding.begin(userId);
            }

            @Override
            public void end() {
                binding.end();
            }
        };
        unread();
        SubscriptionManager<Long> manager = new SubscriptionManager<>(vertx, backend, flaky, queue,
            ReconnectPolicy.fixed(Duration.ofMillis(20)), 1024, metrics);

        Throwable failure = awaitFailure(manager.start(USER));
        assertEquals(LiveSyncErrorCodes.INTERNAL_ERROR, ((LiveSyncException) failure).getCode());

        waitUntil(() -> manager.phase() == SubscriptionManager.Phase.LIVE, "reconnected");
        unread();
        await(queue.whenIdle());
        assertEquals(2, counter.value());
        assertEquals(1.0, count("livesync.baseline.failures"));
    }

    @Test
    @DisplayName("Being live and being subscribed are tracked separately")
    void unconfirmedSubscription_isNotSubscribed() {
        backend.confirmSubscriptions(false);
        SubscriptionManager<Long> manager = manager();

        await(manager.start(USER));
        await(queue.whenIdle());

        assertEquals(SubscriptionManager.Phase.LIVE, manager.phase());
        assertFalse(manager.isSubscribed());
        assertEquals(ChannelStatus.CONNECTING, backend.openHandles().get(0).status());
    }

    @Test
    @DisplayName("The hold buffer must hold at least one event")
    void holdCapacity_mustBePositive() {
        assertThrows(IllegalArgumentException.class,
            () -> manager(backend, ReconnectPolicy.defaultPolicy(), 0));
    }
}
