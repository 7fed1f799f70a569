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
import dev.mars.livesync.api.error.LiveSyncError;
import dev.mars.livesync.api.error.LiveSyncErrorCodes;
import dev.mars.livesync.api.error.LiveSyncException;
import dev.mars.livesync.api.query.QuerySnapshot;
import dev.mars.livesync.core.config.ReconnectPolicy;
import dev.mars.livesync.core.metrics.LiveSyncMetrics;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the change-stream subscription behind one local aggregate.
 *
 * <p>Each (re)start is an <em>attempt</em>: the previous handle and reconnect
 * timer are torn down, a new subscription is opened, and events delivered on it
 * are held until the baseline has been fetched and applied. Held events that
 * the baseline already reflects are discarded; the rest are replayed in
 * delivery order and the attempt is armed, after which events go straight to
 * the write queue. Callbacks belonging to an attempt that is no longer current
 * are ignored, so a late timer or status can never resurrect a closed session.
 *
 * <p>A {@link ChannelStatus#CHANNEL_ERROR} or a failed baseline discards the
 * attempt and schedules a new one according to the {@link ReconnectPolicy}.
 * {@link ChannelStatus#CLOSED} from the backend is terminal.
 *
 * <p>All state lives on the writer context of the {@link SingleWriterQueue}.
 *
 * @param <V> the baseline value type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public class SubscriptionManager<V> {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionManager.class);

    public enum Phase {
        /** No session has been opened yet. */
        IDLE,
        /** Subscription open, baseline in flight, events held. */
        SYNCING,
        /** Baseline applied, events applied as they arrive. */
        LIVE,
        /** Waiting for the reconnect timer. */
        RECONNECT_PENDING,
        /** Reconnect attempts exhausted. */
        FAILED,
        /** Session closed, or subscription closed by the backend. */
        CLOSED
    }

    private final Vertx vertx;
    private final ChangeStreamClient changeStreamClient;
    private final SyncBinding<V> binding;
    private final SingleWriterQueue queue;
    private final ReconnectPolicy reconnectPolicy;
    private final int holdBufferCapacity;
    private final LiveSyncMetrics metrics;

    // Writer-confined
    private SyncSession session;
    private Attempt current;
    private long generation;

    private volatile long reconnectTimerId = -1;
    private volatile int reconnectAttempts;
    private volatile Phase phase = Phase.IDLE;
    private volatile boolean subscribed;

    public SubscriptionManager(Vertx vertx, ChangeStreamClient changeStreamClient, SyncBinding<V> binding,
                               SingleWriterQueue queue, ReconnectPolicy reconnectPolicy,
                               int holdBufferCapacity, LiveSyncMetrics metrics) {
        this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
        this.changeStreamClient = Objects.requireNonNull(changeStreamClient, "changeStreamClient cannot be null");
        this.binding = Objects.requireNonNull(binding, "binding cannot be null");
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
        this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        if (holdBufferCapacity < 1) {
            throw new IllegalArgumentException("Hold buffer capacity must be positive, got: " + holdBufferCapacity);
        }
        this.holdBufferCapacity = holdBufferCapacity;
    }

    /**
     * Opens a session for {@code userId}, closing any previous one. The
     * aggregate is reset, a subscription is opened and the baseline fetched.
     *
     * @param userId the session's user, null for global feeds
     * @return the session; {@link SyncSession#ready()} completes once the first baseline is applied
     */
    public SyncSession open(String userId) {
        SyncSession next = new SyncSession(this, userId);
        queue.execute(() -> {
            SyncSession previous = session;
            session = next;
            if (previous != null) {
                previous.superseded();
            }
            reconnectAttempts = 0;
            binding.begin(userId);
            logger.info("[{}] opening session for user: {}", feed(), userId);
            startAttempt(userId).onComplete(next::completeReady);
        });
        return next;
    }

    /**
     * Opens a session and waits for its first baseline.
     */
    public Future<Void> start(String userId) {
        return open(userId).ready();
    }

    /**
     * Closes the current session, if any. Idempotent.
     */
    public Future<Void> stop() {
        Promise<Void> promise = Promise.promise();
        queue.execute(() -> {
            if (session == null) {
                promise.complete();
                return;
            }
            session.closeReactive().onComplete(ar -> promise.complete());
        });
        return promise.future();
    }

    /**
     * Re-runs the baseline for the current session. A failed, closed or
     * reconnecting subscription is restarted instead.
     */
    public Future<Void> refetch() {
        Promise<Void> promise = Promise.promise();
        queue.execute(() -> {
            if (session == null) {
                promise.complete();
                return;
            }
            Attempt attempt = current;
            if (attempt == null) {
                logger.info("[{}] refetch requested while not subscribed, restarting", feed());
                reconnectAttempts = 0;
                complete(startAttempt(session.userId()), promise);
            } else if (!attempt.armed) {
                // the attempt's own baseline is queued ahead of this marker
                complete(queue.whenIdle(), promise);
            } else {
                complete(queue.submit(() -> refreshBaseline(attempt)), promise);
            }
        });
        return promise.future();
    }

    public boolean isSubscribed() {
        return subscribed;
    }

    public Phase phase() {
        return phase;
    }

    public boolean hasPendingReconnect() {
        return reconnectTimerId != -1;
    }

    public int reconnectAttempts() {
        return reconnectAttempts;
    }

    public String feed() {
        return binding.feed();
    }

    /**
     * Marks everything committed up to {@code asOf} as already reflected in the
     * aggregate, e.g. after an acknowledged bulk write. Writer context only.
     */
    void raiseWatermark(Instant asOf) {
        Attempt attempt = current;
        if (attempt != null && asOf != null && (attempt.watermark == null || asOf.isAfter(attempt.watermark))) {
            attempt.watermark = asOf;
        }
    }

    /**
     * @return true if {@code candidate} is the open session. Writer context only.
     */
    boolean isCurrent(SyncSession candidate) {
        return candidate != null && candidate == session;
    }

    Future<Void> close(SyncSession closing) {
        Promise<Void> promise = Promise.promise();
        queue.execute(() -> {
            if (session != closing) {
                promise.complete();
                return;
            }
            session = null;
            Future<Void> released = teardown();
            phase = Phase.CLOSED;
            binding.end();
            logger.info("[{}] closed session for user: {}", feed(), closing.userId());
            released.onComplete(ar -> promise.complete());
        });
        return promise.future();
    }

    private Future<Void> startAttempt(String userId) {
        teardown();
        Attempt attempt = new Attempt(++generation, userId);
        current = attempt;
        phase = Phase.SYNCING;

        ChangeSubscription subscription = binding.subscription(userId);
        try {
            // Callbacks are always deferred so the handle is assigned before they run
            attempt.handle = changeStreamClient.subscribe(subscription,
                event -> queue.context().runOnContext(v -> onEvent(attempt, event)),
                status -> queue.context().runOnContext(v -> onStatus(attempt, status)));
        } catch (Exception e) {
            logger.error("[{}] {} failed to open subscription {}: {}",
                feed(), LiveSyncErrorCodes.CHANNEL_ERROR, subscription.key(), e.getMessage());
            metrics.recordChannelError(feed());
            failAttempt(attempt);
            return Future.failedFuture(new LiveSyncException(
                LiveSyncError.of(LiveSyncErrorCodes.CHANNEL_ERROR, "Failed to open subscription " + subscription.key()), e));
        }
        logger.info("[{}] opened subscription {} filtered by {} (generation {})",
            feed(), attempt.handle.id(), subscription.filter() != null ? subscription.filter() : "none", attempt.generation);

        return queue.submit(() -> syncBaseline(attempt));
    }

    private Future<Void> syncBaseline(Attempt attempt) {
        if (attempt != current) {
            return superseded(attempt);
        }
        Promise<Void> done = Promise.promise();
        fetchBaseline(attempt).onComplete(ar -> queue.execute(() -> {
            if (attempt != current) {
                complete(superseded(attempt), done);
                return;
            }
            if (ar.failed()) {
                logger.error("[{}] {} baseline fetch failed for user {}: {}",
                    feed(), LiveSyncErrorCodes.BASELINE_FAILED, attempt.userId, ar.cause().getMessage());
                metrics.recordBaselineFailure(feed());
                failAttempt(attempt);
                done.fail(new LiveSyncException(LiveSyncError.baselineFailed(feed(), ar.cause()), ar.cause()));
                return;
            }
            if (attempt.holdOverflowed) {
                logger.warn("[{}] hold buffer overflowed while fetching baseline, fetching again", feed());
                attempt.holdOverflowed = false;
                attempt.held.clear();
                complete(syncBaseline(attempt), done);
                return;
            }
            try {
                arm(attempt, ar.result());
                done.complete();
            } catch (Exception e) {
                logger.error("[{}] {} could not apply baseline for user {}: {}",
                    feed(), LiveSyncErrorCodes.INTERNAL_ERROR, attempt.userId, e.getMessage(), e);
                metrics.recordBaselineFailure(feed());
                if (attempt == current) {
                    failAttempt(attempt);
                }
                done.tryFail(new LiveSyncException(
                    LiveSyncError.internalError("Could not apply baseline for " + feed() + ": " + e.getMessage()), e));
            }
        }));
        return done.future();
    }

    /**
     * Outcome of a baseline whose attempt is no longer current. An attempt
     * dropped by a channel failure before it was armed fails with
     * {@code CHANNEL_ERROR}; one replaced by a new session or a close completes.
     */
    private Future<Void> superseded(Attempt attempt) {
        if (attempt.failed && !attempt.armed) {
            logger.info("[{}] baseline of generation {} discarded, subscription failed before it was applied",
                feed(), attempt.generation);
            return Future.failedFuture(new LiveSyncException(LiveSyncError.of(LiveSyncErrorCodes.CHANNEL_ERROR,
                "Subscription for user " + attempt.userId + " failed before its baseline was applied")));
        }
        logger.debug("[{}] discarding baseline of superseded generation {}", feed(), attempt.generation);
        return Future.succeededFuture();
    }

    private Future<Void> refreshBaseline(Attempt attempt) {
        if (attempt != current) {
            return Future.succeededFuture();
        }
        Promise<Void> done = Promise.promise();
        fetchBaseline(attempt).onComplete(ar -> queue.execute(() -> {
            if (attempt != current) {
                done.complete();
                return;
            }
            if (ar.failed()) {
                // Keep the stale value and the live subscription
                logger.error("[{}] {} baseline refetch failed for user {}: {}",
                    feed(), LiveSyncErrorCodes.BASELINE_FAILED, attempt.userId, ar.cause().getMessage());
                metrics.recordBaselineFailure(feed());
                done.fail(new LiveSyncException(LiveSyncError.baselineFailed(feed(), ar.cause()), ar.cause()));
                return;
            }
            try {
                binding.applyBaseline(ar.result());
                raiseWatermark(ar.result().asOf());
                logger.debug("[{}] refetched baseline as of {}", feed(), ar.result().asOf());
                done.complete();
            } catch (Exception e) {
                logger.error("[{}] {} could not apply refetched baseline for user {}: {}",
                    feed(), LiveSyncErrorCodes.INTERNAL_ERROR, attempt.userId, e.getMessage(), e);
                metrics.recordBaselineFailure(feed());
                done.tryFail(new LiveSyncException(
                    LiveSyncError.internalError("Could not apply refetched baseline for " + feed() + ": " + e.getMessage()), e));
            }
        }));
        return done.future();
    }

    private Future<QuerySnapshot<V>> fetchBaseline(Attempt attempt) {
        try {
            return binding.fetchBaseline(attempt.userId);
        } catch (Exception e) {
            return Future.failedFuture(e);
        }
    }

    private void arm(Attempt attempt, QuerySnapshot<V> baseline) {
        binding.applyBaseline(baseline);
        attempt.watermark = baseline.asOf();
        int replayed = attempt.held.size();
        ChangeEvent event;
        while ((event = attempt.held.pollFirst()) != null) {
            applyEvent(attempt, event);
        }
        attempt.armed = true;
        phase = Phase.LIVE;
        reconnectAttempts = 0;
        logger.info("[{}] subscription armed for user {} with baseline as of {}, {} held events replayed",
            feed(), attempt.userId, baseline.asOf(), replayed);
    }

    private void onEvent(Attempt attempt, ChangeEvent event) {
        if (attempt != current) {
            logger.debug("[{}] dropping event for superseded generation {}", feed(), attempt.generation);
            return;
        }
        if (!attempt.armed) {
            hold(attempt, event);
            return;
        }
        queue.submit(() -> Future.succeededFuture(applyEvent(attempt, event)))
            .onFailure(err -> logger.warn("[{}] {} event {} on {} lost: {}", feed(),
                err instanceof RejectedExecutionException ? LiveSyncErrorCodes.QUEUE_FULL : LiveSyncErrorCodes.INTERNAL_ERROR,
                event.operation(), event.table(), err.getMessage()));
    }

    private void hold(Attempt attempt, ChangeEvent event) {
        if (attempt.held.size() >= holdBufferCapacity) {
            if (!attempt.holdOverflowed) {
                logger.warn("[{}] hold buffer full ({} events), baseline will be fetched again", feed(), holdBufferCapacity);
            }
            attempt.holdOverflowed = true;
            attempt.held.clear();
        }
        attempt.held.addLast(event);
    }

    private ApplyOutcome applyEvent(Attempt attempt, ChangeEvent event) {
        if (attempt != current) {
            return ApplyOutcome.IGNORED;
        }
        ApplyOutcome outcome;
        Instant committed = event.commitTimestamp();
        if (attempt.watermark != null && committed != null && !committed.isAfter(attempt.watermark)) {
            logger.debug("[{}] {} committed at {} is covered by state as of {}",
                feed(), event.operation(), committed, attempt.watermark);
            outcome = ApplyOutcome.COVERED;
        } else {
            outcome = binding.applyEvent(event);
        }
        metrics.recordEventOutcome(feed(), outcome);
        return outcome;
    }

    private void onStatus(Attempt attempt, ChannelStatus status) {
        if (attempt != current || attempt.handle == null) {
            logger.debug("[{}] ignoring {} for superseded generation {}", feed(), status, attempt.generation);
            return;
        }
        switch (status) {
            case CONNECTING:
                logger.debug("[{}] subscription {} connecting", feed(), attempt.handle.id());
                break;
            case SUBSCRIBED:
                logger.info("[{}] subscription {} established", feed(), attempt.handle.id());
                setSubscribed(true);
                break;
            case CHANNEL_ERROR:
                logger.error("[{}] {} channel error on subscription {}",
                    feed(), LiveSyncErrorCodes.CHANNEL_ERROR, attempt.handle.id());
                metrics.recordChannelError(feed());
                failAttempt(attempt);
                break;
            case CLOSED:
                logger.info("[{}] subscription {} closed by backend", feed(), attempt.handle.id());
                attempt.handle = null;
                current = null;
                setSubscribed(false);
                phase = Phase.CLOSED;
                break;
            default:
                logger.warn("[{}] unknown channel status: {}", feed(), status);
        }
    }

    /**
     * Discards the attempt and schedules a reconnect.
     */
    private void failAttempt(Attempt attempt) {
        attempt.failed = true;
        SubscriptionHandle handle = attempt.handle;
        attempt.handle = null;
        attempt.held.clear();
        if (current == attempt) {
            current = null;
        }
        setSubscribed(false);
        if (handle != null) {
            unsubscribe(handle);
        }
        scheduleReconnect(attempt.userId);
    }

    private void scheduleReconnect(String userId) {
        int attemptNumber = reconnectAttempts + 1;
        if (reconnectPolicy.isExhausted(attemptNumber)) {
            logger.error("[{}] {} giving up after {} reconnect attempts",
                feed(), LiveSyncErrorCodes.RECONNECT_EXHAUSTED, reconnectAttempts);
            metrics.recordReconnectExhausted(feed());
            phase = Phase.FAILED;
            return;
        }
        reconnectAttempts = attemptNumber;
        long delay = Math.max(1, reconnectPolicy.delayForAttempt(attemptNumber).toMillis());
        phase = Phase.RECONNECT_PENDING;
        long timerId = vertx.setTimer(delay, id -> queue.execute(() -> {
            if (reconnectTimerId != id || session == null) {
                logger.debug("[{}] ignoring cancelled reconnect timer {}", feed(), id);
                return;
            }
            reconnectTimerId = -1;
            metrics.recordReconnect(feed());
            logger.info("[{}] reconnecting for user {} (attempt {})", feed(), userId, attemptNumber);
            startAttempt(userId).onFailure(err ->
                logger.debug("[{}] reconnect attempt {} failed: {}", feed(), attemptNumber, err.getMessage()));
        }));
        reconnectTimerId = timerId;
        logger.info("[{}] reconnect attempt {} scheduled in {} ms", feed(), attemptNumber, delay);
    }

    private Future<Void> teardown() {
        cancelReconnectTimer();
        Attempt attempt = current;
        current = null;
        setSubscribed(false);
        if (attempt == null || attempt.handle == null) {
            return Future.succeededFuture();
        }
        SubscriptionHandle handle = attempt.handle;
        attempt.handle = null;
        attempt.held.clear();
        return unsubscribe(handle);
    }

    private void cancelReconnectTimer() {
        long timerId = reconnectTimerId;
        if (timerId != -1) {
            vertx.cancelTimer(timerId);
            reconnectTimerId = -1;
            logger.debug("[{}] cancelled reconnect timer {}", feed(), timerId);
        }
    }

    private Future<Void> unsubscribe(SubscriptionHandle handle) {
        Future<Void> result;
        try {
            result = changeStreamClient.unsubscribe(handle);
        } catch (Exception e) {
            result = Future.failedFuture(e);
        }
        return result
            .onSuccess(v -> logger.debug("[{}] unsubscribed {}", feed(), handle.id()))
            .recover(err -> {
                logger.warn("[{}] failed to unsubscribe {}: {}", feed(), handle.id(), err.getMessage());
                return Future.succeededFuture();
            });
    }

    private void setSubscribed(boolean value) {
        if (subscribed == value) {
            return;
        }
        subscribed = value;
        if (value) {
            metrics.subscriptionActivated();
        } else {
            metrics.subscriptionDeactivated();
        }
    }

    private static <T> void complete(Future<T> source, Promise<Void> target) {
        source.onComplete(ar -> {
            if (ar.succeeded()) {
                target.tryComplete();
            } else {
                target.tryFail(ar.cause());
            }
        });
    }

    /**
     * One subscribe-baseline-arm cycle.
     */
    private final class Attempt {
        private final long generation;
        private final String userId;
        private final Deque<ChangeEvent> held = new ArrayDeque<>();
        private SubscriptionHandle handle;
        private Instant watermark;
        private boolean armed;
        private boolean holdOverflowed;
        private boolean failed;

        private Attempt(long generation, String userId) {
            this.generation = generation;
            this.userId = userId;
        }
    }
}
