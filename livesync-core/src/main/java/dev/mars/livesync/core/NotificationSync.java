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

import dev.mars.livesync.api.error.LiveSyncError;
import dev.mars.livesync.api.identity.IdentityEvents;
import dev.mars.livesync.api.identity.IdentityListener;
import dev.mars.livesync.api.identity.IdentityRegistration;
import dev.mars.livesync.api.lifecycle.ReactiveCloseable;
import dev.mars.livesync.api.model.NotificationRow;
import dev.mars.livesync.api.mutation.MutationResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Live unread-notification count for the signed-in user.
 *
 * <p>Follows {@link IdentityEvents}: signing in opens a fresh session for the
 * new user, signing out closes it and resets the count to 0. With no
 * signed-in user nothing is subscribed and the count reads 0.
 *
 * <p>Reads ({@link #unreadCount()}, {@link #isSubscribed()}) are safe from any
 * thread. Everything else is dispatched onto the sync's writer context.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public class NotificationSync implements ReactiveCloseable {
    private static final Logger logger = LoggerFactory.getLogger(NotificationSync.class);

    private final IdentityEvents identityEvents;
    private final SubscriptionManager<Long> manager;
    private final UnreadCounter counter;
    private final UnreadCountApplier applier;
    private final MutationGateway mutationGateway;
    private final SingleWriterQueue queue;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean enabled;

    // Writer-confined
    private SyncSession session;
    private IdentityRegistration registration;
    private boolean opened;

    public NotificationSync(IdentityEvents identityEvents, SubscriptionManager<Long> manager, UnreadCounter counter,
                            UnreadCountApplier applier, MutationGateway mutationGateway, SingleWriterQueue queue,
                            boolean enabled) {
        this.identityEvents = Objects.requireNonNull(identityEvents, "identityEvents cannot be null");
        this.manager = Objects.requireNonNull(manager, "manager cannot be null");
        this.counter = Objects.requireNonNull(counter, "counter cannot be null");
        this.applier = Objects.requireNonNull(applier, "applier cannot be null");
        this.mutationGateway = Objects.requireNonNull(mutationGateway, "mutationGateway cannot be null");
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
        this.enabled = enabled;
    }

    /**
     * Registers for identity changes and starts syncing for the current user,
     * if any. Completes once the first baseline is applied.
     */
    public Future<Void> open() {
        Promise<Void> promise = Promise.promise();
        queue.execute(() -> {
            if (closed.get()) {
                promise.fail(new IllegalStateException("NotificationSync is closed"));
                return;
            }
            opened = true;
            if (registration == null) {
                registration = identityEvents.register(new IdentityHandler());
            }
            complete(syncWithIdentity(), promise);
        });
        return promise.future();
    }

    public long unreadCount() {
        return counter.value();
    }

    public boolean isSubscribed() {
        return manager.isSubscribed();
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * The user the count belongs to, or null when signed out.
     */
    public String userId() {
        return counter.ownerUserId();
    }

    /**
     * Re-reads the unread count from the backend.
     */
    public Future<Void> refetchCount() {
        return manager.refetch();
    }

    /**
     * Marks all of the current user's notifications as read.
     *
     * @return the write outcome; fails with {@link IllegalStateException} when no user is signed in
     */
    public Future<MutationResult> markAllAsRead() {
        return withSession(MutationGateway.MARK_ALL_AS_READ, current ->
            mutationGateway.markAllAsRead(current.userId(), asOf -> {
                if (!manager.isCurrent(current)) {
                    return false;
                }
                manager.raiseWatermark(asOf);
                return true;
            }));
    }

    /**
     * Marks one notification as read.
     *
     * @return the write outcome; fails with {@link IllegalStateException} when no user is signed in
     */
    public Future<MutationResult> markAsRead(long notificationId) {
        return withSession(MutationGateway.MARK_AS_READ, current ->
            mutationGateway.markAsRead(notificationId, asOf -> manager.isCurrent(current)));
    }

    /**
     * Registers a callback for newly inserted unread notifications.
     *
     * @return a runnable that removes the callback
     */
    public Runnable onNewNotification(Consumer<NotificationRow> listener) {
        return applier.addNewItemListener(listener);
    }

    /**
     * @return a runnable that removes the observer
     */
    public Runnable subscribeUnreadCount(Consumer<Long> observer) {
        return counter.subscribe(observer);
    }

    /**
     * Enables or disables syncing. Disabling closes the session; enabling an
     * opened sync resumes it for the current user.
     */
    public Future<Void> setEnabled(boolean value) {
        Promise<Void> promise = Promise.promise();
        queue.execute(() -> {
            if (enabled == value || closed.get()) {
                promise.complete();
                return;
            }
            enabled = value;
            logger.info("Notification sync {}", value ? "enabled" : "disabled");
            if (!value) {
                complete(closeSession(), promise);
            } else if (opened) {
                complete(syncWithIdentity(), promise);
            } else {
                promise.complete();
            }
        });
        return promise.future();
    }

    /**
     * Completes once every queued event and write has been handled.
     */
    public Future<Void> whenIdle() {
        return queue.whenIdle();
    }

    @Override
    public String name() {
        return "notifications";
    }

    @Override
    public Future<Void> closeReactive() {
        if (!closed.compareAndSet(false, true)) {
            return Future.succeededFuture();
        }
        Promise<Void> promise = Promise.promise();
        queue.execute(() -> {
            if (registration != null) {
                registration.unregister();
                registration = null;
            }
            logger.info("Closing notification sync");
            complete(closeSession(), promise);
        });
        return promise.future();
    }

    private Future<Void> syncWithIdentity() {
        if (!enabled) {
            logger.info("Notification sync is disabled, not subscribing");
            return Future.succeededFuture();
        }
        Promise<Void> promise = Promise.promise();
        Future<String> current;
        try {
            current = identityEvents.currentUserId();
        } catch (Exception e) {
            current = Future.failedFuture(e);
        }
        current.onComplete(ar -> queue.execute(() -> {
            if (ar.failed()) {
                logger.warn("Could not resolve the signed-in user: {}", ar.cause().getMessage());
                promise.fail(ar.cause());
            } else if (closed.get() || !enabled) {
                promise.complete();
            } else if (ar.result() == null) {
                logger.info("No signed-in user, unread count not subscribed");
                complete(closeSession(), promise);
            } else {
                complete(openSession(ar.result()), promise);
            }
        }));
        return promise.future();
    }

    private Future<Void> openSession(String userId) {
        if (session != null && session.isOpen() && userId.equals(session.userId())) {
            return session.ready();
        }
        session = manager.open(userId);
        return session.ready();
    }

    private Future<Void> closeSession() {
        SyncSession previous = session;
        session = null;
        if (previous != null) {
            return previous.closeReactive();
        }
        counter.resetFor(null);
        return Future.succeededFuture();
    }

    private Future<MutationResult> withSession(String operation,
                                               Function<SyncSession, Future<MutationResult>> write) {
        Promise<MutationResult> promise = Promise.promise();
        queue.execute(() -> {
            SyncSession current = session;
            if (current == null || !current.isOpen()) {
                LiveSyncError error = LiveSyncError.noActiveSession(operation);
                logger.warn("{}: {}", error.code(), error.message());
                promise.fail(new IllegalStateException(error.code() + ": " + error.message()));
                return;
            }
            write.apply(current).onComplete(ar -> {
                if (ar.succeeded()) {
                    promise.complete(ar.result());
                } else {
                    promise.fail(ar.cause());
                }
            });
        });
        return promise.future();
    }

    private static void complete(Future<Void> source, Promise<Void> target) {
        source.onComplete(ar -> {
            if (ar.succeeded()) {
                target.tryComplete();
            } else {
                target.tryFail(ar.cause());
            }
        });
    }

    private final class IdentityHandler implements IdentityListener {

        @Override
        public void onSignedIn(String userId) {
            queue.execute(() -> {
                if (closed.get() || !enabled || userId == null) {
                    return;
                }
                logger.info("User {} signed in, starting unread count sync", userId);
                openSession(userId).onFailure(err ->
                    logger.warn("Initial unread count for user {} not loaded: {}", userId, err.getMessage()));
            });
        }

        @Override
        public void onSignedOut() {
            queue.execute(() -> {
                logger.info("User signed out, stopping unread count sync");
                closeSession();
            });
        }
    }
}
