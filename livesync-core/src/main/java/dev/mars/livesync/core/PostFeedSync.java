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

import dev.mars.livesync.api.lifecycle.ReactiveCloseable;
import dev.mars.livesync.api.model.PostRow;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Live list of the most recent visible posts. The feed is global and does not
 * follow identity changes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public class PostFeedSync implements ReactiveCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PostFeedSync.class);

    private final SubscriptionManager<List<PostRow>> manager;
    private final FeedCache<PostRow> cache;
    private final FeedEventApplier<PostRow> applier;
    private final SingleWriterQueue queue;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean enabled;

    // Writer-confined
    private SyncSession session;
    private boolean opened;

    public PostFeedSync(SubscriptionManager<List<PostRow>> manager, FeedCache<PostRow> cache,
                        FeedEventApplier<PostRow> applier, SingleWriterQueue queue, boolean enabled) {
        this.manager = Objects.requireNonNull(manager, "manager cannot be null");
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
        this.applier = Objects.requireNonNull(applier, "applier cannot be null");
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
        this.enabled = enabled;
    }

    /**
     * Loads the latest posts and subscribes to changes.
     */
    public Future<Void> open() {
        Promise<Void> promise = Promise.promise();
        queue.execute(() -> {
            if (closed.get()) {
                promise.fail(new IllegalStateException("PostFeedSync is closed"));
                return;
            }
            opened = true;
            complete(openSession(), promise);
        });
        return promise.future();
    }

    public List<PostRow> items() {
        return cache.items();
    }

    /**
     * Creation time of the oldest cached post, for loading older pages. Advisory only.
     */
    public Instant cursor() {
        return cache.cursor();
    }

    public boolean isSubscribed() {
        return manager.isSubscribed();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Future<Void> refetch() {
        return manager.refetch();
    }

    public Runnable onNewPost(Consumer<PostRow> listener) {
        return applier.addNewItemListener(listener);
    }

    public Runnable subscribeItems(Consumer<List<PostRow>> observer) {
        return cache.subscribe(observer);
    }

    public Future<Void> setEnabled(boolean value) {
        Promise<Void> promise = Promise.promise();
        queue.execute(() -> {
            if (enabled == value || closed.get()) {
                promise.complete();
                return;
            }
            enabled = value;
            logger.info("Post feed sync {}", value ? "enabled" : "disabled");
            if (!value) {
                complete(closeSession(), promise);
            } else if (opened) {
                complete(openSession(), promise);
            } else {
                promise.complete();
            }
        });
        return promise.future();
    }

    public Future<Void> whenIdle() {
        return queue.whenIdle();
    }

    @Override
    public String name() {
        return "posts";
    }

    @Override
    public Future<Void> closeReactive() {
        if (!closed.compareAndSet(false, true)) {
            return Future.succeededFuture();
        }
        Promise<Void> promise = Promise.promise();
        queue.execute(() -> {
            logger.info("Closing post feed sync");
            complete(closeSession(), promise);
        });
        return promise.future();
    }

    private Future<Void> openSession() {
        if (!enabled) {
            logger.info("Post feed sync is disabled, not subscribing");
            return Future.succeededFuture();
        }
        if (session != null && session.isOpen()) {
            return session.ready();
        }
        session = manager.open(null);
        return session.ready();
    }

    private Future<Void> closeSession() {
        SyncSession previous = session;
        session = null;
        return previous != null ? previous.closeReactive() : Future.succeededFuture();
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
}
