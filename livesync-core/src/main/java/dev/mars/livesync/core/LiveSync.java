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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.livesync.api.cache.CacheInvalidator;
import dev.mars.livesync.api.change.ChangeStreamClient;
import dev.mars.livesync.api.identity.IdentityEvents;
import dev.mars.livesync.api.lifecycle.ReactiveCloseable;
import dev.mars.livesync.api.model.PostRow;
import dev.mars.livesync.api.mutation.RowMutationClient;
import dev.mars.livesync.api.query.RowQueryClient;
import dev.mars.livesync.core.config.LiveSyncConfiguration;
import dev.mars.livesync.core.config.ReconnectPolicy;
import dev.mars.livesync.core.metrics.LiveSyncMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Entry point wiring configuration, Vert.x and the backend collaborators into
 * the UI-facing {@link NotificationSync} and {@link PostFeedSync}.
 *
 * <p>Each sync object gets its own {@link SingleWriterQueue} on the shared
 * writer context. Sync objects are created on first access.
 *
 * <pre>{@code
 * LiveSync liveSync = LiveSync.builder()
 *     .vertx(vertx)
 *     .configuration(new LiveSyncConfiguration("production"))
 *     .changeStreamClient(changes)
 *     .queryClient(queries)
 *     .mutationClient(mutations)
 *     .identityEvents(identity)
 *     .build();
 * liveSync.notifications().open();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public final class LiveSync implements ReactiveCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LiveSync.class);

    private final Vertx vertx;
    private final Context context;
    private final LiveSyncConfiguration configuration;
    private final ChangeStreamClient changeStreamClient;
    private final RowQueryClient queryClient;
    private final RowMutationClient mutationClient;
    private final IdentityEvents identityEvents;
    private final CacheInvalidator cacheInvalidator;
    private final LiveSyncMetrics metrics;
    private final RowMapper rowMapper;
    private final BaselineFetcher baselineFetcher;
    private final List<ReactiveCloseable> closeHooks = new CopyOnWriteArrayList<>();

    private NotificationSync notifications;
    private PostFeedSync posts;
    private boolean closed;

    private LiveSync(Builder builder) {
        this.vertx = builder.vertx;
        this.context = builder.context != null ? builder.context : vertx.getOrCreateContext();
        this.configuration = builder.configuration;
        this.changeStreamClient = builder.changeStreamClient;
        this.queryClient = builder.queryClient;
        this.mutationClient = builder.mutationClient;
        this.identityEvents = builder.identityEvents;
        this.cacheInvalidator = builder.cacheInvalidator != null ? builder.cacheInvalidator : CacheInvalidator.noop();
        this.metrics = builder.metrics != null ? builder.metrics : new LiveSyncMetrics("livesync");
        this.rowMapper = builder.objectMapper != null ? new RowMapper(builder.objectMapper) : new RowMapper();
        this.baselineFetcher = new BaselineFetcher(queryClient, rowMapper);

        if (builder.meterRegistry != null) {
            metrics.bindTo(builder.meterRegistry);
        }
        logger.info("Initialized LiveSync with profile: {}, reconnect policy: {}",
            configuration.getProfile(), configuration.getReconnectPolicy());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The unread-notification sync, created on first access.
     */
    public synchronized NotificationSync notifications() {
        checkOpen();
        if (notifications == null) {
            notifications = createNotificationSync();
        }
        return notifications;
    }

    /**
     * The post feed sync, created on first access.
     */
    public synchronized PostFeedSync posts() {
        checkOpen();
        if (posts == null) {
            posts = createPostFeedSync();
        }
        return posts;
    }

    public LiveSyncMetrics metrics() {
        return metrics;
    }

    public LiveSyncConfiguration configuration() {
        return configuration;
    }

    /**
     * Registers a resource closed after the sync objects, e.g. a backend connection.
     */
    public void registerCloseHook(ReactiveCloseable hook) {
        closeHooks.add(Objects.requireNonNull(hook, "hook cannot be null"));
    }

    @Override
    public String name() {
        return "livesync";
    }

    @Override
    public Future<Void> closeReactive() {
        List<ReactiveCloseable> toClose = new ArrayList<>();
        synchronized (this) {
            if (closed) {
                return Future.succeededFuture();
            }
            closed = true;
            if (notifications != null) {
                toClose.add(notifications);
            }
            if (posts != null) {
                toClose.add(posts);
            }
        }
        toClose.addAll(closeHooks);
        logger.info("Closing LiveSync ({} resources)", toClose.size());

        Future<Void> chain = Future.succeededFuture();
        for (ReactiveCloseable closeable : toClose) {
            chain = chain.compose(ignored -> closeable.closeReactive()
                .onSuccess(v -> logger.debug("Closed '{}'", closeable.name()))
                .onFailure(e -> logger.warn("Closing '{}' failed: {}", closeable.name(), e.getMessage()))
                .recover(e -> Future.succeededFuture()));
        }
        return chain.onSuccess(v -> logger.info("LiveSync closed"));
    }

    private NotificationSync createNotificationSync() {
        LiveSyncConfiguration.SyncConfig sync = configuration.getSyncConfig();
        SingleWriterQueue queue = new SingleWriterQueue(context, "notifications", sync.getQueueCapacity(), metrics);
        UnreadCounter counter = new UnreadCounter(context, "notifications");
        UnreadCountApplier applier = new UnreadCountApplier(counter, rowMapper, cacheInvalidator,
            new EventDeduplicator(sync.getDedupWindowSize()));
        UnreadCountBinding binding = new UnreadCountBinding(counter, applier, baselineFetcher);
        SubscriptionManager<Long> manager = new SubscriptionManager<>(vertx, changeStreamClient, binding, queue,
            reconnectPolicy(), sync.getHoldBufferCapacity(), metrics);
        MutationGateway gateway = new MutationGateway(mutationClient, queue, counter, cacheInvalidator, metrics);
        return new NotificationSync(identityEvents, manager, counter, applier, gateway, queue,
            sync.isNotificationsEnabled());
    }

    private PostFeedSync createPostFeedSync() {
        LiveSyncConfiguration.SyncConfig sync = configuration.getSyncConfig();
        FeedDefinition<PostRow> definition = FeedDefinition.POSTS;
        SingleWriterQueue queue = new SingleWriterQueue(context, definition.name(), sync.getQueueCapacity(), metrics);
        FeedCache<PostRow> cache = new FeedCache<>(context, definition.name(), definition.keyOf(),
            definition.createdAtOf(), sync.getFeedMaxItems());
        FeedEventApplier<PostRow> applier = new FeedEventApplier<>(definition, cache, rowMapper, cacheInvalidator,
            new EventDeduplicator(sync.getDedupWindowSize()));
        FeedBinding<PostRow> binding = new FeedBinding<>(definition, cache, applier, baselineFetcher);
        SubscriptionManager<List<PostRow>> manager = new SubscriptionManager<>(vertx, changeStreamClient, binding,
            queue, reconnectPolicy(), sync.getHoldBufferCapacity(), metrics);
        return new PostFeedSync(manager, cache, applier, queue, sync.isPostsEnabled());
    }

    private ReconnectPolicy reconnectPolicy() {
        return configuration.getReconnectPolicy();
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("LiveSync is closed");
        }
    }

    public static class Builder {
        private Vertx vertx;
        private Context context;
        private LiveSyncConfiguration configuration;
        private ChangeStreamClient changeStreamClient;
        private RowQueryClient queryClient;
        private RowMutationClient mutationClient;
        private IdentityEvents identityEvents;
        private CacheInvalidator cacheInvalidator;
        private LiveSyncMetrics metrics;
        private MeterRegistry meterRegistry;
        private ObjectMapper objectMapper;

        public Builder vertx(Vertx vertx) {
            this.vertx = vertx;
            return this;
        }

        /**
         * Writer context for all sync objects. Defaults to a context obtained from the Vert.x instance.
         */
        public Builder context(Context context) {
            this.context = context;
            return this;
        }

        public Builder configuration(LiveSyncConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder changeStreamClient(ChangeStreamClient changeStreamClient) {
            this.changeStreamClient = changeStreamClient;
            return this;
        }

        public Builder queryClient(RowQueryClient queryClient) {
            this.queryClient = queryClient;
            return this;
        }

        public Builder mutationClient(RowMutationClient mutationClient) {
            this.mutationClient = mutationClient;
            return this;
        }

        public Builder identityEvents(IdentityEvents identityEvents) {
            this.identityEvents = identityEvents;
            return this;
        }

        public Builder cacheInvalidator(CacheInvalidator cacheInvalidator) {
            this.cacheInvalidator = cacheInvalidator;
            return this;
        }

        public Builder metrics(LiveSyncMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public LiveSync build() {
            Objects.requireNonNull(vertx, "vertx cannot be null");
            Objects.requireNonNull(changeStreamClient, "changeStreamClient cannot be null");
            Objects.requireNonNull(queryClient, "queryClient cannot be null");
            Objects.requireNonNull(mutationClient, "mutationClient cannot be null");
            Objects.requireNonNull(identityEvents, "identityEvents cannot be null");
            if (configuration == null) {
                configuration = new LiveSyncConfiguration();
            }
            return new LiveSync(this);
        }
    }
}
