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
package dev.mars.livesync.pg;

import dev.mars.livesync.api.change.ChangeEvent;
import dev.mars.livesync.api.change.ChangeStreamClient;
import dev.mars.livesync.api.change.ChangeSubscription;
import dev.mars.livesync.api.change.ChannelStatus;
import dev.mars.livesync.api.change.SubscriptionHandle;
import dev.mars.livesync.api.error.LiveSyncError;
import dev.mars.livesync.api.error.LiveSyncErrorCodes;
import dev.mars.livesync.api.lifecycle.ReactiveCloseable;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.PgConnection;
import io.vertx.pgclient.PgNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Change stream over PostgreSQL LISTEN/NOTIFY.
 *
 * <p>Every handle owns a dedicated {@link PgConnection} listening on the
 * configured channel. All triggered tables publish to that one channel, so
 * each handle filters the decoded events against its own subscription.
 *
 * <p>This client does not reconnect. A failed connect, a failed LISTEN or an
 * unexpected connection close report {@link ChannelStatus#CHANNEL_ERROR} and
 * the handle is dead; the caller opens a new one.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public class PgChangeStreamClient implements ChangeStreamClient, ReactiveCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PgChangeStreamClient.class);

    private final Vertx vertx;
    private final PgConnectOptions connectOptions;
    private final String channel;
    private final String quotedChannel;
    private final ChangePayloadCodec codec;
    private final Map<String, PgHandle> handles = new ConcurrentHashMap<>();

    public PgChangeStreamClient(Vertx vertx, PgConnectOptions connectOptions, String channel) {
        this(vertx, connectOptions, channel, new ChangePayloadCodec());
    }

    public PgChangeStreamClient(Vertx vertx, PgConnectOptions connectOptions, String channel,
                                ChangePayloadCodec codec) {
        this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
        this.connectOptions = Objects.requireNonNull(connectOptions, "connectOptions cannot be null");
        this.quotedChannel = PgIdentifiers.quoteChannel(channel);
        this.channel = channel;
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        logger.debug("Created PgChangeStreamClient on channel '{}' for {}:{}/{}",
            channel, connectOptions.getHost(), connectOptions.getPort(), connectOptions.getDatabase());
    }

    @Override
    public SubscriptionHandle subscribe(ChangeSubscription subscription,
                                        Handler<ChangeEvent> eventHandler,
                                        Handler<ChannelStatus> statusHandler) {
        Objects.requireNonNull(subscription, "subscription cannot be null");
        Objects.requireNonNull(eventHandler, "eventHandler cannot be null");
        Objects.requireNonNull(statusHandler, "statusHandler cannot be null");

        PgHandle handle = new PgHandle("pg-" + UUID.randomUUID(), subscription, eventHandler, statusHandler);
        handles.put(handle.id, handle);
        logger.debug("Opening {} for {}", handle.id, subscription.key());
        // connect after the caller holds the handle so that no status precedes it
        vertx.runOnContext(v -> connect(handle));
        return handle;
    }

    @Override
    public Future<Void> unsubscribe(SubscriptionHandle handle) {
        if (!(handle instanceof PgHandle)) {
            return Future.failedFuture(new IllegalArgumentException("Not a PostgreSQL subscription handle: " + handle));
        }
        PgHandle pgHandle = (PgHandle) handle;
        handles.remove(pgHandle.id);
        return pgHandle.close();
    }

    /**
     * @return the number of handles not yet closed or failed
     */
    public int activeHandles() {
        return handles.size();
    }

    @Override
    public String name() {
        return "pg-change-stream";
    }

    @Override
    public Future<Void> closeReactive() {
        List<Future<Void>> closing = new ArrayList<>();
        for (PgHandle handle : new ArrayList<>(handles.values())) {
            closing.add(unsubscribe(handle));
        }
        return Future.join(closing).mapEmpty();
    }

    private void connect(PgHandle handle) {
        PgConnection.connect(vertx, connectOptions)
            .compose(conn -> {
                if (!handle.attach(conn)) {
                    // unsubscribed while connecting
                    return conn.close().compose(v -> Future.<Void>failedFuture(new HandleClosedException()));
                }
                conn.notificationHandler(handle::onNotification);
                conn.closeHandler(v -> handle.connectionLost());
                return conn.query("LISTEN " + quotedChannel).execute().<Void>mapEmpty();
            })
            .onSuccess(v -> {
                logger.debug("{} listening on channel '{}'", handle.id, channel);
                handle.transition(ChannelStatus.CONNECTING, ChannelStatus.SUBSCRIBED);
            })
            .onFailure(error -> {
                if (error instanceof HandleClosedException) {
                    return;
                }
                logger.warn("{} {} failed to open LISTEN connection for {}: {}",
                    LiveSyncErrorCodes.CHANNEL_ERROR, handle.id, handle.subscription.key(), error.getMessage());
                handle.fail();
            });
    }

    private void dispatch(PgHandle handle, String payload) {
        ChangeEvent event;
        try {
            event = codec.decode(payload);
        } catch (IllegalArgumentException e) {
            LiveSyncError error = LiveSyncError.malformedEvent(handle.subscription.table(), e.getMessage());
            logger.warn("{} {} dropping payload on '{}': {}", error.code(), error.message(), channel, error.details());
            return;
        }
        if (handle.subscription.matches(event)) {
            handle.eventHandler.handle(event);
        }
    }

    private final class PgHandle implements SubscriptionHandle {
        private final String id;
        private final ChangeSubscription subscription;
        private final Handler<ChangeEvent> eventHandler;
        private final Handler<ChannelStatus> statusHandler;
        private volatile ChannelStatus status = ChannelStatus.CONNECTING;
        private PgConnection connection;

        private PgHandle(String id, ChangeSubscription subscription, Handler<ChangeEvent> eventHandler,
                         Handler<ChannelStatus> statusHandler) {
            this.id = id;
            this.subscription = subscription;
            this.eventHandler = eventHandler;
            this.statusHandler = statusHandler;
        }

        private synchronized boolean attach(PgConnection conn) {
            if (status.isTerminal()) {
                return false;
            }
            connection = conn;
            return true;
        }

        private synchronized PgConnection detach() {
            PgConnection conn = connection;
            connection = null;
            return conn;
        }

        private void onNotification(PgNotification notification) {
            if (status == ChannelStatus.SUBSCRIBED && channel.equals(notification.getChannel())) {
                dispatch(this, notification.getPayload());
            }
        }

        private void transition(ChannelStatus expected, ChannelStatus next) {
            synchronized (this) {
                if (status != expected) {
                    return;
                }
                status = next;
            }
            notifyStatus(next);
        }

        private void connectionLost() {
            logger.warn("{} LISTEN connection for {} closed unexpectedly",
                LiveSyncErrorCodes.CHANNEL_ERROR, subscription.key());
            fail();
        }

        private void fail() {
            synchronized (this) {
                if (status.isTerminal()) {
                    return;
                }
                status = ChannelStatus.CHANNEL_ERROR;
            }
            handles.remove(id);
            PgConnection conn = detach();
            if (conn != null) {
                conn.closeHandler(null);
                conn.close();
            }
            notifyStatus(ChannelStatus.CHANNEL_ERROR);
        }

        private Future<Void> close() {
            synchronized (this) {
                if (status == ChannelStatus.CLOSED) {
                    return Future.succeededFuture();
                }
                status = ChannelStatus.CLOSED;
            }
            PgConnection conn = detach();
            notifyStatus(ChannelStatus.CLOSED);
            if (conn == null) {
                return Future.succeededFuture();
            }
            conn.closeHandler(null);
            return conn.query("UNLISTEN " + quotedChannel).execute()
                .<Void>mapEmpty()
                .recover(error -> {
                    logger.debug("{} UNLISTEN failed, closing anyway: {}", id, error.getMessage());
                    return Future.succeededFuture();
                })
                .compose(v -> conn.close())
                .onSuccess(v -> logger.debug("Closed {}", id));
        }

        private void notifyStatus(ChannelStatus next) {
            try {
                statusHandler.handle(next);
            } catch (RuntimeException e) {
                logger.warn("{} status handler failed for {}: {}", id, next, e.getMessage(), e);
            }
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public ChangeSubscription subscription() {
            return subscription;
        }

        @Override
        public ChannelStatus status() {
            return status;
        }

        @Override
        public String toString() {
            return id + "[" + subscription.key() + ", " + status + "]";
        }
    }

    private static final class HandleClosedException extends RuntimeException {
        private HandleClosedException() {
            super("Subscription closed while connecting", null, false, false);
        }
    }
}
