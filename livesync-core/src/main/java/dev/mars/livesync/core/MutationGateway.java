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

import dev.mars.livesync.api.cache.CacheInvalidator;
import dev.mars.livesync.api.change.RowFilter;
import dev.mars.livesync.api.error.LiveSyncError;
import dev.mars.livesync.api.model.NotificationRow;
import dev.mars.livesync.api.mutation.MutationResult;
import dev.mars.livesync.api.mutation.RowMutationClient;
import dev.mars.livesync.api.query.QuerySnapshot;
import dev.mars.livesync.core.metrics.LiveSyncMetrics;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * User-initiated writes against the notifications table.
 *
 * <p>Writes run as tasks on the same {@link SingleWriterQueue} as event
 * application, so no event is applied between sending a write and handling its
 * acknowledgement. The local counter only changes after the backend has
 * acknowledged the write; a failed write leaves it untouched and is returned
 * as a failed {@link MutationResult}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public class MutationGateway {
    private static final Logger logger = LoggerFactory.getLogger(MutationGateway.class);

    static final String MARK_ALL_AS_READ = "markAllAsRead";
    static final String MARK_AS_READ = "markAsRead";

    private final RowMutationClient mutationClient;
    private final SingleWriterQueue queue;
    private final UnreadCounter counter;
    private final CacheInvalidator cacheInvalidator;
    private final LiveSyncMetrics metrics;

    public MutationGateway(RowMutationClient mutationClient, SingleWriterQueue queue, UnreadCounter counter,
                           CacheInvalidator cacheInvalidator, LiveSyncMetrics metrics) {
        this.mutationClient = Objects.requireNonNull(mutationClient, "mutationClient cannot be null");
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
        this.counter = Objects.requireNonNull(counter, "counter cannot be null");
        this.cacheInvalidator = Objects.requireNonNull(cacheInvalidator, "cacheInvalidator cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    }

    /**
     * Marks every unread notification of {@code userId} as read. On
     * acknowledgement, and only if {@code acknowledgement} accepts the write
     * time, the counter is set to 0 and the notifications query key invalidated.
     *
     * @param userId          the owner of the notifications
     * @param acknowledgement called on the writer context with the backend write time;
     *                        returns false if the write no longer belongs to the open session
     * @return the write outcome; fails only if the queue rejects the write. Backend errors
     *         and failing local follow-ups arrive as a failed {@link MutationResult}
     */
    public Future<MutationResult> markAllAsRead(String userId, Predicate<Instant> acknowledgement) {
        Objects.requireNonNull(userId, "userId cannot be null");
        Objects.requireNonNull(acknowledgement, "acknowledgement cannot be null");
        JsonObject changes = new JsonObject()
            .put(NotificationRow.IS_READ, true)
            .put(NotificationRow.READ_AT, Instant.now());
        List<RowFilter> filters = List.of(
            RowFilter.eq(NotificationRow.USER_ID, userId),
            RowFilter.eq(NotificationRow.IS_READ, false));

        return write(MARK_ALL_AS_READ, filters, changes, cause -> LiveSyncError.markAllReadFailed(userId, cause), ack -> {
            if (!acknowledgement.test(ack.asOf())) {
                logger.info("markAllAsRead for user {} acknowledged after the session changed, local state untouched", userId);
                return;
            }
            counter.setCount(0);
            CacheInvalidation.invalidate(cacheInvalidator, UnreadCountApplier.INVALIDATION_KEY);
            logger.info("Marked {} notifications as read for user: {}", ack.value(), userId);
        });
    }

    /**
     * Marks one notification as read. The counter is left to the UPDATE event
     * the write produces; only the notifications query key is invalidated.
     */
    public Future<MutationResult> markAsRead(long notificationId, Predicate<Instant> acknowledgement) {
        Objects.requireNonNull(acknowledgement, "acknowledgement cannot be null");
        JsonObject changes = new JsonObject()
            .put(NotificationRow.IS_READ, true)
            .put(NotificationRow.READ_AT, Instant.now());
        List<RowFilter> filters = List.of(
            RowFilter.eq(NotificationRow.ID, notificationId),
            RowFilter.eq(NotificationRow.IS_READ, false));

        return write(MARK_AS_READ, filters, changes, cause -> LiveSyncError.mutationFailed(NotificationRow.TABLE, cause), ack -> {
            if (acknowledgement.test(ack.asOf())) {
                CacheInvalidation.invalidate(cacheInvalidator, UnreadCountApplier.INVALIDATION_KEY);
            }
            logger.debug("Marked notification {} as read ({} rows)", notificationId, ack.value());
        });
    }

    private Future<MutationResult> write(String operation, List<RowFilter> filters, JsonObject changes,
                                         Function<Throwable, LiveSyncError> errorOf,
                                         Consumer<QuerySnapshot<Integer>> onAcknowledged) {
        return queue.submit(() -> {
            Promise<MutationResult> promise = Promise.promise();
            Future<QuerySnapshot<Integer>> update;
            try {
                update = mutationClient.update(NotificationRow.TABLE, filters, changes);
            } catch (Exception e) {
                update = Future.failedFuture(e);
            }
            update.onComplete(ar -> queue.execute(() -> {
                try {
                    if (ar.succeeded()) {
                        QuerySnapshot<Integer> ack = ar.result();
                        int rows = ack.value() != null ? ack.value() : 0;
                        onAcknowledged.accept(ack);
                        metrics.recordMutation(operation, true);
                        promise.tryComplete(MutationResult.succeeded(rows));
                    } else {
                        LiveSyncError error = errorOf.apply(ar.cause());
                        logger.error("{} {}: {}", error.code(), error.message(), error.details());
                        metrics.recordMutation(operation, false);
                        promise.tryComplete(MutationResult.failed(error));
                    }
                } catch (Exception e) {
                    // The write itself may have landed; only the local follow-up failed
                    LiveSyncError error = LiveSyncError.internalError(
                        operation + " acknowledgement could not be applied: " + e.getMessage());
                    logger.error("{} {}", error.code(), error.message(), e);
                    metrics.recordMutation(operation, false);
                    promise.tryComplete(MutationResult.failed(error));
                }
            }));
            return promise.future();
        });
    }
}
