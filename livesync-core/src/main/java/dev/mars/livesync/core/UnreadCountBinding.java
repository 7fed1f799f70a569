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
import dev.mars.livesync.api.change.ChangeOperation;
import dev.mars.livesync.api.change.ChangeSubscription;
import dev.mars.livesync.api.model.NotificationRow;
import dev.mars.livesync.api.query.QuerySnapshot;
import io.vertx.core.Future;

import java.util.EnumSet;

/**
 * Binds the unread counter to the user's notification rows.
 */
public class UnreadCountBinding implements SyncBinding<Long> {

    private final UnreadCounter counter;
    private final UnreadCountApplier applier;
    private final BaselineFetcher baselineFetcher;

    public UnreadCountBinding(UnreadCounter counter, UnreadCountApplier applier, BaselineFetcher baselineFetcher) {
        this.counter = counter;
        this.applier = applier;
        this.baselineFetcher = baselineFetcher;
    }

    @Override
    public String feed() {
        return counter.name();
    }

    @Override
    public ChangeSubscription subscription(String userId) {
        return ChangeSubscription.forOwner(NotificationRow.TABLE, NotificationRow.USER_ID, userId,
            EnumSet.allOf(ChangeOperation.class));
    }

    @Override
    public Future<QuerySnapshot<Long>> fetchBaseline(String userId) {
        return baselineFetcher.fetchUnreadCount(userId);
    }

    @Override
    public void applyBaseline(QuerySnapshot<Long> snapshot) {
        counter.setCount(snapshot.value());
    }

    @Override
    public ApplyOutcome applyEvent(ChangeEvent event) {
        return applier.apply(event);
    }

    @Override
    public void begin(String userId) {
        counter.resetFor(userId);
        applier.reset(subscription(userId));
    }

    @Override
    public void end() {
        counter.resetFor(null);
        applier.reset(null);
    }
}
