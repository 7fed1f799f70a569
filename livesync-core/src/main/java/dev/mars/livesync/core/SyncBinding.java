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
import dev.mars.livesync.api.change.ChangeSubscription;
import dev.mars.livesync.api.query.QuerySnapshot;
import io.vertx.core.Future;

/**
 * Ties one local aggregate to the subscription, baseline and applier that keep it current.
 * All methods except {@link #fetchBaseline} are called on the writer context.
 *
 * @param <V> the baseline value type
 */
public interface SyncBinding<V> {

    /**
     * @return short feed name used in logs and metric tags
     */
    String feed();

    /**
     * @param userId the session's user, null for global feeds
     */
    ChangeSubscription subscription(String userId);

    Future<QuerySnapshot<V>> fetchBaseline(String userId);

    /**
     * Replaces the aggregate with the baseline value.
     */
    void applyBaseline(QuerySnapshot<V> snapshot);

    ApplyOutcome applyEvent(ChangeEvent event);

    /**
     * Clears the aggregate and starts a new scope for a session.
     *
     * @param userId the session's user, null for global feeds
     */
    void begin(String userId);

    /**
     * Clears the aggregate and stops accepting events until the next {@link #begin}.
     */
    void end();
}
