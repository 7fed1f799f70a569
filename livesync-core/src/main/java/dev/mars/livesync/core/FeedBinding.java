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

import java.util.List;

/**
 * Binds a feed cache to every row of its table.
 *
 * @param <T> the typed row
 */
public class FeedBinding<T> implements SyncBinding<List<T>> {

    private final FeedDefinition<T> definition;
    private final FeedCache<T> cache;
    private final FeedEventApplier<T> applier;
    private final BaselineFetcher baselineFetcher;

    public FeedBinding(FeedDefinition<T> definition, FeedCache<T> cache, FeedEventApplier<T> applier,
                       BaselineFetcher baselineFetcher) {
        this.definition = definition;
        this.cache = cache;
        this.applier = applier;
        this.baselineFetcher = baselineFetcher;
    }

    @Override
    public String feed() {
        return definition.name();
    }

    @Override
    public ChangeSubscription subscription(String userId) {
        return ChangeSubscription.forTable(definition.table(), definition.operations());
    }

    @Override
    public Future<QuerySnapshot<List<T>>> fetchBaseline(String userId) {
        return baselineFetcher.fetchLatest(definition, cache.maxItems());
    }

    @Override
    public void applyBaseline(QuerySnapshot<List<T>> snapshot) {
        cache.replaceAll(snapshot.value());
    }

    @Override
    public ApplyOutcome applyEvent(ChangeEvent event) {
        return applier.apply(event);
    }

    @Override
    public void begin(String userId) {
        cache.clear(userId);
        applier.reset(subscription(userId));
    }

    @Override
    public void end() {
        cache.clear(null);
        applier.reset(null);
    }
}
