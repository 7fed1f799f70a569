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
import dev.mars.livesync.api.change.ChangeEvent;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.Optional;

/**
 * Keeps a {@link FeedCache} in step with the change stream.
 *
 * <p>INSERT prepends a visible row, UPDATE replaces a cached row (or removes
 * it once it is no longer visible), DELETE removes it. An UPDATE older than
 * the cached version of the row is discarded as stale. Rows that are not
 * cached are not pulled in by UPDATE, so paging stays the cursor's job.
 *
 * @param <T> the typed row
 */
public class FeedEventApplier<T> extends AbstractEventApplier<T> {

    private final FeedDefinition<T> definition;
    private final FeedCache<T> cache;
    private final CacheInvalidator cacheInvalidator;

    public FeedEventApplier(FeedDefinition<T> definition, FeedCache<T> cache, RowMapper rowMapper,
                            CacheInvalidator cacheInvalidator, EventDeduplicator deduplicator) {
        super(definition.name(), definition.primaryKeyColumn(), rowMapper, deduplicator);
        this.definition = definition;
        this.cache = cache;
        this.cacheInvalidator = cacheInvalidator;
    }

    @Override
    protected ApplyOutcome applyScoped(ChangeEvent event) {
        switch (event.operation()) {
            case INSERT:
                return applyInsert(event);
            case UPDATE:
                return applyUpdate(event);
            case DELETE:
                return applyDelete(event);
            default:
                throw new MalformedEventException("Unsupported operation " + event.operation());
        }
    }

    private ApplyOutcome applyInsert(ChangeEvent event) {
        JsonObject row = requireNewRow(event);
        requireKey(row);
        T item = rowMapper.map(row, definition.rowType());
        if (!definition.isVisible(item)) {
            return ApplyOutcome.IGNORED;
        }
        cache.prepend(item);
        CacheInvalidation.invalidate(cacheInvalidator, definition.invalidationKey());
        notifyNewItem(item);
        return ApplyOutcome.APPLIED;
    }

    private ApplyOutcome applyUpdate(ChangeEvent event) {
        JsonObject row = requireNewRow(event);
        long key = requireKey(row);
        T item = rowMapper.map(row, definition.rowType());

        Optional<T> cached = cache.find(key);
        if (cached.isEmpty()) {
            return ApplyOutcome.IGNORED;
        }
        Instant cachedVersion = definition.updatedAt(cached.get());
        Instant incomingVersion = definition.updatedAt(item);
        if (cachedVersion != null && incomingVersion != null && incomingVersion.isBefore(cachedVersion)) {
            return ApplyOutcome.STALE;
        }
        if (!definition.isVisible(item)) {
            cache.remove(key);
            return ApplyOutcome.APPLIED;
        }
        cache.replace(item);
        return ApplyOutcome.APPLIED;
    }

    private ApplyOutcome applyDelete(ChangeEvent event) {
        long key = requireKey(requireOldRow(event));
        return cache.remove(key) ? ApplyOutcome.APPLIED : ApplyOutcome.IGNORED;
    }
}
