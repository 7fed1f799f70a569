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
import dev.mars.livesync.api.error.LiveSyncErrorCodes;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Shared pipeline for appliers: scope check, duplicate detection and
 * malformed-event containment around a table-specific transition.
 *
 * @param <T> typed row passed to "new item" listeners
 */
public abstract class AbstractEventApplier<T> implements EventApplier {
    private static final Logger logger = LoggerFactory.getLogger(AbstractEventApplier.class);

    protected final String feed;
    protected final String primaryKeyColumn;
    protected final RowMapper rowMapper;
    private final EventDeduplicator deduplicator;
    private final List<Consumer<T>> newItemListeners = new CopyOnWriteArrayList<>();
    private ChangeSubscription scope;

    protected AbstractEventApplier(String feed, String primaryKeyColumn, RowMapper rowMapper,
                                   EventDeduplicator deduplicator) {
        this.feed = feed;
        this.primaryKeyColumn = primaryKeyColumn;
        this.rowMapper = rowMapper;
        this.deduplicator = deduplicator;
    }

    @Override
    public final ApplyOutcome apply(ChangeEvent event) {
        if (event == null || event.table() == null || event.operation() == null) {
            logger.warn("[{}] {} dropping change event without table or operation: {}",
                feed, LiveSyncErrorCodes.MALFORMED_EVENT, event);
            return ApplyOutcome.MALFORMED;
        }
        if (scope == null || !scope.matches(event)) {
            logger.debug("[{}] ignoring {} on {} outside subscription {}", feed, event.operation(), event.table(),
                scope != null ? scope.key() : "none");
            return ApplyOutcome.IGNORED;
        }
        String key = event.deduplicationKey(primaryKeyColumn);
        if (deduplicator.isDuplicate(key)) {
            logger.debug("[{}] discarding duplicate event {}", feed, key);
            return ApplyOutcome.DUPLICATE;
        }

        ApplyOutcome outcome;
        try {
            outcome = applyScoped(event);
        } catch (MalformedEventException e) {
            logger.warn("[{}] {} dropping malformed {} event on {}: {}",
                feed, LiveSyncErrorCodes.MALFORMED_EVENT, event.operation(), event.table(), e.getMessage());
            return ApplyOutcome.MALFORMED;
        }
        deduplicator.record(key);
        logger.debug("[{}] {} {} -> {}", feed, event.operation(), key, outcome);
        return outcome;
    }

    /**
     * Applies an event already known to be in scope and not a duplicate.
     *
     * @throws MalformedEventException if the event lacks required fields
     */
    protected abstract ApplyOutcome applyScoped(ChangeEvent event);

    @Override
    public void reset(ChangeSubscription scope) {
        this.scope = scope;
        deduplicator.clear();
    }

    public ChangeSubscription scope() {
        return scope;
    }

    /**
     * @return an action that removes the listener
     */
    public Runnable addNewItemListener(Consumer<T> listener) {
        newItemListeners.add(listener);
        return () -> newItemListeners.remove(listener);
    }

    protected void notifyNewItem(T item) {
        for (Consumer<T> listener : newItemListeners) {
            try {
                listener.accept(item);
            } catch (Exception e) {
                logger.warn("[{}] new item listener failed: {}", feed, e.getMessage(), e);
            }
        }
    }

    protected JsonObject requireNewRow(ChangeEvent event) {
        if (!event.hasNewRow()) {
            throw new MalformedEventException(event.operation() + " without new row");
        }
        return event.newRow();
    }

    protected JsonObject requireOldRow(ChangeEvent event) {
        if (!event.hasOldRow()) {
            throw new MalformedEventException(event.operation() + " without old row");
        }
        return event.oldRow();
    }

    protected static boolean requireBoolean(JsonObject row, String column) {
        Object value = row.getValue(column);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new MalformedEventException("Column " + column + " missing or not boolean: " + value);
    }

    protected long requireKey(JsonObject row) {
        Object value = row.getValue(primaryKeyColumn);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                throw new MalformedEventException("Primary key " + primaryKeyColumn + " is not numeric: " + value, e);
            }
        }
        throw new MalformedEventException("Missing primary key " + primaryKeyColumn);
    }
}
