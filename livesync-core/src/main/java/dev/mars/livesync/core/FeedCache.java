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

import io.vertx.core.Context;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ordered, bounded list of feed items, newest first.
 *
 * <p>Items are identified by a primary key; the cache never holds two items
 * with the same key. The cursor is the creation time of the oldest cached
 * item and is advisory only.
 *
 * @param <T> the item type
 */
public class FeedCache<T> extends LocalAggregateStore<List<T>> {

    private final Function<T, Long> keyOf;
    private final Function<T, Instant> createdAtOf;
    private final int maxItems;

    public FeedCache(Context writerContext, String name, Function<T, Long> keyOf,
                     Function<T, Instant> createdAtOf, int maxItems) {
        super(writerContext, name, List.of());
        if (maxItems < 1) {
            throw new IllegalArgumentException("Max items must be positive, got: " + maxItems);
        }
        this.keyOf = Objects.requireNonNull(keyOf, "keyOf cannot be null");
        this.createdAtOf = Objects.requireNonNull(createdAtOf, "createdAtOf cannot be null");
        this.maxItems = maxItems;
    }

    public List<T> items() {
        return read();
    }

    public int maxItems() {
        return maxItems;
    }

    /**
     * @return creation time of the oldest cached item, or null when empty
     */
    public Instant cursor() {
        List<T> items = read();
        return items.isEmpty() ? null : createdAtOf.apply(items.get(items.size() - 1));
    }

    public Optional<T> find(long key) {
        return read().stream().filter(item -> keyOf.apply(item) == key).findFirst();
    }

    /**
     * Replaces the whole list, e.g. with a baseline page.
     */
    public void replaceAll(List<T> items) {
        List<T> copy = new ArrayList<>();
        for (T item : items) {
            if (copy.stream().noneMatch(existing -> sameKey(existing, item))) {
                copy.add(item);
            }
        }
        set(trim(copy));
    }

    /**
     * Puts an item at the head, removing any cached item with the same key first.
     */
    public void prepend(T item) {
        apply(current -> {
            List<T> next = new ArrayList<>(current.size() + 1);
            next.add(item);
            for (T existing : current) {
                if (!sameKey(existing, item)) {
                    next.add(existing);
                }
            }
            return trim(next);
        });
    }

    /**
     * Replaces the cached item with the same key, keeping its position.
     *
     * @return false if no item with that key is cached
     */
    public boolean replace(T item) {
        List<T> current = read();
        for (int i = 0; i < current.size(); i++) {
            if (sameKey(current.get(i), item)) {
                List<T> next = new ArrayList<>(current);
                next.set(i, item);
                set(List.copyOf(next));
                return true;
            }
        }
        checkWriter();
        return false;
    }

    /**
     * @return false if no item with that key is cached
     */
    public boolean remove(long key) {
        List<T> current = read();
        List<T> next = new ArrayList<>(current.size());
        for (T existing : current) {
            if (keyOf.apply(existing) != key) {
                next.add(existing);
            }
        }
        if (next.size() == current.size()) {
            checkWriter();
            return false;
        }
        set(List.copyOf(next));
        return true;
    }

    public void clear(String owner) {
        reset(owner, List.of());
    }

    private boolean sameKey(T a, T b) {
        return keyOf.apply(a).longValue() == keyOf.apply(b).longValue();
    }

    private List<T> trim(List<T> items) {
        if (items.size() > maxItems) {
            return List.copyOf(items.subList(0, maxItems));
        }
        return List.copyOf(items);
    }
}
