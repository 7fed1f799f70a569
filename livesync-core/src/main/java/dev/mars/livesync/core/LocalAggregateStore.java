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
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Locally held aggregate exposed to the UI layer.
 *
 * <p>Any thread may {@link #read()} and {@link #subscribe}. Writes are only
 * accepted on the writer context; a write from anywhere else throws
 * {@link IllegalStateException}. Observers are notified on the writer context
 * after each change.
 *
 * @param <V> the aggregate type, treated as immutable
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public abstract class LocalAggregateStore<V> {
    private static final Logger logger = LoggerFactory.getLogger(LocalAggregateStore.class);

    private final Context writerContext;
    private final String name;
    private final List<Consumer<V>> observers = new CopyOnWriteArrayList<>();
    private volatile V value;
    private volatile String ownerUserId;

    protected LocalAggregateStore(Context writerContext, String name, V initialValue) {
        this.writerContext = Objects.requireNonNull(writerContext, "writerContext cannot be null");
        this.name = name;
        this.value = initialValue;
    }

    public V read() {
        return value;
    }

    public String name() {
        return name;
    }

    /**
     * @return the user the current value belongs to, or null for global or reset stores
     */
    public String ownerUserId() {
        return ownerUserId;
    }

    /**
     * Registers an observer called with every new value.
     *
     * @return an action that removes the observer
     */
    public Runnable subscribe(Consumer<V> observer) {
        Objects.requireNonNull(observer, "observer cannot be null");
        observers.add(observer);
        return () -> observers.remove(observer);
    }

    /**
     * Applies a transition to the current value.
     */
    protected void apply(UnaryOperator<V> delta) {
        checkWriter();
        set(delta.apply(value));
    }

    protected void set(V newValue) {
        checkWriter();
        if (Objects.equals(value, newValue)) {
            return;
        }
        value = newValue;
        for (Consumer<V> observer : observers) {
            try {
                observer.accept(newValue);
            } catch (Exception e) {
                logger.warn("Observer of store {} failed: {}", name, e.getMessage(), e);
            }
        }
    }

    /**
     * Replaces the value and owner in one step, e.g. on session start or end.
     */
    protected void reset(String owner, V initialValue) {
        checkWriter();
        this.ownerUserId = owner;
        set(initialValue);
    }

    protected void checkWriter() {
        if (Vertx.currentContext() != writerContext) {
            throw new IllegalStateException("Store " + name + " may only be written on its writer context, current thread: "
                + Thread.currentThread().getName());
        }
    }
}
