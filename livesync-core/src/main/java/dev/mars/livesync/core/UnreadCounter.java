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

/**
 * Non-negative count of unread items for the signed-in user.
 */
public class UnreadCounter extends LocalAggregateStore<Long> {

    public UnreadCounter(Context writerContext, String name) {
        super(writerContext, name, 0L);
    }

    public long value() {
        return read();
    }

    public void increment() {
        apply(v -> v + 1);
    }

    /**
     * Decrements by one, clamped at zero.
     *
     * @return false if the counter was already zero
     */
    public boolean decrement() {
        if (read() <= 0) {
            checkWriter();
            return false;
        }
        apply(v -> Math.max(0L, v - 1));
        return true;
    }

    public void setCount(long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Count must not be negative, got: " + count);
        }
        set(count);
    }

    /**
     * Starts a new owner at zero, or clears the counter when {@code owner} is null.
     */
    public void resetFor(String owner) {
        reset(owner, 0L);
    }
}
