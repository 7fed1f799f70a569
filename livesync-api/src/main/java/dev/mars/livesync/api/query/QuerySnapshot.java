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
package dev.mars.livesync.api.query;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of a point-in-time query together with the backend time it reflects.
 *
 * <p>Change events committed at or before {@code asOf} are already contained
 * in {@code value}.
 *
 * @param value the query result
 * @param asOf  the backend time the result is consistent with
 * @param <T>   result type
 */
public record QuerySnapshot<T>(T value, Instant asOf) {

    public QuerySnapshot {
        Objects.requireNonNull(asOf, "asOf cannot be null");
    }

    public static <T> QuerySnapshot<T> of(T value, Instant asOf) {
        return new QuerySnapshot<>(value, asOf);
    }

    /**
     * Returns true if an event committed at {@code commitTimestamp} is already
     * reflected in this snapshot. Events without a commit timestamp are never
     * considered covered.
     */
    public boolean covers(Instant commitTimestamp) {
        return commitTimestamp != null && !commitTimestamp.isAfter(asOf);
    }
}
