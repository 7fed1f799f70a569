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
package dev.mars.livesync.api.change;

import java.util.Locale;

/**
 * Row-level operation carried by a {@link ChangeEvent}.
 */
public enum ChangeOperation {
    /**
     * A row was inserted. Only the new row snapshot is present.
     */
    INSERT,

    /**
     * A row was updated. The new row is always present; the old row is present
     * when the backend publishes full row images.
     */
    UPDATE,

    /**
     * A row was deleted. Only the old row snapshot is present, and it may be
     * limited to the primary key.
     */
    DELETE;

    /**
     * Parses an operation name case-insensitively, as published by the backend
     * (e.g. {@code "INSERT"}, {@code "update"}).
     *
     * @param value the operation name
     * @return the operation
     * @throws IllegalArgumentException if the value is null or not a known operation
     */
    public static ChangeOperation parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Change operation cannot be null");
        }
        return ChangeOperation.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
