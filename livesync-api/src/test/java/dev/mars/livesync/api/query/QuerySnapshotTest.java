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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class QuerySnapshotTest {

    @Test
    @DisplayName("covers() includes events committed at or before asOf")
    void covers_atOrBeforeAsOf() {
        Instant asOf = Instant.parse("2026-02-10T10:00:00Z");
        QuerySnapshot<Long> snapshot = QuerySnapshot.of(2L, asOf);

        assertTrue(snapshot.covers(asOf));
        assertTrue(snapshot.covers(asOf.minusMillis(1)));
        assertFalse(snapshot.covers(asOf.plusMillis(1)));
        assertFalse(snapshot.covers(null));
    }

    @Test
    @DisplayName("asOf is required")
    void asOf_required() {
        assertThrows(NullPointerException.class, () -> QuerySnapshot.of(1L, null));
    }
}
