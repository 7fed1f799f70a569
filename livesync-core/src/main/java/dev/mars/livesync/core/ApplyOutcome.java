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

/**
 * What happened to a change event once it reached the writer.
 */
public enum ApplyOutcome {
    /** The event changed, or was allowed to change, the local aggregate. */
    APPLIED,
    /** The event belongs to another table or owner, or carries no relevant transition. */
    IGNORED,
    /** The event was already applied once. */
    DUPLICATE,
    /** The event is older than the state already held for its row. */
    STALE,
    /** The event was committed before the current baseline and is already reflected in it. */
    COVERED,
    /** The event could not be interpreted and was dropped. */
    MALFORMED
}
