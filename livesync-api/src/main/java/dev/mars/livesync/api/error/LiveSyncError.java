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
package dev.mars.livesync.api.error;

import java.time.Instant;

/**
 * Immutable error record surfaced by sync operations.
 *
 * @param code      The standard error code (e.g., LSYNCERR0201)
 * @param message   Human-readable error message
 * @param timestamp When the error occurred
 * @param details   Optional additional details (can be null)
 */
public record LiveSyncError(
    String code,
    String message,
    Instant timestamp,
    String details
) {
    /**
     * Creates an error with code and message, using current timestamp.
     */
    public static LiveSyncError of(String code, String message) {
        return new LiveSyncError(code, message, Instant.now(), null);
    }

    /**
     * Creates an error with code, message, and details, using current timestamp.
     */
    public static LiveSyncError of(String code, String message, String details) {
        return new LiveSyncError(code, message, Instant.now(), details);
    }

    /**
     * Creates an error for a failed bulk mark-as-read.
     */
    public static LiveSyncError markAllReadFailed(String userId, Throwable cause) {
        return of(LiveSyncErrorCodes.MARK_ALL_READ_FAILED,
                  "Failed to mark notifications as read for user: " + userId,
                  describe(cause));
    }

    /**
     * Creates an error for a failed single-row mutation.
     */
    public static LiveSyncError mutationFailed(String table, Throwable cause) {
        return of(LiveSyncErrorCodes.MUTATION_FAILED,
                  "Mutation failed on table: " + table,
                  describe(cause));
    }

    /**
     * Creates an error for a failed baseline query.
     */
    public static LiveSyncError baselineFailed(String table, Throwable cause) {
        return of(LiveSyncErrorCodes.BASELINE_FAILED,
                  "Baseline fetch failed for table: " + table,
                  describe(cause));
    }

    /**
     * Creates an error for an event that could not be interpreted.
     */
    public static LiveSyncError malformedEvent(String table, String reason) {
        return of(LiveSyncErrorCodes.MALFORMED_EVENT,
                  "Malformed change event for table: " + table, reason);
    }

    /**
     * Creates an error for an operation that needs a signed-in user.
     */
    public static LiveSyncError noActiveSession(String operation) {
        return of(LiveSyncErrorCodes.NO_ACTIVE_SESSION,
                  "No active session for operation: " + operation);
    }

    /**
     * Creates an internal error.
     */
    public static LiveSyncError internalError(String message) {
        return of(LiveSyncErrorCodes.INTERNAL_ERROR, message);
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return null;
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
