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

/**
 * Standard error codes for the live sync layer.
 *
 * Error code ranges:
 * - LSYNCERR0001-0049: General/System errors
 * - LSYNCERR0050-0099: Subscription errors
 * - LSYNCERR0100-0149: Baseline errors
 * - LSYNCERR0150-0199: Event errors
 * - LSYNCERR0200-0249: Mutation errors
 * - LSYNCERR0250-0299: Write queue errors
 */
public final class LiveSyncErrorCodes {

    private LiveSyncErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General/System Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "LSYNCERR0001";
    public static final String NO_ACTIVE_SESSION = "LSYNCERR0002";

    // ========================================================================
    // Subscription Errors (0050-0099)
    // ========================================================================
    public static final String CHANNEL_ERROR = "LSYNCERR0050";
    public static final String RECONNECT_EXHAUSTED = "LSYNCERR0051";

    // ========================================================================
    // Baseline Errors (0100-0149)
    // ========================================================================
    public static final String BASELINE_FAILED = "LSYNCERR0100";

    // ========================================================================
    // Event Errors (0150-0199)
    // ========================================================================
    public static final String MALFORMED_EVENT = "LSYNCERR0150";

    // ========================================================================
    // Mutation Errors (0200-0249)
    // ========================================================================
    public static final String MUTATION_FAILED = "LSYNCERR0200";
    public static final String MARK_ALL_READ_FAILED = "LSYNCERR0201";

    // ========================================================================
    // Write Queue Errors (0250-0299)
    // ========================================================================
    public static final String QUEUE_FULL = "LSYNCERR0250";
}
