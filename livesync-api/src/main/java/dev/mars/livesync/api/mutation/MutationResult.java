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
package dev.mars.livesync.api.mutation;

import dev.mars.livesync.api.error.LiveSyncError;

/**
 * Outcome of a user-initiated mutation.
 *
 * @param succeeded    whether the backend accepted the write
 * @param rowsAffected rows changed, 0 on failure
 * @param error        the failure, null on success
 */
public record MutationResult(boolean succeeded, int rowsAffected, LiveSyncError error) {

    public static MutationResult succeeded(int rowsAffected) {
        return new MutationResult(true, rowsAffected, null);
    }

    public static MutationResult failed(LiveSyncError error) {
        return new MutationResult(false, 0, error);
    }
}
