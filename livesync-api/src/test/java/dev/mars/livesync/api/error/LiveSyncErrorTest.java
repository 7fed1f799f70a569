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

import dev.mars.livesync.api.mutation.MutationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LiveSyncErrorTest {

    @Test
    @DisplayName("markAllReadFailed() carries the code and cause message")
    void markAllReadFailed_carriesCause() {
        LiveSyncError error = LiveSyncError.markAllReadFailed("u1", new RuntimeException("connection reset"));

        assertEquals(LiveSyncErrorCodes.MARK_ALL_READ_FAILED, error.code());
        assertTrue(error.message().contains("u1"));
        assertEquals("connection reset", error.details());
        assertNotNull(error.timestamp());
    }

    @Test
    @DisplayName("cause without message is described by its type")
    void describe_usesTypeWhenNoMessage() {
        LiveSyncError error = LiveSyncError.mutationFailed("notifications", new IllegalStateException());

        assertEquals("IllegalStateException", error.details());
    }

    @Test
    @DisplayName("LiveSyncException exposes the error code")
    void exception_exposesCode() {
        LiveSyncException ex = new LiveSyncException(LiveSyncError.noActiveSession("markAllAsRead"));

        assertEquals(LiveSyncErrorCodes.NO_ACTIVE_SESSION, ex.getCode());
        assertTrue(ex.getMessage().startsWith("LSYNCERR0002"));
    }

    @Test
    @DisplayName("failed mutation results report zero rows")
    void mutationResult_failed() {
        MutationResult result = MutationResult.failed(LiveSyncError.internalError("boom"));

        assertFalse(result.succeeded());
        assertEquals(0, result.rowsAffected());
        assertEquals(LiveSyncErrorCodes.INTERNAL_ERROR, result.error().code());
        assertTrue(MutationResult.succeeded(3).succeeded());
    }
}
