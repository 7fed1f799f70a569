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
 * Unchecked exception carrying a {@link LiveSyncError}. Used to fail futures
 * with a coded error.
 */
public class LiveSyncException extends RuntimeException {

    private final transient LiveSyncError error;

    public LiveSyncException(LiveSyncError error) {
        super(error.code() + ": " + error.message());
        this.error = error;
    }

    public LiveSyncException(LiveSyncError error, Throwable cause) {
        super(error.code() + ": " + error.message(), cause);
        this.error = error;
    }

    public LiveSyncError getError() {
        return error;
    }

    public String getCode() {
        return error.code();
    }
}
