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

/**
 * Status of a change-stream subscription as reported by the backend.
 *
 * <p>Valid transitions:
 * <ul>
 *   <li>CONNECTING → SUBSCRIBED (events start flowing)</li>
 *   <li>CONNECTING / SUBSCRIBED → CHANNEL_ERROR (transient failure, the handle is dead)</li>
 *   <li>any → CLOSED (explicit teardown, terminal)</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public enum ChannelStatus {
    CONNECTING,
    SUBSCRIBED,
    CHANNEL_ERROR,
    CLOSED;

    /**
     * @return true for statuses after which the handle will not deliver events again
     */
    public boolean isTerminal() {
        return this == CHANNEL_ERROR || this == CLOSED;
    }
}
