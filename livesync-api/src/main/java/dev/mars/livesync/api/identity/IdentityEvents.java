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
package dev.mars.livesync.api.identity;

import io.vertx.core.Future;

/**
 * Source of the current user and of sign-in/sign-out transitions.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public interface IdentityEvents {

    /**
     * @return the signed-in user id, or a future completing with null when nobody is signed in
     */
    Future<String> currentUserId();

    /**
     * Registers a listener for identity transitions.
     *
     * @param listener the listener
     * @return a registration used to stop receiving events
     */
    IdentityRegistration register(IdentityListener listener);
}
