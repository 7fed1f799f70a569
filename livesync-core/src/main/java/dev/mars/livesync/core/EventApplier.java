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

import dev.mars.livesync.api.change.ChangeEvent;
import dev.mars.livesync.api.change.ChangeSubscription;

/**
 * Turns a change event into a state transition on a local aggregate.
 *
 * <p>Implementations are called on the writer context only and never throw:
 * problems with an event are reported through the returned outcome.
 */
public interface EventApplier {

    /**
     * Applies one event.
     *
     * @param event the event
     * @return what happened to it
     */
    ApplyOutcome apply(ChangeEvent event);

    /**
     * Starts a new scope: events outside {@code scope} are ignored from now on and
     * the memory of applied events is cleared.
     *
     * @param scope the subscription the applier serves, or null to accept nothing until the next reset
     */
    void reset(ChangeSubscription scope);
}
