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
package dev.mars.livesync.api.lifecycle;

import io.vertx.core.Future;

import java.util.concurrent.CompletableFuture;

/**
 * Close contract for sync objects that own subscriptions and timers.
 */
public interface ReactiveCloseable {
    /** A short, human-readable name for logging. */
    String name();

    /** Reactive close. Must be non-blocking. Safe to call multiple times. */
    Future<Void> closeReactive();

    /** CompletableFuture variant for non-Vert.x consumers. */
    default CompletableFuture<Void> closeAsync() {
        return closeReactive().toCompletionStage().toCompletableFuture();
    }
}
