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

import dev.mars.livesync.api.lifecycle.ReactiveCloseable;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One user's (or one global feed's) live sync lifetime, from
 * {@link SubscriptionManager#open(String)} until {@link #closeReactive()} or
 * until superseded by a newer session on the same manager.
 */
public class SyncSession implements ReactiveCloseable {

    private final SubscriptionManager<?> manager;
    private final String userId;
    private final Promise<Void> ready = Promise.promise();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    SyncSession(SubscriptionManager<?> manager, String userId) {
        this.manager = manager;
        this.userId = userId;
    }

    public String userId() {
        return userId;
    }

    public boolean isOpen() {
        return !closed.get();
    }

    /**
     * Completes once the first baseline has been applied, or when the session
     * ends before that. Fails if the first baseline could not be fetched; the
     * session keeps retrying in the background.
     */
    public Future<Void> ready() {
        return ready.future();
    }

    @Override
    public String name() {
        return "sync-session-" + manager.feed() + (userId != null ? "-" + userId : "");
    }

    @Override
    public Future<Void> closeReactive() {
        if (!closed.compareAndSet(false, true)) {
            return Future.succeededFuture();
        }
        ready.tryComplete();
        return manager.close(this);
    }

    void superseded() {
        closed.set(true);
        ready.tryComplete();
    }

    void completeReady(AsyncResult<Void> result) {
        if (result.succeeded()) {
            ready.tryComplete();
        } else {
            ready.tryFail(result.cause());
        }
    }

    @Override
    public String toString() {
        return "SyncSession{feed=" + manager.feed() + ", userId=" + userId + ", open=" + isOpen() + "}";
    }
}
