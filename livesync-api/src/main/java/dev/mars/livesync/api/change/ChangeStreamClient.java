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

import io.vertx.core.Future;
import io.vertx.core.Handler;

/**
 * Push-based feed of row changes from the backend.
 *
 * <p>Delivery is at-least-once and may be unordered across reconnects.
 * Handlers may be invoked on any thread; callers that need a single writer
 * must re-dispatch onto their own context.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public interface ChangeStreamClient {

    /**
     * Opens a subscription. The returned handle starts in
     * {@link ChannelStatus#CONNECTING}; every later status transition is
     * reported to {@code statusHandler}.
     *
     * @param subscription  table, row filter and operations to deliver
     * @param eventHandler  receives each matching change
     * @param statusHandler receives status transitions
     * @return the subscription handle
     */
    SubscriptionHandle subscribe(ChangeSubscription subscription,
                                 Handler<ChangeEvent> eventHandler,
                                 Handler<ChannelStatus> statusHandler);

    /**
     * Closes a subscription. No events are delivered for the handle once the
     * returned future completes. Unsubscribing a closed handle is a no-op.
     *
     * @param handle the handle returned by {@link #subscribe}
     * @return a future completing when the backend resource is released
     */
    Future<Void> unsubscribe(SubscriptionHandle handle);
}
