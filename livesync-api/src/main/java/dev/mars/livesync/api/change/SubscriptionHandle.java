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
 * Live resource representing one change-stream subscription.
 */
public interface SubscriptionHandle {

    /**
     * @return a unique id for logging and identity comparisons
     */
    String id();

    /**
     * @return what this handle was opened for
     */
    ChangeSubscription subscription();

    /**
     * @return the last status reported for this handle
     */
    ChannelStatus status();

    /**
     * @return true until the handle reaches {@link ChannelStatus#CLOSED}
     */
    default boolean isActive() {
        return status() != ChannelStatus.CLOSED;
    }

    /**
     * @return the owning user, or null for global feeds
     */
    default String ownerUserId() {
        return subscription().ownerUserId();
    }
}
