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
package dev.mars.livesync.core.config;

import dev.mars.livesync.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class LiveSyncConfigurationTest {

    @Test
    @DisplayName("Defaults come from livesync-default.properties")
    void defaults() {
        LiveSyncConfiguration configuration = new LiveSyncConfiguration("default");

        ReconnectPolicy policy = configuration.getReconnectPolicy();
        assertEquals(ReconnectPolicy.BackoffMode.FIXED, policy.getMode());
        assertEquals(Duration.ofSeconds(5), policy.getInitialDelay());
        assertEquals(0, policy.getMaxAttempts());

        LiveSyncConfiguration.SyncConfig sync = configuration.getSyncConfig();
        assertEquals(1024, sync.getQueueCapacity());
        assertEquals(1024, sync.getHoldBufferCapacity());
        assertEquals(4096, sync.getDedupWindowSize());
        assertEquals(20, sync.getFeedMaxItems());
        assertTrue(sync.isNotificationsEnabled());
        assertTrue(sync.isPostsEnabled());

        LiveSyncConfiguration.DatabaseConfig database = configuration.getDatabaseConfig();
        assertEquals("localhost", database.getHost());
        assertEquals(5432, database.getPort());
        assertEquals("livesync_changes", database.getChannel());
    }

    @Test
    void overridesWinOverDefaults() {
        LiveSyncConfiguration configuration = new LiveSyncConfiguration("default", Map.of(
            "livesync.reconnect.mode", "exponential",
            "livesync.reconnect.initial-delay", "PT1S",
            "livesync.reconnect.max-delay", "PT8S",
            "livesync.reconnect.max-attempts", "6",
            "livesync.feed.max-items", "50",
            "livesync.posts.enabled", "false"));

        ReconnectPolicy policy = configuration.getReconnectPolicy();
        assertEquals(ReconnectPolicy.BackoffMode.EXPONENTIAL, policy.getMode());
        assertEquals(Duration.ofSeconds(8), policy.delayForAttempt(10));
        assertEquals(6, policy.getMaxAttempts());
        assertEquals(50, configuration.getSyncConfig().getFeedMaxItems());
        assertFalse(configuration.getSyncConfig().isPostsEnabled());
    }

    @Test
    void unknownProfileFallsBackToDefaults() {
        LiveSyncConfiguration configuration = new LiveSyncConfiguration("no-such-profile");

        assertEquals("no-such-profile", configuration.getProfile());
        assertEquals(1024, configuration.getSyncConfig().getQueueCapacity());
    }

    @Test
    void unparseableValuesFallBackToDefaults() {
        LiveSyncConfiguration configuration = new LiveSyncConfiguration("default", Map.of(
            "livesync.queue.capacity", "lots"));

        assertEquals(1024, configuration.getSyncConfig().getQueueCapacity());
    }

    @Test
    @DisplayName("Every validation problem is reported at once")
    void invalidValues_areReportedTogether() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
            () -> new LiveSyncConfiguration("default", Map.of(
                "livesync.queue.capacity", "0",
                "livesync.reconnect.mode", "LINEAR",
                "livesync.pg.channel", "Bad-Channel")));

        assertTrue(error.getMessage().contains("Queue capacity must be between 1 and 1000000"));
        assertTrue(error.getMessage().contains("Reconnect mode must be FIXED or EXPONENTIAL"));
        assertTrue(error.getMessage().contains("PostgreSQL channel must be a lower-case identifier"));
    }

    @Test
    void requiredPropertyMissing_throws() {
        LiveSyncConfiguration configuration = new LiveSyncConfiguration("default");

        assertThrows(IllegalArgumentException.class, () -> configuration.getString("livesync.no.such.key"));
    }
}
