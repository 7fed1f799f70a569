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
package dev.mars.livesync.core.metrics;

import dev.mars.livesync.core.ApplyOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for the sync layer. Recording before {@link #bindTo} is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public class LiveSyncMetrics implements MeterBinder {

    private final String instanceId;
    private volatile MeterRegistry registry;

    private Counter channelErrors;
    private Counter reconnects;
    private Counter baselineFailures;
    private Counter mutationFailures;
    private Counter queueRejections;

    private final AtomicLong activeSubscriptions = new AtomicLong(0);

    public LiveSyncMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    /**
     * Metrics instance that is never bound.
     */
    public static LiveSyncMetrics noop() {
        return new LiveSyncMetrics("noop");
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        channelErrors = Counter.builder("livesync.channel.errors")
            .description("Total number of CHANNEL_ERROR transitions")
            .tag("instance", instanceId)
            .register(registry);

        reconnects = Counter.builder("livesync.reconnects")
            .description("Total number of reconnect attempts")
            .tag("instance", instanceId)
            .register(registry);

        baselineFailures = Counter.builder("livesync.baseline.failures")
            .description("Total number of failed baseline fetches")
            .tag("instance", instanceId)
            .register(registry);

        mutationFailures = Counter.builder("livesync.mutations.failed")
            .description("Total number of failed mutations")
            .tag("instance", instanceId)
            .register(registry);

        queueRejections = Counter.builder("livesync.queue.rejected")
            .description("Total number of tasks rejected by a full write queue")
            .tag("instance", instanceId)
            .register(registry);

        Gauge.builder("livesync.subscriptions.active", activeSubscriptions, AtomicLong::get)
            .description("Number of subscriptions currently in SUBSCRIBED state")
            .tag("instance", instanceId)
            .register(registry);
    }

    public void recordEventOutcome(String feed, ApplyOutcome outcome) {
        if (registry != null) {
            Counter.builder("livesync.events")
                .tag("instance", instanceId)
                .tag("feed", feed)
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
        }
    }

    public void recordChannelError(String feed) {
        if (channelErrors != null) {
            channelErrors.increment();
        }
        recordByFeed("livesync.channel.errors.by.feed", feed);
    }

    public void recordReconnect(String feed) {
        if (reconnects != null) {
            reconnects.increment();
        }
        recordByFeed("livesync.reconnects.by.feed", feed);
    }

    public void recordReconnectExhausted(String feed) {
        recordByFeed("livesync.reconnects.exhausted", feed);
    }

    public void recordBaselineFailure(String feed) {
        if (baselineFailures != null) {
            baselineFailures.increment();
        }
        recordByFeed("livesync.baseline.failures.by.feed", feed);
    }

    public void recordMutation(String operation, boolean succeeded) {
        if (!succeeded && mutationFailures != null) {
            mutationFailures.increment();
        }
        if (registry != null) {
            Counter.builder("livesync.mutations")
                .tag("instance", instanceId)
                .tag("operation", operation)
                .tag("result", succeeded ? "success" : "failure")
                .register(registry)
                .increment();
        }
    }

    public void recordQueueRejection(String queue) {
        if (queueRejections != null) {
            queueRejections.increment();
        }
        recordByFeed("livesync.queue.rejected.by.feed", queue);
    }

    public void subscriptionActivated() {
        activeSubscriptions.incrementAndGet();
    }

    public void subscriptionDeactivated() {
        activeSubscriptions.updateAndGet(v -> Math.max(0, v - 1));
    }

    public long getActiveSubscriptions() {
        return activeSubscriptions.get();
    }

    private void recordByFeed(String name, String feed) {
        if (registry != null) {
            Counter.builder(name)
                .tag("instance", instanceId)
                .tag("feed", feed)
                .register(registry)
                .increment();
        }
    }
}
