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

import java.time.Duration;

/**
 * How a subscription is re-established after a channel error.
 *
 * <p>{@link BackoffMode#FIXED} waits the initial delay before every attempt.
 * {@link BackoffMode#EXPONENTIAL} multiplies the delay after each attempt and
 * caps it at the maximum delay. A {@code maxAttempts} of 0 retries forever.
 */
public class ReconnectPolicy {

    public enum BackoffMode {
        FIXED,
        EXPONENTIAL
    }

    private static final Duration MAX_ALLOWED_DELAY = Duration.ofHours(1);

    private final BackoffMode mode;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private ReconnectPolicy(Builder builder) {
        this.mode = builder.mode;
        this.initialDelay = builder.initialDelay;
        this.maxDelay = builder.maxDelay;
        this.multiplier = builder.multiplier;
        this.maxAttempts = builder.maxAttempts;
    }

    public BackoffMode getMode() { return mode; }
    public Duration getInitialDelay() { return initialDelay; }
    public Duration getMaxDelay() { return maxDelay; }
    public double getMultiplier() { return multiplier; }
    public int getMaxAttempts() { return maxAttempts; }

    /**
     * Delay before the given reconnect attempt.
     *
     * @param attempt 1 for the first reconnect after an error
     * @return the delay, never longer than the max delay
     */
    public Duration delayForAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt must be at least 1, got: " + attempt);
        }
        if (mode == BackoffMode.FIXED) {
            return initialDelay;
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    /**
     * @return true if the given attempt would exceed {@code maxAttempts}
     */
    public boolean isExhausted(int attempt) {
        return maxAttempts > 0 && attempt > maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fixed five second retry with no attempt limit.
     */
    public static ReconnectPolicy defaultPolicy() {
        return builder().build();
    }

    public static ReconnectPolicy fixed(Duration delay) {
        return builder().mode(BackoffMode.FIXED).initialDelay(delay).maxDelay(delay).build();
    }

    public static class Builder {
        private BackoffMode mode = BackoffMode.FIXED;
        private Duration initialDelay = Duration.ofSeconds(5);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private int maxAttempts = 0;

        public Builder mode(BackoffMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public ReconnectPolicy build() {
            if (mode == null) {
                throw new NullPointerException("Backoff mode cannot be null");
            }
            if (initialDelay == null) {
                throw new NullPointerException("Initial delay cannot be null");
            }
            if (maxDelay == null) {
                throw new NullPointerException("Max delay cannot be null");
            }
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive, got: " + initialDelay);
            }
            if (initialDelay.compareTo(MAX_ALLOWED_DELAY) > 0) {
                throw new IllegalArgumentException("Initial delay too large (maximum 1 hour), got: " + initialDelay);
            }
            if (maxDelay.compareTo(MAX_ALLOWED_DELAY) > 0) {
                throw new IllegalArgumentException("Max delay too large (maximum 1 hour), got: " + maxDelay);
            }
            if (mode == BackoffMode.EXPONENTIAL) {
                if (maxDelay.compareTo(initialDelay) < 0) {
                    throw new IllegalArgumentException("Max delay must not be shorter than initial delay, got: "
                        + maxDelay + " < " + initialDelay);
                }
                if (multiplier < 1.0 || Double.isNaN(multiplier)) {
                    throw new IllegalArgumentException("Multiplier must be at least 1.0, got: " + multiplier);
                }
            }
            if (maxAttempts < 0) {
                throw new IllegalArgumentException("Max attempts must not be negative, got: " + maxAttempts);
            }
            return new ReconnectPolicy(this);
        }
    }

    @Override
    public String toString() {
        return "ReconnectPolicy{" +
                "mode=" + mode +
                ", initialDelay=" + initialDelay +
                ", maxDelay=" + maxDelay +
                ", multiplier=" + multiplier +
                ", maxAttempts=" + maxAttempts +
                '}';
    }
}
