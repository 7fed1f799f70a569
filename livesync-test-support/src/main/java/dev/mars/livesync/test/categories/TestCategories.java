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
package dev.mars.livesync.test.categories;

/**
 * Test category constants for JUnit 5 {@code @Tag} annotations.
 *
 * <ul>
 *   <li><strong>CORE</strong> - Fast unit tests against in-memory collaborators</li>
 *   <li><strong>INTEGRATION</strong> - Tests with TestContainers and a real PostgreSQL</li>
 *   <li><strong>SLOW</strong> - Tests that wait on real reconnect timers</li>
 *   <li><strong>FLAKY</strong> - Unstable tests needing investigation</li>
 * </ul>
 *
 * <pre>{@code
 * mvn test                 # core tests
 * mvn verify               # adds the *IT integration tests via failsafe
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 * @see org.junit.jupiter.api.Tag
 */
public final class TestCategories {

    /**
     * Core tests - no external infrastructure, each under a second.
     */
    public static final String CORE = "core";

    /**
     * Integration tests - TestContainers with real PostgreSQL.
     */
    public static final String INTEGRATION = "integration";

    /**
     * Slow tests - wait on real timers or long event sequences.
     */
    public static final String SLOW = "slow";

    /**
     * Flaky tests - excluded from regular runs until fixed.
     */
    public static final String FLAKY = "flaky";

    private TestCategories() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }
}
