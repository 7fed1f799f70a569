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

import dev.mars.livesync.api.cache.CacheInvalidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs a host-supplied {@link CacheInvalidator} on the writer context. A
 * failing invalidator is logged and never reaches the caller.
 */
final class CacheInvalidation {
    private static final Logger logger = LoggerFactory.getLogger(CacheInvalidation.class);

    private CacheInvalidation() {
    }

    static void invalidate(CacheInvalidator invalidator, List<String> keyPrefix) {
        try {
            invalidator.invalidate(keyPrefix);
        } catch (Exception e) {
            logger.warn("Cache invalidation of {} failed: {}", keyPrefix, e.getMessage(), e);
        }
    }
}
