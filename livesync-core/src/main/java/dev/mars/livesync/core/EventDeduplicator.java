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

import java.util.LinkedHashSet;
import java.util.Iterator;

/**
 * Bounded window of recently applied event keys. The oldest key is evicted
 * once the window is full. Not thread-safe; used on the writer context only.
 */
public class EventDeduplicator {

    private final int windowSize;
    private final LinkedHashSet<String> seen = new LinkedHashSet<>();

    public EventDeduplicator(int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("Window size must be positive, got: " + windowSize);
        }
        this.windowSize = windowSize;
    }

    /**
     * @param key the event key, may be null
     * @return true if the key has been recorded and is still within the window
     */
    public boolean isDuplicate(String key) {
        return key != null && seen.contains(key);
    }

    /**
     * Records a key. Null keys are not recorded.
     */
    public void record(String key) {
        if (key == null || !seen.add(key)) {
            return;
        }
        if (seen.size() > windowSize) {
            Iterator<String> oldest = seen.iterator();
            oldest.next();
            oldest.remove();
        }
    }

    public int size() {
        return seen.size();
    }

    public void clear() {
        seen.clear();
    }
}
