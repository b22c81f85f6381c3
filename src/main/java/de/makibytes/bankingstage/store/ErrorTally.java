/*
 * Copyright (c) 2026 MakiBytes.
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
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package de.makibytes.bankingstage.store;

import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

/**
 * Number of banking stage errors observed per slot, drained once per slot by the
 * block processor.
 */
@Component
public class ErrorTally {

    private final Map<Long, Long> errorsBySlot = new ConcurrentHashMap<>();

    public void recordError(long slot) {
        errorsBySlot.merge(slot, 1L, Long::sum);
    }

    /**
     * Reads and removes the count for {@code slot}. Empty when no error was
     * recorded, which is the usual case.
     */
    public OptionalLong take(long slot) {
        Long count = errorsBySlot.remove(slot);
        return count == null ? OptionalLong.empty() : OptionalLong.of(count);
    }

    /**
     * Drops counts of slots below {@code slot} whose block never arrived.
     *
     * @return number of dropped slots
     */
    public int pruneBelow(long slot) {
        int pruned = 0;
        for (Long key : errorsBySlot.keySet()) {
            if (key < slot && errorsBySlot.remove(key) != null) {
                pruned++;
            }
        }
        return pruned;
    }

    public int size() {
        return errorsBySlot.size();
    }
}
