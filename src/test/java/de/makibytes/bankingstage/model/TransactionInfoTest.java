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
package de.makibytes.bankingstage.model;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class TransactionInfoTest {

    @Test
    void accountStaysWritableOnceSeenWritable() {
        TransactionInfo info = new TransactionInfo("sig", 1, Instant.EPOCH);

        info.addInclusion(new BlockTransaction("sig", true, 1, 1, 0, List.of(new AccountUse("a", true))), 2);
        info.addInclusion(new BlockTransaction("sig", true, 1, 1, 0, List.of(new AccountUse("a", false))), 3);

        assertEquals(Boolean.TRUE, info.getAccountsUsed().get("a"));
        assertEquals(3L, info.getProcessedSlot());
    }

    @Test
    void ignoresNotificationWithoutError() {
        TransactionInfo info = new TransactionInfo("sig", 1, Instant.EPOCH);

        info.addNotification(new TransactionNotification("sig", 1, (String) null));

        assertTrue(info.getErrors().isEmpty());
    }

    @Test
    void exposesErrorsReadOnly() {
        TransactionInfo info = new TransactionInfo("sig", 1, Instant.EPOCH);
        info.addNotification(new TransactionNotification("sig", 1, "AccountInUse"));

        assertThrows(UnsupportedOperationException.class,
                () -> info.getErrors().put(new ErrorKey("x", 1), 1));
    }
}
