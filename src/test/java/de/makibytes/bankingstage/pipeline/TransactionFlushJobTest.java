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
package de.makibytes.bankingstage.pipeline;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.bankingstage.config.BankingStageProperties;
import de.makibytes.bankingstage.metrics.BankingStageMetrics;
import de.makibytes.bankingstage.model.TransactionInfo;
import de.makibytes.bankingstage.model.TransactionNotification;
import de.makibytes.bankingstage.storage.RecordingBankingStageStore;
import de.makibytes.bankingstage.storage.StorageConnectionLostException;
import de.makibytes.bankingstage.store.ErrorTally;
import de.makibytes.bankingstage.store.SlotWatermark;
import de.makibytes.bankingstage.store.TransactionIndex;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@DisplayName("TransactionFlushJob")
class TransactionFlushJobTest {

    private final TransactionIndex index = new TransactionIndex();
    private final ErrorTally tally = new ErrorTally();
    private final SlotWatermark watermark = new SlotWatermark();
    private final RecordingBankingStageStore store = new RecordingBankingStageStore();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final List<Throwable> fatalErrors = new ArrayList<>();
    private final TransactionFlushJob job = new TransactionFlushJob(index, tally, watermark, store,
            new BankingStageMetrics(registry), (component, error) -> fatalErrors.add(error),
            new BankingStageProperties());

    private void notify(String signature, long slot) {
        index.upsertNotification(new TransactionNotification(signature, slot, "AccountInUse"));
    }

    @Test
    @DisplayName("persists evicted entries in batches of eight")
    void batches() {
        for (int i = 0; i < 20; i++) {
            notify("sig" + i, 100);
        }
        watermark.advanceTo(401);

        job.flushCompletedTransactions();

        assertEquals(List.of(8, 8, 4), store.getTransactionBatches().stream().map(List::size).toList());
        assertEquals(0, index.size());
        assertEquals(20.0, registry.get("bankingstage_evicted_transactions_counter").counter().count());
    }

    @Test
    @DisplayName("evicts only entries older than the lag window")
    void lagWindow() {
        notify("old", 699);
        notify("older", 650);
        notify("boundary", 700);
        notify("fresh", 701);
        watermark.advanceTo(1000);

        job.flushCompletedTransactions();

        List<String> saved = store.getSavedTransactions().stream().map(TransactionInfo::getSignature).sorted().toList();
        assertEquals(List.of("old", "older"), saved);
        assertTrue(index.find("boundary").isPresent());
        assertTrue(index.find("fresh").isPresent());
        assertEquals(2.0, registry.get("bankingstage_tracked_transactions").gauge().value());
    }

    @Test
    @DisplayName("persists a transaction that was never included as not executed")
    void neverIncluded() {
        notify("orphan", 10);
        notify("orphan", 11);
        watermark.advanceTo(500);

        job.flushCompletedTransactions();

        TransactionInfo saved = store.getSavedTransactions().get(0);
        assertEquals("orphan", saved.getSignature());
        assertFalse(saved.isExecuted());
        assertNull(saved.getProcessedSlot());
        assertEquals(2, saved.getErrorCount());
    }

    @Test
    @DisplayName("a failed batch neither stops later batches nor returns to the index")
    void failedBatch() {
        for (int i = 0; i < 20; i++) {
            notify("sig" + i, 100);
        }
        watermark.advanceTo(1000);
        int[] calls = {0};
        store.failTransactionBatchWhen(batch -> ++calls[0] == 1);

        job.flushCompletedTransactions();

        assertEquals(3, store.getAttemptedTransactionBatches());
        assertEquals(List.of(8, 4), store.getTransactionBatches().stream().map(List::size).toList());
        assertEquals(0, index.size());
        assertEquals(1.0, registry.get("bankingstage_persistence_failures_counter")
                .tag("record", "transactions").counter().count());
        assertTrue(fatalErrors.isEmpty());
    }

    @Test
    @DisplayName("stops and reports a lost storage connection as fatal")
    void lostConnection() {
        for (int i = 0; i < 20; i++) {
            notify("sig" + i, 100);
        }
        watermark.advanceTo(1000);
        store.loseConnection();

        job.flushCompletedTransactions();

        assertEquals(1, store.getAttemptedTransactionBatches());
        assertEquals(1, fatalErrors.size());
        assertInstanceOf(StorageConnectionLostException.class, fatalErrors.get(0));
    }

    @Test
    @DisplayName("prunes error counts of slots whose block never arrived")
    void prunesErrorTally() {
        tally.recordError(100);
        tally.recordError(950);
        watermark.advanceTo(1000);

        job.flushCompletedTransactions();

        assertTrue(tally.take(100).isEmpty());
        assertTrue(tally.take(950).isPresent());
    }

    @Test
    @DisplayName("flushAll persists every entry and disables later flushes")
    void flushAll() {
        notify("a", 990);
        notify("b", 999);
        watermark.advanceTo(1000);

        job.flushAll();
        notify("late", 1);
        job.flushCompletedTransactions();

        assertEquals(2, store.getSavedTransactions().size());
        assertTrue(index.find("late").isPresent());
    }
}
