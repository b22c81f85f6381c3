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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.bankingstage.config.BankingStageProperties;
import de.makibytes.bankingstage.metrics.BankingStageMetrics;
import de.makibytes.bankingstage.model.AccountUse;
import de.makibytes.bankingstage.model.BlockEvent;
import de.makibytes.bankingstage.model.BlockInfo;
import de.makibytes.bankingstage.model.BlockTransaction;
import de.makibytes.bankingstage.model.TransactionInfo;
import de.makibytes.bankingstage.model.TransactionNotification;
import de.makibytes.bankingstage.storage.RecordingBankingStageStore;
import de.makibytes.bankingstage.storage.StorageConnectionLostException;
import de.makibytes.bankingstage.store.ErrorTally;
import de.makibytes.bankingstage.store.SlotWatermark;
import de.makibytes.bankingstage.store.TransactionIndex;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@DisplayName("BlockProcessor")
class BlockProcessorTest {

    private final TransactionIndex index = new TransactionIndex();
    private final ErrorTally tally = new ErrorTally();
    private final SlotWatermark watermark = new SlotWatermark();
    private final RecordingBankingStageStore store = new RecordingBankingStageStore();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final BankingStageMetrics metrics = new BankingStageMetrics(registry);
    private final NotificationHandler notificationHandler = new NotificationHandler(tally, index, metrics);
    private final List<Throwable> fatalErrors = new ArrayList<>();
    private BlockDelayQueue queue;
    private BlockProcessor processor;

    private BlockProcessor processor(Duration hold) {
        queue = new BlockDelayQueue(hold);
        processor = new BlockProcessor(queue, index, tally, new BlockInfoFactory(new BankingStageProperties()),
                store, watermark, metrics, (component, error) -> fatalErrors.add(error));
        return processor;
    }

    @AfterEach
    void tearDown() {
        if (processor != null) {
            processor.stop();
        }
    }

    private static BlockTransaction tx(String signature, boolean success) {
        return new BlockTransaction(signature, success, 1_000, 2_000, 50,
                List.of(new AccountUse("acc", true)));
    }

    private static BlockEvent block(long slot, BlockTransaction... transactions) {
        return new BlockEvent(slot, "hash-" + slot, "leader", List.of(transactions));
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("counts an error notification that arrives while its block is held")
    void notificationDuringHold() throws InterruptedException {
        processor(Duration.ofMillis(300)).start();

        queue.offer(block(100, tx("tx1", false), tx("tx2", true)));
        notificationHandler.handle(new TransactionNotification("tx1", 100, "AccountInUse"));
        awaitCondition(() -> !store.getBlocks().isEmpty());

        BlockInfo info = store.getBlocks().get(0);
        assertEquals(100, info.getSlot());
        assertEquals(1L, info.getBankingStageErrors());
        assertEquals(1, info.getTransactionErrors());
        TransactionInfo tx1 = index.find("tx1").orElseThrow();
        assertTrue(tx1.isExecuted());
        assertEquals(100L, tx1.getProcessedSlot());
        assertTrue(index.find("tx2").isEmpty());
        assertEquals(100, watermark.get());
    }

    @Test
    @DisplayName("misses an error notification that arrives after its block was processed")
    void notificationAfterRelease() throws InterruptedException {
        processor(Duration.ofMillis(20)).start();

        queue.offer(block(100, tx("tx1", false), tx("tx2", true)));
        awaitCondition(() -> !store.getBlocks().isEmpty());
        notificationHandler.handle(new TransactionNotification("tx1", 100, "AccountInUse"));

        assertNull(store.getBlocks().get(0).getBankingStageErrors());
        TransactionInfo tx1 = index.find("tx1").orElseThrow();
        assertFalse(tx1.isExecuted());
        assertEquals(1, tx1.getErrorCount());
    }

    @Test
    @DisplayName("skips and counts transactions without signature")
    void malformedTransaction() {
        processor(Duration.ZERO);
        notificationHandler.handle(new TransactionNotification("tx1", 7, "AccountInUse"));

        BlockInfo info = processor.process(block(7, tx(null, true), tx("tx1", true)));

        assertEquals(2, info.getProcessedTransactions());
        assertEquals(1.0, registry.get("bankingstage_malformed_transactions_counter").counter().count());
        assertTrue(index.find("tx1").orElseThrow().isExecuted());
        assertEquals(1, store.getBlocks().size());
    }

    @Test
    @DisplayName("persists each block once and advances the watermark monotonically")
    void watermarkMonotonic() {
        processor(Duration.ZERO);

        processor.process(block(12));
        processor.process(block(10));
        processor.process(block(13));

        assertEquals(13, watermark.get());
        assertEquals(List.of(12L, 10L, 13L), store.getBlocks().stream().map(BlockInfo::getSlot).toList());
        assertEquals(13.0, registry.get("bankingstage_slot_watermark").gauge().value());
    }

    @Test
    @DisplayName("keeps processing after a failed block write")
    void persistenceFailure() {
        processor(Duration.ZERO);
        store.failBlockWhen(info -> info.getSlot() == 20);

        processor.process(block(20));
        processor.process(block(21));

        assertEquals(List.of(21L), store.getBlocks().stream().map(BlockInfo::getSlot).toList());
        assertEquals(21, watermark.get());
        assertEquals(1.0, registry.get("bankingstage_persistence_failures_counter")
                .tag("record", "block").counter().count());
        assertTrue(fatalErrors.isEmpty());
    }

    @Test
    @DisplayName("reports a lost storage connection as fatal")
    void lostConnection() {
        processor(Duration.ZERO);
        store.loseConnection();

        processor.process(block(30));

        assertEquals(1, fatalErrors.size());
        assertInstanceOf(StorageConnectionLostException.class, fatalErrors.get(0));
    }

    @Test
    @DisplayName("updates the error gauges per processed block")
    void errorGauges() {
        processor(Duration.ZERO);
        notificationHandler.handle(new TransactionNotification("tx1", 40, "AccountInUse"));
        notificationHandler.handle(new TransactionNotification("tx2", 40, "AccountInUse"));

        processor.process(block(40, tx("tx1", false), tx("tx2", false), tx("tx3", true)));

        assertEquals(2.0, registry.get("bankingstage_banking_errors").gauge().value());
        assertEquals(2.0, registry.get("bankingstage_txerrors").gauge().value());
    }

    @Test
    @DisplayName("stop processes held blocks without waiting for their hold")
    void stopDrainsHeldBlocks() {
        processor(Duration.ofMinutes(5)).start();
        queue.offer(block(50));
        queue.offer(block(51));

        processor.stop();

        assertFalse(processor.isRunning());
        assertEquals(List.of(50L, 51L), store.getBlocks().stream().map(BlockInfo::getSlot).toList());
        assertEquals(0, queue.size());
    }
}
