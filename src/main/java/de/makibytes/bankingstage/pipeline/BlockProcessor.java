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

import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import de.makibytes.bankingstage.metrics.BankingStageMetrics;
import de.makibytes.bankingstage.model.BlockEvent;
import de.makibytes.bankingstage.model.BlockInfo;
import de.makibytes.bankingstage.model.BlockTransaction;
import de.makibytes.bankingstage.storage.BankingStageStore;
import de.makibytes.bankingstage.storage.StorageConnectionLostException;
import de.makibytes.bankingstage.storage.StorageException;
import de.makibytes.bankingstage.store.ErrorTally;
import de.makibytes.bankingstage.store.SlotWatermark;
import de.makibytes.bankingstage.store.TransactionIndex;

/**
 * Single consumer of the {@link BlockDelayQueue}. Every released block is merged
 * into the transaction index, paired with the banking stage errors of its slot,
 * persisted once and then advances the slot watermark.
 */
@Component
public class BlockProcessor {

    private static final Logger logger = LoggerFactory.getLogger(BlockProcessor.class);
    private static final long POLL_INTERVAL_MS = 200;

    private final BlockDelayQueue delayQueue;
    private final TransactionIndex transactionIndex;
    private final ErrorTally errorTally;
    private final BlockInfoFactory blockInfoFactory;
    private final BankingStageStore store;
    private final SlotWatermark watermark;
    private final BankingStageMetrics metrics;
    private final FatalErrorHandler fatalErrorHandler;
    private ExecutorService executor;
    private volatile boolean running;

    public BlockProcessor(BlockDelayQueue delayQueue,
                          TransactionIndex transactionIndex,
                          ErrorTally errorTally,
                          BlockInfoFactory blockInfoFactory,
                          BankingStageStore store,
                          SlotWatermark watermark,
                          BankingStageMetrics metrics,
                          FatalErrorHandler fatalErrorHandler) {
        this.delayQueue = delayQueue;
        this.transactionIndex = transactionIndex;
        this.errorTally = errorTally;
        this.blockInfoFactory = blockInfoFactory;
        this.store = store;
        this.watermark = watermark;
        this.metrics = metrics;
        this.fatalErrorHandler = fatalErrorHandler;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        executor = Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, "block-processor"));
        executor.submit(this::consume);
    }

    /**
     * Stops the consumer and processes every block still held, without waiting
     * for the remaining holds to elapse.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Block processor did not stop within 30s");
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        List<BlockEvent> remaining = delayQueue.drainAll();
        if (!remaining.isEmpty()) {
            logger.info("Processing {} held blocks before shutdown", remaining.size());
        }
        for (BlockEvent block : remaining) {
            process(block);
        }
        metrics.recordDelayQueueDepth(delayQueue.size());
    }

    public boolean isRunning() {
        return running;
    }

    private void consume() {
        while (running) {
            try {
                BlockEvent block = delayQueue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (block == null) {
                    continue;
                }
                metrics.recordDelayQueueDepth(delayQueue.size());
                process(block);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                logger.warn("Block processor interrupted");
                return;
            } catch (RuntimeException ex) {
                logger.error("Block processing failure: {}", ex.getMessage(), ex);
            }
        }
    }

    public BlockInfo process(BlockEvent block) {
        int merged = 0;
        for (BlockTransaction transaction : block.transactions()) {
            if (!transaction.hasSignature()) {
                logger.warn("Skipping transaction without signature in block {}", block.slot());
                metrics.recordMalformedTransaction();
                continue;
            }
            if (transactionIndex.mergeInclusion(transaction.signature(), block.slot(), transaction)) {
                merged++;
            }
        }

        OptionalLong bankingStageErrors = errorTally.take(block.slot());
        BlockInfo blockInfo = blockInfoFactory.create(block,
                bankingStageErrors.isPresent() ? bankingStageErrors.getAsLong() : null);
        metrics.recordProcessedBlock(blockInfo);
        logger.debug("Processed block {}: {} transactions, {} tracked, {} banking stage errors",
                block.slot(), blockInfo.getProcessedTransactions(), merged, blockInfo.getBankingStageErrors());

        try {
            store.saveBlock(blockInfo);
        } catch (StorageConnectionLostException ex) {
            metrics.recordBlockPersistenceFailure();
            fatalErrorHandler.onFatalError("block processor", ex);
        } catch (StorageException ex) {
            logger.error("Error saving block {}: {}", block.slot(), ex.getMessage());
            metrics.recordBlockPersistenceFailure();
        }
        watermark.advanceTo(block.slot());
        return blockInfo;
    }
}
