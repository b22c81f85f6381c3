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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import de.makibytes.bankingstage.config.BankingStageProperties;
import de.makibytes.bankingstage.metrics.BankingStageMetrics;
import de.makibytes.bankingstage.model.TransactionInfo;
import de.makibytes.bankingstage.storage.BankingStageStore;
import de.makibytes.bankingstage.storage.StorageConnectionLostException;
import de.makibytes.bankingstage.storage.StorageException;
import de.makibytes.bankingstage.store.ErrorTally;
import de.makibytes.bankingstage.store.SlotWatermark;
import de.makibytes.bankingstage.store.TransactionIndex;

/**
 * Periodically evicts transactions whose first notification lies more than the
 * configured lag behind the slot watermark and persists them in small batches.
 * Evicted entries are never re-inserted, a failed batch is lost.
 */
@Component
public class TransactionFlushJob {

    private static final Logger logger = LoggerFactory.getLogger(TransactionFlushJob.class);

    private final TransactionIndex transactionIndex;
    private final ErrorTally errorTally;
    private final SlotWatermark watermark;
    private final BankingStageStore store;
    private final BankingStageMetrics metrics;
    private final FatalErrorHandler fatalErrorHandler;
    private final long lagSlots;
    private final int batchSize;
    private volatile boolean closed;

    public TransactionFlushJob(TransactionIndex transactionIndex,
                               ErrorTally errorTally,
                               SlotWatermark watermark,
                               BankingStageStore store,
                               BankingStageMetrics metrics,
                               FatalErrorHandler fatalErrorHandler,
                               BankingStageProperties properties) {
        this.transactionIndex = transactionIndex;
        this.errorTally = errorTally;
        this.watermark = watermark;
        this.store = store;
        this.metrics = metrics;
        this.fatalErrorHandler = fatalErrorHandler;
        this.lagSlots = properties.getPipeline().getEvictionLagSlots();
        this.batchSize = properties.getPipeline().getEvictionBatchSize();
    }

    @Scheduled(fixedDelayString = "${banking-stage.pipeline.eviction-interval-ms:60000}",
            initialDelayString = "${banking-stage.pipeline.eviction-interval-ms:60000}")
    public synchronized void flushCompletedTransactions() {
        if (closed) {
            return;
        }
        long slot = watermark.get();
        List<TransactionInfo> evicted = transactionIndex.evictOlderThan(slot, lagSlots);
        int pruned = errorTally.pruneBelow(slot - lagSlots);
        if (pruned > 0) {
            logger.debug("Dropped banking stage error counts of {} slots without block", pruned);
        }
        metrics.recordTrackedTransactions(transactionIndex.size());
        if (evicted.isEmpty()) {
            return;
        }
        logger.debug("Saving {} transaction infos older than {} slots behind slot {}", evicted.size(), lagSlots, slot);
        persistInBatches(evicted);
    }

    /**
     * Evicts and persists every tracked transaction regardless of its age, then
     * disables the periodic flush.
     */
    public synchronized void flushAll() {
        if (closed) {
            return;
        }
        closed = true;
        List<TransactionInfo> evicted = transactionIndex.evictAll();
        metrics.recordTrackedTransactions(transactionIndex.size());
        if (!evicted.isEmpty()) {
            logger.info("Saving {} tracked transaction infos before shutdown", evicted.size());
            persistInBatches(evicted);
        }
    }

    /**
     * @return number of batches written successfully
     */
    int persistInBatches(List<TransactionInfo> evicted) {
        metrics.recordEvicted(evicted.size());
        int saved = 0;
        for (int from = 0; from < evicted.size(); from += batchSize) {
            List<TransactionInfo> batch = List.copyOf(evicted.subList(from, Math.min(evicted.size(), from + batchSize)));
            try {
                store.saveTransactionInfos(batch);
                saved++;
            } catch (StorageConnectionLostException ex) {
                metrics.recordTransactionPersistenceFailure();
                fatalErrorHandler.onFatalError("transaction flush", ex);
                return saved;
            } catch (StorageException ex) {
                logger.error("Error saving {} transaction infos: {}", batch.size(), ex.getMessage());
                metrics.recordTransactionPersistenceFailure();
            }
        }
        return saved;
    }
}
