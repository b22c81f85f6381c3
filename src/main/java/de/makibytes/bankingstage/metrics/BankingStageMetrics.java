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
package de.makibytes.bankingstage.metrics;

import java.util.concurrent.atomic.AtomicLong;

import org.springframework.stereotype.Component;

import de.makibytes.bankingstage.model.BlockInfo;
import de.makibytes.bankingstage.source.SourceConnectionTracker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Meters of the correlation pipeline, registered once at startup and never reset.
 *
 * <h3>Gauges</h3>
 * <ul>
 * <li>{@code block_arrived}: transaction count of the most recently seen block</li>
 * <li>{@code bankingstage_banking_errors}: running sum of banking stage errors per block</li>
 * <li>{@code bankingstage_txerrors}: running sum of failed transactions per block</li>
 * <li>{@code bankingstage_delay_queue_depth}: blocks waiting for their release</li>
 * <li>{@code bankingstage_tracked_transactions}: size of the transaction index</li>
 * <li>{@code bankingstage_slot_watermark}: slot of the last processed block</li>
 * </ul>
 *
 * <h3>Counters</h3>
 * <ul>
 * <li>{@code bankingstage_banking_stage_events_counter}: error notifications received</li>
 * <li>{@code bankingstage_blocks_counter}: blocks received</li>
 * <li>{@code bankingstage_malformed_messages_counter}: upstream messages skipped</li>
 * <li>{@code bankingstage_malformed_transactions_counter}: block transactions skipped</li>
 * <li>{@code bankingstage_evicted_transactions_counter}: index entries evicted</li>
 * <li>{@code bankingstage_persistence_failures_counter}: failed writes, tagged by record</li>
 * </ul>
 *
 * <h3>Event source connection</h3>
 * <ul>
 * <li>{@code bankingstage_source_connected}: 1 while the stream is connected</li>
 * <li>{@code bankingstage_source_last_message_seconds}: epoch second of the last frame</li>
 * <li>{@code bankingstage_source_connects_counter}, {@code bankingstage_source_disconnects_counter},
 * {@code bankingstage_source_connect_failures_counter}</li>
 * </ul>
 */
@Component
public class BankingStageMetrics {

    private final AtomicLong blockArrived = new AtomicLong();
    private final AtomicLong bankingErrors = new AtomicLong();
    private final AtomicLong transactionErrors = new AtomicLong();
    private final AtomicLong delayQueueDepth = new AtomicLong();
    private final AtomicLong trackedTransactions = new AtomicLong();
    private final AtomicLong slotWatermark = new AtomicLong();

    private final Counter bankingStageEvents;
    private final Counter blocks;
    private final Counter malformedMessages;
    private final Counter malformedTransactions;
    private final Counter evictedTransactions;
    private final Counter blockPersistenceFailures;
    private final Counter transactionPersistenceFailures;
    private final MeterRegistry registry;

    public BankingStageMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("block_arrived", blockArrived, AtomicLong::get)
                .description("block seen with n transactions")
                .register(registry);
        Gauge.builder("bankingstage_banking_errors", bankingErrors, AtomicLong::get)
                .description("banking_stage errors in block")
                .register(registry);
        Gauge.builder("bankingstage_txerrors", transactionErrors, AtomicLong::get)
                .description("transaction errors in block")
                .register(registry);
        Gauge.builder("bankingstage_delay_queue_depth", delayQueueDepth, AtomicLong::get)
                .description("blocks waiting for banking stage errors")
                .register(registry);
        Gauge.builder("bankingstage_tracked_transactions", trackedTransactions, AtomicLong::get)
                .description("transactions held in memory")
                .register(registry);
        Gauge.builder("bankingstage_slot_watermark", slotWatermark, AtomicLong::get)
                .description("slot of the last processed block")
                .register(registry);

        this.bankingStageEvents = Counter.builder("bankingstage_banking_stage_events_counter")
                .description("Banking stage events received")
                .register(registry);
        this.blocks = Counter.builder("bankingstage_blocks_counter")
                .description("Banking stage blocks received")
                .register(registry);
        this.malformedMessages = Counter.builder("bankingstage_malformed_messages_counter")
                .description("Upstream messages skipped as malformed")
                .register(registry);
        this.malformedTransactions = Counter.builder("bankingstage_malformed_transactions_counter")
                .description("Block transactions skipped as malformed")
                .register(registry);
        this.evictedTransactions = Counter.builder("bankingstage_evicted_transactions_counter")
                .description("Transactions evicted from memory")
                .register(registry);
        this.blockPersistenceFailures = Counter.builder("bankingstage_persistence_failures_counter")
                .description("Records lost because the write failed")
                .tag("record", "block")
                .register(registry);
        this.transactionPersistenceFailures = Counter.builder("bankingstage_persistence_failures_counter")
                .description("Records lost because the write failed")
                .tag("record", "transactions")
                .register(registry);
    }

    /**
     * Exposes the state of the event source connection. Read on every scrape.
     */
    public void bindSourceConnection(SourceConnectionTracker tracker) {
        Gauge.builder("bankingstage_source_connected", tracker, t -> t.isConnected() ? 1 : 0)
                .description("event source connection is open")
                .register(registry);
        Gauge.builder("bankingstage_source_last_message_seconds", tracker,
                        t -> t.getLastMessageAt() != null ? t.getLastMessageAt().getEpochSecond() : 0)
                .description("epoch second of the last frame received")
                .register(registry);
        FunctionCounter.builder("bankingstage_source_connects_counter", tracker, SourceConnectionTracker::getConnectCount)
                .description("Event source connections established")
                .register(registry);
        FunctionCounter.builder("bankingstage_source_disconnects_counter", tracker, SourceConnectionTracker::getDisconnectCount)
                .description("Event source connections lost")
                .register(registry);
        FunctionCounter.builder("bankingstage_source_connect_failures_counter", tracker,
                        SourceConnectionTracker::getConnectFailureCount)
                .description("Event source connection attempts that failed")
                .register(registry);
    }

    public void recordBlockArrived(int transactionCount) {
        blockArrived.set(transactionCount);
        blocks.increment();
    }

    public void recordBankingStageEvent() {
        bankingStageEvents.increment();
    }

    public void recordProcessedBlock(BlockInfo blockInfo) {
        Long errors = blockInfo.getBankingStageErrors();
        bankingErrors.addAndGet(errors != null ? errors : 0L);
        transactionErrors.addAndGet(blockInfo.getTransactionErrors());
        slotWatermark.accumulateAndGet(blockInfo.getSlot(), Math::max);
    }

    public void recordMalformedMessage() {
        malformedMessages.increment();
    }

    public void recordMalformedTransaction() {
        malformedTransactions.increment();
    }

    public void recordEvicted(int count) {
        evictedTransactions.increment(count);
    }

    public void recordBlockPersistenceFailure() {
        blockPersistenceFailures.increment();
    }

    public void recordTransactionPersistenceFailure() {
        transactionPersistenceFailures.increment();
    }

    public void recordDelayQueueDepth(int depth) {
        delayQueueDepth.set(depth);
    }

    public void recordTrackedTransactions(int count) {
        trackedTransactions.set(count);
    }
}
