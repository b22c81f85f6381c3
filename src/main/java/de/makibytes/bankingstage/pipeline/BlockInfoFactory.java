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
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import de.makibytes.bankingstage.config.BankingStageProperties;
import de.makibytes.bankingstage.model.AccountUsage;
import de.makibytes.bankingstage.model.AccountUse;
import de.makibytes.bankingstage.model.BlockEvent;
import de.makibytes.bankingstage.model.BlockInfo;
import de.makibytes.bankingstage.model.BlockTransaction;
import de.makibytes.bankingstage.model.PrioritizationFeesInfo;

/**
 * Derives the per-block statistics persisted for every processed block.
 */
@Component
public class BlockInfoFactory {

    private static final Comparator<AccountUsage> BY_CONTENTION = Comparator
            .comparingLong(AccountUsage::transactionCount).reversed()
            .thenComparing(Comparator.comparingLong(AccountUsage::cuConsumed).reversed())
            .thenComparing(AccountUsage::key);

    private final int heavilyLockedAccountsLimit;

    public BlockInfoFactory(BankingStageProperties properties) {
        this.heavilyLockedAccountsLimit = properties.getPipeline().getHeavilyLockedAccountsLimit();
    }

    public BlockInfo create(BlockEvent block, Long bankingStageErrors) {
        long successful = 0;
        long totalCuUsed = 0;
        long totalCuRequested = 0;
        List<Long> fees = new ArrayList<>(block.transactions().size());
        Map<String, LockAccumulator> writeLocks = new HashMap<>();
        Map<String, LockAccumulator> readLocks = new HashMap<>();

        for (BlockTransaction transaction : block.transactions()) {
            if (transaction.success()) {
                successful++;
            }
            totalCuUsed += transaction.cuConsumed();
            totalCuRequested += transaction.cuRequested();
            fees.add(transaction.prioritizationFees());
            for (AccountUse account : transaction.accounts()) {
                Map<String, LockAccumulator> locks = account.writable() ? writeLocks : readLocks;
                locks.computeIfAbsent(account.key(), LockAccumulator::new).add(transaction);
            }
        }

        return BlockInfo.builder(block.slot())
                .blockHash(block.blockHash())
                .leaderIdentity(block.leaderIdentity())
                .processedTransactions(block.transactions().size())
                .successfulTransactions(successful)
                .bankingStageErrors(bankingStageErrors)
                .totalCuUsed(totalCuUsed)
                .totalCuRequested(totalCuRequested)
                .heavilyWriteLockedAccounts(rank(writeLocks))
                .heavilyReadLockedAccounts(rank(readLocks))
                .prioritizationFeesInfo(feeDistribution(fees))
                .build();
    }

    /**
     * Accounts locked by more than one transaction, most contended first.
     */
    List<AccountUsage> rank(Map<String, LockAccumulator> locks) {
        return locks.values().stream()
                .filter(accumulator -> accumulator.transactionCount > 1)
                .map(LockAccumulator::toUsage)
                .sorted(BY_CONTENTION)
                .limit(heavilyLockedAccountsLimit)
                .toList();
    }

    static PrioritizationFeesInfo feeDistribution(List<Long> fees) {
        if (fees.isEmpty()) {
            return null;
        }
        List<Long> sorted = new ArrayList<>(fees);
        sorted.sort(null);
        return new PrioritizationFeesInfo(
                sorted.get(0),
                percentile(sorted, 50),
                percentile(sorted, 75),
                percentile(sorted, 90),
                sorted.get(sorted.size() - 1));
    }

    static long percentile(List<Long> sorted, int percent) {
        int index = Math.min(sorted.size() - 1, sorted.size() * percent / 100);
        return sorted.get(index);
    }

    static final class LockAccumulator {
        private final String key;
        private final List<Long> fees = new ArrayList<>();
        private long transactionCount;
        private long cuRequested;
        private long cuConsumed;

        LockAccumulator(String key) {
            this.key = key;
        }

        void add(BlockTransaction transaction) {
            transactionCount++;
            cuRequested += transaction.cuRequested();
            cuConsumed += transaction.cuConsumed();
            fees.add(transaction.prioritizationFees());
        }

        AccountUsage toUsage() {
            List<Long> sorted = new ArrayList<>(fees);
            sorted.sort(null);
            return new AccountUsage(key, transactionCount, cuRequested, cuConsumed,
                    sorted.get(0), sorted.get(sorted.size() - 1), percentile(sorted, 50));
        }
    }
}
