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

import java.util.List;

public class BlockInfo {

    private final long slot;
    private final String blockHash;
    private final String leaderIdentity;
    private final long processedTransactions;
    private final long successfulTransactions;
    private final Long bankingStageErrors;
    private final long totalCuUsed;
    private final long totalCuRequested;
    private final List<AccountUsage> heavilyWriteLockedAccounts;
    private final List<AccountUsage> heavilyReadLockedAccounts;
    private final PrioritizationFeesInfo prioritizationFeesInfo;

    public BlockInfo(long slot,
                     String blockHash,
                     String leaderIdentity,
                     long processedTransactions,
                     long successfulTransactions,
                     Long bankingStageErrors,
                     long totalCuUsed,
                     long totalCuRequested,
                     List<AccountUsage> heavilyWriteLockedAccounts,
                     List<AccountUsage> heavilyReadLockedAccounts,
                     PrioritizationFeesInfo prioritizationFeesInfo) {
        this.slot = slot;
        this.blockHash = blockHash;
        this.leaderIdentity = leaderIdentity;
        this.processedTransactions = processedTransactions;
        this.successfulTransactions = successfulTransactions;
        this.bankingStageErrors = bankingStageErrors;
        this.totalCuUsed = totalCuUsed;
        this.totalCuRequested = totalCuRequested;
        this.heavilyWriteLockedAccounts = List.copyOf(heavilyWriteLockedAccounts);
        this.heavilyReadLockedAccounts = List.copyOf(heavilyReadLockedAccounts);
        this.prioritizationFeesInfo = prioritizationFeesInfo;
    }

    public long getSlot() {
        return slot;
    }

    public String getBlockHash() {
        return blockHash;
    }

    public String getLeaderIdentity() {
        return leaderIdentity;
    }

    public long getProcessedTransactions() {
        return processedTransactions;
    }

    public long getSuccessfulTransactions() {
        return successfulTransactions;
    }

    /**
     * Banking stage errors seen for this slot before the block was released, or
     * {@code null} when none arrived in time.
     */
    public Long getBankingStageErrors() {
        return bankingStageErrors;
    }

    public long getTransactionErrors() {
        return processedTransactions - successfulTransactions;
    }

    public long getTotalCuUsed() {
        return totalCuUsed;
    }

    public long getTotalCuRequested() {
        return totalCuRequested;
    }

    public List<AccountUsage> getHeavilyWriteLockedAccounts() {
        return heavilyWriteLockedAccounts;
    }

    public List<AccountUsage> getHeavilyReadLockedAccounts() {
        return heavilyReadLockedAccounts;
    }

    public PrioritizationFeesInfo getPrioritizationFeesInfo() {
        return prioritizationFeesInfo;
    }

    public static Builder builder(long slot) {
        return new Builder(slot);
    }

    public static class Builder {
        private final long slot;
        private String blockHash;
        private String leaderIdentity;
        private long processedTransactions;
        private long successfulTransactions;
        private Long bankingStageErrors;
        private long totalCuUsed;
        private long totalCuRequested;
        private List<AccountUsage> heavilyWriteLockedAccounts = List.of();
        private List<AccountUsage> heavilyReadLockedAccounts = List.of();
        private PrioritizationFeesInfo prioritizationFeesInfo;

        private Builder(long slot) {
            this.slot = slot;
        }

        public Builder blockHash(String blockHash) { this.blockHash = blockHash; return this; }
        public Builder leaderIdentity(String leaderIdentity) { this.leaderIdentity = leaderIdentity; return this; }
        public Builder processedTransactions(long processedTransactions) { this.processedTransactions = processedTransactions; return this; }
        public Builder successfulTransactions(long successfulTransactions) { this.successfulTransactions = successfulTransactions; return this; }
        public Builder bankingStageErrors(Long bankingStageErrors) { this.bankingStageErrors = bankingStageErrors; return this; }
        public Builder totalCuUsed(long totalCuUsed) { this.totalCuUsed = totalCuUsed; return this; }
        public Builder totalCuRequested(long totalCuRequested) { this.totalCuRequested = totalCuRequested; return this; }
        public Builder heavilyWriteLockedAccounts(List<AccountUsage> accounts) { this.heavilyWriteLockedAccounts = accounts; return this; }
        public Builder heavilyReadLockedAccounts(List<AccountUsage> accounts) { this.heavilyReadLockedAccounts = accounts; return this; }
        public Builder prioritizationFeesInfo(PrioritizationFeesInfo info) { this.prioritizationFeesInfo = info; return this; }

        public BlockInfo build() {
            return new BlockInfo(slot, blockHash, leaderIdentity, processedTransactions,
                    successfulTransactions, bankingStageErrors, totalCuUsed, totalCuRequested,
                    heavilyWriteLockedAccounts, heavilyReadLockedAccounts, prioritizationFeesInfo);
        }
    }
}
