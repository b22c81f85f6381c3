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
package de.makibytes.bankingstage.storage;

import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;

import de.makibytes.bankingstage.model.BlockInfo;

/**
 * Row of {@code blocks}, in column order.
 */
public record BlockRecord(String blockHash,
                          long slot,
                          String leaderIdentity,
                          long successfulTransactions,
                          Long bankingStageErrors,
                          long processedTransactions,
                          long totalCuUsed,
                          long totalCuRequested,
                          String heavilyWriteLockedAccounts,
                          String heavilyReadLockedAccounts,
                          String suppInfos) {

    public static final List<String> COLUMNS = List.of(
            "block_hash", "slot", "leader_identity", "successful_transactions", "banking_stage_errors",
            "processed_transactions", "total_cu_used", "total_cu_requested",
            "heavily_writelocked_accounts", "heavily_readlocked_accounts", "supp_infos");

    public static BlockRecord from(BlockInfo info, ObjectMapper mapper) {
        return new BlockRecord(
                info.getBlockHash(),
                info.getSlot(),
                info.getLeaderIdentity(),
                info.getSuccessfulTransactions(),
                info.getBankingStageErrors(),
                info.getProcessedTransactions(),
                info.getTotalCuUsed(),
                info.getTotalCuRequested(),
                JsonColumns.encode(mapper, info.getHeavilyWriteLockedAccounts(), "heavily_writelocked_accounts"),
                JsonColumns.encode(mapper, info.getHeavilyReadLockedAccounts(), "heavily_readlocked_accounts"),
                info.getPrioritizationFeesInfo() != null
                        ? JsonColumns.encode(mapper, info.getPrioritizationFeesInfo(), "supp_infos")
                        : null);
    }

    public List<Object> values() {
        return Arrays.asList(blockHash, slot, leaderIdentity, successfulTransactions, bankingStageErrors,
                processedTransactions, totalCuUsed, totalCuRequested, heavilyWriteLockedAccounts,
                heavilyReadLockedAccounts, suppInfos);
    }
}
