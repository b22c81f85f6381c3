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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.makibytes.bankingstage.model.BlockInfo;
import de.makibytes.bankingstage.model.TransactionInfo;

/**
 * Store used when persistence is disabled; records are dropped.
 */
public class DiscardingBankingStageStore implements BankingStageStore {

    private static final Logger logger = LoggerFactory.getLogger(DiscardingBankingStageStore.class);

    @Override
    public void saveTransactionInfos(List<TransactionInfo> transactionInfos) {
        logger.debug("Persistence disabled, dropping {} transaction infos", transactionInfos.size());
    }

    @Override
    public void saveBlock(BlockInfo blockInfo) {
        logger.debug("Persistence disabled, dropping block {}", blockInfo.getSlot());
    }

    @Override
    public void close() {
        // nothing to release
    }
}
