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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import de.makibytes.bankingstage.metrics.BankingStageMetrics;
import de.makibytes.bankingstage.model.TransactionNotification;
import de.makibytes.bankingstage.store.ErrorTally;
import de.makibytes.bankingstage.store.TransactionIndex;

/**
 * Applies banking stage error notifications to the error tally and the
 * transaction index. Notifications without an error are ignored.
 */
@Component
public class NotificationHandler {

    private static final Logger logger = LoggerFactory.getLogger(NotificationHandler.class);

    private final ErrorTally errorTally;
    private final TransactionIndex transactionIndex;
    private final BankingStageMetrics metrics;

    public NotificationHandler(ErrorTally errorTally, TransactionIndex transactionIndex, BankingStageMetrics metrics) {
        this.errorTally = errorTally;
        this.transactionIndex = transactionIndex;
        this.metrics = metrics;
    }

    /**
     * @return whether the notification was recorded
     */
    public boolean handle(TransactionNotification notification) {
        if (!notification.hasError()) {
            return false;
        }
        if (notification.signature() == null || notification.signature().isBlank()) {
            logger.warn("Skipping banking stage error without signature at slot {}", notification.slot());
            metrics.recordMalformedMessage();
            return false;
        }
        metrics.recordBankingStageEvent();
        errorTally.recordError(notification.slot());
        transactionIndex.upsertNotification(notification);
        return true;
    }
}
