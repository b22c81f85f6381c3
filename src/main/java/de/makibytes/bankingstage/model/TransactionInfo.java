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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything observed for one transaction signature: banking stage errors per slot
 * and, once its block arrived, the inclusion details.
 *
 * <p>
 * Instances are not thread-safe. The transaction index mutates them only while it
 * holds the lock of the owning key and hands out copies to everyone else.
 */
public class TransactionInfo {

    private final String signature;
    private final long firstNotificationSlot;
    private final Instant utcTimestamp;
    private final Map<ErrorKey, Integer> errors;
    private final Map<String, Boolean> accountsUsed;
    private boolean executed;
    private boolean confirmed;
    private Long cuRequested;
    private Long prioritizationFees;
    private Long processedSlot;

    public TransactionInfo(String signature, long firstNotificationSlot, Instant utcTimestamp) {
        this.signature = signature;
        this.firstNotificationSlot = firstNotificationSlot;
        this.utcTimestamp = utcTimestamp;
        this.errors = new LinkedHashMap<>();
        this.accountsUsed = new LinkedHashMap<>();
    }

    private TransactionInfo(TransactionInfo source) {
        this.signature = source.signature;
        this.firstNotificationSlot = source.firstNotificationSlot;
        this.utcTimestamp = source.utcTimestamp;
        this.errors = new LinkedHashMap<>(source.errors);
        this.accountsUsed = new LinkedHashMap<>(source.accountsUsed);
        this.executed = source.executed;
        this.confirmed = source.confirmed;
        this.cuRequested = source.cuRequested;
        this.prioritizationFees = source.prioritizationFees;
        this.processedSlot = source.processedSlot;
    }

    public void addNotification(TransactionNotification notification) {
        if (!notification.hasError()) {
            return;
        }
        errors.merge(new ErrorKey(notification.error(), notification.slot()), 1, Integer::sum);
    }

    /**
     * Records the inclusion of this transaction in the block at {@code slot}.
     * Accumulated errors are left untouched.
     */
    public void addInclusion(BlockTransaction transaction, long slot) {
        executed = true;
        confirmed = true;
        cuRequested = transaction.cuRequested();
        prioritizationFees = transaction.prioritizationFees();
        processedSlot = slot;
        for (AccountUse account : transaction.accounts()) {
            accountsUsed.merge(account.key(), account.writable(), Boolean::logicalOr);
        }
    }

    public TransactionInfo copy() {
        return new TransactionInfo(this);
    }

    public String getSignature() {
        return signature;
    }

    public long getFirstNotificationSlot() {
        return firstNotificationSlot;
    }

    public Instant getUtcTimestamp() {
        return utcTimestamp;
    }

    public Map<ErrorKey, Integer> getErrors() {
        return Collections.unmodifiableMap(errors);
    }

    public int getErrorCount() {
        int total = 0;
        for (int count : errors.values()) {
            total += count;
        }
        return total;
    }

    public Map<String, Boolean> getAccountsUsed() {
        return Collections.unmodifiableMap(accountsUsed);
    }

    public boolean isExecuted() {
        return executed;
    }

    public boolean isConfirmed() {
        return confirmed;
    }

    public Long getCuRequested() {
        return cuRequested;
    }

    public Long getPrioritizationFees() {
        return prioritizationFees;
    }

    public Long getProcessedSlot() {
        return processedSlot;
    }
}
