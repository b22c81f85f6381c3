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

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import de.makibytes.bankingstage.model.ErrorKey;
import de.makibytes.bankingstage.model.TransactionInfo;

/**
 * Row of {@code transaction_infos}, in column order.
 */
public record TransactionRecord(String signature,
                                String errors,
                                boolean isExecuted,
                                boolean isConfirmed,
                                long firstNotificationSlot,
                                Long cuRequested,
                                Long prioritizationFees,
                                OffsetDateTime utcTimestamp,
                                String accountsUsed,
                                Long processedSlot) {

    public static final List<String> COLUMNS = List.of(
            "signature", "errors", "is_executed", "is_confirmed", "first_notification_slot",
            "cu_requested", "prioritization_fees", "utc_timestamp", "accounts_used", "processed_slot");

    public record ErrorData(JsonNode error, long slot, int count) {
    }

    public record AccountUsed(String key, boolean writable) {
    }

    public static TransactionRecord from(TransactionInfo info, ObjectMapper mapper) {
        List<ErrorData> errors = new ArrayList<>();
        for (Map.Entry<ErrorKey, Integer> entry : info.getErrors().entrySet()) {
            errors.add(new ErrorData(entry.getKey().error(), entry.getKey().slot(), entry.getValue()));
        }
        List<AccountUsed> accounts = new ArrayList<>();
        info.getAccountsUsed().forEach((key, writable) -> accounts.add(new AccountUsed(key, writable)));
        return new TransactionRecord(
                info.getSignature(),
                JsonColumns.encode(mapper, errors, "errors"),
                info.isExecuted(),
                info.isConfirmed(),
                info.getFirstNotificationSlot(),
                info.getCuRequested(),
                info.getPrioritizationFees(),
                info.getUtcTimestamp().atOffset(ZoneOffset.UTC),
                JsonColumns.encode(mapper, accounts, "accounts_used"),
                info.getProcessedSlot());
    }

    public List<Object> values() {
        return Arrays.asList(signature, errors, isExecuted, isConfirmed, firstNotificationSlot,
                cuRequested, prioritizationFees, utcTimestamp, accountsUsed, processedSlot);
    }
}
