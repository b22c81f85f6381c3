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
package de.makibytes.bankingstage.source;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import de.makibytes.bankingstage.model.AccountUse;
import de.makibytes.bankingstage.model.BlockEvent;
import de.makibytes.bankingstage.model.BlockTransaction;
import de.makibytes.bankingstage.model.StreamUpdate;
import de.makibytes.bankingstage.model.TransactionNotification;

/**
 * Decodes one JSON frame of the event stream.
 *
 * <p>
 * Frames carry either {@code bankingTransactionErrors} or {@code block}. Any
 * other frame (pings, subscription acknowledgements, unrelated updates) decodes
 * to empty. A transaction without signature is kept with a {@code null}
 * signature so the block processor can count it.
 */
public class StreamUpdateDecoder {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    public Optional<StreamUpdate> decode(String payload) throws MalformedMessageException {
        if (payload == null || payload.isBlank()) {
            throw new MalformedMessageException("empty message");
        }
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (JsonProcessingException ex) {
            throw new MalformedMessageException("invalid JSON: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMessageException("message is not a JSON object");
        }
        JsonNode notification = root.get("bankingTransactionErrors");
        if (notification != null) {
            return Optional.of(decodeNotification(notification));
        }
        JsonNode block = root.get("block");
        if (block != null) {
            return Optional.of(decodeBlock(block));
        }
        return Optional.empty();
    }

    TransactionNotification decodeNotification(JsonNode node) throws MalformedMessageException {
        long slot = requireSlot(node, "bankingTransactionErrors");
        String signature = text(node.get("signature"));
        return new TransactionNotification(signature, slot, errorValue(node.get("error")));
    }

    BlockEvent decodeBlock(JsonNode node) throws MalformedMessageException {
        long slot = requireSlot(node, "block");
        JsonNode transactionsNode = node.path("transactions");
        if (!transactionsNode.isMissingNode() && !transactionsNode.isNull() && !transactionsNode.isArray()) {
            throw new MalformedMessageException("block " + slot + " transactions is not an array");
        }
        List<BlockTransaction> transactions = new ArrayList<>();
        for (JsonNode transaction : transactionsNode) {
            transactions.add(decodeTransaction(transaction));
        }
        return new BlockEvent(slot, text(node.get("blockhash")), text(node.get("leaderIdentity")), transactions);
    }

    private BlockTransaction decodeTransaction(JsonNode node) {
        boolean success = node.has("success")
                ? node.get("success").asBoolean()
                : errorValue(node.get("error")) == null;
        List<AccountUse> accounts = new ArrayList<>();
        for (JsonNode account : node.path("accounts")) {
            String key = text(account.get("key"));
            if (key != null) {
                accounts.add(new AccountUse(key, account.path("writable").asBoolean(false)));
            }
        }
        return new BlockTransaction(
                text(node.get("signature")),
                success,
                node.path("computeUnitsConsumed").asLong(0),
                node.path("computeUnitsRequested").asLong(0),
                node.path("prioritizationFees").asLong(0),
                accounts);
    }

    private static long requireSlot(JsonNode node, String kind) throws MalformedMessageException {
        JsonNode slot = node.get("slot");
        if (slot == null || !slot.canConvertToLong() || slot.asLong() < 0) {
            throw new MalformedMessageException(kind + " without valid slot");
        }
        return slot.asLong();
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    // Structured errors such as {"InstructionError":[0,{"Custom":1}]} stay JSON objects.
    private static JsonNode errorValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual() && node.asText().isBlank()) {
            return null;
        }
        return node;
    }
}
