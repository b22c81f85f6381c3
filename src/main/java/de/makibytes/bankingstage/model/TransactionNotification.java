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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * A banking stage notification for one attempt to include a transaction at a slot.
 * The error is kept as the JSON value the validator reported, a plain string such
 * as {@code "AccountInUse"} or an object such as
 * {@code {"InstructionError":[0,{"Custom":1}]}}, and is {@code null} when the
 * attempt did not fail.
 */
public record TransactionNotification(String signature, long slot, JsonNode error) implements StreamUpdate {

    public TransactionNotification(String signature, long slot, String error) {
        this(signature, slot, error != null ? TextNode.valueOf(error) : null);
    }

    public boolean hasError() {
        return error != null && !error.isNull() && !error.isMissingNode();
    }
}
