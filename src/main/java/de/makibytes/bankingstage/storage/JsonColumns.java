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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Encodes structured columns as JSON text. A value that cannot be encoded is
 * stored as an empty string instead of failing the whole row.
 */
final class JsonColumns {

    private static final Logger logger = LoggerFactory.getLogger(JsonColumns.class);

    private JsonColumns() {
    }

    static String encode(ObjectMapper mapper, Object value, String column) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            logger.warn("Could not encode column {}: {}", column, ex.getMessage());
            return "";
        }
    }
}
