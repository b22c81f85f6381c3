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

import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;

class CsvRowsTest {

    @Test
    void writesNullAsEmptyFieldAndQuotesText() {
        StringBuilder out = new StringBuilder();

        CsvRows.appendRow(out, Arrays.asList("sig", null, 42L, true, ""));

        assertEquals("\"sig\",,42,true,\"\"\n", out.toString());
    }

    @Test
    void doublesEmbeddedQuotes() {
        StringBuilder out = new StringBuilder();

        CsvRows.appendRow(out, Arrays.asList("[{\"key\":\"a,b\"}]"));

        assertEquals("\"[{\"\"key\"\":\"\"a,b\"\"}]\"\n", out.toString());
    }

    @Test
    void appendsOneLinePerRow() {
        StringBuilder out = new StringBuilder();

        CsvRows.appendRow(out, Arrays.asList(1, 2));
        CsvRows.appendRow(out, Arrays.asList(3, 4));

        assertEquals("1,2\n3,4\n", out.toString());
    }
}
