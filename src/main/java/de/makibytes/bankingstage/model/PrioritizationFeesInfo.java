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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Distribution of prioritization fees paid by the transactions of a block.
 */
public record PrioritizationFeesInfo(@JsonProperty("p_min") long min,
                                     @JsonProperty("p_median") long median,
                                     @JsonProperty("p_75") long p75,
                                     @JsonProperty("p_90") long p90,
                                     @JsonProperty("p_max") long max) {
}
