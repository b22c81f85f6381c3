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

import java.util.List;

/**
 * Transaction data carried by a block. The signature may be missing when the
 * upstream payload is malformed.
 */
public record BlockTransaction(String signature,
                               boolean success,
                               long cuConsumed,
                               long cuRequested,
                               long prioritizationFees,
                               List<AccountUse> accounts) {

    public BlockTransaction {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
    }

    public boolean hasSignature() {
        return signature != null && !signature.isBlank();
    }
}
