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
package de.makibytes.bankingstage.config;

import java.time.Clock;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import de.makibytes.bankingstage.pipeline.BlockDelayQueue;
import de.makibytes.bankingstage.storage.BankingStageStore;
import de.makibytes.bankingstage.storage.DiscardingBankingStageStore;
import de.makibytes.bankingstage.storage.PostgresBankingStageStore;

@Configuration
public class PipelineConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BlockDelayQueue blockDelayQueue(BankingStageProperties properties) {
        return new BlockDelayQueue(Duration.ofMillis(properties.getPipeline().getBlockHoldMs()));
    }

    // Closed by BankingStagePipeline after the final flush, not by the context.
    @Bean(destroyMethod = "")
    public BankingStageStore bankingStageStore(BankingStageProperties properties) {
        BankingStageProperties.Storage storage = properties.getStorage();
        if (!storage.isEnabled()) {
            logger.warn("Storage disabled, processed blocks and transactions are not persisted");
            return new DiscardingBankingStageStore();
        }
        return PostgresBankingStageStore.connect(storage);
    }
}
