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
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import de.makibytes.bankingstage.source.EventSource;
import de.makibytes.bankingstage.storage.BankingStageStore;

/**
 * Starts the pipeline once the context is ready and drains it on shutdown:
 * ingestion stops first, held blocks are processed, every tracked transaction is
 * flushed and only then the storage connection is closed.
 */
@Component
public class BankingStagePipeline implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(BankingStagePipeline.class);

    private final EventSource eventSource;
    private final BankingStageEventHandler eventHandler;
    private final BlockProcessor blockProcessor;
    private final TransactionFlushJob flushJob;
    private final BankingStageStore store;
    private volatile boolean running;

    public BankingStagePipeline(EventSource eventSource,
                                BankingStageEventHandler eventHandler,
                                BlockProcessor blockProcessor,
                                TransactionFlushJob flushJob,
                                BankingStageStore store) {
        this.eventSource = eventSource;
        this.eventHandler = eventHandler;
        this.blockProcessor = blockProcessor;
        this.flushJob = flushJob;
        this.store = store;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        logger.info("Starting banking stage pipeline");
        blockProcessor.start();
        eventSource.start(eventHandler);
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        logger.info("Stopping banking stage pipeline");
        eventSource.close();
        blockProcessor.stop();
        flushJob.flushAll();
        store.close();
        logger.info("Banking stage pipeline stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
