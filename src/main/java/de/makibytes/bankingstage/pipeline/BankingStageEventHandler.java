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
import org.springframework.stereotype.Component;

import de.makibytes.bankingstage.config.BankingStageProperties;
import de.makibytes.bankingstage.metrics.BankingStageMetrics;
import de.makibytes.bankingstage.model.BlockEvent;
import de.makibytes.bankingstage.model.StreamUpdate;
import de.makibytes.bankingstage.model.TransactionNotification;
import de.makibytes.bankingstage.source.StreamUpdateListener;

/**
 * Routes stream updates inline: notifications are applied immediately, blocks are
 * held in the {@link BlockDelayQueue}.
 */
@Component
public class BankingStageEventHandler implements StreamUpdateListener {

    private static final Logger logger = LoggerFactory.getLogger(BankingStageEventHandler.class);

    private final NotificationHandler notificationHandler;
    private final BlockDelayQueue delayQueue;
    private final BankingStageMetrics metrics;
    private final int delayQueueWarnDepth;

    public BankingStageEventHandler(NotificationHandler notificationHandler,
                                    BlockDelayQueue delayQueue,
                                    BankingStageMetrics metrics,
                                    BankingStageProperties properties) {
        this.notificationHandler = notificationHandler;
        this.delayQueue = delayQueue;
        this.metrics = metrics;
        this.delayQueueWarnDepth = properties.getPipeline().getDelayQueueWarnDepth();
    }

    @Override
    public void onUpdate(StreamUpdate update) {
        if (update instanceof TransactionNotification notification) {
            notificationHandler.handle(notification);
        } else if (update instanceof BlockEvent block) {
            onBlock(block);
        }
    }

    private void onBlock(BlockEvent block) {
        logger.debug("got block {}", block.slot());
        metrics.recordBlockArrived(block.transactions().size());
        delayQueue.offer(block);
        int depth = delayQueue.size();
        metrics.recordDelayQueueDepth(depth);
        if (depth >= delayQueueWarnDepth) {
            logger.warn("{} blocks waiting in the delay queue, block processing falls behind", depth);
        }
    }

    @Override
    public void onMalformedMessage(String reason) {
        metrics.recordMalformedMessage();
    }
}
