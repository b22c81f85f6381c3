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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import de.makibytes.bankingstage.model.BlockEvent;

/**
 * Holds every arrived block for a fixed interval so that banking stage errors of
 * its slot can arrive first.
 *
 * <p>
 * Blocks are released by deadline, ties broken by arrival sequence. With a fixed
 * hold and a monotonic clock the deadlines grow with arrival, so release order is
 * arrival order. The queue is unbounded.
 */
public class BlockDelayQueue {

    private final DelayQueue<PendingBlock> queue = new DelayQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private final long holdNanos;

    public BlockDelayQueue(Duration hold) {
        if (hold.isNegative()) {
            throw new IllegalArgumentException("hold must not be negative: " + hold);
        }
        this.holdNanos = hold.toNanos();
    }

    public PendingBlock offer(BlockEvent block) {
        PendingBlock pending = new PendingBlock(block, System.nanoTime() + holdNanos, sequence.getAndIncrement());
        queue.offer(pending);
        return pending;
    }

    /**
     * Waits up to {@code timeout} for the next block whose hold elapsed.
     *
     * @return the released block, or {@code null} if none was released in time
     */
    public BlockEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        PendingBlock pending = queue.poll(timeout, unit);
        return pending != null ? pending.block() : null;
    }

    /**
     * Removes every queued block regardless of its deadline, in release order.
     */
    public List<BlockEvent> drainAll() {
        List<PendingBlock> pending = new ArrayList<>();
        for (PendingBlock candidate : queue.toArray(new PendingBlock[0])) {
            if (queue.remove(candidate)) {
                pending.add(candidate);
            }
        }
        pending.sort(Comparator.naturalOrder());
        List<BlockEvent> blocks = new ArrayList<>(pending.size());
        for (PendingBlock block : pending) {
            blocks.add(block.block());
        }
        return blocks;
    }

    public int size() {
        return queue.size();
    }

    public record PendingBlock(BlockEvent block, long releaseAtNanos, long sequence) implements Delayed {

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(releaseAtNanos - System.nanoTime(), TimeUnit.NANOSECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            PendingBlock that = (PendingBlock) other;
            int byDeadline = Long.compare(releaseAtNanos - that.releaseAtNanos, 0);
            return byDeadline != 0 ? byDeadline : Long.compare(sequence, that.sequence);
        }
    }
}
