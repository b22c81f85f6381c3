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
package de.makibytes.bankingstage.store;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import de.makibytes.bankingstage.model.BlockTransaction;
import de.makibytes.bankingstage.model.TransactionInfo;
import de.makibytes.bankingstage.model.TransactionNotification;

/**
 * In-flight transactions keyed by signature.
 *
 * <p>
 * Every mutation runs inside {@link ConcurrentHashMap#compute}, so updates of one
 * signature are serialized while different signatures proceed in parallel. Callers
 * never see the live {@link TransactionInfo}: lookups return a copy taken under the
 * same per-key lock, and eviction hands over the instance that was removed.
 */
@Component
public class TransactionIndex {

    private final Map<String, TransactionInfo> infosBySignature = new ConcurrentHashMap<>();
    private final Clock clock;

    public TransactionIndex() {
        this(Clock.systemUTC());
    }

    @Autowired
    public TransactionIndex(Clock clock) {
        this.clock = clock;
    }

    public void upsertNotification(TransactionNotification notification) {
        infosBySignature.compute(notification.signature(), (signature, existing) -> {
            TransactionInfo info = existing != null
                    ? existing
                    : new TransactionInfo(signature, notification.slot(), clock.instant());
            info.addNotification(notification);
            return info;
        });
    }

    /**
     * Records a block inclusion, creating a minimal entry when the signature was
     * never seen in a notification.
     */
    public void upsertInclusion(String signature, long blockSlot, BlockTransaction transaction) {
        infosBySignature.compute(signature, (key, existing) -> {
            TransactionInfo info = existing != null
                    ? existing
                    : new TransactionInfo(key, blockSlot, clock.instant());
            info.addInclusion(transaction, blockSlot);
            return info;
        });
    }

    /**
     * Records a block inclusion only for a signature that is already tracked.
     *
     * @return whether the signature was tracked
     */
    public boolean mergeInclusion(String signature, long blockSlot, BlockTransaction transaction) {
        TransactionInfo merged = infosBySignature.computeIfPresent(signature, (key, existing) -> {
            existing.addInclusion(transaction, blockSlot);
            return existing;
        });
        return merged != null;
    }

    public Optional<TransactionInfo> find(String signature) {
        TransactionInfo[] snapshot = new TransactionInfo[1];
        infosBySignature.computeIfPresent(signature, (key, existing) -> {
            snapshot[0] = existing.copy();
            return existing;
        });
        return Optional.ofNullable(snapshot[0]);
    }

    public int size() {
        return infosBySignature.size();
    }

    /**
     * Removes every entry whose first notification lies more than {@code lagSlots}
     * behind {@code watermark} and returns the removed entries.
     */
    public List<TransactionInfo> evictOlderThan(long watermark, long lagSlots) {
        List<TransactionInfo> evicted = new ArrayList<>();
        for (Map.Entry<String, TransactionInfo> entry : infosBySignature.entrySet()) {
            if (!isExpired(entry.getValue(), watermark, lagSlots)) {
                continue;
            }
            infosBySignature.computeIfPresent(entry.getKey(), (key, existing) -> {
                if (!isExpired(existing, watermark, lagSlots)) {
                    return existing;
                }
                evicted.add(existing);
                return null;
            });
        }
        return evicted;
    }

    public List<TransactionInfo> evictAll() {
        List<TransactionInfo> evicted = new ArrayList<>();
        for (String signature : infosBySignature.keySet()) {
            TransactionInfo removed = infosBySignature.remove(signature);
            if (removed != null) {
                evicted.add(removed);
            }
        }
        return evicted;
    }

    static boolean isExpired(TransactionInfo info, long watermark, long lagSlots) {
        return watermark - info.getFirstNotificationSlot() > lagSlots;
    }
}
