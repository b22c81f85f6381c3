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

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "banking-stage")
public class BankingStageProperties {

    public enum Commitment {
        PROCESSED,
        CONFIRMED,
        FINALIZED
    }

    private Source source = new Source();
    private Pipeline pipeline = new Pipeline();
    private Storage storage = new Storage();

    public Source getSource() {
        return source;
    }

    public void setSource(Source source) {
        this.source = source;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public static class Source {
        private String url;
        private String accessToken;
        private Commitment commitment = Commitment.PROCESSED;
        private List<String> bankingAddresses = new ArrayList<>();
        private long reconnectIntervalMs = 5000;
        private long connectTimeoutMs = 10000;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getAccessToken() {
            return accessToken;
        }

        public void setAccessToken(String accessToken) {
            this.accessToken = accessToken;
        }

        public Commitment getCommitment() {
            return commitment;
        }

        public void setCommitment(Commitment commitment) {
            this.commitment = commitment;
        }

        public List<String> getBankingAddresses() {
            return bankingAddresses;
        }

        public void setBankingAddresses(List<String> bankingAddresses) {
            this.bankingAddresses = bankingAddresses;
        }

        public long getReconnectIntervalMs() {
            return reconnectIntervalMs;
        }

        public void setReconnectIntervalMs(long reconnectIntervalMs) {
            this.reconnectIntervalMs = reconnectIntervalMs;
        }

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }
    }

    /**
     * Timing and sizing of the correlation pipeline. A longer block hold and a
     * larger eviction lag catch more late notifications at the cost of memory.
     */
    public static class Pipeline {
        private long blockHoldMs = 30000;
        private long evictionIntervalMs = 60000;
        private long evictionLagSlots = 300;
        private int evictionBatchSize = 8;
        private int heavilyLockedAccountsLimit = 10;
        private int delayQueueWarnDepth = 1000;

        public long getBlockHoldMs() {
            return blockHoldMs;
        }

        public void setBlockHoldMs(long blockHoldMs) {
            this.blockHoldMs = requirePositive("block-hold-ms", blockHoldMs);
        }

        public long getEvictionIntervalMs() {
            return evictionIntervalMs;
        }

        public void setEvictionIntervalMs(long evictionIntervalMs) {
            this.evictionIntervalMs = requirePositive("eviction-interval-ms", evictionIntervalMs);
        }

        public long getEvictionLagSlots() {
            return evictionLagSlots;
        }

        public void setEvictionLagSlots(long evictionLagSlots) {
            this.evictionLagSlots = requirePositive("eviction-lag-slots", evictionLagSlots);
        }

        public int getEvictionBatchSize() {
            return evictionBatchSize;
        }

        public void setEvictionBatchSize(int evictionBatchSize) {
            this.evictionBatchSize = (int) requirePositive("eviction-batch-size", evictionBatchSize);
        }

        public int getHeavilyLockedAccountsLimit() {
            return heavilyLockedAccountsLimit;
        }

        public void setHeavilyLockedAccountsLimit(int heavilyLockedAccountsLimit) {
            this.heavilyLockedAccountsLimit = (int) requirePositive("heavily-locked-accounts-limit", heavilyLockedAccountsLimit);
        }

        public int getDelayQueueWarnDepth() {
            return delayQueueWarnDepth;
        }

        public void setDelayQueueWarnDepth(int delayQueueWarnDepth) {
            this.delayQueueWarnDepth = (int) requirePositive("delay-queue-warn-depth", delayQueueWarnDepth);
        }

        private static long requirePositive(String name, long value) {
            if (value <= 0) {
                throw new IllegalArgumentException("banking-stage.pipeline." + name + " must be positive, was " + value);
            }
            return value;
        }
    }

    public static class Storage {
        private boolean enabled = false;
        private String url;
        private String user;
        private String password;
        private String schema = "banking_stage_results";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUser() {
            return user;
        }

        public void setUser(String user) {
            this.user = user;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getSchema() {
            return schema;
        }

        public void setSchema(String schema) {
            this.schema = schema;
        }
    }
}
