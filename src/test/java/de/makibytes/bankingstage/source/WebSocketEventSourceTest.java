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
package de.makibytes.bankingstage.source;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import de.makibytes.bankingstage.config.BankingStageProperties;
import de.makibytes.bankingstage.metrics.BankingStageMetrics;
import de.makibytes.bankingstage.model.BlockEvent;
import de.makibytes.bankingstage.model.StreamUpdate;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@DisplayName("WebSocketEventSource")
class WebSocketEventSourceTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private WebSocketEventSource source(BankingStageProperties properties) {
        return new WebSocketEventSource(properties, new BankingStageMetrics(registry));
    }

    private static class RecordingListener implements StreamUpdateListener {
        private final List<StreamUpdate> updates = new ArrayList<>();
        private final List<String> malformed = new ArrayList<>();

        @Override
        public void onUpdate(StreamUpdate update) {
            updates.add(update);
        }

        @Override
        public void onMalformedMessage(String reason) {
            malformed.add(reason);
        }
    }

    @Test
    @DisplayName("subscribes to blocks with transactions and banking stage errors")
    void subscribeRequest() throws Exception {
        BankingStageProperties properties = new BankingStageProperties();
        properties.getSource().setCommitment(BankingStageProperties.Commitment.CONFIRMED);
        WebSocketEventSource source = source(properties);

        JsonNode request = new ObjectMapper().readTree(source.subscribeRequest());

        assertTrue(request.path("blocks").path("client").path("includeTransactions").asBoolean());
        assertFalse(request.path("blocks").path("client").path("includeAccounts").asBoolean());
        assertTrue(request.path("bankingTransactionErrors").asBoolean());
        assertEquals("confirmed", request.path("commitment").asText());
    }

    @Test
    @DisplayName("without url start only registers the listener")
    void startWithoutUrl() {
        WebSocketEventSource source = source(new BankingStageProperties());
        RecordingListener listener = new RecordingListener();

        source.start(listener);
        source.ensureConnected();

        assertFalse(source.getTracker().isConnected());
        assertEquals(0, source.getTracker().getConnectFailureCount());
        source.close();
    }

    @Test
    @DisplayName("passes decoded frames on and reports malformed ones")
    void handleMessage() {
        WebSocketEventSource source = source(new BankingStageProperties());
        RecordingListener listener = new RecordingListener();
        source.start(listener);

        source.handleMessage("{\"block\":{\"slot\":12,\"transactions\":[]}}");
        source.handleMessage("{\"ping\":{}}");
        source.handleMessage("{broken");

        assertEquals(1, listener.updates.size());
        assertEquals(12, ((BlockEvent) listener.updates.get(0)).slot());
        assertEquals(1, listener.malformed.size());
    }

    @Test
    @DisplayName("delivers nothing after close")
    void closed() {
        WebSocketEventSource source = source(new BankingStageProperties());
        RecordingListener listener = new RecordingListener();
        source.start(listener);
        source.close();

        source.handleMessage("{\"block\":{\"slot\":12}}");

        assertTrue(listener.updates.isEmpty());
    }

    @Test
    @DisplayName("an invalid url counts as a failed connection and allows the next attempt")
    void invalidUrl() {
        BankingStageProperties properties = new BankingStageProperties();
        properties.getSource().setUrl("ws://bad host:1/");
        WebSocketEventSource source = source(properties);

        source.start(new RecordingListener());
        source.ensureConnected();

        assertEquals(2, source.getTracker().getConnectFailureCount());
        assertEquals(2.0, registry.get("bankingstage_source_connect_failures_counter").functionCounter().count());
        assertEquals(0.0, registry.get("bankingstage_source_connected").gauge().value());
        source.close();
    }

    @Test
    @DisplayName("concurrent reconnect checks start a single handshake")
    void singleHandshake() throws Exception {
        List<Socket> accepted = new CopyOnWriteArrayList<>();
        try (ServerSocket server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            Thread acceptor = new Thread(() -> {
                while (!server.isClosed()) {
                    try {
                        accepted.add(server.accept());
                    } catch (IOException ex) {
                        return;
                    }
                }
            });
            acceptor.start();

            BankingStageProperties properties = new BankingStageProperties();
            properties.getSource().setUrl("ws://127.0.0.1:" + server.getLocalPort() + "/");
            WebSocketEventSource source = source(properties);
            source.start(new RecordingListener());

            CountDownLatch go = new CountDownLatch(1);
            Thread[] callers = new Thread[8];
            for (int i = 0; i < callers.length; i++) {
                callers[i] = new Thread(() -> {
                    try {
                        go.await();
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    }
                    source.ensureConnected();
                });
                callers[i].start();
            }
            go.countDown();
            for (Thread caller : callers) {
                caller.join();
            }

            long deadline = System.currentTimeMillis() + 5_000;
            while (accepted.isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            Thread.sleep(300);

            assertEquals(1, accepted.size());
            source.close();
            for (Socket socket : accepted) {
                socket.close();
            }
        }
    }
}
