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

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.net.http.WebSocketHandshakeException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import de.makibytes.bankingstage.config.BankingStageProperties;
import de.makibytes.bankingstage.metrics.BankingStageMetrics;
import de.makibytes.bankingstage.model.StreamUpdate;

/**
 * Event source reading JSON frames from a WebSocket endpoint. A dropped
 * connection is re-established by {@link #ensureConnected()}.
 */
@Component
public class WebSocketEventSource implements EventSource {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketEventSource.class);

    private final BankingStageProperties.Source properties;
    private final StreamUpdateDecoder decoder = new StreamUpdateDecoder();
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private final SourceConnectionTracker tracker = new SourceConnectionTracker();
    private final AtomicReference<WebSocket> webSocketRef = new AtomicReference<>();
    private final HttpClient httpClient;
    private volatile StreamUpdateListener listener;
    private volatile boolean closed;
    private final AtomicBoolean connecting = new AtomicBoolean();

    public WebSocketEventSource(BankingStageProperties properties, BankingStageMetrics metrics) {
        this.properties = properties.getSource();
        metrics.bindSourceConnection(tracker);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(this.properties.getConnectTimeoutMs()))
                .build();
    }

    @Override
    public void start(StreamUpdateListener listener) {
        this.listener = listener;
        this.closed = false;
        if (properties.getUrl() == null || properties.getUrl().isBlank()) {
            logger.warn("No banking-stage.source.url configured, not subscribing to any event stream");
            return;
        }
        if (!properties.getBankingAddresses().isEmpty()) {
            logger.info("Banking stage addresses: {}", properties.getBankingAddresses());
        }
        ensureConnected();
    }

    @Scheduled(fixedDelayString = "${banking-stage.source.reconnect-interval-ms:5000}",
            initialDelayString = "${banking-stage.source.reconnect-interval-ms:5000}")
    public void ensureConnected() {
        if (closed || listener == null || webSocketRef.get() != null) {
            return;
        }
        if (properties.getUrl() == null || properties.getUrl().isBlank()) {
            return;
        }
        if (!connecting.compareAndSet(false, true)) {
            return;
        }
        WebSocket.Builder builder = httpClient.newWebSocketBuilder();
        if (properties.getAccessToken() != null && !properties.getAccessToken().isBlank()) {
            builder.header("x-token", properties.getAccessToken());
        }
        URI uri;
        try {
            uri = URI.create(properties.getUrl());
        } catch (IllegalArgumentException ex) {
            logger.error("Invalid event source url {}: {}", properties.getUrl(), ex.getMessage());
            tracker.onConnectFailure(ex);
            connecting.set(false);
            return;
        }
        builder.buildAsync(uri, new Listener())
                .thenAccept(webSocket -> {
                    webSocketRef.set(webSocket);
                    connecting.set(false);
                    if (closed) {
                        webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "closing");
                    }
                })
                .exceptionally(ex -> {
                    String msg = ex.getMessage();
                    if (ex.getCause() instanceof WebSocketHandshakeException handshakeEx) {
                        msg = "Handshake failed (HTTP " + handshakeEx.getResponse().statusCode() + "): " + msg;
                    }
                    logger.error("Event source connection failure ({}): {}", properties.getUrl(), msg);
                    tracker.onConnectFailure(ex);
                    webSocketRef.set(null);
                    connecting.set(false);
                    return null;
                });
    }

    String subscribeRequest() {
        ObjectNode request = mapper.createObjectNode();
        ObjectNode blocks = request.putObject("blocks").putObject("client");
        blocks.put("includeTransactions", true);
        blocks.put("includeAccounts", false);
        blocks.put("includeEntries", false);
        request.put("bankingTransactionErrors", true);
        request.put("commitment", properties.getCommitment().name().toLowerCase());
        try {
            return mapper.writeValueAsString(request);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot encode subscribe request", ex);
        }
    }

    void handleMessage(String payload) {
        StreamUpdateListener current = listener;
        if (current == null || closed) {
            return;
        }
        try {
            Optional<StreamUpdate> update = decoder.decode(payload);
            update.ifPresent(current::onUpdate);
        } catch (MalformedMessageException ex) {
            logger.debug("Skipping malformed message: {}", ex.getMessage());
            current.onMalformedMessage(ex.getMessage());
        }
    }

    public SourceConnectionTracker getTracker() {
        return tracker;
    }

    @Override
    public void close() {
        closed = true;
        WebSocket webSocket = webSocketRef.getAndSet(null);
        if (webSocket != null) {
            logger.info("Closing event source connection");
            webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "shutdown");
            webSocket.abort();
        }
    }

    private class Listener implements WebSocket.Listener {

        private final StringBuilder buffer = new StringBuilder();

        @Override
        public void onOpen(WebSocket webSocket) {
            WebSocket.Listener.super.onOpen(webSocket);
            tracker.onConnect();
            logger.info("Connected to event source {} ({} commitment)", properties.getUrl(), properties.getCommitment());
            webSocket.sendText(subscribeRequest(), true);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buffer.append(data);
            if (last) {
                String payload = buffer.toString();
                buffer.setLength(0);
                tracker.onMessage();
                handleMessage(payload);
            }
            return WebSocket.Listener.super.onText(webSocket, data, last);
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            return WebSocket.Listener.super.onBinary(webSocket, data, last);
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            logger.error("Event source error: {}", error.getMessage());
            tracker.onError(error);
            tracker.onDisconnect();
            webSocketRef.compareAndSet(webSocket, null);
            WebSocket.Listener.super.onError(webSocket, error);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            logger.info("Event source closed ({}): {}", statusCode, reason);
            tracker.onDisconnect();
            webSocketRef.compareAndSet(webSocket, null);
            return WebSocket.Listener.super.onClose(webSocket, statusCode, reason);
        }
    }
}
