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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class SourceConnectionTrackerTest {

    @Test
    void clearsLastErrorOnConnect() {
        SourceConnectionTracker tracker = new SourceConnectionTracker();

        tracker.onConnectFailure(new IllegalStateException("refused"));
        assertEquals("refused", tracker.getLastError());
        assertEquals(1, tracker.getConnectFailureCount());

        tracker.onConnect();
        assertNull(tracker.getLastError());
        assertTrue(tracker.isConnected());
        assertNotNull(tracker.getConnectedSince());
    }

    @Test
    void tracksDisconnects() {
        SourceConnectionTracker tracker = new SourceConnectionTracker();

        tracker.onConnect();
        tracker.onError(new IllegalStateException("reset"));
        tracker.onDisconnect();
        tracker.onConnect();
        tracker.onDisconnect();

        assertEquals(2, tracker.getConnectCount());
        assertEquals(2, tracker.getDisconnectCount());
        assertFalse(tracker.isConnected());
        assertNull(tracker.getConnectedSince());
    }

    @Test
    void recordsLastMessage() {
        SourceConnectionTracker tracker = new SourceConnectionTracker();
        assertNull(tracker.getLastMessageAt());

        tracker.onMessage();

        assertNotNull(tracker.getLastMessageAt());
    }
}
