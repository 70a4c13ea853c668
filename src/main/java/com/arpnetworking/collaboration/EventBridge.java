/*
 * Copyright 2026 Inscope Metrics, Inc
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
 */
package com.arpnetworking.collaboration;

import java.time.Duration;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Bridge that forwards {@link CollaborationEvent} instances to a remote
 * collaboration endpoint. Emitting never blocks the caller for more than a
 * short bounded interval and never throws because of delivery problems.
 */
public interface EventBridge extends AutoCloseable {

    /**
     * Emit an event without session, user or metadata.
     *
     * @param type the event type
     * @param content the event content
     * @param operationId the producing operation
     * @return {@code true} if the event was queued for delivery
     */
    boolean emit(String type, String content, String operationId);

    /**
     * Emit an event.
     *
     * @param type the event type
     * @param content the event content
     * @param operationId the producing operation
     * @param sessionId the session, if any
     * @param userId the user, if any
     * @param metadata additional metadata, if any
     * @return {@code true} if the event was queued for delivery
     */
    boolean emit(
            String type,
            String content,
            String operationId,
            @Nullable String sessionId,
            @Nullable String userId,
            @Nullable Map<String, MetadataValue> metadata);

    /**
     * Start the dispatcher. Has no effect if it is already running or if the
     * bridge is disabled.
     */
    void start();

    /**
     * Stop the dispatcher, flushing any pending events, and wait up to the
     * default timeout for it to finish.
     */
    void stop();

    /**
     * Stop the dispatcher, flushing any pending events, and wait up to the
     * given timeout for it to finish. Has no effect if it is not running.
     *
     * @param timeout maximum time to wait for the dispatcher
     */
    void stop(Duration timeout);

    /**
     * Snapshot of the bridge's counters.
     *
     * @return the current {@link BridgeStatistics}
     */
    BridgeStatistics getStatistics();

    BridgeState getState();

    /**
     * Stop the bridge as {@link #stop()} does and release its resources.
     * The bridge is terminal afterwards: it cannot be started again and
     * every further emit returns {@code false}.
     */
    @Override
    void close();
}
