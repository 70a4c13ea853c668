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
package com.arpnetworking.collaboration.impl;

import com.arpnetworking.collaboration.BridgeState;
import com.arpnetworking.collaboration.EventBridge;
import com.arpnetworking.collaboration.MetadataValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * Process-wide holder for a shared {@link EventBridge}, for callers that
 * cannot be handed a bridge instance directly. The bridge is built and
 * started on first use; the configuration supplier is consulted only then.
 * A disabled result is remembered as well, so the configuration is not
 * re-read until {@link #shutdown()} is called.
 *
 * <p>Shutdown is explicit: call {@link #shutdown()} from the application's
 * own lifecycle, or opt into {@link #installShutdownHook()}.</p>
 */
public final class EventBridges {

    /**
     * The shared bridge configured from the process environment.
     *
     * @return the running bridge, or empty if it is disabled
     */
    public static Optional<EventBridge> get() {
        return get(EnvironmentConfiguration::fromEnvironment);
    }

    /**
     * The shared bridge, building it from {@code configuration} if none
     * exists yet.
     *
     * @param configuration supplies the bridge configuration
     * @return the running bridge, or empty if it is disabled
     */
    public static Optional<EventBridge> get(final Supplier<HttpEventBridge.Builder> configuration) {
        @Nullable EventBridge instance = _instance;
        if (instance == null) {
            synchronized (LOCK) {
                instance = _instance;
                if (instance == null) {
                    instance = configuration.get().build();
                    instance.start();
                    _instance = instance;
                }
            }
        }
        if (instance.getState() == BridgeState.DISABLED) {
            return Optional.empty();
        }
        return Optional.of(instance);
    }

    /**
     * Emit an event through the shared bridge.
     *
     * @param type the event type
     * @param content the event content
     * @param operationId the producing operation
     * @param sessionId the session, if any
     * @param userId the user, if any
     * @param metadata additional metadata, if any
     * @return {@code true} if the event was queued for delivery
     */
    public static boolean emit(
            final String type,
            final String content,
            final String operationId,
            @Nullable final String sessionId,
            @Nullable final String userId,
            @Nullable final Map<String, MetadataValue> metadata) {
        return get()
                .map(bridge -> bridge.emit(type, content, operationId, sessionId, userId, metadata))
                .orElse(false);
    }

    /**
     * Stop the shared bridge, flushing pending events, and forget it. The
     * next {@link #get()} builds a new one. Callers of {@link #get()} and
     * {@link #emit} are not held up while the old bridge stops.
     */
    public static void shutdown() {
        @Nullable final EventBridge instance;
        synchronized (LOCK) {
            instance = _instance;
            _instance = null;
        }
        if (instance != null) {
            LOGGER.info("Shutting down shared collaboration event bridge");
            instance.close();
        }
    }

    /**
     * Register a JVM shutdown hook that calls {@link #shutdown()}. Only the
     * first call registers a hook.
     */
    public static void installShutdownHook() {
        if (HOOK_INSTALLED.compareAndSet(false, true)) {
            Runtime.getRuntime().addShutdownHook(new Thread(EventBridges::shutdown, "CollaborationEventBridgeShutdown"));
        }
    }

    private EventBridges() {}

    private static final Object LOCK = new Object();
    private static final AtomicBoolean HOOK_INSTALLED = new AtomicBoolean(false);
    private static final Logger LOGGER = LoggerFactory.getLogger(EventBridges.class);
    private static volatile @Nullable EventBridge _instance;
}
