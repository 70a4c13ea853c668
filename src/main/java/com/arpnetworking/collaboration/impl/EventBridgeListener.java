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

import com.arpnetworking.collaboration.CollaborationEvent;

/**
 * Interface for callbacks from {@link HttpEventBridge}. Callbacks are invoked
 * synchronously on the emitting thread (drops) or on the dispatcher thread
 * (attempts), so implementations must be fast and must not throw.
 */
public interface EventBridgeListener {

    /**
     * Callback invoked when a batch has been handed to the transport and the
     * exchange (including any retries) has finished.
     *
     * @param result the outcome of the exchange
     * @param events the number of events in the batch
     */
    void attemptComplete(DispatchResult result, int events);

    /**
     * Callback invoked when an event is rejected because the queue is full.
     *
     * @param event the {@link CollaborationEvent} dropped
     */
    void droppedEvent(CollaborationEvent event);
}
