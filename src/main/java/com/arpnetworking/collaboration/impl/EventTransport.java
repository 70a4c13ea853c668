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

import java.io.Closeable;
import java.util.List;

/**
 * Delivers one batch of events to the collaboration endpoint. Implementations
 * report every failure through the returned {@link DispatchResult} and never
 * throw.
 */
public interface EventTransport extends Closeable {

    /**
     * Send the batch as a single request, retrying transient failures
     * according to the transport's policy.
     *
     * @param events the batch; never empty
     * @return the outcome of the exchange
     */
    DispatchResult send(List<CollaborationEvent> events);

    /**
     * Release pooled connections. Does not throw.
     */
    @Override
    void close();
}
