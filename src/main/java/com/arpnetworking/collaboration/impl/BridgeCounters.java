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

import com.arpnetworking.collaboration.BridgeStatistics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Delivery counters of a bridge. Written by the dispatcher thread, read by
 * any thread.
 */
/* package private */ final class BridgeCounters {

    /* package private */ void record(final DispatchResult result, final int events) {
        switch (result.getOutcome()) {
            case SUCCESS:
                _eventsSent.addAndGet(events);
                _batchesSent.incrementAndGet();
                return;
            case CONNECTION_ERROR:
                _connectionErrors.incrementAndGet();
                break;
            case TIMEOUT:
                _timeoutErrors.incrementAndGet();
                break;
            case HTTP_ERROR:
                _httpErrors.incrementAndGet();
                break;
            default:
                throw new IllegalArgumentException("Unsupported outcome: " + result.getOutcome());
        }
        _eventsFailed.addAndGet(events);
    }

    /* package private */ BridgeStatistics.Builder snapshot() {
        return new BridgeStatistics.Builder()
                .setEventsSent(_eventsSent.get())
                .setEventsFailed(_eventsFailed.get())
                .setBatchesSent(_batchesSent.get())
                .setConnectionErrors(_connectionErrors.get())
                .setTimeoutErrors(_timeoutErrors.get())
                .setHttpErrors(_httpErrors.get());
    }

    private final AtomicLong _eventsSent = new AtomicLong(0);
    private final AtomicLong _eventsFailed = new AtomicLong(0);
    private final AtomicLong _batchesSent = new AtomicLong(0);
    private final AtomicLong _connectionErrors = new AtomicLong(0);
    private final AtomicLong _timeoutErrors = new AtomicLong(0);
    private final AtomicLong _httpErrors = new AtomicLong(0);
}
