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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Current batch of the dispatcher. A flush is due once the batch holds
 * {@code batchSize} events or once it is non-empty and {@code batchTimeout}
 * has passed since the last flush. An event arriving after an idle period
 * is therefore due on the next check.
 *
 * <p>Not thread safe; owned by the dispatcher thread.</p>
 */
/* package private */ final class BatchAccumulator {

    /* package private */ BatchAccumulator(final int batchSize, final Duration batchTimeout, final Clock clock) {
        _batchSize = batchSize;
        _batchTimeout = batchTimeout;
        _clock = clock;
        _lastFlush = clock.instant();
        _batch = new ArrayList<>(batchSize);
    }

    /* package private */ void add(final CollaborationEvent event) {
        _batch.add(event);
    }

    /* package private */ boolean isFull() {
        return _batch.size() >= _batchSize;
    }

    /* package private */ boolean isFlushDue() {
        if (_batch.isEmpty()) {
            return false;
        }
        if (isFull()) {
            return true;
        }
        return !_clock.instant().isBefore(_lastFlush.plus(_batchTimeout));
    }

    /* package private */ boolean isEmpty() {
        return _batch.isEmpty();
    }

    /* package private */ int size() {
        return _batch.size();
    }

    /**
     * Hand out the current batch and start a new one.
     *
     * @return the events accumulated so far, in arrival order
     */
    /* package private */ List<CollaborationEvent> drain() {
        final List<CollaborationEvent> drained = Collections.unmodifiableList(_batch);
        _batch = new ArrayList<>(_batchSize);
        _lastFlush = _clock.instant();
        return drained;
    }

    private final int _batchSize;
    private final Duration _batchTimeout;
    private final Clock _clock;
    private List<CollaborationEvent> _batch;
    private Instant _lastFlush;
}
