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
import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The single consumer of an {@link EventQueue}. Polls the queue, batches
 * events and sends each batch synchronously; one batch is in flight at a
 * time. Failed batches are counted and discarded. Once stopped it drains the
 * queue and flushes whatever is left before returning.
 */
/* package private */ final class EventDispatcher implements Runnable {

    /* package private */ EventDispatcher(
            final EventQueue queue,
            final BatchAccumulator accumulator,
            final EventTransport transport,
            final BridgeCounters counters,
            final Duration pollInterval,
            final Optional<EventBridgeListener> listener,
            final RateLimitedLogger dispatchErrorLogger,
            final Logger logger,
            final Runnable onTerminated) {
        _queue = queue;
        _accumulator = accumulator;
        _transport = transport;
        _counters = counters;
        _pollInterval = pollInterval;
        _listener = listener;
        _dispatchErrorLogger = dispatchErrorLogger;
        _logger = logger;
        _onTerminated = onTerminated;
    }

    @Override
    public void run() {
        try {
            while (!_stopRequested.get() && !Thread.currentThread().isInterrupted()) {
                try {
                    final Optional<CollaborationEvent> event = _queue.get(_pollInterval);
                    event.ifPresent(_accumulator::add);
                    if (_accumulator.isFlushDue()) {
                        flush();
                    }
                    // CHECKSTYLE.OFF: IllegalCatch - Ensure exception neutrality
                } catch (final RuntimeException e) {
                    // CHECKSTYLE.ON: IllegalCatch
                    _dispatchErrorLogger.getLogger().error("Collaboration event dispatcher failure", e);
                }
            }
            drainAndFlush();
        } finally {
            _onTerminated.run();
        }
    }

    /* package private */ void requestStop() {
        _stopRequested.set(true);
    }

    private void drainAndFlush() {
        final List<CollaborationEvent> remaining = new ArrayList<>(_queue.size());
        _queue.drainTo(remaining, Integer.MAX_VALUE);
        if (!remaining.isEmpty() || !_accumulator.isEmpty()) {
            _logger.debug(String.format(
                    "Flushing pending events on stop; batched=%d, queued=%d",
                    _accumulator.size(),
                    remaining.size()));
        }
        for (final CollaborationEvent event : remaining) {
            _accumulator.add(event);
            if (_accumulator.isFull()) {
                flush();
            }
        }
        flush();
    }

    private void flush() {
        if (_accumulator.isEmpty()) {
            return;
        }
        final List<CollaborationEvent> batch = _accumulator.drain();

        DispatchResult result;
        try {
            result = _transport.send(batch);
            // CHECKSTYLE.OFF: IllegalCatch - Transport contract violations must not stop the dispatcher
        } catch (final RuntimeException e) {
            // CHECKSTYLE.ON: IllegalCatch
            result = DispatchResult.connectionError(e, 0, 0, Duration.ZERO);
        }
        _counters.record(result, batch.size());
        logResult(result, batch.size());

        if (_listener.isPresent()) {
            try {
                _listener.get().attemptComplete(result, batch.size());
                // CHECKSTYLE.OFF: IllegalCatch - Listener failures must not stop the dispatcher
            } catch (final RuntimeException e) {
                // CHECKSTYLE.ON: IllegalCatch
                _dispatchErrorLogger.getLogger().error("Collaboration event listener failure", e);
            }
        }
    }

    private void logResult(final DispatchResult result, final int events) {
        switch (result.getOutcome()) {
            case SUCCESS:
                _logger.debug(String.format(
                        "Sent event batch; events=%d, attempts=%d, bytes=%d, elapsed=%s",
                        events,
                        result.getAttempts(),
                        result.getBytes(),
                        result.getElapsed()));
                break;
            case CONNECTION_ERROR:
                _dispatchErrorLogger.getLogger().warn(
                        String.format(
                                "Connection error sending event batch; events=%d, attempts=%d",
                                events,
                                result.getAttempts()),
                        result.getCause().orElse(null));
                break;
            case TIMEOUT:
                _dispatchErrorLogger.getLogger().warn(
                        String.format(
                                "Timeout sending event batch; events=%d, attempts=%d",
                                events,
                                result.getAttempts()),
                        result.getCause().orElse(null));
                break;
            case HTTP_ERROR:
                _dispatchErrorLogger.getLogger().error(String.format(
                        "Received failure response when sending event batch; events=%d, attempts=%d, status=%d",
                        events,
                        result.getAttempts(),
                        result.getStatusCode()));
                break;
            default:
                break;
        }
    }

    private final EventQueue _queue;
    private final BatchAccumulator _accumulator;
    private final EventTransport _transport;
    private final BridgeCounters _counters;
    private final Duration _pollInterval;
    private final Optional<EventBridgeListener> _listener;
    private final RateLimitedLogger _dispatchErrorLogger;
    private final Logger _logger;
    private final Runnable _onTerminated;
    private final AtomicBoolean _stopRequested = new AtomicBoolean(false);
}
