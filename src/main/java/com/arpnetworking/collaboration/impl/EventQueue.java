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
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded FIFO of events between producers and the dispatcher. Insertion
 * waits at most the configured offer timeout; when the queue is still full
 * the new event is discarded and counted.
 */
/* package private */ final class EventQueue {

    /* package private */ EventQueue(
            final int capacity,
            final Duration offerTimeout,
            final Optional<EventBridgeListener> listener,
            final RateLimitedLogger droppedLogger) {
        _capacity = capacity;
        _events = new ArrayBlockingQueue<>(capacity);
        _offerTimeout = offerTimeout;
        _listener = listener;
        _droppedLogger = droppedLogger;
    }

    /**
     * Attempt to enqueue an event.
     *
     * @param event the event
     * @return {@code true} if queued, {@code false} if dropped
     */
    /* package private */ boolean put(final CollaborationEvent event) {
        boolean accepted;
        try {
            accepted = _events.offer(event, _offerTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            accepted = false;
        }
        if (!accepted) {
            final long dropped = _droppedCount.incrementAndGet();
            final Logger logger = _droppedLogger.getLogger();
            logger.warn(String.format(
                    "Event queue is full; dropping event; id=%s, capacity=%d, dropped=%d",
                    event.getId(),
                    _capacity,
                    dropped));
            _listener.ifPresent(l -> l.droppedEvent(event));
        }
        return accepted;
    }

    /**
     * Remove the oldest event, waiting up to {@code timeout} for one to arrive.
     *
     * @param timeout maximum wait
     * @return the event, or empty on timeout or interruption
     */
    /* package private */ Optional<CollaborationEvent> get(final Duration timeout) {
        try {
            return Optional.ofNullable(_events.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    /* package private */ Optional<CollaborationEvent> poll() {
        return Optional.ofNullable(_events.poll());
    }

    /* package private */ int drainTo(final Collection<? super CollaborationEvent> target, final int maxEvents) {
        return _events.drainTo(target, maxEvents);
    }

    /* package private */ int size() {
        return _events.size();
    }

    /* package private */ int capacity() {
        return _capacity;
    }

    /* package private */ long droppedCount() {
        return _droppedCount.get();
    }

    private final int _capacity;
    private final BlockingQueue<CollaborationEvent> _events;
    private final Duration _offerTimeout;
    private final Optional<EventBridgeListener> _listener;
    private final RateLimitedLogger _droppedLogger;
    private final AtomicLong _droppedCount = new AtomicLong(0);
}
