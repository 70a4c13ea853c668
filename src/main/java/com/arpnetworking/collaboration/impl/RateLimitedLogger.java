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

import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;

/**
 * Wraps a {@code Logger} so that at most one message is written per interval.
 * Callers obtain the logger to write through with {@link #getLogger()}; when
 * the interval has not elapsed a no-op logger is returned and the message is
 * counted as skipped. The skip count is reported with the next message that
 * gets through.
 */
/* package private */ final class RateLimitedLogger {

    /* package private */ RateLimitedLogger(
            final String name,
            final Logger logger,
            final Duration interval) {
        this(name, logger, interval, Clock.systemUTC());
    }

    /* package private */ RateLimitedLogger(
            final String name,
            final Logger logger,
            final Duration interval,
            final Clock clock) {
        _name = name;
        _logger = logger;
        _interval = interval;
        _clock = clock;
    }

    /* package private */ Logger getLogger() {
        final Instant now = _clock.instant();
        @Nullable final Instant last = _lastLogTime.get();
        if (last != null && now.isBefore(last.plus(_interval))) {
            _skipped.incrementAndGet();
            return NOPLogger.NOP_LOGGER;
        }
        if (!_lastLogTime.compareAndSet(last, now)) {
            // Another thread claimed this interval
            _skipped.incrementAndGet();
            return NOPLogger.NOP_LOGGER;
        }
        final long skipped = _skipped.getAndSet(0);
        if (skipped > 0) {
            _logger.info(String.format(
                    "Suppressed messages on rate limited logger; logger=%s, skipped=%d, since=%s",
                    _name,
                    skipped,
                    last));
        }
        return _logger;
    }

    private final String _name;
    private final Logger _logger;
    private final Duration _interval;
    private final Clock _clock;
    private final AtomicReference<Instant> _lastLogTime = new AtomicReference<>();
    private final AtomicLong _skipped = new AtomicLong(0);
}
