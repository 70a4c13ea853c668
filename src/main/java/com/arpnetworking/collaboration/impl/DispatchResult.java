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

import java.time.Duration;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Outcome of sending one batch through an {@link EventTransport}.
 */
public final class DispatchResult {

    /**
     * Successful exchange.
     *
     * @param statusCode the final HTTP status
     * @param attempts number of requests made
     * @param bytes size of the request body
     * @param elapsed total time including backoff
     * @return new {@link DispatchResult}
     */
    public static DispatchResult success(
            final int statusCode,
            final int attempts,
            final long bytes,
            final Duration elapsed) {
        return new DispatchResult(Outcome.SUCCESS, statusCode, attempts, bytes, elapsed, null);
    }

    /**
     * The endpoint answered with a non-success status after retries were
     * exhausted or for a status that is not retried.
     *
     * @param statusCode the final HTTP status
     * @param attempts number of requests made
     * @param bytes size of the request body
     * @param elapsed total time including backoff
     * @return new {@link DispatchResult}
     */
    public static DispatchResult httpError(
            final int statusCode,
            final int attempts,
            final long bytes,
            final Duration elapsed) {
        return new DispatchResult(Outcome.HTTP_ERROR, statusCode, attempts, bytes, elapsed, null);
    }

    /**
     * The request could not be completed because of a network failure.
     *
     * @param cause the last failure
     * @param attempts number of requests made
     * @param bytes size of the request body
     * @param elapsed total time including backoff
     * @return new {@link DispatchResult}
     */
    public static DispatchResult connectionError(
            final Throwable cause,
            final int attempts,
            final long bytes,
            final Duration elapsed) {
        return new DispatchResult(Outcome.CONNECTION_ERROR, NO_STATUS, attempts, bytes, elapsed, cause);
    }

    /**
     * The request timed out.
     *
     * @param cause the last failure
     * @param attempts number of requests made
     * @param bytes size of the request body
     * @param elapsed total time including backoff
     * @return new {@link DispatchResult}
     */
    public static DispatchResult timeout(
            final Throwable cause,
            final int attempts,
            final long bytes,
            final Duration elapsed) {
        return new DispatchResult(Outcome.TIMEOUT, NO_STATUS, attempts, bytes, elapsed, cause);
    }

    public Outcome getOutcome() {
        return _outcome;
    }

    public boolean isSuccess() {
        return _outcome == Outcome.SUCCESS;
    }

    /**
     * The last HTTP status received, or {@code -1} if no response arrived.
     *
     * @return the status code
     */
    public int getStatusCode() {
        return _statusCode;
    }

    public int getAttempts() {
        return _attempts;
    }

    public long getBytes() {
        return _bytes;
    }

    public Duration getElapsed() {
        return _elapsed;
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(_cause);
    }

    @Override
    public String toString() {
        return String.format(
                "DispatchResult{outcome=%s, statusCode=%d, attempts=%d, bytes=%d, elapsed=%s, cause=%s}",
                _outcome,
                _statusCode,
                _attempts,
                _bytes,
                _elapsed,
                _cause);
    }

    private DispatchResult(
            final Outcome outcome,
            final int statusCode,
            final int attempts,
            final long bytes,
            final Duration elapsed,
            @Nullable final Throwable cause) {
        _outcome = outcome;
        _statusCode = statusCode;
        _attempts = attempts;
        _bytes = bytes;
        _elapsed = elapsed;
        _cause = cause;
    }

    private final Outcome _outcome;
    private final int _statusCode;
    private final int _attempts;
    private final long _bytes;
    private final Duration _elapsed;
    private final @Nullable Throwable _cause;

    private static final int NO_STATUS = -1;

    /**
     * Classification of a batch exchange.
     */
    public enum Outcome {
        /**
         * The endpoint accepted the batch.
         */
        SUCCESS,
        /**
         * The endpoint could not be reached.
         */
        CONNECTION_ERROR,
        /**
         * Connecting or reading the response took too long.
         */
        TIMEOUT,
        /**
         * The endpoint rejected the batch.
         */
        HTTP_ERROR
    }
}
