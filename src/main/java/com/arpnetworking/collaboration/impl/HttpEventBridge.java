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
import com.arpnetworking.collaboration.BridgeStatistics;
import com.arpnetworking.collaboration.CollaborationEvent;
import com.arpnetworking.collaboration.EventBridge;
import com.arpnetworking.collaboration.MetadataValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;

/**
 * {@link EventBridge} that batches events on a single background thread and
 * posts them to the collaboration endpoint over HTTP.
 */
public final class HttpEventBridge implements EventBridge {

    @Override
    public boolean emit(final String type, final String content, final String operationId) {
        return emit(type, content, operationId, null, null, null);
    }

    @Override
    public boolean emit(
            final String type,
            final String content,
            final String operationId,
            @Nullable final String sessionId,
            @Nullable final String userId,
            @Nullable final Map<String, MetadataValue> metadata) {
        if (_closed.get()) {
            return false;
        }
        final CollaborationEvent event;
        try {
            event = new CollaborationEvent.Builder()
                    .setId(UUID.randomUUID().toString())
                    .setType(type)
                    .setContent(content)
                    .setTimestamp(_clock.millis())
                    .setOperationId(operationId)
                    .setSessionId(sessionId)
                    .setUserId(userId)
                    .setMetadata(metadata)
                    .build();
        } catch (final IllegalStateException e) {
            _invalidEventLogger.getLogger().error("Rejected invalid collaboration event", e);
            return false;
        }
        return _queue.put(event);
    }

    @Override
    public void start() {
        synchronized (_lifecycleLock) {
            if (_closed.get()) {
                _logger.warn("Collaboration event bridge is closed and cannot be started");
                return;
            }
            if (_dispatcherThread != null && _dispatcherThread.isAlive()) {
                return;
            }
            _dispatcher = new EventDispatcher(
                    _queue,
                    new BatchAccumulator(_batchSize, _batchTimeout, _clock),
                    _transport,
                    _counters,
                    _pollInterval,
                    _listener,
                    _dispatchErrorLogger,
                    _logger,
                    () -> _state.compareAndSet(BridgeState.STOPPING, BridgeState.STOPPED));
            _dispatcherThread = new Thread(_dispatcher, WORKER_THREAD_NAME);
            _dispatcherThread.setDaemon(true);
            _state.set(BridgeState.RUNNING);
            _dispatcherThread.start();
            _logger.info(String.format(
                    "Collaboration event bridge started; uri=%s, batchSize=%d, batchTimeout=%s",
                    _uri,
                    _batchSize,
                    _batchTimeout));
        }
    }

    @Override
    public void stop() {
        stop(_stopTimeout);
    }

    @Override
    public void stop(final Duration timeout) {
        synchronized (_lifecycleLock) {
            if (_dispatcherThread == null || !_dispatcherThread.isAlive()) {
                return;
            }
            _logger.info("Stopping collaboration event bridge");
            _state.set(BridgeState.STOPPING);
            _dispatcher.requestStop();
            try {
                _dispatcherThread.join(Math.max(1, timeout.toMillis()));
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (_dispatcherThread.isAlive()) {
                _logger.warn(String.format(
                        "Collaboration event bridge did not stop within timeout; abandoning dispatcher; timeout=%s, queueSize=%d",
                        timeout,
                        _queue.size()));
            } else {
                _state.set(BridgeState.STOPPED);
                _logger.info(String.format(
                        "Collaboration event bridge stopped; statistics=%s",
                        getStatistics()));
            }
        }
    }

    @Override
    public BridgeStatistics getStatistics() {
        return _counters.snapshot()
                .setQueueSize(_queue.size())
                .setDroppedEvents(_queue.droppedCount())
                .setEnabled(true)
                .setState(_state.get())
                .build();
    }

    @Override
    public BridgeState getState() {
        return _state.get();
    }

    /**
     * Stop the bridge and release its connection pool. The bridge cannot be
     * restarted afterwards and rejects further events.
     */
    @Override
    public void close() {
        synchronized (_lifecycleLock) {
            if (!_closed.compareAndSet(false, true)) {
                return;
            }
            stop();
            _transport.close();
        }
    }

    /* package private */ boolean isDispatcherAlive() {
        synchronized (_lifecycleLock) {
            return _dispatcherThread != null && _dispatcherThread.isAlive();
        }
    }

    private HttpEventBridge(final Builder builder) {
        this(
                builder,
                new ApacheHttpTransport.Builder()
                        .setUri(builder._uri)
                        .setApiKey(builder._apiKey)
                        .setMaxRetries(builder._maxRetries)
                        .setRetryBackoff(builder._retryBackoff)
                        .setRequestTimeout(builder._requestTimeout)
                        .setMaxConnectionsPerRoute(builder._maxConnectionsPerRoute)
                        .setMaxConnectionsTotal(builder._maxConnectionsTotal)
                        .build(),
                Clock.systemUTC(),
                LOGGER);
    }

    /* package private */ HttpEventBridge(
            final Builder builder,
            final EventTransport transport,
            final Clock clock,
            final Logger logger) {
        _uri = builder._uri;
        _batchSize = builder._batchSize;
        _batchTimeout = builder._batchTimeout;
        _pollInterval = builder._pollInterval;
        _stopTimeout = builder._stopTimeout;
        _listener = Optional.ofNullable(builder._listener);
        _transport = transport;
        _clock = clock;
        _logger = logger;
        _dispatchErrorLogger = new RateLimitedLogger(
                "DispatchErrorLogger",
                logger,
                builder._dispatchErrorLoggingInterval);
        _invalidEventLogger = new RateLimitedLogger(
                "InvalidEventLogger",
                logger,
                builder._dispatchErrorLoggingInterval);
        _queue = new EventQueue(
                builder._queueCapacity,
                builder._queueOfferTimeout,
                _listener,
                new RateLimitedLogger(
                        "EventsDroppedLogger",
                        logger,
                        builder._eventsDroppedLoggingInterval));
    }

    private final URI _uri;
    private final int _batchSize;
    private final Duration _batchTimeout;
    private final Duration _pollInterval;
    private final Duration _stopTimeout;
    private final Optional<EventBridgeListener> _listener;
    private final EventTransport _transport;
    private final Clock _clock;
    private final Logger _logger;
    private final RateLimitedLogger _dispatchErrorLogger;
    private final RateLimitedLogger _invalidEventLogger;
    private final EventQueue _queue;
    private final BridgeCounters _counters = new BridgeCounters();
    private final AtomicReference<BridgeState> _state = new AtomicReference<>(BridgeState.STOPPED);
    private final AtomicBoolean _closed = new AtomicBoolean(false);
    private final Object _lifecycleLock = new Object();
    private @Nullable Thread _dispatcherThread;
    private @Nullable EventDispatcher _dispatcher;

    /* package private */ static final String WORKER_THREAD_NAME = "CollaborationEventBridgeWorker";

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpEventBridge.class);

    /**
     * Builder for {@link HttpEventBridge}. Holds the already resolved bridge
     * configuration; see {@link EnvironmentConfiguration} for populating it
     * from the process environment.
     */
    public static final class Builder {

        /**
         * Set the URI of the ingestion endpoint. Optional; default is
         * {@code http://localhost:8081/api/events}.
         *
         * @param value The uri of the HTTP endpoint.
         * @return This {@link Builder} instance.
         */
        public Builder setUri(@Nullable final URI value) {
            _uri = value;
            return this;
        }

        /**
         * Set the credential sent with every request. Without a credential
         * the bridge is disabled. Optional; default is {@code null}.
         *
         * @param value The credential.
         * @return This {@link Builder} instance.
         */
        public Builder setApiKey(@Nullable final String value) {
            _apiKey = value;
            return this;
        }

        /**
         * Set whether the bridge is enabled. Optional; default is {@code true}.
         *
         * @param value Whether the bridge is enabled.
         * @return This {@link Builder} instance.
         */
        public Builder setEnabled(@Nullable final Boolean value) {
            _enabled = value;
            return this;
        }

        /**
         * Set the batch size; a batch is sent as soon as it holds this many
         * events. Optional; default is 10.
         *
         * @param value The batch size.
         * @return This {@link Builder} instance.
         */
        public Builder setBatchSize(@Nullable final Integer value) {
            _batchSize = value;
            return this;
        }

        /**
         * Set the batch timeout; a partial batch is sent once it has waited
         * this long. Optional; default is 500 milliseconds.
         *
         * @param value The batch timeout.
         * @return This {@link Builder} instance.
         */
        public Builder setBatchTimeout(@Nullable final Duration value) {
            _batchTimeout = value;
            return this;
        }

        /**
         * Set the number of retries per batch for network failures and
         * retriable statuses; at most 10. Optional; default is 3.
         *
         * @param value The maximum number of retries.
         * @return This {@link Builder} instance.
         */
        public Builder setMaxRetries(@Nullable final Integer value) {
            _maxRetries = value;
            return this;
        }

        /**
         * Set the backoff before the first retry; it doubles on each further
         * retry. Optional; default is 500 milliseconds.
         *
         * @param value The base backoff.
         * @return This {@link Builder} instance.
         */
        public Builder setRetryBackoff(@Nullable final Duration value) {
            _retryBackoff = value;
            return this;
        }

        /**
         * Set the per request timeout; must be positive. Optional; default is
         * 5 seconds.
         *
         * @param value The request timeout.
         * @return This {@link Builder} instance.
         */
        public Builder setRequestTimeout(@Nullable final Duration value) {
            _requestTimeout = value;
            return this;
        }

        /**
         * Set the queue capacity in number of events. Optional; default is 1,000.
         *
         * @param value The queue capacity.
         * @return This {@link Builder} instance.
         */
        public Builder setQueueCapacity(@Nullable final Integer value) {
            _queueCapacity = value;
            return this;
        }

        /**
         * Set how long an emit waits for room in a full queue before the
         * event is dropped. Optional; default is 100 milliseconds.
         *
         * @param value The offer timeout.
         * @return This {@link Builder} instance.
         */
        public Builder setQueueOfferTimeout(@Nullable final Duration value) {
            _queueOfferTimeout = value;
            return this;
        }

        /**
         * Set how long the dispatcher waits for an event before re-checking
         * the batch timeout and stop signal; must be positive. Optional;
         * default is 100 milliseconds.
         *
         * @param value The poll interval.
         * @return This {@link Builder} instance.
         */
        public Builder setPollInterval(@Nullable final Duration value) {
            _pollInterval = value;
            return this;
        }

        /**
         * Set the default wait used by {@link HttpEventBridge#stop()}.
         * Optional; default is 5 seconds.
         *
         * @param value The stop timeout.
         * @return This {@link Builder} instance.
         */
        public Builder setStopTimeout(@Nullable final Duration value) {
            _stopTimeout = value;
            return this;
        }

        /**
         * Set the number of pooled connections per route. Optional; default is 10.
         *
         * @param value The connection count.
         * @return This {@link Builder} instance.
         */
        public Builder setMaxConnectionsPerRoute(@Nullable final Integer value) {
            _maxConnectionsPerRoute = value;
            return this;
        }

        /**
         * Set the total number of pooled connections. Optional; default is 20.
         *
         * @param value The connection count.
         * @return This {@link Builder} instance.
         */
        public Builder setMaxConnectionsTotal(@Nullable final Integer value) {
            _maxConnectionsTotal = value;
            return this;
        }

        /**
         * Set the events dropped logging interval. Any event drop notices will
         * be logged at most once per interval. Optional; default is 1 minute.
         *
         * @param value The logging interval.
         * @return This {@link Builder} instance.
         */
        public Builder setEventsDroppedLoggingInterval(@Nullable final Duration value) {
            _eventsDroppedLoggingInterval = value;
            return this;
        }

        /**
         * Set the dispatch error logging interval. Any dispatch errors will be
         * logged at most once per interval. Optional; default is 1 minute.
         *
         * @param value The logging interval.
         * @return This {@link Builder} instance.
         */
        public Builder setDispatchErrorLoggingInterval(@Nullable final Duration value) {
            _dispatchErrorLoggingInterval = value;
            return this;
        }

        /**
         * Set the listener. Optional; default is {@code null}.
         *
         * @param value The listener.
         * @return This {@link Builder} instance.
         */
        public Builder setListener(@Nullable final EventBridgeListener value) {
            _listener = value;
            return this;
        }

        /**
         * Create an instance of {@link EventBridge}. The bridge is not
         * started. A disabled bridge is returned if the bridge is turned off,
         * has no credential or is misconfigured.
         *
         * @return Instance of {@link EventBridge}.
         */
        public EventBridge build() {
            // Defaults
            applyDefaults();

            // Gate
            if (!_enabled) {
                LOGGER.info("Collaboration event bridge disabled by configuration");
                return new DisabledEventBridge("disabled by configuration");
            }
            if (_apiKey == null || _apiKey.isEmpty()) {
                LOGGER.info("Collaboration event bridge disabled; no api key configured");
                return new DisabledEventBridge("no api key configured");
            }

            // Validate
            final List<String> failures = new ArrayList<>();
            validate(failures);

            // Fallback
            if (!failures.isEmpty()) {
                LOGGER.warn(String.format(
                        "Unable to construct %s, bridge disabled; failures=%s",
                        this.getClass().getEnclosingClass().getSimpleName(),
                        failures));
                return new DisabledEventBridge(failures);
            }

            return new HttpEventBridge(this);
        }

        /* package private */ HttpEventBridge build(final EventTransport transport, final Clock clock, final Logger logger) {
            applyDefaults();
            final List<String> failures = new ArrayList<>();
            validate(failures);
            if (!failures.isEmpty()) {
                throw new IllegalStateException("Invalid bridge configuration: " + failures);
            }
            return new HttpEventBridge(this, transport, clock, logger);
        }

        private void applyDefaults() {
            if (_uri == null) {
                _uri = DEFAULT_URI;
                LOGGER.info(String.format(
                        "Defaulted null uri; uri=%s",
                        _uri));
            }
            if (_enabled == null) {
                _enabled = DEFAULT_ENABLED;
            }
            if (_batchSize == null) {
                _batchSize = DEFAULT_BATCH_SIZE;
                LOGGER.info(String.format(
                        "Defaulted null batch size; batchSize=%s",
                        _batchSize));
            }
            if (_batchTimeout == null) {
                _batchTimeout = DEFAULT_BATCH_TIMEOUT;
                LOGGER.info(String.format(
                        "Defaulted null batch timeout; batchTimeout=%s",
                        _batchTimeout));
            }
            if (_maxRetries == null) {
                _maxRetries = DEFAULT_MAX_RETRIES;
                LOGGER.info(String.format(
                        "Defaulted null max retries; maxRetries=%s",
                        _maxRetries));
            }
            if (_retryBackoff == null) {
                _retryBackoff = DEFAULT_RETRY_BACKOFF;
                LOGGER.info(String.format(
                        "Defaulted null retry backoff; retryBackoff=%s",
                        _retryBackoff));
            }
            if (_requestTimeout == null) {
                _requestTimeout = DEFAULT_REQUEST_TIMEOUT;
                LOGGER.info(String.format(
                        "Defaulted null request timeout; requestTimeout=%s",
                        _requestTimeout));
            }
            if (_queueCapacity == null) {
                _queueCapacity = DEFAULT_QUEUE_CAPACITY;
                LOGGER.info(String.format(
                        "Defaulted null queue capacity; queueCapacity=%s",
                        _queueCapacity));
            }
            if (_queueOfferTimeout == null) {
                _queueOfferTimeout = DEFAULT_QUEUE_OFFER_TIMEOUT;
                LOGGER.info(String.format(
                        "Defaulted null queue offer timeout; queueOfferTimeout=%s",
                        _queueOfferTimeout));
            }
            if (_pollInterval == null) {
                _pollInterval = DEFAULT_POLL_INTERVAL;
                LOGGER.info(String.format(
                        "Defaulted null poll interval; pollInterval=%s",
                        _pollInterval));
            }
            if (_stopTimeout == null) {
                _stopTimeout = DEFAULT_STOP_TIMEOUT;
                LOGGER.info(String.format(
                        "Defaulted null stop timeout; stopTimeout=%s",
                        _stopTimeout));
            }
            if (_maxConnectionsPerRoute == null) {
                _maxConnectionsPerRoute = DEFAULT_MAX_CONNECTIONS_PER_ROUTE;
                LOGGER.info(String.format(
                        "Defaulted null max connections per route; maxConnectionsPerRoute=%s",
                        _maxConnectionsPerRoute));
            }
            if (_maxConnectionsTotal == null) {
                _maxConnectionsTotal = DEFAULT_MAX_CONNECTIONS_TOTAL;
                LOGGER.info(String.format(
                        "Defaulted null max connections total; maxConnectionsTotal=%s",
                        _maxConnectionsTotal));
            }
            if (_eventsDroppedLoggingInterval == null) {
                _eventsDroppedLoggingInterval = DEFAULT_EVENTS_DROPPED_LOGGING_INTERVAL;
                LOGGER.info(String.format(
                        "Defaulted null events dropped logging interval; eventsDroppedLoggingInterval=%s",
                        _eventsDroppedLoggingInterval));
            }
            if (_dispatchErrorLoggingInterval == null) {
                _dispatchErrorLoggingInterval = DEFAULT_DISPATCH_ERROR_LOGGING_INTERVAL;
                LOGGER.info(String.format(
                        "Defaulted null dispatch error logging interval; dispatchErrorLoggingInterval=%s",
                        _dispatchErrorLoggingInterval));
            }
        }

        private void validate(final List<String> failures) {
            if (!"http".equalsIgnoreCase(_uri.getScheme()) && !"https".equalsIgnoreCase(_uri.getScheme())) {
                failures.add(String.format("URI must be an http(s) URI; uri=%s", _uri));
            }
            if (_batchSize < 1) {
                failures.add(String.format("Batch size must be positive; batchSize=%s", _batchSize));
            }
            if (_queueCapacity < 1) {
                failures.add(String.format("Queue capacity must be positive; queueCapacity=%s", _queueCapacity));
            }
            if (_maxRetries < 0 || _maxRetries > MAX_RETRIES_LIMIT) {
                failures.add(String.format(
                        "Max retries must be between 0 and %d; maxRetries=%s",
                        MAX_RETRIES_LIMIT,
                        _maxRetries));
            }
            if (_maxConnectionsPerRoute < 1 || _maxConnectionsTotal < _maxConnectionsPerRoute) {
                failures.add(String.format(
                        "Connection pool must allow at least one connection per route; maxConnectionsPerRoute=%s, maxConnectionsTotal=%s",
                        _maxConnectionsPerRoute,
                        _maxConnectionsTotal));
            }
            validateDuration(failures, "batchTimeout", _batchTimeout);
            validateDuration(failures, "retryBackoff", _retryBackoff);
            validateTimeout(failures, "requestTimeout", _requestTimeout);
            validateDuration(failures, "queueOfferTimeout", _queueOfferTimeout);
            validateTimeout(failures, "pollInterval", _pollInterval);
            validateDuration(failures, "stopTimeout", _stopTimeout);
        }

        private static void validateTimeout(final List<String> failures, final String name, final Duration value) {
            if (value.isNegative() || value.isZero() || value.compareTo(MAX_TIMEOUT) > 0) {
                failures.add(String.format("Duration must be positive and at most %s; %s=%s", MAX_TIMEOUT, name, value));
            }
        }

        private static void validateDuration(final List<String> failures, final String name, final Duration value) {
            if (value.isNegative()) {
                failures.add(String.format("Duration must not be negative; %s=%s", name, value));
            }
        }

        private URI _uri = DEFAULT_URI;
        private @Nullable String _apiKey;
        private Boolean _enabled = DEFAULT_ENABLED;
        private Integer _batchSize = DEFAULT_BATCH_SIZE;
        private Duration _batchTimeout = DEFAULT_BATCH_TIMEOUT;
        private Integer _maxRetries = DEFAULT_MAX_RETRIES;
        private Duration _retryBackoff = DEFAULT_RETRY_BACKOFF;
        private Duration _requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Integer _queueCapacity = DEFAULT_QUEUE_CAPACITY;
        private Duration _queueOfferTimeout = DEFAULT_QUEUE_OFFER_TIMEOUT;
        private Duration _pollInterval = DEFAULT_POLL_INTERVAL;
        private Duration _stopTimeout = DEFAULT_STOP_TIMEOUT;
        private Integer _maxConnectionsPerRoute = DEFAULT_MAX_CONNECTIONS_PER_ROUTE;
        private Integer _maxConnectionsTotal = DEFAULT_MAX_CONNECTIONS_TOTAL;
        private Duration _eventsDroppedLoggingInterval = DEFAULT_EVENTS_DROPPED_LOGGING_INTERVAL;
        private Duration _dispatchErrorLoggingInterval = DEFAULT_DISPATCH_ERROR_LOGGING_INTERVAL;
        private @Nullable EventBridgeListener _listener;

        /* package private */ static final int MAX_RETRIES_LIMIT = 10;
        /* package private */ static final Duration MAX_TIMEOUT = Duration.ofMillis(Integer.MAX_VALUE);
        /* package private */ static final URI DEFAULT_URI = URI.create("http://localhost:8081/api/events");
        private static final Boolean DEFAULT_ENABLED = Boolean.TRUE;
        private static final Integer DEFAULT_BATCH_SIZE = 10;
        private static final Duration DEFAULT_BATCH_TIMEOUT = Duration.ofMillis(500);
        private static final Integer DEFAULT_MAX_RETRIES = 3;
        private static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofMillis(500);
        private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(5);
        private static final Integer DEFAULT_QUEUE_CAPACITY = 1000;
        private static final Duration DEFAULT_QUEUE_OFFER_TIMEOUT = Duration.ofMillis(100);
        private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);
        private static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(5);
        private static final Integer DEFAULT_MAX_CONNECTIONS_PER_ROUTE = 10;
        private static final Integer DEFAULT_MAX_CONNECTIONS_TOTAL = 20;
        private static final Duration DEFAULT_EVENTS_DROPPED_LOGGING_INTERVAL = Duration.ofMinutes(1);
        private static final Duration DEFAULT_DISPATCH_ERROR_LOGGING_INTERVAL = Duration.ofMinutes(1);
    }
}
