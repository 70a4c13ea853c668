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
import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.http.Header;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.conn.ConnectTimeoutException;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.message.BasicHeader;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link EventTransport} that posts each batch as JSON using the Apache HTTP
 * library. Connections are pooled and kept alive across batches. Network
 * failures, timeouts and statuses 429, 500, 502, 503 and 504 are retried with
 * exponential backoff; everything else is returned to the caller as is.
 */
public final class ApacheHttpTransport implements EventTransport {

    @Override
    public DispatchResult send(final List<CollaborationEvent> events) {
        final long startNanos = System.nanoTime();
        final byte[] body;
        try {
            body = _serializer.serialize(events);
        } catch (final JsonProcessingException e) {
            _logger.error(
                    String.format(
                            "Unable to serialize event batch; uri=%s, events=%d",
                            _uri,
                            events.size()),
                    e);
            return DispatchResult.connectionError(e, 0, 0, elapsedSince(startNanos));
        }

        int attempt = 0;
        while (true) {
            ++attempt;
            final DispatchResult result = attempt(body, attempt, startNanos);
            if (result.isSuccess() || attempt > _maxRetries || !isRetriable(result)) {
                return result;
            }

            final Duration backoff = backoffFor(attempt);
            _logger.debug(String.format(
                    "Retrying event batch; uri=%s, attempt=%d, outcome=%s, status=%d, backoff=%s",
                    _uri,
                    attempt,
                    result.getOutcome(),
                    result.getStatusCode(),
                    backoff));
            try {
                _sleeper.sleep(backoff);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                return result;
            }
        }
    }

    @Override
    public void close() {
        try {
            _httpClient.close();
        } catch (final IOException e) {
            _logger.warn(String.format("Failed to close http client; uri=%s", _uri), e);
        }
    }

    /* package private */ Duration backoffFor(final int attempt) {
        return _retryBackoff.multipliedBy(1L << Math.min(attempt - 1, MAX_BACKOFF_SHIFT));
    }

    private DispatchResult attempt(final byte[] body, final int attempt, final long startNanos) {
        final HttpPost post = new HttpPost(_uri);
        post.setHeader(CONTENT_TYPE_HEADER);
        post.setHeader(USER_AGENT_HEADER);
        post.setHeader(_apiKeyHeader);
        post.setEntity(new ByteArrayEntity(body));

        try (CloseableHttpResponse response = _httpClient.execute(post)) {
            final int statusCode = response.getStatusLine().getStatusCode();
            EntityUtils.consumeQuietly(response.getEntity());
            if ((statusCode / 100) == 2) {
                return DispatchResult.success(statusCode, attempt, body.length, elapsedSince(startNanos));
            }
            return DispatchResult.httpError(statusCode, attempt, body.length, elapsedSince(startNanos));
        } catch (final SocketTimeoutException | ConnectTimeoutException e) {
            return DispatchResult.timeout(e, attempt, body.length, elapsedSince(startNanos));
            // CHECKSTYLE.OFF: IllegalCatch - Prevent leaking exceptions into the dispatcher
        } catch (final RuntimeException | IOException e) {
            // CHECKSTYLE.ON: IllegalCatch
            return DispatchResult.connectionError(e, attempt, body.length, elapsedSince(startNanos));
        }
    }

    private static boolean isRetriable(final DispatchResult result) {
        switch (result.getOutcome()) {
            case TIMEOUT:
                return true;
            case CONNECTION_ERROR:
                return result.getCause().filter(c -> c instanceof IOException).isPresent();
            case HTTP_ERROR:
                return RETRIABLE_STATUS_CODES.contains(result.getStatusCode());
            default:
                return false;
        }
    }

    private static Duration elapsedSince(final long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /* package private */ static void safeSleep(final Duration duration) throws InterruptedException {
        Thread.sleep(duration.toMillis());
    }

    private ApacheHttpTransport(final Builder builder) {
        this(
                builder,
                createHttpClient(builder),
                ApacheHttpTransport::safeSleep,
                LOGGER);
    }

    /* package private */ ApacheHttpTransport(
            final Builder builder,
            final CloseableHttpClient httpClient,
            final Sleeper sleeper,
            final Logger logger) {
        _uri = builder._uri;
        _apiKeyHeader = new BasicHeader(API_KEY_HEADER_NAME, builder._apiKey);
        _maxRetries = builder._maxRetries;
        _retryBackoff = builder._retryBackoff;
        _httpClient = httpClient;
        _sleeper = sleeper;
        _logger = logger;
    }

    /* package private */ static CloseableHttpClient createHttpClient(final Builder builder) {
        final PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setDefaultMaxPerRoute(builder._maxConnectionsPerRoute);
        connectionManager.setMaxTotal(builder._maxConnectionsTotal);

        final int timeoutMillis = (int) Math.max(1, Math.min(builder._requestTimeout.toMillis(), Integer.MAX_VALUE));
        final RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(timeoutMillis)
                .setConnectionRequestTimeout(timeoutMillis)
                .setSocketTimeout(timeoutMillis)
                .build();

        // Retries are driven by send() so the client's own handler is off
        return HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .disableAutomaticRetries()
                .build();
    }

    private final URI _uri;
    private final Header _apiKeyHeader;
    private final int _maxRetries;
    private final Duration _retryBackoff;
    private final CloseableHttpClient _httpClient;
    private final Sleeper _sleeper;
    private final Logger _logger;
    private final BatchSerializer _serializer = new BatchSerializer();

    /* package private */ static final String API_KEY_HEADER_NAME = "X-API-Key";
    /* package private */ static final String USER_AGENT = "CollaborationEventBridge/1.0";

    private static final Logger LOGGER = LoggerFactory.getLogger(ApacheHttpTransport.class);
    private static final Header CONTENT_TYPE_HEADER = new BasicHeader(HttpHeaders.CONTENT_TYPE, "application/json");
    private static final Header USER_AGENT_HEADER = new BasicHeader(HttpHeaders.USER_AGENT, USER_AGENT);
    private static final int SC_TOO_MANY_REQUESTS = 429;
    private static final int MAX_BACKOFF_SHIFT = 10;
    private static final Set<Integer> RETRIABLE_STATUS_CODES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            SC_TOO_MANY_REQUESTS,
            HttpStatus.SC_INTERNAL_SERVER_ERROR,
            HttpStatus.SC_BAD_GATEWAY,
            HttpStatus.SC_SERVICE_UNAVAILABLE,
            HttpStatus.SC_GATEWAY_TIMEOUT)));

    /**
     * Pause between retries.
     */
    @FunctionalInterface
    /* package private */ interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    /**
     * Builder for {@link ApacheHttpTransport}. All values are expected to have
     * been defaulted and validated by the caller.
     */
    public static final class Builder {

        /**
         * Set the ingestion endpoint.
         *
         * @param value the endpoint
         * @return This {@link Builder} instance.
         */
        public Builder setUri(final URI value) {
            _uri = value;
            return this;
        }

        /**
         * Set the credential sent in the {@code X-API-Key} header.
         *
         * @param value the credential
         * @return This {@link Builder} instance.
         */
        public Builder setApiKey(final String value) {
            _apiKey = value;
            return this;
        }

        /**
         * Set the number of retries after the first attempt.
         *
         * @param value the retry count
         * @return This {@link Builder} instance.
         */
        public Builder setMaxRetries(final int value) {
            _maxRetries = value;
            return this;
        }

        /**
         * Set the backoff before the first retry; each further retry doubles it.
         *
         * @param value the base backoff
         * @return This {@link Builder} instance.
         */
        public Builder setRetryBackoff(final Duration value) {
            _retryBackoff = value;
            return this;
        }

        /**
         * Set the connect, pool checkout and read timeout of each request.
         *
         * @param value the timeout
         * @return This {@link Builder} instance.
         */
        public Builder setRequestTimeout(final Duration value) {
            _requestTimeout = value;
            return this;
        }

        /**
         * Set the number of pooled connections per route.
         *
         * @param value the connection count
         * @return This {@link Builder} instance.
         */
        public Builder setMaxConnectionsPerRoute(final int value) {
            _maxConnectionsPerRoute = value;
            return this;
        }

        /**
         * Set the total number of pooled connections.
         *
         * @param value the connection count
         * @return This {@link Builder} instance.
         */
        public Builder setMaxConnectionsTotal(final int value) {
            _maxConnectionsTotal = value;
            return this;
        }

        /**
         * Create an instance of {@link ApacheHttpTransport}.
         *
         * @return Instance of {@link ApacheHttpTransport}.
         */
        public ApacheHttpTransport build() {
            return new ApacheHttpTransport(this);
        }

        private URI _uri;
        private String _apiKey;
        private int _maxRetries;
        private Duration _retryBackoff;
        private Duration _requestTimeout;
        private int _maxConnectionsPerRoute;
        private int _maxConnectionsTotal;
    }
}
