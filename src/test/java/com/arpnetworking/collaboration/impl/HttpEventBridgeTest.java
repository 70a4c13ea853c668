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
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.junit.WireMockRule;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.mockito.Mockito;
import org.slf4j.Logger;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Tests for {@link HttpEventBridge}.
 */
public final class HttpEventBridgeTest {

    @Test
    public void testExactBatchSizeSendsOneBatch() throws InterruptedException {
        final RecordingTransport transport = new RecordingTransport();
        final HttpEventBridge bridge = createBuilder(5).build(transport, Clock.systemUTC(), _logger);
        emit(bridge, 5);

        bridge.start();
        Assert.assertTrue(transport.awaitSends(1));
        bridge.stop();

        Assert.assertEquals(Collections.singletonList(5), transport.getBatchSizes());
        final BridgeStatistics statistics = bridge.getStatistics();
        Assert.assertEquals(5, statistics.getEventsSent());
        Assert.assertEquals(1, statistics.getBatchesSent());
        Assert.assertEquals(0, statistics.getEventsFailed());
        Assert.assertEquals(0, statistics.getQueueSize());
        Assert.assertEquals(BridgeState.STOPPED, statistics.getState());
        Assert.assertTrue(statistics.isEnabled());
    }

    @Test
    public void testFullBatchesThenRemainderOnStop() throws InterruptedException {
        final RecordingTransport transport = new RecordingTransport();
        final HttpEventBridge bridge = createBuilder(4).build(transport, Clock.systemUTC(), _logger);
        emit(bridge, 10);

        bridge.start();
        Assert.assertTrue(transport.awaitSends(2));
        bridge.stop();

        Assert.assertEquals(Arrays.asList(4, 4, 2), transport.getBatchSizes());
        Assert.assertEquals(10, bridge.getStatistics().getEventsSent());
        Assert.assertEquals(3, bridge.getStatistics().getBatchesSent());
        assertArrivalOrder(transport, 10);
    }

    @Test
    public void testStopFlushesPendingEvents() {
        final RecordingTransport transport = new RecordingTransport();
        final HttpEventBridge bridge = createBuilder(10).build(transport, Clock.systemUTC(), _logger);
        bridge.start();
        emit(bridge, 3);
        bridge.stop();

        Assert.assertEquals(Collections.singletonList(3), transport.getBatchSizes());
        Assert.assertEquals(0, bridge.getStatistics().getQueueSize());
        Assert.assertEquals(3, bridge.getStatistics().getEventsSent());
        Assert.assertEquals(BridgeState.STOPPED, bridge.getState());
        Assert.assertFalse(bridge.isDispatcherAlive());
    }

    @Test
    public void testStopDrainsQueueInBatches() {
        final RecordingTransport transport = new RecordingTransport();
        final HttpEventBridge bridge = createBuilder(3).build(transport, Clock.systemUTC(), _logger);
        emit(bridge, 7);
        bridge.start();
        bridge.stop();

        Assert.assertEquals(Arrays.asList(3, 3, 1), transport.getBatchSizes());
        Assert.assertEquals(7, bridge.getStatistics().getEventsSent());
        assertArrivalOrder(transport, 7);
    }

    @Test
    public void testPartialBatchFlushedAfterTimeout() throws InterruptedException {
        final RecordingTransport transport = new RecordingTransport();
        final HttpEventBridge bridge = createBuilder(10)
                .setBatchTimeout(Duration.ofMillis(100))
                .build(transport, Clock.systemUTC(), _logger);
        bridge.start();
        try {
            emit(bridge, 2);
            Assert.assertTrue(transport.awaitSends(1));
            Assert.assertEquals(BridgeState.RUNNING, bridge.getState());
            Assert.assertEquals(Collections.singletonList(2), transport.getBatchSizes());
        } finally {
            bridge.stop();
        }
        Assert.assertEquals(1, bridge.getStatistics().getBatchesSent());
    }

    @Test
    public void testQueueFullDropsEvents() {
        final AtomicInteger dropped = new AtomicInteger();
        final RecordingTransport transport = new RecordingTransport();
        final HttpEventBridge bridge = createBuilder(10)
                .setQueueCapacity(3)
                .setQueueOfferTimeout(Duration.ofMillis(1))
                .setListener(new EventBridgeListener() {
                    @Override
                    public void attemptComplete(final DispatchResult result, final int events) {
                    }

                    @Override
                    public void droppedEvent(final CollaborationEvent event) {
                        dropped.incrementAndGet();
                    }
                })
                .build(transport, Clock.systemUTC(), _logger);

        int accepted = 0;
        for (int i = 0; i < 5; ++i) {
            if (bridge.emit("stdout", "line " + i, "op-1")) {
                ++accepted;
            }
        }

        Assert.assertEquals(3, accepted);
        Assert.assertEquals(2, dropped.get());
        final BridgeStatistics statistics = bridge.getStatistics();
        Assert.assertEquals(3, statistics.getQueueSize());
        Assert.assertEquals(2, statistics.getDroppedEvents());
        Mockito.verify(_logger).warn(Mockito.startsWith("Event queue is full; dropping event;"));
    }

    @Test
    public void testConnectionErrorDiscardsBatch() throws InterruptedException {
        final IOException cause = new IOException("Connection refused");
        final RecordingTransport transport = new RecordingTransport(
                events -> DispatchResult.connectionError(cause, 4, 100, Duration.ofMillis(10)));
        final HttpEventBridge bridge = createBuilder(5).build(transport, Clock.systemUTC(), _logger);
        emit(bridge, 5);

        bridge.start();
        Assert.assertTrue(transport.awaitSends(1));
        bridge.stop();

        final BridgeStatistics statistics = bridge.getStatistics();
        Assert.assertEquals(0, statistics.getEventsSent());
        Assert.assertEquals(0, statistics.getBatchesSent());
        Assert.assertEquals(5, statistics.getEventsFailed());
        Assert.assertEquals(1, statistics.getConnectionErrors());
        Assert.assertEquals(0, statistics.getQueueSize());
        // The failed batch is not retried on stop
        Assert.assertEquals(1, transport.getBatchSizes().size());
        Mockito.verify(_logger).warn("Connection error sending event batch; events=5, attempts=4", cause);
    }

    @Test
    public void testFailureOutcomesCounted() {
        final AtomicInteger sends = new AtomicInteger();
        final RecordingTransport transport = new RecordingTransport(events -> {
            switch (sends.getAndIncrement()) {
                case 0:
                    return DispatchResult.timeout(new SocketTimeoutException(), 4, 10, Duration.ofSeconds(5));
                case 1:
                    return DispatchResult.httpError(400, 1, 10, Duration.ofMillis(5));
                default:
                    return DispatchResult.success(200, 1, 10, Duration.ofMillis(5));
            }
        });
        final HttpEventBridge bridge = createBuilder(2).build(transport, Clock.systemUTC(), _logger);
        emit(bridge, 6);
        bridge.start();
        bridge.stop();

        final BridgeStatistics statistics = bridge.getStatistics();
        Assert.assertEquals(1, statistics.getTimeoutErrors());
        Assert.assertEquals(1, statistics.getHttpErrors());
        Assert.assertEquals(0, statistics.getConnectionErrors());
        Assert.assertEquals(4, statistics.getEventsFailed());
        Assert.assertEquals(2, statistics.getEventsSent());
        Assert.assertEquals(1, statistics.getBatchesSent());
        Assert.assertEquals(6, statistics.getEventsSent() + statistics.getEventsFailed());
    }

    @Test
    public void testTransportExceptionCountedAsConnectionError() {
        final RecordingTransport transport = new RecordingTransport(events -> {
            throw new IllegalStateException("Test");
        });
        final List<DispatchResult> results = new CopyOnWriteArrayList<>();
        final HttpEventBridge bridge = createBuilder(3)
                .setListener(new RecordingListener(results))
                .build(transport, Clock.systemUTC(), _logger);
        emit(bridge, 3);
        bridge.start();
        bridge.stop();

        Assert.assertEquals(1, bridge.getStatistics().getConnectionErrors());
        Assert.assertEquals(3, bridge.getStatistics().getEventsFailed());
        Assert.assertEquals(1, results.size());
        Assert.assertEquals(DispatchResult.Outcome.CONNECTION_ERROR, results.get(0).getOutcome());
        Assert.assertEquals(0, results.get(0).getAttempts());
    }

    @Test
    public void testListenerFailureDoesNotStopDispatcher() {
        final RecordingTransport transport = new RecordingTransport();
        final HttpEventBridge bridge = createBuilder(2)
                .setListener(new EventBridgeListener() {
                    @Override
                    public void attemptComplete(final DispatchResult result, final int events) {
                        throw new IllegalStateException("Test");
                    }

                    @Override
                    public void droppedEvent(final CollaborationEvent event) {
                    }
                })
                .build(transport, Clock.systemUTC(), _logger);
        emit(bridge, 4);
        bridge.start();
        bridge.stop();

        Assert.assertEquals(Arrays.asList(2, 2), transport.getBatchSizes());
        Assert.assertEquals(4, bridge.getStatistics().getEventsSent());
    }

    @Test
    public void testStartIsIdempotent() {
        final HttpEventBridge bridge = createBuilder(10).build(new RecordingTransport(), Clock.systemUTC(), _logger);
        final long workersBefore = countWorkerThreads();
        bridge.start();
        bridge.start();
        try {
            Assert.assertEquals(workersBefore + 1, countWorkerThreads());
            Assert.assertTrue(bridge.isDispatcherAlive());
            Assert.assertEquals(BridgeState.RUNNING, bridge.getState());
        } finally {
            bridge.stop();
        }
        Mockito.verify(_logger, Mockito.times(1)).info(Mockito.startsWith("Collaboration event bridge started;"));
    }

    @Test
    public void testStopIsIdempotent() {
        final HttpEventBridge bridge = createBuilder(10).build(new RecordingTransport(), Clock.systemUTC(), _logger);
        bridge.start();
        bridge.stop();
        bridge.stop();

        Assert.assertEquals(BridgeState.STOPPED, bridge.getState());
        Mockito.verify(_logger, Mockito.times(1)).info("Stopping collaboration event bridge");
    }

    @Test
    public void testStopWithoutStart() {
        final HttpEventBridge bridge = createBuilder(10).build(new RecordingTransport(), Clock.systemUTC(), _logger);
        bridge.stop();
        Assert.assertEquals(BridgeState.STOPPED, bridge.getState());
        Mockito.verify(_logger, Mockito.never()).info("Stopping collaboration event bridge");
    }

    @Test
    public void testRestartAfterStop() {
        final RecordingTransport transport = new RecordingTransport();
        final HttpEventBridge bridge = createBuilder(10).build(transport, Clock.systemUTC(), _logger);
        bridge.start();
        emit(bridge, 2);
        bridge.stop();

        bridge.start();
        Assert.assertEquals(BridgeState.RUNNING, bridge.getState());
        emit(bridge, 3);
        bridge.stop();

        Assert.assertEquals(Arrays.asList(2, 3), transport.getBatchSizes());
        Assert.assertEquals(5, bridge.getStatistics().getEventsSent());
    }

    @Test
    public void testStopTimeoutAbandonsDispatcher() throws InterruptedException {
        final CountDownLatch release = new CountDownLatch(1);
        final RecordingTransport transport = new RecordingTransport(events -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return DispatchResult.success(200, 1, 10, Duration.ofMillis(1));
        });
        final HttpEventBridge bridge = createBuilder(1).build(transport, Clock.systemUTC(), _logger);
        emit(bridge, 1);
        bridge.start();
        Assert.assertTrue(transport.awaitSends(1));

        bridge.stop(Duration.ofMillis(50));
        Assert.assertEquals(BridgeState.STOPPING, bridge.getState());
        Mockito.verify(_logger).warn(Mockito.startsWith("Collaboration event bridge did not stop within timeout;"));

        release.countDown();
        final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (bridge.isDispatcherAlive() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        Assert.assertFalse(bridge.isDispatcherAlive());
        Assert.assertEquals(BridgeState.STOPPED, bridge.getState());
        Assert.assertEquals(1, bridge.getStatistics().getEventsSent());
    }

    @Test
    public void testEmitPopulatesEvent() {
        final RecordingTransport transport = new RecordingTransport();
        final Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        final HttpEventBridge bridge = createBuilder(10).build(transport, clock, _logger);
        final Map<String, MetadataValue> metadata = Collections.singletonMap("tool", MetadataValue.of("nmap"));

        Assert.assertTrue(bridge.emit("tool_start", "Running nmap", "op-5", "session-2", "user-3", metadata));
        bridge.start();
        bridge.stop();

        final CollaborationEvent event = transport.getEvents().get(0);
        Assert.assertEquals("tool_start", event.getType());
        Assert.assertEquals("Running nmap", event.getContent());
        Assert.assertEquals("op-5", event.getOperationId());
        Assert.assertEquals("session-2", event.getSessionId());
        Assert.assertEquals("user-3", event.getUserId());
        Assert.assertEquals(metadata, event.getMetadata());
        Assert.assertEquals(clock.millis(), event.getTimestamp());
        Assert.assertEquals(event.getId(), UUID.fromString(event.getId()).toString());
    }

    @Test
    public void testEmitAssignsDistinctIds() {
        final RecordingTransport transport = new RecordingTransport();
        final HttpEventBridge bridge = createBuilder(10).build(transport, Clock.systemUTC(), _logger);
        emit(bridge, 2);
        bridge.start();
        bridge.stop();

        final List<CollaborationEvent> events = transport.getEvents();
        Assert.assertNotEquals(events.get(0).getId(), events.get(1).getId());
    }

    @Test
    public void testEmitInvalidEventRejected() {
        final HttpEventBridge bridge = createBuilder(10).build(new RecordingTransport(), Clock.systemUTC(), _logger);
        Assert.assertFalse(bridge.emit("stdout", null, "op-1"));
        Assert.assertEquals(0, bridge.getStatistics().getQueueSize());
        Mockito.verify(_logger).error(
                Mockito.eq("Rejected invalid collaboration event"),
                Mockito.any(IllegalStateException.class));
    }

    @Test
    public void testCloseStopsAndReleasesTransport() {
        final RecordingTransport transport = new RecordingTransport();
        final HttpEventBridge bridge = createBuilder(10).build(transport, Clock.systemUTC(), _logger);
        bridge.start();
        emit(bridge, 1);
        bridge.close();

        Assert.assertEquals(BridgeState.STOPPED, bridge.getState());
        Assert.assertEquals(1, bridge.getStatistics().getEventsSent());
        Assert.assertTrue(transport.isClosed());
    }

    @Test
    public void testCloseIsTerminal() {
        final RecordingTransport transport = new RecordingTransport();
        final HttpEventBridge bridge = createBuilder(10).build(transport, Clock.systemUTC(), _logger);
        bridge.start();
        bridge.close();

        bridge.start();
        Assert.assertEquals(BridgeState.STOPPED, bridge.getState());
        Assert.assertFalse(bridge.isDispatcherAlive());
        Assert.assertFalse(bridge.emit("stdout", "after close", "op-1"));
        Assert.assertFalse(bridge.emit("stdout", "after close", "op-1", null, null, null));
        bridge.stop();

        final BridgeStatistics statistics = bridge.getStatistics();
        Assert.assertEquals(0, statistics.getQueueSize());
        Assert.assertEquals(0, statistics.getEventsFailed());
        Assert.assertEquals(0, statistics.getConnectionErrors());
        Assert.assertTrue(transport.getBatchSizes().isEmpty());
        Mockito.verify(_logger).warn("Collaboration event bridge is closed and cannot be started");
    }

    @Test
    public void testCloseTwiceReleasesTransportOnce() {
        final RecordingTransport transport = new RecordingTransport();
        final HttpEventBridge bridge = createBuilder(10).build(transport, Clock.systemUTC(), _logger);
        bridge.start();
        bridge.close();
        bridge.close();

        Assert.assertEquals(1, transport.getCloseCount());
        Mockito.verify(_logger, Mockito.times(1)).info("Stopping collaboration event bridge");
    }

    @Test
    public void testBuilderZeroTimeoutsAreDisabled() {
        final EventBridge bridge = new HttpEventBridge.Builder()
                .setUri(createWireMockUri())
                .setApiKey("key")
                .setRequestTimeout(Duration.ZERO)
                .setPollInterval(Duration.ZERO)
                .build();
        assertDisabled(bridge);
        final List<String> reasons = ((DisabledEventBridge) bridge).getReasons();
        Assert.assertEquals(2, reasons.size());
        Assert.assertTrue(reasons.get(0), reasons.get(0).endsWith("requestTimeout=PT0S"));
        Assert.assertTrue(reasons.get(1), reasons.get(1).endsWith("pollInterval=PT0S"));
    }

    @Test
    public void testBuilderOversizedTimeoutIsDisabled() {
        final EventBridge bridge = new HttpEventBridge.Builder()
                .setUri(createWireMockUri())
                .setApiKey("key")
                .setRequestTimeout(HttpEventBridge.Builder.MAX_TIMEOUT.plusMillis(1))
                .build();
        assertDisabled(bridge);
        Assert.assertTrue(((DisabledEventBridge) bridge).getReasons().get(0).contains("requestTimeout="));
    }

    @Test
    public void testBuilderLargestTimeoutAccepted() {
        final EventBridge bridge = new HttpEventBridge.Builder()
                .setUri(createWireMockUri())
                .setApiKey("key")
                .setRequestTimeout(HttpEventBridge.Builder.MAX_TIMEOUT)
                .setPollInterval(Duration.ofMillis(1))
                .build();
        try {
            Assert.assertEquals(HttpEventBridge.class, bridge.getClass());
        } finally {
            bridge.close();
        }
    }

    @Test
    public void testBuilderTooManyRetriesIsDisabled() {
        final EventBridge bridge = new HttpEventBridge.Builder()
                .setUri(createWireMockUri())
                .setApiKey("key")
                .setMaxRetries(64)
                .build();
        assertDisabled(bridge);
        Assert.assertTrue(((DisabledEventBridge) bridge).getReasons().get(0).startsWith("Max retries must be between 0 and 10;"));
    }

    @Test(expected = IllegalStateException.class)
    public void testInvalidConfigurationRejectedByTestHook() {
        createBuilder(0).build(new RecordingTransport(), Clock.systemUTC(), _logger);
    }

    @Test
    public void testBuilderWithDefaults() {
        final EventBridge bridge = new HttpEventBridge.Builder()
                .setApiKey("key")
                .build();
        try {
            Assert.assertEquals(HttpEventBridge.class, bridge.getClass());
            Assert.assertEquals(BridgeState.STOPPED, bridge.getState());
        } finally {
            bridge.close();
        }
    }

    @Test
    public void testBuilderWithNulls() {
        final EventBridge bridge = new HttpEventBridge.Builder()
                .setApiKey("key")
                .setUri(null)
                .setEnabled(null)
                .setBatchSize(null)
                .setBatchTimeout(null)
                .setMaxRetries(null)
                .setRetryBackoff(null)
                .setRequestTimeout(null)
                .setQueueCapacity(null)
                .setQueueOfferTimeout(null)
                .setPollInterval(null)
                .setStopTimeout(null)
                .setMaxConnectionsPerRoute(null)
                .setMaxConnectionsTotal(null)
                .setEventsDroppedLoggingInterval(null)
                .setDispatchErrorLoggingInterval(null)
                .setListener(null)
                .build();
        try {
            Assert.assertEquals(HttpEventBridge.class, bridge.getClass());
        } finally {
            bridge.close();
        }
    }

    @Test
    public void testBuilderWithoutApiKeyIsDisabled() {
        final EventBridge bridge = new HttpEventBridge.Builder()
                .setUri(createWireMockUri())
                .build();
        assertDisabled(bridge);
        Assert.assertEquals(
                Collections.singletonList("no api key configured"),
                ((DisabledEventBridge) bridge).getReasons());
    }

    @Test
    public void testBuilderWithEmptyApiKeyIsDisabled() {
        assertDisabled(new HttpEventBridge.Builder()
                .setUri(createWireMockUri())
                .setApiKey("")
                .build());
    }

    @Test
    public void testBuilderExplicitlyDisabled() {
        final EventBridge bridge = new HttpEventBridge.Builder()
                .setUri(createWireMockUri())
                .setApiKey("key")
                .setEnabled(false)
                .build();
        assertDisabled(bridge);
        Assert.assertEquals(
                Collections.singletonList("disabled by configuration"),
                ((DisabledEventBridge) bridge).getReasons());
    }

    @Test
    public void testBuilderInvalidConfigurationIsDisabled() {
        final EventBridge bridge = new HttpEventBridge.Builder()
                .setUri(URI.create("ftp://localhost/events"))
                .setApiKey("key")
                .setBatchSize(0)
                .setMaxConnectionsPerRoute(30)
                .build();
        assertDisabled(bridge);
        final List<String> reasons = ((DisabledEventBridge) bridge).getReasons();
        Assert.assertEquals(3, reasons.size());
        Assert.assertTrue(reasons.get(0).startsWith("URI must be an http(s) URI;"));
        Assert.assertTrue(reasons.get(1).startsWith("Batch size must be positive;"));
        Assert.assertTrue(reasons.get(2).startsWith("Connection pool must allow"));
    }

    @Test
    public void testEndToEnd() throws InterruptedException {
        _wireMockRule.stubFor(
                WireMock.post(WireMock.urlEqualTo(PATH))
                        .willReturn(WireMock.aResponse().withStatus(200)));

        final Semaphore semaphore = new Semaphore(0);
        final List<DispatchResult> results = new CopyOnWriteArrayList<>();
        final EventBridge bridge = new HttpEventBridge.Builder()
                .setUri(createWireMockUri())
                .setApiKey("e2e-key")
                .setBatchSize(2)
                .setBatchTimeout(Duration.ofMinutes(1))
                .setListener(new RecordingListener(results, semaphore))
                .build();
        Assert.assertEquals(HttpEventBridge.class, bridge.getClass());

        Assert.assertTrue(bridge.emit(
                "stdout",
                "PORT   STATE SERVICE",
                "op-9",
                "session-1",
                null,
                Collections.singletonMap("line", MetadataValue.of(1))));
        Assert.assertTrue(bridge.emit("stdout", "22/tcp open  ssh", "op-9"));
        Assert.assertTrue(bridge.emit("status", "done", "op-9"));

        bridge.start();
        Assert.assertTrue(semaphore.tryAcquire(1, 5, TimeUnit.SECONDS));
        bridge.close();

        Assert.assertEquals(2, results.size());
        Assert.assertTrue(results.get(0).isSuccess());
        Assert.assertTrue(results.get(1).isSuccess());
        final BridgeStatistics statistics = bridge.getStatistics();
        Assert.assertEquals(3, statistics.getEventsSent());
        Assert.assertEquals(2, statistics.getBatchesSent());

        _wireMockRule.verify(2, WireMock.postRequestedFor(WireMock.urlEqualTo(PATH))
                .withHeader("Content-Type", WireMock.equalTo("application/json"))
                .withHeader("X-API-Key", WireMock.equalTo("e2e-key")));
        _wireMockRule.verify(1, WireMock.postRequestedFor(WireMock.urlEqualTo(PATH))
                .withRequestBody(WireMock.matchingJsonPath("$.events[0].session_id", WireMock.equalTo("session-1")))
                .withRequestBody(WireMock.matchingJsonPath("$.events[0].metadata.line", WireMock.equalTo("1")))
                .withRequestBody(WireMock.matchingJsonPath("$.events[1].content", WireMock.equalTo("22/tcp open  ssh"))));
        _wireMockRule.verify(1, WireMock.postRequestedFor(WireMock.urlEqualTo(PATH))
                .withRequestBody(WireMock.matchingJsonPath("$.events[0].type", WireMock.equalTo("status"))));
        Assert.assertTrue(_wireMockRule.findUnmatchedRequests().getRequests().isEmpty());
    }

    private void assertDisabled(final EventBridge bridge) {
        Assert.assertEquals(DisabledEventBridge.class, bridge.getClass());
        bridge.start();
        Assert.assertFalse(bridge.emit("stdout", "ignored", "op-1"));
        Assert.assertFalse(bridge.emit("stdout", "ignored", "op-1", null, null, null));
        bridge.stop();
        bridge.close();

        final BridgeStatistics statistics = bridge.getStatistics();
        Assert.assertFalse(statistics.isEnabled());
        Assert.assertEquals(BridgeState.DISABLED, statistics.getState());
        Assert.assertEquals(BridgeState.DISABLED, bridge.getState());
        Assert.assertEquals(0, statistics.getEventsSent());
        Assert.assertEquals(0, statistics.getQueueSize());
        _wireMockRule.verify(0, WireMock.anyRequestedFor(WireMock.anyUrl()));
    }

    private URI createWireMockUri() {
        return URI.create("http://localhost:" + _wireMockRule.port() + PATH);
    }

    private static HttpEventBridge.Builder createBuilder(final int batchSize) {
        return new HttpEventBridge.Builder()
                .setApiKey("key")
                .setBatchSize(batchSize)
                .setBatchTimeout(Duration.ofMinutes(1))
                .setPollInterval(Duration.ofMillis(10))
                .setStopTimeout(Duration.ofSeconds(5));
    }

    private static void emit(final EventBridge bridge, final int count) {
        for (int i = 0; i < count; ++i) {
            Assert.assertTrue(bridge.emit("stdout", "line " + i, "op-1"));
        }
    }

    private static void assertArrivalOrder(final RecordingTransport transport, final int count) {
        final List<CollaborationEvent> events = transport.getEvents();
        Assert.assertEquals(count, events.size());
        for (int i = 0; i < count; ++i) {
            Assert.assertEquals("line " + i, events.get(i).getContent());
        }
    }

    private static long countWorkerThreads() {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(t -> HttpEventBridge.WORKER_THREAD_NAME.equals(t.getName()) && t.isAlive())
                .count();
    }

    @Rule
    public WireMockRule _wireMockRule = new WireMockRule(WireMockConfiguration.wireMockConfig().dynamicPort());

    private final Logger _logger = Mockito.mock(Logger.class);

    private static final String PATH = "/api/events";

    private static final class RecordingTransport implements EventTransport {

        RecordingTransport() {
            this(events -> DispatchResult.success(200, 1, 100, Duration.ofMillis(1)));
        }

        RecordingTransport(final Function<List<CollaborationEvent>, DispatchResult> responder) {
            _responder = responder;
        }

        @Override
        public DispatchResult send(final List<CollaborationEvent> events) {
            _batches.add(events);
            _sends.release();
            return _responder.apply(events);
        }

        @Override
        public void close() {
            _closeCount.incrementAndGet();
        }

        boolean awaitSends(final int count) throws InterruptedException {
            return _sends.tryAcquire(count, 5, TimeUnit.SECONDS);
        }

        List<Integer> getBatchSizes() {
            final List<Integer> sizes = new ArrayList<>();
            for (final List<CollaborationEvent> batch : _batches) {
                sizes.add(batch.size());
            }
            return sizes;
        }

        List<CollaborationEvent> getEvents() {
            final List<CollaborationEvent> events = new ArrayList<>();
            for (final List<CollaborationEvent> batch : _batches) {
                events.addAll(batch);
            }
            return events;
        }

        boolean isClosed() {
            return _closeCount.get() > 0;
        }

        int getCloseCount() {
            return _closeCount.get();
        }

        private final Function<List<CollaborationEvent>, DispatchResult> _responder;
        private final List<List<CollaborationEvent>> _batches = new CopyOnWriteArrayList<>();
        private final Semaphore _sends = new Semaphore(0);
        private final AtomicInteger _closeCount = new AtomicInteger();
    }

    private static final class RecordingListener implements EventBridgeListener {

        RecordingListener(final List<DispatchResult> results) {
            this(results, new Semaphore(0));
        }

        RecordingListener(final List<DispatchResult> results, final Semaphore semaphore) {
            _results = results;
            _semaphore = semaphore;
        }

        @Override
        public void attemptComplete(final DispatchResult result, final int events) {
            _results.add(result);
            _semaphore.release();
        }

        @Override
        public void droppedEvent(final CollaborationEvent event) {
        }

        private final List<DispatchResult> _results;
        private final Semaphore _semaphore;
    }
}
