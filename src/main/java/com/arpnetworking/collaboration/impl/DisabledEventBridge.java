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
import com.arpnetworking.collaboration.EventBridge;
import com.arpnetworking.collaboration.MetadataValue;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * {@link EventBridge} returned when the bridge is turned off, has no
 * credential or could not be configured. Every emit is rejected and no
 * network call is ever made.
 */
/* package private */ final class DisabledEventBridge implements EventBridge {

    /* package private */ DisabledEventBridge(final String reason) {
        this(Collections.singletonList(reason));
    }

    /* package private */ DisabledEventBridge(final List<String> reasons) {
        _reasons = Collections.unmodifiableList(reasons);
    }

    @Override
    public boolean emit(final String type, final String content, final String operationId) {
        return false;
    }

    @Override
    public boolean emit(
            final String type,
            final String content,
            final String operationId,
            @Nullable final String sessionId,
            @Nullable final String userId,
            @Nullable final Map<String, MetadataValue> metadata) {
        return false;
    }

    @Override
    public void start() {
        // Nothing to start
    }

    @Override
    public void stop() {
        // Nothing to stop
    }

    @Override
    public void stop(final Duration timeout) {
        // Nothing to stop
    }

    @Override
    public BridgeStatistics getStatistics() {
        return new BridgeStatistics.Builder()
                .setEnabled(false)
                .setState(BridgeState.DISABLED)
                .build();
    }

    @Override
    public BridgeState getState() {
        return BridgeState.DISABLED;
    }

    @Override
    public void close() {
        // Nothing to release
    }

    /* package private */ List<String> getReasons() {
        return _reasons;
    }

    @Override
    public String toString() {
        return String.format("DisabledEventBridge{reasons=%s}", _reasons);
    }

    private final List<String> _reasons;
}
