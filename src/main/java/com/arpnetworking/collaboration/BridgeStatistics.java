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
package com.arpnetworking.collaboration;

/**
 * Read-only snapshot of an {@link EventBridge}'s counters. The values are
 * read individually and are not a consistent cut across counters.
 */
public final class BridgeStatistics {

    public long getEventsSent() {
        return _eventsSent;
    }

    public long getEventsFailed() {
        return _eventsFailed;
    }

    public long getBatchesSent() {
        return _batchesSent;
    }

    public long getConnectionErrors() {
        return _connectionErrors;
    }

    public long getTimeoutErrors() {
        return _timeoutErrors;
    }

    public long getHttpErrors() {
        return _httpErrors;
    }

    /**
     * Number of events waiting in the queue when the snapshot was taken.
     *
     * @return the queue depth
     */
    public int getQueueSize() {
        return _queueSize;
    }

    /**
     * Number of events rejected because the queue was full.
     *
     * @return the dropped event count
     */
    public long getDroppedEvents() {
        return _droppedEvents;
    }

    public boolean isEnabled() {
        return _enabled;
    }

    public BridgeState getState() {
        return _state;
    }

    @Override
    public String toString() {
        return String.format(
                "BridgeStatistics{eventsSent=%d, eventsFailed=%d, batchesSent=%d, connectionErrors=%d, timeoutErrors=%d, "
                        + "httpErrors=%d, queueSize=%d, droppedEvents=%d, enabled=%s, state=%s}",
                _eventsSent,
                _eventsFailed,
                _batchesSent,
                _connectionErrors,
                _timeoutErrors,
                _httpErrors,
                _queueSize,
                _droppedEvents,
                _enabled,
                _state);
    }

    private BridgeStatistics(final Builder builder) {
        _eventsSent = builder._eventsSent;
        _eventsFailed = builder._eventsFailed;
        _batchesSent = builder._batchesSent;
        _connectionErrors = builder._connectionErrors;
        _timeoutErrors = builder._timeoutErrors;
        _httpErrors = builder._httpErrors;
        _queueSize = builder._queueSize;
        _droppedEvents = builder._droppedEvents;
        _enabled = builder._enabled;
        _state = builder._state;
    }

    private final long _eventsSent;
    private final long _eventsFailed;
    private final long _batchesSent;
    private final long _connectionErrors;
    private final long _timeoutErrors;
    private final long _httpErrors;
    private final int _queueSize;
    private final long _droppedEvents;
    private final boolean _enabled;
    private final BridgeState _state;

    /**
     * Builder for {@link BridgeStatistics}.
     */
    public static final class Builder {

        /**
         * Set the number of events delivered.
         *
         * @param value the count
         * @return This {@link Builder} instance.
         */
        public Builder setEventsSent(final long value) {
            _eventsSent = value;
            return this;
        }

        /**
         * Set the number of events in batches that could not be delivered.
         *
         * @param value the count
         * @return This {@link Builder} instance.
         */
        public Builder setEventsFailed(final long value) {
            _eventsFailed = value;
            return this;
        }

        /**
         * Set the number of batches delivered.
         *
         * @param value the count
         * @return This {@link Builder} instance.
         */
        public Builder setBatchesSent(final long value) {
            _batchesSent = value;
            return this;
        }

        /**
         * Set the number of batches that failed with a connection error.
         *
         * @param value the count
         * @return This {@link Builder} instance.
         */
        public Builder setConnectionErrors(final long value) {
            _connectionErrors = value;
            return this;
        }

        /**
         * Set the number of batches that failed with a timeout.
         *
         * @param value the count
         * @return This {@link Builder} instance.
         */
        public Builder setTimeoutErrors(final long value) {
            _timeoutErrors = value;
            return this;
        }

        /**
         * Set the number of batches rejected by the endpoint.
         *
         * @param value the count
         * @return This {@link Builder} instance.
         */
        public Builder setHttpErrors(final long value) {
            _httpErrors = value;
            return this;
        }

        /**
         * Set the current queue depth.
         *
         * @param value the depth
         * @return This {@link Builder} instance.
         */
        public Builder setQueueSize(final int value) {
            _queueSize = value;
            return this;
        }

        /**
         * Set the number of dropped events.
         *
         * @param value the count
         * @return This {@link Builder} instance.
         */
        public Builder setDroppedEvents(final long value) {
            _droppedEvents = value;
            return this;
        }

        /**
         * Set whether the bridge is enabled.
         *
         * @param value whether the bridge is enabled
         * @return This {@link Builder} instance.
         */
        public Builder setEnabled(final boolean value) {
            _enabled = value;
            return this;
        }

        /**
         * Set the lifecycle state.
         *
         * @param value the state
         * @return This {@link Builder} instance.
         */
        public Builder setState(final BridgeState value) {
            _state = value;
            return this;
        }

        /**
         * Create an instance of {@link BridgeStatistics}.
         *
         * @return Instance of {@link BridgeStatistics}.
         */
        public BridgeStatistics build() {
            return new BridgeStatistics(this);
        }

        private long _eventsSent;
        private long _eventsFailed;
        private long _batchesSent;
        private long _connectionErrors;
        private long _timeoutErrors;
        private long _httpErrors;
        private int _queueSize;
        private long _droppedEvents;
        private boolean _enabled;
        private BridgeState _state = BridgeState.STOPPED;
    }
}
