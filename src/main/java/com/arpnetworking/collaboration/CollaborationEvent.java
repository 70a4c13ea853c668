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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * One occurrence produced by an operation (tool output, status notice,
 * lifecycle marker) to be forwarded to the collaboration endpoint. Instances
 * are immutable.
 */
@JsonPropertyOrder({"id", "type", "content", "timestamp", "operation_id", "session_id", "user_id", "metadata"})
public final class CollaborationEvent {

    @JsonProperty("id")
    public String getId() {
        return _id;
    }

    @JsonProperty("type")
    public String getType() {
        return _type;
    }

    @JsonProperty("content")
    public String getContent() {
        return _content;
    }

    /**
     * Emission time in milliseconds since epoch.
     *
     * @return the emission timestamp
     */
    @JsonProperty("timestamp")
    public long getTimestamp() {
        return _timestamp;
    }

    @JsonProperty("operation_id")
    public String getOperationId() {
        return _operationId;
    }

    @JsonProperty("session_id")
    @Nullable
    public String getSessionId() {
        return _sessionId;
    }

    @JsonProperty("user_id")
    @Nullable
    public String getUserId() {
        return _userId;
    }

    @JsonProperty("metadata")
    public Map<String, MetadataValue> getMetadata() {
        return _metadata;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CollaborationEvent)) {
            return false;
        }
        final CollaborationEvent otherEvent = (CollaborationEvent) other;
        return _timestamp == otherEvent._timestamp
                && _id.equals(otherEvent._id)
                && _type.equals(otherEvent._type)
                && _content.equals(otherEvent._content)
                && _operationId.equals(otherEvent._operationId)
                && Objects.equals(_sessionId, otherEvent._sessionId)
                && Objects.equals(_userId, otherEvent._userId)
                && _metadata.equals(otherEvent._metadata);
    }

    @Override
    public int hashCode() {
        return _id.hashCode();
    }

    @Override
    public String toString() {
        return String.format(
                "CollaborationEvent{id=%s, type=%s, timestamp=%d, operationId=%s, sessionId=%s, userId=%s, metadata=%s}",
                _id,
                _type,
                _timestamp,
                _operationId,
                _sessionId,
                _userId,
                _metadata);
    }

    private CollaborationEvent(final Builder builder) {
        _id = builder._id;
        _type = builder._type;
        _content = builder._content;
        _timestamp = builder._timestamp;
        _operationId = builder._operationId;
        _sessionId = builder._sessionId;
        _userId = builder._userId;
        _metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder._metadata));
    }

    private final String _id;
    private final String _type;
    private final String _content;
    private final long _timestamp;
    private final String _operationId;
    private final @Nullable String _sessionId;
    private final @Nullable String _userId;
    private final Map<String, MetadataValue> _metadata;

    /**
     * Builder for {@link CollaborationEvent}.
     */
    public static final class Builder {

        /**
         * Set the event identifier. Required.
         *
         * @param value the identifier
         * @return This {@link Builder} instance.
         */
        public Builder setId(@Nullable final String value) {
            _id = value;
            return this;
        }

        /**
         * Set the event type (e.g. {@code tool_start}, {@code stdout}). Required.
         *
         * @param value the type
         * @return This {@link Builder} instance.
         */
        public Builder setType(@Nullable final String value) {
            _type = value;
            return this;
        }

        /**
         * Set the event content. Required.
         *
         * @param value the content
         * @return This {@link Builder} instance.
         */
        public Builder setContent(@Nullable final String value) {
            _content = value;
            return this;
        }

        /**
         * Set the emission timestamp in milliseconds since epoch. Required.
         *
         * @param value the timestamp
         * @return This {@link Builder} instance.
         */
        public Builder setTimestamp(@Nullable final Long value) {
            _timestamp = value;
            return this;
        }

        /**
         * Set the identifier of the producing operation. Required.
         *
         * @param value the operation identifier
         * @return This {@link Builder} instance.
         */
        public Builder setOperationId(@Nullable final String value) {
            _operationId = value;
            return this;
        }

        /**
         * Set the session identifier. Optional; default is {@code null}.
         *
         * @param value the session identifier
         * @return This {@link Builder} instance.
         */
        public Builder setSessionId(@Nullable final String value) {
            _sessionId = value;
            return this;
        }

        /**
         * Set the user identifier. Optional; default is {@code null}.
         *
         * @param value the user identifier
         * @return This {@link Builder} instance.
         */
        public Builder setUserId(@Nullable final String value) {
            _userId = value;
            return this;
        }

        /**
         * Set the metadata. Iteration order of the map is preserved. Optional;
         * default is empty.
         *
         * @param value the metadata
         * @return This {@link Builder} instance.
         */
        public Builder setMetadata(@Nullable final Map<String, MetadataValue> value) {
            _metadata = value == null ? Collections.emptyMap() : value;
            return this;
        }

        /**
         * Create an instance of {@link CollaborationEvent}.
         *
         * @return Instance of {@link CollaborationEvent}.
         * @throws IllegalStateException if a required field is missing
         */
        public CollaborationEvent build() {
            final List<String> missing = new ArrayList<>();
            if (_id == null) {
                missing.add("id");
            }
            if (_type == null) {
                missing.add("type");
            }
            if (_content == null) {
                missing.add("content");
            }
            if (_timestamp == null) {
                missing.add("timestamp");
            }
            if (_operationId == null) {
                missing.add("operationId");
            }
            if (!missing.isEmpty()) {
                throw new IllegalStateException(String.format(
                        "Unable to construct %s; missing=%s",
                        CollaborationEvent.class.getSimpleName(),
                        missing));
            }
            for (final Map.Entry<String, MetadataValue> entry : _metadata.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    throw new IllegalStateException(String.format(
                            "Metadata must not contain null keys or values; metadata=%s",
                            _metadata));
                }
            }
            return new CollaborationEvent(this);
        }

        private @Nullable String _id;
        private @Nullable String _type;
        private @Nullable String _content;
        private @Nullable Long _timestamp;
        private @Nullable String _operationId;
        private @Nullable String _sessionId;
        private @Nullable String _userId;
        private Map<String, MetadataValue> _metadata = Collections.emptyMap();
    }
}
