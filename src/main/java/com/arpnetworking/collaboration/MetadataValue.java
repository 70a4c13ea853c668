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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * A single scalar metadata value attached to a {@link CollaborationEvent}.
 * Values are restricted to strings, numbers and booleans so that they map
 * one-to-one onto JSON scalars.
 */
public final class MetadataValue {

    /**
     * Create a string value.
     *
     * @param value the string
     * @return new {@link MetadataValue}
     */
    public static MetadataValue of(final String value) {
        return new MetadataValue(Kind.STRING, Objects.requireNonNull(value, "value must not be null"));
    }

    /**
     * Create a numeric value.
     *
     * @param value the number
     * @return new {@link MetadataValue}
     */
    public static MetadataValue of(final Number value) {
        return new MetadataValue(Kind.NUMBER, Objects.requireNonNull(value, "value must not be null"));
    }

    /**
     * Create a boolean value.
     *
     * @param value the boolean
     * @return new {@link MetadataValue}
     */
    public static MetadataValue of(final boolean value) {
        return new MetadataValue(Kind.BOOLEAN, value);
    }

    public Kind getKind() {
        return _kind;
    }

    /**
     * The raw value; a {@code String}, {@code Number} or {@code Boolean}
     * depending on {@link #getKind()}. This is also the serialized form.
     *
     * @return the raw value
     */
    @JsonValue
    public Object getValue() {
        return _value;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MetadataValue)) {
            return false;
        }
        final MetadataValue otherValue = (MetadataValue) other;
        return _kind == otherValue._kind && _value.equals(otherValue._value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_kind, _value);
    }

    @Override
    public String toString() {
        return String.format("MetadataValue{kind=%s, value=%s}", _kind, _value);
    }

    private MetadataValue(final Kind kind, final Object value) {
        _kind = kind;
        _value = value;
    }

    private final Kind _kind;
    private final Object _value;

    /**
     * The supported value kinds.
     */
    public enum Kind {
        /**
         * A string value.
         */
        STRING,
        /**
         * A numeric value.
         */
        NUMBER,
        /**
         * A boolean value.
         */
        BOOLEAN
    }
}
