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
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Serializes a batch into the ingestion request body:
 * {@code {"events": [ {...}, ... ]}}.
 */
/* package private */ final class BatchSerializer {

    /* package private */ BatchSerializer() {
        this(new ObjectMapper());
    }

    /* package private */ BatchSerializer(final ObjectMapper objectMapper) {
        _objectMapper = objectMapper;
    }

    /* package private */ byte[] serialize(final List<CollaborationEvent> events) throws JsonProcessingException {
        final Map<String, List<CollaborationEvent>> body = Collections.singletonMap(EVENTS_KEY, events);
        return _objectMapper.writeValueAsBytes(body);
    }

    private final ObjectMapper _objectMapper;

    private static final String EVENTS_KEY = "events";
}
