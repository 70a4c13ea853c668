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
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Populates a {@link HttpEventBridge.Builder} from environment variables:
 *
 * <ul>
 *     <li>{@code COLLAB_ENABLED}: one of {@code true}, {@code 1} or {@code yes}
 *     (case insensitive) to enable the bridge; anything else disables it</li>
 *     <li>{@code COLLAB_API_URL}: ingestion endpoint; default is
 *     {@code http://localhost:8081/api/events}</li>
 *     <li>{@code COLLAB_API_KEY}: credential; the bridge is disabled without one</li>
 * </ul>
 */
public final class EnvironmentConfiguration {

    /**
     * Create a builder from the process environment.
     *
     * @return new {@link HttpEventBridge.Builder}
     */
    public static HttpEventBridge.Builder fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Create a builder from the given environment.
     *
     * @param environment the environment variables
     * @return new {@link HttpEventBridge.Builder}
     */
    public static HttpEventBridge.Builder fromEnvironment(final Map<String, String> environment) {
        final HttpEventBridge.Builder builder = new HttpEventBridge.Builder()
                .setEnabled(isEnabled(environment.get(ENABLED_VARIABLE)))
                .setApiKey(environment.get(API_KEY_VARIABLE));

        @Nullable final String uri = environment.get(API_URL_VARIABLE);
        if (uri != null && !uri.isEmpty()) {
            try {
                builder.setUri(URI.create(uri));
            } catch (final IllegalArgumentException e) {
                LOGGER.warn(String.format("Invalid collaboration api url; disabling bridge; %s=%s", API_URL_VARIABLE, uri), e);
                builder.setEnabled(false);
            }
        }
        return builder;
    }

    private static boolean isEnabled(@Nullable final String value) {
        return value != null && TRUE_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    private EnvironmentConfiguration() {}

    /* package private */ static final String ENABLED_VARIABLE = "COLLAB_ENABLED";
    /* package private */ static final String API_URL_VARIABLE = "COLLAB_API_URL";
    /* package private */ static final String API_KEY_VARIABLE = "COLLAB_API_KEY";

    private static final Logger LOGGER = LoggerFactory.getLogger(EnvironmentConfiguration.class);
    private static final Set<String> TRUE_VALUES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList("true", "1", "yes")));
}
