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
 * Lifecycle state of an {@link EventBridge}.
 */
public enum BridgeState {
    /**
     * The bridge was built without a credential or was explicitly disabled.
     * Terminal; all emits are rejected.
     */
    DISABLED,
    /**
     * No dispatcher thread is running.
     */
    STOPPED,
    /**
     * The dispatcher thread is draining the queue.
     */
    RUNNING,
    /**
     * A stop was requested and the dispatcher is flushing.
     */
    STOPPING
}
