package me.golemcore.oracle.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.oracle.domain.model.LlmRequest;
import me.golemcore.oracle.domain.model.LlmResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the remote completion service. Failures complete the future
 * exceptionally with a
 * {@link me.golemcore.oracle.domain.model.TransportException} that is already
 * classified.
 */
public interface LlmPort {

    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Check if the service is configured and reachable.
     */
    boolean isAvailable();
}
