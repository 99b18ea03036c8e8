package me.golemcore.oracle.domain.model;

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

import lombok.Getter;

/**
 * Thrown by a tool to end the current step deliberately. It is never retried
 * and never treated as a fault.
 */
@Getter
public class StepTerminationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient InterruptMarker marker;

    public StepTerminationException(InterruptMarker marker) {
        super("Step terminated: " + marker.kind(), null, false, false);
        this.marker = marker;
    }
}
