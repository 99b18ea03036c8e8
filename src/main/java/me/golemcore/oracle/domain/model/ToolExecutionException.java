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
 * Raised by the execution sandbox once the retry budget of a tool call is
 * exhausted.
 */
@Getter
public class ToolExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ToolFailureType failureType;
    private final int attempts;

    public ToolExecutionException(ToolFailureType failureType, String message, int attempts, Throwable cause) {
        super(failureType.label() + ": " + message, cause);
        this.failureType = failureType;
        this.attempts = attempts;
    }
}
