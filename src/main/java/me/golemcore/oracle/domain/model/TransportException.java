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
 * Failure of the completion service call, already classified at the adapter
 * boundary.
 */
@Getter
public class TransportException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final TransportFailureKind kind;
    private final Integer httpStatus;

    public TransportException(TransportFailureKind kind, String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.httpStatus = httpStatus;
    }

    public TransportException(TransportFailureKind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }
}
