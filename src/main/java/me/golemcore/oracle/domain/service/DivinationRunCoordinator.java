package me.golemcore.oracle.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.oracle.domain.model.OracleRequest;
import me.golemcore.oracle.domain.model.OracleResponse;
import me.golemcore.oracle.domain.model.ToolDefinition;
import me.golemcore.oracle.port.outbound.ToolDispatcher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs consultations on background workers, one active run per session id.
 *
 * <p>
 * Cancelling a session interrupts its worker. The loop notices the interrupt
 * while it waits for the completion service; a tool that is already executing
 * may finish before the run stops.
 */
@Service
@Slf4j
public class DivinationRunCoordinator {

    private final OracleService oracleService;
    private final ExecutorService runExecutor;

    private final Map<String, Future<OracleResponse>> runs = new ConcurrentHashMap<>();

    public DivinationRunCoordinator(OracleService oracleService,
            @Qualifier("divinationRunExecutor") ExecutorService runExecutor) {
        this.oracleService = oracleService;
        this.runExecutor = runExecutor;
    }

    /**
     * Starts a consultation for the session.
     *
     * @throws IllegalStateException
     *             if the session already has a run in progress
     */
    public synchronized Future<OracleResponse> submit(String sessionId, OracleRequest request,
            List<ToolDefinition> tools, ToolDispatcher dispatcher) {
        Future<OracleResponse> active = runs.get(sessionId);
        if (active != null && !active.isDone()) {
            throw new IllegalStateException("Session " + sessionId + " already has an active run");
        }
        runs.values().removeIf(Future::isDone);
        Future<OracleResponse> future = runExecutor
                .submit(() -> oracleService.consult(sessionId, request, tools, dispatcher));
        runs.put(sessionId, future);
        log.debug("[Oracle] Run submitted for session {}", sessionId);
        return future;
    }

    public boolean cancel(String sessionId) {
        Future<OracleResponse> future = runs.remove(sessionId);
        if (future == null) {
            log.info("[Oracle] Cancel requested for idle session {}", sessionId);
            return false;
        }
        boolean cancelled = future.cancel(true);
        log.info("[Oracle] Cancel requested for session {} (cancelled={})", sessionId, cancelled);
        return cancelled;
    }

    public boolean isRunning(String sessionId) {
        Future<OracleResponse> future = runs.get(sessionId);
        return future != null && !future.isDone();
    }
}
