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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.oracle.domain.model.AegisState;
import me.golemcore.oracle.infrastructure.config.OracleProperties;
import me.golemcore.oracle.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide sticky orientation (tags, summary, temperature).
 *
 * <p>
 * Every change appends a new snapshot row; older rows stay readable for
 * retrospective summaries. The current snapshot is published only after its
 * row is durable, so concurrent sessions never observe a partial update.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AegisService {

    private static final String SNAPSHOTS_FILE = "snapshots.jsonl";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final OracleProperties properties;
    private final Clock clock;

    private final AtomicReference<List<AegisState>> snapshots = new AtomicReference<>(List.of());

    @PostConstruct
    public void init() {
        List<AegisState> loaded = loadSnapshots();
        snapshots.set(Collections.unmodifiableList(loaded));
        if (!loaded.isEmpty()) {
            AegisState latest = loaded.get(loaded.size() - 1);
            log.info("[Aegis] Restored orientation: tags={}, temperature={}", latest.getTags(),
                    latest.getTemperature());
        }
    }

    /**
     * Latest snapshot, or the initial orientation when none was ever written.
     */
    public AegisState current() {
        List<AegisState> all = snapshots.get();
        if (all.isEmpty()) {
            return AegisState.initial();
        }
        return copy(all.get(all.size() - 1));
    }

    public double currentTemperature() {
        return current().getTemperature();
    }

    /**
     * Merges the given values into the current orientation and appends the
     * result as a new snapshot. Null arguments keep the current value.
     */
    public synchronized AegisState unveil(List<String> tags, String summary, Double temperature) {
        AegisState base = current();
        AegisState next = AegisState.builder()
                .tags(tags != null ? normalizeTags(tags) : base.getTags())
                .summary(summary != null ? summary : base.getSummary())
                .temperature(temperature != null ? temperature : base.getTemperature())
                .createdAt(clock.instant())
                .build();

        String line;
        try {
            line = objectMapper.writeValueAsString(next);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize aegis snapshot", e);
        }
        storagePort.appendLine(aegisDirectory(), SNAPSHOTS_FILE, line).join();

        List<AegisState> updated = new ArrayList<>(snapshots.get());
        updated.add(next);
        snapshots.set(Collections.unmodifiableList(updated));
        log.info("[Aegis] Orientation updated: tags={}, temperature={}", next.getTags(), next.getTemperature());
        return copy(next);
    }

    public AegisState updateSummary(String summary) {
        return unveil(null, summary, null);
    }

    public AegisState setTemperature(double temperature) {
        return unveil(null, null, temperature);
    }

    /**
     * Snapshots with a non-blank summary written before {@code before}, newest
     * first, as many as fit in {@code maxTokens}.
     */
    public List<AegisState> summariesBefore(Instant before, int maxTokens) {
        List<AegisState> all = snapshots.get();
        List<AegisState> selected = new ArrayList<>();
        int total = 0;
        for (int i = all.size() - 1; i >= 0; i--) {
            AegisState snapshot = copy(all.get(i));
            if (snapshot.getSummary() == null || snapshot.getSummary().isBlank()) {
                continue;
            }
            if (before != null && (snapshot.getCreatedAt() == null || !snapshot.getCreatedAt().isBefore(before))) {
                continue;
            }
            int cost = TokenEstimationSupport.estimate(snapshot.getSummary(), String.join(",", snapshot.getTags()));
            if (total + cost > maxTokens) {
                break;
            }
            total += cost;
            selected.add(snapshot);
        }
        return selected;
    }

    /**
     * Most recent snapshots, newest first.
     */
    public List<AegisState> recentSnapshots(int limit) {
        List<AegisState> all = snapshots.get();
        List<AegisState> recent = new ArrayList<>();
        for (int i = all.size() - 1; i >= 0 && recent.size() < limit; i--) {
            recent.add(copy(all.get(i)));
        }
        return recent;
    }

    private static List<String> normalizeTags(List<String> tags) {
        return tags.stream()
                .filter(tag -> tag != null && !tag.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
    }

    private static AegisState copy(AegisState state) {
        List<String> tags = state.getTags() != null ? new ArrayList<>(state.getTags()) : new ArrayList<>();
        return state.toBuilder().tags(tags).build();
    }

    private List<AegisState> loadSnapshots() {
        List<AegisState> loaded = new ArrayList<>();
        String content;
        try {
            content = storagePort.readText(aegisDirectory(), SNAPSHOTS_FILE).join();
        } catch (RuntimeException e) {
            log.warn("[Aegis] Failed to read snapshots: {}", e.getMessage());
            return loaded;
        }
        if (content == null || content.isBlank()) {
            return loaded;
        }
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                loaded.add(objectMapper.readValue(line, AegisState.class));
            } catch (JsonProcessingException e) {
                log.warn("[Aegis] Skipping corrupt snapshot row: {}", e.getOriginalMessage());
            }
        }
        return loaded;
    }

    private String aegisDirectory() {
        return properties.getStorage().getDirectories().getAegis();
    }
}
