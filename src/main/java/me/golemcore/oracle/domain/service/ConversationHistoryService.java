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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.oracle.domain.model.ConversationEntry;
import me.golemcore.oracle.domain.model.ToolCallRecord;
import me.golemcore.oracle.infrastructure.config.OracleProperties;
import me.golemcore.oracle.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Append-only log of recorded exchanges with token-aware retrieval.
 *
 * <p>
 * Entries live in one JSONL file, one row per exchange. Writers are serialized
 * and every append is forced to disk before the cache is updated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationHistoryService {

    private static final String ENTRIES_FILE = "entries.jsonl";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final OracleProperties properties;
    private final ToolCallStorageTruncator toolCallTruncator;
    private final Clock clock;

    private final AtomicReference<List<ConversationEntry>> entriesCache = new AtomicReference<>();

    /**
     * Records one exchange. Id, timestamp and tool-call count are assigned here;
     * tool calls are truncated by priority before the write.
     *
     * @return the id of the new entry
     */
    public synchronized long recordEntry(ConversationEntry draft) {
        List<ConversationEntry> entries = new ArrayList<>(getEntries());
        long nextId = entries.isEmpty() ? 1 : entries.get(entries.size() - 1).getId() + 1;

        List<ToolCallRecord> toolCalls = toolCallTruncator.truncate(draft.getToolCalls());
        ConversationEntry entry = draft.toBuilder()
                .id(nextId)
                .toolCalls(toolCalls)
                .toolCallCount(toolCalls.size())
                .createdAt(clock.instant())
                .build();

        String line;
        try {
            line = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize conversation entry", e);
        }
        storagePort.appendLine(historyDirectory(), ENTRIES_FILE, line).join();

        entries.add(entry);
        entriesCache.set(Collections.unmodifiableList(entries));
        log.debug("[Memory] Recorded entry {} ({} tool calls)", nextId, toolCalls.size());
        return nextId;
    }

    /**
     * Fetches recent history, oldest first.
     *
     * <p>
     * With a token budget, entries are walked newest first. An entry that does
     * not fit is retried with its code blocks collapsed; if it still does not
     * fit, accumulation stops there.
     *
     * @param limit
     *            maximum number of entries
     * @param maxTokens
     *            token budget, or {@code null} for none
     * @param includeToolCalls
     *            whether stored tool calls are kept on the returned entries
     */
    public List<ConversationEntry> fetchHistory(int limit, Integer maxTokens, boolean includeToolCalls) {
        List<ConversationEntry> all = getEntries();
        List<ConversationEntry> selected = new ArrayList<>();
        int total = 0;

        for (int i = all.size() - 1; i >= 0 && selected.size() < limit; i--) {
            ConversationEntry entry = all.get(i);
            if (maxTokens != null) {
                int cost = tokenCost(entry);
                if (total + cost > maxTokens) {
                    entry = collapseCodeBlocks(entry);
                    cost = tokenCost(entry);
                    if (total + cost > maxTokens) {
                        log.debug("[Memory] History budget {} reached at entry {} ({} tokens used)",
                                maxTokens, entry.getId(), total);
                        break;
                    }
                }
                total += cost;
            }
            selected.add(includeToolCalls ? entry : entry.toBuilder().toolCalls(new ArrayList<>()).build());
        }

        Collections.reverse(selected);
        return selected;
    }

    public List<ConversationEntry> getEntries() {
        List<ConversationEntry> cached = entriesCache.get();
        if (cached == null) {
            synchronized (this) {
                cached = entriesCache.get();
                if (cached == null) {
                    cached = Collections.unmodifiableList(loadEntries());
                    entriesCache.set(cached);
                }
            }
        }
        return cached;
    }

    static int tokenCost(ConversationEntry entry) {
        return TokenEstimationSupport.estimate(entry.getPrompt(), entry.getAnswer());
    }

    private static ConversationEntry collapseCodeBlocks(ConversationEntry entry) {
        return entry.toBuilder()
                .prompt(TextTruncationSupport.collapseCodeBlocks(entry.getPrompt()))
                .answer(TextTruncationSupport.collapseCodeBlocks(entry.getAnswer()))
                .build();
    }

    private List<ConversationEntry> loadEntries() {
        List<ConversationEntry> entries = new ArrayList<>();
        String content;
        try {
            content = storagePort.readText(historyDirectory(), ENTRIES_FILE).join();
        } catch (RuntimeException e) {
            log.warn("[Memory] Failed to read history: {}", e.getMessage());
            return entries;
        }
        if (content == null || content.isBlank()) {
            return entries;
        }
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, ConversationEntry.class));
            } catch (JsonProcessingException e) {
                log.warn("[Memory] Skipping corrupt history row: {}", e.getOriginalMessage());
            }
        }
        return entries;
    }

    private String historyDirectory() {
        return properties.getStorage().getDirectories().getHistory();
    }
}
