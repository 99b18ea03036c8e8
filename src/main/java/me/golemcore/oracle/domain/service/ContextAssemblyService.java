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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.oracle.domain.model.AegisState;
import me.golemcore.oracle.domain.model.AssembledContext;
import me.golemcore.oracle.domain.model.Attachment;
import me.golemcore.oracle.domain.model.ConversationEntry;
import me.golemcore.oracle.domain.model.ExtraContext;
import me.golemcore.oracle.domain.model.HistorySelection;
import me.golemcore.oracle.domain.model.Message;
import me.golemcore.oracle.domain.model.Note;
import me.golemcore.oracle.domain.model.OracleRequest;
import me.golemcore.oracle.infrastructure.config.OracleProperties;
import me.golemcore.oracle.port.outbound.ProjectWorkspacePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Builds the bounded context of a consultation: formatted history preceded by
 * older orientation summaries, and the extra context (project files,
 * attachments, orientation, recalled notes, caller context, manifest).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextAssemblyService {

    static final String MANIFEST_HEADER = "PROJECT MANIFEST (optional project guidance, editable by the user and "
            + "the oracle) ";

    private final ConversationHistoryService historyService;
    private final AegisService aegisService;
    private final NoteService noteService;
    private final ProjectWorkspacePort workspacePort;
    private final HistoryToolCallFormatter toolCallFormatter;
    private final OracleProperties properties;
    private final Clock clock;

    public AssembledContext build(OracleRequest request) {
        OracleProperties.ContextProperties config = properties.getContext();
        HistorySelection selection = request.getHistory() != null ? request.getHistory() : HistorySelection.fetch();

        List<ConversationEntry> entries = switch (selection.mode()) {
            case FETCH -> historyService.fetchHistory(config.getHistoryLimit(), config.getMaxHistoryTokens(), true);
            case EXPLICIT -> selection.entries();
            case NONE -> List.of();
        };

        List<Message> history = new ArrayList<>();
        if (selection.mode() != HistorySelection.Mode.NONE) {
            Instant earliest = entries.isEmpty() ? clock.instant() : entries.get(0).getCreatedAt();
            history.addAll(summaryMessages(earliest, config.getMaxSummaryTokens()));
        }
        history.addAll(formatHistory(entries));

        ExtraContext extra = resolveExtraContext(request);
        log.debug("[Context] Assembled {} history messages from {} entries ({} mode), {} aegis notes",
                history.size(), entries.size(), selection.mode(), extra.getAegisNotes().size());
        return new AssembledContext(history, extra);
    }

    /**
     * Turns entries (oldest first) into user/assistant pairs. The tool calls of
     * each entry are folded into its assistant message, decayed by distance
     * from the present.
     */
    public List<Message> formatHistory(List<ConversationEntry> entries) {
        List<Message> messages = new ArrayList<>(entries.size() * 2);
        for (int i = 0; i < entries.size(); i++) {
            ConversationEntry entry = entries.get(i);
            int index = entries.size() - 1 - i;
            messages.add(Message.builder()
                    .role(Message.ROLE_USER)
                    .content(entry.getPrompt())
                    .timestamp(entry.getCreatedAt())
                    .build());

            String toolHistory = toolCallFormatter.format(entry.getToolCalls(), index);
            String answer = entry.getAnswer() != null ? entry.getAnswer() : "";
            messages.add(Message.builder()
                    .role(Message.ROLE_ASSISTANT)
                    .content(toolHistory.isEmpty() ? answer : toolHistory + "\n\n" + answer)
                    .timestamp(entry.getCreatedAt())
                    .build());
        }
        return messages;
    }

    private List<Message> summaryMessages(Instant before, int maxTokens) {
        List<AegisState> summaries = new ArrayList<>(aegisService.summariesBefore(before, maxTokens));
        Collections.reverse(summaries);
        List<Message> messages = new ArrayList<>(summaries.size());
        for (AegisState snapshot : summaries) {
            messages.add(Message.builder()
                    .role(Message.ROLE_SYSTEM)
                    .content("Summary: " + snapshot.getSummary() + "\n\nTags: " + String.join(", ", snapshot.getTags()))
                    .timestamp(snapshot.getCreatedAt())
                    .build());
        }
        return messages;
    }

    private ExtraContext resolveExtraContext(OracleRequest request) {
        List<Attachment> attachments = request.getAttachments() != null ? request.getAttachments() : List.of();
        AegisState aegis = aegisService.current();
        List<String> files = attachments.stream()
                .map(Attachment::getFile)
                .filter(file -> file != null && !file.isBlank())
                .distinct()
                .toList();
        List<String> selections = attachments.stream()
                .map(Attachment::getSelection)
                .filter(text -> text != null && !text.isBlank())
                .toList();

        if (request.getEnvironment() != null && !request.getEnvironment().isEmpty()) {
            log.debug("[Context] Environment injected: {}", request.getEnvironment().keySet());
        }

        return ExtraContext.builder()
                .projectFiles(listProjectFiles())
                .attachments(new ArrayList<>(attachments))
                .aegisOrientation(new ExtraContext.AegisOrientation(aegis.getTags(), aegis.getSummary(),
                        aegis.getTemperature(), files, selections))
                .aegisNotes(recallAegisNotes())
                .callerContext(request.getCallerContext() != null
                        ? new LinkedHashMap<>(request.getCallerContext())
                        : new LinkedHashMap<>())
                .environment(request.getEnvironment() != null
                        ? new LinkedHashMap<>(request.getEnvironment())
                        : new LinkedHashMap<>())
                .manifest(readManifest())
                .build();
    }

    private List<String> listProjectFiles() {
        try {
            return workspacePort.listProjectFiles();
        } catch (RuntimeException e) {
            log.warn("[Context] Failed to list project files: {}", e.getMessage());
            return new ArrayList<>();
        }
    }

    private List<Note> recallAegisNotes() {
        try {
            return noteService.recallAegisNotes(properties.getContext().getMaxAegisNoteTokens());
        } catch (RuntimeException e) {
            log.warn("[Context] Failed to recall aegis notes: {}", e.getMessage());
            return new ArrayList<>();
        }
    }

    /**
     * Reads the project manifest. Never throws: a missing or unreadable file
     * becomes an explanatory placeholder.
     */
    String readManifest() {
        String path = properties.getContext().getManifestPath();
        try {
            Optional<String> content = workspacePort.readText(path);
            if (content.isEmpty()) {
                return "Project manifest file not found: " + path;
            }
            return MANIFEST_HEADER + path + ":\n" + content.get();
        } catch (IOException | RuntimeException e) {
            log.warn("[Context] Failed to read manifest {}: {}", path, e.getMessage());
            return "Error reading project manifest: " + e.getMessage();
        }
    }
}
