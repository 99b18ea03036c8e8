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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.oracle.domain.model.AegisState;
import me.golemcore.oracle.domain.model.Note;
import me.golemcore.oracle.domain.model.ScoredNote;
import me.golemcore.oracle.infrastructure.config.OracleProperties;
import me.golemcore.oracle.port.outbound.ProjectWorkspacePort;
import me.golemcore.oracle.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Long-term notes: create/update/remove and scored recall.
 *
 * <p>
 * Content is capped before it is written. Recall scores token overlap: 4 per
 * content token, 3 per tag token, 2 per link token, plus a bonus of 5 when a
 * query token appears literally inside the links field.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NoteService {

    static final int CONTENT_WEIGHT = 4;
    static final int TAG_WEIGHT = 3;
    static final int LINK_WEIGHT = 2;
    static final int LINK_SUBSTRING_BONUS = 5;

    static final Set<String> STOP_WORDS = Set.of("the", "a", "an", "and", "of", "in", "to", "with", "on", "for",
            "is", "are", "am", "be", "was", "were", "it", "this", "that", "at", "by", "from", "as", "if", "or",
            "but", "so", "not", "into", "out", "about", "then");

    private static final String NOTES_FILE = "notes.json";
    private static final String NOTE_NOT_FOUND = "Note not found: ";
    private static final TypeReference<List<Note>> NOTE_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final OracleProperties properties;
    private final AegisService aegisService;
    private final ProjectWorkspacePort workspacePort;
    private final Clock clock;

    private final AtomicReference<List<Note>> notesCache = new AtomicReference<>();

    public synchronized Note createNote(String content, Collection<String> tags, Collection<String> links) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Note content is required");
        }
        List<Note> notes = new ArrayList<>(getNotes());
        long nextId = notes.stream().mapToLong(Note::getId).max().orElse(0) + 1;
        Instant now = clock.instant();

        Note note = Note.builder()
                .id(nextId)
                .content(truncateContent(content))
                .tags(Note.joinCsv(tags))
                .links(Note.joinCsv(links))
                .createdAt(now)
                .updatedAt(now)
                .build();
        notes.add(note);
        saveNotes(notes);
        log.info("[Memory] Created note {} (tags: {})", nextId, note.getTags());
        return note;
    }

    /**
     * Updates the given fields of a note; null arguments leave a field as is.
     */
    public synchronized Note updateNote(long id, String content, Collection<String> tags, Collection<String> links) {
        List<Note> notes = new ArrayList<>(getNotes());
        int index = indexOf(notes, id);
        Note current = notes.get(index);

        Note updated = current.toBuilder()
                .content(content != null ? truncateContent(content) : current.getContent())
                .tags(tags != null ? Note.joinCsv(tags) : current.getTags())
                .links(links != null ? Note.joinCsv(links) : current.getLinks())
                .updatedAt(clock.instant())
                .build();
        notes.set(index, updated);
        saveNotes(notes);
        log.info("[Memory] Updated note {}", id);
        return updated;
    }

    public synchronized boolean removeNote(long id) {
        List<Note> notes = new ArrayList<>(getNotes());
        boolean removed = notes.removeIf(note -> note.getId() == id);
        if (removed) {
            saveNotes(notes);
            log.info("[Memory] Removed note {}", id);
        }
        return removed;
    }

    public Optional<Note> getNote(long id) {
        return getNotes().stream().filter(note -> note.getId() == id).findFirst();
    }

    public List<Note> getNotes() {
        List<Note> cached = notesCache.get();
        if (cached == null) {
            synchronized (this) {
                cached = notesCache.get();
                if (cached == null) {
                    cached = List.copyOf(loadNotes());
                    notesCache.set(cached);
                }
            }
        }
        return cached;
    }

    /**
     * Scored recall with the default limit and no content cap.
     */
    public List<ScoredNote> recallNotes(String query) {
        return recallNotes(query, properties.getMemory().getRecallLimit(), null);
    }

    /**
     * Ranks notes against a query. Zero-score notes are dropped; an empty query
     * (after stop words) scores every note 1 so the newest ones come back.
     *
     * @param maxContentLength
     *            cap applied to returned content, or {@code null}
     */
    public List<ScoredNote> recallNotes(String query, int limit, Integer maxContentLength) {
        Set<String> queryTokens = tokenize(query);
        List<ScoredNote> scored = new ArrayList<>();
        for (Note note : getNotes()) {
            int score = queryTokens.isEmpty() ? 1 : score(queryTokens, note);
            if (score > 0) {
                scored.add(new ScoredNote(presentForRecall(note, maxContentLength), score));
            }
        }
        Comparator<ScoredNote> byScore = Comparator.comparingInt(ScoredNote::score).reversed();
        Comparator<ScoredNote> byRecency = Comparator.comparing((ScoredNote hit) -> hit.note().getUpdatedAt(),
                Comparator.nullsLast(Comparator.<Instant>reverseOrder()));
        scored.sort(byScore.thenComparing(byRecency)
                .thenComparing(hit -> hit.note().getId(), Comparator.<Long>reverseOrder()));
        log.debug("[Memory] Recall '{}': {} of {} notes matched", query, scored.size(), getNotes().size());
        return scored.size() > limit ? new ArrayList<>(scored.subList(0, limit)) : scored;
    }

    /**
     * Notes linked to any of the given targets.
     */
    public List<Note> fetchNotesByLinks(Collection<String> links) {
        if (links == null || links.isEmpty()) {
            return List.of();
        }
        Set<String> wanted = new HashSet<>(links);
        return getNotes().stream()
                .filter(note -> note.getLinkList().stream().anyMatch(wanted::contains))
                .toList();
    }

    /**
     * Notes relevant to the current orientation, queried by its tags or, when
     * there are none, by its summary; returned in rank order within
     * {@code maxTokens}.
     */
    public List<Note> recallAegisNotes(int maxTokens) {
        AegisState aegis = aegisService.current();
        String query = !aegis.getTags().isEmpty() ? String.join(" ", aegis.getTags()) : aegis.getSummary();
        if (query == null || query.isBlank()) {
            return List.of();
        }
        List<Note> selected = new ArrayList<>();
        int total = 0;
        int maxContentLength = properties.getMemory().getMaxNoteContentLength();
        for (ScoredNote hit : recallNotes(query, properties.getMemory().getAegisRecallLimit(), maxContentLength)) {
            int cost = TokenEstimationSupport.estimate(hit.note().getContent(), hit.note().getTags(),
                    hit.note().getLinks());
            if (total + cost > maxTokens) {
                break;
            }
            total += cost;
            selected.add(hit.note());
        }
        return selected;
    }

    public String truncateContent(String content) {
        return TextTruncationSupport.truncatePreservingCodeBlocks(content,
                properties.getMemory().getMaxNoteContentLength());
    }

    static int score(Set<String> queryTokens, Note note) {
        int score = CONTENT_WEIGHT * overlap(queryTokens, tokenize(note.getContent()))
                + TAG_WEIGHT * overlap(queryTokens, tokenize(note.getTags()))
                + LINK_WEIGHT * overlap(queryTokens, tokenize(note.getLinks()));
        String links = note.getLinks();
        if (links != null && !links.isEmpty() && queryTokens.stream().anyMatch(links::contains)) {
            score += LINK_SUBSTRING_BONUS;
        }
        return score;
    }

    static Set<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}_]+")) {
            if (!token.isEmpty() && !STOP_WORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static int overlap(Set<String> queryTokens, Set<String> fieldTokens) {
        int count = 0;
        for (String token : fieldTokens) {
            if (queryTokens.contains(token)) {
                count++;
            }
        }
        return count;
    }

    private Note presentForRecall(Note note, Integer maxContentLength) {
        String content = maxContentLength != null
                ? TextTruncationSupport.truncatePreservingCodeBlocks(note.getContent(), maxContentLength)
                : note.getContent();
        String links = note.getLinkList().stream()
                .map(this::renderLink)
                .collect(Collectors.joining(","));
        return note.toBuilder().content(content).links(links).build();
    }

    private String renderLink(String link) {
        if (looksLikePath(link) && !workspacePort.fileExists(link)) {
            return "~~" + link + "~~ (path not found)";
        }
        return link;
    }

    private static boolean looksLikePath(String link) {
        return !link.contains("://") && (link.contains("/") || link.contains("."));
    }

    private static int indexOf(List<Note> notes, long id) {
        for (int i = 0; i < notes.size(); i++) {
            if (notes.get(i).getId() == id) {
                return i;
            }
        }
        throw new IllegalArgumentException(NOTE_NOT_FOUND + id);
    }

    private void saveNotes(List<Note> notes) {
        try {
            String json = objectMapper.writeValueAsString(notes);
            storagePort.writeAtomic(notesDirectory(), NOTES_FILE, json, true).join();
            notesCache.set(List.copyOf(notes));
        } catch (IOException | RuntimeException e) {
            log.error("[Memory] Failed to save notes", e);
            throw new IllegalStateException("Failed to persist notes", e);
        }
    }

    private List<Note> loadNotes() {
        try {
            String json = storagePort.readText(notesDirectory(), NOTES_FILE).join();
            if (json != null && !json.isBlank()) {
                return new ArrayList<>(objectMapper.readValue(json, NOTE_LIST_TYPE_REF));
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - fall back to empty notes
            log.debug("[Memory] No notes found or failed to parse: {}", e.getMessage());
        }
        return new ArrayList<>();
    }

    private String notesDirectory() {
        return properties.getStorage().getDirectories().getNotes();
    }
}
