package me.golemcore.oracle.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.oracle.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.oracle.domain.model.Note;
import me.golemcore.oracle.domain.model.ScoredNote;
import me.golemcore.oracle.infrastructure.config.AutoConfiguration;
import me.golemcore.oracle.infrastructure.config.OracleProperties;
import me.golemcore.oracle.port.outbound.ProjectWorkspacePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class NoteServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private OracleProperties properties;
    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private AegisService aegisService;
    private ProjectWorkspacePort workspacePort;
    private NoteService service;

    @BeforeEach
    void setUp() {
        properties = new OracleProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        aegisService = new AegisService(storage, objectMapper, properties, clock);
        aegisService.init();
        workspacePort = mock(ProjectWorkspacePort.class);
        when(workspacePort.fileExists(anyString())).thenReturn(true);
        service = new NoteService(storage, objectMapper, properties, aegisService, workspacePort, clock);
    }

    // ==================== CRUD ====================

    @Test
    void shouldCreateUpdateAndRemoveNotes() {
        Note created = service.createNote("Retry budget is two", List.of("sandbox"), List.of("docs/retry.md"));

        assertEquals(1, created.getId());
        assertEquals("sandbox", created.getTags());

        Note updated = service.updateNote(created.getId(), null, List.of("sandbox", "retry"), null);
        assertEquals("Retry budget is two", updated.getContent());
        assertEquals(List.of("sandbox", "retry"), updated.getTagList());

        assertTrue(service.removeNote(created.getId()));
        assertFalse(service.removeNote(created.getId()));
        assertTrue(service.getNote(created.getId()).isEmpty());
    }

    @Test
    void shouldPersistNotesAcrossInstances() {
        service.createNote("Persisted note", List.of(), List.of());

        NoteService reloaded = new NoteService(storage, objectMapper, properties, aegisService, workspacePort,
                Clock.fixed(NOW, ZoneOffset.UTC));

        assertEquals(1, reloaded.getNotes().size());
        assertEquals("Persisted note", reloaded.getNotes().get(0).getContent());
        assertEquals(NOW, reloaded.getNotes().get(0).getCreatedAt());
    }

    @Test
    void shouldRejectBlankContentAndUnknownIds() {
        assertThrows(IllegalArgumentException.class, () -> service.createNote(" ", List.of(), List.of()));
        assertThrows(IllegalArgumentException.class, () -> service.updateNote(42, "x", null, null));
    }

    // ==================== Truncation ====================

    @Test
    void shouldKeepContentAtCapUnchanged() {
        String content = "n".repeat(properties.getMemory().getMaxNoteContentLength());

        assertSame(content, service.truncateContent(content));
    }

    @Test
    void shouldKeepProseAndFencesWhenContentJustOverCap() {
        int cap = properties.getMemory().getMaxNoteContentLength();
        String prose = "Parser fix:\n";
        String suffix = "\nApplied to lexer.";
        String codeBody = "c".repeat(cap - prose.length() - suffix.length() - 10) + "\n";
        String content = prose + "```java\n" + codeBody + "```" + suffix;

        String truncated = service.truncateContent(content);

        assertTrue(content.length() > cap);
        assertTrue(truncated.length() <= cap);
        assertTrue(truncated.startsWith(prose + "```java\n"));
        assertTrue(truncated.endsWith("```" + suffix));
    }

    // ==================== Recall ====================

    @Test
    void shouldScoreLinkSubstringMatchAtLeastFiveHigher() {
        Set<String> query = NoteService.tokenize("parser bug");
        Note withLink = Note.builder().id(1).content("Fixed a crash").tags("core").links("src/parser.rb").build();
        Note withoutLink = Note.builder().id(2).content("Fixed a crash").tags("core").links("").build();

        int difference = NoteService.score(query, withLink) - NoteService.score(query, withoutLink);

        assertTrue(difference >= 5);
    }

    @Test
    void shouldWeighContentAboveTagsAboveLinks() {
        Set<String> query = NoteService.tokenize("cache");

        assertEquals(4, NoteService.score(query, Note.builder().content("cache").build()));
        assertEquals(3, NoteService.score(query, Note.builder().tags("cache").build()));
        assertEquals(2 + 5, NoteService.score(query, Note.builder().links("cache").build()));
    }

    @Test
    void shouldIgnoreStopWordsWhenTokenizing() {
        assertEquals(Set.of("state", "loop"), NoteService.tokenize("The state of the loop"));
    }

    @Test
    void shouldRankByScoreAndDropNonMatches() {
        service.createNote("The sandbox retries twice", List.of("sandbox"), List.of());
        service.createNote("Unrelated note about colors", List.of(), List.of());
        service.createNote("Sandbox timeout", List.of(), List.of());

        List<ScoredNote> hits = service.recallNotes("sandbox retries");

        assertEquals(2, hits.size());
        assertEquals(1, hits.get(0).note().getId());
        assertTrue(hits.get(0).score() > hits.get(1).score());
    }

    @Test
    void shouldReturnNewestNotesForStopWordOnlyQuery() {
        service.createNote("first", List.of(), List.of());
        service.createNote("second", List.of(), List.of());

        List<ScoredNote> hits = service.recallNotes("the of and", 1, null);

        assertEquals(1, hits.size());
        assertEquals(2, hits.get(0).note().getId());
    }

    @Test
    void shouldStrikeThroughMissingPathLinks() {
        when(workspacePort.fileExists("lib/gone.rb")).thenReturn(false);
        service.createNote("Loader notes", List.of(), List.of("lib/gone.rb", "https://example.com/doc"));

        Note recalled = service.recallNotes("loader").get(0).note();

        assertEquals("~~lib/gone.rb~~ (path not found),https://example.com/doc", recalled.getLinks());
    }

    @Test
    void shouldFetchNotesByLinks() {
        service.createNote("A", List.of(), List.of("lib/a.rb"));
        service.createNote("B", List.of(), List.of("lib/b.rb"));

        List<Note> linked = service.fetchNotesByLinks(List.of("lib/b.rb"));

        assertEquals(1, linked.size());
        assertEquals("B", linked.get(0).getContent());
    }

    @Test
    void shouldRecallNotesForAegisTags() {
        service.createNote("Divination loop restarts on temperature drift", List.of("loop"), List.of());
        service.createNote("Unrelated", List.of(), List.of());
        aegisService.unveil(List.of("loop"), "Working on the loop", null);

        List<Note> notes = service.recallAegisNotes(500);

        assertEquals(1, notes.size());
        assertEquals(1, notes.get(0).getId());
        assertTrue(service.recallAegisNotes(1).isEmpty());
    }
}
