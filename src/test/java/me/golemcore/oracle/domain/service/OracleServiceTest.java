package me.golemcore.oracle.domain.service;

import me.golemcore.oracle.domain.model.AssembledContext;
import me.golemcore.oracle.domain.model.Attachment;
import me.golemcore.oracle.domain.model.ConversationEntry;
import me.golemcore.oracle.domain.model.DivinationArtifacts;
import me.golemcore.oracle.domain.model.DivinationResult;
import me.golemcore.oracle.domain.model.InterruptMarker;
import me.golemcore.oracle.domain.model.OracleRequest;
import me.golemcore.oracle.domain.model.OracleResponse;
import me.golemcore.oracle.domain.model.OracleStatus;
import me.golemcore.oracle.domain.model.ToolDefinition;
import me.golemcore.oracle.domain.model.ToolResultRecord;
import me.golemcore.oracle.domain.system.divination.DivinationLoop;
import me.golemcore.oracle.domain.system.divination.DivinationSession;
import me.golemcore.oracle.port.outbound.ToolDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OracleServiceTest {

    private static final Instant STARTED = Instant.parse("2026-03-01T10:00:00Z");

    private ContextAssemblyService contextAssemblyService;
    private ConversationHistoryService historyService;
    private ToolPriorityRegistry priorityRegistry;
    private DivinationLoop divinationLoop;
    private OracleService oracleService;

    @BeforeEach
    void setUp() {
        contextAssemblyService = mock(ContextAssemblyService.class);
        historyService = mock(ConversationHistoryService.class);
        priorityRegistry = new ToolPriorityRegistry();
        divinationLoop = mock(DivinationLoop.class);
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenReturn(STARTED, STARTED.plusMillis(1500));

        when(contextAssemblyService.build(any())).thenReturn(AssembledContext.empty());
        when(historyService.recordEntry(any())).thenReturn(42L);

        oracleService = new OracleService(contextAssemblyService, historyService, priorityRegistry, divinationLoop,
                clock);
    }

    private static OracleRequest request(boolean record) {
        return OracleRequest.builder()
                .prompt("What does User do?")
                .record(record)
                .tags(List.of("rails", "models"))
                .attachments(List.of(new Attachment("app/models/user.rb", "class User", 1, 1)))
                .build();
    }

    // ==================== Status mapping ====================

    @Test
    void shouldMapAnsweredToSuccess() {
        when(divinationLoop.divine(any())).thenReturn(
                new DivinationResult.Answered("4", new DivinationArtifacts(), List.of(), 1));

        OracleResponse response = oracleService.consult("s-1", request(false), List.of(), null);

        assertEquals(OracleStatus.SUCCESS, response.getStatus());
        assertEquals("success", response.getStatusTag());
        assertEquals("4", response.getAnswer());
        assertEquals("Answered in 1 turn(s)", response.getMessage());
        assertEquals(1.5, response.getExecutionTime(), 1e-9);
        assertNull(response.getEntryId());
        verify(historyService, never()).recordEntry(any());
    }

    @Test
    void shouldMapInterruptedAndSkipRecording() {
        InterruptMarker marker = InterruptMarker.stepCompleted("done");
        when(divinationLoop.divine(any())).thenReturn(
                new DivinationResult.Interrupted(marker, new DivinationArtifacts(), List.of(), 2));

        OracleResponse response = oracleService.consult("s-1", request(true), List.of(), null);

        assertEquals(OracleStatus.INTERRUPTED, response.getStatus());
        assertSame(marker, response.getInterrupt());
        assertEquals("Interrupted by tool: step_completed", response.getMessage());
        verify(historyService, never()).recordEntry(any());
    }

    @Test
    void shouldCapFailureMessage() {
        String longMessage = "x".repeat(1000);
        when(divinationLoop.divine(any())).thenReturn(new DivinationResult.Failed(OracleStatus.RATE_LIMIT,
                longMessage, "at Foo.bar", new DivinationArtifacts(), List.of()));

        OracleResponse response = oracleService.consult("s-1", request(false), List.of(), null);

        assertEquals("rate_limit_error", response.getStatusTag());
        assertTrue(response.getMessage().length() <= OracleResponse.MAX_MESSAGE_LENGTH);
    }

    @Test
    void shouldTurnUnexpectedExceptionIntoFailure() {
        when(contextAssemblyService.build(any())).thenThrow(new IllegalStateException("history unreadable"));

        OracleResponse response = oracleService.consult("s-1", request(false), List.of(), null);

        assertEquals(OracleStatus.FAILURE, response.getStatus());
        assertEquals("history unreadable", response.getMessage());
    }

    // ==================== Session ====================

    @Test
    void shouldBuildSessionFromRequestAndRegisterPriorities() {
        when(divinationLoop.divine(any())).thenReturn(
                new DivinationResult.Answered("ok", new DivinationArtifacts(), List.of(), 1));
        OracleRequest request = OracleRequest.builder()
                .prompt("Plan it")
                .reasoning(true)
                .temperature(0.3)
                .maxDepth(5)
                .reminders(List.of("check tests"))
                .callerContext(Map.of("user", "dev"))
                .build();
        ToolDefinition readFile = ToolDefinition.builder().name("read_file").historyPriority(3).build();

        oracleService.consult("s-7", request, List.of(readFile), null);

        ArgumentCaptor<DivinationSession> captor = ArgumentCaptor.forClass(DivinationSession.class);
        verify(divinationLoop).divine(captor.capture());
        DivinationSession session = captor.getValue();
        assertEquals("s-7", session.getSessionId());
        assertEquals("Plan it", session.getPrompt());
        assertTrue(session.isReasoning());
        assertEquals(0.3, session.getTemperatureOverride());
        assertEquals(5, session.getMaxDepth());
        assertEquals(1, session.remainingReminders());
        assertEquals("dev", session.getCallerContext().get("user"));
        assertEquals(3, priorityRegistry.priorityOf("read_file"));
    }

    // ==================== Recording ====================

    @Test
    void shouldRecordAnsweredEntryWithCapturedArguments() {
        when(divinationLoop.divine(any())).thenAnswer(invocation -> {
            DivinationSession session = invocation.getArgument(0);
            List<ToolResultRecord> results = new ArrayList<>();
            Object content = session.getDispatcher().dispatch("read_file", Map.of("path", "app/models/user.rb"),
                    new ToolDispatcher.Invocation(session.getSessionId(), results, Map.of()));
            results.add(new ToolResultRecord("call_1", "read_file", content));
            return new DivinationResult.Answered("User is a model", new DivinationArtifacts(), results, 2);
        });
        ToolDispatcher dispatcher = (name, args, invocation) -> Map.of("ok", true);

        OracleResponse response = oracleService.consult("s-1", request(true), List.of(), dispatcher);

        assertEquals(42L, response.getEntryId());
        ArgumentCaptor<ConversationEntry> captor = ArgumentCaptor.forClass(ConversationEntry.class);
        verify(historyService).recordEntry(captor.capture());
        ConversationEntry entry = captor.getValue();
        assertEquals("What does User do?", entry.getPrompt());
        assertEquals("User is a model", entry.getAnswer());
        assertEquals("rails,models", entry.getTags());
        assertEquals("app/models/user.rb", entry.getFile());
        assertEquals("class User", entry.getSelection());
        assertEquals(1.5, entry.getExecutionTime(), 1e-9);
        assertEquals(1, entry.getToolCalls().size());
        assertEquals("read_file", entry.getToolCalls().get(0).toolName());
        assertEquals("app/models/user.rb", entry.getToolCalls().get(0).getRequest().getArgs().get("path"));
        assertEquals(Map.of("ok", true), entry.getToolCalls().get(0).getResult());
    }

    @Test
    void shouldRecordFailureWithErrorPrefix() {
        when(divinationLoop.divine(any())).thenReturn(new DivinationResult.Failed(OracleStatus.TIMEOUT,
                "Read timed out", null, new DivinationArtifacts(), List.of()));

        oracleService.consult("s-1", request(true), List.of(), null);

        ArgumentCaptor<ConversationEntry> captor = ArgumentCaptor.forClass(ConversationEntry.class);
        verify(historyService).recordEntry(captor.capture());
        assertEquals("Error: Read timed out", captor.getValue().getAnswer());
    }

    @Test
    void shouldKeepResponseWhenRecordingFails() {
        when(divinationLoop.divine(any())).thenReturn(
                new DivinationResult.Answered("4", new DivinationArtifacts(), List.of(), 1));
        when(historyService.recordEntry(any())).thenThrow(new IllegalStateException("disk full"));

        OracleResponse response = oracleService.consult("s-1", request(true), List.of(), null);

        assertEquals(OracleStatus.SUCCESS, response.getStatus());
        assertNull(response.getEntryId());
    }

    // ==================== Message cap ====================

    @Test
    void shouldLeaveShortMessagesUntouched() {
        assertEquals("short", OracleService.capMessage("short"));
        assertNull(OracleService.capMessage(null));
    }
}
