package me.golemcore.oracle.domain.service;

import me.golemcore.oracle.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.oracle.domain.model.InterruptMarker;
import me.golemcore.oracle.domain.model.Task;
import me.golemcore.oracle.domain.model.TaskAction;
import me.golemcore.oracle.domain.model.TaskActionResult;
import me.golemcore.oracle.domain.model.TaskCommand;
import me.golemcore.oracle.domain.model.TaskStatus;
import me.golemcore.oracle.domain.model.ToolCallRecord;
import me.golemcore.oracle.domain.model.WorkflowType;
import me.golemcore.oracle.infrastructure.config.AutoConfiguration;
import me.golemcore.oracle.infrastructure.config.OracleProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private OracleProperties properties;
    private LocalStorageAdapter storage;
    private TaskService service;

    @BeforeEach
    void setUp() {
        properties = new OracleProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        service = newService();
    }

    private TaskService newService() {
        return new TaskService(storage, AutoConfiguration.objectMapper(), properties,
                new ToolCallStorageTruncator(new ToolPriorityRegistry()), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ==================== manage_task ====================

    @Test
    void shouldCreateTaskWithDefaults() {
        TaskActionResult result = service.manageTask(TaskAction.CREATE,
                TaskCommand.builder().title("Port the parser").plan("1. read\n2. port").build());

        assertTrue(result.isOk());
        Task task = result.getTask();
        assertEquals(1, task.getId());
        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertEquals(1, task.getCurrentStep());
        assertEquals(WorkflowType.FULL, task.getWorkflowType());
        assertEquals("Task created", task.getLogs().get(0).getMessage());
    }

    @Test
    void shouldReportValidationErrorsAsFailedResults() {
        TaskActionResult missingTitle = service.manageTask(TaskAction.CREATE, TaskCommand.builder().build());
        TaskActionResult missingId = service.manageTask(TaskAction.ACTIVATE, TaskCommand.builder().build());
        TaskActionResult unknownParent = service.manageTask(TaskAction.CREATE,
                TaskCommand.builder().title("child").parentTaskId(99L).build());

        assertFalse(missingTitle.isOk());
        assertEquals("Task title is required", missingTitle.getError());
        assertFalse(missingId.isOk());
        assertEquals("Parent task not found: 99", unknownParent.getError());
    }

    @Test
    void shouldPersistTasksAcrossInstances() {
        service.createTask(TaskCommand.builder().title("Persisted").build());

        List<Task> reloaded = newService().getTasks();

        assertEquals(1, reloaded.size());
        assertEquals("Persisted", reloaded.get(0).getTitle());
    }

    // ==================== Steps ====================

    @Test
    void shouldNeverAdvancePastWorkflowMaximum() {
        Task task = service.createTask(TaskCommand.builder().title("Quick fix").workflowType(WorkflowType.SIMPLE)
                .build());

        service.advanceStep(task.getId());
        Task atEnd = service.advanceStep(task.getId());

        assertEquals(3, atEnd.getCurrentStep());
        TaskActionResult beyond = service.manageTask(TaskAction.ADVANCE_STEP,
                TaskCommand.builder().id(task.getId()).build());
        assertFalse(beyond.isOk());
        assertEquals(3, service.getTask(task.getId()).orElseThrow().getCurrentStep());
    }

    @Test
    void shouldRejectStepOutsideWorkflowRange() {
        Task task = service.createTask(TaskCommand.builder().title("Analyse").workflowType(WorkflowType.ANALYSIS)
                .build());

        TaskActionResult result = service.manageTask(TaskAction.UPDATE,
                TaskCommand.builder().id(task.getId()).currentStep(6).build());

        assertFalse(result.isOk());
        assertThrows(IllegalArgumentException.class,
                () -> service.recordStepResult(task.getId(), 0, "x", List.of()));
    }

    @Test
    void shouldNotLetReturnedTasksChangeStoredState() {
        Task created = service.createTask(TaskCommand.builder().title("Refactor").build());
        created.setCurrentStep(99);

        service.getTask(created.getId()).orElseThrow().setCurrentStep(42);
        service.getTasks().get(0).getLogs().clear();

        Task stored = service.getTask(created.getId()).orElseThrow();
        assertEquals(1, stored.getCurrentStep());
        assertEquals(1, stored.getLogs().size());
        assertEquals(1, newService().getTask(created.getId()).orElseThrow().getCurrentStep());
    }

    @Test
    void shouldRecordStepResultAndTruncatedToolCallsUnderSameKey() {
        Task task = service.createTask(TaskCommand.builder().title("Record").build());
        ToolCallRecord call = ToolCallRecord.builder()
                .request(ToolCallRecord.Request.builder().tool("read_file").build())
                .result("r".repeat(1000))
                .build();

        Task updated = service.recordStepResult(task.getId(), 2, Map.of("summary", "done"), List.of(call));

        assertEquals(Map.of("summary", "done"), updated.getStepResults().get("2"));
        assertEquals(300, ((String) updated.getStepToolCalls().get("2").get(0).getResult()).length());
    }

    // ==================== Interrupts ====================

    @Test
    void shouldAdvanceOnStepCompletedAndCompleteAtLastStep() {
        Task task = service.createTask(TaskCommand.builder().title("Short").workflowType(WorkflowType.SIMPLE)
                .build());

        service.applyInterrupt(task.getId(), InterruptMarker.stepCompleted("one"), List.of());
        service.applyInterrupt(task.getId(), InterruptMarker.stepCompleted("two"), List.of());
        Task finished = service.applyInterrupt(task.getId(), InterruptMarker.stepCompleted("three"), List.of());

        assertEquals(3, finished.getCurrentStep());
        assertEquals(TaskStatus.COMPLETED, finished.getStatus());
        assertEquals("three", finished.getStepResults().get("3"));
    }

    @Test
    void shouldRewindOnStepRejectedWithinRange() {
        Task task = service.createTask(TaskCommand.builder().title("Rewind").build());
        service.updateTask(TaskCommand.builder().id(task.getId()).currentStep(4).build());

        Task rewound = service.applyInterrupt(task.getId(), InterruptMarker.stepRejected("bad plan", 2), null);
        assertEquals(2, rewound.getCurrentStep());

        Task clamped = service.applyInterrupt(task.getId(), InterruptMarker.stepRejected("again", 9), null);
        assertEquals(2, clamped.getCurrentStep());
        assertEquals(Boolean.TRUE, ((Map<?, ?>) clamped.getStepResults().get("2")).get("rejected"));
    }

    // ==================== Hierarchy ====================

    @Test
    void shouldCascadeDeleteToSubtasks() {
        Task parent = service.createTask(TaskCommand.builder().title("Parent").build());
        Task child = service.createTask(TaskCommand.builder().title("Child").parentTaskId(parent.getId()).build());
        service.createTask(TaskCommand.builder().title("Grandchild").parentTaskId(child.getId()).build());
        Task other = service.createTask(TaskCommand.builder().title("Other").build());

        service.deleteTask(parent.getId());

        assertEquals(List.of(other.getId()), service.getTasks().stream().map(Task::getId).toList());
    }

    @Test
    void shouldRecordSubtaskResultsOnParent() {
        Task parent = service.createTask(TaskCommand.builder().title("Parent").build());
        Task child = service.createTask(TaskCommand.builder().title("Child").parentTaskId(parent.getId()).build());

        Task updated = service.updateSubtaskResults(parent.getId(), child.getId(), "child done");

        assertEquals("child done", updated.getSubtaskResults().get(Long.toString(child.getId())));
        assertThrows(IllegalArgumentException.class,
                () -> service.updateSubtaskResults(child.getId(), parent.getId(), "wrong"));
    }

    @Test
    void shouldListChildrenNewestFirstWithinBudget() {
        Task parent = service.createTask(TaskCommand.builder().title("Parent").build());
        service.createTask(TaskCommand.builder().title("First child").parentTaskId(parent.getId()).build());
        service.createTask(TaskCommand.builder().title("Second child").parentTaskId(parent.getId()).build());

        List<Task> children = service.listTasks(parent.getId());
        assertEquals(List.of("Second child", "First child"), children.stream().map(Task::getTitle).toList());

        properties.getMemory().setTaskListMaxTokens(3);
        assertEquals(1, service.listTasks(parent.getId()).size());
    }

    @Test
    void shouldKeepPlanHistoryOnPlanUpdate() {
        Task task = service.createTask(TaskCommand.builder().title("Plan").plan("v1").build());

        Task updated = service.updatePlan(task.getId(), "v2", "scope changed");

        assertEquals("v2", updated.getPlan());
        assertEquals("v1", updated.getPlanUpdates().get(0).getPreviousPlan());
        assertEquals("scope changed", updated.getPlanUpdates().get(0).getReason());
    }
}
