package me.golemcore.oracle.domain.system.divination;

import me.golemcore.oracle.domain.model.InterruptMarker;
import me.golemcore.oracle.domain.model.StepTerminationException;
import me.golemcore.oracle.domain.model.ToolExecutionException;
import me.golemcore.oracle.domain.model.ToolFailureType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionSandboxTest {

    private ExecutorService executor;
    private ExecutionSandbox sandbox;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        sandbox = new ExecutionSandbox(executor, Duration.ZERO, 40);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // ==================== Retries ====================

    @Test
    void shouldReturnResultOnFirstAttempt() {
        String result = sandbox.execute("echo", () -> "ok", 2, Duration.ofSeconds(5));

        assertEquals("ok", result);
    }

    @Test
    void shouldRetryUntilSuccessWithinBudget() {
        AtomicInteger attempts = new AtomicInteger();

        String result = sandbox.execute("flaky", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
            return "done";
        }, 2, Duration.ofSeconds(5));

        assertEquals("done", result);
        assertEquals(3, attempts.get());
    }

    @Test
    void shouldThrowTypedErrorWhenRetriesExhausted() {
        AtomicInteger attempts = new AtomicInteger();

        ToolExecutionException error = assertThrows(ToolExecutionException.class,
                () -> sandbox.execute("broken", () -> {
                    attempts.incrementAndGet();
                    throw new IllegalStateException("disk on fire");
                }, 2, Duration.ofSeconds(5)));

        assertEquals(3, attempts.get());
        assertEquals(3, error.getAttempts());
        assertEquals(ToolFailureType.TOOL_EXECUTION, error.getFailureType());
        assertEquals("ToolExecution: disk on fire", error.getMessage());
    }

    @Test
    void shouldTruncateLongFailureMessages() {
        ToolExecutionException error = assertThrows(ToolExecutionException.class,
                () -> sandbox.execute("noisy", () -> {
                    throw new IllegalStateException("x".repeat(500));
                }, 0, Duration.ofSeconds(5)));

        assertEquals("ToolExecution: " + "x".repeat(40) + "...", error.getMessage());
    }

    // ==================== Timeouts ====================

    @Test
    void shouldClassifyTimeoutAfterRetries() {
        CountDownLatch never = new CountDownLatch(1);

        ToolExecutionException error = assertThrows(ToolExecutionException.class,
                () -> sandbox.execute("slow", () -> {
                    never.await();
                    return "late";
                }, 1, Duration.ofMillis(50)));

        assertEquals(ToolFailureType.TIMEOUT, error.getFailureType());
        assertEquals(2, error.getAttempts());
        assertTrue(error.getMessage().startsWith("Timeout: slow timed out"));
    }

    // ==================== Step termination ====================

    @Test
    void shouldPropagateStepTerminationWithoutRetry() {
        AtomicInteger attempts = new AtomicInteger();
        StepTerminationException termination = new StepTerminationException(InterruptMarker.stepCompleted("ok"));

        StepTerminationException thrown = assertThrows(StepTerminationException.class,
                () -> sandbox.execute("finish_step", () -> {
                    attempts.incrementAndGet();
                    throw termination;
                }, 2, Duration.ofSeconds(5)));

        assertSame(termination, thrown);
        assertEquals(1, attempts.get());
    }

    // ==================== Classification ====================

    @Test
    void shouldClassifyFailureTypes() {
        assertEquals(ToolFailureType.TIMEOUT, ExecutionSandbox.classify(new TimeoutException("t")));
        assertEquals(ToolFailureType.RATE_LIMIT, ExecutionSandbox.classify(new IllegalStateException("HTTP 429")));
        assertEquals(ToolFailureType.CONTEXT_LENGTH,
                ExecutionSandbox.classify(new IllegalStateException("maximum context exceeded")));
        assertEquals(ToolFailureType.NETWORK, ExecutionSandbox.classify(new IOException("connection reset")));
        assertEquals(ToolFailureType.TOOL_EXECUTION, ExecutionSandbox.classify(new RuntimeException("boom")));
    }
}
