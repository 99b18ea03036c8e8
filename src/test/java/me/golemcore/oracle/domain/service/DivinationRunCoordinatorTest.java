package me.golemcore.oracle.domain.service;

import me.golemcore.oracle.domain.model.OracleRequest;
import me.golemcore.oracle.domain.model.OracleResponse;
import me.golemcore.oracle.domain.model.OracleStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DivinationRunCoordinatorTest {

    private static final OracleRequest REQUEST = OracleRequest.builder().prompt("hi").build();

    private OracleService oracleService;
    private ExecutorService executor;
    private DivinationRunCoordinator coordinator;
    private CountDownLatch started;
    private CountDownLatch release;

    @BeforeEach
    void setUp() {
        oracleService = mock(OracleService.class);
        executor = Executors.newCachedThreadPool();
        coordinator = new DivinationRunCoordinator(oracleService, executor);
        started = new CountDownLatch(1);
        release = new CountDownLatch(1);

        when(oracleService.consult(eq("blocking"), any(), any(), any())).thenAnswer(invocation -> {
            started.countDown();
            release.await();
            return OracleResponse.builder().status(OracleStatus.SUCCESS).answer("late").build();
        });
        when(oracleService.consult(eq("quick"), any(), any(), any()))
                .thenReturn(OracleResponse.builder().status(OracleStatus.SUCCESS).answer("4").build());
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    @Test
    void shouldRunConsultationInBackground() throws Exception {
        Future<OracleResponse> future = coordinator.submit("quick", REQUEST, List.of(), null);

        assertEquals("4", future.get(5, TimeUnit.SECONDS).getAnswer());
        assertFalse(coordinator.isRunning("quick"));
    }

    @Test
    void shouldRejectSecondRunForBusySession() throws Exception {
        coordinator.submit("blocking", REQUEST, List.of(), null);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(coordinator.isRunning("blocking"));
        assertThrows(IllegalStateException.class,
                () -> coordinator.submit("blocking", REQUEST, List.of(), null));
    }

    @Test
    void shouldAllowNewRunAfterPreviousFinished() throws Exception {
        coordinator.submit("quick", REQUEST, List.of(), null).get(5, TimeUnit.SECONDS);

        Future<OracleResponse> second = coordinator.submit("quick", REQUEST, List.of(), null);

        assertEquals("4", second.get(5, TimeUnit.SECONDS).getAnswer());
    }

    @Test
    void shouldCancelActiveRun() throws Exception {
        Future<OracleResponse> future = coordinator.submit("blocking", REQUEST, List.of(), null);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(coordinator.cancel("blocking"));

        assertTrue(future.isCancelled());
        assertFalse(coordinator.isRunning("blocking"));
    }

    @Test
    void shouldReportFalseWhenCancellingIdleSession() {
        assertFalse(coordinator.cancel("nobody"));
    }
}
