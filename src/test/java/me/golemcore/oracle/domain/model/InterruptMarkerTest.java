package me.golemcore.oracle.domain.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InterruptMarkerTest {

    @Test
    void shouldDetectMarkerKey() {
        Optional<InterruptMarker> marker = InterruptMarker.detect(Map.of(
                InterruptMarker.MARKER_KEY, "step_rejected",
                "reason", "tests fail",
                "restart_from_step", "3"));

        assertTrue(marker.isPresent());
        assertTrue(marker.get().isStepRejected());
        assertEquals("tests fail", marker.get().reason());
        assertEquals(3, marker.get().restartFromStep());
    }

    @Test
    void shouldAcceptInterruptKindKey() {
        Optional<InterruptMarker> marker = InterruptMarker.detect(Map.of(
                InterruptMarker.INTERRUPT_KIND_KEY, "needs_input"));

        assertTrue(marker.isPresent());
        assertEquals("needs_input", marker.get().kind());
        assertFalse(marker.get().isStepCompleted());
    }

    @Test
    void shouldIgnoreNonMarkerResults() {
        assertFalse(InterruptMarker.detect("plain text").isPresent());
        assertFalse(InterruptMarker.detect(Map.of("ok", true)).isPresent());
        assertFalse(InterruptMarker.detect(List.of(Map.of(InterruptMarker.MARKER_KEY, "x"))).isPresent());
        assertFalse(InterruptMarker.detect(null).isPresent());
    }

    @Test
    void shouldIgnoreUnparseableRestartStep() {
        InterruptMarker marker = InterruptMarker.detect(Map.of(
                InterruptMarker.MARKER_KEY, "step_rejected",
                "restart_from_step", "soon")).orElseThrow();

        assertNull(marker.restartFromStep());
    }

    @Test
    void shouldDropNullValuesFromRawCopy() {
        InterruptMarker marker = InterruptMarker.stepRejected("bad", null);

        assertEquals(Map.of(InterruptMarker.MARKER_KEY, "step_rejected", "reason", "bad"), marker.raw());
    }

    @Test
    void shouldRoundTripFactoryMarkerThroughDetect() {
        Map<String, Object> raw = new HashMap<>(InterruptMarker.stepCompleted(Map.of("files", 2)).raw());

        InterruptMarker detected = InterruptMarker.detect(raw).orElseThrow();

        assertTrue(detected.isStepCompleted());
        assertEquals(Map.of("files", 2), detected.result());
    }
}
