package me.golemcore.oracle.domain.service;

import me.golemcore.oracle.domain.model.ToolCallRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolCallStorageTruncatorTest {

    private ToolPriorityRegistry registry;
    private ToolCallStorageTruncator truncator;

    @BeforeEach
    void setUp() {
        registry = new ToolPriorityRegistry();
        truncator = new ToolCallStorageTruncator(registry);
    }

    @Test
    void shouldPickLimitTierByPriority() {
        assertEquals(300, ToolCallStorageTruncator.limitForPriority(0));
        assertEquals(300, ToolCallStorageTruncator.limitForPriority(1));
        assertEquals(600, ToolCallStorageTruncator.limitForPriority(4));
        assertEquals(1200, ToolCallStorageTruncator.limitForPriority(9));
        assertEquals(3000, ToolCallStorageTruncator.limitForPriority(10));
    }

    @Test
    void shouldTruncateResultAndArgsOfLowPriorityTool() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("path", "p".repeat(400));
        ToolCallRecord call = ToolCallRecord.builder()
                .request(ToolCallRecord.Request.builder().tool("read_file").args(args).build())
                .result("r".repeat(1000))
                .build();

        ToolCallRecord truncated = truncator.truncate(List.of(call)).get(0);

        assertEquals(300, ((String) truncated.getResult()).length());
        assertEquals(150, ((String) truncated.getRequest().getArgs().get("path")).length());
        assertEquals("read_file", truncated.toolName());
    }

    @Test
    void shouldKeepMoreForHighPriorityTool() {
        registry.register("edit_file", 10);
        ToolCallRecord call = ToolCallRecord.builder()
                .request(ToolCallRecord.Request.builder().tool("edit_file").build())
                .result("r".repeat(2000))
                .build();

        ToolCallRecord truncated = truncator.truncate(List.of(call)).get(0);

        assertEquals(2000, ((String) truncated.getResult()).length());
    }

    @Test
    void shouldShrinkNestedStructures() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("body", "b".repeat(500));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("meta", nested);
        result.put("lines", List.of("l".repeat(500)));

        @SuppressWarnings("unchecked")
        Map<String, Object> truncated = (Map<String, Object>) ToolCallStorageTruncator.truncateValue(result, 300);

        @SuppressWarnings("unchecked")
        Map<String, Object> meta = (Map<String, Object>) truncated.get("meta");
        assertEquals(150, ((String) meta.get("body")).length());
        assertEquals(100, ((String) ((List<?>) truncated.get("lines")).get(0)).length());
    }

    @Test
    void shouldReturnEmptyListForNoCalls() {
        assertTrue(truncator.truncate(null).isEmpty());
    }
}
