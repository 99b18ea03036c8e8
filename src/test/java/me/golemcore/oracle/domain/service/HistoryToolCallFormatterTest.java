package me.golemcore.oracle.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.oracle.domain.model.ToolCallRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HistoryToolCallFormatterTest {

    private static final String RESULT_PREFIX = "  => ";

    private ToolPriorityRegistry registry;
    private HistoryToolCallFormatter formatter;

    @BeforeEach
    void setUp() {
        registry = new ToolPriorityRegistry();
        formatter = new HistoryToolCallFormatter(registry, new ObjectMapper());
    }

    @Test
    void shouldReturnEmptyStringWithoutCalls() {
        assertEquals("", formatter.format(List.of(), 0));
        assertEquals("", formatter.format(null, 3));
    }

    @Test
    void shouldWrapRecentCallsInMarkersWithArgsAndResult() {
        String formatted = formatter.format(List.of(call("read_file", "a.rb", "puts 1")), 0);

        assertTrue(formatted.startsWith(HistoryToolCallFormatter.BEGIN_MARKER + "\n"));
        assertTrue(formatted.endsWith(HistoryToolCallFormatter.END_MARKER));
        assertTrue(formatted.contains("- read_file {\"path\":\"a.rb\"}"));
        assertTrue(formatted.contains("\n  => puts 1"));
    }

    @Test
    void shouldOmitResultsOfOldCrowdedEntries() {
        List<ToolCallRecord> calls = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            calls.add(call("read_file", "f" + i + ".rb", "content " + i));
        }

        String recent = formatter.format(calls, 0);
        String old = formatter.format(calls, 3);

        assertTrue(recent.contains("=> content 0"));
        assertFalse(old.contains("=>"));
        assertTrue(old.contains(HistoryToolCallFormatter.RESULT_OMITTED));
    }

    @Test
    void shouldKeepMoreOfHighPriorityResults() {
        registry.register("edit_file", 10);
        String longResult = "x".repeat(800);

        String low = formatter.format(List.of(call("read_file", "a.rb", longResult)), 1);
        String high = formatter.format(List.of(call("edit_file", "a.rb", longResult)), 1);

        assertTrue(high.length() > low.length());
        assertTrue(high.contains(longResult));
        assertFalse(low.contains(longResult));
    }

    @Test
    void shouldShrinkResultsByFractionalDensity() {
        assertEquals(58, keptResultLength(9));
        assertEquals(87, keptResultLength(6));
        assertEquals(105, keptResultLength(4));
    }

    @Test
    void shouldKeepFloorLimitsForMediumPriority() {
        registry.register("search_code", 2);
        List<ToolCallRecord> records = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            records.add(call("search_code", "f" + i + ".rb", "y".repeat(500)));
        }

        String formatted = formatter.format(records, 4);

        assertEquals(200, resultLine(formatted).length() - RESULT_PREFIX.length());
    }

    private int keptResultLength(int calls) {
        List<ToolCallRecord> records = new ArrayList<>();
        for (int i = 0; i < calls; i++) {
            records.add(call("read_file", "f" + i + ".rb", "x".repeat(500)));
        }
        return resultLine(formatter.format(records, 1)).length() - RESULT_PREFIX.length();
    }

    private static String resultLine(String formatted) {
        for (String line : formatted.split("\n")) {
            if (line.startsWith(RESULT_PREFIX)) {
                return line;
            }
        }
        throw new AssertionError("no result line in " + formatted);
    }

    private static ToolCallRecord call(String tool, String path, Object result) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("path", path);
        return ToolCallRecord.builder()
                .request(ToolCallRecord.Request.builder().tool(tool).args(args).build())
                .result(result)
                .build();
    }
}
