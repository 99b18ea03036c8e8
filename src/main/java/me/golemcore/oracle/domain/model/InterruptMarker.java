package me.golemcore.oracle.domain.model;

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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Control signal a tool result can carry to hand control back to the task
 * engine, e.g. {@code step_completed} or {@code step_rejected}.
 */
public record InterruptMarker(String kind, String reason, Object result, Integer restartFromStep,
        Map<String, Object> raw) {

    public static final String MARKER_KEY = "__divine_interrupt";
    public static final String INTERRUPT_KIND_KEY = "interrupt_kind";
    public static final String STEP_COMPLETED = "step_completed";
    public static final String STEP_REJECTED = "step_rejected";

    public InterruptMarker {
        raw = raw != null ? Map.copyOf(withoutNulls(raw)) : Map.of();
    }

    public static InterruptMarker stepCompleted(Object result) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put(MARKER_KEY, STEP_COMPLETED);
        raw.put("result", result);
        return new InterruptMarker(STEP_COMPLETED, null, result, null, raw);
    }

    public static InterruptMarker stepRejected(String reason, Integer restartFromStep) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put(MARKER_KEY, STEP_REJECTED);
        raw.put("reason", reason);
        raw.put("restart_from_step", restartFromStep);
        return new InterruptMarker(STEP_REJECTED, reason, null, restartFromStep, raw);
    }

    /**
     * Inspects a tool result for a marker key. Anything that is not a map, or a
     * map without the key, is an ordinary result.
     */
    public static Optional<InterruptMarker> detect(Object toolResult) {
        if (!(toolResult instanceof Map<?, ?> map)) {
            return Optional.empty();
        }
        Object kind = map.get(MARKER_KEY);
        if (kind == null) {
            kind = map.get(INTERRUPT_KIND_KEY);
        }
        if (kind == null) {
            return Optional.empty();
        }
        Map<String, Object> raw = new LinkedHashMap<>();
        map.forEach((key, value) -> raw.put(String.valueOf(key), value));
        Object reason = map.get("reason");
        return Optional.of(new InterruptMarker(
                String.valueOf(kind),
                reason != null ? String.valueOf(reason) : null,
                map.get("result"),
                toInteger(map.get("restart_from_step")),
                raw));
    }

    public boolean isStepCompleted() {
        return STEP_COMPLETED.equals(kind);
    }

    public boolean isStepRejected() {
        return STEP_REJECTED.equals(kind);
    }

    private static Integer toInteger(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return copy;
    }
}
