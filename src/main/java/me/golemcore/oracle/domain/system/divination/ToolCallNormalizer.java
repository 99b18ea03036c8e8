package me.golemcore.oracle.domain.system.divination;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.oracle.domain.model.Message;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns every tool-call dialect the model may produce into
 * {@link Message.ToolCall}. Accepted shapes: OpenAI style (name and JSON-string
 * arguments under {@code function}), flat objects, and aliased field names.
 */
@Slf4j
public class ToolCallNormalizer {

    /** Alias field name to canonical field name. */
    static final Map<String, String> FIELD_ALIASES = Map.of(
            "toolcalls", "tool_calls",
            "tools", "tool_calls",
            "tool_name", "name",
            "toolname", "name",
            "args", "arguments",
            "params", "arguments",
            "parameters", "arguments");

    static final String TOOL_CALLS = "tool_calls";
    static final String NAME = "name";
    static final String ARGUMENTS = "arguments";
    static final String FUNCTION = "function";

    private static final Pattern JSON_BLOCK = Pattern.compile("^\\s*```json\\s*\\n(.*?)^\\s*```",
            Pattern.MULTILINE | Pattern.DOTALL);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ToolCallNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String extractName(Map<String, Object> call) {
        Map<String, Object> normalized = normalizeKeys(call);
        Object name = null;
        if (normalized.get(FUNCTION) instanceof Map<?, ?> function) {
            name = normalizeKeys(function).get(NAME);
        }
        if (name == null) {
            name = normalized.get(NAME);
        }
        return name != null ? String.valueOf(name) : null;
    }

    public Map<String, Object> extractArguments(Map<String, Object> call) {
        Map<String, Object> normalized = normalizeKeys(call);
        Object arguments = null;
        if (normalized.get(FUNCTION) instanceof Map<?, ?> function) {
            arguments = normalizeKeys(function).get(ARGUMENTS);
        }
        if (arguments == null) {
            arguments = normalized.get(ARGUMENTS);
        }
        return parseArguments(arguments);
    }

    /**
     * Normalizes one raw call. A missing id is replaced by a random one.
     */
    public Message.ToolCall normalize(Map<String, Object> call) {
        String name = extractName(call);
        Object id = call.get("id");
        return Message.ToolCall.builder()
                .id(id != null && !String.valueOf(id).isBlank() ? String.valueOf(id) : UUID.randomUUID().toString())
                .name(name)
                .arguments(unwrapLegacyArguments(name, extractArguments(call)))
                .build();
    }

    /**
     * Normalizes the structured tool calls of a response, dropping entries
     * without a tool name.
     */
    public List<Message.ToolCall> normalizeAll(List<Map<String, Object>> rawCalls) {
        List<Message.ToolCall> calls = new ArrayList<>();
        if (rawCalls == null) {
            return calls;
        }
        for (Map<String, Object> raw : rawCalls) {
            if (raw == null) {
                continue;
            }
            Message.ToolCall call = normalize(raw);
            if (call.getName() == null || call.getName().isBlank()) {
                log.warn("[Tools] Ignoring tool call without a name: {}", raw.keySet());
                continue;
            }
            calls.add(call);
        }
        return calls;
    }

    /**
     * Fallback path: finds tool calls inside {@code ```json} blocks of free
     * text. Every block is considered, in document order; a block may hold a
     * single call, a list of calls, or an object with a {@code tool_calls}
     * list.
     */
    public List<Message.ToolCall> extractFromContent(String text) {
        List<Message.ToolCall> calls = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return calls;
        }
        Matcher matcher = JSON_BLOCK.matcher(text);
        while (matcher.find()) {
            String block = matcher.group(1).trim();
            if (block.isEmpty()) {
                continue;
            }
            try {
                collectCalls(objectMapper.readValue(block, Object.class), calls);
            } catch (JsonProcessingException e) {
                log.debug("[Tools] Skipping unparseable json block: {}", e.getOriginalMessage());
            }
        }
        return calls;
    }

    private void collectCalls(Object parsed, List<Message.ToolCall> calls) {
        if (parsed instanceof List<?> list) {
            for (Object element : list) {
                if (element instanceof Map<?, ?>) {
                    collectCalls(element, calls);
                }
            }
            return;
        }
        if (!(parsed instanceof Map<?, ?> map)) {
            return;
        }
        Map<String, Object> normalized = normalizeKeys(map);
        if (normalized.get(TOOL_CALLS) instanceof List<?> nested) {
            collectCalls(nested, calls);
            return;
        }
        if (normalized.containsKey(NAME) || normalized.containsKey(FUNCTION)) {
            Message.ToolCall call = normalize(normalized);
            if (call.getName() != null && !call.getName().isBlank()) {
                calls.add(call);
            }
        }
    }

    /**
     * Renames aliased keys to their canonical names. A canonical key already
     * present wins over its aliases.
     */
    static Map<String, Object> normalizeKeys(Map<?, ?> raw) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (raw == null) {
            return normalized;
        }
        raw.forEach((key, value) -> {
            String name = String.valueOf(key);
            if (!FIELD_ALIASES.containsKey(name)) {
                normalized.put(name, value);
            }
        });
        raw.forEach((key, value) -> {
            String canonical = FIELD_ALIASES.get(String.valueOf(key));
            if (canonical != null) {
                normalized.putIfAbsent(canonical, value);
            }
        });
        return normalized;
    }

    private Map<String, Object> parseArguments(Object arguments) {
        if (arguments == null) {
            return new LinkedHashMap<>();
        }
        if (arguments instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, value) -> copy.put(String.valueOf(key), value));
            return copy;
        }
        if (arguments instanceof String text) {
            if (text.isBlank()) {
                return new LinkedHashMap<>();
            }
            try {
                return new LinkedHashMap<>(objectMapper.readValue(text, MAP_TYPE));
            } catch (JsonProcessingException e) {
                log.warn("[Tools] Tool arguments are not a JSON object: {}", e.getOriginalMessage());
                Map<String, Object> raw = new LinkedHashMap<>();
                raw.put("_raw", text);
                return raw;
            }
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("value", arguments);
        return wrapped;
    }

    /**
     * Older prompts made the model wrap arguments as {@code {name, args}}.
     */
    private static Map<String, Object> unwrapLegacyArguments(String name, Map<String, Object> arguments) {
        if (arguments.size() == 2 && name != null && name.equals(arguments.get(NAME))) {
            Object inner = arguments.containsKey("args") ? arguments.get("args") : arguments.get(ARGUMENTS);
            if (inner instanceof Map<?, ?> map) {
                Map<String, Object> unwrapped = new LinkedHashMap<>();
                map.forEach((key, value) -> unwrapped.put(String.valueOf(key), value));
                return unwrapped;
            }
        }
        return arguments;
    }
}
