package me.golemcore.oracle.adapter.outbound.llm;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Headers;
import feign.Param;
import feign.Request;
import feign.RequestLine;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.oracle.domain.model.LlmRequest;
import me.golemcore.oracle.domain.model.LlmResponse;
import me.golemcore.oracle.domain.model.Message;
import me.golemcore.oracle.domain.model.ToolDefinition;
import me.golemcore.oracle.domain.model.TransportException;
import me.golemcore.oracle.domain.service.AegisService;
import me.golemcore.oracle.infrastructure.config.OracleProperties;
import me.golemcore.oracle.infrastructure.http.FeignClientFactory;
import me.golemcore.oracle.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Adapter for OpenAI-compatible chat completion endpoints (DeepSeek by
 * default).
 *
 * <p>
 * Reasoning mode switches to the reasoning model, a larger token ceiling and a
 * longer timeout. Tool schemas are omitted for reasoning mode and for any model
 * whose name matches the reasoning pattern, since such models reject them.
 *
 * <p>
 * Every failure leaves this adapter as a classified
 * {@link TransportException}.
 *
 * @see me.golemcore.oracle.infrastructure.http.FeignClientFactory
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatCompletionLlmAdapter implements LlmPort {

    private final OracleProperties properties;
    private final FeignClientFactory feignClientFactory;
    private final AegisService aegisService;
    private final ObjectMapper objectMapper;

    private volatile ChatCompletionApi client;

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ChatCompletionRequest payload = buildRequest(request.getMessages(), request.getTools(),
                    request.isReasoning(), request.getTemperature());
            Duration timeout = request.isReasoning()
                    ? properties.getLlm().getReasoningRequestTimeout()
                    : properties.getLlm().getRequestTimeout();
            return extract(send(payload, timeout));
        });
    }

    @Override
    public boolean isAvailable() {
        OracleProperties.LlmProperties llm = properties.getLlm();
        return llm.getApiUrl() != null && !llm.getApiUrl().isBlank()
                && llm.getApiKey() != null && !llm.getApiKey().isBlank();
    }

    public ChatCompletionRequest buildRequest(List<Message> messages, List<ToolDefinition> tools, boolean reasoning,
            Double temperatureOverride) {
        OracleProperties.LlmProperties llm = properties.getLlm();
        String model = reasoning ? llm.getReasoningModel() : llm.getModel();

        ChatCompletionRequest payload = new ChatCompletionRequest();
        payload.setModel(model);
        payload.setMaxTokens(reasoning ? llm.getReasoningMaxTokens() : llm.getMaxTokens());
        payload.setTemperature(temperatureOverride != null ? temperatureOverride : aegisService.currentTemperature());
        payload.setMessages(messages.stream().map(this::toApiMessage).toList());

        if (!reasoning && !isReasoningModel(model) && tools != null && !tools.isEmpty()) {
            payload.setTools(tools.stream().map(ChatCompletionLlmAdapter::toApiTool).toList());
        }
        return payload;
    }

    public ChatCompletionResponse send(ChatCompletionRequest payload, Duration timeout) {
        long started = System.nanoTime();
        try {
            Request.Options options = new Request.Options(properties.getHttp().getConnectTimeout().toMillis(),
                    TimeUnit.MILLISECONDS, timeout.toMillis(), TimeUnit.MILLISECONDS, true);
            ChatCompletionResponse response = getClient().chatCompletion(properties.getLlm().getApiKey(), options,
                    payload);
            log.debug("[Llm] {} answered in {} ms", payload.getModel(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            return response;
        } catch (RuntimeException e) {
            TransportException failure = TransportErrorClassifier.toTransportException(e);
            log.warn("[Llm] Completion call failed ({}): {}", failure.getKind(), failure.getMessage());
            throw failure;
        }
    }

    public LlmResponse extract(ChatCompletionResponse response) {
        if (response == null || response.getChoices() == null || response.getChoices().isEmpty()) {
            return LlmResponse.builder()
                    .content("")
                    .model(response != null ? response.getModel() : null)
                    .finishReason("error")
                    .build();
        }
        ChatChoice choice = response.getChoices().get(0);
        ResponseMessage message = choice.getMessage();
        if (message == null) {
            return LlmResponse.builder().content("").model(response.getModel())
                    .finishReason(choice.getFinishReason()).build();
        }
        return LlmResponse.builder()
                .content(message.getContent())
                .rawToolCalls(message.getToolCalls() != null ? message.getToolCalls() : new ArrayList<>())
                .reasoningContent(message.getReasoningContent())
                .model(response.getModel())
                .finishReason(choice.getFinishReason())
                .build();
    }

    boolean isReasoningModel(String model) {
        String pattern = properties.getLlm().getReasoningModelPattern();
        return model != null && pattern != null && !pattern.isBlank()
                && model.toLowerCase(Locale.ROOT).contains(pattern.toLowerCase(Locale.ROOT));
    }

    private ChatCompletionApi getClient() {
        ChatCompletionApi current = client;
        if (current == null) {
            synchronized (this) {
                current = client;
                if (current == null) {
                    current = feignClientFactory.create(ChatCompletionApi.class, properties.getLlm().getApiUrl());
                    client = current;
                    log.info("[Llm] Completion client initialized with URL: {}", properties.getLlm().getApiUrl());
                }
            }
        }
        return current;
    }

    private ApiMessage toApiMessage(Message message) {
        ApiMessage apiMessage = new ApiMessage();
        apiMessage.setRole(message.getRole());
        apiMessage.setContent(message.getContent() != null ? message.getContent() : "");
        if (message.hasToolCalls()) {
            apiMessage.setToolCalls(message.getToolCalls().stream().map(this::toApiToolCall).toList());
        }
        apiMessage.setToolCallId(message.getToolCallId());
        return apiMessage;
    }

    private ApiToolCall toApiToolCall(Message.ToolCall toolCall) {
        ApiFunction function = new ApiFunction();
        function.setName(toolCall.getName());
        function.setArguments(toJson(toolCall.getArguments()));
        ApiToolCall apiToolCall = new ApiToolCall();
        apiToolCall.setId(toolCall.getId());
        apiToolCall.setType("function");
        apiToolCall.setFunction(function);
        return apiToolCall;
    }

    private static ApiTool toApiTool(ToolDefinition tool) {
        ApiToolFunction function = new ApiToolFunction();
        function.setName(tool.getName());
        function.setDescription(tool.getDescription());
        function.setParameters(tool.getInputSchema());
        ApiTool apiTool = new ApiTool();
        apiTool.setType("function");
        apiTool.setFunction(function);
        return apiTool;
    }

    private String toJson(Map<String, Object> arguments) {
        if (arguments == null || arguments.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            log.warn("[Llm] Tool arguments are not serializable: {}", e.getOriginalMessage());
            return "{}";
        }
    }

    // Feign API interface
    public interface ChatCompletionApi {
        @RequestLine("POST /chat/completions")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}"
        })
        ChatCompletionResponse chatCompletion(@Param("apiKey") String apiKey, Request.Options options,
                ChatCompletionRequest request);
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        private List<ApiTool> tools;
        private Double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
    }

    @Data
    public static class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
    }

    @Data
    public static class ChatChoice {
        private int index;
        private ResponseMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ApiMessage {
        private String role;
        private String content;
        @JsonProperty("tool_calls")
        private List<ApiToolCall> toolCalls;
        @JsonProperty("tool_call_id")
        private String toolCallId;
    }

    /**
     * Response-side message. Tool calls stay raw maps: providers disagree on
     * their shape and the normalizer sorts that out.
     */
    @Data
    public static class ResponseMessage {
        private String role;
        private String content;
        @JsonProperty("reasoning_content")
        private String reasoningContent;
        @JsonProperty("tool_calls")
        private List<Map<String, Object>> toolCalls;
    }

    @Data
    public static class ApiTool {
        private String type;
        private ApiToolFunction function;
    }

    @Data
    public static class ApiToolFunction {
        private String name;
        private String description;
        private Map<String, Object> parameters;
    }

    @Data
    public static class ApiToolCall {
        private String id;
        private String type;
        private ApiFunction function;
    }

    @Data
    public static class ApiFunction {
        private String name;
        private String arguments;
    }
}
