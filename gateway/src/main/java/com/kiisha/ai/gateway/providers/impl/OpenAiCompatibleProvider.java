package com.kiisha.ai.gateway.providers.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kiisha.ai.common.model.ValidationResult;
import com.kiisha.ai.gateway.providers.AiMessage;
import com.kiisha.ai.gateway.providers.AiProvider;
import com.kiisha.ai.gateway.providers.CompletionRequest;
import com.kiisha.ai.gateway.providers.CompletionResponse;
import com.kiisha.ai.gateway.providers.FinishReason;
import com.kiisha.ai.gateway.providers.ProviderConfig;
import com.kiisha.ai.gateway.providers.ProviderException;
import com.kiisha.ai.gateway.providers.ProviderId;
import com.kiisha.ai.gateway.providers.ResponseFormat;
import com.kiisha.ai.gateway.providers.TokenUsage;
import com.kiisha.ai.gateway.providers.ToolCall;
import com.kiisha.ai.gateway.providers.ToolChoice;
import com.kiisha.ai.gateway.providers.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Adapter for chat-completions endpoints that speak the OpenAI wire format.
 * Serves OpenAI itself plus Forge, Azure OpenAI, Gemini and DeepSeek through
 * their OpenAI-compatible endpoints.
 */
public class OpenAiCompatibleProvider implements AiProvider {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiCompatibleProvider.class);

    private static final int DEFAULT_MAX_TOKENS = 4096;
    private static final int CONNECT_TIMEOUT_SECONDS = 30;
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(120);

    private final ProviderConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OpenAiCompatibleProvider(ProviderConfig config) {
        if (config.getProviderId() == ProviderId.ANTHROPIC) {
            throw new IllegalArgumentException("Anthropic does not speak the chat-completions format");
        }
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(CONNECT_TIMEOUT_SECONDS))
                .build();
        this.objectMapper = new ObjectMapper();

        logger.info("OpenAiCompatibleProvider initialized for {} (base: {})",
                config.getProviderId(), getApiBase());
    }

    @Override
    public ProviderId getProviderId() {
        return config.getProviderId();
    }

    @Override
    public boolean isAvailable() {
        return config.isEnabled() && config.hasApiKey() && getApiBase() != null;
    }

    @Override
    public List<String> getAvailableModels() {
        if (!config.getModels().isEmpty()) {
            return config.getModels();
        }
        List<String> defaults = defaultModels(config.getProviderId());
        if (config.getDefaultModel() == null) {
            return defaults;
        }
        List<String> models = new ArrayList<>();
        models.add(config.getDefaultModel());
        for (String model : defaults) {
            if (!model.equals(config.getDefaultModel())) {
                models.add(model);
            }
        }
        return models;
    }

    @Override
    public CompletionResponse complete(CompletionRequest request) throws ProviderException {
        if (!isAvailable()) {
            throw ProviderException.unauthorized(getProviderId(),
                    getDisplayName() + " provider is not available - check API key configuration");
        }

        String requestBody = buildRequestBody(request);

        logger.debug("Sending request to {}: {} messages, {} tools",
                getProviderId(), request.getMessages().size(),
                request.hasTools() ? request.getTools().size() : 0);

        HttpRequest.Builder httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(getApiBase() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .timeout(resolveTimeout(request));
        if (getProviderId() == ProviderId.AZURE_OPENAI) {
            httpRequest.header("api-key", config.getApiKey());
        } else {
            httpRequest.header("Authorization", "Bearer " + config.getApiKey());
        }
        config.getCustomHeaders().forEach(httpRequest::header);

        try {
            HttpResponse<String> response = httpClient.send(
                    httpRequest.build(), HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw handleErrorResponse(response.statusCode(), response.body());
            }

            CompletionResponse completion = parseResponse(response.body());

            logger.debug("Received {} response: {} tokens, finish_reason={}",
                    getProviderId(), completion.getUsage().getTotalTokens(), completion.getFinishReason());

            return completion;

        } catch (HttpTimeoutException e) {
            throw ProviderException.timeout(getProviderId(), e);
        } catch (IOException e) {
            throw new ProviderException(getProviderId(),
                    "Failed to communicate with " + getDisplayName(), -1, true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(getProviderId(),
                    "Request to " + getDisplayName() + " was interrupted", -1, false, e);
        }
    }

    @Override
    public ValidationResult validateConfig(ProviderConfig config) {
        ValidationResult.Builder result = ValidationResult.builder();

        if (!config.hasApiKey()) {
            result.addError("apiKey", "API key is required");
        }
        String base = config.getApiBaseUrl() != null ?
                config.getApiBaseUrl() : defaultApiBase(config.getProviderId());
        if (base == null) {
            result.addError("apiBaseUrl", "Base URL is required for " + config.getProviderId());
        } else if (!base.startsWith("http")) {
            result.addError("apiBaseUrl", "Base URL must be an http(s) URL");
        }
        if (config.getTemperature() != null &&
                (config.getTemperature() < 0.0 || config.getTemperature() > 2.0)) {
            result.addWarning("temperature", "Temperature outside 0.0-2.0 will be rejected by the API");
        }

        return result.build();
    }

    String getApiBase() {
        return config.getApiBaseUrl() != null ? config.getApiBaseUrl() : defaultApiBase(config.getProviderId());
    }

    static String defaultApiBase(ProviderId providerId) {
        switch (providerId) {
            case OPENAI:
                return "https://api.openai.com/v1";
            case DEEPSEEK:
                return "https://api.deepseek.com/v1";
            case GEMINI:
                return "https://generativelanguage.googleapis.com/v1beta/openai";
            default:
                // forge and azure deployments have no public default endpoint
                return null;
        }
    }

    static List<String> defaultModels(ProviderId providerId) {
        switch (providerId) {
            case OPENAI:
            case AZURE_OPENAI:
                return List.of("gpt-4o", "gpt-4o-mini", "gpt-4-turbo");
            case FORGE:
                return List.of("forge-default", "forge-fast");
            case GEMINI:
                return List.of("gemini-1.5-pro", "gemini-1.5-flash");
            case DEEPSEEK:
                return List.of("deepseek-chat", "deepseek-reasoner");
            default:
                return List.of();
        }
    }

    /**
     * The configured timeout, shortened to the request's own deadline when it has one.
     */
    private Duration resolveTimeout(CompletionRequest request) {
        Duration configured = config.getTimeout() != null ? config.getTimeout() : DEFAULT_REQUEST_TIMEOUT;
        if (request.getTimeout() != null && request.getTimeout().compareTo(configured) < 0) {
            return request.getTimeout();
        }
        return configured;
    }

    String buildRequestBody(CompletionRequest request) throws ProviderException {
        try {
            ObjectNode body = objectMapper.createObjectNode();

            String model = request.getModel() != null ? request.getModel() : getAvailableModels().get(0);
            body.put("model", model);

            int maxTokens = request.getMaxTokens() != null ? request.getMaxTokens() :
                    (config.getMaxTokens() != null ? config.getMaxTokens() : DEFAULT_MAX_TOKENS);
            body.put("max_tokens", maxTokens);

            Double temperature = request.getTemperature() != null ? request.getTemperature() :
                    config.getTemperature();
            if (temperature != null) {
                body.put("temperature", temperature);
            }

            ArrayNode messages = body.putArray("messages");
            for (AiMessage message : request.getMessages()) {
                messages.add(convertMessage(message));
            }

            if (request.hasTools()) {
                ArrayNode tools = body.putArray("tools");
                for (ToolDefinition tool : request.getTools()) {
                    tools.add(convertTool(tool));
                }
                ToolChoice toolChoice = request.getToolChoice() != null ?
                        request.getToolChoice() : ToolChoice.auto();
                if (toolChoice.getMode() == ToolChoice.Mode.FUNCTION) {
                    ObjectNode choice = body.putObject("tool_choice");
                    choice.put("type", "function");
                    choice.putObject("function").put("name", toolChoice.getFunctionName());
                } else {
                    body.put("tool_choice", toolChoice.toString());
                }
            }

            ResponseFormat format = request.getResponseFormat();
            if (format != null) {
                ObjectNode responseFormat = body.putObject("response_format");
                responseFormat.put("type", format.getType());
                ObjectNode jsonSchema = responseFormat.putObject("json_schema");
                jsonSchema.put("name", format.getName());
                jsonSchema.put("strict", format.isStrict());
                jsonSchema.set("schema", objectMapper.valueToTree(format.getSchema()));
            }

            return objectMapper.writeValueAsString(body);

        } catch (IOException e) {
            throw new ProviderException(getProviderId(), "Failed to build chat-completions request",
                    -1, false, e);
        }
    }

    private ObjectNode convertMessage(AiMessage message) {
        ObjectNode msg = objectMapper.createObjectNode();

        switch (message.getRole()) {
            case SYSTEM:
                msg.put("role", "system");
                msg.put("content", message.getContent());
                break;

            case USER:
                msg.put("role", "user");
                msg.put("content", message.getContent());
                break;

            case ASSISTANT:
                msg.put("role", "assistant");
                if (message.getContent() != null && !message.getContent().isEmpty()) {
                    msg.put("content", message.getContent());
                }
                if (message.hasToolCalls()) {
                    ArrayNode toolCalls = msg.putArray("tool_calls");
                    for (ToolCall tc : message.getToolCalls()) {
                        ObjectNode tcNode = toolCalls.addObject();
                        tcNode.put("id", tc.getId());
                        tcNode.put("type", "function");
                        ObjectNode function = tcNode.putObject("function");
                        function.put("name", tc.getName());
                        function.put("arguments", tc.getArguments());
                    }
                }
                break;

            case TOOL:
                msg.put("role", "tool");
                msg.put("tool_call_id", message.getToolCallId());
                msg.put("content", message.getContent());
                break;

            default:
                throw new IllegalArgumentException("Unsupported role: " + message.getRole());
        }
        if (message.getName() != null) {
            msg.put("name", message.getName());
        }

        return msg;
    }

    private ObjectNode convertTool(ToolDefinition tool) {
        ObjectNode toolNode = objectMapper.createObjectNode();
        toolNode.put("type", "function");

        ObjectNode function = toolNode.putObject("function");
        function.put("name", tool.getName());
        function.put("description", tool.getDescription());

        if (tool.getParameters() != null) {
            function.set("parameters", objectMapper.valueToTree(tool.getParameters()));
        } else {
            ObjectNode schema = function.putObject("parameters");
            schema.put("type", "object");
            schema.putObject("properties");
        }

        return toolNode;
    }

    CompletionResponse parseResponse(String responseBody) throws ProviderException {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (IOException e) {
            throw new ProviderException(getProviderId(), "Failed to parse chat-completions response",
                    -1, false, e);
        }

        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new ProviderException(getProviderId(), "Invalid response: no choices", -1, true);
        }

        JsonNode choice = choices.get(0);
        JsonNode message = choice.path("message");

        List<ToolCall> calls = new ArrayList<>();
        for (JsonNode tc : message.path("tool_calls")) {
            calls.add(ToolCall.builder()
                    .id(tc.path("id").asText())
                    .name(tc.path("function").path("name").asText())
                    .arguments(tc.path("function").path("arguments").asText())
                    .build());
        }

        JsonNode usage = root.path("usage");
        JsonNode content = message.path("content");
        return CompletionResponse.builder()
                .content(content.isTextual() ? content.asText() : null)
                .toolCalls(calls)
                .finishReason(FinishReason.fromVendor(choice.path("finish_reason").asText(null)))
                .usage(TokenUsage.of(usage.path("prompt_tokens").asInt(),
                        usage.path("completion_tokens").asInt(),
                        usage.path("total_tokens").asInt()))
                .model(root.path("model").asText(null))
                .build();
    }

    private ProviderException handleErrorResponse(int statusCode, String responseBody) {
        String message;
        try {
            message = objectMapper.readTree(responseBody).path("error").path("message").asText("Unknown error");
        } catch (IOException e) {
            message = responseBody;
        }
        return ProviderException.fromStatus(getProviderId(), statusCode,
                getDisplayName() + " API error (" + statusCode + "): " + message);
    }
}
