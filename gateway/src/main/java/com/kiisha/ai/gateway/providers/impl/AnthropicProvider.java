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
 * Adapter for Anthropic's Messages API.
 */
public class AnthropicProvider implements AiProvider {

    private static final Logger logger = LoggerFactory.getLogger(AnthropicProvider.class);

    private static final String DEFAULT_API_BASE = "https://api.anthropic.com/v1";
    private static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final int DEFAULT_MAX_TOKENS = 4096;
    private static final int CONNECT_TIMEOUT_SECONDS = 30;
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(120);

    static final List<String> DEFAULT_MODELS = List.of(
            "claude-3-5-sonnet-20241022",
            "claude-3-5-haiku-20241022",
            "claude-3-opus-20240229",
            "claude-3-sonnet-20240229",
            "claude-3-haiku-20240307");

    private final ProviderConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public AnthropicProvider(ProviderConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(CONNECT_TIMEOUT_SECONDS))
                .build();
        this.objectMapper = new ObjectMapper();

        logger.info("AnthropicProvider initialized (models: {})", getAvailableModels().size());
    }

    @Override
    public ProviderId getProviderId() {
        return ProviderId.ANTHROPIC;
    }

    @Override
    public boolean isAvailable() {
        return config.isEnabled() && config.hasApiKey();
    }

    @Override
    public List<String> getAvailableModels() {
        if (!config.getModels().isEmpty()) {
            return config.getModels();
        }
        if (config.getDefaultModel() != null) {
            List<String> models = new ArrayList<>();
            models.add(config.getDefaultModel());
            for (String model : DEFAULT_MODELS) {
                if (!model.equals(config.getDefaultModel())) {
                    models.add(model);
                }
            }
            return models;
        }
        return DEFAULT_MODELS;
    }

    @Override
    public CompletionResponse complete(CompletionRequest request) throws ProviderException {
        if (!isAvailable()) {
            throw ProviderException.unauthorized(ProviderId.ANTHROPIC,
                    "Anthropic provider is not available - check API key configuration");
        }

        String requestBody = buildRequestBody(request);

        logger.debug("Sending request to Anthropic API: {} messages, {} tools",
                request.getMessages().size(),
                request.hasTools() ? request.getTools().size() : 0);

        String apiBase = config.getApiBaseUrl() != null ? config.getApiBaseUrl() : DEFAULT_API_BASE;

        HttpRequest.Builder httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(apiBase + "/messages"))
                .header("Content-Type", "application/json")
                .header("x-api-key", config.getApiKey())
                .header("anthropic-version", ANTHROPIC_VERSION)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .timeout(resolveTimeout(request));
        config.getCustomHeaders().forEach(httpRequest::header);

        try {
            HttpResponse<String> response = httpClient.send(
                    httpRequest.build(), HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw handleErrorResponse(response.statusCode(), response.body());
            }

            CompletionResponse completion = parseResponse(response.body());

            logger.debug("Received Anthropic response: {} tokens, finish_reason={}",
                    completion.getUsage().getTotalTokens(), completion.getFinishReason());

            return completion;

        } catch (HttpTimeoutException e) {
            throw ProviderException.timeout(ProviderId.ANTHROPIC, e);
        } catch (IOException e) {
            throw new ProviderException(ProviderId.ANTHROPIC,
                    "Failed to communicate with Anthropic API", -1, true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderId.ANTHROPIC,
                    "Request to Anthropic API was interrupted", -1, false, e);
        }
    }

    @Override
    public ValidationResult validateConfig(ProviderConfig config) {
        ValidationResult.Builder result = ValidationResult.builder();

        if (!config.hasApiKey()) {
            result.addError("apiKey", "API key is required");
        } else if (!config.getApiKey().startsWith("sk-ant-")) {
            result.addWarning("apiKey", "API key should start with 'sk-ant-'");
        }
        if (config.getApiBaseUrl() != null && !config.getApiBaseUrl().startsWith("http")) {
            result.addError("apiBaseUrl", "Base URL must be an http(s) URL");
        }

        return result.build();
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

    /**
     * Builds the Messages API body. System messages are lifted into the top-level
     * "system" field; tool results become user messages.
     */
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

            StringBuilder system = new StringBuilder();
            ArrayNode messages = body.putArray("messages");
            for (AiMessage message : request.getMessages()) {
                if (message.isSystem()) {
                    if (system.length() > 0) {
                        system.append('\n');
                    }
                    system.append(message.getContent());
                } else {
                    messages.add(convertMessage(message));
                }
            }

            if (request.getResponseFormat() != null) {
                if (system.length() > 0) {
                    system.append("\n\n");
                }
                system.append("Respond only with JSON matching this schema (")
                        .append(request.getResponseFormat().getName())
                        .append("): ")
                        .append(objectMapper.writeValueAsString(request.getResponseFormat().getSchema()));
            }
            if (system.length() > 0) {
                body.put("system", system.toString());
            }

            ToolChoice toolChoice = request.getToolChoice();
            boolean toolsDisabled = toolChoice != null && toolChoice.getMode() == ToolChoice.Mode.NONE;
            if (request.hasTools() && !toolsDisabled) {
                ArrayNode tools = body.putArray("tools");
                for (ToolDefinition tool : request.getTools()) {
                    tools.add(convertTool(tool));
                }
                if (toolChoice != null) {
                    ObjectNode choice = body.putObject("tool_choice");
                    switch (toolChoice.getMode()) {
                        case REQUIRED:
                            choice.put("type", "any");
                            break;
                        case FUNCTION:
                            choice.put("type", "tool");
                            choice.put("name", toolChoice.getFunctionName());
                            break;
                        default:
                            choice.put("type", "auto");
                            break;
                    }
                }
            }

            return objectMapper.writeValueAsString(body);

        } catch (IOException e) {
            throw new ProviderException(ProviderId.ANTHROPIC, "Failed to build Anthropic API request",
                    -1, false, e);
        }
    }

    private ObjectNode convertMessage(AiMessage message) {
        ObjectNode msg = objectMapper.createObjectNode();

        if (message.getRole() == AiMessage.MessageRole.TOOL) {
            msg.put("role", "user");
            ArrayNode content = msg.putArray("content");
            ObjectNode toolResult = content.addObject();
            toolResult.put("type", "tool_result");
            toolResult.put("tool_use_id", message.getToolCallId());
            toolResult.put("content", message.getContent());

        } else if (message.hasToolCalls()) {
            msg.put("role", "assistant");
            ArrayNode content = msg.putArray("content");
            if (message.getContent() != null && !message.getContent().isEmpty()) {
                ObjectNode textBlock = content.addObject();
                textBlock.put("type", "text");
                textBlock.put("text", message.getContent());
            }
            for (ToolCall toolCall : message.getToolCalls()) {
                ObjectNode toolUse = content.addObject();
                toolUse.put("type", "tool_use");
                toolUse.put("id", toolCall.getId());
                toolUse.put("name", toolCall.getName());
                toolUse.set("input", toolCall.getArgumentsAsJson());
            }

        } else {
            msg.put("role", message.getRole() == AiMessage.MessageRole.ASSISTANT ? "assistant" : "user");
            msg.put("content", message.getContent());
        }

        return msg;
    }

    private ObjectNode convertTool(ToolDefinition tool) {
        ObjectNode toolNode = objectMapper.createObjectNode();
        toolNode.put("name", tool.getName());
        toolNode.put("description", tool.getDescription());

        if (tool.getParameters() != null) {
            toolNode.set("input_schema", objectMapper.valueToTree(tool.getParameters()));
        } else {
            ObjectNode schema = toolNode.putObject("input_schema");
            schema.put("type", "object");
            schema.putObject("properties");
        }

        return toolNode;
    }

    CompletionResponse parseResponse(String responseBody) throws ProviderException {
        try {
            JsonNode root = objectMapper.readTree(responseBody);

            StringBuilder text = new StringBuilder();
            List<ToolCall> toolCalls = new ArrayList<>();
            for (JsonNode block : root.path("content")) {
                String type = block.path("type").asText();
                if ("text".equals(type)) {
                    text.append(block.path("text").asText());
                } else if ("tool_use".equals(type)) {
                    toolCalls.add(ToolCall.builder()
                            .id(block.path("id").asText())
                            .name(block.path("name").asText())
                            .arguments(block.path("input").toString())
                            .build());
                }
            }

            JsonNode usage = root.path("usage");
            return CompletionResponse.builder()
                    .content(text.length() > 0 ? text.toString() : null)
                    .toolCalls(toolCalls)
                    .finishReason(FinishReason.fromVendor(root.path("stop_reason").asText(null)))
                    .usage(TokenUsage.of(usage.path("input_tokens").asInt(),
                            usage.path("output_tokens").asInt()))
                    .model(root.path("model").asText(null))
                    .build();

        } catch (IOException e) {
            throw new ProviderException(ProviderId.ANTHROPIC, "Failed to parse Anthropic API response",
                    -1, false, e);
        }
    }

    private ProviderException handleErrorResponse(int statusCode, String responseBody) {
        String message;
        try {
            message = objectMapper.readTree(responseBody).path("error").path("message").asText("Unknown error");
        } catch (IOException e) {
            message = responseBody;
        }
        return ProviderException.fromStatus(ProviderId.ANTHROPIC, statusCode,
                "Anthropic API error (" + statusCode + "): " + message);
    }
}
