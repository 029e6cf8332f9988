package com.kiisha.ai.gateway.providers.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kiisha.ai.common.model.ValidationResult;
import com.kiisha.ai.gateway.providers.AiMessage;
import com.kiisha.ai.gateway.providers.CompletionRequest;
import com.kiisha.ai.gateway.providers.CompletionResponse;
import com.kiisha.ai.gateway.providers.FinishReason;
import com.kiisha.ai.gateway.providers.ProviderConfig;
import com.kiisha.ai.gateway.providers.ProviderException;
import com.kiisha.ai.gateway.providers.ProviderId;
import com.kiisha.ai.gateway.providers.ResponseFormat;
import com.kiisha.ai.gateway.providers.ToolChoice;
import com.kiisha.ai.gateway.providers.ToolDefinition;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AnthropicProvider.
 */
class AnthropicProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private AnthropicProvider createProvider(String apiKey) {
        ProviderConfig.Builder builder = ProviderConfig.builder()
                .providerId(ProviderId.ANTHROPIC);
        if (apiKey != null) {
            builder.apiKey(apiKey);
        }
        return new AnthropicProvider(builder.build());
    }

    @Test
    void testGetProviderId() {
        AnthropicProvider provider = createProvider("sk-ant-test");
        assertEquals(ProviderId.ANTHROPIC, provider.getProviderId());
        assertEquals("Anthropic Claude", provider.getDisplayName());
    }

    @Test
    void testIsAvailable_withApiKey() {
        assertTrue(createProvider("sk-ant-test").isAvailable());
    }

    @Test
    void testIsAvailable_withoutApiKey() {
        assertFalse(createProvider(null).isAvailable());
        assertFalse(createProvider("").isAvailable());
    }

    @Test
    void testIsAvailable_withDisabledConfig() {
        ProviderConfig config = ProviderConfig.builder()
                .providerId(ProviderId.ANTHROPIC)
                .apiKey("sk-ant-test")
                .enabled(false)
                .build();
        assertFalse(new AnthropicProvider(config).isAvailable());
    }

    @Test
    void testGetAvailableModels_defaultModelFirst() {
        ProviderConfig config = ProviderConfig.builder()
                .providerId(ProviderId.ANTHROPIC)
                .apiKey("sk-ant-test")
                .defaultModel("claude-3-haiku-20240307")
                .build();
        List<String> models = new AnthropicProvider(config).getAvailableModels();

        assertEquals("claude-3-haiku-20240307", models.get(0));
        assertEquals(AnthropicProvider.DEFAULT_MODELS.size(), models.size());
    }

    @Test
    void testComplete_unavailableThrows() {
        AnthropicProvider provider = createProvider(null);
        CompletionRequest request = CompletionRequest.builder()
                .addMessage(AiMessage.user("hi"))
                .build();

        ProviderException e = assertThrows(ProviderException.class, () -> provider.complete(request));
        assertEquals(ProviderId.ANTHROPIC, e.getProviderId());
        assertFalse(e.isRetryable());
    }

    // ========== Validation ==========

    @Test
    void testValidateConfig_missingApiKey() {
        ProviderConfig config = ProviderConfig.builder().providerId(ProviderId.ANTHROPIC).build();
        ValidationResult result = createProvider(null).validateConfig(config);

        assertFalse(result.isValid());
        assertTrue(result.getErrors().stream().anyMatch(e -> "apiKey".equals(e.getField())));
    }

    @Test
    void testValidateConfig_unexpectedKeyPrefixIsWarning() {
        ProviderConfig config = ProviderConfig.builder()
                .providerId(ProviderId.ANTHROPIC)
                .apiKey("sk-other")
                .build();
        ValidationResult result = createProvider("sk-ant-test").validateConfig(config);

        assertTrue(result.isValid());
        assertTrue(result.getWarnings().stream().anyMatch(w -> w.contains("sk-ant-")));
    }

    // ========== Request translation ==========

    @Test
    void testBuildRequestBody_liftsSystemMessages() throws Exception {
        CompletionRequest request = CompletionRequest.builder()
                .messages(Arrays.asList(
                        AiMessage.system("Be precise."),
                        AiMessage.user("What is a PPA?"),
                        AiMessage.assistant("A power purchase agreement."),
                        AiMessage.user("Thanks")))
                .model("claude-3-5-sonnet-20241022")
                .maxTokens(300)
                .build();

        JsonNode body = mapper.readTree(createProvider("sk-ant-test").buildRequestBody(request));

        assertEquals("claude-3-5-sonnet-20241022", body.path("model").asText());
        assertEquals(300, body.path("max_tokens").asInt());
        assertEquals("Be precise.", body.path("system").asText());
        assertEquals(3, body.path("messages").size());
        assertEquals("user", body.path("messages").get(0).path("role").asText());
        assertEquals("assistant", body.path("messages").get(1).path("role").asText());
    }

    @Test
    void testBuildRequestBody_toolChoiceMapping() throws Exception {
        ToolDefinition tool = ToolDefinition.builder()
                .name("classify")
                .description("Classify the document")
                .parameters(Collections.singletonMap("type", "object"))
                .build();
        AnthropicProvider provider = createProvider("sk-ant-test");

        CompletionRequest required = CompletionRequest.builder()
                .addMessage(AiMessage.user("doc"))
                .tools(List.of(tool))
                .toolChoice(ToolChoice.required())
                .build();
        JsonNode body = mapper.readTree(provider.buildRequestBody(required));
        assertEquals("any", body.path("tool_choice").path("type").asText());
        assertEquals("classify", body.path("tools").get(0).path("name").asText());
        assertEquals("object", body.path("tools").get(0).path("input_schema").path("type").asText());

        CompletionRequest forced = required.toBuilder().toolChoice(ToolChoice.function("classify")).build();
        body = mapper.readTree(provider.buildRequestBody(forced));
        assertEquals("tool", body.path("tool_choice").path("type").asText());
        assertEquals("classify", body.path("tool_choice").path("name").asText());

        CompletionRequest none = required.toBuilder().toolChoice(ToolChoice.none()).build();
        body = mapper.readTree(provider.buildRequestBody(none));
        assertTrue(body.path("tools").isMissingNode());
        assertTrue(body.path("tool_choice").isMissingNode());
    }

    @Test
    void testBuildRequestBody_responseFormatAddsSchemaInstruction() throws Exception {
        CompletionRequest request = CompletionRequest.builder()
                .addMessage(AiMessage.user("extract"))
                .responseFormat(ResponseFormat.jsonSchema("fields", true,
                        Collections.singletonMap("type", "object")))
                .build();

        JsonNode body = mapper.readTree(createProvider("sk-ant-test").buildRequestBody(request));

        assertTrue(body.path("system").asText().contains("fields"));
        assertTrue(body.path("system").asText().contains("\"type\":\"object\""));
    }

    // ========== Response translation ==========

    @Test
    void testParseResponse_textAndToolUse() throws Exception {
        String json = "{\"model\":\"claude-3-5-sonnet-20241022\",\"stop_reason\":\"tool_use\"," +
                "\"content\":[{\"type\":\"text\",\"text\":\"Checking.\"}," +
                "{\"type\":\"tool_use\",\"id\":\"tu_1\",\"name\":\"lookup\",\"input\":{\"site\":\"A\"}}]," +
                "\"usage\":{\"input_tokens\":12,\"output_tokens\":8}}";

        CompletionResponse response = createProvider("sk-ant-test").parseResponse(json);

        assertEquals("Checking.", response.getContent());
        assertEquals(FinishReason.TOOL_CALLS, response.getFinishReason());
        assertEquals(1, response.getToolCalls().size());
        assertEquals("lookup", response.getToolCalls().get(0).getName());
        assertEquals("A", response.getToolCalls().get(0).getArgumentsAsJson().path("site").asText());
        assertEquals(20, response.getUsage().getTotalTokens());
        assertEquals("claude-3-5-sonnet-20241022", response.getModel());
    }

    @Test
    void testParseResponse_stopReasonMapping() throws Exception {
        AnthropicProvider provider = createProvider("sk-ant-test");
        assertEquals(FinishReason.STOP, provider.parseResponse(
                "{\"stop_reason\":\"end_turn\",\"content\":[]}").getFinishReason());
        assertEquals(FinishReason.LENGTH, provider.parseResponse(
                "{\"stop_reason\":\"max_tokens\",\"content\":[]}").getFinishReason());
    }

    @Test
    void testParseResponse_malformedJson() {
        ProviderException e = assertThrows(ProviderException.class,
                () -> createProvider("sk-ant-test").parseResponse("not json"));
        assertEquals(ProviderId.ANTHROPIC, e.getProviderId());
    }
}
