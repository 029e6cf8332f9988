package com.kiisha.ai.gateway;

import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.common.model.Channel;
import com.kiisha.ai.gateway.providers.AiMessage;
import com.kiisha.ai.gateway.providers.ResponseFormat;
import com.kiisha.ai.gateway.providers.ToolChoice;
import com.kiisha.ai.gateway.providers.ToolDefinition;

import java.util.List;
import java.util.Map;

/**
 * Shortcuts for the calls the platform makes most often. Each one builds a
 * {@link GatewayRequest} and hands it to {@link AiGateway#runTask}.
 */
public class GatewayTasks {

    static final String EXTRACTED_FIELDS_SCHEMA_NAME = "extracted_fields";

    private final AiGateway gateway;

    public GatewayTasks(AiGateway gateway) {
        this.gateway = gateway;
    }

    public GatewayResponse classifyIntent(String message, String userId, String orgId) {
        return classifyIntent(message, userId, orgId, Channel.WEB);
    }

    public GatewayResponse classifyIntent(String message, String userId, String orgId, Channel channel) {
        return gateway.runTask(GatewayRequest.builder()
                .task(AiTask.INTENT_CLASSIFY)
                .addMessage(AiMessage.user(message))
                .userId(userId)
                .orgId(orgId)
                .channel(channel)
                .build());
    }

    /**
     * Extracts fields from a document. With a schema the response is constrained to it.
     */
    public GatewayResponse extractDocumentFields(String documentContent, String documentType,
                                                 String userId, String orgId, Map<String, Object> schema) {
        GatewayRequest.Builder request = GatewayRequest.builder()
                .task(AiTask.DOC_EXTRACT_FIELDS)
                .addMessage(AiMessage.user(
                        "Extract structured data from this " + documentType + " document:\n\n" + documentContent))
                .userId(userId)
                .orgId(orgId)
                .channel(Channel.WEB);
        if (schema != null) {
            request.responseFormat(ResponseFormat.jsonSchema(EXTRACTED_FIELDS_SCHEMA_NAME, true, schema));
        }
        return gateway.runTask(request.build());
    }

    public GatewayResponse summarizeDocument(String documentContent, String userId, String orgId) {
        return gateway.runTask(GatewayRequest.builder()
                .task(AiTask.DOC_SUMMARIZE)
                .addMessage(AiMessage.user("Summarize this document, highlighting key information relevant to "
                        + "renewable energy asset diligence:\n\n" + documentContent))
                .userId(userId)
                .orgId(orgId)
                .channel(Channel.WEB)
                .build());
    }

    /**
     * Conversational turn. Tools, when given, are offered with automatic tool choice.
     */
    public GatewayResponse chatResponse(List<AiMessage> messages, List<ToolDefinition> tools,
                                        String userId, String orgId, Channel channel) {
        boolean hasTools = tools != null && !tools.isEmpty();
        return gateway.runTask(GatewayRequest.builder()
                .task(AiTask.CHAT_RESPONSE)
                .messages(messages)
                .tools(hasTools ? tools : null)
                .toolChoice(hasTools ? ToolChoice.auto() : null)
                .userId(userId)
                .orgId(orgId)
                .channel(channel)
                .build());
    }
}
