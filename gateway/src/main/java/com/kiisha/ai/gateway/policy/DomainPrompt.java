package com.kiisha.ai.gateway.policy;

import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.gateway.providers.AiMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Domain-scoping system instruction sent with every call, so all providers see the
 * same behavioural constraints whatever system messages the caller supplied.
 */
public final class DomainPrompt {

    public static final String SYSTEM_PROMPT =
            "You are KIISHA, an AI assistant specialized in renewable energy asset diligence " +
            "and operations management.\n\n" +
            "IMPORTANT CONSTRAINTS:\n" +
            "1. You must ONLY operate within the KIISHA platform's domain and tools.\n" +
            "2. You can ONLY use the provided tools and access data that the current user is " +
            "authorized to see.\n" +
            "3. If asked questions unrelated to renewable energy assets, diligence, or operations, " +
            "respond briefly that KIISHA is limited to KIISHA workspace operations and offer to help " +
            "with supported actions.\n" +
            "4. Never claim capabilities outside of your provided tools.\n" +
            "5. Always cite evidence when making claims about documents or data.\n" +
            "6. For any action that modifies data, clearly explain what will be changed and ask " +
            "for confirmation.\n\n" +
            "SUPPORTED DOMAINS:\n" +
            "- Document management and categorization\n" +
            "- Asset data extraction and verification\n" +
            "- RFI/Request management\n" +
            "- Compliance tracking\n" +
            "- Operations monitoring\n" +
            "- Data room management\n" +
            "- Entity resolution and linking\n\n" +
            "You are helpful, precise, and always operate within your defined scope.";

    private DomainPrompt() {
    }

    static String taskLine(AiTask task) {
        return "\n\nCurrent task: " + task.name();
    }

    /**
     * Returns a new message list carrying the domain instruction. With no system message a
     * new one is prepended; otherwise every existing system message is wrapped with the
     * instruction in front and the task line behind.
     */
    public static List<AiMessage> apply(List<AiMessage> messages, AiTask task) {
        boolean hasSystem = messages.stream().anyMatch(AiMessage::isSystem);
        List<AiMessage> result = new ArrayList<>(messages.size() + 1);

        if (!hasSystem) {
            result.add(AiMessage.system(SYSTEM_PROMPT + taskLine(task)));
            result.addAll(messages);
            return result;
        }

        for (AiMessage message : messages) {
            if (message.isSystem()) {
                String existing = message.getContent() != null ? message.getContent() : "";
                result.add(message.withContent(SYSTEM_PROMPT + "\n\n" + existing + taskLine(task)));
            } else {
                result.add(message);
            }
        }
        return result;
    }
}
