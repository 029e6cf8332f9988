package com.kiisha.ai.gateway.policy;

import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.gateway.providers.AiMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DomainPromptTest {

    @Test
    void testApply_prependsSystemMessage() {
        List<AiMessage> result = DomainPrompt.apply(List.of(AiMessage.user("Summarize the PPA")),
                AiTask.DOC_SUMMARIZE);

        assertEquals(2, result.size());
        assertTrue(result.get(0).isSystem());
        assertTrue(result.get(0).getContent().startsWith("You are KIISHA"));
        assertTrue(result.get(0).getContent().endsWith("\n\nCurrent task: DOC_SUMMARIZE"));
        assertEquals("Summarize the PPA", result.get(1).getContent());
    }

    @Test
    void testApply_mergesIntoExistingSystemMessage() {
        List<AiMessage> result = DomainPrompt.apply(List.of(
                AiMessage.system("Answer in French."),
                AiMessage.user("Bonjour")), AiTask.CHAT_RESPONSE);

        assertEquals(2, result.size());
        assertEquals(DomainPrompt.SYSTEM_PROMPT + "\n\nAnswer in French.\n\nCurrent task: CHAT_RESPONSE",
                result.get(0).getContent());
    }

    @Test
    void testApply_doesNotMutateInput() {
        List<AiMessage> input = List.of(AiMessage.system("Keep it short."));
        DomainPrompt.apply(input, AiTask.GEO_PARSE);
        assertEquals("Keep it short.", input.get(0).getContent());
    }
}
