package com.kiisha.ai.common.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the shared enums and ValidationResult.
 */
class RoleTest {

    @Test
    void testFromCode_acceptsWireCode() {
        assertEquals(Role.INVESTOR_VIEWER, Role.fromCode("investor_viewer"));
        assertEquals(Role.ADMIN, Role.fromCode("ADMIN"));
    }

    @Test
    void testFromCode_unknownRoleRejected() {
        assertThrows(IllegalArgumentException.class, () -> Role.fromCode("owner"));
    }

    @Test
    void testChannelFromCode() {
        assertEquals(Channel.WHATSAPP, Channel.fromCode("whatsapp"));
        assertEquals("api", Channel.API.toString());
        assertThrows(IllegalArgumentException.class, () -> Channel.fromCode("sms"));
    }

    @Test
    void testValidationResult_errorsMakeInvalid() {
        ValidationResult result = ValidationResult.builder()
                .addWarning("model", "unusual model name")
                .addError("maxRetries", "must not be negative")
                .build();

        assertFalse(result.isValid());
        assertEquals(1, result.getErrors().size());
        assertEquals(1, result.getWarnings().size());
        assertEquals("maxRetries: must not be negative", result.getErrorSummary());
    }

    @Test
    void testValidationResult_valid() {
        ValidationResult result = ValidationResult.valid();
        assertTrue(result.isValid());
        assertTrue(result.getErrors().isEmpty());
        assertEquals("", result.getErrorSummary());
    }

    @Test
    void testAiTaskFromName() {
        assertEquals(AiTask.DOC_SUMMARIZE, AiTask.fromName("doc_summarize").orElseThrow());
        assertTrue(AiTask.fromName("WRITE_POEM").isEmpty());
        assertTrue(AiTask.fromName(null).isEmpty());
    }
}
