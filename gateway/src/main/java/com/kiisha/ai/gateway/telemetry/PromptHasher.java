package com.kiisha.ai.gateway.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kiisha.ai.common.AiGatewayConstants;
import com.kiisha.ai.gateway.providers.AiMessage;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Prompt fingerprints: the first 16 hex characters of the SHA-256 of the rendered prompt.
 * Identical message lists always hash the same, so audit entries can be grouped by prompt
 * version without storing prompt text.
 */
public final class PromptHasher {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PromptHasher() {
    }

    public static String hash(String prompt) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(prompt.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, AiGatewayConstants.PROMPT_HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Hashes the JSON rendering of the message list.
     */
    public static String hash(List<AiMessage> messages) {
        try {
            return hash(MAPPER.writeValueAsString(messages));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Messages cannot be rendered for hashing", e);
        }
    }
}
