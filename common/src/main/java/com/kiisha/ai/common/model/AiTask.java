package com.kiisha.ai.common.model;

import java.util.Optional;

/**
 * The closed set of model invocations the gateway will run.
 * Adding a kind requires a policy registry entry; callers never pick freeform modes.
 */
public enum AiTask {
    /** Router intent classification for chat */
    INTENT_CLASSIFY,
    /** Document type/category classification */
    DOC_CLASSIFY,
    /** Field extraction with evidence references */
    DOC_EXTRACT_FIELDS,
    /** Summary restricted to data the caller may see */
    DOC_SUMMARIZE,
    /** Diff detection and change summary */
    DOC_COMPARE_VERSIONS,
    /** Propose primary entity linking */
    LINK_SUGGEST_PRIMARY,
    /** Propose data room / checklist links */
    LINK_SUGGEST_SECONDARY,
    /** Draft structured responses from allowed data */
    RFI_DRAFT_RESPONSE,
    /** Help create field packs and templates */
    REQUEST_TEMPLATE_ASSIST,
    /** Submission quality score */
    QUALITY_SCORE,
    /** Cross-check extracted values against prior documents */
    VALIDATE_CONSISTENCY,
    /** Conversational response restricted to platform tools */
    CHAT_RESPONSE,
    /** OCR pipeline */
    OCR_EXTRACT,
    /** Parse GIS, coordinates and site data */
    GEO_PARSE;

    /**
     * Looks a task up by its wire name, ignoring case. Empty for names outside the closed set.
     */
    public static Optional<AiTask> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (AiTask task : values()) {
            if (task.name().equalsIgnoreCase(name.trim())) {
                return Optional.of(task);
            }
        }
        return Optional.empty();
    }
}
