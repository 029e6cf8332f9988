package com.kiisha.ai.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Organization roles that task policies are expressed against.
 */
public enum Role {
    ADMIN("admin"),
    EDITOR("editor"),
    REVIEWER("reviewer"),
    INVESTOR_VIEWER("investor_viewer");

    private final String code;

    Role(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Parses a role from its code string.
     */
    @JsonCreator
    public static Role fromCode(String code) {
        for (Role role : values()) {
            if (role.code.equalsIgnoreCase(code) || role.name().equalsIgnoreCase(code)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
