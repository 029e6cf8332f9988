package com.kiisha.ai.gateway.providers;

import java.util.Objects;

/**
 * How the model may use the supplied tools: never, at will, always, or one named function.
 */
public final class ToolChoice {

    public enum Mode {
        NONE,
        AUTO,
        REQUIRED,
        FUNCTION
    }

    private static final ToolChoice NONE = new ToolChoice(Mode.NONE, null);
    private static final ToolChoice AUTO = new ToolChoice(Mode.AUTO, null);
    private static final ToolChoice REQUIRED = new ToolChoice(Mode.REQUIRED, null);

    private final Mode mode;
    private final String functionName;

    private ToolChoice(Mode mode, String functionName) {
        this.mode = mode;
        this.functionName = functionName;
    }

    public static ToolChoice none() {
        return NONE;
    }

    public static ToolChoice auto() {
        return AUTO;
    }

    public static ToolChoice required() {
        return REQUIRED;
    }

    public static ToolChoice function(String functionName) {
        return new ToolChoice(Mode.FUNCTION, Objects.requireNonNull(functionName, "functionName"));
    }

    public Mode getMode() {
        return mode;
    }

    /**
     * Name of the forced function; only set for {@link Mode#FUNCTION}.
     */
    public String getFunctionName() {
        return functionName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToolChoice)) return false;
        ToolChoice that = (ToolChoice) o;
        return mode == that.mode && Objects.equals(functionName, that.functionName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, functionName);
    }

    @Override
    public String toString() {
        return mode == Mode.FUNCTION ? "function:" + functionName : mode.name().toLowerCase();
    }
}
