package com.kiisha.ai.gateway.providers;

/**
 * Token counts reported by a provider for one completion.
 */
public final class TokenUsage {

    private static final TokenUsage EMPTY = new TokenUsage(0, 0, 0);

    private final int promptTokens;
    private final int completionTokens;
    private final int totalTokens;

    private TokenUsage(int promptTokens, int completionTokens, int totalTokens) {
        this.promptTokens = Math.max(0, promptTokens);
        this.completionTokens = Math.max(0, completionTokens);
        this.totalTokens = totalTokens > 0 ? totalTokens : this.promptTokens + this.completionTokens;
    }

    public static TokenUsage of(int promptTokens, int completionTokens) {
        return new TokenUsage(promptTokens, completionTokens, 0);
    }

    /**
     * Usage with the total the vendor reported. A non-positive total falls back to the sum.
     */
    public static TokenUsage of(int promptTokens, int completionTokens, int totalTokens) {
        return new TokenUsage(promptTokens, completionTokens, totalTokens);
    }

    public static TokenUsage empty() {
        return EMPTY;
    }

    public int getPromptTokens() {
        return promptTokens;
    }

    public int getCompletionTokens() {
        return completionTokens;
    }

    public int getTotalTokens() {
        return totalTokens;
    }

    @Override
    public String toString() {
        return "TokenUsage{prompt=" + promptTokens + ", completion=" + completionTokens +
                ", total=" + getTotalTokens() + '}';
    }
}
