package com.kiisha.ai.common.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of validating a configuration object (routing table, provider config).
 * Errors make the result invalid; warnings are advisory.
 */
public final class ValidationResult {

    private final List<ValidationError> errors;
    private final List<String> warnings;

    private ValidationResult(List<ValidationError> errors, List<String> warnings) {
        this.errors = Collections.unmodifiableList(errors);
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * Joins all error messages into a single line, for log and exception messages.
     */
    public String getErrorSummary() {
        return errors.stream()
                .map(ValidationError::toString)
                .collect(Collectors.joining("; "));
    }

    /**
     * Creates a valid result with no errors.
     */
    public static ValidationResult valid() {
        return new ValidationResult(Collections.emptyList(), Collections.emptyList());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<ValidationError> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        public Builder addError(String field, String message) {
            errors.add(new ValidationError(field, message));
            return this;
        }

        public Builder addWarning(String field, String message) {
            warnings.add(field + ": " + message);
            return this;
        }

        public ValidationResult build() {
            return new ValidationResult(new ArrayList<>(errors), new ArrayList<>(warnings));
        }
    }

    /**
     * Represents a single validation error.
     */
    public static class ValidationError {
        private final String field;
        private final String message;

        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }

        public String getField() {
            return field;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return String.format("%s: %s", field, message);
        }
    }
}
