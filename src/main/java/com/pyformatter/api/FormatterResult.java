package com.pyformatter.api;

import java.util.ArrayList;
import java.util.List;

import com.pyformatter.api.error.FormatterError;

/**
 * Result of formatting or checking one file.
 */
public class FormatterResult {
    private final boolean successful;
    private final String formattedCode;
    private final boolean changed;
    private final List<FormatterError> errors;
    private final List<Violation> violations;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.formattedCode = builder.formattedCode;
        this.changed = builder.changed;
        this.errors = builder.errors;
        this.violations = builder.violations;
    }

    public boolean isSuccessful() {
        return successful;
    }

    /**
     * The formatted text, or the untouched input when formatting failed.
     */
    public String getFormattedCode() {
        return formattedCode;
    }

    public boolean isChanged() {
        return changed;
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    public List<Violation> getViolations() {
        return violations;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String formattedCode;
        private boolean changed;
        private List<FormatterError> errors = new ArrayList<>();
        private List<Violation> violations = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder formattedCode(String formattedCode) {
            this.formattedCode = formattedCode;
            return this;
        }

        public Builder changed(boolean changed) {
            this.changed = changed;
            return this;
        }

        public Builder addError(FormatterError error) {
            this.errors.add(error);
            return this;
        }

        public Builder violations(List<Violation> violations) {
            this.violations = new ArrayList<>(violations);
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
