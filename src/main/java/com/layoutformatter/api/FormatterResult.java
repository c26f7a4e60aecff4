package com.layoutformatter.api;

import java.util.ArrayList;
import java.util.List;

import com.layoutformatter.api.error.FormatterError;

/**
 * Result of formatting one translated document.
 */
public class FormatterResult {
    private final boolean successful;
    private final String formattedCode;
    private final List<FormatterError> errors;
    private final List<AppliedCorrection> appliedCorrections;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.formattedCode = builder.formattedCode;
        this.errors = List.copyOf(builder.errors);
        this.appliedCorrections = List.copyOf(builder.appliedCorrections);
    }

    public boolean isSuccessful() {
        return successful;
    }

    /**
     * The formatted text, or {@code null} when formatting failed.
     */
    public String getFormattedCode() {
        return formattedCode;
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    public List<AppliedCorrection> getAppliedCorrections() {
        return appliedCorrections;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String formattedCode;
        private List<FormatterError> errors = new ArrayList<>();
        private List<AppliedCorrection> appliedCorrections = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder formattedCode(String formattedCode) {
            this.formattedCode = formattedCode;
            return this;
        }

        public Builder addError(FormatterError error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<FormatterError> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public Builder appliedCorrections(List<AppliedCorrection> corrections) {
            this.appliedCorrections = new ArrayList<>(corrections);
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
