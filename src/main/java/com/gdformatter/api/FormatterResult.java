package com.gdformatter.api;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.gdformatter.api.error.FormatterError;
import com.gdformatter.api.error.Severity;

/**
 * Outcome of formatting one source.
 * <p>
 * An unsuccessful result always carries the original text as its formatted code,
 * so writing it back is harmless.
 */
public class FormatterResult {
    private final boolean successful;
    private final String originalCode;
    private final String formattedCode;
    private final List<FormatterError> errors;
    private final List<Refactoring> appliedRefactorings;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.originalCode = builder.originalCode;
        this.formattedCode = builder.formattedCode;
        this.errors = List.copyOf(builder.errors);
        this.appliedRefactorings = List.copyOf(builder.appliedRefactorings);
    }

    public boolean isSuccessful() {
        return successful;
    }

    public String getOriginalCode() {
        return originalCode;
    }

    public String getFormattedCode() {
        return formattedCode;
    }

    /**
     * True when formatting succeeded and produced different text.
     */
    public boolean isChanged() {
        return successful && formattedCode != null && !formattedCode.equals(originalCode);
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    public List<FormatterError> getErrors(Severity severity) {
        return errors.stream()
                .filter(e -> e.getSeverity() == severity)
                .collect(Collectors.toList());
    }

    public boolean hasBlockingErrors() {
        return errors.stream().anyMatch(e -> e.getSeverity().isBlocking());
    }

    public List<Refactoring> getAppliedRefactorings() {
        return appliedRefactorings;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String originalCode;
        private String formattedCode;
        private final List<FormatterError> errors = new ArrayList<>();
        private final List<Refactoring> appliedRefactorings = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder originalCode(String originalCode) {
            this.originalCode = originalCode;
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

        public Builder addRefactoring(Refactoring refactoring) {
            this.appliedRefactorings.add(refactoring);
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
