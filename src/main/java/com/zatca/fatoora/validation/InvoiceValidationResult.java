package com.zatca.fatoora.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Errors block an invoice from being sequenced; warnings do not.
 */
public final class InvoiceValidationResult {

    private final List<ValidationMessage> errors;
    private final List<ValidationMessage> warnings;

    public InvoiceValidationResult(List<ValidationMessage> errors, List<ValidationMessage> warnings) {
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<ValidationMessage> getErrors() {
        return errors;
    }

    public List<ValidationMessage> getWarnings() {
        return warnings;
    }

    public boolean hasError(String code) {
        return errors.stream().anyMatch(e -> e.getCode().equals(code));
    }

    public boolean hasWarning(String code) {
        return warnings.stream().anyMatch(w -> w.getCode().equals(code));
    }

    @Override
    public String toString() {
        return "InvoiceValidationResult{errors=" + errors + ", warnings=" + warnings + '}';
    }
}
