package com.cratepilot.app.dto.response;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

@Value
public class ValidationResult {

    boolean valid;
    List<String> errors;
    List<String> warnings;

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors.isEmpty(), List.copyOf(errors), List.copyOf(warnings));
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of(), List.of());
    }

    public ValidationResult merge(ValidationResult other) {
        List<String> mergedErrors = new ArrayList<>(errors);
        mergedErrors.addAll(other.errors);
        List<String> mergedWarnings = new ArrayList<>(warnings);
        mergedWarnings.addAll(other.warnings);
        return of(mergedErrors, mergedWarnings);
    }
}
