package com.linlay.goapengine.validation;

import java.util.ArrayList;
import java.util.List;

public record ValidationResult(List<ValidationError> errors) {

    public static final ValidationResult VALID = new ValidationResult(List.of());

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult of(ValidationError error) {
        return new ValidationResult(List.of(error));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public ValidationResult plus(ValidationResult other) {
        if (other == null || other.isValid()) {
            return this;
        }
        List<ValidationError> merged = new ArrayList<>(errors);
        merged.addAll(other.errors());
        return new ValidationResult(merged);
    }
}
