package com.record.merge.store;

import java.util.List;

/**
 * Thrown when a record fails validation on save.
 */
public class RecordInvalidException extends RuntimeException {

    private final List<String> violations;

    public RecordInvalidException(String message, List<String> violations) {
        super(message + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public RecordInvalidException(List<String> violations) {
        this("Record is invalid", violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
