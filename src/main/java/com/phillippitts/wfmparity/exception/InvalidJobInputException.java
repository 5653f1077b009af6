package com.phillippitts.wfmparity.exception;

import java.util.List;

/**
 * Thrown when a job submission or tracking request is malformed. Nothing is enqueued.
 */
public class InvalidJobInputException extends ParityException {

    private final List<String> violations;

    public InvalidJobInputException(String reason) {
        super("Invalid job input: " + reason);
        this.violations = List.of(reason);
    }

    public InvalidJobInputException(List<String> violations) {
        super("Invalid job input: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
