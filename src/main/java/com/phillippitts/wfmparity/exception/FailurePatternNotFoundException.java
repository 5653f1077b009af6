package com.phillippitts.wfmparity.exception;

import java.util.UUID;

public class FailurePatternNotFoundException extends ParityException {

    private final UUID patternId;

    public FailurePatternNotFoundException(UUID patternId) {
        super("Failure pattern not found: " + patternId);
        this.patternId = patternId;
    }

    public UUID getPatternId() {
        return patternId;
    }
}
