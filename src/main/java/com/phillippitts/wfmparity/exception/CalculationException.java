package com.phillippitts.wfmparity.exception;

import com.phillippitts.wfmparity.domain.EngineVariant;

/**
 * Thrown when an engine cannot produce a result: invalid parameters, non-convergence or a
 * numeric singularity. The job is retried with backoff until its retry budget is spent.
 */
public class CalculationException extends ParityException {

    private final String engine;

    public CalculationException(String message) {
        super(message);
        this.engine = "unknown";
    }

    public CalculationException(String message, EngineVariant variant) {
        super(message + " (engine: " + variant.tag() + ")");
        this.engine = variant.tag();
    }

    public CalculationException(String message, Throwable cause) {
        super(message, cause);
        this.engine = "unknown";
    }

    public CalculationException(String message, EngineVariant variant, Throwable cause) {
        super(message + " (engine: " + variant.tag() + ")", cause);
        this.engine = variant.tag();
    }

    public String getEngine() {
        return engine;
    }
}
