package com.eainde.legalqa.exception;

/**
 * The generator failed or timed out.
 */
public class GenerationException extends PipelineException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
