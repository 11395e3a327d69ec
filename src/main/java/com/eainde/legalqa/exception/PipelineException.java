package com.eainde.legalqa.exception;

/**
 * Base of all failures raised inside the legal QA pipeline.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
