package com.eainde.legalqa.exception;

/**
 * The retriever failed or timed out.
 */
public class RetrievalException extends PipelineException {

    public RetrievalException(String message) {
        super(message);
    }

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
