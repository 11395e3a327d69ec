package com.eainde.legalqa.exception;

/**
 * Reading or writing conversation state failed.
 */
public class ConversationStoreException extends PipelineException {

    public ConversationStoreException(String message) {
        super(message);
    }

    public ConversationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
