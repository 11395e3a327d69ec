package com.eainde.legalqa.pipeline;

/**
 * One event of a streamed answer: text increments, then exactly one {@code COMPLETE} or
 * {@code ERROR} carrying the final {@link AnswerResult}.
 */
public record StreamChunk(Type type, String content, AnswerResult result) {

    public enum Type { CONTENT, COMPLETE, ERROR }

    public static StreamChunk content(String text) {
        return new StreamChunk(Type.CONTENT, text, null);
    }

    public static StreamChunk complete(AnswerResult result) {
        return new StreamChunk(Type.COMPLETE, null, result);
    }

    public static StreamChunk error(AnswerResult result) {
        return new StreamChunk(Type.ERROR, result.answerText(), result);
    }

    public boolean isTerminal() {
        return type != Type.CONTENT;
    }
}
