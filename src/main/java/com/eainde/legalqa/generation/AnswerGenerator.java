package com.eainde.legalqa.generation;

import com.eainde.legalqa.model.ConversationTurn;

import java.util.List;

/**
 * Language model behind the pipeline. Failures are reported through
 * {@link GenerationResult#failure(String)} or {@link GenerationStreamHandler#onError(Throwable)}.
 */
public interface AnswerGenerator {

    /**
     * @param systemPrompt instructions for the model
     * @param userPrompt   rendered question with context
     * @param history      earlier turns, oldest first; may be empty
     */
    GenerationResult generate(String systemPrompt, String userPrompt, List<ConversationTurn> history);

    void generateStream(String systemPrompt, String userPrompt, GenerationStreamHandler handler);
}
