package com.eainde.legalqa.generation;

import com.eainde.legalqa.context.TokenCounter;
import com.eainde.legalqa.model.ConversationTurn;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link AnswerGenerator} over LangChain4j chat models.
 *
 * <p>Without a streaming model, {@link #generateStream} runs a blocking call and emits the whole
 * answer as a single increment.</p>
 */
@Log4j2
public class ChatModelAnswerGenerator implements AnswerGenerator {

    private final ChatModel chatModel;
    private final StreamingChatModel streamingChatModel;
    private final ConfidenceEstimator confidenceEstimator;
    private final TokenCounter tokenCounter;

    public ChatModelAnswerGenerator(ChatModel chatModel, StreamingChatModel streamingChatModel,
                                    ConfidenceEstimator confidenceEstimator, TokenCounter tokenCounter) {
        this.chatModel = chatModel;
        this.streamingChatModel = streamingChatModel;
        this.confidenceEstimator = confidenceEstimator;
        this.tokenCounter = tokenCounter;
    }

    @Override
    public GenerationResult generate(String systemPrompt, String userPrompt, List<ConversationTurn> history) {
        try {
            ChatResponse response = chatModel.chat(request(systemPrompt, userPrompt, history));
            return toResult(response, systemPrompt, userPrompt);
        } catch (RuntimeException e) {
            log.error("Chat model call failed: {}", e.getMessage(), e);
            return GenerationResult.failure("Chat model call failed: " + e.getMessage());
        }
    }

    @Override
    public void generateStream(String systemPrompt, String userPrompt, GenerationStreamHandler handler) {
        if (streamingChatModel == null) {
            GenerationResult result = generate(systemPrompt, userPrompt, List.of());
            if (result.isSuccess()) {
                handler.onContent(result.text());
                handler.onComplete(result);
            } else {
                handler.onError(new IllegalStateException(result.error()));
            }
            return;
        }

        streamingChatModel.chat(request(systemPrompt, userPrompt, List.of()), new StreamingChatResponseHandler() {

            @Override
            public void onPartialResponse(String partialResponse) {
                handler.onContent(partialResponse);
            }

            @Override
            public void onCompleteResponse(ChatResponse completeResponse) {
                handler.onComplete(toResult(completeResponse, systemPrompt, userPrompt));
            }

            @Override
            public void onError(Throwable error) {
                log.error("Streaming chat model call failed: {}", error.getMessage());
                handler.onError(error);
            }
        });
    }

    // =========================================================================
    //  Internals
    // =========================================================================

    static ChatRequest request(String systemPrompt, String userPrompt, List<ConversationTurn> history) {
        List<ChatMessage> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        if (history != null) {
            for (ConversationTurn turn : history) {
                if (turn.query() != null && turn.answer() != null && !turn.answer().isBlank()) {
                    messages.add(UserMessage.from(turn.query()));
                    messages.add(AiMessage.from(turn.answer()));
                }
            }
        }
        messages.add(UserMessage.from(userPrompt));
        return ChatRequest.builder().messages(messages).build();
    }

    private GenerationResult toResult(ChatResponse response, String systemPrompt, String userPrompt) {
        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            return GenerationResult.failure("Chat model returned an empty answer");
        }
        TokenUsage usage = response.tokenUsage();
        int tokens = tokensUsed(usage, systemPrompt, userPrompt, text);
        int outputTokens = usage != null && usage.outputTokenCount() != null
                ? usage.outputTokenCount()
                : tokenCounter.count(text);
        double confidence = confidenceEstimator.estimate(text, outputTokens);
        log.debug("Generated {} chars, {} tokens, confidence {}", text.length(), tokens, confidence);
        return GenerationResult.success(text.trim(), confidence, tokens);
    }

    private int tokensUsed(TokenUsage usage, String systemPrompt, String userPrompt, String text) {
        if (usage != null && usage.totalTokenCount() != null) {
            return usage.totalTokenCount();
        }
        return tokenCounter.count(systemPrompt) + tokenCounter.count(userPrompt) + tokenCounter.count(text);
    }
}
