package com.eainde.legalqa.generation;

import com.eainde.legalqa.context.TokenCounter;
import com.eainde.legalqa.model.AnswerStatus;
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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatModelAnswerGeneratorTest {

    @Mock
    private ChatModel chatModel;

    @Mock
    private StreamingChatModel streamingChatModel;

    private ChatModelAnswerGenerator generator(StreamingChatModel streaming) {
        return new ChatModelAnswerGenerator(chatModel, streaming, new ConfidenceEstimator(0.85), TokenCounter.estimating());
    }

    private static ChatResponse response(String text, TokenUsage usage) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).tokenUsage(usage).build();
    }

    /** Collects stream callbacks. */
    static final class RecordingHandler implements GenerationStreamHandler {
        final List<String> increments = new ArrayList<>();
        GenerationResult completed;
        Throwable error;

        @Override
        public void onContent(String increment) {
            increments.add(increment);
        }

        @Override
        public void onComplete(GenerationResult result) {
            completed = result;
        }

        @Override
        public void onError(Throwable error) {
            this.error = error;
        }
    }

    // =========================================================================
    //  Request building
    // =========================================================================

    @Test
    @DisplayName("the request carries system prompt, answered history and the user prompt")
    void request() {
        List<ConversationTurn> history = List.of(
                new ConversationTurn("s", 1, "What is bail?", null, "Bail is release.", AnswerStatus.SUCCESS, 0.8,
                        null, List.of(), null),
                new ConversationTurn("s", 2, "Unanswered", null, " ", AnswerStatus.ERROR, 0.0, null, List.of(), null));

        List<ChatMessage> messages = ChatModelAnswerGenerator.request("system", "user", history).messages();

        assertThat(messages).containsExactly(
                SystemMessage.from("system"),
                UserMessage.from("What is bail?"),
                AiMessage.from("Bail is release."),
                UserMessage.from("user"));
    }

    // =========================================================================
    //  Blocking generation
    // =========================================================================

    @Nested
    @DisplayName("generate")
    class Generate {

        @Test
        @DisplayName("reports trimmed text, total tokens and an output-token based confidence")
        void success() {
            when(chatModel.chat(any(ChatRequest.class)))
                    .thenReturn(response(" Bail was granted. ", new TokenUsage(100, 50)));

            GenerationResult result = generator(null).generate("sys", "user", List.of());

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.text()).isEqualTo("Bail was granted.");
            assertThat(result.tokensUsed()).isEqualTo(150);
            assertThat(result.confidence()).isCloseTo(0.75, within(1e-9));
        }

        @Test
        @DisplayName("estimates tokens when the model reports no usage")
        void noUsage() {
            when(chatModel.chat(any(ChatRequest.class))).thenReturn(response("abcdefgh", null));

            GenerationResult result = generator(null).generate("abcd", "abcdefgh", List.of());

            assertThat(result.tokensUsed()).isEqualTo(5);
        }

        @Test
        @DisplayName("an empty answer is a failure")
        void emptyAnswer() {
            when(chatModel.chat(any(ChatRequest.class))).thenReturn(response(" ", null));

            GenerationResult result = generator(null).generate("sys", "user", List.of());

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.error()).isEqualTo("Chat model returned an empty answer");
        }

        @Test
        @DisplayName("a model exception is a failure")
        void modelFailure() {
            when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("quota exceeded"));

            GenerationResult result = generator(null).generate("sys", "user", List.of());

            assertThat(result.status()).isEqualTo(GenerationResult.Status.ERROR);
            assertThat(result.error()).contains("quota exceeded");
            assertThat(result.confidence()).isZero();
        }
    }

    // =========================================================================
    //  Streaming
    // =========================================================================

    @Nested
    @DisplayName("generateStream")
    class Stream {

        @Test
        @DisplayName("without a streaming model the whole answer is one increment")
        void fallback() {
            when(chatModel.chat(any(ChatRequest.class))).thenReturn(response("Bail was granted.", new TokenUsage(10, 5)));
            RecordingHandler handler = new RecordingHandler();

            generator(null).generateStream("sys", "user", handler);

            assertThat(handler.increments).containsExactly("Bail was granted.");
            assertThat(handler.completed.text()).isEqualTo("Bail was granted.");
            assertThat(handler.error).isNull();
        }

        @Test
        @DisplayName("a failing fallback call reports an error")
        void fallbackFailure() {
            when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("down"));
            RecordingHandler handler = new RecordingHandler();

            generator(null).generateStream("sys", "user", handler);

            assertThat(handler.increments).isEmpty();
            assertThat(handler.completed).isNull();
            assertThat(handler.error).hasMessageContaining("down");
        }

        @Test
        @DisplayName("partial responses are forwarded, then the complete result")
        void streaming() {
            doAnswer(invocation -> {
                StreamingChatResponseHandler h = invocation.getArgument(1);
                h.onPartialResponse("Bail was ");
                h.onPartialResponse("granted.");
                h.onCompleteResponse(response("Bail was granted.", new TokenUsage(10, 5)));
                return null;
            }).when(streamingChatModel).chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));
            RecordingHandler handler = new RecordingHandler();

            generator(streamingChatModel).generateStream("sys", "user", handler);

            assertThat(handler.increments).containsExactly("Bail was ", "granted.");
            assertThat(handler.completed.tokensUsed()).isEqualTo(15);
        }

        @Test
        @DisplayName("stream errors are forwarded")
        void streamingError() {
            doAnswer(invocation -> {
                StreamingChatResponseHandler h = invocation.getArgument(1);
                h.onError(new IllegalStateException("connection reset"));
                return null;
            }).when(streamingChatModel).chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));
            RecordingHandler handler = new RecordingHandler();

            generator(streamingChatModel).generateStream("sys", "user", handler);

            assertThat(handler.error).isInstanceOf(IllegalStateException.class).hasMessage("connection reset");
        }
    }
}
