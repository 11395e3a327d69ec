package com.eainde.legalqa.conversation;

import com.eainde.legalqa.model.AnswerStatus;
import com.eainde.legalqa.model.ConversationTurn;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationSummarizerTest {

    private final ConversationSummarizer summarizer = new ConversationSummarizer(2, 150);

    private static ConversationTurn turn(String query) {
        return new ConversationTurn("s1", 1, query, query, "a", AnswerStatus.SUCCESS, 0.5, null, List.of(), null);
    }

    @Test
    @DisplayName("no turns and no case gives the placeholder")
    void empty() {
        assertThat(summarizer.summarize(List.of(), null)).isEqualTo(ConversationSummarizer.NO_PRIOR_CONVERSATION);
        assertThat(ConversationSummarizer.isInformative(ConversationSummarizer.NO_PRIOR_CONVERSATION)).isFalse();
    }

    @Test
    @DisplayName("no turns with a case names the case")
    void caseOnly() {
        assertThat(summarizer.summarize(null, AbstractConversationStoreTest.CASE))
                .isEqualTo("User is discussing case C.P. 12/2021 Civil.");
    }

    @Test
    @DisplayName("only the last turns of the window are summarised, with their topics")
    void window() {
        String summary = summarizer.summarize(List.of(
                turn("What is bail?"),
                turn("Who are the advocates?"),
                turn("What was the order?")), AbstractConversationStoreTest.CASE);

        assertThat(summary).isEqualTo("Active case: C.P. 12/2021 Civil. "
                + "Recent questions: Who are the advocates? | What was the order?. "
                + "Topics: advocates, court order.");
    }

    @Test
    @DisplayName("the same input gives the same summary")
    void deterministic() {
        List<ConversationTurn> turns = List.of(turn("Tell me about the FIR"), turn("Give a brief overview"));
        assertThat(summarizer.summarize(turns, null)).isEqualTo(summarizer.summarize(turns, null));
        assertThat(ConversationSummarizer.detectTopics("Tell me about the FIR. Give a brief overview"))
                .containsExactly("summary", "fir info");
    }

    @Test
    @DisplayName("long summaries are cut to the word limit")
    void wordLimit() {
        String summary = new ConversationSummarizer(5, 4).summarize(List.of(turn("What was the order?")), null);
        assertThat(summary).isEqualTo("Recent questions: What was...");
    }
}
