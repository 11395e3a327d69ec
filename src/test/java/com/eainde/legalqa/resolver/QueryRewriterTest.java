package com.eainde.legalqa.resolver;

import com.eainde.legalqa.conversation.ConversationSummarizer;
import com.eainde.legalqa.model.ActiveCaseContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueryRewriterTest {

    private static final ActiveCaseContext CASE = new ActiveCaseContext(
            "cp-12", "C.P. 12/2021 Civil", "Ahmed vs State", null,
            null, null, null, null, null, null, null, null);

    private final QueryRewriter rewriter = new QueryRewriter(500);

    @Nested
    @DisplayName("With a case lock")
    class Locked {

        @Test
        @DisplayName("'this case' is replaced by the case number")
        void replacesPronounPhrase() {
            assertThat(rewriter.rewrite("What was the order in this case?", CASE, null, null, true))
                    .isEqualTo("What was the order in C.P. 12/2021 Civil?");
        }

        @Test
        @DisplayName("'same one' is replaced too")
        void replacesSameOne() {
            assertThat(rewriter.rewrite("Any appeal in the same one?", CASE, null, null, true))
                    .isEqualTo("Any appeal in the C.P. 12/2021 Civil?");
        }

        @Test
        @DisplayName("a short question using 'it' gets the reference appended")
        void appendsForShortIt() {
            assertThat(rewriter.rewrite("When was it filed?", CASE, null, null, true))
                    .isEqualTo("When was it filed? (C.P. 12/2021 Civil)");
        }

        @Test
        @DisplayName("a long question using 'it' is left alone")
        void longItUnchanged() {
            String q = "Was it decided before the amendment to the limitation law came into force?";
            assertThat(rewriter.rewrite(q, CASE, null, null, true)).isEqualTo(q);
        }

        @Test
        @DisplayName("falls back to the title when there is no case number")
        void titleFallback() {
            ActiveCaseContext titled = new ActiveCaseContext("x", null, "Ahmed vs State", null,
                    null, null, null, null, null, null, null, null);
            assertThat(rewriter.rewrite("Who decided that case?", titled, null, null, true))
                    .isEqualTo("Who decided Ahmed vs State?");
        }
    }

    @Nested
    @DisplayName("Without a case lock")
    class Unlocked {

        @Test
        @DisplayName("non follow-ups only have whitespace collapsed")
        void notFollowUp() {
            assertThat(rewriter.rewrite("  what   is\tbail? ", null, "Recent questions: x.", "prev", false))
                    .isEqualTo("what is bail?");
        }

        @Test
        @DisplayName("follow-ups carry a summary fragment")
        void summaryFragment() {
            assertThat(rewriter.rewrite("And the appeal?", null, "Recent questions: bail under 497.", null, true))
                    .isEqualTo("And the appeal? (context: Recent questions: bail under 497.)");
        }

        @Test
        @DisplayName("follow-ups without a summary are chained to the previous question")
        void previousQuestion() {
            assertThat(rewriter.rewrite("And the appeal?", null, ConversationSummarizer.NO_PRIOR_CONVERSATION,
                    "What is bail?", true))
                    .isEqualTo("What is bail? THEN: And the appeal?");
        }

        @Test
        @DisplayName("the result is capped")
        void capped() {
            assertThat(new QueryRewriter(10).rewrite("abcdefghijklmnop", null, null, null, false))
                    .isEqualTo("abcdefghij");
        }

        @Test
        @DisplayName("the cap never leaves half of a surrogate pair")
        void cappedAtSurrogatePair() {
            String result = new QueryRewriter(10).rewrite("abcdefghi\uD83D\uDE00 bail", null, null, null, false);
            assertThat(result).isEqualTo("abcdefghi");
            assertThat(Character.isHighSurrogate(result.charAt(result.length() - 1))).isFalse();
        }

        @Test
        @DisplayName("a pair that fits whole is kept")
        void keepsWholeSurrogatePair() {
            assertThat(new QueryRewriter(10).rewrite("abcdefgh\uD83D\uDE00 bail", null, null, null, false))
                    .isEqualTo("abcdefgh\uD83D\uDE00");
        }

        @Test
        @DisplayName("null input yields an empty query")
        void nullQuery() {
            assertThat(rewriter.rewrite(null, CASE, null, null, true)).isEmpty();
        }
    }
}
