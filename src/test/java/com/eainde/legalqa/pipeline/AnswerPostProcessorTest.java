package com.eainde.legalqa.pipeline;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AnswerPostProcessorTest {

    private final AnswerPostProcessor processor = new AnswerPostProcessor();

    @Test
    void softensGuaranteesAndCategoricalOutcomes() {
        String out = processor.process("I guarantee you will definitely win.");

        assertThat(out).isEqualTo("Generally, you may have a strong case.");
    }

    @Test
    void softensMustInBothCases() {
        assertThat(processor.process("You must file a reply. Then you must wait."))
                .isEqualTo("You may need to file a reply. Then you may need to wait.");
    }

    @Test
    void softensDefiniteLoss() {
        assertThat(processor.process("If you proceed, you will definitely lose."))
                .isEqualTo("If you proceed, your case may face difficulties.");
    }

    @Test
    void tidiesWhitespace() {
        String out = processor.process("  First point.   \n\n\n\nSecond point.\t\nThird.  ");

        assertThat(out).isEqualTo("First point.\n\nSecond point.\nThird.");
    }

    @Test
    void leavesOrdinaryTextAlone() {
        String text = "The court held that the petition was maintainable.";

        assertThat(processor.process(text)).isEqualTo(text);
    }

    @Test
    void nullStaysNull() {
        assertThat(processor.process(null)).isNull();
    }
}
