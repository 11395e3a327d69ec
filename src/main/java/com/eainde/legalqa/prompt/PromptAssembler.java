package com.eainde.legalqa.prompt;

import com.eainde.legalqa.model.ActiveCaseContext;
import com.eainde.legalqa.model.ConversationTurn;
import com.eainde.legalqa.model.PackedContext;
import dev.langchain4j.model.input.PromptTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders an {@link AnswerTemplate} into the system and user messages sent to the generator.
 *
 * <h3>User message variables:</h3>
 * <ul>
 *   <li>{@code question}: the user's question as typed</li>
 *   <li>{@code context}: the packed context text, or a note that nothing was found</li>
 *   <li>{@code conversation}: the locked case and the last {@value #CONTEXT_TURNS} exchanges,
 *       answers cut at {@value #ANSWER_PREVIEW_CHARS} characters</li>
 * </ul>
 */
public class PromptAssembler {

    static final int CONTEXT_TURNS = 3;
    static final int ANSWER_PREVIEW_CHARS = 200;
    static final String NO_CONTEXT = "No relevant legal documents were retrieved.";

    /**
     * The two messages plus the name of the template they came from.
     */
    public record AssembledPrompt(String templateName, String systemPrompt, String userPrompt) {}

    public AssembledPrompt assemble(AnswerTemplate template, String question, PackedContext context,
                                    List<ConversationTurn> history, ActiveCaseContext activeCase) {
        String contextText = context == null || context.contextText() == null || context.contextText().isBlank()
                ? NO_CONTEXT
                : context.contextText();
        Map<String, Object> variables = Map.of(
                "question", question == null ? "" : question,
                "context", contextText,
                "conversation", conversationContext(history, activeCase));
        String user = PromptTemplate.from(template.userTemplate()).apply(variables).text();
        return new AssembledPrompt(template.name(), template.systemPrompt(), user);
    }

    static String conversationContext(List<ConversationTurn> history, ActiveCaseContext activeCase) {
        List<String> lines = new ArrayList<>();
        if (activeCase != null) {
            lines.add("ACTIVE CASE: " + activeCase.displayReference());
        }
        if (history != null && !history.isEmpty()) {
            List<ConversationTurn> recent = history.subList(Math.max(0, history.size() - CONTEXT_TURNS), history.size());
            lines.add("CONVERSATION CONTEXT:");
            int i = 1;
            for (ConversationTurn turn : recent) {
                lines.add("Previous Q" + i + ": " + turn.query());
                lines.add("Previous A" + i + ": " + preview(turn.answer()));
                i++;
            }
        }
        return String.join("\n", lines);
    }

    private static String preview(String answer) {
        if (answer == null) {
            return "";
        }
        return answer.length() > ANSWER_PREVIEW_CHARS ? answer.substring(0, ANSWER_PREVIEW_CHARS) + "..." : answer;
    }
}
