package com.eainde.legalqa.prompt;

import java.util.List;
import java.util.Set;

/**
 * The built-in templates. Generic templates come first so that a question type without a matching
 * domain falls back to them rather than to a domain specialist.
 */
final class LegalPromptTemplates {

    static final String CONSTITUTIONAL = "constitutional_law";
    static final String CRIMINAL = "criminal_law";
    static final String CIVIL = "civil_law";
    static final String FAMILY = "family_law";
    static final String PROCEDURAL = "procedural_guidance";
    static final String GENERAL = "general_legal";
    static final String CASE_ANALYSIS = "case_analysis";

    private static final String ANSWER_RULES = """

            ANSWER RULES
            - Answer from the retrieved legal context. Synthesize it; do not copy it.
            - When the context is not relevant or is insufficient, say so, then give general guidance.
            - Use the conversation context to resolve pronouns and references to earlier questions.
            - Never invent case numbers, citations, dates or names of judges.
            - Cite the case number and court for every case you rely on.
            - Number procedural steps continuously (Step 1, Step 2, ...), never by section numbers.
            """;

    private static final String USER_TEMPLATE = """
            Question: {{question}}

            Retrieved Legal Context:
            {{context}}

            {{conversation}}

            %s

            Answer:""";

    private LegalPromptTemplates() {
    }

    static List<AnswerTemplate> all() {
        return List.of(
                new AnswerTemplate(CASE_ANALYSIS, """
                        You are a case analysis specialist for Pakistani court records. For a case, report its number
                        and title, the court and bench, the parties and their advocates, the facts, the issues, the
                        holding and the current status or short order.""" + ANSWER_RULES,
                        user("Summarise the case: parties, bench, issues, holding and current status."),
                        Set.of(QueryType.CASE_INQUIRY, QueryType.JUDGE_INQUIRY, QueryType.LAWYER_INQUIRY,
                                QueryType.CITATION_LOOKUP),
                        Set.of(LegalDomain.GENERAL)),
                new AnswerTemplate(PROCEDURAL, """
                        You are a court procedure specialist for Pakistani courts: filing, jurisdiction, court fees,
                        hearings, adjournments, appeals, revisions and review. Give a practical, ordered sequence of
                        steps with the documents and deadlines each step needs.""" + ANSWER_RULES,
                        user("Give the procedure as ordered steps, with documents and deadlines."),
                        Set.of(QueryType.PROCEDURAL_GUIDANCE),
                        Set.of(LegalDomain.PROCEDURAL)),
                new AnswerTemplate(GENERAL, """
                        You are a legal research assistant for Pakistani law. Explain the legal position clearly,
                        ground it in statutes and case law from the retrieved context, and point out where
                        professional advice is needed.""" + ANSWER_RULES,
                        user("Explain the legal position and the sources it rests on."),
                        Set.of(QueryType.GENERAL_LEGAL, QueryType.LAW_RESEARCH),
                        Set.of(LegalDomain.GENERAL)),
                new AnswerTemplate(CONSTITUTIONAL, """
                        You are a constitutional law specialist for Pakistani law: the Constitution of Pakistan,
                        fundamental rights, Article 199 writ jurisdiction (habeas corpus, mandamus, certiorari,
                        prohibition, quo warranto), judicial review and public interest litigation.
                        Start with the relevant constitutional provision, analyse it with case law, then explain
                        the available remedies and their limits.""" + ANSWER_RULES,
                        user("Identify the constitutional provision first, then the remedy and how to pursue it."),
                        Set.of(QueryType.CONSTITUTIONAL_QUESTION, QueryType.CASE_INQUIRY),
                        Set.of(LegalDomain.CONSTITUTIONAL)),
                new AnswerTemplate(CRIMINAL, """
                        You are a criminal law specialist for Pakistani law: the Pakistan Penal Code, the Code of
                        Criminal Procedure, bail, FIR registration, trial, sentencing and criminal appeals.
                        Reference the specific PPC and CrPC sections, explain the procedure, and state the rights
                        and safeguards of the accused. Stress the importance of legal representation.""" + ANSWER_RULES,
                        user("Name the applicable PPC / CrPC sections and explain the procedure that follows."),
                        Set.of(QueryType.CRIMINAL_LAW, QueryType.PROCEDURAL_GUIDANCE),
                        Set.of(LegalDomain.CRIMINAL)),
                new AnswerTemplate(CIVIL, """
                        You are a civil law specialist for Pakistani law: the Code of Civil Procedure, property and
                        land disputes, contracts, specific relief, limitation and execution of decrees.
                        Identify the cause of action and the forum, the applicable limitation period and the relief
                        the court can grant.""" + ANSWER_RULES,
                        user("State the cause of action, the competent forum and the relief available."),
                        Set.of(QueryType.CIVIL_LAW, QueryType.PROPERTY_LAW),
                        Set.of(LegalDomain.CIVIL, LegalDomain.PROPERTY)),
                new AnswerTemplate(FAMILY, """
                        You are a family law specialist for Pakistani law: the Muslim Family Laws Ordinance,
                        the Family Courts Act, divorce and khula, maintenance, custody and guardianship, dower and
                        inheritance. Treat the welfare of minors as paramount and explain the family court process.""" + ANSWER_RULES,
                        user("Explain the family court position, with the welfare of any minor in mind."),
                        Set.of(QueryType.FAMILY_LAW),
                        Set.of(LegalDomain.FAMILY)));
    }

    private static String user(String instruction) {
        return USER_TEMPLATE.formatted(instruction);
    }
}
