package com.eainde.legalqa.config;

import com.eainde.legalqa.context.ChunkClassifier;
import com.eainde.legalqa.context.TokenBudgetPacker;
import com.eainde.legalqa.context.TokenCounter;
import com.eainde.legalqa.conversation.CaseLockCache;
import com.eainde.legalqa.conversation.ConversationAccessor;
import com.eainde.legalqa.conversation.ConversationStore;
import com.eainde.legalqa.conversation.ConversationSummarizer;
import com.eainde.legalqa.conversation.InMemoryConversationStore;
import com.eainde.legalqa.conversation.JdbcConversationStore;
import com.eainde.legalqa.generation.AnswerGenerator;
import com.eainde.legalqa.generation.ChatModelAnswerGenerator;
import com.eainde.legalqa.generation.ConfidenceEstimator;
import com.eainde.legalqa.guardrail.GuardrailEvaluator;
import com.eainde.legalqa.guardrail.HallucinationDetector;
import com.eainde.legalqa.guardrail.ResponseQualityScorer;
import com.eainde.legalqa.pipeline.AnswerPostProcessor;
import com.eainde.legalqa.pipeline.PipelineOrchestrator;
import com.eainde.legalqa.prompt.PromptAssembler;
import com.eainde.legalqa.prompt.PromptTemplateSelector;
import com.eainde.legalqa.resolver.CaseResolver;
import com.eainde.legalqa.resolver.FollowUpDetector;
import com.eainde.legalqa.resolver.QueryRewriter;
import com.eainde.legalqa.resolver.TopicClassifier;
import com.eainde.legalqa.retrieval.ContentRetrieverLegalRetriever;
import com.eainde.legalqa.retrieval.LegalRetriever;
import com.eainde.legalqa.retrieval.TimeBoundedLegalRetriever;
import com.eainde.legalqa.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.rag.content.retriever.ContentRetriever;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * Wires the answering pipeline from {@link LegalQaProperties}.
 *
 * <h3>Beans the application must supply:</h3>
 * <ul>
 *   <li>a LangChain4j {@link ContentRetriever} over the legal corpus, or a {@link LegalRetriever}</li>
 *   <li>a LangChain4j {@link ChatModel}, or an {@link AnswerGenerator}; a {@link StreamingChatModel}
 *       is used for streaming when present</li>
 * </ul>
 *
 * <p>{@code legalqa.store.type=jdbc} stores conversations through {@link JdbcTemplate} (tables from
 * {@code schema.sql}); anything else keeps them in memory.</p>
 */
@Configuration
@EnableConfigurationProperties(LegalQaProperties.class)
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    // ===== Context packing =====

    @Bean
    public TokenCounter tokenCounter(LegalQaProperties properties) {
        return new TokenCounter(properties.packing().exactTokenizer());
    }

    @Bean
    public ChunkClassifier chunkClassifier(TokenCounter tokenCounter, Clock clock) {
        return new ChunkClassifier(tokenCounter, clock);
    }

    @Bean
    public TokenBudgetPacker tokenBudgetPacker(LegalQaProperties properties, TokenCounter tokenCounter) {
        return TokenBudgetPacker.fromProperties(properties.packing(), tokenCounter);
    }

    // ===== Conversation =====

    @Bean
    @ConditionalOnProperty(prefix = "legalqa.store", name = "type", havingValue = "jdbc")
    public ConversationStore jdbcConversationStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        log.info("Conversation store: JDBC");
        return new JdbcConversationStore(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(ConversationStore.class)
    public ConversationStore inMemoryConversationStore() {
        log.info("Conversation store: in-memory");
        return new InMemoryConversationStore();
    }

    @Bean
    public CaseLockCache caseLockCache(LegalQaProperties properties) {
        LegalQaProperties.Conversation conversation = properties.conversation();
        return new CaseLockCache(conversation.lockCacheSize(), conversation.lockCacheTtl());
    }

    @Bean
    public ConversationAccessor conversationAccessor(ConversationStore store, CaseLockCache lockCache,
                                                     LegalQaProperties properties, Clock clock) {
        LegalQaProperties.Conversation conversation = properties.conversation();
        ConversationSummarizer summarizer =
                new ConversationSummarizer(conversation.summaryTurns(), conversation.summaryMaxWords());
        return new ConversationAccessor(store, lockCache, summarizer, conversation.historyWindow(), clock);
    }

    // ===== Upstream adapters =====

    @Bean
    @ConditionalOnMissingBean(LegalRetriever.class)
    public LegalRetriever legalRetriever(ObjectProvider<ContentRetriever> contentRetriever) {
        ContentRetriever retriever = contentRetriever.getIfAvailable();
        if (retriever == null) {
            throw new IllegalStateException("No ContentRetriever or LegalRetriever bean is configured");
        }
        return new ContentRetrieverLegalRetriever(retriever);
    }

    @Bean
    @ConditionalOnMissingBean(AnswerGenerator.class)
    public AnswerGenerator answerGenerator(ObjectProvider<ChatModel> chatModel,
                                           ObjectProvider<StreamingChatModel> streamingChatModel,
                                           LegalQaProperties properties, TokenCounter tokenCounter) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            throw new IllegalStateException("No ChatModel or AnswerGenerator bean is configured");
        }
        StreamingChatModel streaming = streamingChatModel.getIfAvailable();
        log.info("Answer generator: {} (streaming: {})", model.getClass().getSimpleName(),
                streaming == null ? "blocking fallback" : streaming.getClass().getSimpleName());
        return new ChatModelAnswerGenerator(model, streaming,
                new ConfidenceEstimator(properties.generation().baseConfidence()), tokenCounter);
    }

    // ===== Case resolution and guardrails =====

    @Bean
    public CaseResolver caseResolver(LegalRetriever legalRetriever, MdcAwareExecutor pipelineExecutor,
                                     LegalQaProperties properties, Clock clock) {
        LegalQaProperties.Conversation conversation = properties.conversation();
        // exact case lookups run on the request thread, so they get the retrieval timeout here
        LegalRetriever bounded = new TimeBoundedLegalRetriever(legalRetriever, pipelineExecutor,
                properties.pipeline().retrievalTimeout());
        return new CaseResolver(bounded, new TopicClassifier(),
                new FollowUpDetector(conversation.overlapThreshold()),
                new QueryRewriter(conversation.rewriteMaxChars()), clock);
    }

    @Bean
    public GuardrailEvaluator guardrailEvaluator(LegalQaProperties properties) {
        return new GuardrailEvaluator(properties.guardrails(), new ResponseQualityScorer(), new HallucinationDetector());
    }

    // ===== Orchestration =====

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor pipelineExecutor(LegalQaProperties properties) {
        return new MdcAwareExecutor(properties.pipeline().workerThreads());
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(ConversationAccessor conversationAccessor,
                                                     CaseResolver caseResolver,
                                                     GuardrailEvaluator guardrailEvaluator,
                                                     LegalRetriever legalRetriever,
                                                     ChunkClassifier chunkClassifier,
                                                     TokenBudgetPacker tokenBudgetPacker,
                                                     AnswerGenerator answerGenerator,
                                                     MdcAwareExecutor pipelineExecutor,
                                                     LegalQaProperties properties) {
        return PipelineOrchestrator.builder()
                .conversations(conversationAccessor)
                .caseResolver(caseResolver)
                .guardrails(guardrailEvaluator)
                .retriever(legalRetriever)
                .classifier(chunkClassifier)
                .packer(tokenBudgetPacker)
                .templateSelector(new PromptTemplateSelector())
                .promptAssembler(new PromptAssembler())
                .generator(answerGenerator)
                .postProcessor(new AnswerPostProcessor())
                .executor(pipelineExecutor)
                .settings(properties.pipeline())
                .build();
    }
}
