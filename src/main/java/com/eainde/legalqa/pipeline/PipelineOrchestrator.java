package com.eainde.legalqa.pipeline;

import com.eainde.legalqa.config.LegalQaProperties;
import com.eainde.legalqa.context.ChunkClassifier;
import com.eainde.legalqa.context.TokenBudgetPacker;
import com.eainde.legalqa.conversation.ConversationAccessor;
import com.eainde.legalqa.conversation.ConversationState;
import com.eainde.legalqa.exception.ConversationStoreException;
import com.eainde.legalqa.exception.GenerationException;
import com.eainde.legalqa.exception.RetrievalException;
import com.eainde.legalqa.generation.AnswerGenerator;
import com.eainde.legalqa.generation.GenerationResult;
import com.eainde.legalqa.generation.GenerationStreamHandler;
import com.eainde.legalqa.guardrail.GuardrailEvaluator;
import com.eainde.legalqa.model.AccessLevel;
import com.eainde.legalqa.model.ActiveCaseContext;
import com.eainde.legalqa.model.AnswerStatus;
import com.eainde.legalqa.model.ClassifiedChunk;
import com.eainde.legalqa.model.ConversationTurn;
import com.eainde.legalqa.model.GuardrailVerdict;
import com.eainde.legalqa.model.PackedContext;
import com.eainde.legalqa.model.RawPassage;
import com.eainde.legalqa.model.SourceReference;
import com.eainde.legalqa.prompt.AnswerTemplate;
import com.eainde.legalqa.prompt.CitationFormatter;
import com.eainde.legalqa.prompt.LegalDomain;
import com.eainde.legalqa.prompt.PromptAssembler;
import com.eainde.legalqa.prompt.PromptTemplateSelector;
import com.eainde.legalqa.prompt.QueryClassifier;
import com.eainde.legalqa.prompt.QueryType;
import com.eainde.legalqa.resolver.CaseResolution;
import com.eainde.legalqa.resolver.CaseResolver;
import com.eainde.legalqa.retrieval.LegalRetriever;
import lombok.Builder;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Answers one legal question end to end.
 *
 * <h3>Stages:</h3>
 * <pre>
 * load session → resolve case lock → check query
 *   → retrieve (locked case, else search on the standalone query)
 *   → classify + deduplicate + pack
 *   → select template → assemble prompt → generate
 *   → post-process → check response → persist turn and lock
 * </pre>
 *
 * <h3>Terminal statuses:</h3>
 * <ul>
 *   <li>{@code blocked}: a guardrail denied the query or the answer; the text is the safe response</li>
 *   <li>{@code no_results}: retrieval found nothing</li>
 *   <li>{@code context_error}: retrieval failed or timed out, or no context could be packed</li>
 *   <li>{@code generation_error}: the generator failed or timed out</li>
 *   <li>{@code error}: invalid input or any unexpected failure</li>
 * </ul>
 *
 * <p>This is the only class that turns exceptions into user-facing text: both entry points always
 * return a well-formed {@link AnswerResult}. Retriever and generator calls run on the worker
 * executor with bounded timeouts. A store failure while persisting is logged and does not change
 * the answer.</p>
 *
 * <h3>Streaming:</h3>
 * <p>{@link #answerStream} forwards generator increments as they arrive and checks the response
 * once, on the full text. When the answer is denied after streaming, the final chunk carries the
 * safe response with status {@code blocked} and the client replaces what it displayed.</p>
 */
@Log4j2
public class PipelineOrchestrator {

    static final String EMPTY_QUESTION_MESSAGE = "Please enter a question.";
    static final String NO_RESULTS_MESSAGE = "I couldn't find relevant legal information to answer your question. "
            + "Please try rephrasing your question or consult with a qualified legal professional.";
    static final String CONTEXT_ERROR_MESSAGE = "I encountered an error processing the legal documents. "
            + "Please try again or consult with a legal professional.";
    static final String GENERATION_ERROR_MESSAGE = "I encountered an error generating the answer. "
            + "Please try again or consult with a legal professional.";
    static final String ERROR_MESSAGE = "I encountered an unexpected error while processing your question. "
            + "Please try again or consult with a legal professional.";

    private final ConversationAccessor conversations;
    private final CaseResolver caseResolver;
    private final GuardrailEvaluator guardrails;
    private final LegalRetriever retriever;
    private final ChunkClassifier classifier;
    private final TokenBudgetPacker packer;
    private final PromptTemplateSelector templateSelector;
    private final PromptAssembler promptAssembler;
    private final AnswerGenerator generator;
    private final AnswerPostProcessor postProcessor;
    private final Executor executor;
    private final LegalQaProperties.Pipeline settings;

    @Builder
    public PipelineOrchestrator(ConversationAccessor conversations, CaseResolver caseResolver,
                                GuardrailEvaluator guardrails, LegalRetriever retriever,
                                ChunkClassifier classifier, TokenBudgetPacker packer,
                                PromptTemplateSelector templateSelector, PromptAssembler promptAssembler,
                                AnswerGenerator generator, AnswerPostProcessor postProcessor,
                                Executor executor, LegalQaProperties.Pipeline settings) {
        this.conversations = conversations;
        this.caseResolver = caseResolver;
        this.guardrails = guardrails;
        this.retriever = retriever;
        this.classifier = classifier;
        this.packer = packer;
        this.templateSelector = templateSelector != null ? templateSelector : new PromptTemplateSelector();
        this.promptAssembler = promptAssembler != null ? promptAssembler : new PromptAssembler();
        this.generator = generator;
        this.postProcessor = postProcessor != null ? postProcessor : new AnswerPostProcessor();
        this.executor = executor != null ? executor : Runnable::run;
        this.settings = settings != null ? settings : LegalQaProperties.Pipeline.defaults();
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public AnswerResult answer(AnswerRequest request) {
        if (request == null) {
            return AnswerResult.terminal(AnswerStatus.ERROR, EMPTY_QUESTION_MESSAGE, null, Map.of(), null);
        }
        Exchange exchange = new Exchange(request);
        try (MdcScope ignored = MdcScope.open(exchange)) {
            log.info("Answering question for session {} ({} chars)", exchange.sessionId, length(request.question()));
            AnswerResult early = prepare(exchange);
            if (early != null) {
                return early;
            }

            GenerationResult generation;
            try {
                generation = exchange.timings.time("generation", () -> withTimeout(
                        () -> generator.generate(exchange.prompt.systemPrompt(), exchange.prompt.userPrompt(), List.of()),
                        settings.generationTimeout(), "Generation"));
            } catch (GenerationException e) {
                log.error("Generation failed: {}", e.getMessage());
                generation = GenerationResult.failure(e.getMessage());
            }
            return finish(exchange, generation);
        } catch (RuntimeException e) {
            log.error("Unexpected failure answering question", e);
            return exchange.terminal(AnswerStatus.ERROR, ERROR_MESSAGE, null);
        }
    }

    /**
     * Streams the answer to {@code observer}: {@code CONTENT} increments, then one {@code COMPLETE}
     * or {@code ERROR} chunk. Nothing is forwarded or stored once {@code cancellation} is set.
     *
     * @return the same result carried by the final chunk
     */
    public AnswerResult answerStream(AnswerRequest request, StreamObserver observer, CancellationSignal cancellation) {
        CancellationSignal signal = cancellation != null ? cancellation : new CancellationSignal();
        if (request == null) {
            AnswerResult invalid = AnswerResult.terminal(AnswerStatus.ERROR, EMPTY_QUESTION_MESSAGE, null, Map.of(), null);
            emitFinal(observer, signal, invalid);
            return invalid;
        }
        Exchange exchange = new Exchange(request);
        try (MdcScope ignored = MdcScope.open(exchange)) {
            log.info("Streaming answer for session {} ({} chars)", exchange.sessionId, length(request.question()));
            AnswerResult early = prepare(exchange);
            if (early != null) {
                emitFinal(observer, signal, early);
                return early;
            }

            GenerationResult generation = exchange.timings.time("generation",
                    () -> stream(exchange, observer, signal));

            if (signal.isCancelled()) {
                log.info("Stream cancelled by caller, exchange not stored");
                return exchange.terminal(AnswerStatus.ERROR, "Request cancelled.", null);
            }
            AnswerResult result = finish(exchange, generation);
            emitFinal(observer, signal, result);
            return result;
        } catch (RuntimeException e) {
            log.error("Unexpected failure streaming answer", e);
            AnswerResult result = exchange.terminal(AnswerStatus.ERROR, ERROR_MESSAGE, null);
            emitFinal(observer, signal, result);
            return result;
        }
    }

    // =========================================================================
    //  Stages up to the prompt
    // =========================================================================

    /**
     * Runs every stage before generation. Returns a terminal result when the exchange stops early,
     * {@code null} when the prompt is ready.
     */
    private AnswerResult prepare(Exchange ex) {
        String question = ex.request.question();
        if (question == null || question.isBlank()) {
            return ex.terminal(AnswerStatus.ERROR, EMPTY_QUESTION_MESSAGE, null);
        }
        if (question.length() > settings.maxQueryLength()) {
            return ex.terminal(AnswerStatus.ERROR, "Your question is too long. Please shorten it to "
                    + settings.maxQueryLength() + " characters or fewer.", null);
        }

        ex.state = ex.timings.time("session", () -> conversations.load(ex.sessionId, ex.request.userId()));
        ex.metadata.put("conversationDegraded", ex.state.degraded());

        ex.resolution = ex.timings.time("caseResolution", () -> caseResolver.resolve(question, ex.state));
        recordResolution(ex);

        ex.queryVerdict = ex.timings.time("queryCheck", () -> guardrails.checkQuery(question, ex.accessLevel));
        ex.metadata.put("riskFactors", ex.queryVerdict.riskFactors());
        if (!ex.queryVerdict.allowed()) {
            log.info("Query blocked: {}", ex.queryVerdict.errors());
            return ex.terminal(AnswerStatus.BLOCKED, ex.queryVerdict.safeResponse(), ex.queryVerdict);
        }

        List<RawPassage> passages;
        try {
            passages = ex.timings.time("retrieval", () -> retrieve(ex));
        } catch (RetrievalException e) {
            log.error("Retrieval failed: {}", e.getMessage());
            ex.metadata.put("retrievalError", e.getMessage());
            return ex.terminal(AnswerStatus.CONTEXT_ERROR, CONTEXT_ERROR_MESSAGE, ex.queryVerdict);
        }
        ex.metadata.put("retrievalResults", passages.size());
        if (passages.isEmpty()) {
            log.info("No passages retrieved for '{}'", ex.resolution.standaloneQuery());
            persist(ex, NO_RESULTS_MESSAGE, AnswerStatus.NO_RESULTS, 0.0, List.of());
            return ex.terminal(AnswerStatus.NO_RESULTS, NO_RESULTS_MESSAGE, ex.queryVerdict);
        }

        List<ClassifiedChunk> chunks = ex.timings.time("classification", () -> classifier.classifyAll(passages));
        ex.metadata.put("classifiedChunks", chunks.size());
        if (chunks.isEmpty()) {
            log.info("None of the {} retrieved passages carried usable text", passages.size());
            persist(ex, NO_RESULTS_MESSAGE, AnswerStatus.NO_RESULTS, 0.0, List.of());
            return ex.terminal(AnswerStatus.NO_RESULTS, NO_RESULTS_MESSAGE, ex.queryVerdict);
        }

        ex.packed = ex.timings.time("packing", () -> pack(chunks));
        ex.metadata.put("contextChunks", ex.packed.chunkCount());
        ex.metadata.put("contextTokens", ex.packed.tokenCount());
        ex.metadata.put("sourceTypes", ex.packed.typeCounts());
        ex.metadata.put("packing", ex.packed.packingMetadata(packer.maxTokens()));
        if (!ex.packed.isSuccess() || ex.packed.isEmpty()) {
            return ex.terminal(AnswerStatus.CONTEXT_ERROR, CONTEXT_ERROR_MESSAGE, ex.queryVerdict);
        }
        ex.sources = CitationFormatter.fromChunks(ex.packed.chunks());

        QueryType queryType = QueryClassifier.classifyQueryType(question);
        LegalDomain domain = QueryClassifier.classifyDomain(question, passages);
        AnswerTemplate template = templateSelector.selectTemplate(queryType, domain, ex.state.recentTurns());
        ex.prompt = promptAssembler.assemble(template, question, ex.packed, ex.state.recentTurns(),
                ex.resolution.activeCase());
        ex.metadata.put("queryType", queryType);
        ex.metadata.put("legalDomain", domain);
        ex.metadata.put("template", template.name());
        log.info("Prompt ready: template={}, chunks={}, tokens={}", template.name(),
                ex.packed.chunkCount(), ex.packed.tokenCount());
        return null;
    }

    private void recordResolution(Exchange ex) {
        CaseResolution resolution = ex.resolution;
        ex.metadata.put("standaloneQuery", resolution.standaloneQuery());
        ex.metadata.put("caseLock", resolution.state());
        ex.metadata.put("lockReason", resolution.reason());
        ex.metadata.put("lockChanged", resolution.lockChanged());
        if (resolution.isLocked()) {
            ex.metadata.put("lockedCaseId", resolution.lockedCaseId());
        }
        ex.metadata.put("followUpSignals", resolution.followUpSignals());
    }

    private List<RawPassage> retrieve(Exchange ex) {
        CaseResolution resolution = ex.resolution;
        if (resolution.isLocked()) {
            List<RawPassage> casePassages = withTimeout(() -> retriever.getByCaseId(resolution.lockedCaseId()),
                    settings.retrievalTimeout(), "Retrieval");
            if (!casePassages.isEmpty()) {
                return casePassages;
            }
            log.info("No passages stored for locked case {}, falling back to search", resolution.lockedCaseId());
        }
        return withTimeout(() -> retriever.search(resolution.standaloneQuery(), settings.topK(), ex.request.filters()),
                settings.retrievalTimeout(), "Retrieval");
    }

    private PackedContext pack(List<ClassifiedChunk> chunks) {
        PackedContext packed = packer.pack(chunks);
        if (packed.isSuccess()) {
            return packed;
        }
        log.warn("Packing failed ({}), falling back to a single-chunk context", packed.errorMessage());
        return packer.packSingle(chunks);
    }

    // =========================================================================
    //  Stages after generation
    // =========================================================================

    private AnswerResult finish(Exchange ex, GenerationResult generation) {
        ex.metadata.put("tokensUsed", generation.tokensUsed());
        if (!generation.isSuccess()) {
            ex.metadata.put("generationError", generation.error());
            return ex.terminal(AnswerStatus.GENERATION_ERROR, GENERATION_ERROR_MESSAGE, ex.queryVerdict);
        }

        String answer = ex.timings.time("postProcessing", () -> postProcess(generation.text()));

        GuardrailVerdict verdict = ex.timings.time("responseCheck", () -> guardrails.checkResponse(
                ex.request.question(), answer, ex.sources, generation.confidence(), ex.accessLevel));
        ex.metadata.put("guardrailWarnings", verdict.warnings());
        ex.metadata.put("riskLevel", verdict.riskLevel());

        if (!verdict.allowed()) {
            log.info("Response blocked: {}", verdict.warnings());
            persist(ex, verdict.safeResponse(), AnswerStatus.BLOCKED, 0.0, List.of());
            return ex.terminal(AnswerStatus.BLOCKED, verdict.safeResponse(), verdict);
        }

        persist(ex, answer, AnswerStatus.SUCCESS, generation.confidence(), ex.sources);
        ex.metadata.put("timingsMs", ex.timings.snapshot());
        log.info("Answered with confidence {} from {} sources in {} ms", generation.confidence(),
                ex.sources.size(), ex.timings.totalMillis());
        return new AnswerResult(answer, generation.confidence(), ex.sources, AnswerStatus.SUCCESS,
                ex.metadata, ex.sessionId, verdict);
    }

    private String postProcess(String text) {
        try {
            return postProcessor.process(text);
        } catch (RuntimeException e) {
            log.warn("Post-processing failed, keeping the raw answer: {}", e.getMessage());
            return text;
        }
    }

    private void persist(Exchange ex, String answer, AnswerStatus status, double confidence,
                         List<SourceReference> sources) {
        ActiveCaseContext activeCase = ex.resolution.activeCase();
        ConversationTurn turn = new ConversationTurn(ex.sessionId, 0, ex.request.question(),
                ex.resolution.standaloneQuery(), answer, status, confidence,
                activeCase == null ? null : activeCase.caseId(), sources, null);
        try {
            ex.timings.time("persistence", () -> conversations.recordExchange(ex.state.session(), turn, activeCase));
            ex.metadata.put("persisted", true);
        } catch (ConversationStoreException e) {
            log.warn("Could not store turn for session {}: {}", ex.sessionId, e.getMessage());
            ex.metadata.put("persisted", false);
        }
    }

    // =========================================================================
    //  Streaming
    // =========================================================================

    private GenerationResult stream(Exchange ex, StreamObserver observer, CancellationSignal signal) {
        CompletableFuture<GenerationResult> done = new CompletableFuture<>();
        // guards CONTENT forwarding against completion, so nothing follows the final chunk
        Object forwarding = new Object();
        Runnable call = () -> generator.generateStream(ex.prompt.systemPrompt(), ex.prompt.userPrompt(),
                new GenerationStreamHandler() {
                    @Override
                    public void onContent(String increment) {
                        if (increment == null || increment.isEmpty()) {
                            return;
                        }
                        synchronized (forwarding) {
                            if (!signal.isCancelled() && !done.isDone()) {
                                observer.onChunk(StreamChunk.content(increment));
                            }
                        }
                    }

                    @Override
                    public void onComplete(GenerationResult result) {
                        done.complete(result);
                    }

                    @Override
                    public void onError(Throwable error) {
                        done.complete(GenerationResult.failure(String.valueOf(error.getMessage())));
                    }
                });
        FutureTask<Void> task = new FutureTask<>(() -> {
            try {
                call.run();
            } catch (RuntimeException e) {
                done.complete(GenerationResult.failure(e.getMessage()));
            }
        }, null);
        executor.execute(task);

        Duration timeout = settings.streamTimeout();
        try {
            return done.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.error("Streaming generation timed out after {}", timeout);
            return abandon(task, done, forwarding,
                    GenerationResult.failure("Streaming generation timed out after " + timeout));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return abandon(task, done, forwarding, GenerationResult.failure("Interrupted while streaming"));
        } catch (ExecutionException e) {
            return abandon(task, done, forwarding, GenerationResult.failure(String.valueOf(e.getCause().getMessage())));
        }
    }

    /**
     * Closes the stream to late increments and interrupts the generator. If the generator
     * finished in the meantime its result wins.
     */
    private static GenerationResult abandon(FutureTask<Void> task, CompletableFuture<GenerationResult> done,
                                            Object forwarding, GenerationResult failure) {
        synchronized (forwarding) {
            done.complete(failure);
        }
        task.cancel(true);
        return done.getNow(failure);
    }

    private static void emitFinal(StreamObserver observer, CancellationSignal signal, AnswerResult result) {
        if (signal.isCancelled()) {
            return;
        }
        try {
            observer.onChunk(result.isSuccess() ? StreamChunk.complete(result) : StreamChunk.error(result));
        } catch (RuntimeException e) {
            log.warn("Stream observer rejected the final chunk: {}", e.getMessage());
        }
    }

    // =========================================================================
    //  Internals
    // =========================================================================

    /**
     * Runs a blocking upstream call on the worker executor, bounded by {@code timeout}. Failures
     * surface as {@link RetrievalException} or {@link GenerationException} depending on {@code stage}.
     */
    private <T> T withTimeout(Supplier<T> call, Duration timeout, String stage) {
        // FutureTask.cancel(true) interrupts the worker running it, whatever the executor
        FutureTask<T> future = new FutureTask<>(call::get);
        executor.execute(future);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw upstream(stage, stage + " timed out after " + timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw upstream(stage, stage + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RetrievalException re) {
                throw re;
            }
            if (cause instanceof GenerationException ge) {
                throw ge;
            }
            throw upstream(stage, stage + " failed: " + cause.getMessage(), cause);
        }
    }

    private static RuntimeException upstream(String stage, String message, Throwable cause) {
        return "Retrieval".equals(stage)
                ? new RetrievalException(message, cause)
                : new GenerationException(message, cause);
    }

    private static int length(String text) {
        return text == null ? 0 : text.length();
    }

    /**
     * Mutable per-request scratch space. Never shared between requests.
     */
    private final class Exchange {
        final AnswerRequest request;
        final String sessionId;
        final String requestId = UUID.randomUUID().toString();
        final AccessLevel accessLevel;
        final StageTimer timings = new StageTimer();
        final Map<String, Object> metadata = new LinkedHashMap<>();

        ConversationState state;
        CaseResolution resolution;
        GuardrailVerdict queryVerdict;
        PackedContext packed;
        List<SourceReference> sources = new ArrayList<>();
        PromptAssembler.AssembledPrompt prompt;

        Exchange(AnswerRequest request) {
            this.request = request;
            this.sessionId = request.sessionId() == null || request.sessionId().isBlank()
                    ? UUID.randomUUID().toString()
                    : request.sessionId();
            this.accessLevel = request.accessLevel() != null ? request.accessLevel() : settings.defaultAccessLevel();
            metadata.put("requestId", requestId);
        }

        AnswerResult terminal(AnswerStatus status, String message, GuardrailVerdict verdict) {
            metadata.put("timingsMs", timings.snapshot());
            log.info("Finished with status {} in {} ms", status.wireName(), timings.totalMillis());
            return AnswerResult.terminal(status, message, sessionId, metadata, verdict);
        }
    }

    /**
     * Puts {@code sessionId} and {@code requestId} in the MDC for the duration of a request.
     */
    private static final class MdcScope implements AutoCloseable {

        static MdcScope open(Exchange exchange) {
            MDC.put("sessionId", exchange.sessionId);
            MDC.put("requestId", exchange.requestId);
            return new MdcScope();
        }

        @Override
        public void close() {
            MDC.remove("sessionId");
            MDC.remove("requestId");
        }
    }
}
