package br.edu.ifba.graphrag.synthesis;

import br.edu.ifba.graphrag.PipelineExecutor;
import br.edu.ifba.graphrag.core.Chunk;
import br.edu.ifba.graphrag.core.Citation;
import br.edu.ifba.graphrag.core.GraphRagAnswer;
import br.edu.ifba.graphrag.core.QueryParam;
import br.edu.ifba.graphrag.core.RankedEntity;
import br.edu.ifba.graphrag.llm.CompletionFunction;
import br.edu.ifba.graphrag.storage.GraphQueryGateway;
import br.edu.ifba.graphrag.utils.AsyncCalls;
import br.edu.ifba.graphrag.utils.TextNormalizer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Turns ranked entities or retrieved chunks into a cited answer.
 *
 * <p>Evidence is fetched in one store call, deduplicated and registered for citation. The
 * completion is asked to cite evidence by number; unknown markers are removed. While the
 * confidence stays below the threshold, a bounded gap-fill loop asks the request's
 * {@link EvidenceExpander} for entities covering the missing requirements, passing the
 * entities already considered so the expansion can trace further from them, and synthesizes
 * again. The loop stops at its iteration limit or at the query deadline, in which case the
 * best answer so far is returned as provisional. A failed completion yields an extractive
 * answer built from the evidence, also provisional.</p>
 */
@ApplicationScoped
public class Synthesizer {

    private static final Logger logger = LoggerFactory.getLogger(Synthesizer.class);

    static final int EXTRACTIVE_PASSAGES = 5;

    private final EvidenceCollector collector;
    private final CompletionFunction completion;
    private final Executor executor;

    @Inject
    public Synthesizer(GraphQueryGateway gateway, CompletionFunction completion, PipelineExecutor executor) {
        this(new EvidenceCollector(gateway), completion, executor);
    }

    public Synthesizer(@NotNull EvidenceCollector collector, @NotNull CompletionFunction completion,
                       @NotNull Executor executor) {
        this.collector = collector;
        this.completion = completion;
        this.executor = executor;
    }

    public CompletableFuture<GraphRagAnswer> synthesize(@NotNull SynthesisRequest request) {
        return CompletableFuture.supplyAsync(() -> run(request), executor);
    }

    private GraphRagAnswer run(SynthesisRequest request) {
        QueryParam param = request.context().param();
        List<Chunk> evidence = request.hasDirectChunks()
            ? EvidenceCollector.deduplicate(request.chunks())
            : join(collector.collect(request.entities(), param));

        if (evidence.isEmpty()) {
            logger.debug("No evidence for route {}", request.route());
            return GraphRagAnswer.insufficientEvidence(request.route(), request.degraded());
        }

        CitationRegistry registry = new CitationRegistry();
        List<String> requirements = request.subQuestions().isEmpty()
            ? TextNormalizer.contentTerms(request.context().query())
            : request.subQuestions();
        Map<String, RankedEntity> considered = new LinkedHashMap<>();
        request.entities().forEach(entity -> considered.putIfAbsent(entity.entityId(), entity));

        Draft best = draft(request, evidence, considered.size(), registry, requirements);
        int iteration = 0;
        while (best.score().confidence() < param.getConfidenceThreshold()
                && iteration < param.getGapFillIterations()
                && !best.score().uncovered().isEmpty()) {
            if (param.isDeadlineReached()) {
                logger.info("Query deadline reached after {} gap-fill iteration(s), returning provisional answer",
                    iteration);
                return best.toAnswer(request, true);
            }
            iteration++;

            List<RankedEntity> additional = expand(request, best.score().uncovered(), considered);
            if (additional.isEmpty()) {
                break;
            }
            additional.forEach(entity -> considered.putIfAbsent(entity.entityId(), entity));

            List<Chunk> more = collectQuietly(additional, param);
            List<Chunk> merged = new ArrayList<>(evidence);
            merged.addAll(more);
            merged = EvidenceCollector.deduplicate(merged);
            if (merged.size() == evidence.size()) {
                break;
            }
            evidence = merged;

            Draft next = draft(request, evidence, considered.size(), registry, requirements);
            logger.debug("Gap-fill iteration {}: confidence {} -> {}", iteration,
                best.score().confidence(), next.score().confidence());
            if (next.score().confidence() >= best.score().confidence()) {
                best = next;
            }
        }
        return best.toAnswer(request, false);
    }

    private Draft draft(SynthesisRequest request, List<Chunk> evidence, int entitiesConsidered,
                        CitationRegistry registry, List<String> requirements) {
        QueryParam param = request.context().param();
        String evidenceBlock = AnswerPromptBuilder.evidence(evidence, registry);
        ConfidenceScorer.Score score = ConfidenceScorer.score(evidence, entitiesConsidered, request.degraded(),
            requirements);

        if (param.isDeadlineReached()) {
            return extractive(evidence, registry, score);
        }
        String prompt = AnswerPromptBuilder.prompt(request.route(), request.context().query(), request.subQuestions());
        Duration timeout = shorter(param.getCompletionCallTimeout(), param.remaining());
        String answer;
        try {
            answer = AsyncCalls.withTimeout(completion.complete(prompt, evidenceBlock), timeout, "completion").join();
        } catch (RuntimeException e) {
            AsyncCalls.rethrowIfFatal(e);
            logger.warn("Completion failed, returning extractive answer: {}", AsyncCalls.unwrap(e).getMessage());
            return extractive(evidence, registry, score);
        }
        if (answer == null || answer.isBlank()) {
            logger.warn("Completion returned an empty answer, returning extractive answer");
            return extractive(evidence, registry, score);
        }

        String cleaned = CitationValidator.stripInvalidMarkers(answer.strip(), registry);
        return new Draft(cleaned, citationsFor(cleaned, evidence, registry), score, false);
    }

    private Draft extractive(List<Chunk> evidence, CitationRegistry registry, ConfidenceScorer.Score score) {
        StringBuilder answer = new StringBuilder("The evidence contains the following relevant passages:\n");
        List<Citation> cited = new ArrayList<>();
        for (Chunk chunk : evidence.subList(0, Math.min(EXTRACTIVE_PASSAGES, evidence.size()))) {
            Citation citation = registry.register(chunk);
            cited.add(citation);
            answer.append("- ").append(citation.textPreview()).append(" [").append(citation.id()).append("]\n");
        }
        return new Draft(answer.toString().strip(), cited, score, true);
    }

    private static List<Citation> citationsFor(String answer, List<Chunk> evidence, CitationRegistry registry) {
        List<Citation> cited = new ArrayList<>();
        for (Integer id : CitationValidator.referencedIds(answer)) {
            Citation citation = registry.get(id);
            if (citation != null) {
                cited.add(citation);
            }
        }
        if (!cited.isEmpty()) {
            return cited;
        }
        return evidence.stream().map(registry::register).toList();
    }

    private List<RankedEntity> expand(SynthesisRequest request, List<String> gaps,
                                      Map<String, RankedEntity> considered) {
        try {
            List<RankedEntity> known = List.copyOf(considered.values());
            return join(request.expander().expand(gaps, known, request.context())).stream()
                .filter(entity -> !considered.containsKey(entity.entityId()))
                .toList();
        } catch (RuntimeException e) {
            AsyncCalls.rethrowIfFatal(e);
            logger.warn("Gap-fill expansion failed, keeping current answer: {}", AsyncCalls.unwrap(e).getMessage());
            return List.of();
        }
    }

    private List<Chunk> collectQuietly(List<RankedEntity> entities, QueryParam param) {
        try {
            return join(collector.collect(entities, param));
        } catch (RuntimeException e) {
            AsyncCalls.rethrowIfFatal(e);
            logger.warn("Gap-fill evidence retrieval failed: {}", AsyncCalls.unwrap(e).getMessage());
            return List.of();
        }
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw AsyncCalls.asUnchecked(AsyncCalls.unwrap(e));
        }
    }

    private static Duration shorter(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private record Draft(String answer, List<Citation> citations, ConfidenceScorer.Score score, boolean provisional) {

        GraphRagAnswer toAnswer(SynthesisRequest request, boolean deadlineReached) {
            return new GraphRagAnswer(request.route(), answer, citations, score.confidence(),
                provisional || deadlineReached, request.degraded());
        }
    }
}
