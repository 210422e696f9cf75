package br.edu.ifba.graphrag.disambiguation;

import br.edu.ifba.graphrag.core.QueryParam;
import br.edu.ifba.graphrag.llm.CompletionFunction;
import br.edu.ifba.graphrag.utils.AsyncCalls;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asks the completion model for the entity names in a query, expecting a JSON array of
 * strings. Falls back to {@link HeuristicMentionExtractor} on any failure or empty result.
 */
public class LlmMentionExtractor implements MentionExtractor {

    private static final Logger logger = LoggerFactory.getLogger(LlmMentionExtractor.class);

    static final String PROMPT_TEMPLATE = """
        Extract the named entities, organizations, people, documents, products, terms or fields \
        mentioned in the question below. Answer with a JSON array of strings and nothing else.

        Question: %s
        """;

    private final CompletionFunction completion;
    private final HeuristicMentionExtractor fallback;
    private final ObjectMapper objectMapper;

    public LlmMentionExtractor(@NotNull CompletionFunction completion, @NotNull HeuristicMentionExtractor fallback,
                               @NotNull ObjectMapper objectMapper) {
        this.completion = completion;
        this.fallback = fallback;
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<List<String>> extract(@NotNull String query, @NotNull QueryParam param) {
        return AsyncCalls.withTimeout(completion.complete(String.format(PROMPT_TEMPLATE, query), ""),
                param.getCompletionCallTimeout(), "mention extraction")
            .thenApply(this::parse)
            .handle((mentions, error) -> {
                if (error != null) {
                    AsyncCalls.rethrowIfFatal(error);
                    logger.warn("LLM mention extraction failed, using heuristic extractor: {}",
                        AsyncCalls.unwrap(error).getMessage());
                    return fallback.extract(query);
                }
                return mentions.isEmpty() ? fallback.extract(query) : mentions;
            });
    }

    List<String> parse(String response) {
        int start = response.indexOf('[');
        int end = response.lastIndexOf(']');
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("No JSON array in mention extraction response");
        }
        try {
            List<String> raw = objectMapper.readValue(response.substring(start, end + 1), new TypeReference<List<String>>() { });
            List<String> mentions = new ArrayList<>();
            for (String mention : raw) {
                if (mention != null && !mention.isBlank()) {
                    mentions.add(mention.trim());
                }
            }
            return mentions;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed mention extraction response", e);
        }
    }
}
