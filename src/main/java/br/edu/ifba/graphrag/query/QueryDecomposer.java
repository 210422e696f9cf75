package br.edu.ifba.graphrag.query;

import br.edu.ifba.graphrag.core.QueryContext;
import br.edu.ifba.graphrag.llm.CompletionFunction;
import br.edu.ifba.graphrag.utils.AsyncCalls;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Splits a compound question into at most {@code maxSubQuestions} self-contained sub-questions.
 * Asks the completion model first and falls back to splitting on question marks and on
 * "and" before a question word.
 */
public class QueryDecomposer {

    private static final Logger logger = LoggerFactory.getLogger(QueryDecomposer.class);

    static final String PROMPT_TEMPLATE = """
        Break the question below into at most %d simpler, self-contained questions that together \
        answer it. Repeat entity names instead of using pronouns. Answer with a JSON array of \
        strings and nothing else.

        Question: %s
        """;

    private static final Pattern SPLIT = Pattern.compile(
        "\\?\\s*|\\s*[,;]?\\s+and\\s+(?=(what|who|which|when|where|how|why|does|do|is|are)\\b)",
        Pattern.CASE_INSENSITIVE);
    private static final int MIN_SUB_QUESTION_LENGTH = 3;

    private final CompletionFunction completion;
    private final ObjectMapper objectMapper;

    public QueryDecomposer(@NotNull CompletionFunction completion, @NotNull ObjectMapper objectMapper) {
        this.completion = completion;
        this.objectMapper = objectMapper;
    }

    public CompletableFuture<List<String>> decompose(@NotNull QueryContext context) {
        int max = context.param().getMaxSubQuestions();
        String query = context.query();
        return AsyncCalls.withTimeout(completion.complete(String.format(PROMPT_TEMPLATE, max, query), ""),
                context.param().getCompletionCallTimeout(), "query decomposition")
            .thenApply(response -> limit(parse(response), max))
            .handle((questions, error) -> {
                if (error != null) {
                    AsyncCalls.rethrowIfFatal(error);
                    logger.warn("Query decomposition failed, splitting heuristically: {}",
                        AsyncCalls.unwrap(error).getMessage());
                    return split(query, max);
                }
                return questions.isEmpty() ? split(query, max) : questions;
            });
    }

    /**
     * Heuristic split; returns the whole query when nothing splits.
     */
    @NotNull
    public static List<String> split(@NotNull String query, int max) {
        List<String> parts = new ArrayList<>();
        for (String part : SPLIT.split(query.strip())) {
            String trimmed = part.strip();
            if (trimmed.length() >= MIN_SUB_QUESTION_LENGTH) {
                parts.add(trimmed.endsWith("?") ? trimmed : trimmed + "?");
            }
        }
        if (parts.isEmpty()) {
            parts.add(query.strip());
        }
        return limit(parts, max);
    }

    List<String> parse(String response) {
        int start = response.indexOf('[');
        int end = response.lastIndexOf(']');
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("No JSON array in decomposition response");
        }
        try {
            List<String> raw = objectMapper.readValue(response.substring(start, end + 1),
                new TypeReference<List<String>>() { });
            List<String> questions = new ArrayList<>();
            for (String question : raw) {
                if (question != null && question.strip().length() >= MIN_SUB_QUESTION_LENGTH) {
                    questions.add(question.strip());
                }
            }
            return questions;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed decomposition response", e);
        }
    }

    private static List<String> limit(List<String> questions, int max) {
        Set<String> distinct = new LinkedHashSet<>(questions);
        return distinct.stream().limit(Math.max(1, max)).toList();
    }
}
