package br.edu.ifba.graphrag.synthesis;

import br.edu.ifba.graphrag.core.Chunk;
import br.edu.ifba.graphrag.core.Citation;
import br.edu.ifba.graphrag.core.QueryRoute;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Builds the completion prompt for a route and the citation-tagged evidence block.
 */
public final class AnswerPromptBuilder {

    private static final String GROUNDING_RULES = """
        Answer only from the evidence provided. Cite every statement with the bracketed
        number of the evidence it comes from, for example [1] or [2][3]. Do not cite numbers
        that are not in the evidence. If the evidence does not answer the question, say so.
        """;

    private AnswerPromptBuilder() {
        throw new UnsupportedOperationException("Utility class");
    }

    @NotNull
    public static String prompt(@NotNull QueryRoute route, @NotNull String query, @NotNull List<String> subQuestions) {
        StringBuilder prompt = new StringBuilder();
        switch (route) {
            case GLOBAL_SUMMARY_SEARCH -> prompt
                .append("Write a concise summary that answers the question below. ")
                .append("Group related points into themes and keep each theme short.\n\n");
            case MULTI_HOP_DISCOVERY -> {
                prompt.append("The question below has several parts. Answer each part in turn, ")
                    .append("then combine the parts into one conclusion.\n\n");
                if (!subQuestions.isEmpty()) {
                    prompt.append("Parts:\n");
                    for (int i = 0; i < subQuestions.size(); i++) {
                        prompt.append(i + 1).append(". ").append(subQuestions.get(i)).append('\n');
                    }
                    prompt.append('\n');
                }
            }
            case DIRECT_VECTOR_LOOKUP, LOCAL_GRAPH_SEARCH -> prompt
                .append("Write a detailed, factual answer to the question below. ")
                .append("Include specific figures, names and dates found in the evidence.\n\n");
        }
        prompt.append(GROUNDING_RULES).append('\n');
        prompt.append("Question: ").append(query).append('\n');
        return prompt.toString();
    }

    /**
     * Formats evidence as numbered blocks. Each chunk must already be registered.
     */
    @NotNull
    public static String evidence(@NotNull List<Chunk> chunks, @NotNull CitationRegistry registry) {
        StringBuilder evidence = new StringBuilder();
        for (Chunk chunk : chunks) {
            Citation citation = registry.register(chunk);
            evidence.append('[').append(citation.id()).append("] ")
                .append("Source: ").append(citation.source())
                .append(" | Section: ").append(citation.section()).append('\n')
                .append(chunk.text().strip()).append("\n\n");
        }
        return evidence.toString();
    }
}
