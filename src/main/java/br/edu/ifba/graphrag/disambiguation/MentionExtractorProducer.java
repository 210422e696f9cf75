package br.edu.ifba.graphrag.disambiguation;

import br.edu.ifba.graphrag.llm.CompletionFunction;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Selects the mention extractor from {@code graphrag.disambiguation.mention-extractor}
 * ({@code heuristic} or {@code llm}).
 */
@ApplicationScoped
public class MentionExtractorProducer {

    private static final Logger logger = LoggerFactory.getLogger(MentionExtractorProducer.class);

    @Produces
    @ApplicationScoped
    MentionExtractor mentionExtractor(
            @ConfigProperty(name = "graphrag.disambiguation.mention-extractor", defaultValue = "heuristic") String kind,
            CompletionFunction completion,
            ObjectMapper objectMapper) {
        HeuristicMentionExtractor heuristic = new HeuristicMentionExtractor();
        switch (kind.trim().toLowerCase(Locale.ROOT)) {
            case "llm":
                logger.info("Using LLM mention extraction with heuristic fallback");
                return new LlmMentionExtractor(completion, heuristic, objectMapper);
            case "heuristic":
                return heuristic;
            default:
                throw new IllegalStateException("Unknown mention extractor: " + kind);
        }
    }
}
