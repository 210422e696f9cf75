package br.edu.ifba.graphrag.synthesis;

import br.edu.ifba.graphrag.core.Chunk;
import br.edu.ifba.graphrag.utils.TextNormalizer;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Confidence of a synthesized answer: {@code 0.5 * diversity + 0.5 * coverage}.
 *
 * <p>Diversity is the share of considered entities credited with at least one kept chunk;
 * for evidence not reached through entities it is the share of distinct sections among the
 * chunks. It is capped at 0.5 when the trace was degraded. Coverage is the share of
 * requirements whose content terms are at least half present in the evidence.</p>
 */
public final class ConfidenceScorer {

    static final double DIVERSITY_WEIGHT = 0.5;
    static final double COVERAGE_WEIGHT = 0.5;
    static final double DEGRADED_DIVERSITY_CAP = 0.5;

    private ConfidenceScorer() {
        throw new UnsupportedOperationException("Utility class");
    }

    @NotNull
    public static Score score(
            @NotNull List<Chunk> evidence,
            int entitiesConsidered,
            boolean degraded,
            @NotNull List<String> requirements) {
        if (evidence.isEmpty()) {
            return new Score(0.0, 0.0, 0.0, List.copyOf(requirements));
        }
        double diversity = diversity(evidence, entitiesConsidered);
        if (degraded) {
            diversity = Math.min(diversity, DEGRADED_DIVERSITY_CAP);
        }

        Set<String> evidenceTerms = new HashSet<>();
        evidence.forEach(chunk -> evidenceTerms.addAll(TextNormalizer.contentTerms(chunk.text())));
        List<String> uncovered = new ArrayList<>();
        for (String requirement : requirements) {
            if (!isCovered(requirement, evidenceTerms)) {
                uncovered.add(requirement);
            }
        }
        double coverage = requirements.isEmpty()
            ? 1.0
            : (double) (requirements.size() - uncovered.size()) / requirements.size();

        double confidence = DIVERSITY_WEIGHT * diversity + COVERAGE_WEIGHT * coverage;
        return new Score(confidence, diversity, coverage, uncovered);
    }

    static double diversity(List<Chunk> evidence, int entitiesConsidered) {
        if (entitiesConsidered > 0) {
            long contributing = evidence.stream()
                .flatMap(chunk -> chunk.entityIds().stream())
                .distinct()
                .count();
            return Math.min(1.0, (double) contributing / entitiesConsidered);
        }
        long sections = evidence.stream()
            .map(chunk -> chunk.source() + "\u0000" + chunk.sectionLabel())
            .distinct()
            .count();
        return (double) sections / evidence.size();
    }

    static boolean isCovered(String requirement, Set<String> evidenceTerms) {
        List<String> terms = TextNormalizer.contentTerms(requirement);
        if (terms.isEmpty()) {
            return true;
        }
        long present = terms.stream().filter(evidenceTerms::contains).count();
        return present * 2 >= terms.size();
    }

    /**
     * @param confidence combined score in [0, 1]
     * @param diversity  diversity component after any cap
     * @param coverage   coverage component
     * @param uncovered  requirements the evidence does not cover
     */
    public record Score(double confidence, double diversity, double coverage, List<String> uncovered) {
    }
}
