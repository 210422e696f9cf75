package br.edu.ifba.graphrag.routing;

import br.edu.ifba.graphrag.core.QueryRoute;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Heuristic route classification.
 *
 * <p>Summarization phrasing selects global summary search and compound questions select
 * multi-hop discovery. Otherwise the query is scored for complexity and ambiguity, combined as
 * {@code 0.6 * complexity + 0.4 * ambiguity}, and a high score selects multi-hop discovery.
 * Simple fact questions without an explicit entity go to direct vector lookup; everything
 * else is treated as an entity lookup by local graph search.</p>
 */
public class QueryClassifier {

    static final double COMPLEXITY_WEIGHT = 0.6;
    static final double AMBIGUITY_WEIGHT = 0.4;
    static final double MULTI_HOP_THRESHOLD = 0.5;

    private static final List<String> SUMMARY_PHRASES = List.of(
        "summarize", "summarise", "summary of", "overview", "main themes", "key themes",
        "across all documents", "across documents", "across the corpus", "what are the main",
        "high-level", "big picture");

    private static final List<String> MULTI_HOP_KEYWORDS = List.of(
        "connected to", "relationship between", "linked to", "through", "via", "chain of",
        "path from", "trace", "subsidiary", "parent company", "affiliated");

    private static final List<String> ANALYTICAL_KEYWORDS = List.of(
        "why", "how does", "analyze", "analyse", "explain", "implications", "impact", "risk",
        "exposure", "assess", "evaluate");

    private static final List<String> GRAPH_KEYWORDS = List.of(
        "all contracts", "list all", "every", "complete list", "associated with", "related to");

    private static final List<String> SIMPLE_PATTERNS = List.of(
        "what is the", "who is", "when was", "where is", "how much is", "how many",
        "address of", "phone number");

    private static final List<String> VAGUE_REFERENCES = List.of(
        "our", "the main", "primary", "key", "important", "significant", "top", "major", "leading");

    private static final List<String> SCOPE_INDICATORS = List.of(
        "all related", "everything about", "anything to do with", "overall", "in general", "broadly");

    private static final List<String> COMPARATIVES = List.of(
        "compare", "versus", " vs ", "difference between", "better", "worse", "more than", "less than");

    private static final Pattern COMPOUND_CONJUNCTION = Pattern.compile(
        "\\band\\s+(what|who|which|when|where|how|why)\\b");
    private static final Pattern IDENTIFIER = Pattern.compile("\\b[A-Z]{2,}-?\\d+\\b|\\b\\d+-[A-Z]+\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Scores and classifies a query.
     */
    @NotNull
    public Classification classify(@NotNull String query) {
        String lower = " " + query.toLowerCase(Locale.ROOT).trim() + " ";
        double complexity = complexity(lower);
        double ambiguity = ambiguity(query, lower);
        double combined = COMPLEXITY_WEIGHT * complexity + AMBIGUITY_WEIGHT * ambiguity;

        if (containsAny(lower, SUMMARY_PHRASES)) {
            return new Classification(QueryRoute.GLOBAL_SUMMARY_SEARCH, complexity, ambiguity, "summarization phrasing");
        }
        if (isCompound(query, lower)) {
            return new Classification(QueryRoute.MULTI_HOP_DISCOVERY, complexity, ambiguity, "compound question");
        }
        if (combined >= MULTI_HOP_THRESHOLD) {
            return new Classification(QueryRoute.MULTI_HOP_DISCOVERY, complexity, ambiguity,
                String.format(Locale.ROOT, "combined score %.2f", combined));
        }
        if (hasExplicitEntity(query)) {
            return new Classification(QueryRoute.LOCAL_GRAPH_SEARCH, complexity, ambiguity, "named entity");
        }
        if (containsAny(lower, SIMPLE_PATTERNS)) {
            return new Classification(QueryRoute.DIRECT_VECTOR_LOOKUP, complexity, ambiguity, "simple fact lookup");
        }
        return new Classification(QueryRoute.LOCAL_GRAPH_SEARCH, complexity, ambiguity, "entity lookup");
    }

    static double complexity(String lower) {
        double score = 0.0;
        score += 0.25 * countMatches(lower, MULTI_HOP_KEYWORDS);
        score += 0.2 * countMatches(lower, ANALYTICAL_KEYWORDS);
        score += 0.15 * countMatches(lower, GRAPH_KEYWORDS);
        score -= 0.25 * countMatches(lower, SIMPLE_PATTERNS);
        return clamp(score);
    }

    static double ambiguity(String query, String lower) {
        double score = 0.0;
        score += 0.15 * countMatches(lower, VAGUE_REFERENCES);
        score += 0.2 * countMatches(lower, SCOPE_INDICATORS);
        score += 0.2 * countMatches(lower, COMPARATIVES);

        long properNouns = properNounCount(query);
        if (properNouns >= 2) {
            score -= 0.3;
        } else if (properNouns == 1) {
            score -= 0.15;
        }
        if (query.indexOf('"') >= 0) {
            score -= 0.2;
        }
        return clamp(score);
    }

    static boolean isCompound(String query, String lower) {
        long questionMarks = query.chars().filter(c -> c == '?').count();
        return questionMarks >= 2 || COMPOUND_CONJUNCTION.matcher(lower).find();
    }

    static boolean hasExplicitEntity(String query) {
        return properNounCount(query) >= 1 || query.indexOf('"') >= 0 || IDENTIFIER.matcher(query).find();
    }

    private static long properNounCount(String query) {
        String[] words = WHITESPACE.split(query.trim());
        long count = 0;
        for (int i = 1; i < words.length; i++) {
            String word = words[i];
            if (word.length() > 1 && Character.isUpperCase(word.charAt(0))) {
                count++;
            }
        }
        return count;
    }

    private static int countMatches(String lower, List<String> keywords) {
        int count = 0;
        for (String keyword : keywords) {
            if (containsWord(lower, keyword)) {
                count++;
            }
        }
        return count;
    }

    private static boolean containsAny(String lower, List<String> phrases) {
        for (String phrase : phrases) {
            if (containsWord(lower, phrase)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsWord(String lower, String phrase) {
        int index = lower.indexOf(phrase);
        while (index >= 0) {
            int end = index + phrase.length();
            boolean startOk = index == 0 || !Character.isLetterOrDigit(lower.charAt(index - 1));
            boolean endOk = end >= lower.length() || !Character.isLetterOrDigit(lower.charAt(end));
            if (startOk && endOk) {
                return true;
            }
            index = lower.indexOf(phrase, index + 1);
        }
        return false;
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * @param route      classified route
     * @param complexity complexity score in [0, 1]
     * @param ambiguity  ambiguity score in [0, 1]
     * @param reason     the rule that decided
     */
    public record Classification(QueryRoute route, double complexity, double ambiguity, String reason) {
    }
}
