package br.edu.ifba.graphrag.utils;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text normalization used for entity matching, deduplication and coverage checks.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    public static final Set<String> STOPWORDS = Set.of(
        "a", "an", "the", "and", "or", "but", "of", "to", "in", "on", "at", "by", "for", "with",
        "from", "into", "about", "as", "is", "are", "was", "were", "be", "been", "being", "do",
        "does", "did", "has", "have", "had", "what", "which", "who", "whom", "whose", "when",
        "where", "why", "how", "this", "that", "these", "those", "it", "its", "there", "their",
        "any", "all", "each", "some", "me", "my", "we", "our", "you", "your", "can", "could",
        "should", "would", "will", "shall", "may", "might", "must", "tell", "show", "give",
        "list", "please", "between", "across", "than", "then", "not", "no", "so", "if", "also",
        "i", "he", "she", "they", "them", "his", "her", "much", "many", "more", "most", "other",
        "through", "via", "over", "under", "within", "without", "after", "before", "during", "against",
        "among", "like", "such", "only", "just", "very", "up", "out", "off", "down", "again"
    );

    private TextNormalizer() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Lower-cases and collapses whitespace.
     */
    @NotNull
    public static String normalize(@Nullable String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    /**
     * Splits normalized text into alphanumeric tokens.
     */
    @NotNull
    public static List<String> tokens(@Nullable String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (String token : NON_WORD.split(normalized)) {
            if (!token.isEmpty()) {
                result.add(token);
            }
        }
        return result;
    }

    /**
     * Distinct tokens of at least three characters that are not stopwords, in order of appearance.
     */
    @NotNull
    public static List<String> contentTerms(@Nullable String text) {
        Set<String> terms = new LinkedHashSet<>();
        for (String token : tokens(text)) {
            if (token.length() >= 3 && !STOPWORDS.contains(token)) {
                terms.add(stem(token));
            }
        }
        return new ArrayList<>(terms);
    }

    /**
     * Minimal plural folding so that "terms" and "term" compare equal.
     */
    @NotNull
    public static String stem(@NotNull String token) {
        if (token.length() > 4 && token.endsWith("ies")) {
            return token.substring(0, token.length() - 3) + "y";
        }
        if (token.length() > 3 && token.endsWith("s") && !token.endsWith("ss")) {
            return token.substring(0, token.length() - 1);
        }
        return token;
    }

    /**
     * Jaccard overlap of the token sets of two strings.
     */
    public static double jaccard(@Nullable String a, @Nullable String b) {
        Set<String> left = new LinkedHashSet<>(tokens(a));
        Set<String> right = new LinkedHashSet<>(tokens(b));
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new LinkedHashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new LinkedHashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }
}
