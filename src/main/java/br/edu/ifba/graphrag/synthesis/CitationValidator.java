package br.edu.ifba.graphrag.synthesis;

import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes {@code [n]} markers that do not name a registered citation.
 */
public final class CitationValidator {

    private static final Pattern MARKER = Pattern.compile("\\[(\\d{1,4})]");
    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("[ \\t]+([.,;:!?])");
    private static final Pattern REPEATED_SPACES = Pattern.compile("[ \\t]{2,}");

    private CitationValidator() {
        throw new UnsupportedOperationException("Utility class");
    }

    @NotNull
    public static String stripInvalidMarkers(@NotNull String answer, @NotNull CitationRegistry registry) {
        Matcher matcher = MARKER.matcher(answer);
        StringBuilder cleaned = new StringBuilder();
        boolean removed = false;
        while (matcher.find()) {
            int id = Integer.parseInt(matcher.group(1));
            if (registry.contains(id)) {
                matcher.appendReplacement(cleaned, Matcher.quoteReplacement(matcher.group()));
            } else {
                matcher.appendReplacement(cleaned, "");
                removed = true;
            }
        }
        matcher.appendTail(cleaned);
        if (!removed) {
            return answer;
        }
        String result = SPACE_BEFORE_PUNCTUATION.matcher(cleaned).replaceAll("$1");
        return REPEATED_SPACES.matcher(result).replaceAll(" ").strip();
    }

    /**
     * Citation ids referenced in the answer, in order of first appearance.
     */
    @NotNull
    public static Set<Integer> referencedIds(@NotNull String answer) {
        Set<Integer> ids = new LinkedHashSet<>();
        Matcher matcher = MARKER.matcher(answer);
        while (matcher.find()) {
            ids.add(Integer.parseInt(matcher.group(1)));
        }
        return ids;
    }
}
