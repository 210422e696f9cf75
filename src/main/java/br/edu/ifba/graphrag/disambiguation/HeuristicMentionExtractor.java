package br.edu.ifba.graphrag.disambiguation;

import br.edu.ifba.graphrag.core.QueryParam;
import br.edu.ifba.graphrag.utils.TextNormalizer;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic mention extraction: quoted phrases, runs of capitalized words, and maximal
 * runs of content words. "What are the payment terms?" yields {@code payment terms}.
 */
public class HeuristicMentionExtractor implements MentionExtractor {

    private static final Pattern QUOTED = Pattern.compile("\"([^\"]{2,})\"|'([^']{2,})'");
    private static final Set<String> INSTRUCTION_WORDS = Set.of(
        "explain", "describe", "summarize", "summarise", "compare", "analyze", "analyse", "trace",
        "find", "identify", "name", "provide", "outline", "overall", "general", "everything");

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}][\\p{L}\\p{N}&.\\-]*");

    @Override
    public CompletableFuture<List<String>> extract(@NotNull String query, @NotNull QueryParam param) {
        return CompletableFuture.completedFuture(extract(query));
    }

    @NotNull
    public List<String> extract(@NotNull String query) {
        Set<String> mentions = new LinkedHashSet<>();

        Matcher quoted = QUOTED.matcher(query);
        StringBuilder rest = new StringBuilder();
        int last = 0;
        while (quoted.find()) {
            String phrase = quoted.group(1) != null ? quoted.group(1) : quoted.group(2);
            mentions.add(phrase.trim());
            rest.append(query, last, quoted.start()).append(" . ");
            last = quoted.end();
        }
        rest.append(query.substring(last));

        List<String> words = new ArrayList<>();
        List<Integer> separators = new ArrayList<>();
        Matcher word = WORD.matcher(rest);
        int previousEnd = 0;
        while (word.find()) {
            String between = rest.substring(previousEnd, word.start());
            separators.add(between.isBlank() ? 0 : 1);
            words.add(trimPunctuation(word.group()));
            previousEnd = word.end();
        }

        List<String> capitalized = new ArrayList<>();
        List<String> content = new ArrayList<>();
        for (int i = 0; i < words.size(); i++) {
            String token = words.get(i);
            boolean boundary = separators.get(i) == 1;
            if (boundary) {
                flush(capitalized, mentions);
                flush(content, mentions);
            }
            String lower = token.toLowerCase(Locale.ROOT);
            boolean stopword = TextNormalizer.STOPWORDS.contains(lower) || INSTRUCTION_WORDS.contains(lower);
            boolean proper = !stopword && Character.isUpperCase(token.charAt(0));

            if (proper) {
                flush(content, mentions);
                capitalized.add(token);
            } else {
                flush(capitalized, mentions);
                if (!stopword && token.length() > 1) {
                    content.add(lower);
                } else {
                    flush(content, mentions);
                }
            }
        }
        flush(capitalized, mentions);
        flush(content, mentions);
        return new ArrayList<>(mentions);
    }

    private static void flush(List<String> run, Set<String> mentions) {
        if (!run.isEmpty()) {
            mentions.add(String.join(" ", run));
            run.clear();
        }
    }

    private static String trimPunctuation(String token) {
        int end = token.length();
        while (end > 1 && (token.charAt(end - 1) == '.' || token.charAt(end - 1) == '-')) {
            end--;
        }
        return token.substring(0, end);
    }
}
