package eu.virtualparadox.articlefinder.ingest.normalizer;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes text so that the corpus and the query live in the same token space.
 * <p>Used on chunk text at ingestion and on the query at search time. The function is pure,
 * total and idempotent.</p>
 */
@Component
public class TextNormalizer {

    private static final Pattern DOUBLE_QUOTES = Pattern.compile("[\\u201C\\u201D\\u201E\\u201F\\u00AB\\u00BB\\u2033]");
    private static final Pattern SINGLE_QUOTES = Pattern.compile("[\\u2018\\u2019\\u201A\\u201B\\u2032]");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\p{Z}\\u200B\\u200C\\u200D\\uFEFF]+");

    /**
     * Lower-cases the text, maps typographic quotes to ASCII quotes and collapses whitespace runs
     * (including non-breaking and zero-width spaces) to single spaces.
     *
     * @param input raw text, may be {@code null}
     * @return normalized text, empty for {@code null} or blank input
     */
    public String normalize(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }

        String text = input.toLowerCase(Locale.ROOT);
        text = DOUBLE_QUOTES.matcher(text).replaceAll("\"");
        text = SINGLE_QUOTES.matcher(text).replaceAll("'");
        text = WHITESPACE.matcher(text).replaceAll(" ");
        return text.trim();
    }

    /**
     * Splits already normalized text into whitespace tokens.
     *
     * @param normalized output of {@link #normalize(String)}
     * @return tokens, empty for blank input
     */
    public String[] tokenize(final String normalized) {
        if (normalized == null || normalized.isBlank()) {
            return new String[0];
        }
        return normalized.trim().split(" ");
    }
}
