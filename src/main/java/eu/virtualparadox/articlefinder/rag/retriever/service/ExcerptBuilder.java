package eu.virtualparadox.articlefinder.rag.retriever.service;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cuts a bounded window out of chunk text, centered on the strongest query match.
 * <p>The strongest match is the first occurrence of the longest query token found in the text; without a match the
 * window is the leading text. Cut edges are moved to word boundaries and marked with an ellipsis.</p>
 */
@Component
public class ExcerptBuilder {

    static final String ELLIPSIS = "…";
    static final String MARK_OPEN = "<mark>";
    static final String MARK_CLOSE = "</mark>";

    /**
     * @param text      original chunk text
     * @param tokens    query tokens to look for (case-insensitive)
     * @param maxLength maximum window length in characters, excluding ellipses and marks
     * @param highlight whether to wrap token occurrences in {@code <mark>} tags
     * @return the excerpt, never {@code null}
     */
    public String build(final String text, final List<String> tokens, final int maxLength, final boolean highlight) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be > 0");
        }

        final List<String> terms = distinctByLengthDesc(tokens);
        final String window = window(text, terms, maxLength);
        return highlight ? highlight(window, terms) : window;
    }

    private String window(final String text, final List<String> terms, final int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }

        int start = 0;
        for (final String term : terms) {
            final int pos = StringUtils.indexOfIgnoreCase(text, term);
            if (pos >= 0) {
                start = Math.max(0, pos + term.length() / 2 - maxLength / 2);
                break;
            }
        }
        int end = Math.min(text.length(), start + maxLength);
        start = Math.max(0, end - maxLength);

        final int slack = Math.max(1, maxLength / 10);
        if (start > 0) {
            final int space = text.indexOf(' ', start);
            if (space >= 0 && space < start + slack) {
                start = space + 1;
            }
        }
        if (end < text.length()) {
            final int space = text.lastIndexOf(' ', end);
            if (space > start && space > end - slack) {
                end = space;
            }
        }

        // never split a surrogate pair
        if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        if (start > 0 && Character.isLowSurrogate(text.charAt(start))) {
            start++;
        }

        final StringBuilder sb = new StringBuilder(end - start + 2);
        if (start > 0) {
            sb.append(ELLIPSIS);
        }
        sb.append(text, start, end);
        if (end < text.length()) {
            sb.append(ELLIPSIS);
        }
        return sb.toString();
    }

    private String highlight(final String text, final List<String> terms) {
        if (terms.isEmpty()) {
            return text;
        }
        final List<String> quoted = new ArrayList<>(terms.size());
        for (final String term : terms) {
            quoted.add(Pattern.quote(term));
        }
        final Pattern pattern = Pattern.compile(String.join("|", quoted), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        final Matcher matcher = pattern.matcher(text);
        return matcher.replaceAll(m -> Matcher.quoteReplacement(MARK_OPEN + m.group() + MARK_CLOSE));
    }

    private List<String> distinctByLengthDesc(final List<String> tokens) {
        final Set<String> unique = new LinkedHashSet<>();
        if (tokens != null) {
            for (final String t : tokens) {
                if (StringUtils.isNotBlank(t)) {
                    unique.add(t.trim());
                }
            }
        }
        final List<String> out = new ArrayList<>(unique);
        // stable: equal lengths keep query order
        out.sort(Comparator.comparingInt(String::length).reversed());
        return out;
    }
}
