package eu.virtualparadox.articlefinder.application.cli;

import eu.virtualparadox.articlefinder.application.config.RetrievalProperties;
import eu.virtualparadox.articlefinder.error.InvalidRequestException;
import eu.virtualparadox.articlefinder.ingest.model.Role;
import eu.virtualparadox.articlefinder.rag.retriever.model.SearchResult;
import eu.virtualparadox.articlefinder.rag.retriever.service.RetrieverService;
import eu.virtualparadox.articlefinder.security.RoleHierarchy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * One-shot query from the command line:
 * {@code --query="liability limit" --roles=staff,legal --topk=5}.
 * <p>Does nothing when {@code --query} is absent.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryCommandLineRunner implements ApplicationRunner {

    private static final String DEFAULT_ROLE = "staff";

    private final RetrieverService retrieverService;
    private final RoleHierarchy roleHierarchy;
    private final RetrievalProperties props;

    @Override
    public void run(final ApplicationArguments args) {
        final String query = firstValue(args, "query");
        if (query == null) {
            return;
        }

        final Set<Role> roles = roleHierarchy.expand(Role.setOf(parseRoles(firstValue(args, "roles"))));
        final String topk = firstValue(args, "topk");
        final int k = topk == null ? props.getDefaultTopK() : parseTopK(topk);

        log.debug("CLI query with roles {} and k={}", roles, k);
        final List<SearchResult> results = retrieverService.search(query, roles, k);
        print(results, System.out);
    }

    void print(final List<SearchResult> results, final PrintStream out) {
        if (results.isEmpty()) {
            out.println("No relevant article found.");
            return;
        }
        for (final SearchResult r : results) {
            out.println(String.format(Locale.ROOT, "- %s | Article %s | pages %d-%d | score=%.3f",
                    r.docId(), StringUtils.defaultIfBlank(r.articleNo(), "?"), r.fromPage(), r.toPage(), r.score()));
            out.println("  excerpt: " + StringUtils.abbreviate(r.excerpt().replace('\n', ' '), 300));
            out.println();
        }
    }

    private static int parseTopK(final String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("--topk must be an integer, got '" + raw + "'");
        }
    }

    private static List<String> parseRoles(final String raw) {
        final List<String> roles = new ArrayList<>();
        if (raw != null) {
            for (final String r : raw.split(",")) {
                if (StringUtils.isNotBlank(r)) {
                    roles.add(r);
                }
            }
        }
        if (roles.isEmpty()) {
            roles.add(DEFAULT_ROLE);
        }
        return roles;
    }

    private static String firstValue(final ApplicationArguments args, final String name) {
        final List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
