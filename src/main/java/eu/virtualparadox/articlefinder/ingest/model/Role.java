package eu.virtualparadox.articlefinder.ingest.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Access role tag attached to chunks and held by callers.
 * <p>Tags are open-ended strings compared case-insensitively: the name is trimmed and lower-cased on creation.</p>
 *
 * @param name canonical (trimmed, lower-case) role name
 */
public record Role(String name) {

    public static final Role PUBLIC = new Role("public");

    public Role {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Role name must not be blank");
        }
        name = name.trim().toLowerCase(Locale.ROOT);
    }

    public static Role of(final String name) {
        return new Role(name);
    }

    /**
     * Builds an unmodifiable, insertion-ordered role set from raw tags.
     */
    public static Set<Role> setOf(final Collection<String> names) {
        final Set<Role> roles = new LinkedHashSet<>();
        for (final String n : names) {
            roles.add(of(n));
        }
        return Collections.unmodifiableSet(roles);
    }

    public static Set<Role> setOf(final String... names) {
        return setOf(Arrays.asList(names));
    }

    @Override
    public String toString() {
        return name;
    }
}
