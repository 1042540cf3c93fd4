package eu.virtualparadox.articlefinder.security;

import eu.virtualparadox.articlefinder.ingest.model.Role;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expands a caller's roles with the roles they imply (e.g. {@code admin} implies {@code legal}).
 * <p>Applied by callers before searching; expansion is transitive and cycle-safe.</p>
 */
public final class RoleHierarchy {

    private final Map<Role, Set<Role>> implied;

    private RoleHierarchy(final Map<Role, Set<Role>> implied) {
        this.implied = implied;
    }

    /**
     * @param hierarchy role name to the names it directly implies
     */
    public static RoleHierarchy of(final Map<String, List<String>> hierarchy) {
        final Map<Role, Set<Role>> implied = new LinkedHashMap<>();
        hierarchy.forEach((role, children) -> implied.put(Role.of(role), Role.setOf(children)));
        return new RoleHierarchy(Collections.unmodifiableMap(implied));
    }

    /**
     * {@code admin -> legal, staff, public}; {@code legal -> staff, public}; {@code staff -> public}.
     */
    public static RoleHierarchy defaults() {
        final Map<String, List<String>> h = new LinkedHashMap<>();
        h.put("admin", List.of("legal", "staff", "public"));
        h.put("legal", List.of("staff", "public"));
        h.put("staff", List.of("public"));
        return of(h);
    }

    /**
     * @param roles caller roles
     * @return the roles plus everything they imply, in discovery order
     */
    public Set<Role> expand(final Set<Role> roles) {
        final Set<Role> out = new LinkedHashSet<>(roles);
        final Deque<Role> pending = new ArrayDeque<>(roles);
        while (!pending.isEmpty()) {
            final Role role = pending.pop();
            for (final Role child : implied.getOrDefault(role, Set.of())) {
                if (out.add(child)) {
                    pending.push(child);
                }
            }
        }
        return Collections.unmodifiableSet(out);
    }
}
