package eu.virtualparadox.articlefinder.security;

import eu.virtualparadox.articlefinder.ingest.model.Chunk;
import eu.virtualparadox.articlefinder.ingest.model.Role;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Role-based visibility check: a chunk is visible iff its roles intersect the caller's roles.
 * <p>No hierarchy is resolved here; callers pass an already expanded role set (see {@link RoleHierarchy}).</p>
 */
@Component
public class AccessController {

    public boolean isVisible(final Chunk chunk, final Set<Role> callerRoles) {
        return !Collections.disjoint(chunk.roles(), callerRoles);
    }

    /**
     * Keeps the visible chunks.
     *
     * @param chunks      chunks in any order
     * @param callerRoles caller's (expanded) roles
     * @return the visible chunks as a subsequence of {@code chunks}, relative order preserved
     */
    public List<Chunk> filter(final List<Chunk> chunks, final Set<Role> callerRoles) {
        Objects.requireNonNull(chunks, "chunks must not be null");
        Objects.requireNonNull(callerRoles, "callerRoles must not be null");

        final List<Chunk> visible = new ArrayList<>(chunks.size());
        for (final Chunk chunk : chunks) {
            if (isVisible(chunk, callerRoles)) {
                visible.add(chunk);
            }
        }
        return visible;
    }
}
