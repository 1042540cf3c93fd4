package eu.virtualparadox.articlefinder.security;

import eu.virtualparadox.articlefinder.ingest.model.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RoleHierarchyTest {

    @Test
    @DisplayName("Default hierarchy expands admin to every role")
    void adminExpansion() {
        assertThat(RoleHierarchy.defaults().expand(Role.setOf("admin")))
                .containsExactlyInAnyOrder(Role.of("admin"), Role.of("legal"), Role.of("staff"), Role.PUBLIC);
    }

    @Test
    @DisplayName("Staff sees public but not legal")
    void staffExpansion() {
        assertThat(RoleHierarchy.defaults().expand(Role.setOf("staff")))
                .containsExactlyInAnyOrder(Role.of("staff"), Role.PUBLIC);
    }

    @Test
    @DisplayName("Unknown roles are kept unchanged")
    void unknownRole() {
        assertThat(RoleHierarchy.defaults().expand(Role.setOf("auditor"))).containsExactly(Role.of("auditor"));
    }

    @Test
    @DisplayName("Expansion is transitive and survives cycles")
    void transitiveAndCyclic() {
        RoleHierarchy hierarchy = RoleHierarchy.of(Map.of(
                "a", List.of("b"),
                "b", List.of("c"),
                "c", List.of("a")));

        assertThat(hierarchy.expand(Role.setOf("a")))
                .containsExactlyInAnyOrder(Role.of("a"), Role.of("b"), Role.of("c"));
    }
}
