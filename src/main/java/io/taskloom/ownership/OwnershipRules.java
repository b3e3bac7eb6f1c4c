package io.taskloom.ownership;

import io.taskloom.model.Role;

import java.util.List;
import java.util.Set;

/**
 * Built-in partition of the workspace. No prefix here contains another, so each path has
 * exactly one candidate rule.
 */
public final class OwnershipRules {
    private OwnershipRules() {
    }

    public static List<OwnershipRule> defaults() {
        return List.of(
                OwnershipRule.of("docs/roadmap", Role.PROJECT_MANAGER),
                OwnershipRule.of("docs/architecture", Role.ARCHITECT),
                OwnershipRule.of("docs/specs", Role.ARCHITECT),
                OwnershipRule.of("docs/reviews", Role.CODE_REVIEWER),
                OwnershipRule.of("src", Role.CODE_DEVELOPER),
                OwnershipRule.of("tests", Role.CODE_DEVELOPER),
                OwnershipRule.of("scripts", Role.CODE_DEVELOPER),
                OwnershipRule.of("pom.xml", Role.CODE_DEVELOPER),
                OwnershipRule.of(".taskloom", Role.ORCHESTRATOR)
        );
    }

    public static List<SharedWritePath> defaultSharedPaths() {
        return List.of(
                new SharedWritePath("docs/roadmap/ROADMAP.md", Set.of(Role.CODE_DEVELOPER, Role.ARCHITECT), List.of("status", "has_spec"))
        );
    }
}
