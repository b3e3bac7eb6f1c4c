package io.taskloom.ownership;

import io.taskloom.config.ConfigurationException;
import io.taskloom.model.Role;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

final class OwnershipGuardTest {

    @Test
    void ownerMayWriteAndOtherRoleIsDenied() {
        OwnershipGuard guard = OwnershipGuard.withDefaults();

        Assertions.assertTrue(guard.canWrite(Role.ARCHITECT, "docs/specs/item-12.md"));
        Assertions.assertFalse(guard.canWrite(Role.CODE_DEVELOPER, "docs/specs/item-12.md"));
        Assertions.assertTrue(guard.canWrite(Role.CODE_DEVELOPER, "src/main/java/App.java"));
        Assertions.assertFalse(guard.canWrite(Role.ARCHITECT, "src/main/java/App.java"));

        OwnershipViolationException denied = Assertions.assertThrows(OwnershipViolationException.class,
                () -> guard.assertCanWrite(Role.CODE_DEVELOPER, "docs/architecture/overview.md"));
        Assertions.assertEquals(Role.CODE_DEVELOPER, denied.role());
        Assertions.assertEquals(Set.of(Role.ARCHITECT), denied.owners());
        Assertions.assertEquals(WriteAccess.FULL, guard.assertCanWrite(Role.ARCHITECT, "docs/architecture/overview.md"));
    }

    @Test
    void uncoveredAndEscapingPathsAreDenied() {
        OwnershipGuard guard = OwnershipGuard.withDefaults();

        Assertions.assertFalse(guard.canWrite(Role.CODE_DEVELOPER, "README.md"));
        Assertions.assertFalse(guard.canWrite(Role.CODE_DEVELOPER, "../outside/src/x.java"));
        Assertions.assertFalse(guard.canWrite(Role.CODE_DEVELOPER, "/etc/passwd"));
        Assertions.assertFalse(guard.canWrite(Role.CODE_DEVELOPER, "  "));
        Assertions.assertTrue(guard.ownersOf("README.md").isEmpty());

        OwnershipViolationException e = Assertions.assertThrows(OwnershipViolationException.class,
                () -> guard.assertCanWrite(Role.ARCHITECT, "README.md"));
        Assertions.assertTrue(e.getMessage().contains("no rule covers"), e.getMessage());
    }

    @Test
    void prefixMatchesWholeComponentsAfterNormalization() {
        OwnershipGuard guard = OwnershipGuard.create(
                List.of(OwnershipRule.of("docs/spec", Role.ARCHITECT), OwnershipRule.of("docs/specs", Role.PROJECT_MANAGER)),
                List.of()
        );

        Assertions.assertTrue(guard.canWrite(Role.PROJECT_MANAGER, "docs/specs/a.md"));
        Assertions.assertFalse(guard.canWrite(Role.ARCHITECT, "docs/specs/a.md"));
        Assertions.assertTrue(guard.canWrite(Role.ARCHITECT, "./docs/spec/../spec/a.md"));
        Assertions.assertTrue(guard.canWrite(Role.ARCHITECT, "docs\\spec\\a.md"));
    }

    @Test
    void sharedPathGivesPartialOwnerFieldScopedAccess() {
        OwnershipGuard guard = OwnershipGuard.withDefaults();

        Assertions.assertEquals(WriteAccess.FULL,
                guard.assertCanWrite(Role.PROJECT_MANAGER, "docs/roadmap/ROADMAP.md"));
        Assertions.assertEquals(WriteAccess.FIELD_SCOPED,
                guard.assertCanWrite(Role.CODE_DEVELOPER, "docs/roadmap/ROADMAP.md"));
        Assertions.assertFalse(guard.canWrite(Role.CODE_DEVELOPER, "docs/roadmap/ROADMAP.md"));
        Assertions.assertThrows(OwnershipViolationException.class,
                () -> guard.assertCanWrite(Role.CODE_REVIEWER, "docs/roadmap/ROADMAP.md"));
        Assertions.assertThrows(OwnershipViolationException.class,
                () -> guard.assertCanWrite(Role.CODE_DEVELOPER, "docs/roadmap/other.md"));
    }

    @Test
    void nestedPrefixesWithDifferentOwnersAreRejected() {
        List<OwnershipRule> rules = List.of(
                OwnershipRule.of("docs", Role.PROJECT_MANAGER),
                OwnershipRule.of("docs/specs", Role.ARCHITECT),
                OwnershipRule.of("src", Role.CODE_DEVELOPER)
        );

        List<OverlapViolation> violations = OwnershipGuard.validateNoOverlaps(rules);
        Assertions.assertEquals(1, violations.size());
        Assertions.assertEquals("docs", violations.get(0).outerPrefix());
        Assertions.assertEquals("docs/specs", violations.get(0).innerPrefix());

        ConfigurationException e = Assertions.assertThrows(ConfigurationException.class,
                () -> OwnershipGuard.create(rules, List.of()));
        Assertions.assertEquals(1, e.problems().size());
        Assertions.assertTrue(e.problems().get(0).contains("docs/specs"), e.problems().get(0));
    }

    @Test
    void overlapDetectionIsDeterministicAndAllowsSameOwners() {
        List<OwnershipRule> rules = List.of(
                OwnershipRule.of("src/main", Role.ASSISTANT),
                OwnershipRule.of("docs/a", Role.ARCHITECT),
                OwnershipRule.of("src", Role.CODE_DEVELOPER),
                OwnershipRule.of("docs", Role.PROJECT_MANAGER),
                OwnershipRule.of("tests", Role.CODE_DEVELOPER),
                OwnershipRule.of("tests/unit", Role.CODE_DEVELOPER)
        );

        List<OverlapViolation> first = OwnershipGuard.validateNoOverlaps(rules);
        List<OwnershipRule> backwards = new ArrayList<>(rules);
        Collections.reverse(backwards);
        List<OverlapViolation> reversed = OwnershipGuard.validateNoOverlaps(backwards);
        Assertions.assertEquals(first, reversed);
        Assertions.assertEquals(List.of("docs/a", "src/main"),
                first.stream().map(OverlapViolation::innerPrefix).toList());
    }

    @Test
    void defaultTableIsValidAndListable() {
        Assertions.assertTrue(OwnershipGuard.validateNoOverlaps(OwnershipRules.defaults()).isEmpty());
        List<String> listing = OwnershipGuard.withDefaults().auditListing();
        Assertions.assertEquals(OwnershipRules.defaults().size() + OwnershipRules.defaultSharedPaths().size(), listing.size());
        Assertions.assertTrue(listing.stream().anyMatch(l -> l.startsWith("docs/specs") && l.contains("[architect]")));
        Assertions.assertTrue(listing.stream().anyMatch(l -> l.startsWith("shared docs/roadmap/ROADMAP.md")));
    }
}
