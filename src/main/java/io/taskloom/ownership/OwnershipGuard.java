package io.taskloom.ownership;

import io.taskloom.config.ConfigurationException;
import io.taskloom.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Static write partition of the workspace. Built once, validated at construction and read-only
 * afterwards, so it can be shared across threads without locking.
 */
public final class OwnershipGuard {
    private static final Logger log = LoggerFactory.getLogger(OwnershipGuard.class);

    private final List<OwnershipRule> rules;
    private final List<SharedWritePath> sharedPaths;

    private OwnershipGuard(List<OwnershipRule> rules, List<SharedWritePath> sharedPaths) {
        this.rules = rules;
        this.sharedPaths = sharedPaths;
    }

    public static OwnershipGuard withDefaults() {
        return create(OwnershipRules.defaults(), OwnershipRules.defaultSharedPaths());
    }

    /**
     * @throws ConfigurationException if two rules nest with different owners
     */
    public static OwnershipGuard create(List<OwnershipRule> rules, List<SharedWritePath> sharedPaths) {
        List<OverlapViolation> violations = validateNoOverlaps(rules);
        if (!violations.isEmpty()) {
            throw new ConfigurationException(
                    "Ownership rules overlap",
                    violations.stream().map(OverlapViolation::describe).toList()
            );
        }
        List<OwnershipRule> sorted = rules.stream()
                .sorted(Comparator.comparing(OwnershipRule::pathPrefix))
                .toList();
        return new OwnershipGuard(sorted, sharedPaths == null ? List.of() : List.copyOf(sharedPaths));
    }

    /**
     * Every pair of rules where one prefix contains the other must name the same owners.
     * Output is sorted by outer then inner prefix, so repeated runs report the same list.
     */
    public static List<OverlapViolation> validateNoOverlaps(List<OwnershipRule> rules) {
        List<OwnershipRule> sorted = rules.stream()
                .sorted(Comparator.comparing(OwnershipRule::pathPrefix))
                .toList();
        List<OverlapViolation> out = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            for (int j = 0; j < sorted.size(); j++) {
                if (i == j) {
                    continue;
                }
                OwnershipRule outer = sorted.get(i);
                OwnershipRule inner = sorted.get(j);
                boolean nested = inner.prefixPath().startsWith(outer.prefixPath());
                boolean sameLengthDuplicate = outer.pathPrefix().equals(inner.pathPrefix()) && i > j;
                if (nested && !sameLengthDuplicate && !outer.owners().equals(inner.owners())) {
                    out.add(new OverlapViolation(outer.pathPrefix(), outer.owners(), inner.pathPrefix(), inner.owners()));
                }
            }
        }
        out.sort(Comparator.comparing(OverlapViolation::outerPrefix).thenComparing(OverlapViolation::innerPrefix));
        return out;
    }

    public boolean canWrite(Role role, String path) {
        Optional<OwnershipRule> rule = normalize(path).flatMap(this::matchingRule);
        if (rule.isEmpty()) {
            log.debug("No ownership rule covers {}, denying {}", path, role.wireName());
            return false;
        }
        return rule.get().owners().contains(role);
    }

    /**
     * @return {@link WriteAccess#FIELD_SCOPED} when the write is only allowed through a shared path
     * @throws OwnershipViolationException when the role may not write the path at all
     */
    public WriteAccess assertCanWrite(Role role, String path) {
        if (canWrite(role, path)) {
            return WriteAccess.FULL;
        }
        Optional<Path> normalized = normalize(path);
        if (normalized.isPresent()) {
            for (SharedWritePath shared : sharedPaths) {
                if (shared.path().equals(normalized.get().toString()) && shared.partialRoles().contains(role)) {
                    log.warn("{} writes shared path {} with partial ownership; only fields {} may change",
                            role.wireName(), shared.path(), shared.fields());
                    return WriteAccess.FIELD_SCOPED;
                }
            }
        }
        throw new OwnershipViolationException(role, path, ownersOf(path));
    }

    public Set<Role> ownersOf(String path) {
        return normalize(path).flatMap(this::matchingRule)
                .map(OwnershipRule::owners)
                .orElse(Set.of());
    }

    public List<OwnershipRule> rules() {
        return rules;
    }

    public List<SharedWritePath> sharedPaths() {
        return sharedPaths;
    }

    /**
     * One line per rule and shared path, in prefix order.
     */
    public List<String> auditListing() {
        List<String> lines = new ArrayList<>();
        int width = rules.stream().mapToInt(r -> r.pathPrefix().length()).max().orElse(0);
        for (OwnershipRule rule : rules) {
            lines.add(String.format("%-" + Math.max(1, width) + "s  %s", rule.pathPrefix(), roleNames(rule.owners())));
        }
        for (SharedWritePath shared : sharedPaths) {
            lines.add("shared " + shared.path() + "  partial=" + roleNames(shared.partialRoles())
                    + " fields=" + String.join(",", shared.fields()));
        }
        return lines;
    }

    private Optional<OwnershipRule> matchingRule(Path normalized) {
        OwnershipRule best = null;
        for (OwnershipRule rule : rules) {
            if (rule.covers(normalized)
                    && (best == null || rule.prefixPath().getNameCount() > best.prefixPath().getNameCount())) {
                best = rule;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Normalizes a workspace-relative path. Absolute paths and paths escaping the root are
     * rejected as empty.
     */
    static Optional<Path> normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Path path;
        try {
            path = Path.of(raw.trim().replace('\\', '/')).normalize();
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
        if (path.isAbsolute() || path.toString().isEmpty() || path.startsWith("..")) {
            return Optional.empty();
        }
        return Optional.of(path);
    }

    static String roleNames(Set<Role> roles) {
        return roles.stream().map(Role::wireName).sorted().collect(Collectors.joining(",", "[", "]"));
    }
}
