package io.taskloom.ownership;

import io.taskloom.model.Role;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Roles allowed to write under {@code pathPrefix}. Prefixes match whole path components, so
 * {@code docs/spec} does not cover {@code docs/specs/x.md}.
 */
public record OwnershipRule(String pathPrefix, Set<Role> owners) {
    public OwnershipRule {
        if (pathPrefix == null || pathPrefix.isBlank()) {
            throw new IllegalArgumentException("pathPrefix must not be blank");
        }
        if (owners == null || owners.isEmpty()) {
            throw new IllegalArgumentException("owners must not be empty for " + pathPrefix);
        }
        pathPrefix = OwnershipGuard.normalize(pathPrefix)
                .orElseThrow(() -> new IllegalArgumentException("pathPrefix must be relative to the workspace root"))
                .toString();
        owners = Collections.unmodifiableSet(EnumSet.copyOf(owners));
    }

    public static OwnershipRule of(String pathPrefix, Role... owners) {
        EnumSet<Role> set = EnumSet.noneOf(Role.class);
        Collections.addAll(set, owners);
        return new OwnershipRule(pathPrefix, set);
    }

    Path prefixPath() {
        return Path.of(pathPrefix);
    }

    boolean covers(Path normalized) {
        return normalized.startsWith(prefixPath());
    }
}
