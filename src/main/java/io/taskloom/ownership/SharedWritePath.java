package io.taskloom.ownership;

import io.taskloom.model.Role;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A file that some non-owner roles may update in a limited way, for example the status
 * column of the roadmap. Writes by those roles are downgraded from a violation to a
 * field-scoped warning.
 */
public record SharedWritePath(String path, Set<Role> partialRoles, List<String> fields) {
    public SharedWritePath {
        path = OwnershipGuard.normalize(path)
                .orElseThrow(() -> new IllegalArgumentException("shared path must be relative to the workspace root"))
                .toString();
        partialRoles = partialRoles == null || partialRoles.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(partialRoles));
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}
