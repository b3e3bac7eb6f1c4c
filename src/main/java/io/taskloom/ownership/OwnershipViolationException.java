package io.taskloom.ownership;

import io.taskloom.model.Role;

import java.util.Set;

/**
 * A role attempted to write a path it does not own. Fatal to that write; retrying cannot help.
 */
public final class OwnershipViolationException extends RuntimeException {
    private final Role role;
    private final String path;
    private final Set<Role> owners;

    public OwnershipViolationException(Role role, String path, Set<Role> owners) {
        super("Ownership violation: " + role.wireName() + " cannot write " + path
                + (owners.isEmpty() ? " (no rule covers this path)" : " (owned by " + OwnershipGuard.roleNames(owners) + ")"));
        this.role = role;
        this.path = path;
        this.owners = Set.copyOf(owners);
    }

    public Role role() {
        return role;
    }

    public String path() {
        return path;
    }

    public Set<Role> owners() {
        return owners;
    }
}
