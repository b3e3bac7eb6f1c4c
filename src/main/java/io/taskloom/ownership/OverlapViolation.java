package io.taskloom.ownership;

import io.taskloom.model.Role;

import java.util.Set;

public record OverlapViolation(String outerPrefix, Set<Role> outerOwners, String innerPrefix, Set<Role> innerOwners) {
    public String describe() {
        return innerPrefix + " " + OwnershipGuard.roleNames(innerOwners)
                + " is nested in " + outerPrefix + " " + OwnershipGuard.roleNames(outerOwners)
                + " with different owners";
    }
}
