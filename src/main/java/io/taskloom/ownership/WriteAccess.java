package io.taskloom.ownership;

public enum WriteAccess {
    FULL,
    /** Only the fields declared for the shared path may be changed. */
    FIELD_SCOPED
}
