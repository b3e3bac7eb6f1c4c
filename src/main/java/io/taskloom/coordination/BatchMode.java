package io.taskloom.coordination;

public enum BatchMode {
    PARALLEL,
    SEQUENTIAL
}
