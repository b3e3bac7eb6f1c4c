package io.taskloom.loop;

public enum LoopState {
    STARTING,
    POLLING,
    COORDINATING,
    MONITORING,
    PERSISTING,
    SLEEPING,
    SHUTTING_DOWN,
    STOPPED
}
