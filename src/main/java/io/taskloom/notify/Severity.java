package io.taskloom.notify;

public enum Severity {
    INFO,
    WARNING,
    HIGH,
    CRITICAL
}
