package io.taskloom.notify;

/**
 * Where operator-facing alerts go. Implementations must not throw for delivery problems;
 * a lost notification never stops the work loop.
 */
public interface NotificationSink {
    void send(Severity severity, String title, String message);
}
