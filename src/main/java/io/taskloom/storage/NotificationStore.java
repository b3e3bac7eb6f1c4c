package io.taskloom.storage;

import io.taskloom.notify.NotificationSink;
import io.taskloom.notify.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Default notification sink: rows in the {@code notifications} table, listed by the CLI.
 */
public final class NotificationStore implements NotificationSink {
    private static final Logger log = LoggerFactory.getLogger(NotificationStore.class);

    private final Database database;
    private final Clock clock;

    public NotificationStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @Override
    public void send(Severity severity, String title, String message) {
        String sql = "INSERT INTO notifications(severity,title,message,created_at_ms) VALUES(?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, severity.name());
            ps.setString(2, title);
            ps.setString(3, message == null ? "" : message);
            ps.setLong(4, clock.millis());
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to store notification '{}' ({}): {}", title, severity, message, e);
            return;
        }
        if (severity.compareTo(Severity.HIGH) >= 0) {
            log.warn("[{}] {}: {}", severity, title, message);
        } else {
            log.info("[{}] {}: {}", severity, title, message);
        }
    }

    public List<Notification> recent(int limit) {
        String sql = "SELECT id,severity,title,message,created_at_ms FROM notifications ORDER BY created_at_ms DESC, id DESC LIMIT ?";
        List<Notification> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Notification(
                            rs.getLong("id"),
                            Severity.valueOf(rs.getString("severity")),
                            rs.getString("title"),
                            rs.getString("message"),
                            rs.getLong("created_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list notifications", e);
        }
    }

    public record Notification(long id, Severity severity, String title, String message, long createdAtMs) {
    }
}
