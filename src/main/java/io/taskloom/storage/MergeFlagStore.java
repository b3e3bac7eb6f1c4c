package io.taskloom.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Items whose reconciliation exhausted its retries. A flagged item stays in the backlog but is
 * never dispatched automatically until an operator clears the flag.
 */
public final class MergeFlagStore {
    private final Database database;
    private final Clock clock;

    public MergeFlagStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    public void flag(int itemNumber, int attempts, String lastError) {
        String sql = """
                INSERT INTO merge_flags(item_number,attempts,last_error,flagged_at_ms) VALUES(?,?,?,?)
                ON CONFLICT(item_number) DO UPDATE SET attempts=excluded.attempts,last_error=excluded.last_error,flagged_at_ms=excluded.flagged_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, itemNumber);
            ps.setInt(2, attempts);
            ps.setString(3, lastError);
            ps.setLong(4, clock.millis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record merge flag", e);
        }
    }

    public boolean clear(int itemNumber) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM merge_flags WHERE item_number=?")) {
            ps.setInt(1, itemNumber);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear merge flag", e);
        }
    }

    public Set<Integer> flaggedItems() {
        Set<Integer> out = new LinkedHashSet<>();
        for (MergeFlag flag : list()) {
            out.add(flag.itemNumber());
        }
        return out;
    }

    public List<MergeFlag> list() {
        String sql = "SELECT item_number,attempts,last_error,flagged_at_ms FROM merge_flags ORDER BY item_number";
        List<MergeFlag> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new MergeFlag(
                        rs.getInt("item_number"),
                        rs.getInt("attempts"),
                        rs.getString("last_error"),
                        rs.getLong("flagged_at_ms")
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list merge flags", e);
        }
    }

    public record MergeFlag(int itemNumber, int attempts, String lastError, long flaggedAtMs) {
    }
}
