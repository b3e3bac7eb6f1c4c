package io.taskloom.storage;

import io.taskloom.model.ProcessRecord;
import io.taskloom.model.ProcessStatus;
import io.taskloom.model.Role;
import io.taskloom.model.TaskKind;
import io.taskloom.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process records keyed by a surrogate id. The OS may reuse a pid, so pid lookups resolve to
 * the most recently spawned record.
 */
public final class ProcessStore {
    private static final String COLUMNS =
            "id,pid,role,task_id,task_kind,priority_number,spawned_at_ms,started_at_ms,completed_at_ms,status,command,isolated_context_path,exit_code,metadata";

    private final Database database;

    public ProcessStore(Database database) {
        this.database = database;
    }

    public long insert(NewProcess p) {
        String sql = """
                INSERT INTO processes(pid,role,task_id,task_kind,priority_number,spawned_at_ms,status,command,isolated_context_path,metadata)
                VALUES(?,?,?,?,?,?,?,?,?,?)
                """;
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, p.pid());
            ps.setString(2, p.role().name());
            ps.setString(3, p.taskId());
            ps.setString(4, p.taskKind().name());
            if (p.priorityNumber() == null) {
                ps.setNull(5, Types.INTEGER);
            } else {
                ps.setInt(5, p.priorityNumber());
            }
            ps.setLong(6, p.spawnedAtMs());
            ps.setString(7, ProcessStatus.SPAWNED.name());
            ps.setString(8, p.command());
            ps.setString(9, p.isolatedContextPath());
            ps.setString(10, Jsons.toCompactJson(p.metadata() == null ? Map.of() : p.metadata()));
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new IllegalStateException("No id generated for process record");
                }
                return keys.getLong(1);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record spawned process", e);
        }
    }

    public Optional<ProcessRecord> latestByPid(long pid) {
        String sql = "SELECT " + COLUMNS + " FROM processes WHERE pid=? ORDER BY spawned_at_ms DESC, id DESC LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, pid);
            List<ProcessRecord> rows = read(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load process record", e);
        }
    }

    public Optional<ProcessRecord> byId(long id) {
        String sql = "SELECT " + COLUMNS + " FROM processes WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, id);
            List<ProcessRecord> rows = read(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load process record", e);
        }
    }

    public List<ProcessRecord> listByStatus(List<ProcessStatus> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return List.of();
        }
        StringBuilder in = new StringBuilder();
        for (int i = 0; i < statuses.size(); i++) {
            in.append(i == 0 ? "?" : ",?");
        }
        String sql = "SELECT " + COLUMNS + " FROM processes WHERE status IN (" + in + ") ORDER BY spawned_at_ms ASC, id ASC";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < statuses.size(); i++) {
                ps.setString(i + 1, statuses.get(i).name());
            }
            return read(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list process records", e);
        }
    }

    public List<ProcessRecord> listRecent(int limit) {
        String sql = "SELECT " + COLUMNS + " FROM processes ORDER BY spawned_at_ms DESC, id DESC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            return read(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list process records", e);
        }
    }

    /**
     * Moves a non-terminal record to {@code RUNNING}. Returns false if another observer got
     * there first or the record is already terminal.
     */
    public boolean markRunning(long id, long startedAtMs) {
        String sql = "UPDATE processes SET status=?,started_at_ms=? WHERE id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, ProcessStatus.RUNNING.name());
            ps.setLong(2, startedAtMs);
            ps.setLong(3, id);
            ps.setString(4, ProcessStatus.SPAWNED.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark process running", e);
        }
    }

    /**
     * Applies a terminal status once. Returns false when the record was already terminal.
     */
    public boolean markTerminal(long id, ProcessStatus status, Integer exitCode, long completedAtMs) {
        if (!status.terminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        String sql = "UPDATE processes SET status=?,exit_code=?,completed_at_ms=? WHERE id=? AND status IN (?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, status.name());
            if (exitCode == null) {
                ps.setNull(2, Types.INTEGER);
            } else {
                ps.setInt(2, exitCode);
            }
            ps.setLong(3, completedAtMs);
            ps.setLong(4, id);
            ps.setString(5, ProcessStatus.SPAWNED.name());
            ps.setString(6, ProcessStatus.RUNNING.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to finalize process record", e);
        }
    }

    public void clearIsolatedContext(long id) {
        String sql = "UPDATE processes SET isolated_context_path=NULL WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear isolated context", e);
        }
    }

    private List<ProcessRecord> read(PreparedStatement ps) throws SQLException {
        List<ProcessRecord> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new ProcessRecord(
                        rs.getLong("id"),
                        rs.getLong("pid"),
                        Role.valueOf(rs.getString("role")),
                        rs.getString("task_id"),
                        TaskKind.valueOf(rs.getString("task_kind")),
                        WorkQueue.nullableInt(rs, "priority_number"),
                        rs.getLong("spawned_at_ms"),
                        WorkQueue.nullableLong(rs, "started_at_ms"),
                        WorkQueue.nullableLong(rs, "completed_at_ms"),
                        ProcessStatus.valueOf(rs.getString("status")),
                        rs.getString("command"),
                        rs.getString("isolated_context_path"),
                        WorkQueue.nullableInt(rs, "exit_code"),
                        Jsons.toMap(rs.getString("metadata"))
                ));
            }
        }
        return out;
    }

    public record NewProcess(
            long pid,
            Role role,
            String taskId,
            TaskKind taskKind,
            Integer priorityNumber,
            long spawnedAtMs,
            String command,
            String isolatedContextPath,
            Map<String, Object> metadata
    ) {
    }
}
