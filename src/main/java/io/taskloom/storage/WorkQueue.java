package io.taskloom.storage;

import io.taskloom.model.NewTask;
import io.taskloom.model.Priority;
import io.taskloom.model.Task;
import io.taskloom.model.TaskStatus;
import io.taskloom.util.Jsons;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable priority queue of tasks addressed to worker roles. Lower priority values are
 * served first, ties by creation time and then by insertion order. Every state change is a
 * status-conditional UPDATE, so two consumers can never both claim the same row.
 */
public final class WorkQueue {
    private static final int DEQUEUE_ATTEMPTS = 8;
    private static final String TASK_COLUMNS =
            "task_id,sender,recipient,kind,priority,payload,status,started_by,created_at_ms,started_at_ms,completed_at_ms,duration_ms,error";

    private final Database database;
    private final Clock clock;

    public WorkQueue(Database database) {
        this(database, Clock.systemUTC());
    }

    public WorkQueue(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if {@code taskId} is already taken
     */
    public String enqueue(NewTask task) {
        String taskId = task.taskId() == null || task.taskId().isBlank()
                ? "tsk_" + UUID.randomUUID()
                : task.taskId().trim();
        String sql = """
                INSERT INTO tasks(task_id,sender,recipient,kind,priority,payload,status,created_at_ms)
                VALUES(?,?,?,?,?,?,?,?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, taskId);
            ps.setString(2, task.sender());
            ps.setString(3, task.recipient());
            ps.setString(4, task.kind());
            ps.setInt(5, task.priority());
            ps.setString(6, Jsons.toCompactJson(task.payload()));
            ps.setString(7, TaskStatus.QUEUED.name());
            ps.setLong(8, clock.millis());
            ps.executeUpdate();
        } catch (SQLException e) {
            if (isPrimaryKeyViolation(e)) {
                throw new IllegalArgumentException("Task id already exists: " + taskId, e);
            }
            throw new RuntimeException("Failed to enqueue task", e);
        }
        return taskId;
    }

    static boolean isPrimaryKeyViolation(SQLException e) {
        if (e instanceof SQLiteException sqlite) {
            SQLiteErrorCode code = sqlite.getResultCode();
            if (code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY) {
                return true;
            }
        }
        String message = e.getMessage();
        return message != null && message.contains("UNIQUE constraint failed: tasks.task_id");
    }

    /**
     * Claims the most urgent queued task for {@code recipient}. A claim lost to a concurrent
     * consumer is retried against the next candidate a bounded number of times.
     */
    public Optional<Task> dequeue(String recipient) {
        String select = """
                SELECT task_id FROM tasks
                WHERE recipient=? AND status=?
                ORDER BY priority ASC, created_at_ms ASC, rowid ASC
                LIMIT 1
                """;
        String claim = "UPDATE tasks SET status=?,started_by=?,started_at_ms=? WHERE task_id=? AND status=?";
        try (Connection c = database.openConnection();
             PreparedStatement sel = c.prepareStatement(select);
             PreparedStatement upd = c.prepareStatement(claim)) {
            for (int attempt = 0; attempt < DEQUEUE_ATTEMPTS; attempt++) {
                sel.setString(1, recipient);
                sel.setString(2, TaskStatus.QUEUED.name());
                String taskId;
                try (ResultSet rs = sel.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    taskId = rs.getString(1);
                }
                upd.setString(1, TaskStatus.RUNNING.name());
                upd.setString(2, recipient);
                upd.setLong(3, clock.millis());
                upd.setString(4, taskId);
                upd.setString(5, TaskStatus.QUEUED.name());
                if (upd.executeUpdate() == 1) {
                    return findTask(c, taskId);
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to dequeue task", e);
        }
    }

    public boolean markStarted(String taskId, String startedBy) {
        String sql = """
                UPDATE tasks SET status=?,started_by=COALESCE(?,started_by),started_at_ms=COALESCE(started_at_ms,?)
                WHERE task_id=? AND status IN (?,?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.RUNNING.name());
            ps.setString(2, startedBy);
            ps.setLong(3, clock.millis());
            ps.setString(4, taskId);
            ps.setString(5, TaskStatus.QUEUED.name());
            ps.setString(6, TaskStatus.RUNNING.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark task started", e);
        }
    }

    /**
     * Completes a task. A null {@code durationMs} is derived from the recorded start time.
     * Returns false when the task is unknown or already terminal.
     */
    public boolean markCompleted(String taskId, Long durationMs) {
        return finish(taskId, TaskStatus.COMPLETED, durationMs, null);
    }

    public boolean markFailed(String taskId, String error) {
        return finish(taskId, TaskStatus.FAILED, null, error == null ? "" : error);
    }

    private boolean finish(String taskId, TaskStatus terminal, Long durationMs, String error) {
        String sql = """
                UPDATE tasks SET status=?,completed_at_ms=?,duration_ms=COALESCE(?,MAX(0,?-started_at_ms)),error=?
                WHERE task_id=? AND status IN (?,?)
                """;
        long nowMs = clock.millis();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, terminal.name());
            ps.setLong(2, nowMs);
            if (durationMs == null) {
                ps.setNull(3, Types.BIGINT);
            } else {
                ps.setLong(3, Math.max(0L, durationMs));
            }
            ps.setLong(4, nowMs);
            ps.setString(5, error);
            ps.setString(6, taskId);
            ps.setString(7, TaskStatus.QUEUED.name());
            ps.setString(8, TaskStatus.RUNNING.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark task " + terminal.name().toLowerCase(), e);
        }
    }

    /**
     * Puts a running or failed task back in the queue. This is the only way a claimed task
     * becomes claimable again.
     */
    public boolean requeue(String taskId) {
        String sql = """
                UPDATE tasks SET status=?,started_by=NULL,started_at_ms=NULL,completed_at_ms=NULL,duration_ms=NULL,error=NULL
                WHERE task_id=? AND status IN (?,?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.QUEUED.name());
            ps.setString(2, taskId);
            ps.setString(3, TaskStatus.RUNNING.name());
            ps.setString(4, TaskStatus.FAILED.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to requeue task", e);
        }
    }

    public Optional<Task> getTask(String taskId) {
        try (Connection c = database.openConnection()) {
            return findTask(c, taskId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load task", e);
        }
    }

    public List<Task> listTasks(TaskStatus status, int limit) {
        String sql = status == null
                ? "SELECT " + TASK_COLUMNS + " FROM tasks ORDER BY created_at_ms DESC, rowid DESC LIMIT ?"
                : "SELECT " + TASK_COLUMNS + " FROM tasks WHERE status=? ORDER BY created_at_ms DESC, rowid DESC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            if (status != null) {
                ps.setString(i++, status.name());
            }
            ps.setInt(i, Math.max(1, limit));
            return readTasks(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list tasks", e);
        }
    }

    public List<Task> slowestTasks(int limit) {
        String sql = "SELECT " + TASK_COLUMNS + " FROM tasks WHERE status=? AND duration_ms IS NOT NULL"
                + " ORDER BY duration_ms DESC, task_id ASC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.COMPLETED.name());
            ps.setInt(2, Math.max(1, limit));
            return readTasks(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list slowest tasks", e);
        }
    }

    /**
     * Per-recipient outcome counts and duration distribution of completed tasks.
     */
    public List<AgentPerformance> agentPerformance() {
        String sql = "SELECT recipient,status,duration_ms FROM tasks ORDER BY recipient";
        Map<String, List<Long>> durations = new LinkedHashMap<>();
        Map<String, int[]> counts = new LinkedHashMap<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String recipient = rs.getString("recipient");
                TaskStatus status = TaskStatus.valueOf(rs.getString("status"));
                int[] row = counts.computeIfAbsent(recipient, k -> new int[3]);
                List<Long> list = durations.computeIfAbsent(recipient, k -> new ArrayList<>());
                row[0]++;
                if (status == TaskStatus.COMPLETED) {
                    row[1]++;
                    long duration = rs.getLong("duration_ms");
                    if (!rs.wasNull()) {
                        list.add(duration);
                    }
                } else if (status == TaskStatus.FAILED) {
                    row[2]++;
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to compute agent performance", e);
        }
        List<AgentPerformance> out = new ArrayList<>();
        for (Map.Entry<String, int[]> entry : counts.entrySet()) {
            List<Long> list = durations.get(entry.getKey());
            Collections.sort(list);
            double avg = list.isEmpty() ? 0.0 : list.stream().mapToLong(Long::longValue).average().orElse(0.0);
            int[] row = entry.getValue();
            out.add(new AgentPerformance(
                    entry.getKey(),
                    row[0],
                    row[1],
                    row[2],
                    avg,
                    percentile(list, 50.0),
                    percentile(list, 95.0),
                    percentile(list, 99.0)
            ));
        }
        return out;
    }

    public Map<String, QueueDepth> queueDepth() {
        String sql = "SELECT recipient,priority,COUNT(1) AS n FROM tasks WHERE status=? GROUP BY recipient,priority ORDER BY recipient";
        Map<String, EnumMap<Priority, Integer>> bands = new LinkedHashMap<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.QUEUED.name());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Priority band = Priority.bandOf(rs.getInt("priority"));
                    bands.computeIfAbsent(rs.getString("recipient"), k -> new EnumMap<>(Priority.class))
                            .merge(band, rs.getInt("n"), Integer::sum);
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to compute queue depth", e);
        }
        Map<String, QueueDepth> out = new LinkedHashMap<>();
        bands.forEach((recipient, counts) -> {
            int high = counts.getOrDefault(Priority.HIGH, 0);
            int normal = counts.getOrDefault(Priority.NORMAL, 0);
            int low = counts.getOrDefault(Priority.LOW, 0);
            out.put(recipient, new QueueDepth(high, normal, low, high + normal + low));
        });
        return out;
    }

    public TaskMetrics taskMetrics() {
        String sql = "SELECT status,COUNT(1) AS n,AVG(duration_ms) AS avg_ms FROM tasks GROUP BY status";
        Map<TaskStatus, Integer> byStatus = new EnumMap<>(TaskStatus.class);
        double avgCompleted = 0.0;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                TaskStatus status = TaskStatus.valueOf(rs.getString("status"));
                byStatus.put(status, rs.getInt("n"));
                if (status == TaskStatus.COMPLETED) {
                    avgCompleted = rs.getDouble("avg_ms");
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to compute task metrics", e);
        }
        int total = byStatus.values().stream().mapToInt(Integer::intValue).sum();
        return new TaskMetrics(
                total,
                byStatus.getOrDefault(TaskStatus.QUEUED, 0),
                byStatus.getOrDefault(TaskStatus.RUNNING, 0),
                byStatus.getOrDefault(TaskStatus.COMPLETED, 0),
                byStatus.getOrDefault(TaskStatus.FAILED, 0),
                avgCompleted
        );
    }

    public int size(String recipient) {
        String sql = "SELECT COUNT(1) FROM tasks WHERE recipient=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, recipient);
            ps.setString(2, TaskStatus.QUEUED.name());
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count queued tasks", e);
        }
    }

    public boolean hasQueued(String recipient) {
        return size(recipient) > 0;
    }

    /**
     * Deletes completed and failed tasks that finished more than {@code retentionDays} ago.
     */
    public int cleanupOld(int retentionDays) {
        long cutoffMs = clock.millis() - Math.max(0, retentionDays) * 24L * 60L * 60L * 1000L;
        String sql = "DELETE FROM tasks WHERE status IN (?,?) AND COALESCE(completed_at_ms,created_at_ms)<?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.COMPLETED.name());
            ps.setString(2, TaskStatus.FAILED.name());
            ps.setLong(3, cutoffMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to purge old tasks", e);
        }
    }

    public void recordMetric(String role, String metric, double value) {
        String sql = "INSERT INTO agent_metrics(role,metric,value,recorded_at_ms) VALUES(?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, role);
            ps.setString(2, metric);
            ps.setDouble(3, value);
            ps.setLong(4, clock.millis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record agent metric", e);
        }
    }

    public List<AgentMetric> metrics(String role, int limit) {
        String sql = """
                SELECT role,metric,value,recorded_at_ms FROM agent_metrics
                WHERE role=? ORDER BY recorded_at_ms DESC, id DESC LIMIT ?
                """;
        List<AgentMetric> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, role);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new AgentMetric(
                            rs.getString("role"),
                            rs.getString("metric"),
                            rs.getDouble("value"),
                            rs.getLong("recorded_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list agent metrics", e);
        }
    }

    /**
     * Nearest-rank percentile: the value at rank {@code ceil(p/100 * n)}. Empty input yields 0.
     */
    public static long percentile(List<Long> values, double p) {
        if (values == null || values.isEmpty()) {
            return 0L;
        }
        List<Long> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int idx = (int) Math.ceil((p / 100.0) * sorted.size()) - 1;
        idx = Math.max(0, Math.min(sorted.size() - 1, idx));
        return sorted.get(idx);
    }

    private Optional<Task> findTask(Connection c, String taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + TASK_COLUMNS + " FROM tasks WHERE task_id=?")) {
            ps.setString(1, taskId);
            List<Task> rows = readTasks(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        }
    }

    private List<Task> readTasks(PreparedStatement ps) throws SQLException {
        List<Task> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new Task(
                        rs.getString("task_id"),
                        rs.getString("sender"),
                        rs.getString("recipient"),
                        rs.getString("kind"),
                        rs.getInt("priority"),
                        Jsons.toMap(rs.getString("payload")),
                        TaskStatus.valueOf(rs.getString("status")),
                        rs.getString("started_by"),
                        rs.getLong("created_at_ms"),
                        nullableLong(rs, "started_at_ms"),
                        nullableLong(rs, "completed_at_ms"),
                        nullableLong(rs, "duration_ms"),
                        rs.getString("error")
                ));
            }
        }
        return out;
    }

    static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    public record AgentPerformance(
            String role,
            int total,
            int completed,
            int failed,
            double avgDurationMs,
            long p50DurationMs,
            long p95DurationMs,
            long p99DurationMs
    ) {
    }

    public record QueueDepth(int high, int normal, int low, int total) {
    }

    public record TaskMetrics(int total, int queued, int running, int completed, int failed, double avgDurationMs) {
    }

    public record AgentMetric(String role, String metric, double value, long recordedAtMs) {
    }
}
