package io.agentwarden.storage;

import io.agentwarden.error.StorageException;
import io.agentwarden.model.Priority;
import io.agentwarden.model.TaskError;
import io.agentwarden.model.TaskPayload;
import io.agentwarden.model.TaskStatus;
import io.agentwarden.model.TaskType;
import io.agentwarden.model.TaskView;
import io.agentwarden.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Single-node queue on the embedded database. Claims rely on IMMEDIATE transactions. */
public final class SqliteQueueBackend implements QueueBackend {
    private static final String TASK_COLUMNS = """
            task_id,seq,task_type,priority_rank,payload_json,status,attempt_count,max_attempts,
            created_at_ms,claimed_at_ms,completed_at_ms,lease_owner,lease_expires_at_ms,
            next_retry_at_ms,cancel_requested,result,error_json
            """;

    private final Database db;

    public SqliteQueueBackend(Database db) {
        this.db = db;
    }

    @Override
    public void init() {
        db.init();
    }

    @Override
    public long insert(NewTask task) {
        String sql = """
                INSERT INTO tasks(task_id,seq,task_type,priority_rank,payload_json,status,attempt_count,
                                  max_attempts,created_at_ms,updated_at_ms)
                VALUES(?,(SELECT COALESCE(MAX(seq),0)+1 FROM tasks),?,?,?,?,0,?,?,?)
                """;
        try (Connection c = db.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql);
                 PreparedStatement seq = c.prepareStatement("SELECT seq FROM tasks WHERE task_id=?")) {
                ps.setString(1, task.taskId());
                ps.setString(2, task.type().wireName());
                ps.setInt(3, task.priority().rank());
                ps.setString(4, Jsons.toCompactJson(task.payload()));
                ps.setString(5, TaskStatus.PENDING.name());
                ps.setInt(6, task.maxAttempts());
                ps.setLong(7, task.createdAtMs());
                ps.setLong(8, task.createdAtMs());
                ps.executeUpdate();
                seq.setString(1, task.taskId());
                long assigned;
                try (ResultSet rs = seq.executeQuery()) {
                    rs.next();
                    assigned = rs.getLong(1);
                }
                c.commit();
                return assigned;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to insert task: " + task.taskId(), e);
        }
    }

    @Override
    public Optional<TaskView> claimNext(String workerId, String leaseToken, long nowMs, long leaseExpiresAtMs) {
        String promote = """
                UPDATE tasks SET status=?, next_retry_at_ms=NULL, updated_at_ms=?
                WHERE status=? AND next_retry_at_ms<=?
                """;
        String select = """
                SELECT task_id FROM tasks
                WHERE status=?
                ORDER BY priority_rank DESC, created_at_ms ASC, seq ASC
                LIMIT 1
                """;
        String claim = """
                UPDATE tasks
                SET status=?, lease_owner=?, lease_token=?, lease_expires_at_ms=?, claimed_at_ms=?, updated_at_ms=?
                WHERE task_id=? AND status=?
                """;
        try (Connection c = db.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement promoteSt = c.prepareStatement(promote);
                 PreparedStatement selectSt = c.prepareStatement(select);
                 PreparedStatement claimSt = c.prepareStatement(claim)) {
                promoteSt.setString(1, TaskStatus.PENDING.name());
                promoteSt.setLong(2, nowMs);
                promoteSt.setString(3, TaskStatus.RETRYING.name());
                promoteSt.setLong(4, nowMs);
                promoteSt.executeUpdate();

                selectSt.setString(1, TaskStatus.PENDING.name());
                String taskId;
                try (ResultSet rs = selectSt.executeQuery()) {
                    if (!rs.next()) {
                        c.commit();
                        return Optional.empty();
                    }
                    taskId = rs.getString("task_id");
                }

                claimSt.setString(1, TaskStatus.CLAIMED.name());
                claimSt.setString(2, workerId);
                claimSt.setString(3, leaseToken);
                claimSt.setLong(4, leaseExpiresAtMs);
                claimSt.setLong(5, nowMs);
                claimSt.setLong(6, nowMs);
                claimSt.setString(7, taskId);
                claimSt.setString(8, TaskStatus.PENDING.name());
                if (claimSt.executeUpdate() == 0) {
                    c.rollback();
                    return Optional.empty();
                }
                Optional<TaskView> claimed = readTask(c, taskId);
                c.commit();
                return claimed;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to claim task for worker " + workerId, e);
        }
    }

    @Override
    public boolean markRunning(String taskId, String leaseToken, long nowMs) {
        String sql = """
                UPDATE tasks SET status=?, updated_at_ms=?
                WHERE task_id=? AND status=? AND lease_token=? AND lease_expires_at_ms>=?
                """;
        try (Connection c = db.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.RUNNING.name());
            ps.setLong(2, nowMs);
            ps.setString(3, taskId);
            ps.setString(4, TaskStatus.CLAIMED.name());
            ps.setString(5, leaseToken);
            ps.setLong(6, nowMs);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to mark task running: " + taskId, e);
        }
    }

    @Override
    public LeaseCheck checkLease(String taskId, String leaseToken, long nowMs) {
        try (Connection c = db.openConnection()) {
            LeaseState lease = readLease(c, taskId);
            if (lease == null || !lease.heldBy(leaseToken, nowMs)) {
                return LeaseCheck.NOT_HELD;
            }
            return lease.cancelRequested() ? LeaseCheck.CANCEL_REQUESTED : LeaseCheck.HELD;
        } catch (SQLException e) {
            throw new StorageException("Failed to check lease of task: " + taskId, e);
        }
    }

    @Override
    public AckOutcome ack(String taskId, String leaseToken, String result, long nowMs) {
        try (Connection c = db.openConnection()) {
            c.setAutoCommit(false);
            try {
                LeaseState lease = readLease(c, taskId);
                if (lease == null || !lease.heldBy(leaseToken, nowMs)) {
                    c.rollback();
                    return AckOutcome.NOT_CLAIMED;
                }
                TaskStatus next = lease.cancelRequested() ? TaskStatus.CANCELLED : TaskStatus.COMPLETED;
                try (PreparedStatement ps = c.prepareStatement("""
                        UPDATE tasks
                        SET status=?, result=?, completed_at_ms=?, updated_at_ms=?,
                            lease_owner=NULL, lease_token=NULL, lease_expires_at_ms=NULL
                        WHERE task_id=? AND lease_token=?
                        """)) {
                    ps.setString(1, next.name());
                    ps.setString(2, next == TaskStatus.COMPLETED ? result : null);
                    ps.setLong(3, nowMs);
                    ps.setLong(4, nowMs);
                    ps.setString(5, taskId);
                    ps.setString(6, leaseToken);
                    if (ps.executeUpdate() == 0) {
                        c.rollback();
                        return AckOutcome.NOT_CLAIMED;
                    }
                }
                c.commit();
                return next == TaskStatus.COMPLETED ? AckOutcome.COMPLETED : AckOutcome.CANCELLED;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to ack task: " + taskId, e);
        }
    }

    @Override
    public FailureResolution fail(String taskId, String leaseToken, TaskError error, long nowMs, RetryDecision retry) {
        try (Connection c = db.openConnection()) {
            c.setAutoCommit(false);
            try {
                LeaseState lease = readLease(c, taskId);
                if (lease == null || !lease.heldBy(leaseToken, nowMs)) {
                    c.rollback();
                    return FailureResolution.notClaimed();
                }
                int attempts = lease.attemptCount() + 1;
                FailureResolution resolution;
                if (lease.cancelRequested()) {
                    resolution = FailureResolution.cancelled(attempts);
                } else if (error.retryable() && attempts < lease.maxAttempts()) {
                    resolution = FailureResolution.retryScheduled(attempts, retry.nextRetryAtMs(attempts, nowMs));
                } else {
                    resolution = FailureResolution.failed(attempts);
                }
                TaskStatus next = switch (resolution.outcome()) {
                    case RETRY_SCHEDULED -> TaskStatus.RETRYING;
                    case CANCELLED -> TaskStatus.CANCELLED;
                    default -> TaskStatus.FAILED;
                };
                try (PreparedStatement ps = c.prepareStatement("""
                        UPDATE tasks
                        SET status=?, attempt_count=?, error_json=?, next_retry_at_ms=?, completed_at_ms=?,
                            updated_at_ms=?, lease_owner=NULL, lease_token=NULL, lease_expires_at_ms=NULL
                        WHERE task_id=? AND lease_token=?
                        """)) {
                    ps.setString(1, next.name());
                    ps.setInt(2, attempts);
                    ps.setString(3, Jsons.toCompactJson(error));
                    setNullableLong(ps, 4, resolution.nextRetryAtMs());
                    setNullableLong(ps, 5, next.terminal() ? nowMs : null);
                    ps.setLong(6, nowMs);
                    ps.setString(7, taskId);
                    ps.setString(8, leaseToken);
                    if (ps.executeUpdate() == 0) {
                        c.rollback();
                        return FailureResolution.notClaimed();
                    }
                }
                c.commit();
                return resolution;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to record task failure: " + taskId, e);
        }
    }

    @Override
    public List<ReapedTask> reapExpired(long nowMs, int limit) {
        String select = """
                SELECT task_id,lease_owner,attempt_count,max_attempts,cancel_requested FROM tasks
                WHERE status IN (?,?) AND lease_expires_at_ms<?
                ORDER BY lease_expires_at_ms ASC
                LIMIT ?
                """;
        String revert = """
                UPDATE tasks
                SET status=?, attempt_count=attempt_count+1, completed_at_ms=?, updated_at_ms=?,
                    error_json=COALESCE(?, error_json),
                    lease_owner=NULL, lease_token=NULL, lease_expires_at_ms=NULL, claimed_at_ms=NULL
                WHERE task_id=? AND status IN (?,?) AND lease_expires_at_ms<?
                """;
        List<ReapedTask> out = new ArrayList<>();
        try (Connection c = db.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement sel = c.prepareStatement(select);
                 PreparedStatement upd = c.prepareStatement(revert)) {
                sel.setString(1, TaskStatus.CLAIMED.name());
                sel.setString(2, TaskStatus.RUNNING.name());
                sel.setLong(3, nowMs);
                sel.setInt(4, Math.max(1, limit));
                List<ReapedTask> candidates = new ArrayList<>();
                try (ResultSet rs = sel.executeQuery()) {
                    while (rs.next()) {
                        int attempts = rs.getInt("attempt_count") + 1;
                        TaskStatus next;
                        if (rs.getInt("cancel_requested") == 1) {
                            next = TaskStatus.CANCELLED;
                        } else if (attempts >= rs.getInt("max_attempts")) {
                            next = TaskStatus.FAILED;
                        } else {
                            next = TaskStatus.PENDING;
                        }
                        candidates.add(new ReapedTask(rs.getString("task_id"), rs.getString("lease_owner"), next, attempts));
                    }
                }
                for (ReapedTask candidate : candidates) {
                    upd.setString(1, candidate.newStatus().name());
                    setNullableLong(upd, 2, candidate.newStatus().terminal() ? nowMs : null);
                    upd.setLong(3, nowMs);
                    upd.setString(4, candidate.newStatus() == TaskStatus.FAILED
                            ? Jsons.toCompactJson(ReapedTask.exhaustedError(candidate.attemptCount()))
                            : null);
                    upd.setString(5, candidate.taskId());
                    upd.setString(6, TaskStatus.CLAIMED.name());
                    upd.setString(7, TaskStatus.RUNNING.name());
                    upd.setLong(8, nowMs);
                    if (upd.executeUpdate() > 0) {
                        out.add(candidate);
                    }
                }
                c.commit();
                return out;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to reap expired leases", e);
        }
    }

    @Override
    public CancelOutcome cancel(String taskId, long nowMs) {
        try (Connection c = db.openConnection()) {
            c.setAutoCommit(false);
            try {
                TaskStatus status;
                try (PreparedStatement ps = c.prepareStatement("SELECT status FROM tasks WHERE task_id=?")) {
                    ps.setString(1, taskId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            c.rollback();
                            return CancelOutcome.NOT_FOUND;
                        }
                        status = TaskStatus.valueOf(rs.getString("status"));
                    }
                }
                CancelOutcome outcome;
                if (status == TaskStatus.PENDING || status == TaskStatus.RETRYING) {
                    try (PreparedStatement ps = c.prepareStatement("""
                            UPDATE tasks SET status=?, next_retry_at_ms=NULL, completed_at_ms=?, updated_at_ms=?
                            WHERE task_id=?
                            """)) {
                        ps.setString(1, TaskStatus.CANCELLED.name());
                        ps.setLong(2, nowMs);
                        ps.setLong(3, nowMs);
                        ps.setString(4, taskId);
                        ps.executeUpdate();
                    }
                    outcome = CancelOutcome.CANCELLED;
                } else if (status.holdsLease()) {
                    try (PreparedStatement ps = c.prepareStatement(
                            "UPDATE tasks SET cancel_requested=1, updated_at_ms=? WHERE task_id=?")) {
                        ps.setLong(1, nowMs);
                        ps.setString(2, taskId);
                        ps.executeUpdate();
                    }
                    outcome = CancelOutcome.CANCEL_REQUESTED;
                } else {
                    outcome = CancelOutcome.NOT_CANCELLABLE;
                }
                c.commit();
                return outcome;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to cancel task: " + taskId, e);
        }
    }

    @Override
    public Optional<TaskView> find(String taskId) {
        try (Connection c = db.openConnection()) {
            return readTask(c, taskId);
        } catch (SQLException e) {
            throw new StorageException("Failed to read task: " + taskId, e);
        }
    }

    @Override
    public List<TaskView> list(TaskStatus status, int limit) {
        String sql = status == null
                ? "SELECT " + TASK_COLUMNS + " FROM tasks ORDER BY seq ASC LIMIT ?"
                : "SELECT " + TASK_COLUMNS + " FROM tasks WHERE status=? ORDER BY seq ASC LIMIT ?";
        List<TaskView> out = new ArrayList<>();
        try (Connection c = db.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            if (status != null) {
                ps.setString(idx++, status.name());
            }
            ps.setInt(idx, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapTask(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to list tasks", e);
        }
    }

    @Override
    public Map<TaskStatus, Long> countByStatus() {
        Map<TaskStatus, Long> out = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            out.put(status, 0L);
        }
        try (Connection c = db.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT status, COUNT(*) AS n FROM tasks GROUP BY status");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(TaskStatus.valueOf(rs.getString("status")), rs.getLong("n"));
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to count tasks", e);
        }
    }

    private Optional<TaskView> readTask(Connection c, String taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + TASK_COLUMNS + " FROM tasks WHERE task_id=?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapTask(rs));
            }
        }
    }

    private LeaseState readLease(Connection c, String taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT status,lease_token,lease_expires_at_ms,attempt_count,max_attempts,cancel_requested
                FROM tasks WHERE task_id=?
                """)) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return new LeaseState(
                        TaskStatus.valueOf(rs.getString("status")),
                        rs.getString("lease_token"),
                        getNullableLong(rs, "lease_expires_at_ms"),
                        rs.getInt("attempt_count"),
                        rs.getInt("max_attempts"),
                        rs.getInt("cancel_requested") == 1
                );
            }
        }
    }

    private TaskView mapTask(ResultSet rs) throws SQLException {
        String errorJson = rs.getString("error_json");
        return new TaskView(
                rs.getString("task_id"),
                rs.getLong("seq"),
                TaskType.fromWire(rs.getString("task_type")),
                Priority.fromRank(rs.getInt("priority_rank")),
                Jsons.fromJson(rs.getString("payload_json"), TaskPayload.class),
                TaskStatus.valueOf(rs.getString("status")),
                rs.getInt("attempt_count"),
                rs.getInt("max_attempts"),
                rs.getLong("created_at_ms"),
                getNullableLong(rs, "claimed_at_ms"),
                getNullableLong(rs, "completed_at_ms"),
                rs.getString("lease_owner"),
                getNullableLong(rs, "lease_expires_at_ms"),
                getNullableLong(rs, "next_retry_at_ms"),
                rs.getInt("cancel_requested") == 1,
                rs.getString("result"),
                errorJson == null ? null : Jsons.fromJson(errorJson, TaskError.class)
        );
    }

    private static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, java.sql.Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    private record LeaseState(
            TaskStatus status,
            String leaseToken,
            Long leaseExpiresAtMs,
            int attemptCount,
            int maxAttempts,
            boolean cancelRequested
    ) {
        boolean heldBy(String token, long nowMs) {
            return status.holdsLease()
                    && token != null
                    && token.equals(leaseToken)
                    && leaseExpiresAtMs != null
                    && leaseExpiresAtMs >= nowMs;
        }
    }
}
