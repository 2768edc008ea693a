package io.agentwarden.storage;

import io.agentwarden.error.StorageException;
import io.agentwarden.model.Backup;
import io.agentwarden.model.ChangeLogEntry;
import io.agentwarden.model.PendingUpdate;
import io.agentwarden.model.UpdateStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for self-updates. Status changes are compare-and-set on the expected current
 * status, and each one writes its change-log row in the same transaction.
 */
public final class UpdateStore {
    private static final String UPDATE_COLUMNS = """
            update_id,target_path,proposed_content,proposed_sha256,base_sha256,origin_task_id,protected_target,
            status,backup_ref,reason,created_at_ms,decided_at_ms,decided_by,applied_at_ms,rolled_back_at_ms
            """;

    private final Database db;

    public UpdateStore(Database db) {
        this.db = db;
    }

    public void insert(PendingUpdate update, ChangeLogEntry entry) {
        String sql = "INSERT INTO pending_updates(" + UPDATE_COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
        inTransaction("insert update " + update.updateId(), c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, update.updateId());
                ps.setString(2, update.targetPath());
                ps.setString(3, update.proposedContent());
                ps.setString(4, update.proposedSha256());
                ps.setString(5, update.baseSha256());
                ps.setString(6, update.originTaskId());
                ps.setInt(7, update.protectedTarget() ? 1 : 0);
                ps.setString(8, update.status().name());
                ps.setString(9, update.backupRef());
                ps.setString(10, update.reason());
                ps.setLong(11, update.createdAtMs());
                setNullableLong(ps, 12, update.decidedAtMs());
                ps.setString(13, update.decidedBy());
                setNullableLong(ps, 14, update.appliedAtMs());
                setNullableLong(ps, 15, update.rolledBackAtMs());
                ps.executeUpdate();
            }
            appendLog(c, entry);
            return true;
        });
    }

    /** PENDING_APPROVAL to APPROVED or REJECTED. */
    public boolean recordDecision(String updateId, UpdateStatus to, String actor, String reason, long atMs, ChangeLogEntry entry) {
        String sql = """
                UPDATE pending_updates SET status=?, decided_by=?, decided_at_ms=?, reason=COALESCE(?, reason)
                WHERE update_id=? AND status=?
                """;
        return inTransaction("record decision for " + updateId, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, to.name());
                ps.setString(2, actor);
                ps.setLong(3, atMs);
                ps.setString(4, reason);
                ps.setString(5, updateId);
                ps.setString(6, UpdateStatus.PENDING_APPROVAL.name());
                if (ps.executeUpdate() == 0) {
                    c.rollback();
                    return false;
                }
            }
            appendLog(c, entry);
            return true;
        });
    }

    /** Stores the backup and links it to the update; only succeeds once per update. */
    public boolean saveBackup(Backup backup, ChangeLogEntry entry) {
        return inTransaction("save backup for " + backup.updateId(), c -> {
            try (PreparedStatement link = c.prepareStatement("""
                    UPDATE pending_updates SET backup_ref=?
                    WHERE update_id=? AND status=? AND backup_ref IS NULL
                    """)) {
                link.setString(1, backup.backupId());
                link.setString(2, backup.updateId());
                link.setString(3, UpdateStatus.APPROVED.name());
                if (link.executeUpdate() == 0) {
                    c.rollback();
                    return false;
                }
            }
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO backups(backup_id,update_id,target_path,target_existed,original_content,original_sha256,taken_at_ms)
                    VALUES(?,?,?,?,?,?,?)
                    """)) {
                ps.setString(1, backup.backupId());
                ps.setString(2, backup.updateId());
                ps.setString(3, backup.targetPath());
                ps.setInt(4, backup.targetExisted() ? 1 : 0);
                if (backup.originalContent() == null) {
                    ps.setNull(5, Types.BLOB);
                } else {
                    ps.setBytes(5, backup.originalContent());
                }
                ps.setString(6, backup.originalSha256());
                ps.setLong(7, backup.takenAtMs());
                ps.executeUpdate();
            }
            appendLog(c, entry);
            return true;
        });
    }

    public boolean markApplied(String updateId, long atMs, ChangeLogEntry entry) {
        return simpleTransition(updateId, UpdateStatus.APPROVED, UpdateStatus.APPLIED, "applied_at_ms", atMs, entry);
    }

    public boolean markRolledBack(String updateId, UpdateStatus from, long atMs, ChangeLogEntry entry) {
        return simpleTransition(updateId, from, UpdateStatus.ROLLED_BACK, "rolled_back_at_ms", atMs, entry);
    }

    public void appendLog(ChangeLogEntry entry) {
        inTransaction("append change log for " + entry.updateId(), c -> {
            appendLog(c, entry);
            return true;
        });
    }

    public Optional<PendingUpdate> find(String updateId) {
        try (Connection c = db.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + UPDATE_COLUMNS + " FROM pending_updates WHERE update_id=?")) {
            ps.setString(1, updateId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapUpdate(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read update: " + updateId, e);
        }
    }

    public List<PendingUpdate> list(UpdateStatus status, int limit) {
        String sql = status == null
                ? "SELECT " + UPDATE_COLUMNS + " FROM pending_updates ORDER BY created_at_ms ASC, update_id ASC LIMIT ?"
                : "SELECT " + UPDATE_COLUMNS + " FROM pending_updates WHERE status=? ORDER BY created_at_ms ASC, update_id ASC LIMIT ?";
        List<PendingUpdate> out = new ArrayList<>();
        try (Connection c = db.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            if (status != null) {
                ps.setString(idx++, status.name());
            }
            ps.setInt(idx, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapUpdate(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to list updates", e);
        }
    }

    public Optional<Backup> findBackup(String backupId) {
        try (Connection c = db.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     SELECT backup_id,update_id,target_path,target_existed,original_content,original_sha256,taken_at_ms
                     FROM backups WHERE backup_id=?
                     """)) {
            ps.setString(1, backupId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new Backup(
                        rs.getString("backup_id"),
                        rs.getString("update_id"),
                        rs.getString("target_path"),
                        rs.getInt("target_existed") == 1,
                        rs.getBytes("original_content"),
                        rs.getString("original_sha256"),
                        rs.getLong("taken_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read backup: " + backupId, e);
        }
    }

    public List<ChangeLogEntry> changeLog(String updateId) {
        String sql = """
                SELECT seq,update_id,at_ms,actor,action,from_status,to_status,before_ref,after_ref
                FROM update_change_log
                WHERE (? IS NULL OR update_id=?)
                ORDER BY seq ASC
                """;
        List<ChangeLogEntry> out = new ArrayList<>();
        try (Connection c = db.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, updateId);
            ps.setString(2, updateId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String from = rs.getString("from_status");
                    out.add(new ChangeLogEntry(
                            rs.getLong("seq"),
                            rs.getString("update_id"),
                            rs.getLong("at_ms"),
                            rs.getString("actor"),
                            rs.getString("action"),
                            from == null ? null : UpdateStatus.valueOf(from),
                            UpdateStatus.valueOf(rs.getString("to_status")),
                            rs.getString("before_ref"),
                            rs.getString("after_ref")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to read change log", e);
        }
    }

    private boolean simpleTransition(
            String updateId,
            UpdateStatus from,
            UpdateStatus to,
            String timestampColumn,
            long atMs,
            ChangeLogEntry entry
    ) {
        String sql = "UPDATE pending_updates SET status=?, " + timestampColumn + "=? WHERE update_id=? AND status=?";
        return inTransaction("move update " + updateId + " to " + to, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, to.name());
                ps.setLong(2, atMs);
                ps.setString(3, updateId);
                ps.setString(4, from.name());
                if (ps.executeUpdate() == 0) {
                    c.rollback();
                    return false;
                }
            }
            appendLog(c, entry);
            return true;
        });
    }

    private void appendLog(Connection c, ChangeLogEntry entry) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO update_change_log(update_id,at_ms,actor,action,from_status,to_status,before_ref,after_ref)
                VALUES(?,?,?,?,?,?,?,?)
                """)) {
            ps.setString(1, entry.updateId());
            ps.setLong(2, entry.atMs());
            ps.setString(3, entry.actor());
            ps.setString(4, entry.action());
            ps.setString(5, entry.fromStatus() == null ? null : entry.fromStatus().name());
            ps.setString(6, entry.toStatus().name());
            ps.setString(7, entry.beforeRef());
            ps.setString(8, entry.afterRef());
            ps.executeUpdate();
        }
    }

    private boolean inTransaction(String what, SqlWork work) {
        try (Connection c = db.openConnection()) {
            c.setAutoCommit(false);
            try {
                boolean done = work.run(c);
                if (done) {
                    c.commit();
                }
                return done;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to " + what, e);
        }
    }

    private PendingUpdate mapUpdate(ResultSet rs) throws SQLException {
        String status = rs.getString("status");
        return new PendingUpdate(
                rs.getString("update_id"),
                rs.getString("target_path"),
                rs.getString("proposed_content"),
                rs.getString("proposed_sha256"),
                rs.getString("base_sha256"),
                rs.getString("origin_task_id"),
                rs.getInt("protected_target") == 1,
                UpdateStatus.valueOf(status),
                rs.getString("backup_ref"),
                rs.getString("reason"),
                rs.getLong("created_at_ms"),
                getNullableLong(rs, "decided_at_ms"),
                rs.getString("decided_by"),
                getNullableLong(rs, "applied_at_ms"),
                getNullableLong(rs, "rolled_back_at_ms")
        );
    }

    private static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    @FunctionalInterface
    private interface SqlWork {
        boolean run(Connection c) throws SQLException;
    }
}
