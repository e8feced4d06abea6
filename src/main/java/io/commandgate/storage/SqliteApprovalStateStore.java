package io.commandgate.storage;

import io.commandgate.model.Approval;
import io.commandgate.model.ApprovalOutcome;
import io.commandgate.model.ApprovalStatus;
import io.commandgate.model.CommandGateException;
import io.commandgate.model.ErrorType;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public final class SqliteApprovalStateStore implements ApprovalStateStore {
    private static final String COLUMNS = "approval_id,execution_id,status,created_at_ms,decided_at_ms,decided_by";

    private final Database database;

    public SqliteApprovalStateStore(Database database) {
        this.database = database;
    }

    @Override
    public Approval create(String executionId) {
        Approval approval = Approval.pending("apr_" + UUID.randomUUID(), executionId, Instant.now().toEpochMilli());
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT OR IGNORE INTO approvals(" + COLUMNS + ") VALUES(?,?,?,?,?,?)")) {
            ps.setString(1, approval.approvalId());
            ps.setString(2, approval.executionId());
            ps.setString(3, approval.status().name());
            ps.setLong(4, approval.createdAtMs());
            ps.setNull(5, Types.INTEGER);
            ps.setNull(6, Types.VARCHAR);
            if (ps.executeUpdate() == 0) {
                throw new CommandGateException(ErrorType.APPROVAL_CONFLICT,
                        "Execution already has an approval: " + executionId);
            }
            return approval;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create approval for execution: " + executionId, e);
        }
    }

    @Override
    public Approval decide(String approvalId, ApprovalOutcome outcome, String decidedBy) {
        long now = Instant.now().toEpochMilli();
        String sql = """
                UPDATE approvals
                SET status=?, decided_at_ms=?, decided_by=?
                WHERE approval_id=? AND status=?
                """;
        int updated;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, outcome.toStatus().name());
            ps.setLong(2, now);
            ps.setString(3, decidedBy);
            ps.setString(4, approvalId);
            ps.setString(5, ApprovalStatus.PENDING.name());
            updated = ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to decide approval: " + approvalId, e);
        }
        Approval current = get(approvalId).orElseThrow(() -> CommandGateException.notFound("approval", approvalId));
        if (updated == 0) {
            throw new CommandGateException(ErrorType.APPROVAL_CONFLICT,
                    "Approval already decided: " + approvalId + " status=" + current.status());
        }
        return current;
    }

    @Override
    public Optional<Approval> get(String approvalId) {
        return queryOne("SELECT " + COLUMNS + " FROM approvals WHERE approval_id=?", approvalId);
    }

    @Override
    public Optional<Approval> findByExecution(String executionId) {
        return queryOne("SELECT " + COLUMNS + " FROM approvals WHERE execution_id=?", executionId);
    }

    @Override
    public List<Approval> listPending() {
        String sql = "SELECT " + COLUMNS + " FROM approvals WHERE status=? ORDER BY created_at_ms ASC, approval_id ASC";
        List<Approval> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, ApprovalStatus.PENDING.name());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list pending approvals", e);
        }
    }

    private Optional<Approval> queryOne(String sql, String key) {
        if (key == null) {
            return Optional.empty();
        }
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load approval: " + key, e);
        }
    }

    private static Approval map(ResultSet rs) throws SQLException {
        long decidedAt = rs.getLong("decided_at_ms");
        Long decidedAtMs = rs.wasNull() ? null : decidedAt;
        return new Approval(
                rs.getString("approval_id"),
                rs.getString("execution_id"),
                ApprovalStatus.valueOf(rs.getString("status")),
                rs.getLong("created_at_ms"),
                decidedAtMs,
                rs.getString("decided_by")
        );
    }
}
