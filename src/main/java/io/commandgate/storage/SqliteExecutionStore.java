package io.commandgate.storage;

import io.commandgate.model.Command;
import io.commandgate.model.ErrorType;
import io.commandgate.model.ExecutionFailure;
import io.commandgate.model.ExecutionRecord;
import io.commandgate.model.ExecutionState;
import io.commandgate.model.PolicyVerdict;
import io.commandgate.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SqliteExecutionStore implements ExecutionStore {
    private static final String COLUMNS = "execution_id,command_json,state,verdict,approval_id,result_json,"
            + "error_type,failure_reason,attempt_count,agent_id,created_at_ms,updated_at_ms";

    private final Database database;

    public SqliteExecutionStore(Database database) {
        this.database = database;
    }

    @Override
    public boolean create(ExecutionRecord record) {
        String sql = "INSERT OR IGNORE INTO executions(" + COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, record.executionId());
            ps.setString(2, Jsons.toCanonicalJson(record.command()));
            ps.setString(3, record.state().name());
            ps.setString(4, record.verdict() == null ? null : record.verdict().name());
            ps.setString(5, record.approvalId());
            ps.setString(6, record.result() == null ? null : Jsons.toCanonicalJson(record.result()));
            ps.setString(7, record.failure() == null ? null : record.failure().errorType().name());
            ps.setString(8, record.failure() == null ? null : record.failure().reason());
            ps.setInt(9, record.attemptCount());
            ps.setString(10, record.agentId());
            ps.setLong(11, record.createdAtMs());
            ps.setLong(12, record.updatedAtMs());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create execution: " + record.executionId(), e);
        }
    }

    @Override
    public Optional<ExecutionRecord> get(String executionId) {
        if (executionId == null) {
            return Optional.empty();
        }
        String sql = "SELECT " + COLUMNS + " FROM executions WHERE execution_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load execution: " + executionId, e);
        }
    }

    @Override
    public boolean transition(ExecutionState expected, ExecutionRecord next) {
        ExecutionStore.checkForward(expected, next);
        String sql = """
                UPDATE executions
                SET state=?, verdict=?, approval_id=?, result_json=?, error_type=?, failure_reason=?,
                    attempt_count=?, agent_id=?, updated_at_ms=?
                WHERE execution_id=? AND state=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, next.state().name());
            ps.setString(2, next.verdict() == null ? null : next.verdict().name());
            ps.setString(3, next.approvalId());
            ps.setString(4, next.result() == null ? null : Jsons.toCanonicalJson(next.result()));
            ps.setString(5, next.failure() == null ? null : next.failure().errorType().name());
            ps.setString(6, next.failure() == null ? null : next.failure().reason());
            ps.setInt(7, next.attemptCount());
            ps.setString(8, next.agentId());
            ps.setLong(9, next.updatedAtMs());
            ps.setString(10, next.executionId());
            ps.setString(11, expected.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update execution: " + next.executionId(), e);
        }
    }

    @Override
    public List<ExecutionRecord> listByState(ExecutionState state) {
        String sql = "SELECT " + COLUMNS + " FROM executions WHERE state=? ORDER BY created_at_ms ASC, execution_id ASC";
        List<ExecutionRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, state.name());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list executions by state: " + state, e);
        }
    }

    private static ExecutionRecord map(ResultSet rs) throws SQLException {
        String verdict = rs.getString("verdict");
        String resultJson = rs.getString("result_json");
        String errorType = rs.getString("error_type");
        return new ExecutionRecord(
                rs.getString("execution_id"),
                Jsons.read(rs.getString("command_json"), Command.class),
                ExecutionState.valueOf(rs.getString("state")),
                verdict == null ? null : PolicyVerdict.valueOf(verdict),
                rs.getString("approval_id"),
                resultJson == null ? null : Jsons.readMap(resultJson),
                errorType == null ? null : new ExecutionFailure(ErrorType.valueOf(errorType), rs.getString("failure_reason")),
                rs.getInt("attempt_count"),
                rs.getString("agent_id"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }
}
