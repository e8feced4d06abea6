package io.commandgate.storage;

import io.commandgate.model.ErrorType;
import io.commandgate.model.ExecutionFailure;
import io.commandgate.model.ExecutionRecord;
import io.commandgate.model.ExecutionState;
import io.commandgate.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

public final class SqliteIdempotencyIndex implements IdempotencyIndex {
    private final Database database;

    public SqliteIdempotencyIndex(Database database) {
        this.database = database;
    }

    @Override
    public Optional<IndexEntry> lookup(String executionId) {
        if (executionId == null) {
            return Optional.empty();
        }
        String sql = """
                SELECT execution_id,status,outcome_state,result_json,error_type,failure_reason,agent_id,recorded_at_ms
                FROM idempotency_index WHERE execution_id=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                String outcomeState = rs.getString("outcome_state");
                String resultJson = rs.getString("result_json");
                String errorType = rs.getString("error_type");
                return Optional.of(new IndexEntry(
                        rs.getString("execution_id"),
                        IndexEntry.Status.valueOf(rs.getString("status")),
                        outcomeState == null ? null : ExecutionState.valueOf(outcomeState),
                        resultJson == null ? null : Jsons.readMap(resultJson),
                        errorType == null ? null : new ExecutionFailure(ErrorType.valueOf(errorType), rs.getString("failure_reason")),
                        rs.getString("agent_id"),
                        rs.getLong("recorded_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to look up idempotency entry: " + executionId, e);
        }
    }

    @Override
    public boolean reserve(String executionId) {
        String sql = "INSERT OR IGNORE INTO idempotency_index(execution_id,status,recorded_at_ms) VALUES(?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, executionId);
            ps.setString(2, IndexEntry.Status.PROCESSING.name());
            ps.setLong(3, Instant.now().toEpochMilli());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reserve idempotency entry: " + executionId, e);
        }
    }

    @Override
    public void complete(ExecutionRecord outcome) {
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("Only terminal outcomes can be indexed: " + outcome.executionId());
        }
        String sql = """
                INSERT INTO idempotency_index(execution_id,status,outcome_state,result_json,error_type,failure_reason,agent_id,recorded_at_ms)
                VALUES(?,?,?,?,?,?,?,?)
                ON CONFLICT(execution_id) DO UPDATE SET
                    status=excluded.status,
                    outcome_state=excluded.outcome_state,
                    result_json=excluded.result_json,
                    error_type=excluded.error_type,
                    failure_reason=excluded.failure_reason,
                    agent_id=excluded.agent_id,
                    recorded_at_ms=excluded.recorded_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, outcome.executionId());
            ps.setString(2, IndexEntry.Status.COMMITTED.name());
            ps.setString(3, outcome.state().name());
            ps.setString(4, outcome.result() == null ? null : Jsons.toCanonicalJson(outcome.result()));
            ps.setString(5, outcome.failure() == null ? null : outcome.failure().errorType().name());
            ps.setString(6, outcome.failure() == null ? null : outcome.failure().reason());
            ps.setString(7, outcome.agentId());
            ps.setLong(8, Instant.now().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record idempotency outcome: " + outcome.executionId(), e);
        }
    }

    @Override
    public void release(String executionId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM idempotency_index WHERE execution_id=? AND status=?")) {
            ps.setString(1, executionId);
            ps.setString(2, IndexEntry.Status.PROCESSING.name());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release idempotency entry: " + executionId, e);
        }
    }
}
