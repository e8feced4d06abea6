package io.commandgate.storage;

import io.commandgate.audit.AuditTrail;
import io.commandgate.audit.InMemoryAuditTrail;

/**
 * The process-wide shared state. Build it once and hand the same instance to every gateway and
 * orchestrator so that all of them observe one approval store and one audit trail.
 */
public record StateStores(
        ApprovalStateStore approvals,
        ExecutionStore executions,
        IdempotencyIndex idempotency,
        AuditTrail audit,
        ExecutionLocks locks
) {
    public static StateStores inMemory() {
        return new StateStores(
                new InMemoryApprovalStateStore(),
                new InMemoryExecutionStore(),
                new InMemoryIdempotencyIndex(),
                new InMemoryAuditTrail(),
                new ExecutionLocks()
        );
    }

    public static StateStores sqlite(Database database, AuditTrail audit) {
        return new StateStores(
                new SqliteApprovalStateStore(database),
                new SqliteExecutionStore(database),
                new SqliteIdempotencyIndex(database),
                audit,
                new ExecutionLocks()
        );
    }
}
