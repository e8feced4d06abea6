package io.commandgate.storage;

import io.commandgate.config.CommandGateConfig;
import io.commandgate.model.Command;
import io.commandgate.model.ErrorType;
import io.commandgate.model.ExecutionFailure;
import io.commandgate.model.ExecutionRecord;
import io.commandgate.model.ExecutionState;
import io.commandgate.model.PolicyVerdict;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class SqliteExecutionStoreTest {

    @Test
    void recordsRoundTripAndTransitionsAreCompareAndSet() throws Exception {
        Path root = Files.createTempDirectory("commandgate-test-executions-");
        try {
            Database db = new Database(CommandGateConfig.fromRoot(root.toString()));
            db.init();
            SqliteExecutionStore store = new SqliteExecutionStore(db);

            Command command = Command.write("exec-1", "update_record", Map.of("id", 7, "name", "x"), "alice")
                    .withCommandId("cmd-1")
                    .requiringApproval();
            ExecutionRecord received = ExecutionRecord.received(command);
            Assertions.assertTrue(store.create(received));
            Assertions.assertFalse(store.create(received));

            ExecutionRecord loaded = store.get("exec-1").orElseThrow();
            Assertions.assertEquals(ExecutionState.RECEIVED, loaded.state());
            Assertions.assertEquals("update_record", loaded.command().kind());
            Assertions.assertEquals(7, loaded.command().parameters().get("id"));
            Assertions.assertTrue(loaded.command().requestsApproval());

            ExecutionRecord allowed = loaded.withVerdict(PolicyVerdict.ALLOW);
            Assertions.assertTrue(store.transition(ExecutionState.RECEIVED, allowed));
            Assertions.assertTrue(store.get("exec-1").orElseThrow().isDispatchable());

            ExecutionRecord dispatched = allowed.dispatched();
            Assertions.assertTrue(store.transition(ExecutionState.RECEIVED, dispatched));
            Assertions.assertFalse(store.transition(ExecutionState.RECEIVED, dispatched.moveTo(ExecutionState.DISPATCHED)));

            ExecutionRecord failed = dispatched.failed("agent-a", ExecutionFailure.of(ErrorType.TIMEOUT));
            Assertions.assertTrue(store.transition(ExecutionState.DISPATCHED, failed));
            ExecutionRecord terminal = store.get("exec-1").orElseThrow();
            Assertions.assertEquals(ExecutionState.FAILED, terminal.state());
            Assertions.assertEquals(ErrorType.TIMEOUT, terminal.failure().errorType());
            Assertions.assertEquals("timeout", terminal.failure().reason());
            Assertions.assertEquals(1, terminal.attemptCount());
            Assertions.assertEquals("agent-a", terminal.agentId());

            Assertions.assertThrows(IllegalStateException.class,
                    () -> store.transition(ExecutionState.FAILED, terminal.completed("agent-a", Map.of())));
            Assertions.assertEquals(List.of("exec-1"),
                    store.listByState(ExecutionState.FAILED).stream().map(ExecutionRecord::executionId).toList());
            Assertions.assertTrue(store.get("missing").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
