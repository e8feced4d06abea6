package io.commandgate.audit;

import io.commandgate.model.AuditEvent;
import io.commandgate.model.AuditEventType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class InMemoryAuditTrailTest {

    @Test
    void concurrentAppendsKeepDenseSequencesPerExecution() throws Exception {
        InMemoryAuditTrail trail = new InMemoryAuditTrail();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<AuditEvent>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String executionId = "exec-" + (i % 4);
                futures.add(pool.submit(() -> trail.append(executionId, AuditEventType.POLICY_EVAL, Map.of())));
            }
            for (Future<AuditEvent> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        for (int i = 0; i < 4; i++) {
            List<AuditEvent> events = trail.eventsFor("exec-" + i);
            Assertions.assertEquals(50, events.size());
            for (int seq = 0; seq < events.size(); seq++) {
                Assertions.assertEquals(seq + 1L, events.get(seq).sequence());
            }
        }
        Assertions.assertEquals(200, trail.verifyIntegrity().totalRows());
        Assertions.assertTrue(trail.eventsFor("unknown").isEmpty());
    }
}
