package io.commandgate.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.commandgate.model.AuditEvent;
import io.commandgate.model.AuditEventType;
import io.commandgate.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hash-chained JSONL audit log. Every row carries the hash of the previous row and, when a
 * signing secret is configured, an HMAC of its own hash. Rows are indexed in memory on open.
 *
 * <p>One writer process per file: the chain is extended from the in-memory head.
 */
public final class FileAuditTrail implements AuditTrail {
    private static final Logger log = LoggerFactory.getLogger(FileAuditTrail.class);
    private static final ObjectMapper COMPACT_MAPPER = new ObjectMapper().findAndRegisterModules();
    private static final TypeReference<LinkedHashMap<String, Object>> DETAILS_TYPE = new TypeReference<>() {
    };

    private final Path auditFile;
    private final String signingSecret;
    private final List<AuditEvent> events = new ArrayList<>();
    private final Map<String, List<AuditEvent>> byExecution = new HashMap<>();
    private String previousHash;

    public FileAuditTrail(Path auditFile, String signingSecret) {
        this.auditFile = auditFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.previousHash = "";
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created by another process between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        loadExisting();
    }

    @Override
    public synchronized AuditEvent append(String executionId, AuditEventType type, Map<String, Object> details) {
        List<AuditEvent> forExecution = byExecution.computeIfAbsent(executionId, id -> new ArrayList<>());
        AuditEvent event = AuditEvents.create(executionId, forExecution.size() + 1L, type, details);
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", event.timestamp());
        row.put("event_id", event.eventId());
        row.put("execution_id", event.executionId());
        row.put("sequence", event.sequence());
        row.put("event_type", event.eventType().name());
        row.put("payload_digest", event.payloadDigest());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
        previousHash = rowHash;
        forExecution.add(event);
        events.add(event);
        return event;
    }

    @Override
    public synchronized List<AuditEvent> eventsFor(String executionId) {
        List<AuditEvent> forExecution = byExecution.get(executionId);
        return forExecution == null ? List.of() : List.copyOf(forExecution);
    }

    @Override
    public synchronized List<AuditEvent> tail(int limit) {
        int from = Math.max(0, events.size() - Math.max(1, limit));
        return List.copyOf(events.subList(from, events.size()));
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    @Override
    public synchronized AuditIntegrity verifyIntegrity() {
        int totalRows = 0;
        int checkedRows = 0;
        int brokenLine = 0;
        String reason = "";
        String expectedPrev = "";
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line == null || line.isBlank()) {
                    continue;
                }
                totalRows++;
                JsonNode parsed;
                try {
                    parsed = COMPACT_MAPPER.readTree(line);
                } catch (JsonProcessingException e) {
                    brokenLine = i + 1;
                    reason = "invalid_json";
                    break;
                }
                String hash = parsed.path("hash").asText("");
                String prevHash = parsed.path("prev_hash").asText("");
                if (!prevHash.equals(expectedPrev)) {
                    brokenLine = i + 1;
                    reason = "prev_hash_mismatch";
                    break;
                }
                ObjectNode canonical = (ObjectNode) parsed.deepCopy();
                canonical.remove("hash");
                canonical.remove("signature");
                if (!Hashing.sha256Hex(COMPACT_MAPPER.writeValueAsString(canonical)).equals(hash)) {
                    brokenLine = i + 1;
                    reason = "hash_mismatch";
                    break;
                }
                Map<String, Object> details = COMPACT_MAPPER.convertValue(parsed.path("details"), DETAILS_TYPE);
                if (!AuditEvents.digest(details).equals(parsed.path("payload_digest").asText(""))) {
                    brokenLine = i + 1;
                    reason = "payload_digest_mismatch";
                    break;
                }
                if (!signingSecret.isBlank()) {
                    String signature = parsed.path("signature").asText("");
                    if (!Hashing.constantTimeEquals(Hashing.hmacSha256Hex(signingSecret, hash), signature)) {
                        brokenLine = i + 1;
                        reason = "signature_mismatch";
                        break;
                    }
                }
                checkedRows++;
                expectedPrev = hash;
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to verify audit integrity", e);
        }
        return new AuditIntegrity(brokenLine == 0, totalRows, checkedRows, brokenLine, reason, expectedPrev);
    }

    private void loadExisting() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                JsonNode row = COMPACT_MAPPER.readTree(line);
                AuditEvent event = new AuditEvent(
                        row.path("event_id").asText(),
                        row.path("execution_id").asText(),
                        row.path("sequence").asLong(),
                        AuditEventType.valueOf(row.path("event_type").asText()),
                        row.path("timestamp").asText(),
                        row.path("payload_digest").asText(),
                        COMPACT_MAPPER.convertValue(row.path("details"), DETAILS_TYPE)
                );
                events.add(event);
                byExecution.computeIfAbsent(event.executionId(), id -> new ArrayList<>()).add(event);
                previousHash = row.path("hash").asText("");
            } catch (JsonProcessingException | IllegalArgumentException e) {
                // A damaged row stays in the file for audit-verify to report.
                log.warn("Skipping unreadable audit row in {}: {}", auditFile, e.getMessage());
            }
        }
    }

    private String toCompactJson(Map<String, Object> row) {
        try {
            return COMPACT_MAPPER.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize audit row", e);
        }
    }
}
