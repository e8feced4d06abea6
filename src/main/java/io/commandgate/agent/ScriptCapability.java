package io.commandgate.agent;

import io.commandgate.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs an external process per command and polls it as a remote job. The request is written to
 * stdin as JSON; exit code 0 means applied, and stdout becomes the result (parsed as a JSON
 * object when it is one). A process still running at the poll deadline is destroyed.
 */
public final class ScriptCapability extends PollingCapability {
    private static final int MAX_ERROR_CHARS = 512;

    private final List<String> command;

    public ScriptCapability(List<String> command, RemoteJobPoller poller, PollPolicy policy) {
        super(poller, policy);
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script capability command cannot be empty");
        }
        this.command = List.copyOf(command);
    }

    @Override
    public String type() {
        return "script";
    }

    @Override
    protected RemoteJob start(CapabilityRequest request) throws IOException {
        Path output = Files.createTempFile("commandgate-script-", ".out");
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        pb.redirectOutput(output.toFile());
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            Files.deleteIfExists(output);
            throw e;
        }
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("execution_id", request.executionId());
        input.put("kind", request.kind());
        input.put("parameters", request.parameters());
        input.put("read_only", request.readOnly());
        try {
            process.getOutputStream().write(Jsons.toCanonicalJson(input).getBytes(StandardCharsets.UTF_8));
            process.getOutputStream().close();
        } catch (IOException e) {
            process.destroyForcibly();
            Files.deleteIfExists(output);
            throw e;
        }
        return new ProcessJob(request.executionId(), process, output);
    }

    private static final class ProcessJob implements RemoteJob {
        private final String jobId;
        private final Process process;
        private final Path output;

        private ProcessJob(String executionId, Process process, Path output) {
            this.jobId = executionId + ":pid-" + process.pid();
            this.process = process;
            this.output = output;
        }

        @Override
        public String jobId() {
            return jobId;
        }

        @Override
        public PollResult poll() throws IOException {
            if (process.isAlive()) {
                return PollResult.pending();
            }
            try {
                String combined = Files.readString(output, StandardCharsets.UTF_8).strip();
                if (process.exitValue() != 0) {
                    return PollResult.failed("script exit=" + process.exitValue() + " output=" + truncate(combined));
                }
                return PollResult.done(parseOutput(combined));
            } finally {
                Files.deleteIfExists(output);
            }
        }

        @Override
        public void cancel() {
            process.destroyForcibly();
            try {
                Files.deleteIfExists(output);
            } catch (IOException e) {
                output.toFile().deleteOnExit();
            }
        }
    }

    private static Map<String, Object> parseOutput(String stdout) {
        if (stdout.startsWith("{")) {
            try {
                return Jsons.readMap(stdout);
            } catch (RuntimeException notJson) {
                return Map.of("stdout", stdout);
            }
        }
        return Map.of("stdout", stdout);
    }

    private static String truncate(String raw) {
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
