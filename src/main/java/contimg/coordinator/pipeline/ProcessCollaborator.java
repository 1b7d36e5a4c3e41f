package contimg.coordinator.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs an external command as a collaborator.
 * <p>
 * The request is written to {@code <output_dir>/<name>-request.json} and its path appended to the
 * command line. The command reports back on its last non-blank stdout line as
 * {@code {"success":..,"artifacts":{..},"diagnostics":{..},"permanent":..,"message":".."}}.
 */
public class ProcessCollaborator implements Collaborator {

    private static final Logger log = LoggerFactory.getLogger(ProcessCollaborator.class);

    /**
     * Upper bound on captured stdout/stderr kept in memory.
     */
    private static final int MAX_CAPTURE_BYTES = 16 * 1024;

    private final String name;
    private final List<String> command;
    private final Duration timeout;
    private final ObjectMapper mapper;

    public ProcessCollaborator(String name, List<String> command, Duration timeout, ObjectMapper mapper) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Collaborator " + name + " needs a command");
        }
        this.name = name;
        this.command = List.copyOf(command);
        this.timeout = timeout;
        this.mapper = mapper;
    }

    @Override
    public CollaboratorResponse invoke(CollaboratorRequest request) {
        Path requestFile = writeRequest(request);
        List<String> commandLine = new ArrayList<>(command);
        commandLine.add(requestFile.toString());

        Process process;
        try {
            process = new ProcessBuilder(commandLine).start();
        } catch (IOException e) {
            throw new CollaboratorException(name + " could not be started: " + e.getMessage(), e);
        }

        StreamConsumer stdout = new StreamConsumer(process.getInputStream(), null);
        StreamConsumer stderr = new StreamConsumer(process.getErrorStream(),
                line -> log.warn("[{}-stderr] {}", name, line));
        Thread stdoutThread = startDaemon(stdout, name + "-stdout");
        Thread stderrThread = startDaemon(stderr, name + "-stderr");

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new CollaboratorException(name + " timed out after " + timeout);
            }
            stdoutThread.join(TimeUnit.SECONDS.toMillis(5));
            stderrThread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CollaboratorException(name + " interrupted", e);
        }

        int exitCode = process.exitValue();
        log.debug("{} exited with {}", name, exitCode);
        CollaboratorResponse response = parse(stdout.lastLine());
        if (response == null) {
            throw new CollaboratorException(name + " exited with " + exitCode + " without a result: "
                    + stderr.captured());
        }
        if (exitCode != 0 && response.success()) {
            throw new CollaboratorException(name + " reported success but exited with " + exitCode);
        }
        return response;
    }

    public String name() {
        return name;
    }

    private Path writeRequest(CollaboratorRequest request) {
        try {
            Files.createDirectories(request.outputPath());
            Path file = request.outputPath().resolve(name + "-request.json");
            Files.write(file, mapper.writeValueAsBytes(request));
            return file;
        } catch (IOException e) {
            throw new CollaboratorException("Cannot write request for " + name + ": " + e.getMessage(), e);
        }
    }

    private CollaboratorResponse parse(String line) {
        if (line == null) {
            return null;
        }
        JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("{} printed an unreadable result: {}", name, line);
            return null;
        }
        if (node == null || !node.isObject() || !node.has("success")) {
            return null;
        }
        Map<String, String> artifacts = new LinkedHashMap<>();
        node.path("artifacts").fields().forEachRemaining(e -> artifacts.put(e.getKey(), e.getValue().asText()));
        return new CollaboratorResponse(
                node.path("success").asBoolean(false),
                artifacts,
                node.get("diagnostics"),
                node.path("permanent").asBoolean(false),
                node.hasNonNull("message") ? node.get("message").asText() : null);
    }

    private static Thread startDaemon(Runnable runnable, String threadName) {
        Thread thread = new Thread(runnable, threadName);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Drains a process stream so the child never blocks on a full pipe, keeping a bounded copy
     * and the last non-blank line.
     */
    private static class StreamConsumer implements Runnable {
        private final InputStream inputStream;
        private final Consumer<String> lineLogger;
        private final StringBuilder capture = new StringBuilder();
        private int bytesCaptured = 0;
        private volatile String lastLine;

        StreamConsumer(InputStream inputStream, Consumer<String> lineLogger) {
            this.inputStream = inputStream;
            this.lineLogger = lineLogger;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (lineLogger != null) {
                        lineLogger.accept(line);
                    }
                    if (!line.isBlank()) {
                        lastLine = line.trim();
                    }
                    synchronized (capture) {
                        if (bytesCaptured < MAX_CAPTURE_BYTES) {
                            capture.append(line).append('\n');
                            bytesCaptured += line.getBytes(StandardCharsets.UTF_8).length + 1;
                        }
                    }
                }
            } catch (IOException e) {
                log.error("Error reading process stream", e);
            }
        }

        String lastLine() {
            return lastLine;
        }

        String captured() {
            synchronized (capture) {
                return capture.toString().trim();
            }
        }
    }
}
