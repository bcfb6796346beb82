package com.williamcallahan.ratchet.service.classification;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.ratchet.domain.IncidentAction;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an external classifier executable once per message.
 *
 * <p>The executable receives {@code {"username": ..., "text": ...}} on stdin and must print one verdict
 * document on stdout and exit 0 within the configured timeout.</p>
 */
public class SubprocessIncidentClassifier implements IncidentClassifier {
    private static final Logger log = LoggerFactory.getLogger(SubprocessIncidentClassifier.class);

    private static final int MAX_STDERR_SNIPPET = 512;

    private final Path executable;
    private final Duration timeout;
    private final ObjectMapper objectMapper;

    /**
     * @param binary executable path, or a bare name resolved against {@code PATH}
     * @param timeout wall-clock limit per invocation
     * @param objectMapper JSON mapper for the stdin/stdout documents
     * @throws IllegalStateException when the executable cannot be found
     */
    public SubprocessIncidentClassifier(String binary, Duration timeout, ObjectMapper objectMapper) {
        this.executable = resolveExecutable(binary);
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        log.info("[CLASSIFY] Using classifier executable {}", executable);
    }

    @Override
    public IncidentAction classify(String sender, String text) {
        byte[] input = writeInput(new ClassifierInput(sender == null ? "" : sender, text == null ? "" : text));
        Process process;
        try {
            process = new ProcessBuilder(executable.toString()).start();
        } catch (IOException startFailure) {
            throw new IncidentClassificationException("Unable to start classifier " + executable, startFailure);
        }

        CompletableFuture<byte[]> stdout = drain(process.getInputStream());
        CompletableFuture<byte[]> stderr = drain(process.getErrorStream());
        try {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(input);
            } catch (IOException pipeClosed) {
                log.debug("[CLASSIFY] Classifier closed stdin early: {}", pipeClosed.getMessage());
            }
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new IncidentClassificationException("Classifier " + executable + " timed out after " + timeout);
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new IncidentClassificationException("Classifier " + executable + " exited with status " + exitCode
                        + ": " + snippet(await(stderr)));
            }
            return parseOutput(await(stdout));
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IncidentClassificationException("Interrupted while waiting for classifier " + executable, interrupted);
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private IncidentAction parseOutput(byte[] output) {
        String document = new String(output, StandardCharsets.UTF_8).trim();
        if (document.isEmpty()) {
            throw new IncidentClassificationException("Classifier " + executable + " printed nothing");
        }
        try {
            IncidentAction action = objectMapper.readValue(document, IncidentAction.class);
            if (action == null) {
                throw new IncidentClassificationException("Classifier " + executable + " printed null");
            }
            return action;
        } catch (JsonProcessingException malformed) {
            throw new IncidentClassificationException(
                    "Classifier " + executable + " printed an invalid verdict: " + snippet(output), malformed);
        }
    }

    private byte[] writeInput(ClassifierInput input) {
        try {
            return objectMapper.writeValueAsBytes(input);
        } catch (JsonProcessingException serializationFailure) {
            throw new IncidentClassificationException("Unable to encode classifier input", serializationFailure);
        }
    }

    private byte[] await(CompletableFuture<byte[]> stream) throws InterruptedException {
        try {
            return stream.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException readFailure) {
            throw new IncidentClassificationException("Unable to read classifier output", readFailure.getCause());
        } catch (TimeoutException stuck) {
            throw new IncidentClassificationException("Classifier output stream did not close", stuck);
        }
    }

    private static CompletableFuture<byte[]> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream source = stream) {
                return source.readAllBytes();
            } catch (IOException readFailure) {
                throw new UncheckedIOException(readFailure);
            }
        });
    }

    private static String snippet(byte[] bytes) {
        String text = new String(bytes, StandardCharsets.UTF_8).replace('\n', ' ').trim();
        return text.length() <= MAX_STDERR_SNIPPET ? text : text.substring(0, MAX_STDERR_SNIPPET) + "...";
    }

    static Path resolveExecutable(String binary) {
        if (binary == null || binary.isBlank()) {
            throw new IllegalStateException("Classifier executable is not configured (ratchet.classifier.binary)");
        }
        String trimmed = binary.trim();
        if (trimmed.contains(File.separator)) {
            Path candidate = Path.of(trimmed);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return candidate;
            }
            throw new IllegalStateException("Classifier executable not found or not executable: " + trimmed);
        }
        String searchPath = Objects.requireNonNullElse(System.getenv("PATH"), "");
        for (String directory : searchPath.split(File.pathSeparator)) {
            if (directory.isBlank()) {
                continue;
            }
            Path candidate = Path.of(directory, trimmed);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Classifier executable " + trimmed + " not found on PATH");
    }

    record ClassifierInput(@JsonProperty("username") String username, @JsonProperty("text") String text) {}
}
