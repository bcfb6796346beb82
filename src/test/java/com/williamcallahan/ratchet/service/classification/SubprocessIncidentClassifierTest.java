package com.williamcallahan.ratchet.service.classification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.williamcallahan.ratchet.domain.IncidentAction;
import com.williamcallahan.ratchet.domain.IncidentActionType;
import com.williamcallahan.ratchet.domain.IncidentPriority;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

/**
 * Runs small shell scripts standing in for the classifier executable.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class SubprocessIncidentClassifierTest {

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

    @TempDir
    Path tempDir;

    @Test
    void parsesVerdictPrintedOnStdout() throws IOException {
        Path script = script("classify.sh", """
                #!/bin/sh
                cat > /dev/null
                echo '{"action":"open_incident","service":"db","alert":"cpu","priority":"HIGH","duration":"1h"}'
                """);
        SubprocessIncidentClassifier classifier =
                new SubprocessIncidentClassifier(script.toString(), Duration.ofSeconds(10), objectMapper);

        IncidentAction action = classifier.classify("pagerduty", "db cpu high");

        assertEquals(IncidentActionType.OPEN_INCIDENT, action.effectiveAction());
        assertEquals(IncidentPriority.HIGH, action.priority());
        assertEquals(Duration.ofHours(1), action.duration());
    }

    @Test
    void sendsSenderAndTextOnStdin() throws IOException {
        Path captured = tempDir.resolve("stdin.json");
        Path script = script("echo.sh", """
                #!/bin/sh
                cat > '%s'
                echo '{"action":"none"}'
                """.formatted(captured));
        SubprocessIncidentClassifier classifier =
                new SubprocessIncidentClassifier(script.toString(), Duration.ofSeconds(10), objectMapper);

        assertTrue(classifier.classify("alice", "hello").isNone());

        JsonNode input = objectMapper.readTree(Files.readString(captured, StandardCharsets.UTF_8));
        assertEquals("alice", input.path("username").asText());
        assertEquals("hello", input.path("text").asText());
    }

    @Test
    void nonZeroExitFailsWithStderr() throws IOException {
        Path script = script("fail.sh", """
                #!/bin/sh
                echo 'model not loaded' >&2
                exit 3
                """);
        SubprocessIncidentClassifier classifier =
                new SubprocessIncidentClassifier(script.toString(), Duration.ofSeconds(10), objectMapper);

        IncidentClassificationException failure =
                assertThrows(IncidentClassificationException.class, () -> classifier.classify("u", "t"));
        assertTrue(failure.getMessage().contains("status 3"), failure.getMessage());
        assertTrue(failure.getMessage().contains("model not loaded"), failure.getMessage());
    }

    @Test
    void invalidOutputFails() throws IOException {
        Path script = script("garbage.sh", """
                #!/bin/sh
                echo 'not a verdict'
                """);
        SubprocessIncidentClassifier classifier =
                new SubprocessIncidentClassifier(script.toString(), Duration.ofSeconds(10), objectMapper);

        assertThrows(IncidentClassificationException.class, () -> classifier.classify("u", "t"));
    }

    @Test
    void slowClassifierTimesOut() throws IOException {
        Path script = script("slow.sh", """
                #!/bin/sh
                sleep 5
                echo '{"action":"none"}'
                """);
        SubprocessIncidentClassifier classifier =
                new SubprocessIncidentClassifier(script.toString(), Duration.ofMillis(300), objectMapper);

        IncidentClassificationException failure =
                assertThrows(IncidentClassificationException.class, () -> classifier.classify("u", "t"));
        assertTrue(failure.getMessage().contains("timed out"), failure.getMessage());
    }

    @Test
    void missingExecutableIsRejectedAtStartup() {
        assertThrows(IllegalStateException.class, () -> new SubprocessIncidentClassifier(
                tempDir.resolve("absent").toString(), Duration.ofSeconds(1), objectMapper));
        assertThrows(IllegalStateException.class, () -> new SubprocessIncidentClassifier(
                "definitely-not-a-real-classifier-binary", Duration.ofSeconds(1), objectMapper));
    }

    private Path script(String name, String body) throws IOException {
        Path script = tempDir.resolve(name);
        Files.writeString(script, body, StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script;
    }
}
