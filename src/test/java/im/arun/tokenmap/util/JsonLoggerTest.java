package im.arun.tokenmap.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class JsonLoggerTest {

    @TempDir
    Path tempDir;

    @Test
    void append_shouldRewriteJournalWithTimedEntries() throws Exception {
        // Arrange
        AtomicLong clock = new AtomicLong();
        JsonLogger journal = new JsonLogger("inputs/prompt.v2.xml", tempDir.resolve("logs"), clock::get);

        // Act
        journal.info("Parsed", Map.of("nodes", 12));
        clock.set(TimeUnit.MILLISECONDS.toNanos(250));
        journal.error("Analysis failed", Map.of("error", "boom"));

        // Assert
        JsonNode json = new ObjectMapper().readTree(journal.getLogPath().toFile());
        assertThat(json.get("document").asText()).isEqualTo("prompt.v2");
        assertThat(json.get("entries")).hasSize(2);
        assertThat(json.at("/entries/0/nodes").asInt()).isEqualTo(12);
        assertThat(json.at("/entries/1/level").asText()).isEqualTo("ERROR");
        assertThat(json.at("/entries/1/elapsed_ms").asLong()).isEqualTo(250);
        assertThat(journal.size()).isEqualTo(2);
        assertThat(journal.getLogPath().getFileName().toString()).startsWith("prompt.v2_");
    }

    @Test
    void baseName_shouldFallBackForBlankNames() {
        assertThat(JsonLogger.baseName(null)).isEqualTo("Untitled");
        assertThat(JsonLogger.baseName("  ")).isEqualTo("Untitled");
        assertThat(JsonLogger.baseName("a/b/report.xml")).isEqualTo("report");
    }
}
