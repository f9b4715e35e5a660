package im.arun.tokenmap.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Run journal for one analyzed document. Each milestone becomes an entry stamped with
 * the milliseconds elapsed since the journal was opened; the whole journal is rewritten
 * as {@code {"document": ..., "started_at": ..., "entries": [...]}} after every entry
 * so a crashed run still leaves a readable file.
 */
public class JsonLogger {
    private static final Logger systemLogger = LoggerFactory.getLogger(JsonLogger.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path logPath;
    private final String documentName;
    private final String startedAt;
    private final long startNanos;
    private final LongSupplier nanoClock;
    private final List<Map<String, Object>> entries = new ArrayList<>();
    private final ObjectMapper objectMapper;

    public JsonLogger(String documentName, Path logDir) {
        this(documentName, logDir, System::nanoTime);
    }

    JsonLogger(String documentName, Path logDir, LongSupplier nanoClock) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.nanoClock = nanoClock;
        this.startNanos = nanoClock.getAsLong();
        this.documentName = baseName(documentName);

        LocalDateTime now = LocalDateTime.now();
        this.startedAt = now.toString();

        try {
            Files.createDirectories(logDir);
        } catch (IOException e) {
            systemLogger.error("Failed to create journal directory {}", logDir, e);
        }
        this.logPath = logDir.resolve(String.format("%s_%s.json", this.documentName, now.format(FILE_STAMP)));
    }

    /**
     * File name without directories or extension, safe to embed in a journal file name.
     */
    static String baseName(String documentName) {
        if (documentName == null || documentName.isBlank()) {
            return "Untitled";
        }
        String filename = Paths.get(documentName).getFileName().toString();
        int dotIndex = filename.lastIndexOf('.');
        if (dotIndex > 0) {
            filename = filename.substring(0, dotIndex);
        }
        return filename.replaceAll("[/\\\\:]", "-");
    }

    public void info(String message, Map<String, ?> details) {
        append("INFO", message, details);
    }

    public void error(String message, Map<String, ?> details) {
        append("ERROR", message, details);
    }

    private synchronized void append(String level, String message, Map<String, ?> details) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("elapsed_ms", TimeUnit.NANOSECONDS.toMillis(nanoClock.getAsLong() - startNanos));
        entry.put("level", level);
        entry.put("message", message);
        if (details != null) {
            entry.putAll(details);
        }
        entries.add(entry);
        flush();
    }

    private void flush() {
        Map<String, Object> journal = new LinkedHashMap<>();
        journal.put("document", documentName);
        journal.put("started_at", startedAt);
        journal.put("entries", entries);
        try {
            objectMapper.writeValue(logPath.toFile(), journal);
        } catch (IOException e) {
            systemLogger.error("Failed to write journal {}", logPath, e);
        }
    }

    public Path getLogPath() {
        return logPath;
    }

    public synchronized int size() {
        return entries.size();
    }
}
