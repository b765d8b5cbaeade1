package im.arun.regingest.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the reports of a run and rewrites them as a JSON array to
 * {@code <dir>/<name>_<timestamp>.json} after every addition.
 */
public class RunReportLogger {
    private static final Logger systemLogger = LoggerFactory.getLogger(RunReportLogger.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path logPath;
    private final List<Object> entries = new ArrayList<>();
    private final ObjectMapper objectMapper;

    public RunReportLogger(String runName) {
        this(Paths.get("./logs"), runName, Clock.systemDefaultZone());
    }

    public RunReportLogger(Path logDir, String runName, Clock clock) {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);

        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP);
        String name = runName == null ? "run" : runName.replaceAll("[^A-Za-z0-9_-]", "-");

        try {
            Files.createDirectories(logDir);
        } catch (IOException e) {
            systemLogger.error("Failed to create logs directory {}", logDir, e);
        }
        this.logPath = logDir.resolve(String.format("%s_%s.json", name, timestamp));
    }

    public synchronized void record(Object report) {
        entries.add(report);
        writeToFile();
    }

    public synchronized List<Object> getEntries() {
        return List.copyOf(entries);
    }

    public Path getLogPath() {
        return logPath;
    }

    private void writeToFile() {
        try {
            objectMapper.writeValue(logPath.toFile(), entries);
        } catch (IOException e) {
            systemLogger.error("Failed to write run report: {}", logPath, e);
        }
    }
}
