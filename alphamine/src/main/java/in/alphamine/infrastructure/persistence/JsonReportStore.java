package in.alphamine.infrastructure.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import in.alphamine.application.port.output.ReportStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Writes reports as indented JSON files named {@code <prefix>_<unixSeconds>.json}.
 */
public class JsonReportStore implements ReportStore {
    private static final Logger log = LoggerFactory.getLogger(JsonReportStore.class);

    private final Path outputDir;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public JsonReportStore(Path outputDir) {
        this(outputDir, Clock.systemUTC());
    }

    public JsonReportStore(Path outputDir, Clock clock) {
        this.outputDir = outputDir;
        this.clock = clock;
    }

    @Override
    public Path save(String prefix, JsonNode report) {
        Path file = outputDir.resolve(fileName(prefix));
        try {
            Files.createDirectories(outputDir);
            mapper.writeValue(file.toFile(), report);
        } catch (IOException e) {
            log.error("[REPORT] Failed to write {}: {}", file, e.getMessage());
            throw new UncheckedIOException("Failed to write report " + file, e);
        }
        log.info("[REPORT] Saved {}", file);
        return file;
    }

    String fileName(String prefix) {
        return prefix + "_" + clock.instant().getEpochSecond() + ".json";
    }
}
