package in.alphamine.application.port.output;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;

/**
 * Persists run reports.
 */
public interface ReportStore {

    /**
     * Write one report.
     *
     * @param prefix file name prefix (e.g. {@code mining_results})
     * @return where the report was written
     * @throws java.io.UncheckedIOException if the report cannot be written
     */
    Path save(String prefix, JsonNode report);
}
