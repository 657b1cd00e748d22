package in.alphamine.domain.simulation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * In-sample performance metrics of a simulated alpha.
 * Parsed from the {@code is} object of the alpha details.
 */
public record MetricSet(
    double sharpe,
    Double fitness,
    double turnover,
    double returns,
    double drawdown,
    double margin,
    int longCount,
    int shortCount,
    List<AlphaCheck> checks
) {
    public MetricSet {
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    public boolean allChecksPassed() {
        return checks.stream().allMatch(AlphaCheck::passed);
    }

    public int totalPositions() {
        return longCount + shortCount;
    }

    public static MetricSet fromApiFormat(JsonNode node) {
        List<AlphaCheck> checks = new ArrayList<>();
        for (JsonNode check : node.path("checks")) {
            checks.add(AlphaCheck.fromApiFormat(check));
        }
        return new MetricSet(
            node.path("sharpe").asDouble(0.0),
            AlphaCheck.optionalDouble(node, "fitness"),
            node.path("turnover").asDouble(0.0),
            node.path("returns").asDouble(0.0),
            node.path("drawdown").asDouble(0.0),
            node.path("margin").asDouble(0.0),
            node.path("longCount").asInt(0),
            node.path("shortCount").asInt(0),
            checks
        );
    }
}
