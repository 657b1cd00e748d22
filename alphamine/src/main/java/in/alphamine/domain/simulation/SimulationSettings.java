package in.alphamine.domain.simulation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Immutable simulation settings.
 * Wire names are the camelCase field names used by the platform.
 */
public record SimulationSettings(
    String instrumentType,
    String region,
    String universe,
    int delay,
    int decay,
    String neutralization,
    double truncation,
    String pasteurization,
    String unitHandling,
    String nanHandling,
    String language,
    boolean visualization
) {
    public static final SimulationSettings DEFAULT = new SimulationSettings(
        "EQUITY", "USA", "TOP3000", 1, 0, "INDUSTRY", 0.08,
        "ON", "VERIFY", "OFF", "FASTEXPR", false);

    public SimulationSettings {
        Objects.requireNonNull(instrumentType, "instrumentType");
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(universe, "universe");
        Objects.requireNonNull(neutralization, "neutralization");
        Objects.requireNonNull(pasteurization, "pasteurization");
        Objects.requireNonNull(unitHandling, "unitHandling");
        Objects.requireNonNull(nanHandling, "nanHandling");
        Objects.requireNonNull(language, "language");
        if (delay < 0) {
            throw new IllegalArgumentException("delay must be non-negative: " + delay);
        }
        if (decay < 0) {
            throw new IllegalArgumentException("decay must be non-negative: " + decay);
        }
        if (Double.isNaN(truncation) || truncation < 0.0 || truncation > 1.0) {
            throw new IllegalArgumentException("truncation must be within [0, 1]: " + truncation);
        }
    }

    public SimulationSettings withRegion(String newRegion) {
        return new SimulationSettings(instrumentType, newRegion, universe, delay, decay, neutralization,
            truncation, pasteurization, unitHandling, nanHandling, language, visualization);
    }

    public SimulationSettings withUniverse(String newUniverse) {
        return new SimulationSettings(instrumentType, region, newUniverse, delay, decay, neutralization,
            truncation, pasteurization, unitHandling, nanHandling, language, visualization);
    }

    public ObjectNode toApiFormat() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("instrumentType", instrumentType);
        node.put("region", region);
        node.put("universe", universe);
        node.put("delay", delay);
        node.put("decay", decay);
        node.put("neutralization", neutralization);
        node.put("truncation", truncation);
        node.put("pasteurization", pasteurization);
        node.put("unitHandling", unitHandling);
        node.put("nanHandling", nanHandling);
        node.put("language", language);
        node.put("visualization", visualization);
        return node;
    }

    /**
     * Build settings from a wire object. Missing fields take the default value.
     */
    public static SimulationSettings fromApiFormat(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return DEFAULT;
        }
        return new SimulationSettings(
            node.path("instrumentType").asText(DEFAULT.instrumentType),
            node.path("region").asText(DEFAULT.region),
            node.path("universe").asText(DEFAULT.universe),
            node.path("delay").asInt(DEFAULT.delay),
            node.path("decay").asInt(DEFAULT.decay),
            node.path("neutralization").asText(DEFAULT.neutralization),
            node.path("truncation").asDouble(DEFAULT.truncation),
            node.path("pasteurization").asText(DEFAULT.pasteurization),
            node.path("unitHandling").asText(DEFAULT.unitHandling),
            node.path("nanHandling").asText(DEFAULT.nanHandling),
            node.path("language").asText(DEFAULT.language),
            node.path("visualization").asBoolean(DEFAULT.visualization)
        );
    }
}
