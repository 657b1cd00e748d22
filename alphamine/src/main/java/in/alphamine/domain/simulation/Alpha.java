package in.alphamine.domain.simulation;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * An alpha as recorded by the platform after simulation.
 */
public record Alpha(
    String id,
    String expression,
    String name,
    SimulationSettings settings,
    MetricSet metrics,
    String status,
    String grade,
    List<String> tags,
    String color,
    String description,
    Instant dateCreated
) {
    public Alpha {
        tags = tags == null ? List.of() : List.copyOf(tags);
        settings = settings == null ? SimulationSettings.DEFAULT : settings;
    }

    public boolean hasMetrics() {
        return metrics != null;
    }

    public static Alpha fromApiFormat(JsonNode node) {
        JsonNode regular = node.path("regular");
        String expression = regular.isObject() ? regular.path("code").asText("") : regular.asText("");
        String description = regular.isObject() && regular.hasNonNull("description")
            ? regular.get("description").asText()
            : null;

        JsonNode is = node.get("is");
        MetricSet metrics = (is != null && is.isObject() && is.size() > 0) ? MetricSet.fromApiFormat(is) : null;

        List<String> tags = new ArrayList<>();
        for (JsonNode tag : node.path("tags")) {
            tags.add(tag.asText());
        }

        return new Alpha(
            textOrNull(node, "id"),
            expression,
            textOrNull(node, "name"),
            SimulationSettings.fromApiFormat(node.get("settings")),
            metrics,
            node.path("status").asText("DRAFT"),
            node.path("grade").asText("UNKNOWN"),
            tags,
            textOrNull(node, "color"),
            description,
            parseInstant(textOrNull(node, "dateCreated"))
        );
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
