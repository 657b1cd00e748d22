package in.alphamine.infrastructure.brain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Raw HTTP response as seen by callers of the client. Header lookup is case-insensitive.
 */
public record BrainResponse(int statusCode, Map<String, List<String>> headers, String body) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public BrainResponse {
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((k, v) -> {
                if (k != null) {
                    copy.put(k, List.copyOf(v));
                }
            });
        }
        headers = copy;
        body = body == null ? "" : body;
    }

    public static BrainResponse of(int statusCode, String body) {
        return new BrainResponse(statusCode, Map.of(), body);
    }

    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(0));
    }

    public boolean hasBody() {
        return !body.isBlank();
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * @throws IOException if the body is not valid JSON
     */
    public JsonNode json() throws IOException {
        return MAPPER.readTree(body);
    }
}
