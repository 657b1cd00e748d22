package in.alphamine.domain.simulation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One platform check (LOW_SHARPE, HIGH_TURNOVER, ...) and its verdict.
 */
public record AlphaCheck(String name, CheckResult result, Double limit, Double value) {

    public boolean passed() {
        return result == CheckResult.PASS;
    }

    public boolean failed() {
        return result == CheckResult.FAIL;
    }

    public static AlphaCheck fromApiFormat(JsonNode node) {
        return new AlphaCheck(
            node.path("name").asText(""),
            CheckResult.fromWire(node.path("result").asText("")),
            optionalDouble(node, "limit"),
            optionalDouble(node, "value")
        );
    }

    static Double optionalDouble(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isNumber()) {
            return null;
        }
        return value.asDouble();
    }
}
