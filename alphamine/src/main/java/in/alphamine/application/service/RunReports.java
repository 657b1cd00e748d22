package in.alphamine.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.alphamine.domain.common.BatchEntry;
import in.alphamine.domain.common.BatchResult;
import in.alphamine.domain.common.Outcome;
import in.alphamine.domain.simulation.Alpha;
import in.alphamine.domain.simulation.MetricSet;
import in.alphamine.domain.simulation.SimulationRequest;
import in.alphamine.domain.simulation.SimulationResult;

import java.util.Map;

/**
 * JSON views of run results, one entry per input.
 */
public final class RunReports {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    public static ArrayNode simulationBatch(BatchResult<SimulationRequest, SimulationResult> batch) {
        ArrayNode entries = JSON.arrayNode();
        for (BatchEntry<SimulationRequest, SimulationResult> entry : batch.entries()) {
            ObjectNode node = entries.addObject();
            node.put("expression", entry.input().expression());
            node.set("settings", entry.input().settings().toApiFormat());
            writeOutcome(node, entry.outcome());
            if (entry.isSuccess()) {
                SimulationResult result = entry.outcome().value();
                node.put("jobHandle", result.jobHandle());
                node.put("alphaId", result.alphaId());
                node.set("metrics", metrics(result.metrics()));
            }
        }
        return entries;
    }

    public static ObjectNode regions(Map<String, BatchResult<SimulationRequest, SimulationResult>> byRegion) {
        ObjectNode node = JSON.objectNode();
        byRegion.forEach((region, batch) -> node.set(region, simulationBatch(batch)));
        return node;
    }

    public static ObjectNode mining(MiningService.MiningReport report) {
        ObjectNode node = JSON.objectNode();
        node.put("baseExpression", report.baseExpression());
        ArrayNode variants = node.putArray("variants");
        report.variants().forEach(variants::add);
        node.set("results", simulationBatch(report.batch()));
        ArrayNode qualifying = node.putArray("qualifying");
        for (SimulationResult result : report.qualifying()) {
            ObjectNode item = qualifying.addObject();
            item.put("expression", result.request().expression());
            item.put("alphaId", result.alphaId());
            item.set("metrics", metrics(result.metrics()));
        }
        return node;
    }

    public static ArrayNode submissions(BatchResult<Alpha, JsonNode> batch) {
        ArrayNode entries = JSON.arrayNode();
        for (BatchEntry<Alpha, JsonNode> entry : batch.entries()) {
            ObjectNode node = entries.addObject();
            node.put("alphaId", entry.input().id());
            node.put("expression", entry.input().expression());
            writeOutcome(node, entry.outcome());
            if (entry.isSuccess()) {
                node.set("submissionResult", entry.outcome().value());
            }
        }
        return entries;
    }

    static JsonNode metrics(MetricSet metrics) {
        if (metrics == null) {
            return JSON.nullNode();
        }
        ObjectNode node = JSON.objectNode();
        node.put("sharpe", metrics.sharpe());
        if (metrics.fitness() != null) {
            node.put("fitness", metrics.fitness());
        } else {
            node.putNull("fitness");
        }
        node.put("turnover", metrics.turnover());
        node.put("returns", metrics.returns());
        node.put("drawdown", metrics.drawdown());
        node.put("margin", metrics.margin());
        node.put("longCount", metrics.longCount());
        node.put("shortCount", metrics.shortCount());
        node.put("allChecksPassed", metrics.allChecksPassed());
        return node;
    }

    private static void writeOutcome(ObjectNode node, Outcome<?> outcome) {
        node.put("success", outcome.isSuccess());
        if (outcome.isFailure()) {
            node.put("errorKind", outcome.errorKind().name());
            node.put("errorMessage", outcome.errorMessage());
        }
    }

    private RunReports() {}
}
