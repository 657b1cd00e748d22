package in.alphamine.domain.simulation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Completed simulation of one request.
 *
 * @param request      the originating input
 * @param jobHandle    poll handle the platform returned on submission
 * @param simulation   terminal poll payload
 * @param alphaId      alpha created by the simulation, may be null
 * @param alphaDetails alpha details, null when they could not be fetched
 * @param metrics      in-sample metrics, null when unavailable
 */
public record SimulationResult(
    SimulationRequest request,
    String jobHandle,
    JsonNode simulation,
    String alphaId,
    JsonNode alphaDetails,
    MetricSet metrics
) {
    public boolean hasMetrics() {
        return metrics != null;
    }
}
