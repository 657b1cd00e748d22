package in.alphamine.domain.simulation;

import java.util.Objects;

/**
 * One expression to evaluate under one set of settings.
 */
public record SimulationRequest(String expression, SimulationSettings settings) {

    public SimulationRequest {
        Objects.requireNonNull(expression, "expression");
        settings = settings == null ? SimulationSettings.DEFAULT : settings;
    }

    public static SimulationRequest of(String expression) {
        return new SimulationRequest(expression, SimulationSettings.DEFAULT);
    }

    public SimulationRequest inRegion(String region) {
        return new SimulationRequest(expression, settings.withRegion(region));
    }
}
