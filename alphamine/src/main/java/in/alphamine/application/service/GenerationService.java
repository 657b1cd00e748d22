package in.alphamine.application.service;

import in.alphamine.application.port.output.ExpressionGenerator;
import in.alphamine.application.port.output.GenerationContext;
import in.alphamine.domain.common.BatchResult;
import in.alphamine.domain.common.ValidationResult;
import in.alphamine.domain.simulation.SimulationRequest;
import in.alphamine.domain.simulation.SimulationResult;
import in.alphamine.domain.simulation.SimulationSettings;
import in.alphamine.service.validation.ExpressionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks the expression generator for candidates and keeps the syntactically valid ones.
 */
public class GenerationService {
    private static final Logger log = LoggerFactory.getLogger(GenerationService.class);

    private final ExpressionGenerator generator;
    private final CatalogCache catalog;
    private final ExpressionValidator validator;
    private final BatchSimulationOrchestrator orchestrator;

    public GenerationService(ExpressionGenerator generator, CatalogCache catalog, ExpressionValidator validator,
                             BatchSimulationOrchestrator orchestrator) {
        this.generator = generator;
        this.catalog = catalog;
        this.validator = validator;
        this.orchestrator = orchestrator;
    }

    /**
     * Request candidates in region/universe.
     *
     * @throws IllegalStateException if the catalog has no operators or no data fields
     */
    public List<SimulationRequest> generate(String region, String universe, GenerationRequest request) {
        List<String> operators = catalog.operatorNames();
        List<String> fields = catalog.dataFieldIds(region, universe);
        if (operators.isEmpty()) {
            throw new IllegalStateException("No operators available for generation");
        }
        if (fields.isEmpty()) {
            throw new IllegalStateException("No data fields available for " + region + "/" + universe);
        }

        GenerationContext context = new GenerationContext(operators, fields, request.strategyType(),
            request.focusFields(), request.complexity(), request.count());
        log.info("[GENERATE] Requesting {} expressions for {}/{}", request.count(), region, universe);

        SimulationSettings settings = SimulationSettings.DEFAULT.withRegion(region).withUniverse(universe);
        List<SimulationRequest> accepted = new ArrayList<>();
        for (String expression : generator.generateExpressions(context)) {
            ValidationResult result = validator.validate(expression);
            if (!result.passed()) {
                log.warn("[GENERATE] Dropping invalid expression {}: {}", expression, result.message());
                continue;
            }
            accepted.add(new SimulationRequest(expression, settings));
        }

        log.info("[GENERATE] {} valid expressions", accepted.size());
        return accepted;
    }

    public BatchResult<SimulationRequest, SimulationResult> generateAndTest(String region, String universe,
                                                                           GenerationRequest request,
                                                                           int maxConcurrency) {
        List<SimulationRequest> requests = generate(region, universe, request);
        return orchestrator.simulateBatch(requests, maxConcurrency);
    }

    /**
     * Hints passed to the generator.
     */
    public record GenerationRequest(String strategyType, List<String> focusFields, String complexity, int count) {

        public static GenerationRequest of(int count) {
            return new GenerationRequest(null, List.of(), null, count);
        }
    }
}
