package in.alphamine.application.service;

import in.alphamine.application.port.output.ExpressionGenerator;
import in.alphamine.domain.simulation.SimulationRequest;
import in.alphamine.domain.simulation.SimulationResult;
import in.alphamine.service.analysis.ImprovementReport;
import in.alphamine.service.analysis.ResultAggregator;
import in.alphamine.service.validation.ExpressionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulates an expression, has it rewritten, simulates the rewrite and compares the two.
 */
public class PolishingService {
    private static final Logger log = LoggerFactory.getLogger(PolishingService.class);

    private final ExpressionGenerator generator;
    private final CatalogCache catalog;
    private final ExpressionValidator validator;
    private final BatchSimulationOrchestrator orchestrator;
    private final ResultAggregator aggregator;

    public PolishingService(ExpressionGenerator generator, CatalogCache catalog, ExpressionValidator validator,
                            BatchSimulationOrchestrator orchestrator, ResultAggregator aggregator) {
        this.generator = generator;
        this.catalog = catalog;
        this.validator = validator;
        this.orchestrator = orchestrator;
        this.aggregator = aggregator;
    }

    /**
     * @param requirements free-form goals for the rewrite, e.g. "reduce turnover"
     * @throws in.alphamine.service.validation.ExpressionValidationException if either
     *         expression is invalid
     */
    public PolishReport polish(SimulationRequest request, String requirements) {
        log.info("[POLISH] Simulating original: {}", request.expression());
        SimulationResult original = orchestrator.simulate(request);

        String polished = generator.polishExpression(request.expression(), requirements, catalog.operatorNames());
        validator.requireValid(polished);
        log.info("[POLISH] Simulating rewrite: {}", polished);

        SimulationResult polishedResult = orchestrator.simulate(new SimulationRequest(polished, request.settings()));

        ImprovementReport improvement = null;
        if (original.hasMetrics() && polishedResult.hasMetrics()) {
            improvement = aggregator.compare(original.metrics(), polishedResult.metrics());
            log.info("[POLISH] Overall improved: {}", improvement.overallImproved());
        } else {
            log.warn("[POLISH] Metrics missing, no comparison for {}", request.expression());
        }
        return new PolishReport(original, polished, polishedResult, improvement);
    }

    /**
     * @param improvement null when either side has no metrics
     */
    public record PolishReport(
        SimulationResult original,
        String polishedExpression,
        SimulationResult polished,
        ImprovementReport improvement
    ) {
    }
}
