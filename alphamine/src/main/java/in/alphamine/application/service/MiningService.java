package in.alphamine.application.service;

import in.alphamine.domain.common.BatchResult;
import in.alphamine.domain.simulation.SimulationRequest;
import in.alphamine.domain.simulation.SimulationResult;
import in.alphamine.domain.simulation.SimulationSettings;
import in.alphamine.domain.simulation.SubmissionCriteria;
import in.alphamine.service.analysis.ResultAggregator;
import in.alphamine.service.variation.ParameterVariationEngine;
import in.alphamine.service.variation.VariationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Parameter mining: expand a base expression, simulate every variant, keep the best.
 */
public class MiningService {
    private static final Logger log = LoggerFactory.getLogger(MiningService.class);

    private final ParameterVariationEngine variationEngine;
    private final BatchSimulationOrchestrator orchestrator;
    private final ResultAggregator aggregator;

    public MiningService(ParameterVariationEngine variationEngine, BatchSimulationOrchestrator orchestrator,
                         ResultAggregator aggregator) {
        this.variationEngine = variationEngine;
        this.orchestrator = orchestrator;
        this.aggregator = aggregator;
    }

    public MiningReport mine(String baseExpression, SimulationSettings settings, VariationOptions options,
                             SubmissionCriteria criteria, int maxConcurrency) {
        List<String> variants = variationEngine.generateVariations(baseExpression, options);
        log.info("[MINE] {} variants of {}", variants.size(), baseExpression);

        List<SimulationRequest> requests = variants.stream()
            .map(expression -> new SimulationRequest(expression, settings))
            .toList();
        BatchResult<SimulationRequest, SimulationResult> batch = orchestrator.simulateBatch(requests, maxConcurrency);

        List<SimulationResult> qualifying = aggregator.rankBySharpe(batch).stream()
            .filter(result -> criteria.meetsThresholds(result.metrics()))
            .toList();

        log.info("[MINE] {} of {} variants meet the criteria", qualifying.size(), variants.size());
        qualifying.stream().limit(5).forEach(result ->
            log.info("[MINE]   sharpe={} fitness={} turnover={} {}", result.metrics().sharpe(),
                result.metrics().fitness(), result.metrics().turnover(), result.request().expression()));

        return new MiningReport(baseExpression, variants, batch, qualifying);
    }

    /**
     * @param qualifying successful variants meeting the criteria, best sharpe first
     */
    public record MiningReport(
        String baseExpression,
        List<String> variants,
        BatchResult<SimulationRequest, SimulationResult> batch,
        List<SimulationResult> qualifying
    ) {
    }
}
