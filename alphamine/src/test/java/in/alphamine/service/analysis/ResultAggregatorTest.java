package in.alphamine.service.analysis;

import in.alphamine.domain.common.BatchEntry;
import in.alphamine.domain.common.BatchResult;
import in.alphamine.domain.common.ErrorKind;
import in.alphamine.domain.common.Outcome;
import in.alphamine.domain.simulation.MetricSet;
import in.alphamine.domain.simulation.SimulationRequest;
import in.alphamine.domain.simulation.SimulationResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ResultAggregator.
 */
class ResultAggregatorTest {

    private final ResultAggregator aggregator = new ResultAggregator();

    private static MetricSet metrics(double sharpe, Double fitness, double turnover, double returns) {
        return new MetricSet(sharpe, fitness, turnover, returns, 0.05, 0.001, 1500, 1500, List.of());
    }

    @Test
    void testSharpeIncreaseIsImprovement() {
        ImprovementReport report = aggregator.compare(
            metrics(1.0, 0.8, 0.3, 0.1),
            metrics(1.3, 0.8, 0.3, 0.1));

        MetricComparison sharpe = report.get(TrackedMetric.SHARPE).orElseThrow();
        assertTrue(sharpe.improved());
        assertEquals(0.3, sharpe.absoluteChange(), 1e-9);
        assertEquals(30.0, sharpe.percentChange(), 1e-9);
        assertFalse(report.improved(TrackedMetric.FITNESS));
        assertTrue(report.overallImproved());
    }

    @Test
    void testTurnoverMovingIntoBandIsImprovement() {
        ImprovementReport report = aggregator.compare(
            metrics(1.0, 1.0, 0.9, 0.1),
            metrics(0.9, 0.9, 0.5, 0.1));

        assertTrue(report.improved(TrackedMetric.TURNOVER));
        assertFalse(report.overallImproved(), "Turnover alone does not make the result better");
    }

    @Test
    void testTurnoverRules() {
        assertTrue(ResultAggregator.turnoverImproved(0.005, 0.2));
        assertTrue(ResultAggregator.turnoverImproved(0.3, 0.35));
        assertFalse(ResultAggregator.turnoverImproved(0.1, 0.5), "Large move inside the band");
        assertFalse(ResultAggregator.turnoverImproved(0.5, 0.95));
        assertFalse(ResultAggregator.turnoverImproved(0.8, 0.9));
    }

    @Test
    void testPercentChangeUndefinedFromZero() {
        ImprovementReport report = aggregator.compare(
            metrics(0.0, 1.0, 0.3, 0.0),
            metrics(0.5, 1.0, 0.3, 0.2));

        MetricComparison sharpe = report.get(TrackedMetric.SHARPE).orElseThrow();
        assertNull(sharpe.percentChange());
        assertEquals(0.5, sharpe.absoluteChange(), 1e-9);
        assertTrue(sharpe.improved());
    }

    @Test
    void testMissingFitnessIsSkipped() {
        ImprovementReport report = aggregator.compare(
            metrics(1.0, null, 0.3, 0.1),
            metrics(1.0, 1.2, 0.3, 0.1));

        assertTrue(report.get(TrackedMetric.FITNESS).isEmpty());
        assertEquals(3, report.comparisons().size());
        assertFalse(report.overallImproved());
    }

    @Test
    void testRankBySharpe() {
        SimulationRequest request = SimulationRequest.of("rank(close)");
        SimulationResult low = new SimulationResult(request, "h1", null, "a1", null, metrics(0.5, 1.0, 0.3, 0.1));
        SimulationResult high = new SimulationResult(request, "h2", null, "a2", null, metrics(2.1, 1.0, 0.3, 0.1));
        SimulationResult bare = new SimulationResult(request, "h3", null, null, null, null);

        BatchResult<SimulationRequest, SimulationResult> batch = new BatchResult<>(List.of(
            new BatchEntry<>(0, request, Outcome.success(low)),
            new BatchEntry<>(1, request, Outcome.failure(ErrorKind.TIMEOUT, "slow")),
            new BatchEntry<>(2, request, Outcome.success(high)),
            new BatchEntry<>(3, request, Outcome.success(bare))));

        List<SimulationResult> ranked = aggregator.rankBySharpe(batch);

        assertEquals(List.of(high, low), ranked);
    }
}
