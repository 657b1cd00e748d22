package in.alphamine.service.analysis;

import in.alphamine.domain.common.BatchResult;
import in.alphamine.domain.simulation.MetricSet;
import in.alphamine.domain.simulation.SimulationResult;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Compares metric sets and ranks batch results.
 *
 * Sharpe, fitness and returns improve when they increase. Turnover improves when it
 * moves into [0.01, 0.7], or stays inside that band while changing by less than 0.1.
 * A comparison is improved overall when sharpe or fitness improved.
 */
public class ResultAggregator {

    static final double TURNOVER_MIN = 0.01;
    static final double TURNOVER_MAX = 0.7;
    static final double TURNOVER_STABLE_DELTA = 0.1;
    private static final double ZERO_EPSILON = 1e-9;

    public ImprovementReport compare(MetricSet before, MetricSet after) {
        Map<TrackedMetric, MetricComparison> comparisons = new EnumMap<>(TrackedMetric.class);

        add(comparisons, TrackedMetric.SHARPE, before.sharpe(), after.sharpe());
        add(comparisons, TrackedMetric.FITNESS, before.fitness(), after.fitness());
        add(comparisons, TrackedMetric.TURNOVER, before.turnover(), after.turnover());
        add(comparisons, TrackedMetric.RETURNS, before.returns(), after.returns());

        boolean overall = isImproved(comparisons, TrackedMetric.SHARPE) || isImproved(comparisons, TrackedMetric.FITNESS);
        return new ImprovementReport(comparisons, overall);
    }

    /**
     * Successful results that carry metrics, best sharpe first.
     */
    public List<SimulationResult> rankBySharpe(BatchResult<?, SimulationResult> batch) {
        return batch.successes().stream()
            .filter(SimulationResult::hasMetrics)
            .sorted(Comparator.comparingDouble((SimulationResult r) -> r.metrics().sharpe()).reversed())
            .toList();
    }

    static boolean turnoverImproved(double before, double after) {
        boolean beforeInBand = inTurnoverBand(before);
        boolean afterInBand = inTurnoverBand(after);
        return (!beforeInBand && afterInBand)
            || (beforeInBand && afterInBand && Math.abs(after - before) < TURNOVER_STABLE_DELTA);
    }

    static boolean inTurnoverBand(double turnover) {
        return turnover >= TURNOVER_MIN && turnover <= TURNOVER_MAX;
    }

    private static void add(Map<TrackedMetric, MetricComparison> comparisons, TrackedMetric metric,
                            Double before, Double after) {
        if (before == null || after == null) {
            return;
        }
        double delta = after - before;
        Double percent = Math.abs(before) > ZERO_EPSILON ? delta / Math.abs(before) * 100.0 : null;
        boolean improved = metric == TrackedMetric.TURNOVER ? turnoverImproved(before, after) : after > before;
        comparisons.put(metric, new MetricComparison(metric, before, after, delta, percent, improved));
    }

    private static boolean isImproved(Map<TrackedMetric, MetricComparison> comparisons, TrackedMetric metric) {
        MetricComparison comparison = comparisons.get(metric);
        return comparison != null && comparison.improved();
    }
}
