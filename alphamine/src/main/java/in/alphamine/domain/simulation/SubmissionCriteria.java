package in.alphamine.domain.simulation;

import java.util.Optional;
import java.util.Set;

/**
 * Caller-supplied acceptance thresholds for alphas.
 *
 * Sharpe and fitness are compared by absolute value. Turnover must lie in
 * [minTurnover, maxTurnover]. A check reported as FAIL whose name is in {@code gatingChecks}
 * rejects the alpha. PENDING or WARNING does not.
 */
public record SubmissionCriteria(
    double minSharpe,
    double minFitness,
    double minTurnover,
    double maxTurnover,
    Set<String> gatingChecks
) {
    public static final Set<String> DEFAULT_GATING_CHECKS =
        Set.of("LOW_SHARPE", "LOW_FITNESS", "LOW_TURNOVER", "HIGH_TURNOVER", "CONCENTRATED_WEIGHT");

    public SubmissionCriteria {
        if (minTurnover > maxTurnover) {
            throw new IllegalArgumentException("minTurnover cannot exceed maxTurnover");
        }
        gatingChecks = gatingChecks == null ? Set.of() : Set.copyOf(gatingChecks);
    }

    /**
     * sharpe 1.25, fitness 1.0, turnover [0.01, 0.7], the standard gating checks.
     */
    public static SubmissionCriteria defaults() {
        return new SubmissionCriteria(1.25, 1.0, 0.01, 0.7, DEFAULT_GATING_CHECKS);
    }

    /**
     * Threshold test only: sharpe, fitness and turnover. A missing fitness counts as 0.
     */
    public boolean meetsThresholds(MetricSet metrics) {
        if (metrics == null) {
            return false;
        }
        double fitness = metrics.fitness() == null ? 0.0 : metrics.fitness();
        return Math.abs(metrics.sharpe()) >= minSharpe
            && Math.abs(fitness) >= minFitness
            && metrics.turnover() >= minTurnover
            && metrics.turnover() <= maxTurnover;
    }

    /**
     * Full submission test.
     *
     * @return the first reason for rejection, empty if the metrics qualify
     */
    public Optional<String> rejectionReason(MetricSet metrics) {
        if (metrics == null) {
            return Optional.of("No metrics available");
        }
        if (Math.abs(metrics.sharpe()) < minSharpe) {
            return Optional.of("Sharpe ratio too low: " + metrics.sharpe());
        }
        if (metrics.fitness() == null || Math.abs(metrics.fitness()) < minFitness) {
            return Optional.of("Fitness too low: " + metrics.fitness());
        }
        if (metrics.turnover() < minTurnover) {
            return Optional.of("Turnover too low: " + metrics.turnover());
        }
        if (metrics.turnover() > maxTurnover) {
            return Optional.of("Turnover too high: " + metrics.turnover());
        }
        if (metrics.checks().isEmpty()) {
            return Optional.of("No check results available");
        }
        for (AlphaCheck check : metrics.checks()) {
            if (gatingChecks.contains(check.name()) && check.failed()) {
                return Optional.of("Check failed: " + check.name());
            }
        }
        return Optional.empty();
    }
}
