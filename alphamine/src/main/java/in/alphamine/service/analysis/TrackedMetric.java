package in.alphamine.service.analysis;

/**
 * Metrics compared between two simulations of related expressions.
 */
public enum TrackedMetric {
    SHARPE,
    FITNESS,
    TURNOVER,
    RETURNS
}
