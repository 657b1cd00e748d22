package in.alphamine.service.analysis;

/**
 * Before/after values of one metric.
 *
 * @param percentChange change relative to |before| in percent; null when |before| is ~0
 */
public record MetricComparison(
    TrackedMetric metric,
    double before,
    double after,
    double absoluteChange,
    Double percentChange,
    boolean improved
) {
}
