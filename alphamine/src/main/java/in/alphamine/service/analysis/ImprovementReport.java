package in.alphamine.service.analysis;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-metric comparison of two metric sets. Only metrics present on both sides appear.
 */
public record ImprovementReport(Map<TrackedMetric, MetricComparison> comparisons, boolean overallImproved) {

    public ImprovementReport {
        comparisons = comparisons.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(comparisons));
    }

    public Optional<MetricComparison> get(TrackedMetric metric) {
        return Optional.ofNullable(comparisons.get(metric));
    }

    public boolean improved(TrackedMetric metric) {
        return get(metric).map(MetricComparison::improved).orElse(false);
    }
}
