package in.alphamine.service.variation;

/**
 * Bounds for parameter variation.
 *
 * @param rangePercent  half-width of the candidate range as a fraction of the original value
 * @param minPerParam   candidates for values up to 20
 * @param maxPerParam   candidates for larger values
 * @param maxVariations cap on the number of returned expressions, original included
 */
public record VariationOptions(double rangePercent, int minPerParam, int maxPerParam, int maxVariations) {

    public static final VariationOptions DEFAULT = new VariationOptions(0.5, 3, 5, 20);

    public VariationOptions {
        if (Double.isNaN(rangePercent) || rangePercent < 0) {
            throw new IllegalArgumentException("rangePercent must be non-negative: " + rangePercent);
        }
        if (minPerParam < 2) {
            throw new IllegalArgumentException("minPerParam must be at least 2: " + minPerParam);
        }
        if (maxPerParam < minPerParam) {
            throw new IllegalArgumentException("maxPerParam must be >= minPerParam");
        }
        if (maxVariations < 1) {
            throw new IllegalArgumentException("maxVariations must be positive: " + maxVariations);
        }
    }

    public VariationOptions withRange(double range) {
        return new VariationOptions(range, minPerParam, maxPerParam, maxVariations);
    }

    public VariationOptions withMaxVariations(int max) {
        return new VariationOptions(rangePercent, minPerParam, maxPerParam, max);
    }
}
