package in.alphamine.domain.simulation;

/**
 * An integer literal inside an expression, located by [start, end) offsets.
 */
public record ParameterSite(int value, int start, int end) {

    public ParameterSite {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid site offsets: [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }
}
