package in.alphamine.application.port.output;

import java.util.List;

/**
 * What the expression generator is told about the platform and the request.
 *
 * @param operators     operator names available on the platform
 * @param dataFields    data field ids for the target region/universe
 * @param strategyType  optional strategy hint (momentum, mean reversion, ...)
 * @param focusFields   optional data fields to prefer
 * @param complexity    optional complexity hint
 * @param count         number of expressions requested
 */
public record GenerationContext(
    List<String> operators,
    List<String> dataFields,
    String strategyType,
    List<String> focusFields,
    String complexity,
    int count
) {
    public GenerationContext {
        operators = List.copyOf(operators);
        dataFields = List.copyOf(dataFields);
        focusFields = focusFields == null ? List.of() : List.copyOf(focusFields);
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive");
        }
    }
}
