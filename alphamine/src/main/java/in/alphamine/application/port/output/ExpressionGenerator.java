package in.alphamine.application.port.output;

import java.util.List;

/**
 * Text-generation collaborator that proposes or rewrites expressions.
 * Output is untrusted: callers validate every returned expression.
 */
public interface ExpressionGenerator {

    /**
     * Propose new expressions.
     *
     * @return candidate expressions, possibly fewer than requested
     */
    List<String> generateExpressions(GenerationContext context);

    /**
     * Rewrite an expression to meet the given requirements.
     *
     * @param operators operator names the rewrite may use
     * @return the rewritten expression
     */
    String polishExpression(String expression, String requirements, List<String> operators);
}
