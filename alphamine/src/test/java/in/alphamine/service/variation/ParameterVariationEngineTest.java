package in.alphamine.service.variation;

import in.alphamine.domain.simulation.ParameterSite;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ParameterVariationEngine.
 *
 * Tests:
 * - Parameter extraction and exclusions
 * - Candidate generation
 * - Variant ordering, uniqueness and bound
 * - Shrinking of oversized grids
 * - Substitution at extracted offsets
 */
@DisplayName("Parameter Variation Engine Tests")
class ParameterVariationEngineTest {

    private final ParameterVariationEngine engine = new ParameterVariationEngine();

    @Test
    void testExtractParameters() {
        List<ParameterSite> sites = engine.extractParameters("ts_mean(close, 10) / ts_std_dev(returns, 252)");

        assertEquals(2, sites.size());
        assertEquals(10, sites.get(0).value());
        assertEquals(15, sites.get(0).start());
        assertEquals(17, sites.get(0).end());
        assertEquals(252, sites.get(1).value());
    }

    @Test
    void testIdentifierAndDecimalDigitsAreNotParameters() {
        assertTrue(engine.extractParameters("rank(close10)").isEmpty());
        assertTrue(engine.extractParameters("rank(x_5) * 0.5").isEmpty());
        assertTrue(engine.extractParameters("rank(close) * 1.25").isEmpty());
        assertTrue(engine.extractParameters("ts_mean(close, 99999999999)").isEmpty(), "Out of int range");
    }

    @Test
    void testCandidateValuesIncludeOriginal() {
        List<Integer> candidates = engine.candidateValues(10, VariationOptions.DEFAULT);
        assertTrue(candidates.containsAll(List.of(5, 10, 15)), candidates.toString());

        List<Integer> large = engine.candidateValues(100, VariationOptions.DEFAULT);
        assertEquals(List.of(50, 75, 100, 125, 150), large);

        List<Integer> narrow = engine.candidateValues(1, VariationOptions.DEFAULT);
        assertEquals(List.of(1, 2), narrow);
    }

    @Test
    @DisplayName("First variant is the unmodified expression")
    void testVariationsStartWithOriginal() {
        String expression = "ts_mean(close, 10)";

        List<String> variants = engine.generateVariations(expression);

        assertEquals(expression, variants.get(0));
        assertTrue(variants.contains("ts_mean(close, 5)"));
        assertTrue(variants.contains("ts_mean(close, 15)"));
        assertEquals(variants.size(), new HashSet<>(variants).size(), "Variants must be unique");
    }

    @Test
    void testNoParametersReturnsOriginalOnly() {
        assertEquals(List.of("rank(close10)"), engine.generateVariations("rank(close10)"));
    }

    @Test
    @DisplayName("Variant count never exceeds maxVariations")
    void testVariationsBoundedByMax() {
        String expression = "ts_corr(ts_mean(close, 20), ts_mean(volume, 40), 60) - ts_delta(close, 5)";
        VariationOptions options = VariationOptions.DEFAULT.withMaxVariations(7);

        List<String> variants = engine.generateVariations(expression, options);

        assertEquals(7, variants.size());
        assertEquals(expression, variants.get(0));
    }

    @Test
    void testMaxOneReturnsOriginalOnly() {
        List<String> variants = engine.generateVariations("ts_mean(close, 10)",
            VariationOptions.DEFAULT.withMaxVariations(1));

        assertEquals(List.of("ts_mean(close, 10)"), variants);
    }

    @Test
    void testFullGridWhenUnderLimit() {
        String expression = "ts_corr(close, volume, 20) - ts_mean(close, 5)";

        List<String> variants = engine.generateVariations(expression, VariationOptions.DEFAULT);

        assertEquals(9, variants.size(), "3 x 3 candidates, original counted once");
        assertTrue(variants.contains("ts_corr(close, volume, 30) - ts_mean(close, 2)"));
    }

    @Test
    @DisplayName("Shrinking drops the farthest candidate of the widest site")
    void testShrinkRemovesFarthestFromWidestSite() {
        List<ParameterSite> sites = engine.extractParameters("ts_corr(close, volume, 20) - ts_mean(close, 5)");
        List<List<Integer>> candidates = new ArrayList<>();
        candidates.add(new ArrayList<>(List.of(10, 20, 30)));
        candidates.add(new ArrayList<>(List.of(2, 5, 8)));

        engine.shrink(sites, candidates, 4);

        assertEquals(List.of(20, 30), candidates.get(0));
        assertEquals(List.of(5, 8), candidates.get(1));
        assertEquals(4, ParameterVariationEngine.combinationCount(candidates));
    }

    @Test
    void testSubstituteKeepsOffsets() {
        String expression = "ts_mean(close, 5) + ts_mean(close, 100)";
        List<ParameterSite> sites = engine.extractParameters(expression);

        String result = ParameterVariationEngine.substitute(expression, sites, new int[] {12, 7});

        assertEquals("ts_mean(close, 12) + ts_mean(close, 7)", result);
    }

    @Test
    void testSubstitutingOriginalValuesRestoresExpression() {
        List<String> expressions = List.of(
            "rank(close)",
            "ts_mean(close, 5)",
            "ts_corr(rank(close), rank(volume), 10) - ts_delta(vwap, 3) * 0.5",
            "group_neutralize(ts_rank(returns, 252), subindustry) + ts_sum(volume, 1) / ts_std_dev(close, 20000)",
            "1+22+333+4444");

        for (String expression : expressions) {
            List<ParameterSite> sites = engine.extractParameters(expression);
            int[] originals = sites.stream().mapToInt(ParameterSite::value).toArray();

            assertEquals(expression, ParameterVariationEngine.substitute(expression, sites, originals),
                "Substituting the extracted values should give back: " + expression);
        }
    }

    @Test
    void testCombinationCountSaturates() {
        List<List<Integer>> huge = new ArrayList<>();
        List<Integer> many = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            many.add(i);
        }
        for (int i = 0; i < 10; i++) {
            huge.add(many);
        }
        assertEquals(Long.MAX_VALUE, ParameterVariationEngine.combinationCount(huge));
    }
}
