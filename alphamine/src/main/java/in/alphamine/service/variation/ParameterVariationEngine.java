package in.alphamine.service.variation;

import in.alphamine.domain.simulation.ParameterSite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands one expression into variants by substituting its integer literals.
 *
 * Integer literals touching an identifier character or a decimal point are not
 * parameters: {@code close10}, {@code x_5} and {@code 0.5} are left alone.
 *
 * The result always starts with the unmodified expression and never holds more than
 * {@link VariationOptions#maxVariations()} entries.
 */
public class ParameterVariationEngine {
    private static final Logger log = LoggerFactory.getLogger(ParameterVariationEngine.class);

    private static final Pattern INTEGER_LITERAL = Pattern.compile("(?<![A-Za-z0-9_.])\\d+(?![A-Za-z0-9_.])");

    /** Values up to this size get minPerParam candidates, larger ones maxPerParam. */
    static final int SMALL_VALUE_LIMIT = 20;

    public List<ParameterSite> extractParameters(String expression) {
        List<ParameterSite> sites = new ArrayList<>();
        Matcher matcher = INTEGER_LITERAL.matcher(expression);
        while (matcher.find()) {
            String literal = matcher.group();
            int value;
            try {
                value = Integer.parseInt(literal);
            } catch (NumberFormatException e) {
                log.debug("[VARIATION] Skipping literal out of int range: {}", literal);
                continue;
            }
            sites.add(new ParameterSite(value, matcher.start(), matcher.end()));
        }
        return sites;
    }

    public List<String> generateVariations(String expression) {
        return generateVariations(expression, VariationOptions.DEFAULT);
    }

    public List<String> generateVariations(String expression, VariationOptions options) {
        List<ParameterSite> sites = extractParameters(expression);
        if (sites.isEmpty()) {
            log.warn("[VARIATION] No numeric parameters in expression: {}", expression);
            return List.of(expression);
        }

        List<List<Integer>> candidates = new ArrayList<>();
        for (ParameterSite site : sites) {
            candidates.add(candidateValues(site.value(), options));
        }

        long combinations = combinationCount(candidates);
        if (combinations > options.maxVariations()) {
            log.info("[VARIATION] {} combinations exceed limit {}, shrinking", combinations, options.maxVariations());
            shrink(sites, candidates, options.maxVariations());
        }

        Set<String> variants = new LinkedHashSet<>();
        variants.add(expression);
        int[] index = new int[sites.size()];
        int[] values = new int[sites.size()];

        // odometer over the candidate lists, last site varies fastest
        outer:
        while (variants.size() < options.maxVariations()) {
            boolean original = true;
            for (int i = 0; i < sites.size(); i++) {
                values[i] = candidates.get(i).get(index[i]);
                if (values[i] != sites.get(i).value()) {
                    original = false;
                }
            }
            if (!original) {
                variants.add(substitute(expression, sites, values));
            }

            int position = sites.size() - 1;
            while (position >= 0) {
                index[position]++;
                if (index[position] < candidates.get(position).size()) {
                    continue outer;
                }
                index[position] = 0;
                position--;
            }
            break;
        }

        log.info("[VARIATION] Generated {} variants from {} parameters", variants.size(), sites.size());
        return new ArrayList<>(variants);
    }

    /**
     * Evenly spaced candidates in [max(1, floor(v(1-r))), ceil(v(1+r))], original included, sorted.
     */
    List<Integer> candidateValues(int value, VariationOptions options) {
        int lower = (int) Math.max(1, Math.floor(value * (1 - options.rangePercent())));
        int upper = (int) Math.max(lower, Math.ceil(value * (1 + options.rangePercent())));
        int count = value <= SMALL_VALUE_LIMIT ? options.minPerParam() : options.maxPerParam();

        TreeSet<Integer> values = new TreeSet<>();
        int span = upper - lower;
        if (span < count) {
            for (int v = lower; v <= upper; v++) {
                values.add(v);
            }
        } else {
            for (int i = 0; i < count; i++) {
                values.add(lower + (int) Math.round((double) i * span / (count - 1)));
            }
        }
        values.add(value);
        return new ArrayList<>(values);
    }

    /**
     * Drop candidates from the widest site, farthest from the original first, until the
     * product fits or no site has more than two candidates.
     */
    void shrink(List<ParameterSite> sites, List<List<Integer>> candidates, int maxVariations) {
        while (combinationCount(candidates) > maxVariations) {
            int widest = -1;
            for (int i = 0; i < candidates.size(); i++) {
                if (widest < 0 || candidates.get(i).size() > candidates.get(widest).size()) {
                    widest = i;
                }
            }
            List<Integer> values = candidates.get(widest);
            if (values.size() <= 2) {
                return;
            }
            int original = sites.get(widest).value();
            Integer farthest = values.stream()
                .filter(v -> v != original)
                .max(Comparator.<Integer>comparingInt(v -> Math.abs(v - original))
                    .thenComparing(Comparator.reverseOrder()))
                .orElse(null);
            if (farthest == null) {
                return;
            }
            values.remove(farthest);
        }
    }

    static long combinationCount(List<List<Integer>> candidates) {
        long product = 1;
        for (List<Integer> values : candidates) {
            if (product > Long.MAX_VALUE / Math.max(1, values.size())) {
                return Long.MAX_VALUE;
            }
            product *= values.size();
        }
        return product;
    }

    /**
     * Replace each site with its new value, rightmost first so earlier offsets stay valid.
     */
    static String substitute(String expression, List<ParameterSite> sites, int[] values) {
        StringBuilder text = new StringBuilder(expression);
        for (int i = sites.size() - 1; i >= 0; i--) {
            ParameterSite site = sites.get(i);
            text.replace(site.start(), site.end(), String.valueOf(values[i]));
        }
        return text.toString();
    }
}
