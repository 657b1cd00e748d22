package in.alphamine.infrastructure.brain;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Filter for the data-field catalog.
 */
public record DataFieldQuery(
    String instrumentType,
    String region,
    int delay,
    String universe,
    String datasetId,
    String search,
    int pageSize
) {
    public DataFieldQuery {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
    }

    public static DataFieldQuery forRegion(String region, String universe) {
        return new DataFieldQuery("EQUITY", region, 1, universe, null, null, 50);
    }

    Map<String, String> toParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("instrumentType", instrumentType);
        params.put("region", region);
        params.put("delay", String.valueOf(delay));
        params.put("universe", universe);
        params.put("limit", String.valueOf(pageSize));
        if (datasetId != null && !datasetId.isEmpty()) {
            params.put("dataset.id", datasetId);
        }
        if (search != null && !search.isEmpty()) {
            params.put("search", search);
        }
        return params;
    }
}
