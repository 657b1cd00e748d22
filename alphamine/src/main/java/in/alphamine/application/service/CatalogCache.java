package in.alphamine.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import in.alphamine.infrastructure.brain.BrainClient;
import in.alphamine.infrastructure.brain.BrainException;
import in.alphamine.infrastructure.brain.DataFieldQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operators and data fields fetched from the platform, cached per instance.
 *
 * Data fields are keyed by region and universe. A failed fetch is logged and cached as
 * an empty list; pass {@code refresh=true} to try again.
 */
public class CatalogCache {
    private static final Logger log = LoggerFactory.getLogger(CatalogCache.class);

    private final BrainClient client;
    private final Map<String, List<JsonNode>> dataFields = new ConcurrentHashMap<>();
    private volatile List<JsonNode> operators;

    public CatalogCache(BrainClient client) {
        this.client = client;
    }

    public synchronized List<JsonNode> operators(boolean refresh) {
        if (operators == null || refresh) {
            try {
                operators = List.copyOf(client.getOperators());
                log.info("[CATALOG] Cached {} operators", operators.size());
            } catch (BrainException e) {
                log.error("[CATALOG] Failed to fetch operators: {}", e.getMessage());
                operators = List.of();
            }
        }
        return operators;
    }

    public List<JsonNode> dataFields(String region, String universe, boolean refresh) {
        String key = region + "/" + universe;
        if (!refresh) {
            List<JsonNode> cached = dataFields.get(key);
            if (cached != null) {
                return cached;
            }
        }
        List<JsonNode> fetched;
        try {
            fetched = List.copyOf(client.getDataFields(DataFieldQuery.forRegion(region, universe)));
            log.info("[CATALOG] Cached {} data fields for {}", fetched.size(), key);
        } catch (BrainException e) {
            log.error("[CATALOG] Failed to fetch data fields for {}: {}", key, e.getMessage());
            fetched = List.of();
        }
        dataFields.put(key, fetched);
        return fetched;
    }

    public List<String> operatorNames() {
        return operators(false).stream()
            .map(op -> op.path("name").asText(""))
            .filter(name -> !name.isEmpty())
            .toList();
    }

    public List<String> dataFieldIds(String region, String universe) {
        return dataFields(region, universe, false).stream()
            .map(field -> field.path("id").asText(""))
            .filter(id -> !id.isEmpty())
            .toList();
    }
}
