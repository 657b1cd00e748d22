package in.alphamine.infrastructure.brain;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One page of the account's alpha listing.
 *
 * @param status alpha status filter (UNSUBMITTED, ACTIVE, ...), null for all
 */
public record AlphaQuery(int limit, int offset, String status, String order) {

    public AlphaQuery {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative");
        }
        order = order == null ? "-dateCreated" : order;
    }

    public static AlphaQuery page(String status, int limit, int offset) {
        return new AlphaQuery(limit, offset, status, "-dateCreated");
    }

    public AlphaQuery next() {
        return new AlphaQuery(limit, offset + limit, status, order);
    }

    Map<String, String> toParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("limit", String.valueOf(limit));
        params.put("offset", String.valueOf(offset));
        params.put("order", order);
        params.put("hidden", "false");
        if (status != null) {
            params.put("status", status);
        }
        return params;
    }
}
