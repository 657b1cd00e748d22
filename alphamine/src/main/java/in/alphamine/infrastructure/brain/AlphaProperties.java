package in.alphamine.infrastructure.brain;

import java.util.List;

/**
 * Editable alpha properties. Null fields are left untouched by a PATCH.
 */
public record AlphaProperties(String name, String color, List<String> tags, String description) {

    public AlphaProperties {
        tags = tags == null ? null : List.copyOf(tags);
    }

    public static AlphaProperties tags(List<String> tags) {
        return new AlphaProperties(null, null, tags, null);
    }

    public boolean isEmpty() {
        return name == null && color == null && tags == null && description == null;
    }
}
