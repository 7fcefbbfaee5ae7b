package com.vidnyan.attackgraph.domain.model;

import java.util.Map;

/**
 * A concrete asset of an instance model.
 * Identity is the model-assigned id; the type names an asset type of the language.
 */
public record Asset(
    long id,
    String name,
    String type,
    Map<String, Object> properties
) {

    public Asset {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public Asset(long id, String name, String type) {
        this(id, name, type, Map.of());
    }

    public boolean hasType() {
        return type != null && !type.isBlank();
    }
}
