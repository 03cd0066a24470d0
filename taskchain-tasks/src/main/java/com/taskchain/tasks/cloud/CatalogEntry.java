package com.taskchain.tasks.cloud;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An image, size or location offered by a cloud provider.
 */
public record CatalogEntry(
    String id,
    String name,
    Map<String, Object> extra
) {
    public CatalogEntry {
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }
}
