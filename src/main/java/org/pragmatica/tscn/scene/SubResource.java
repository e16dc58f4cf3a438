package org.pragmatica.tscn.scene;

import org.pragmatica.tscn.value.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code [sub_resource ...]}: a resource defined inline, with its property lines.
 */
public record SubResource(
    String id,
    String type,
    Map<String, Value> properties,
    Map<String, String> attributes
) {
    public SubResource {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
