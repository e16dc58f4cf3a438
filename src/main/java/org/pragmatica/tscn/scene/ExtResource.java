package org.pragmatica.tscn.scene;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@code [ext_resource ...]}: a script, texture or sub-scene stored in its own file.
 */
public record ExtResource(
    String id,
    String type,
    String path,
    Optional<String> uid,
    Map<String, String> attributes
) {
    public ExtResource {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static ExtResource of(String id, String type, String path) {
        return new ExtResource(id, type, path, Optional.empty(), Map.of());
    }
}
