package org.pragmatica.tscn.scene;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The {@code [gd_scene ...]} header.
 *
 * @param formatVersion scene format version, positive ({@code 3} for Godot 4)
 * @param uid           path-independent resource id ({@code uid://...}), if declared
 * @param loadSteps     resource count hint written by older editors
 * @param uidType       legacy {@code uid_type} attribute
 * @param attributes    every raw header attribute, including unrecognized ones
 */
public record SceneHeader(
    int formatVersion,
    Optional<String> uid,
    Optional<Integer> loadSteps,
    Optional<String> uidType,
    Map<String, String> attributes
) {
    public static final int DEFAULT_FORMAT_VERSION = 3;

    public SceneHeader {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static SceneHeader defaultHeader() {
        return defaultHeader(DEFAULT_FORMAT_VERSION);
    }

    public static SceneHeader defaultHeader(int formatVersion) {
        return new SceneHeader(formatVersion, Optional.empty(), Optional.empty(), Optional.empty(), Map.of());
    }
}
