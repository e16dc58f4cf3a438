package org.pragmatica.tscn.scene;

import org.pragmatica.tscn.value.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code [node ...]} section with the property lines that follow it.
 *
 * <p>{@code parent} is empty for the scene root, {@code "."} for a direct child of the root,
 * and otherwise the {@code /}-joined names of the ancestors below the root.
 *
 * @param id                  position in declaration order, unique within the document
 * @param name                node name
 * @param type                node class; absent for instanced sub-scenes
 * @param parent              parent path as written
 * @param scriptRef           raw text of the {@code script} property, e.g. {@code ExtResource("1_abc")}
 * @param properties          remaining properties in declaration order
 * @param instance            raw {@code instance} attribute of an instanced sub-scene
 * @param instancePlaceholder {@code instance_placeholder} path
 * @param owner               {@code owner} attribute
 * @param index               explicit sibling index
 * @param groups              groups the node belongs to
 * @param attributes          every raw header attribute, including unrecognized ones
 */
public record SceneNode(
    int id,
    String name,
    Optional<String> type,
    Optional<String> parent,
    Optional<String> scriptRef,
    Map<String, Value> properties,
    Optional<String> instance,
    Optional<String> instancePlaceholder,
    Optional<String> owner,
    Optional<Integer> index,
    List<String> groups,
    Map<String, String> attributes
) {
    public static final String ROOT_PARENT = ".";

    public SceneNode {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        groups = List.copyOf(groups);
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public boolean isRoot() {
        return parent.isEmpty();
    }

    public boolean isChildOfRoot() {
        return parent.filter(ROOT_PARENT::equals).isPresent();
    }

    public boolean hasScript() {
        return scriptRef.isPresent();
    }
}
