package org.pragmatica.tscn.scene;

/**
 * {@code [editable path="..."]}: an instanced sub-scene whose children are editable.
 */
public record EditableInstance(String path) {}
