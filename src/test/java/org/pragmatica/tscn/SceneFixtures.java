package org.pragmatica.tscn;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Scene texts shared by the tests.
 */
public final class SceneFixtures {
    private SceneFixtures() {}

    public static final String SCRIPTED_PLAYER = """
        [gd_scene load_steps=2 format=3 uid="uid://abc123"]
        [ext_resource type="Script" path="res://scripts/player.gd" id="1"]
        [node name="Root" type="Node2D"]
        [node name="Player" type="CharacterBody2D" parent="."]
        script = ExtResource("1")
        [node name="Sprite" type="Sprite2D" parent="Player"]
        """;

    public static final String UNTERMINATED_ARRAY = """
        [gd_scene format=3]
        [node name="Root" type="Node"]
        items = [1, 2
        """;

    public static final String DANGLING_SCRIPT = """
        [gd_scene format=3]
        [node name="Root" type="Node2D"]
        script = ExtResource("missing")
        """;

    /**
     * Load a scene from {@code src/test/resources/scenes}.
     */
    public static String load(String name) {
        try (var in = SceneFixtures.class.getResourceAsStream("/scenes/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No scene fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
