package org.pragmatica.tscn.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.tscn.SceneFixtures;
import org.pragmatica.tscn.TscnParser;
import org.pragmatica.tscn.scene.SceneDocument;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class NodeIndexTest {

    private static SceneDocument parse(String text) {
        return TscnParser.parseOrThrow(text);
    }

    @Test
    void repeatedNames_resolveThroughTheirOwnBranch() {
        var document = parse(SceneFixtures.load("repeated_names.tscn"));
        var index = NodeIndex.of(document);
        var nodes = document.nodes();

        assertEquals(Optional.of(nodes.get(2)), index.parentOf(nodes.get(3)));
        assertEquals(Optional.of(nodes.get(5)), index.parentOf(nodes.get(6)));
        assertEquals(Optional.of("Left/Body/Light"), index.pathOf(nodes.get(3)));
        assertEquals(Optional.of("Right/Body/Light"), index.pathOf(nodes.get(6)));
        assertThat(index.orphans()).isEmpty();
    }

    @Test
    void walk_followsChildNames() {
        var index = NodeIndex.of(parse(SceneFixtures.load("repeated_names.tscn")));

        assertEquals("SpotLight3D", index.walk("Right/Body/Light").orElseThrow().type().orElseThrow());
        assertEquals("World", index.walk(".").orElseThrow().name());
        assertTrue(index.walk("Right/Missing").isEmpty());
    }

    @Test
    void rootPath_isDot() {
        var document = parse(SceneFixtures.SCRIPTED_PLAYER);
        var index = NodeIndex.of(document);

        assertEquals(Optional.of("."), index.pathOf(document.nodes().get(0)));
        assertEquals(Optional.of("Player/Sprite"), index.pathOf(document.nodes().get(2)));
        assertTrue(index.parentOf(document.nodes().get(0)).isEmpty());
    }

    @Test
    void children_keepDeclarationOrder() {
        var document = parse(SceneFixtures.load("player.tscn"));
        var index = NodeIndex.of(document);
        var player = document.nodes().get(1);

        assertThat(index.children(player)).extracting(node -> node.name())
                                          .containsExactly("Sprite", "Hitbox", "Weapon");
    }

    @Test
    void parentDeclaredLater_isFoundByName() {
        var document = parse("""
            [node name="Root"]
            [node name="Child" parent="Late"]
            [node name="Late" parent="."]
            """);
        var index = NodeIndex.of(document);

        assertEquals(Optional.of(document.nodes().get(2)), index.parentOf(document.nodes().get(1)));
        assertEquals(Optional.of("Late/Child"), index.pathOf(document.nodes().get(1)));
    }

    @Test
    void unknownParent_makesAnOrphan() {
        var document = parse("""
            [node name="Root"]
            [node name="Lost" parent="Nowhere"]
            [node name="Below" parent="Nowhere/Lost"]
            """);
        var index = NodeIndex.of(document);

        assertThat(index.orphans()).extracting(node -> node.name())
                                   .containsExactly("Lost", "Below");
        assertTrue(index.pathOf(document.nodes().get(1)).isEmpty());
        assertEquals(Optional.of(document.nodes().get(1)), index.parentOf(document.nodes().get(2)));
    }

    @Test
    void multipleRoots_firstDeclaredIsPrimary() {
        var document = parse("[node name=\"A\"]\n[node name=\"B\"]\n[node name=\"C\" parent=\".\"]\n");
        var index = NodeIndex.of(document);

        assertEquals("A", index.primaryRoot().orElseThrow().name());
        assertThat(index.roots()).hasSize(2);
        assertEquals(Optional.of("C"), index.pathOf(document.nodes().get(2)));
        assertTrue(index.pathOf(document.nodes().get(1)).isEmpty());
        assertThat(index.orphans()).isEmpty();
    }

    @Test
    void parentLinksNeverFormACycle() {
        var document = parse("[node name=\"A\" parent=\"B\"]\n[node name=\"B\" parent=\"A\"]\n");
        var index = NodeIndex.of(document);

        assertEquals(Optional.of(document.nodes().get(1)), index.parentOf(document.nodes().get(0)));
        assertTrue(index.parentOf(document.nodes().get(1)).isEmpty());
        assertThat(index.orphans()).hasSize(2);
    }

    @Test
    void emptyDocument_hasNoRoot() {
        var index = NodeIndex.of(SceneDocument.empty());

        assertTrue(index.primaryRoot().isEmpty());
        assertThat(index.orphans()).isEmpty();
    }
}
