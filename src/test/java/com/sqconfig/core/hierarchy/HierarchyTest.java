package com.sqconfig.core.hierarchy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HierarchyTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private Hierarchy hierarchy;

    @BeforeEach
    void setUp() {
        hierarchy = new Hierarchy();
        for (var key : List.of("A", "B", "C", "D")) {
            hierarchy.add(new HierarchyNode(key, null, mapper.createObjectNode(), Map.of()));
        }
        assertTrue(hierarchy.link("A", "B", EdgeKind.OWNED));
        assertTrue(hierarchy.link("B", "C", EdgeKind.OWNED));
    }

    @Test
    void rootsAndAncestors() {
        assertEquals(List.of("A", "D"), hierarchy.roots());
        assertEquals(List.of("B", "A"), hierarchy.ancestors("C"));
        assertEquals(Optional.of("B"), hierarchy.parentOf("C"));
        assertEquals(Optional.empty(), hierarchy.parentOf("A"));
    }

    @Test
    @DisplayName("an edge that would make a node its own ancestor is refused")
    void refusesCycles() {
        assertFalse(hierarchy.link("C", "A", EdgeKind.REFERENCE));
        assertFalse(hierarchy.link("C", "C", EdgeKind.REFERENCE));
        assertTrue(hierarchy.children("C").isEmpty());
    }

    @Test
    void ownedChildHasSingleOwner() {
        assertThrows(IllegalArgumentException.class, () -> hierarchy.link("D", "C", EdgeKind.OWNED));
        assertTrue(hierarchy.link("D", "C", EdgeKind.REFERENCE));
        assertEquals(Optional.of("B"), hierarchy.parentOf("C"));
    }

    @Test
    void duplicateKeyRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> hierarchy.add(new HierarchyNode("A", null, mapper.createObjectNode(), Map.of())));
    }

    @Test
    void parentFirstOrderAndSubtree() {
        hierarchy.link("D", "A", EdgeKind.REFERENCE);
        assertEquals(List.of("A", "D", "B", "C"), hierarchy.parentFirstOrder());
        assertEquals(List.of("B", "C"), hierarchy.subtree("B"));
        assertEquals(List.of("D"), hierarchy.subtree("D"));
    }

    @Test
    @DisplayName("removing a node drops its owned descendants and edges pointing to it")
    void removeCascadesOwnedOnly() {
        hierarchy.link("D", "B", EdgeKind.REFERENCE);
        hierarchy.remove("B");
        assertFalse(hierarchy.contains("B"));
        assertFalse(hierarchy.contains("C"));
        assertTrue(hierarchy.children("A").isEmpty());
        assertTrue(hierarchy.children("D").isEmpty());
        assertEquals(2, hierarchy.size());
    }
}
