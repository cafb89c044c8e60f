package com.vidnyan.breakdown.domain.graph;

import com.vidnyan.breakdown.domain.model.UINode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UINodeDigraphTest {

    private final UINode tabs = new UINode(0, "tabpane", "tabpane#0");
    private final UINode general = new UINode(1, "tab", "General");
    private final UINode advanced = new UINode(2, "tab", "Advanced");
    private final UINode save = new UINode(3, "button", "Save");
    private final UINode status = new UINode(4, "label", "Ready");

    private UINodeDigraph sample() {
        return UINodeDigraph.builder()
                .root(tabs)
                .child(tabs, general)
                .child(general, save)
                .child(tabs, advanced)
                .root(status)
                .build();
    }

    @Test
    void build_ShouldExposeRootsChildrenAndParents() {
        UINodeDigraph graph = sample();

        assertEquals(List.of(tabs, status), graph.getRoots());
        assertEquals(List.of(general, advanced), graph.getChildren(tabs));
        assertEquals(general, graph.getParent(save).orElseThrow());
        assertTrue(graph.getParent(tabs).isEmpty());
        assertTrue(graph.getChildren(status).isEmpty());
        assertEquals(5, graph.size());
    }

    @Test
    void getEdges_ShouldFollowInsertionOrder() {
        assertEquals(List.of(
                new UINodeDigraph.Edge(tabs, general),
                new UINodeDigraph.Edge(tabs, advanced),
                new UINodeDigraph.Edge(general, save)
        ), sample().getEdges());
    }

    @Test
    void preorder_ShouldVisitDepthFirst() {
        assertEquals(List.of(tabs, general, save, advanced, status), sample().preorder());
    }

    @Test
    void builder_SecondParent_ShouldBeRejected() {
        UINodeDigraph.Builder builder = UINodeDigraph.builder().root(tabs).root(status).child(tabs, general);

        assertThrows(IllegalStateException.class, () -> builder.child(status, general));
        assertThrows(IllegalStateException.class, () -> builder.root(general));
    }

    @Test
    void builder_UnknownParent_ShouldBeRejected() {
        assertThrows(IllegalStateException.class, () -> UINodeDigraph.builder().child(tabs, general));
    }

    @Test
    void build_ShouldBeImmutable() {
        UINodeDigraph graph = sample();

        assertThrows(UnsupportedOperationException.class, () -> graph.getVertices().add(save));
        assertThrows(UnsupportedOperationException.class, () -> graph.getChildren(tabs).clear());
    }
}
