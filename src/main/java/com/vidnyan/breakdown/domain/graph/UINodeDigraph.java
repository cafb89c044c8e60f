package com.vidnyan.breakdown.domain.graph;

import com.vidnyan.breakdown.domain.model.UINode;

import java.util.*;

/**
 * Widget containment hierarchy of one class.
 * An edge parent → child means the child widget is added inside the parent.
 * Every non-root node has exactly one parent; several roots are allowed.
 * Immutable and thread-safe once built.
 */
public final class UINodeDigraph {

    private final List<UINode> vertices;
    private final List<UINode> roots;
    private final Map<UINode, List<UINode>> children;
    private final Map<UINode, UINode> parents;

    private UINodeDigraph(
            List<UINode> vertices,
            List<UINode> roots,
            Map<UINode, List<UINode>> children,
            Map<UINode, UINode> parents
    ) {
        this.vertices = List.copyOf(vertices);
        this.roots = List.copyOf(roots);
        Map<UINode, List<UINode>> frozen = new LinkedHashMap<>();
        children.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        this.children = Collections.unmodifiableMap(frozen);
        this.parents = Collections.unmodifiableMap(new LinkedHashMap<>(parents));
    }

    /**
     * All nodes in insertion order.
     */
    public List<UINode> getVertices() {
        return vertices;
    }

    /**
     * Nodes with no incoming containment edge.
     */
    public List<UINode> getRoots() {
        return roots;
    }

    /**
     * Direct children in the order they were added.
     */
    public List<UINode> getChildren(UINode node) {
        return children.getOrDefault(node, List.of());
    }

    public Optional<UINode> getParent(UINode node) {
        return Optional.ofNullable(parents.get(node));
    }

    public int inDegree(UINode node) {
        return parents.containsKey(node) ? 1 : 0;
    }

    public boolean isRoot(UINode node) {
        return roots.contains(node);
    }

    /**
     * All containment edges, parents visited in insertion order.
     */
    public List<Edge> getEdges() {
        List<Edge> edges = new ArrayList<>();
        for (UINode vertex : vertices) {
            for (UINode child : getChildren(vertex)) {
                edges.add(new Edge(vertex, child));
            }
        }
        return edges;
    }

    /**
     * Depth-first preorder walk starting from each root in turn.
     */
    public List<UINode> preorder() {
        List<UINode> order = new ArrayList<>();
        Deque<UINode> stack = new ArrayDeque<>();
        for (UINode root : roots) {
            stack.push(root);
            while (!stack.isEmpty()) {
                UINode current = stack.pop();
                order.add(current);
                List<UINode> kids = getChildren(current);
                for (int i = kids.size() - 1; i >= 0; i--) {
                    stack.push(kids.get(i));
                }
            }
        }
        return order;
    }

    public int size() {
        return vertices.size();
    }

    public boolean isEmpty() {
        return vertices.isEmpty();
    }

    public record Edge(UINode parent, UINode child) {}

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<UINode> vertices = new ArrayList<>();
        private final List<UINode> roots = new ArrayList<>();
        private final Map<UINode, List<UINode>> children = new LinkedHashMap<>();
        private final Map<UINode, UINode> parents = new HashMap<>();

        public Builder root(UINode node) {
            addVertex(node);
            roots.add(node);
            return this;
        }

        /**
         * Add {@code child} contained by {@code parent}, which must already be present.
         */
        public Builder child(UINode parent, UINode child) {
            if (!children.containsKey(parent)) {
                throw new IllegalStateException("Unknown parent " + parent);
            }
            addVertex(child);
            parents.put(child, parent);
            children.get(parent).add(child);
            return this;
        }

        private void addVertex(UINode node) {
            if (children.containsKey(node)) {
                throw new IllegalStateException("Node already placed: " + node);
            }
            vertices.add(node);
            children.put(node, new ArrayList<>());
        }

        public UINodeDigraph build() {
            return new UINodeDigraph(vertices, roots, children, parents);
        }
    }
}
