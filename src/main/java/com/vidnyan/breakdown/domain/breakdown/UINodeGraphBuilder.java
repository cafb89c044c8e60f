package com.vidnyan.breakdown.domain.breakdown;

import com.vidnyan.breakdown.domain.graph.UINodeDigraph;
import com.vidnyan.breakdown.domain.model.UINode;
import com.vidnyan.breakdown.domain.node.Node;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Builds the widget containment graph of a class.
 *
 * A call whose name is in the widget vocabulary becomes a node. When it sits
 * inside another widget call's trailing lambda it is contained by that widget,
 * otherwise it is a root. Other calls are not nodes, but their arguments and
 * lambdas are still scanned with the current container.
 */
@Slf4j
public class UINodeGraphBuilder {

    /**
     * Scan property initializers and method bodies in member order.
     * Nested structures are opaque and not scanned.
     */
    public UINodeDigraph build(List<Node> members, BreakdownContext context) {
        Scan scan = new Scan(context);
        for (Node member : members) {
            if (member instanceof Node.PropertyDecl property) {
                scan.visit(property.initializer(), null);
                scan.visit(property.delegate(), null);
            } else if (member instanceof Node.FuncDecl func) {
                scan.visit(func.body(), null);
            }
        }
        UINodeDigraph graph = scan.graph.build();
        if (!graph.isEmpty()) {
            log.debug("Class {}: {} controls, {} roots",
                    context.currentClass(), graph.size(), graph.getRoots().size());
        }
        return graph;
    }

    /**
     * Label of a widget: its first positional string argument, else {@code type#index}.
     */
    static String labelOf(Node.Call call, int index) {
        for (Node.Argument argument : call.arguments()) {
            if (argument.isNamed()) {
                continue;
            }
            if (argument.value() instanceof Node.Literal literal
                    && literal.kind() == Node.Literal.LiteralKind.STRING
                    && literal.text() != null) {
                return unquote(literal.text());
            }
            break;
        }
        return call.name() + "#" + index;
    }

    private static String unquote(String text) {
        String t = text;
        if (t.startsWith("\"\"\"") && t.endsWith("\"\"\"") && t.length() >= 6) {
            return t.substring(3, t.length() - 3);
        }
        if (t.length() >= 2 && t.startsWith("\"") && t.endsWith("\"")) {
            return t.substring(1, t.length() - 1);
        }
        return t;
    }

    private static final class Scan {
        private final BreakdownContext context;
        private final UINodeDigraph.Builder graph = UINodeDigraph.builder();
        private int nextIndex;

        Scan(BreakdownContext context) {
            this.context = context;
        }

        void visit(Node node, UINode container) {
            if (node == null) {
                return;
            }
            context.descend(() -> {
                visitNode(node, container);
                return null;
            });
        }

        private void visitNode(Node node, UINode container) {
            if (node instanceof Node.Call call) {
                visitCall(call, container);
            } else if (node instanceof Node.BinaryOp op) {
                visit(op.lhs(), container);
                visit(op.rhs(), container);
            } else if (node instanceof Node.Lambda lambda) {
                visit(lambda.body(), container);
            } else if (node instanceof Node.Block block) {
                block.statements().forEach(s -> visit(s, container));
            } else if (node instanceof Node.PropertyDecl local) {
                visit(local.initializer(), container);
                visit(local.delegate(), container);
            } else if (node instanceof Node.FuncDecl local) {
                visit(local.body(), container);
            }
        }

        private void visitCall(Node.Call call, UINode container) {
            UINode enclosing = container;
            if (context.vocabulary().isWidget(call.name())) {
                int index = nextIndex++;
                UINode widget = new UINode(index, call.name(), labelOf(call, index));
                if (container == null) {
                    graph.root(widget);
                } else {
                    graph.child(container, widget);
                }
                enclosing = widget;
            }
            for (Node.Argument argument : call.arguments()) {
                visit(argument.value(), container);
            }
            if (call.trailingLambda() != null) {
                visit(call.trailingLambda(), enclosing);
            }
        }
    }
}
