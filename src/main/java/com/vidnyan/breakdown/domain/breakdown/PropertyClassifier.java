package com.vidnyan.breakdown.domain.breakdown;

import com.vidnyan.breakdown.domain.exception.ParseInputException;
import com.vidnyan.breakdown.domain.model.Property;
import com.vidnyan.breakdown.domain.model.Property.PropertyKind;
import com.vidnyan.breakdown.domain.node.Node;
import com.vidnyan.breakdown.domain.vocabulary.BreakdownVocabulary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies member properties by the shape of their initializer.
 *
 * Order of checks: injection marker, reactive wrapper, collection builder,
 * plain value. Anything else is kept as {@link PropertyKind#UNCLASSIFIED}
 * together with its rendered expression.
 */
@Slf4j
@RequiredArgsConstructor
public class PropertyClassifier {

    private static final Set<String> MEMBER_ACCESS = Set.of(".", "?.", "!!.");
    private static final String ANY = "Any";

    private final MethodBodyAnalyzer renderer;

    /**
     * Classify a property and append it to {@code properties}. Names are unique
     * within a class; a redeclared name is logged and the first one kept.
     */
    public void classifyInto(Node.PropertyDecl decl, Collection<Property> properties, BreakdownContext context) {
        Property property = classify(decl, context);
        if (properties.stream().anyMatch(p -> p.name().equals(property.name()))) {
            log.warn("Duplicate property {} in {}, keeping the first declaration",
                    property.name(), context.currentClass());
            return;
        }
        properties.add(property);
    }

    /**
     * Classify a single property declaration.
     * @throws ParseInputException when the declaration has no name
     */
    public Property classify(Node.PropertyDecl decl, BreakdownContext context) {
        if (decl.name() == null || decl.name().isBlank()) {
            throw new ParseInputException("Property declaration without a name in " + context.currentClass());
        }
        BreakdownVocabulary vocabulary = context.vocabulary();
        Node initializer = decl.initializer();
        String expression = summarize(decl, context);

        PropertyKind kind;
        if (isInjected(decl, vocabulary)) {
            kind = PropertyKind.INJECTED;
        } else if (decl.delegate() != null) {
            kind = PropertyKind.UNCLASSIFIED;
        } else if (isReactiveWrapper(initializer, vocabulary)) {
            kind = PropertyKind.OBSERVABLE;
        } else if (isCollection(initializer, vocabulary)) {
            kind = PropertyKind.COLLECTION;
        } else if (isValue(decl)) {
            kind = PropertyKind.VALUE;
        } else {
            kind = PropertyKind.UNCLASSIFIED;
        }

        String type = decl.type() != null && !decl.type().isBlank()
                ? decl.type()
                : inferType(decl, kind, vocabulary);

        if (kind == PropertyKind.UNCLASSIFIED) {
            log.debug("Unclassified property {}.{} = {}", context.currentClass(), decl.name(), expression);
        }
        return new Property(decl.name(), type, kind, expression);
    }

    private String summarize(Node.PropertyDecl decl, BreakdownContext context) {
        if (decl.initializer() != null) {
            return renderer.render(decl.initializer(), context);
        }
        if (decl.delegate() != null) {
            return "by " + renderer.render(decl.delegate(), context);
        }
        return null;
    }

    /**
     * Delegate call to an injection function with no explicit value
     * ({@code by inject()}), or an injection annotation.
     */
    private boolean isInjected(Node.PropertyDecl decl, BreakdownVocabulary vocabulary) {
        if (decl.annotations().stream().anyMatch(vocabulary::isInjectionAnnotation)) {
            return true;
        }
        Node.Call call = terminalCall(decl.delegate());
        return call != null
                && call.arguments().isEmpty()
                && vocabulary.isInjectionDelegate(call.name());
    }

    /**
     * Direct wrapper call ({@code SimpleStringProperty()}) or a member access
     * ending in one ({@code listOf(1).observable()}).
     */
    private boolean isReactiveWrapper(Node initializer, BreakdownVocabulary vocabulary) {
        Node.Call call = terminalCall(initializer);
        return call != null && vocabulary.isReactiveWrapper(call.name());
    }

    private boolean isCollection(Node initializer, BreakdownVocabulary vocabulary) {
        Node.Call call = terminalCall(initializer);
        return call != null && vocabulary.isCollectionBuilder(call.name());
    }

    private boolean isValue(Node.PropertyDecl decl) {
        Node initializer = decl.initializer();
        if (initializer == null) {
            return decl.type() != null && !decl.type().isBlank();
        }
        return initializer instanceof Node.Literal
                || initializer instanceof Node.NameRef
                || initializer instanceof Node.Call
                || initializer instanceof Node.BinaryOp;
    }

    /**
     * The call an expression evaluates through: the call itself, or the
     * right-most call of a member-access chain.
     */
    private static Node.Call terminalCall(Node node) {
        if (node instanceof Node.Call call) {
            return call;
        }
        if (node instanceof Node.BinaryOp op && MEMBER_ACCESS.contains(op.operator())) {
            return terminalCall(op.rhs());
        }
        return null;
    }

    private String inferType(Node.PropertyDecl decl, PropertyKind kind, BreakdownVocabulary vocabulary) {
        Node initializer = decl.initializer();
        if (initializer instanceof Node.Literal literal && literal.kind() != null) {
            return literalType(literal);
        }
        Node.Call call = terminalCall(initializer);
        if (call == null || call.name() == null || call.name().isBlank()) {
            return ANY;
        }
        if (Character.isUpperCase(call.name().charAt(0))) {
            return withTypeArguments(call.name(), call);
        }
        if (kind == PropertyKind.OBSERVABLE) {
            return observableType(call.name());
        }
        if (kind == PropertyKind.COLLECTION && vocabulary.isCollectionBuilder(call.name())) {
            return withTypeArguments(collectionType(call.name()), call);
        }
        return ANY;
    }

    private static String literalType(Node.Literal literal) {
        String text = literal.text() == null ? "" : literal.text();
        return switch (literal.kind()) {
            case STRING -> "String";
            case BOOLEAN -> "Boolean";
            case CHAR -> "Char";
            case NULL -> "Nothing?";
            case NUMBER -> {
                String lower = text.toLowerCase(Locale.ROOT);
                if (lower.endsWith("l")) {
                    yield "Long";
                }
                if (lower.endsWith("f") && !lower.startsWith("0x")) {
                    yield "Float";
                }
                yield text.contains(".") || lower.contains("e") && !lower.startsWith("0x") ? "Double" : "Int";
            }
        };
    }

    private static String observableType(String wrapper) {
        String lower = wrapper.toLowerCase(Locale.ROOT);
        if (lower.contains("map")) {
            return "ObservableMap";
        }
        if (lower.contains("set")) {
            return "ObservableSet";
        }
        if (lower.endsWith("property")) {
            return Character.toUpperCase(wrapper.charAt(0)) + wrapper.substring(1);
        }
        return "ObservableList";
    }

    private static String collectionType(String builder) {
        String lower = builder.toLowerCase(Locale.ROOT);
        if (lower.contains("map")) {
            return "Map";
        }
        if (lower.contains("set")) {
            return "Set";
        }
        if (lower.contains("array") && !lower.contains("list")) {
            return "Array";
        }
        return "List";
    }

    private static String withTypeArguments(String base, Node.Call call) {
        if (call.typeArguments().isEmpty()) {
            return base;
        }
        return base + "<" + String.join(", ", call.typeArguments()) + ">";
    }
}
