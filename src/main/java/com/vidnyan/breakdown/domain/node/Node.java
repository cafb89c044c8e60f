package com.vidnyan.breakdown.domain.node;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Closed syntax-tree vocabulary consumed by the breakdown engine.
 * Front-ends translate their own parse trees into these variants; every
 * component dispatches on the variant and never on untyped objects.
 * Shapes a front-end cannot map are carried as {@link Unknown}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "node")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Node.SourceFile.class, name = "SourceFile"),
    @JsonSubTypes.Type(value = Node.StructuredDecl.class, name = "StructuredDecl"),
    @JsonSubTypes.Type(value = Node.PropertyDecl.class, name = "PropertyDecl"),
    @JsonSubTypes.Type(value = Node.FuncDecl.class, name = "FuncDecl"),
    @JsonSubTypes.Type(value = Node.Call.class, name = "Call"),
    @JsonSubTypes.Type(value = Node.BinaryOp.class, name = "BinaryOp"),
    @JsonSubTypes.Type(value = Node.NameRef.class, name = "NameRef"),
    @JsonSubTypes.Type(value = Node.Literal.class, name = "Literal"),
    @JsonSubTypes.Type(value = Node.Block.class, name = "Block"),
    @JsonSubTypes.Type(value = Node.Lambda.class, name = "Lambda"),
    @JsonSubTypes.Type(value = Node.CallableRef.class, name = "CallableRef"),
    @JsonSubTypes.Type(value = Node.Unknown.class, name = "Unknown")
})
public sealed interface Node {

    /**
     * Root of one source file.
     */
    record SourceFile(
        String path,
        String packageName,
        List<Node> declarations
    ) implements Node {
        public SourceFile {
            declarations = copy(declarations);
        }
    }

    /**
     * Class-like declaration with members (class, interface, object, ...).
     */
    record StructuredDecl(
        String name,
        Form form,
        List<String> superTypes,
        List<Node> members
    ) implements Node {

        public enum Form {
            CLASS,
            INTERFACE,
            OBJECT,
            COMPANION_OBJECT,
            ENUM,
            RECORD
        }

        public StructuredDecl {
            form = form == null ? Form.CLASS : form;
            superTypes = copy(superTypes);
            members = copy(members);
        }
    }

    /**
     * Member property or local variable.
     * {@code delegate} holds the expression after {@code by}, if any.
     */
    record PropertyDecl(
        String name,
        String type,
        boolean mutable,
        Node initializer,
        Node delegate,
        List<String> annotations
    ) implements Node {
        public PropertyDecl {
            annotations = copy(annotations);
        }

        public static PropertyDecl of(String name, String type, Node initializer) {
            return new PropertyDecl(name, type, false, initializer, null, List.of());
        }
    }

    /**
     * Function declaration. A {@link Block} body is the block shape, a
     * {@link CallableRef} or missing body is the reference shape, any other
     * expression is the expression shape.
     */
    record FuncDecl(
        String name,
        List<Param> params,
        String returnType,
        Node body,
        String text
    ) implements Node {
        public FuncDecl {
            params = copy(params);
        }
    }

    record Param(String name, String type) {}

    record Call(
        String name,
        List<String> typeArguments,
        List<Argument> arguments,
        Lambda trailingLambda
    ) implements Node {
        public Call {
            typeArguments = copy(typeArguments);
            arguments = copy(arguments);
        }

        public static Call of(String name, Node... positional) {
            return new Call(name, List.of(), Argument.positional(positional), null);
        }

        public static Call withLambda(String name, Lambda lambda, Node... positional) {
            return new Call(name, List.of(), Argument.positional(positional), lambda);
        }
    }

    /**
     * Call argument; {@code name} is null for positional arguments.
     */
    record Argument(String name, Node value) {

        @JsonIgnore
        public boolean isNamed() {
            return name != null && !name.isBlank();
        }

        static List<Argument> positional(Node... values) {
            return java.util.Arrays.stream(values)
                    .map(v -> new Argument(null, v))
                    .toList();
        }
    }

    /**
     * Binary operation. Member access is modelled with the {@code .} and
     * {@code ?.} operators and assignment with {@code =}.
     */
    record BinaryOp(Node lhs, String operator, Node rhs) implements Node {}

    record NameRef(String name) implements Node {}

    record Literal(String text, LiteralKind kind) implements Node {

        public enum LiteralKind {
            STRING,
            NUMBER,
            BOOLEAN,
            CHAR,
            NULL
        }

        public static Literal string(String value) {
            return new Literal("\"" + value + "\"", LiteralKind.STRING);
        }

        public static Literal number(String text) {
            return new Literal(text, LiteralKind.NUMBER);
        }
    }

    record Block(List<Node> statements) implements Node {
        public Block {
            statements = copy(statements);
        }

        public static Block of(Node... statements) {
            return new Block(List.of(statements));
        }
    }

    record Lambda(List<String> params, Block body) implements Node {
        public Lambda {
            params = copy(params);
            body = body == null ? new Block(List.of()) : body;
        }

        public static Lambda of(Node... statements) {
            return new Lambda(List.of(), Block.of(statements));
        }
    }

    /**
     * Callable reference such as {@code ::handler} or {@code Foo::bar}.
     */
    record CallableRef(String receiver, String name) implements Node {}

    /**
     * Anything a front-end could not map; {@code tag} names the original shape.
     */
    record Unknown(String tag, String text) implements Node {}

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
