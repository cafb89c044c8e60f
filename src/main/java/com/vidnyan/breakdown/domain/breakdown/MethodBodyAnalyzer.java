package com.vidnyan.breakdown.domain.breakdown;

import com.vidnyan.breakdown.domain.exception.ParseInputException;
import com.vidnyan.breakdown.domain.model.Method;
import com.vidnyan.breakdown.domain.model.StatementRecord;
import com.vidnyan.breakdown.domain.model.StatementRecord.StatementKind;
import com.vidnyan.breakdown.domain.node.Node;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reconstructs method bodies as ordered {@link StatementRecord}s.
 *
 * Recursive descent over the body: declarations become assignment records,
 * binary operations are rendered left/operator/right, calls render their
 * target and every argument (innermost calls first), and trailing lambdas
 * are analysed as nested statement sequences folded into the call summary.
 * Unrecognised shapes degrade to {@link StatementKind#UNCLASSIFIED}.
 *
 * Stateless; all per-file state lives in the {@link BreakdownContext}.
 */
@Slf4j
public class MethodBodyAnalyzer {

    private static final Set<String> MEMBER_ACCESS = Set.of(".", "?.", "!!.");
    private static final String MISSING = "<missing>";

    /**
     * Break a function declaration down into a {@link Method}.
     * @throws ParseInputException when the declaration has no name
     */
    public Method analyze(Node.FuncDecl func, BreakdownContext context) {
        if (func.name() == null || func.name().isBlank()) {
            throw new ParseInputException("Function declaration without a name in " + context.currentClass());
        }
        Method.Shape shape = shapeOf(func.body());
        List<Method.Parameter> parameters = func.params().stream()
                .map(p -> new Method.Parameter(
                        p.name() == null ? "_" : p.name(),
                        p.type() == null || p.type().isBlank() ? "Any" : p.type()))
                .toList();

        String returnType = func.returnType();
        if (returnType == null || returnType.isBlank()) {
            returnType = shape == Method.Shape.EXPRESSION ? Method.EXPRESSION : Method.UNIT;
        }

        List<StatementRecord> statements = analyzeBody(func.body(), context);
        log.debug("Method {}.{}: {} shape, {} statements",
                context.currentClass(), func.name(), shape, statements.size());
        return new Method(func.name(), parameters, returnType, shape, statements);
    }

    /**
     * Classify a body: block, expression, or reference (no body).
     */
    public static Method.Shape shapeOf(Node body) {
        if (body == null || body instanceof Node.CallableRef) {
            return Method.Shape.REFERENCE;
        }
        if (body instanceof Node.Block) {
            return Method.Shape.BLOCK;
        }
        return Method.Shape.EXPRESSION;
    }

    /**
     * Ordered statement records for a body, in source order.
     */
    public List<StatementRecord> analyzeBody(Node body, BreakdownContext context) {
        List<StatementRecord> statements = new ArrayList<>();
        switch (shapeOf(body)) {
            case BLOCK -> {
                for (Node statement : ((Node.Block) body).statements()) {
                    statements.add(analyzeStatement(statement, context));
                }
            }
            case EXPRESSION -> statements.add(analyzeStatement(body, context));
            case REFERENCE -> {
                // no statements
            }
        }
        return statements;
    }

    /**
     * Analyse one statement. Declaration position wins: a property whose
     * initializer is a call is still a declaration.
     */
    public StatementRecord analyzeStatement(Node statement, BreakdownContext context) {
        return new StatementRecord(kindOf(statement), render(statement, context));
    }

    static StatementKind kindOf(Node statement) {
        if (statement instanceof Node.PropertyDecl) {
            return StatementKind.DECLARATION;
        }
        if (statement instanceof Node.BinaryOp) {
            return StatementKind.BINARY_OPERATION;
        }
        if (statement instanceof Node.Call) {
            return StatementKind.CALL;
        }
        if (statement instanceof Node.Literal
                || statement instanceof Node.NameRef
                || statement instanceof Node.Lambda) {
            return StatementKind.LITERAL;
        }
        return StatementKind.UNCLASSIFIED;
    }

    /**
     * Render any node to its summary string. Never fails on unknown shapes;
     * only the depth ceiling aborts.
     */
    public String render(Node node, BreakdownContext context) {
        return context.descend(() -> renderNode(node, context));
    }

    private String renderNode(Node node, BreakdownContext context) {
        if (node == null) {
            context.recordUnclassified();
            return MISSING;
        }
        if (node instanceof Node.Literal literal) {
            return literal.text() == null ? "null" : literal.text();
        }
        if (node instanceof Node.NameRef name) {
            return name.name() == null ? MISSING : name.name();
        }
        if (node instanceof Node.BinaryOp op) {
            return renderBinaryOperation(op, context);
        }
        if (node instanceof Node.Call call) {
            return renderCall(call, context);
        }
        if (node instanceof Node.Lambda lambda) {
            return renderLambda(lambda, context);
        }
        if (node instanceof Node.Block block) {
            return renderStatements(block.statements(), context);
        }
        if (node instanceof Node.PropertyDecl decl) {
            return renderDeclaration(decl, context);
        }
        if (node instanceof Node.CallableRef ref) {
            return (ref.receiver() == null ? "" : ref.receiver()) + "::" + ref.name();
        }
        if (node instanceof Node.FuncDecl func) {
            context.recordUnclassified();
            return renderSignature(func);
        }
        if (node instanceof Node.StructuredDecl decl) {
            context.recordUnclassified();
            return decl.form().name().toLowerCase(Locale.ROOT) + " " + decl.name();
        }
        if (node instanceof Node.Unknown unknown) {
            context.recordUnclassified();
            log.trace("Unrecognised shape {} in {}", unknown.tag(), context.currentClass());
            return unknown.text() != null && !unknown.text().isBlank()
                    ? unknown.text()
                    : "<unknown:" + unknown.tag() + ">";
        }
        context.recordUnclassified();
        return "<unknown:" + node.getClass().getSimpleName() + ">";
    }

    /**
     * Local declaration as a normalized assignment: {@code name = value}.
     */
    private String renderDeclaration(Node.PropertyDecl decl, BreakdownContext context) {
        String name = decl.name() == null ? MISSING : decl.name();
        if (decl.initializer() != null) {
            return name + " = " + render(decl.initializer(), context);
        }
        if (decl.delegate() != null) {
            return name + " by " + render(decl.delegate(), context);
        }
        return decl.type() == null ? name : name + ": " + decl.type();
    }

    private String renderBinaryOperation(Node.BinaryOp op, BreakdownContext context) {
        String lhs = render(op.lhs(), context);
        String rhs = render(op.rhs(), context);
        String operator = op.operator() == null ? "?" : op.operator();
        if (MEMBER_ACCESS.contains(operator)) {
            return lhs + operator + rhs;
        }
        return lhs + " " + operator + " " + rhs;
    }

    private String renderCall(Node.Call call, BreakdownContext context) {
        StringBuilder sb = new StringBuilder(call.name() == null ? MISSING : call.name());
        if (!call.typeArguments().isEmpty()) {
            sb.append('<').append(String.join(", ", call.typeArguments())).append('>');
        }
        if (!call.arguments().isEmpty() || call.trailingLambda() == null) {
            sb.append('(').append(renderArguments(call.arguments(), context)).append(')');
        }
        if (call.trailingLambda() != null) {
            sb.append(' ').append(render(call.trailingLambda(), context));
        }
        return sb.toString();
    }

    private String renderArguments(List<Node.Argument> arguments, BreakdownContext context) {
        return arguments.stream()
                .map(arg -> arg.isNamed()
                        ? arg.name() + " = " + render(arg.value(), context)
                        : render(arg.value(), context))
                .collect(Collectors.joining(", "));
    }

    private String renderLambda(Node.Lambda lambda, BreakdownContext context) {
        if (lambda.params().isEmpty()) {
            return renderStatements(lambda.body().statements(), context);
        }
        String params = String.join(", ", lambda.params());
        if (lambda.body().statements().isEmpty()) {
            return "{ " + params + " -> }";
        }
        return "{ " + params + " -> " + joinStatements(lambda.body().statements(), context) + " }";
    }

    private String renderStatements(List<Node> statements, BreakdownContext context) {
        if (statements.isEmpty()) {
            return "{ }";
        }
        return "{ " + joinStatements(statements, context) + " }";
    }

    private String joinStatements(List<Node> statements, BreakdownContext context) {
        return statements.stream()
                .map(s -> analyzeStatement(s, context).summary())
                .collect(Collectors.joining("; "));
    }

    /**
     * Signature text for a function when the front-end supplied no source text.
     */
    public static String renderSignature(Node.FuncDecl func) {
        String params = func.params().stream()
                .map(p -> p.type() == null ? p.name() : p.name() + ": " + p.type())
                .collect(Collectors.joining(", "));
        String signature = "fun " + func.name() + "(" + params + ")";
        return func.returnType() == null ? signature : signature + ": " + func.returnType();
    }
}
