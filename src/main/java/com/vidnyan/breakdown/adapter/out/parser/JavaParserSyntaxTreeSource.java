package com.vidnyan.breakdown.adapter.out.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.ArrayCreationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.vidnyan.breakdown.BreakdownProperties;
import com.vidnyan.breakdown.application.port.out.SyntaxTreeSource;
import com.vidnyan.breakdown.domain.breakdown.BreakdownContext;
import com.vidnyan.breakdown.domain.exception.DepthExceededException;
import com.vidnyan.breakdown.domain.exception.ParseInputException;
import com.vidnyan.breakdown.domain.node.Node;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Java front-end: parses {@code .java} files with JavaParser and lowers the
 * compilation unit into the {@link Node} vocabulary.
 *
 * Purely syntactic, no symbol resolution. Member access and assignment are
 * lowered to {@link Node.BinaryOp}, constructor calls to {@link Node.Call}
 * named after the created type, and statements without a counterpart to
 * {@link Node.Unknown} carrying their source text. Lowering shares the
 * engine's recursion ceiling.
 */
@Slf4j
@Component
public class JavaParserSyntaxTreeSource implements SyntaxTreeSource {

    private static final String CONSTRUCTOR = "<init>";

    private final int maxDepth;

    public JavaParserSyntaxTreeSource() {
        this.maxDepth = BreakdownContext.DEFAULT_MAX_DEPTH;
    }

    @Autowired
    public JavaParserSyntaxTreeSource(BreakdownProperties properties) {
        this.maxDepth = properties.getMaxDepth();
    }

    @Override
    public boolean supports(Path file) {
        return file.getFileName() != null && file.getFileName().toString().endsWith(".java");
    }

    @Override
    public Node.SourceFile read(Path file) {
        String source;
        try {
            source = Files.readString(file);
        } catch (IOException e) {
            throw new ParseInputException("Cannot read " + file, e);
        }
        return parse(normalize(file), source);
    }

    /**
     * Parse Java source text that is not backed by a file.
     * @throws ParseInputException when JavaParser reports problems
     * @throws DepthExceededException when lowering nests past the recursion ceiling
     */
    public Node.SourceFile parse(String path, String source) {
        // JavaParser instances are not thread-safe; one per call
        JavaParser parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        ParseResult<CompilationUnit> result = parser.parse(source);

        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .map(p -> p.getMessage())
                    .collect(Collectors.joining("; "));
            throw new ParseInputException("Parse failed for " + path + ": " + problems);
        }

        CompilationUnit cu = result.getResult().get();
        String packageName = cu.getPackageDeclaration()
                .map(pd -> pd.getNameAsString())
                .orElse("");

        Lowering lowering = new Lowering(path);
        List<Node> declarations = new ArrayList<>();
        for (TypeDeclaration<?> td : cu.getTypes()) {
            declarations.add(lowering.lowerType(td));
        }
        log.debug("Parsed {}: {} top-level types", path, declarations.size());
        return new Node.SourceFile(path, packageName, declarations);
    }

    private static String normalize(Path file) {
        return file.toString().replace('\\', '/');
    }

    // ---- declarations ----

    /**
     * Lowering state of one parse, bounded by the recursion ceiling.
     * The adapter is a shared singleton, so the counter lives here.
     */
    private final class Lowering {

        private final String path;
        private int depth;

        Lowering(String path) {
            this.path = path;
        }

        private <T> T descend(Supplier<T> step) {
            if (depth >= maxDepth) {
                throw new DepthExceededException(maxDepth, path + " (lowering)");
            }
            depth++;
            try {
                return step.get();
            } finally {
                depth--;
            }
        }

        Node lowerType(TypeDeclaration<?> td) {
            return descend(() -> lowerTypeDeclaration(td));
        }

        private Node lowerTypeDeclaration(TypeDeclaration<?> td) {
            Node.StructuredDecl.Form form;
            List<String> superTypes = new ArrayList<>();

            if (td instanceof ClassOrInterfaceDeclaration cid) {
                form = cid.isInterface() ? Node.StructuredDecl.Form.INTERFACE : Node.StructuredDecl.Form.CLASS;
                cid.getExtendedTypes().forEach(t -> superTypes.add(t.getNameAsString()));
                cid.getImplementedTypes().forEach(t -> superTypes.add(t.getNameAsString()));
            } else if (td instanceof EnumDeclaration ed) {
                form = Node.StructuredDecl.Form.ENUM;
                ed.getImplementedTypes().forEach(t -> superTypes.add(t.getNameAsString()));
            } else if (td instanceof RecordDeclaration rd) {
                form = Node.StructuredDecl.Form.RECORD;
                rd.getImplementedTypes().forEach(t -> superTypes.add(t.getNameAsString()));
            } else {
                return new Node.Unknown(td.getClass().getSimpleName(), td.getNameAsString());
            }

            List<Node> members = new ArrayList<>();
            for (BodyDeclaration<?> member : td.getMembers()) {
                lowerMember(member, members);
            }
            return new Node.StructuredDecl(td.getNameAsString(), form, superTypes, members);
        }

        private void lowerMember(BodyDeclaration<?> member, List<Node> members) {
            if (member instanceof FieldDeclaration field) {
                List<String> annotations = field.getAnnotations().stream()
                        .map(AnnotationExpr::getNameAsString)
                        .toList();
                for (VariableDeclarator variable : field.getVariables()) {
                    members.add(new Node.PropertyDecl(
                            variable.getNameAsString(),
                            variable.getType().asString(),
                            !field.isFinal(),
                            variable.getInitializer().map(this::lowerExpression).orElse(null),
                            null,
                            annotations));
                }
            } else if (member instanceof MethodDeclaration method) {
                members.add(new Node.FuncDecl(
                        method.getNameAsString(),
                        params(method.getParameters()),
                        method.getType().asString(),
                        method.getBody().map(this::lowerBlock).orElse(null),
                        method.getDeclarationAsString(false, false, true)));
            } else if (member instanceof ConstructorDeclaration ctor) {
                members.add(new Node.FuncDecl(
                        CONSTRUCTOR,
                        params(ctor.getParameters()),
                        null,
                        lowerBlock(ctor.getBody()),
                        ctor.getDeclarationAsString(false, false, true)));
            } else if (member instanceof TypeDeclaration<?> nested) {
                members.add(lowerType(nested));
            } else {
                members.add(new Node.Unknown(member.getClass().getSimpleName(), member.toString()));
            }
        }

        // ---- statements ----

        Node.Block lowerBlock(BlockStmt block) {
            return descend(() -> {
                List<Node> statements = new ArrayList<>();
                for (Statement statement : block.getStatements()) {
                    lowerStatement(statement, statements);
                }
                return new Node.Block(statements);
            });
        }

        private void lowerStatement(Statement statement, List<Node> out) {
            descend(() -> {
                lowerStatementNode(statement, out);
                return null;
            });
        }

        /**
         * Control-flow statements become a {@link Node.Block} of their header
         * expressions followed by their bodies, so nested calls stay reachable.
         */
        private void lowerStatementNode(Statement statement, List<Node> out) {
            if (statement instanceof ExpressionStmt es) {
                lowerExpressionStatement(es.getExpression(), out);
            } else if (statement instanceof BlockStmt block) {
                out.add(lowerBlock(block));
            } else if (statement instanceof ReturnStmt ret && ret.getExpression().isPresent()) {
                out.add(lowerExpression(ret.getExpression().get()));
            } else if (statement instanceof IfStmt ifStmt) {
                List<Node> parts = new ArrayList<>();
                parts.add(lowerExpression(ifStmt.getCondition()));
                parts.add(lowerBranch(ifStmt.getThenStmt()));
                ifStmt.getElseStmt().ifPresent(e -> parts.add(lowerBranch(e)));
                out.add(new Node.Block(parts));
            } else if (statement instanceof ForStmt forStmt) {
                List<Node> parts = new ArrayList<>();
                forStmt.getInitialization().forEach(e -> lowerExpressionStatement(e, parts));
                forStmt.getCompare().ifPresent(e -> parts.add(lowerExpression(e)));
                forStmt.getUpdate().forEach(e -> parts.add(lowerExpression(e)));
                parts.add(lowerBranch(forStmt.getBody()));
                out.add(new Node.Block(parts));
            } else if (statement instanceof ForEachStmt forEach) {
                out.add(new Node.Block(List.of(
                        lowerExpression(forEach.getIterable()),
                        lowerBranch(forEach.getBody()))));
            } else if (statement instanceof WhileStmt whileStmt) {
                out.add(new Node.Block(List.of(
                        lowerExpression(whileStmt.getCondition()),
                        lowerBranch(whileStmt.getBody()))));
            } else if (statement instanceof DoStmt doStmt) {
                out.add(new Node.Block(List.of(
                        lowerBranch(doStmt.getBody()),
                        lowerExpression(doStmt.getCondition()))));
            } else if (statement instanceof TryStmt tryStmt) {
                List<Node> parts = new ArrayList<>();
                tryStmt.getResources().forEach(e -> lowerExpressionStatement(e, parts));
                parts.add(lowerBlock(tryStmt.getTryBlock()));
                for (CatchClause clause : tryStmt.getCatchClauses()) {
                    parts.add(lowerBlock(clause.getBody()));
                }
                tryStmt.getFinallyBlock().ifPresent(f -> parts.add(lowerBlock(f)));
                out.add(new Node.Block(parts));
            } else if (statement instanceof SwitchStmt switchStmt) {
                List<Node> parts = new ArrayList<>();
                parts.add(lowerExpression(switchStmt.getSelector()));
                for (SwitchEntry entry : switchStmt.getEntries()) {
                    List<Node> body = new ArrayList<>();
                    entry.getStatements().forEach(s -> lowerStatement(s, body));
                    parts.add(new Node.Block(body));
                }
                out.add(new Node.Block(parts));
            } else if (statement instanceof SynchronizedStmt sync) {
                out.add(new Node.Block(List.of(
                        lowerExpression(sync.getExpression()),
                        lowerBlock(sync.getBody()))));
            } else if (statement instanceof LabeledStmt labeled) {
                lowerStatement(labeled.getStatement(), out);
            } else {
                out.add(new Node.Unknown(statement.getClass().getSimpleName(), statement.toString().trim()));
            }
        }

        private Node.Block lowerBranch(Statement statement) {
            if (statement instanceof BlockStmt block) {
                return lowerBlock(block);
            }
            List<Node> single = new ArrayList<>();
            lowerStatement(statement, single);
            return new Node.Block(single);
        }

        /**
         * Local variable declarations yield one declaration per variable.
         */
        private void lowerExpressionStatement(Expression expression, List<Node> out) {
            if (expression instanceof VariableDeclarationExpr vde) {
                boolean mutable = !vde.isFinal();
                for (VariableDeclarator variable : vde.getVariables()) {
                    out.add(new Node.PropertyDecl(
                            variable.getNameAsString(),
                            variable.getType().isVarType() ? null : variable.getType().asString(),
                            mutable,
                            variable.getInitializer().map(this::lowerExpression).orElse(null),
                            null,
                            List.of()));
                }
            } else {
                out.add(lowerExpression(expression));
            }
        }

        // ---- expressions ----

        Node lowerExpression(Expression expr) {
            return descend(() -> lowerExpressionNode(expr));
        }

        private Node lowerExpressionNode(Expression expr) {
            if (expr instanceof MethodCallExpr call) {
                Node.Call lowered = new Node.Call(
                        call.getNameAsString(),
                        call.getTypeArguments().map(JavaParserSyntaxTreeSource::typeNames).orElse(List.of()),
                        arguments(call.getArguments()),
                        null);
                return call.getScope()
                        .<Node>map(scope -> new Node.BinaryOp(lowerExpression(scope), ".", lowered))
                        .orElse(lowered);
            }
            if (expr instanceof ObjectCreationExpr creation) {
                ClassOrInterfaceType type = creation.getType();
                return new Node.Call(
                        type.getNameAsString(),
                        type.getTypeArguments().map(JavaParserSyntaxTreeSource::typeNames).orElse(List.of()),
                        arguments(creation.getArguments()),
                        null);
            }
            if (expr instanceof AssignExpr assign) {
                return new Node.BinaryOp(
                        lowerExpression(assign.getTarget()),
                        assign.getOperator().asString(),
                        lowerExpression(assign.getValue()));
            }
            if (expr instanceof BinaryExpr binary) {
                return new Node.BinaryOp(
                        lowerExpression(binary.getLeft()),
                        binary.getOperator().asString(),
                        lowerExpression(binary.getRight()));
            }
            if (expr instanceof FieldAccessExpr access) {
                return new Node.BinaryOp(
                        lowerExpression(access.getScope()),
                        ".",
                        new Node.NameRef(access.getNameAsString()));
            }
            if (expr instanceof NameExpr name) {
                return new Node.NameRef(name.getNameAsString());
            }
            if (expr instanceof ThisExpr) {
                return new Node.NameRef("this");
            }
            if (expr instanceof StringLiteralExpr || expr instanceof TextBlockLiteralExpr) {
                return new Node.Literal(expr.toString(), Node.Literal.LiteralKind.STRING);
            }
            if (expr instanceof IntegerLiteralExpr
                    || expr instanceof LongLiteralExpr
                    || expr instanceof DoubleLiteralExpr) {
                return new Node.Literal(expr.toString(), Node.Literal.LiteralKind.NUMBER);
            }
            if (expr instanceof BooleanLiteralExpr) {
                return new Node.Literal(expr.toString(), Node.Literal.LiteralKind.BOOLEAN);
            }
            if (expr instanceof CharLiteralExpr) {
                return new Node.Literal(expr.toString(), Node.Literal.LiteralKind.CHAR);
            }
            if (expr instanceof NullLiteralExpr) {
                return new Node.Literal("null", Node.Literal.LiteralKind.NULL);
            }
            if (expr instanceof LambdaExpr lambda) {
                return lowerLambda(lambda);
            }
            if (expr instanceof MethodReferenceExpr ref) {
                return new Node.CallableRef(ref.getScope().toString(), ref.getIdentifier());
            }
            if (expr instanceof EnclosedExpr enclosed) {
                return lowerExpression(enclosed.getInner());
            }
            if (expr instanceof CastExpr cast) {
                return lowerExpression(cast.getExpression());
            }
            if (expr instanceof ArrayInitializerExpr init) {
                return arrayOf(init);
            }
            if (expr instanceof ArrayCreationExpr creation && creation.getInitializer().isPresent()) {
                return arrayOf(creation.getInitializer().get());
            }
            return new Node.Unknown(expr.getClass().getSimpleName(), expr.toString());
        }

        private Node.Lambda lowerLambda(LambdaExpr lambda) {
            List<String> params = lambda.getParameters().stream()
                    .map(p -> p.getNameAsString())
                    .toList();
            Node.Block body = lambda.getExpressionBody()
                    .map(e -> Node.Block.of(lowerExpression(e)))
                    .orElseGet(() -> lambda.getBody() instanceof BlockStmt block
                            ? lowerBlock(block)
                            : new Node.Block(List.of()));
            return new Node.Lambda(params, body);
        }

        private Node.Call arrayOf(ArrayInitializerExpr init) {
            return new Node.Call("arrayOf", List.of(), arguments(init.getValues()), null);
        }

        private List<Node.Argument> arguments(NodeList<Expression> arguments) {
            return arguments.stream()
                    .map(a -> new Node.Argument(null, lowerExpression(a)))
                    .toList();
        }
    }

    private static List<Node.Param> params(NodeList<com.github.javaparser.ast.body.Parameter> parameters) {
        return parameters.stream()
                .map(p -> new Node.Param(p.getNameAsString(), p.getType().asString()))
                .toList();
    }

    private static List<String> typeNames(NodeList<Type> types) {
        return types.stream().map(Type::asString).toList();
    }
}
