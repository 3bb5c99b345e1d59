package com.raditha.smells.extraction;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LiteralStringValueExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.raditha.smells.detection.TokenNormalizer;
import com.raditha.smells.model.ClassDef;
import com.raditha.smells.model.FunctionDef;
import com.raditha.smells.model.LiteralOccurrence;
import com.raditha.smells.model.ParameterDef;
import com.raditha.smells.model.SourceUnit;
import com.raditha.smells.model.Statement;
import com.raditha.smells.util.ASTUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses Java source text and extracts the structural model the detectors read.
 * <p>
 * The builder is stateless between calls; every call produces a fresh, fully
 * built {@link SourceUnit}.
 */
public class SourceModelBuilder {

    private static final Logger logger = LoggerFactory.getLogger(SourceModelBuilder.class);

    private static final Path UNNAMED_SOURCE = Path.of("Unnamed.java");
    private static final Pattern CONSTANT_NAME = Pattern.compile("[A-Z][A-Z0-9_]*");

    private final JavaParser parser;
    private final TokenNormalizer normalizer;

    public SourceModelBuilder() {
        this.parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        this.normalizer = new TokenNormalizer();
    }

    /**
     * Build the model of in-memory source text.
     */
    public SourceUnit build(String source) throws SourceParseException {
        return build(source, UNNAMED_SOURCE);
    }

    /**
     * Build the model of one compilation unit.
     *
     * @param source     Complete source text
     * @param sourceFile Path reported in findings
     * @return Immutable structural model
     * @throws SourceParseException if the text is not valid Java
     */
    public SourceUnit build(String source, Path sourceFile) throws SourceParseException {
        CompilationUnit cu = parse(source);

        Map<Node, ClassDef> classesByNode = new IdentityHashMap<>();
        Map<ClassDef, List<FunctionDef>> methodLists = new IdentityHashMap<>();
        List<ClassDef> classes = new ArrayList<>();
        cu.walk(node -> {
            ClassDef classDef = toClassDef(node, methodLists);
            if (classDef != null) {
                classesByNode.put(node, classDef);
                classes.add(classDef);
            } else if (node instanceof EnumConstantDeclaration constant && !constant.getClassBody().isEmpty()) {
                // constant bodies belong to the enum, which the pre-order walk has already seen
                constant.getParentNode().map(classesByNode::get)
                        .ifPresent(enumClass -> classesByNode.put(constant, enumClass));
            }
        });

        Map<Node, FunctionDef> functionsByNode = new IdentityHashMap<>();
        List<FunctionDef> functions = new ArrayList<>();
        for (CallableDeclaration<?> callable : findCallables(cu)) {
            ClassDef owner = callable.getParentNode().map(classesByNode::get).orElse(null);
            FunctionDef function = toFunctionDef(callable, owner);
            functionsByNode.put(callable, function);
            functions.add(function);
            if (owner != null) {
                methodLists.get(owner).add(function);
            }
        }

        List<LiteralOccurrence> literals = collectLiterals(cu, functionsByNode);

        SourceUnit unit = new SourceUnit(sourceFile, (int) source.lines().count(), classes, functions, literals);
        logger.debug("Built model for {}: {} classes, {} functions, {} numeric literals",
                unit.getFileName(), classes.size(), functions.size(), literals.size());
        return unit;
    }

    private CompilationUnit parse(String source) throws SourceParseException {
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }
        if (result.getProblems().isEmpty()) {
            throw new SourceParseException("Source could not be parsed", 0, 0);
        }
        Problem problem = result.getProblems().get(0);
        int line = 0;
        int column = 0;
        var begin = problem.getLocation().flatMap(location -> location.getBegin().getRange());
        if (begin.isPresent()) {
            line = begin.get().begin.line;
            column = begin.get().begin.column;
        }
        throw new SourceParseException(problem.getMessage(), line, column);
    }

    /**
     * Create the class model for type declarations and anonymous class bodies;
     * null for every other node.
     */
    private ClassDef toClassDef(Node node, Map<ClassDef, List<FunctionDef>> methodLists) {
        String name;
        List<BodyDeclaration<?>> members;
        Set<String> fields = new LinkedHashSet<>();

        if (node instanceof TypeDeclaration<?> type && !(node instanceof AnnotationDeclaration)) {
            name = type.getNameAsString();
            members = new ArrayList<>(type.getMembers());
            if (type instanceof RecordDeclaration record) {
                record.getParameters().forEach(p -> fields.add(p.getNameAsString()));
            }
            if (type instanceof EnumDeclaration enumDeclaration) {
                for (EnumConstantDeclaration entry : enumDeclaration.getEntries()) {
                    members.addAll(entry.getClassBody());
                }
            }
        } else if (node instanceof ObjectCreationExpr creation && creation.getAnonymousClassBody().isPresent()) {
            name = "anonymous " + creation.getType().getNameAsString();
            members = new ArrayList<>(creation.getAnonymousClassBody().get());
        } else {
            return null;
        }

        for (BodyDeclaration<?> member : members) {
            if (member instanceof FieldDeclaration field) {
                field.getVariables().forEach(v -> fields.add(v.getNameAsString()));
            }
        }
        for (BodyDeclaration<?> member : members) {
            if (member instanceof ConstructorDeclaration constructor) {
                fields.addAll(assignedReceiverFields(constructor));
            }
        }

        List<FunctionDef> methods = new ArrayList<>();
        ClassDef classDef = new ClassDef(name, ASTUtility.rangeOf(node), new ArrayList<>(fields), methods);
        methodLists.put(classDef, methods);
        return classDef;
    }

    /**
     * Names assigned through {@code this.name = ...} in a constructor.
     */
    private List<String> assignedReceiverFields(ConstructorDeclaration constructor) {
        List<String> names = new ArrayList<>();
        for (AssignExpr assign : constructor.getBody().findAll(AssignExpr.class)) {
            if (assign.getTarget() instanceof FieldAccessExpr target && target.getScope() instanceof ThisExpr) {
                names.add(target.getNameAsString());
            }
        }
        return names;
    }

    /**
     * Methods and constructors in source order.
     */
    private List<CallableDeclaration<?>> findCallables(CompilationUnit cu) {
        List<CallableDeclaration<?>> callables = new ArrayList<>();
        callables.addAll(cu.findAll(MethodDeclaration.class));
        callables.addAll(cu.findAll(ConstructorDeclaration.class));
        callables.sort(Comparator.comparing((CallableDeclaration<?> callable) -> callable.getBegin().orElseThrow()));
        return callables;
    }

    private FunctionDef toFunctionDef(CallableDeclaration<?> callable, ClassDef owner) {
        List<ParameterDef> parameters = new ArrayList<>();
        callable.getReceiverParameter().ifPresent(receiver ->
                parameters.add(new ParameterDef("this", 0, true)));
        for (Parameter parameter : callable.getParameters()) {
            parameters.add(new ParameterDef(parameter.getNameAsString(), parameters.size(), false));
        }

        BlockStmt body = bodyOf(callable);
        Set<String> localNames = new LinkedHashSet<>();
        callable.getParameters().forEach(p -> localNames.add(p.getNameAsString()));
        if (body != null) {
            body.findAll(VariableDeclarator.class).forEach(v -> localNames.add(v.getNameAsString()));
            body.findAll(Parameter.class).forEach(p -> localNames.add(p.getNameAsString()));
        }

        Set<String> receiverFields = owner != null ? new LinkedHashSet<>(owner.fields()) : Set.of();
        StatementConverter converter = new StatementConverter(normalizer,
                new AccessClassifier(receiverFields, localNames));
        List<Statement> statements = body != null ? converter.convertAll(body.getStatements()) : List.of();

        return new FunctionDef(
                callable.getNameAsString(),
                ASTUtility.rangeOf(callable),
                parameters,
                statements,
                owner,
                callable instanceof ConstructorDeclaration);
    }

    private static BlockStmt bodyOf(CallableDeclaration<?> callable) {
        if (callable instanceof MethodDeclaration method) {
            return method.getBody().orElse(null);
        }
        if (callable instanceof ConstructorDeclaration constructor) {
            return constructor.getBody();
        }
        return null;
    }

    private List<LiteralOccurrence> collectLiterals(CompilationUnit cu, Map<Node, FunctionDef> functionsByNode) {
        List<LiteralOccurrence> literals = new ArrayList<>();
        cu.walk(node -> {
            if (!(node instanceof IntegerLiteralExpr
                    || node instanceof LongLiteralExpr
                    || node instanceof DoubleLiteralExpr)) {
                return;
            }
            LiteralStringValueExpr literal = (LiteralStringValueExpr) node;
            if (isInAnnotation(literal) || isInConstantDefinition(literal)) {
                return;
            }

            double value = numericValue(literal);
            String text = literal.getValue();
            Node located = literal;
            if (literal.getParentNode().orElse(null) instanceof UnaryExpr unary
                    && unary.getOperator() == UnaryExpr.Operator.MINUS) {
                value = -value;
                text = "-" + text;
                located = unary;
            }

            FunctionDef enclosing = enclosingFunction(literal, functionsByNode);
            literals.add(new LiteralOccurrence(value, text, ASTUtility.lineOf(located), enclosing));
        });
        return literals;
    }

    private static FunctionDef enclosingFunction(Node node, Map<Node, FunctionDef> functionsByNode) {
        Node current = node.getParentNode().orElse(null);
        while (current != null) {
            FunctionDef function = functionsByNode.get(current);
            if (function != null) {
                return function;
            }
            current = current.getParentNode().orElse(null);
        }
        return null;
    }

    private static double numericValue(LiteralStringValueExpr literal) {
        if (literal instanceof IntegerLiteralExpr integer) {
            return integer.asNumber().doubleValue();
        }
        if (literal instanceof LongLiteralExpr longLiteral) {
            return longLiteral.asNumber().doubleValue();
        }
        return ((DoubleLiteralExpr) literal).asDouble();
    }

    private static boolean isInAnnotation(Node node) {
        return node.findAncestor(AnnotationExpr.class).isPresent();
    }

    /**
     * Literals that initialize a named constant: a static final field, or any
     * variable named in UPPER_SNAKE_CASE. Only the innermost function or lambda
     * is searched, so code inside an anonymous class or lambda stored in a
     * constant still counts.
     */
    private static boolean isInConstantDefinition(Node node) {
        Optional<VariableDeclarator> declarator = enclosingDeclarator(node);
        if (declarator.isEmpty()) {
            return false;
        }
        if (CONSTANT_NAME.matcher(declarator.get().getNameAsString()).matches()) {
            return true;
        }
        return declarator.get().getParentNode()
                .filter(FieldDeclaration.class::isInstance)
                .map(FieldDeclaration.class::cast)
                .map(field -> field.hasModifier(Modifier.Keyword.STATIC) && field.hasModifier(Modifier.Keyword.FINAL))
                .orElse(false);
    }

    private static Optional<VariableDeclarator> enclosingDeclarator(Node node) {
        Node current = node.getParentNode().orElse(null);
        while (current != null && !(current instanceof CallableDeclaration<?>) && !(current instanceof LambdaExpr)) {
            if (current instanceof VariableDeclarator declarator) {
                return Optional.of(declarator);
            }
            current = current.getParentNode().orElse(null);
        }
        return Optional.empty();
    }
}
