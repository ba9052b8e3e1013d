package com.qamigrate.compiler.frontend;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.ast.expr.SingleMemberAnnotationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.qamigrate.compiler.ast.AstBuilder;
import com.qamigrate.compiler.ast.AstLocation;
import com.qamigrate.compiler.ast.AstNode;
import com.qamigrate.compiler.ast.AstProperties;
import com.qamigrate.compiler.ast.PropertyValue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps a JavaParser {@link CompilationUnit} onto the canonical AST.
 *
 * <ul>
 *   <li>class, interface, enum and record declarations become {@code suite} nodes</li>
 *   <li>methods annotated {@code @Test}, {@code @ParameterizedTest} or {@code @RepeatedTest}
 *       become {@code test} nodes; other methods and constructors are {@code node}s with role
 *       {@code method}. Parameters come first, then the body's statements</li>
 *   <li>every field or local declarator becomes its own {@code field}/{@code variable} node
 *       holding its initializer</li>
 *   <li>method calls carry {@code member}, {@code qualifier} and {@code arguments}; their
 *       children are the scope followed by the arguments</li>
 * </ul>
 * Annotations, types and modifiers are not mapped as nodes.
 */
public class JavaAstAdapter implements FrontEndAdapter<CompilationUnit> {

    static final Set<String> TEST_ANNOTATIONS = Set.of("Test", "ParameterizedTest", "RepeatedTest");

    @Override
    public String language() {
        return "java";
    }

    @Override
    public AstNode adapt(CompilationUnit compilationUnit, Path sourceFile) {
        return new Conversion(new AstBuilder(), sourceFile.toString()).root(compilationUnit);
    }

    /** State of one adapt call. */
    private static final class Conversion {

        private final AstBuilder builder;
        private final String filePath;

        Conversion(AstBuilder builder, String filePath) {
            this.builder = builder;
            this.filePath = filePath;
        }

        AstNode root(CompilationUnit cu) {
            AstNode root = builder.createNode(AstProperties.TYPE_NODE, null, props(cu), null, locationOf(cu));
            for (TypeDeclaration<?> type : cu.getTypes()) {
                convertType(type, root);
            }
            return root;
        }

        // --- Declarations ---

        private void convertType(TypeDeclaration<?> type, AstNode parent) {
            Map<String, PropertyValue> props = props(type);
            String name = type.getNameAsString();
            props.put(AstProperties.NAME, PropertyValue.of(name));
            putIfPresent(props, AstProperties.TAGS, tagsOf(type));
            putIfPresent(props, AstProperties.DESCRIPTION, descriptionOf(type));

            AstNode suite = builder.createNode(AstProperties.TYPE_SUITE, name, props, parent, locationOf(type));
            if (type instanceof EnumDeclaration) {
                ((EnumDeclaration) type).getEntries().forEach(entry -> convertGeneric(entry, suite));
            }
            for (BodyDeclaration<?> member : type.getMembers()) {
                convertMember(member, suite);
            }
        }

        private void convertMember(BodyDeclaration<?> member, AstNode parent) {
            if (member instanceof FieldDeclaration) {
                for (VariableDeclarator variable : ((FieldDeclaration) member).getVariables()) {
                    convertDeclarator(AstProperties.TYPE_FIELD, "FieldDeclaration", variable, parent);
                }
            } else if (member instanceof MethodDeclaration) {
                convertMethod((MethodDeclaration) member, parent);
            } else if (member instanceof ConstructorDeclaration) {
                convertConstructor((ConstructorDeclaration) member, parent);
            } else if (member instanceof TypeDeclaration) {
                convertType((TypeDeclaration<?>) member, parent);
            } else {
                convertGeneric(member, parent);
            }
        }

        private void convertDeclarator(String type, String kind, VariableDeclarator variable, AstNode parent) {
            Map<String, PropertyValue> props = new LinkedHashMap<>();
            props.put(AstProperties.KIND, PropertyValue.of(kind));
            props.put(AstProperties.NAME, PropertyValue.of(variable.getNameAsString()));
            AstNode declaration = builder.createNode(type, variable.getNameAsString(), props, parent,
                    locationOf(variable));
            variable.getInitializer().ifPresent(init -> convert(init, declaration));
        }

        private void convertMethod(MethodDeclaration method, AstNode parent) {
            String name = method.getNameAsString();
            boolean isTest = isTest(method);

            Map<String, PropertyValue> props = props(method);
            props.put(AstProperties.NAME, PropertyValue.of(name));
            if (!isTest) {
                props.put(AstProperties.ROLE, PropertyValue.of(AstProperties.ROLE_METHOD));
            }
            putIfPresent(props, AstProperties.TAGS, tagsOf(method));
            putIfPresent(props, AstProperties.DESCRIPTION, descriptionOf(method));
            putIfPresent(props, AstProperties.DATA_SOURCE, dataSourceOf(method));

            AstNode node = builder.createNode(isTest ? AstProperties.TYPE_TEST : AstProperties.TYPE_NODE,
                    name, props, parent, locationOf(method));
            for (Parameter parameter : method.getParameters()) {
                convertParameter(parameter, node);
            }
            method.getBody().ifPresent(body -> body.getStatements().forEach(s -> convert(s, node)));
        }

        private void convertConstructor(ConstructorDeclaration constructor, AstNode parent) {
            String name = constructor.getNameAsString();
            Map<String, PropertyValue> props = props(constructor);
            props.put(AstProperties.NAME, PropertyValue.of(name));
            props.put(AstProperties.ROLE, PropertyValue.of(AstProperties.ROLE_METHOD));

            AstNode node = builder.createNode(AstProperties.TYPE_NODE, name, props, parent,
                    locationOf(constructor));
            for (Parameter parameter : constructor.getParameters()) {
                convertParameter(parameter, node);
            }
            constructor.getBody().getStatements().forEach(s -> convert(s, node));
        }

        private void convertParameter(Parameter parameter, AstNode parent) {
            Map<String, PropertyValue> props = props(parameter);
            props.put(AstProperties.NAME, PropertyValue.of(parameter.getNameAsString()));
            builder.createNode(AstProperties.TYPE_PARAMETER, parameter.getNameAsString(), props, parent,
                    locationOf(parameter));
        }

        // --- Statements and expressions ---

        private void convert(Node node, AstNode parent) {
            if (node instanceof MethodCallExpr) {
                convertCall((MethodCallExpr) node, parent);
            } else if (node instanceof NameExpr) {
                Map<String, PropertyValue> props = props(node);
                props.put(AstProperties.ROLE, PropertyValue.of(AstProperties.ROLE_REFERENCE));
                props.put(AstProperties.NAME, PropertyValue.of(((NameExpr) node).getNameAsString()));
                builder.createNode(AstProperties.TYPE_NODE, null, props, parent, locationOf(node));
            } else if (node instanceof FieldAccessExpr) {
                convertFieldAccess((FieldAccessExpr) node, parent);
            } else if (node instanceof LiteralExpr) {
                convertLiteral((LiteralExpr) node, parent);
            } else if (node instanceof VariableDeclarationExpr) {
                for (VariableDeclarator variable : ((VariableDeclarationExpr) node).getVariables()) {
                    convertDeclarator(AstProperties.TYPE_VARIABLE, "VariableDeclarationExpr", variable, parent);
                }
            } else if (node instanceof Parameter) {
                convertParameter((Parameter) node, parent);
            } else if (node instanceof TypeDeclaration) {
                convertType((TypeDeclaration<?>) node, parent);
            } else if (node instanceof BodyDeclaration) {
                convertMember((BodyDeclaration<?>) node, parent);
            } else {
                convertGeneric(node, parent);
            }
        }

        private void convertCall(MethodCallExpr call, AstNode parent) {
            Map<String, PropertyValue> props = props(call);
            props.put(AstProperties.ROLE, PropertyValue.of(AstProperties.ROLE_CALL));
            props.put(AstProperties.MEMBER, PropertyValue.of(call.getNameAsString()));
            call.getScope().map(Conversion::qualifierOf)
                    .ifPresent(q -> props.put(AstProperties.QUALIFIER, PropertyValue.of(q)));
            props.put(AstProperties.ARGUMENTS, PropertyValue.of((long) call.getArguments().size()));

            AstNode node = builder.createNode(AstProperties.TYPE_NODE, null, props, parent, locationOf(call));
            call.getScope().ifPresent(scope -> convert(scope, node));
            for (Expression argument : call.getArguments()) {
                convert(argument, node);
            }
        }

        private void convertFieldAccess(FieldAccessExpr access, AstNode parent) {
            Map<String, PropertyValue> props = props(access);
            props.put(AstProperties.ROLE, PropertyValue.of(AstProperties.ROLE_REFERENCE));
            props.put(AstProperties.NAME, PropertyValue.of(access.getNameAsString()));
            props.put(AstProperties.QUALIFIER, PropertyValue.of(access.getScope().toString()));

            AstNode node = builder.createNode(AstProperties.TYPE_NODE, null, props, parent, locationOf(access));
            convert(access.getScope(), node);
        }

        private void convertLiteral(LiteralExpr literal, AstNode parent) {
            Map<String, PropertyValue> props = props(literal);
            props.put(AstProperties.ROLE, PropertyValue.of(AstProperties.ROLE_LITERAL));
            PropertyValue value = literalValue(literal);
            if (!value.isAbsent()) {
                props.put(AstProperties.VALUE, value);
            }
            builder.createNode(AstProperties.TYPE_NODE, null, props, parent, locationOf(literal));
        }

        private void convertGeneric(Node node, AstNode parent) {
            AstNode canonical = builder.createNode(AstProperties.TYPE_NODE, null, props(node), parent,
                    locationOf(node));
            for (Node child : node.getChildNodes()) {
                if (isStructural(child)) {
                    convert(child, canonical);
                }
            }
        }

        // --- Helpers ---

        private Map<String, PropertyValue> props(Node node) {
            Map<String, PropertyValue> props = new LinkedHashMap<>();
            props.put(AstProperties.KIND, PropertyValue.of(node.getClass().getSimpleName()));
            return props;
        }

        private AstLocation locationOf(Node node) {
            return node.getRange()
                    .map(r -> new AstLocation(filePath, r.begin.line, r.begin.column, r.end.line, r.end.column))
                    .orElse(AstLocation.ofFile(filePath));
        }

        private static void putIfPresent(Map<String, PropertyValue> props, String key, String value) {
            if (value != null) {
                props.put(key, PropertyValue.of(value));
            }
        }

        // Annotations are expressions too, but only carry metadata.
        private static boolean isStructural(Node child) {
            if (child instanceof AnnotationExpr) return false;
            return child instanceof Expression
                    || child instanceof Statement
                    || child instanceof Parameter
                    || child instanceof BodyDeclaration
                    || child instanceof CatchClause
                    || child instanceof SwitchEntry;
        }

        /** {@code driver} for {@code driver.x()} and {@code this.driver.x()}; {@code null} for chained calls. */
        private static String qualifierOf(Expression scope) {
            if (scope instanceof NameExpr) {
                return ((NameExpr) scope).getNameAsString();
            }
            if (scope instanceof FieldAccessExpr) {
                FieldAccessExpr access = (FieldAccessExpr) scope;
                return access.getScope() instanceof ThisExpr ? access.getNameAsString() : access.toString();
            }
            return null;
        }

        private static PropertyValue literalValue(LiteralExpr literal) {
            if (literal instanceof StringLiteralExpr) {
                return PropertyValue.of(((StringLiteralExpr) literal).asString());
            }
            if (literal instanceof TextBlockLiteralExpr) {
                return PropertyValue.of(((TextBlockLiteralExpr) literal).asString());
            }
            if (literal instanceof CharLiteralExpr) {
                return PropertyValue.of(String.valueOf(((CharLiteralExpr) literal).asChar()));
            }
            if (literal instanceof IntegerLiteralExpr) {
                return PropertyValue.of(((IntegerLiteralExpr) literal).asNumber().longValue());
            }
            if (literal instanceof LongLiteralExpr) {
                return PropertyValue.of(((LongLiteralExpr) literal).asNumber().longValue());
            }
            if (literal instanceof DoubleLiteralExpr) {
                return PropertyValue.of(((DoubleLiteralExpr) literal).asDouble());
            }
            if (literal instanceof BooleanLiteralExpr) {
                return PropertyValue.of(((BooleanLiteralExpr) literal).getValue());
            }
            return PropertyValue.absent();   // null literal
        }
    }

    // --- Test-framework annotations ---

    static boolean isTest(NodeWithAnnotations<?> method) {
        for (AnnotationExpr annotation : method.getAnnotations()) {
            if (TEST_ANNOTATIONS.contains(simpleName(annotation))) {
                return true;
            }
        }
        return false;
    }

    /** JUnit 5 {@code @Tag}/{@code @Tags} and TestNG {@code groups}, comma-joined. */
    static String tagsOf(NodeWithAnnotations<?> node) {
        Set<String> tags = new LinkedHashSet<>();
        for (AnnotationExpr annotation : node.getAnnotations()) {
            switch (simpleName(annotation)) {
                case "Tag", "Tags" -> tags.addAll(stringValues(memberValue(annotation, "value")));
                case "Test" -> tags.addAll(stringValues(memberValue(annotation, "groups")));
                default -> { }
            }
        }
        return tags.isEmpty() ? null : String.join(",", tags);
    }

    /** {@code @DisplayName}, else TestNG {@code description}. */
    static String descriptionOf(NodeWithAnnotations<?> node) {
        String testDescription = null;
        for (AnnotationExpr annotation : node.getAnnotations()) {
            String name = simpleName(annotation);
            if (name.equals("DisplayName")) {
                List<String> values = stringValues(memberValue(annotation, "value"));
                if (!values.isEmpty()) return values.get(0);
            } else if (name.equals("Test") && testDescription == null) {
                List<String> values = stringValues(memberValue(annotation, "description"));
                testDescription = values.isEmpty() ? null : values.get(0);
            }
        }
        return testDescription;
    }

    /** TestNG {@code dataProvider} or JUnit {@code @MethodSource}; a bare {@code @MethodSource} names the test itself. */
    static String dataSourceOf(MethodDeclaration method) {
        for (AnnotationExpr annotation : method.getAnnotations()) {
            String name = simpleName(annotation);
            if (name.equals("Test")) {
                List<String> values = stringValues(memberValue(annotation, "dataProvider"));
                if (!values.isEmpty()) return values.get(0);
            } else if (name.equals("MethodSource")) {
                List<String> values = stringValues(memberValue(annotation, "value"));
                return values.isEmpty() ? method.getNameAsString() : values.get(0);
            }
        }
        return null;
    }

    private static String simpleName(AnnotationExpr annotation) {
        String name = annotation.getNameAsString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : name;
    }

    private static Expression memberValue(AnnotationExpr annotation, String key) {
        if (annotation instanceof SingleMemberAnnotationExpr) {
            return key.equals("value") ? ((SingleMemberAnnotationExpr) annotation).getMemberValue() : null;
        }
        if (annotation instanceof NormalAnnotationExpr) {
            for (MemberValuePair pair : ((NormalAnnotationExpr) annotation).getPairs()) {
                if (pair.getNameAsString().equals(key)) {
                    return pair.getValue();
                }
            }
        }
        return null;
    }

    private static List<String> stringValues(Expression expression) {
        List<String> values = new ArrayList<>();
        if (expression == null) {
            return values;
        }
        if (expression instanceof StringLiteralExpr) {
            values.add(((StringLiteralExpr) expression).asString());
        } else if (expression instanceof ArrayInitializerExpr) {
            for (Expression item : ((ArrayInitializerExpr) expression).getValues()) {
                values.addAll(stringValues(item));
            }
        } else if (expression instanceof AnnotationExpr) {
            values.addAll(stringValues(memberValue((AnnotationExpr) expression, "value")));
        } else {
            values.add(expression.toString());
        }
        return values;
    }
}
