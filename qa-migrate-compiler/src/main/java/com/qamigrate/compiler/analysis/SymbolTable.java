package com.qamigrate.compiler.analysis;

import com.qamigrate.compiler.ast.AstNode;
import com.qamigrate.compiler.ast.AstProperties;
import com.qamigrate.compiler.ast.AstTree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-file cross-reference table mapping names to the locator nodes that define them.
 *
 * Pass 1 records field, variable and parameter declarations whose initializer contains a
 * locator constructor ({@code By.<strategy>(...)}), plus the locator fields of each class.
 * Pass 2 infers target names from method names through {@link MethodTargetRule}s: declared
 * methods and tests, plus calls on a receiver that is not itself a recorded symbol.
 * Build a new instance for every tree.
 */
public class SymbolTable {

    private static final Set<String> DECLARATION_TYPES = Set.of(
        AstProperties.TYPE_FIELD, AstProperties.TYPE_VARIABLE, AstProperties.TYPE_PARAMETER
    );

    private final List<MethodTargetRule> rules;
    private final Map<String, AstNode> symbols = new LinkedHashMap<>();
    private final Map<String, String> methodTargets = new LinkedHashMap<>();
    private final Map<String, Map<String, AstNode>> classFields = new LinkedHashMap<>();

    public SymbolTable() {
        this(MethodTargetRule.DEFAULT_RULES);
    }

    public SymbolTable(List<MethodTargetRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static SymbolTable build(AstTree tree) {
        SymbolTable table = new SymbolTable();
        table.buildFromTree(tree);
        return table;
    }

    public void buildFromTree(AstTree tree) {
        List<AstNode> nodes = tree.walk();

        // Pass 1: locator-defining declarations
        for (AstNode node : nodes) {
            if (DECLARATION_TYPES.contains(node.getType())) {
                recordInitializer(node);
            }
        }
        for (AstNode node : nodes) {
            if (node.hasType(AstProperties.TYPE_SUITE) && node.getName() != null) {
                recordClassFields(node);
            }
        }

        // Pass 2: naming-convention inference
        for (AstNode node : nodes) {
            String methodName = methodNameOf(node);
            if (methodName == null || methodTargets.containsKey(methodName)) continue;
            MethodTargetRule.inferTarget(rules, methodName)
                .ifPresent(target -> methodTargets.put(methodName, target));
        }
    }

    public Map<String, AstNode> getSymbols() { return Collections.unmodifiableMap(symbols); }

    public Map<String, String> getMethodTargets() { return Collections.unmodifiableMap(methodTargets); }

    public Map<String, Map<String, AstNode>> getClassFields() { return Collections.unmodifiableMap(classFields); }

    /**
     * Resolve a single node that references a recorded symbol by its {@code name}
     * or {@code member} property.
     */
    public Optional<StepTarget> resolveReference(AstNode node) {
        String name = node.property(AstProperties.NAME);
        if (name != null && symbols.containsKey(name)) {
            return Optional.of(new StepTarget(name, symbols.get(name).getId()));
        }
        String member = node.property(AstProperties.MEMBER);
        if (member != null && symbols.containsKey(member)) {
            return Optional.of(new StepTarget(member, symbols.get(member).getId()));
        }
        return Optional.empty();
    }

    /**
     * Resolve the target acted on by a statement. Searches the whole subtree for, in order:
     * a call to a method with an inferred target, a reference to a recorded symbol, and an
     * inline locator constructor. Empty when nothing matches.
     *
     * Calls whose receiver is a recorded symbol never match the first step.
     */
    public Optional<StepTarget> resolveStepTarget(AstNode statement) {
        List<AstNode> nodes = statement.walk();

        for (AstNode node : nodes) {
            String member = node.property(AstProperties.MEMBER);
            if (member != null && methodTargets.containsKey(member) && !isSymbolReceiverCall(node)) {
                return Optional.of(new StepTarget(methodTargets.get(member), node.getId()));
            }
        }
        for (AstNode node : nodes) {
            Optional<StepTarget> resolved = resolveReference(node);
            if (resolved.isPresent()) {
                return resolved;
            }
        }
        for (AstNode node : nodes) {
            if (isLocatorNode(node)) {
                String strategy = node.property(AstProperties.MEMBER);
                return Optional.of(new StepTarget(strategy != null ? strategy : "locator", node.getId()));
            }
        }
        return Optional.empty();
    }

    /** A locator constructor: qualifier {@code By} with a non-null member. */
    public static boolean isLocatorNode(AstNode node) {
        return AstProperties.LOCATOR_QUALIFIER.equals(node.property(AstProperties.QUALIFIER))
                && node.property(AstProperties.MEMBER) != null;
    }

    private void recordInitializer(AstNode declaration) {
        String name = declaration.getName();
        if (name == null || name.isEmpty()) return;
        AstNode locator = findLocator(declaration);
        if (locator != null) {
            symbols.put(name, locator);
        }
    }

    private void recordClassFields(AstNode suite) {
        Map<String, AstNode> fields = new LinkedHashMap<>();
        for (AstNode child : suite.getChildren()) {
            if (!child.hasType(AstProperties.TYPE_FIELD) || child.getName() == null) continue;
            AstNode locator = findLocator(child);
            if (locator != null) {
                fields.put(child.getName(), locator);
            }
        }
        if (!fields.isEmpty()) {
            classFields.put(suite.getName(), fields);
        }
    }

    // Direct children first, then the full subtree.
    private static AstNode findLocator(AstNode declaration) {
        for (AstNode child : declaration.getChildren()) {
            if (isLocatorNode(child)) return child;
        }
        for (AstNode child : declaration.getChildren()) {
            for (AstNode descendant : child.walk()) {
                if (isLocatorNode(descendant)) return descendant;
            }
        }
        return null;
    }

    // Chained calls have no qualifier and are library calls on a fresh object.
    private String methodNameOf(AstNode node) {
        if (node.hasType(AstProperties.TYPE_TEST)) {
            return node.getName();
        }
        String role = node.property(AstProperties.ROLE);
        if (AstProperties.ROLE_METHOD.equals(role)) {
            return node.getName();
        }
        if (AstProperties.ROLE_CALL.equals(role)) {
            String qualifier = node.property(AstProperties.QUALIFIER);
            if (qualifier == null || symbols.containsKey(qualifier)) {
                return null;
            }
            return node.property(AstProperties.MEMBER);
        }
        return null;
    }

    private boolean isSymbolReceiverCall(AstNode node) {
        if (!AstProperties.ROLE_CALL.equals(node.property(AstProperties.ROLE))) {
            return false;
        }
        String qualifier = node.property(AstProperties.QUALIFIER);
        return qualifier != null && symbols.containsKey(qualifier);
    }
}
