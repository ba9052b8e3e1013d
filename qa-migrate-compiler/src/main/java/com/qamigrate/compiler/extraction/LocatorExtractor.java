package com.qamigrate.compiler.extraction;

import com.qamigrate.compiler.analysis.SymbolTable;
import com.qamigrate.compiler.ast.AstHasher;
import com.qamigrate.compiler.ast.AstIndex;
import com.qamigrate.compiler.ast.AstNode;
import com.qamigrate.compiler.ast.AstProperties;
import com.qamigrate.compiler.ast.AstTree;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects {@code By.<strategy>(...)} locators of one tree.
 *
 * Locators are deduplicated by (strategy, literal value); the first occurrence in
 * document order is kept. Locators without a literal argument are keyed on the
 * structural hash of the constructor call instead. A locator is named after the nearest enclosing named
 * field, variable or parameter declaration.
 */
public class LocatorExtractor {

    private static final Set<String> DECLARATION_TYPES = Set.of(
        AstProperties.TYPE_FIELD, AstProperties.TYPE_VARIABLE, AstProperties.TYPE_PARAMETER
    );

    private record LocatorKey(String strategy, String value, String structureHash) {}

    private final AstHasher hasher = new AstHasher();

    public List<ExtractedLocator> extract(AstTree tree) {
        return extract(tree, new AstIndex(tree));
    }

    public List<ExtractedLocator> extract(AstTree tree, AstIndex index) {
        List<ExtractedLocator> locators = new ArrayList<>();
        Set<LocatorKey> seen = new LinkedHashSet<>();

        for (AstNode node : tree.walk()) {
            if (!SymbolTable.isLocatorNode(node)) continue;

            String strategy = node.property(AstProperties.MEMBER);
            String value = literalArgument(node);
            String structureHash = value == null ? hasher.hashNode(node) : null;
            if (!seen.add(new LocatorKey(strategy, value, structureHash))) continue;

            AstNode page = index.nearestAncestor(node, Set.of(AstProperties.TYPE_SUITE));
            locators.add(new ExtractedLocator(
                node.getId(),
                owningDeclarationName(node, index),
                strategy,
                value,
                tree.getFilePath(),
                page != null ? page.getName() : null
            ));
        }
        return locators;
    }

    static String literalArgument(AstNode call) {
        for (AstNode child : call.getChildren()) {
            if (AstProperties.ROLE_LITERAL.equals(child.property(AstProperties.ROLE))) {
                return child.propertyValue(AstProperties.VALUE).asText();
            }
        }
        return null;
    }

    private static String owningDeclarationName(AstNode node, AstIndex index) {
        AstNode current = index.nearestAncestor(node, DECLARATION_TYPES);
        while (current != null) {
            if (current.getName() != null && !current.getName().isEmpty()) {
                return current.getName();
            }
            current = index.nearestAncestor(current, DECLARATION_TYPES);
        }
        return null;
    }
}
