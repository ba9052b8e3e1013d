package com.qamigrate.compiler.extraction;

import com.qamigrate.compiler.analysis.SymbolTable;
import com.qamigrate.compiler.ast.AstIndex;
import com.qamigrate.compiler.ast.AstNode;
import com.qamigrate.compiler.ast.AstProperties;
import com.qamigrate.compiler.ast.AstTree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs every extractor over one tree and assembles the per-file {@link ExtractionResult}.
 *
 * A fresh symbol table and index are built for each tree; nothing is shared between calls.
 * Test statements are mapped in document order, actions before assertions.
 */
public class IrExtractor {

    private static final Set<String> SUITE_TYPE = Set.of(AstProperties.TYPE_SUITE);

    private final PageObjectExtractor pageExtractor = new PageObjectExtractor();
    private final LocatorExtractor locatorExtractor = new LocatorExtractor();
    private final ActionMapper actionMapper = new ActionMapper();
    private final AssertionMapper assertionMapper = new AssertionMapper();

    public ExtractionResult extract(AstTree tree, String projectName, String sourceLanguage) {
        SymbolTable symbolTable = SymbolTable.build(tree);
        AstIndex index = new AstIndex(tree);

        List<ExtractedTarget> targets = new ArrayList<>();
        for (ExtractedPage page : pageExtractor.extract(tree)) {
            targets.add(ExtractedTarget.fromPage(page));
        }
        for (ExtractedLocator locator : locatorExtractor.extract(tree, index)) {
            targets.add(ExtractedTarget.fromLocator(locator));
        }

        List<AstNode> suiteNodes = new ArrayList<>();
        List<AstNode> testNodes = new ArrayList<>();
        for (AstNode node : tree.walk()) {
            if (node.hasType(AstProperties.TYPE_SUITE)) {
                suiteNodes.add(node);
            } else if (node.hasType(AstProperties.TYPE_TEST)) {
                testNodes.add(node);
            }
        }

        // suite node id -> names of the tests it declares
        Map<String, List<String>> testsBySuite = new LinkedHashMap<>();
        List<ExtractedTest> tests = new ArrayList<>();
        for (AstNode testNode : testNodes) {
            AstNode suite = index.nearestAncestor(testNode, SUITE_TYPE);
            if (suite != null && testNode.getName() != null) {
                testsBySuite.computeIfAbsent(suite.getId(), id -> new ArrayList<>()).add(testNode.getName());
            }
            tests.add(extractTest(testNode, suite, symbolTable));
        }

        List<ExtractedSuite> suites = new ArrayList<>();
        for (AstNode suiteNode : suiteNodes) {
            AstNode parent = index.nearestAncestor(suiteNode, SUITE_TYPE);
            suites.add(new ExtractedSuite(
                suiteNode.getName(),
                testsBySuite.getOrDefault(suiteNode.getId(), List.of()),
                parent != null ? parent.getName() : null,
                suiteNode.property(AstProperties.DESCRIPTION),
                splitTags(suiteNode.property(AstProperties.TAGS))
            ));
        }

        return new ExtractionResult(projectName, sourceLanguage, tree.getFilePath(),
                tests, suites, targets, List.of());
    }

    private ExtractedTest extractTest(AstNode testNode, AstNode suite, SymbolTable symbolTable) {
        List<ExtractedStep> steps = new ArrayList<>();
        for (AstNode statement : testNode.getChildren()) {
            if (statement.hasType(AstProperties.TYPE_PARAMETER)) continue;
            steps.addAll(actionMapper.map(statement, symbolTable));
            steps.addAll(assertionMapper.map(statement));
        }

        Set<String> tags = new LinkedHashSet<>();
        if (suite != null) {
            tags.addAll(splitTags(suite.property(AstProperties.TAGS)));
        }
        tags.addAll(splitTags(testNode.property(AstProperties.TAGS)));

        return new ExtractedTest(
            testNode.getName(),
            steps,
            new ArrayList<>(tags),
            null,
            testNode.property(AstProperties.DATA_SOURCE),
            suite != null ? suite.getName() : null,
            testNode.property(AstProperties.DESCRIPTION)
        );
    }

    static List<String> splitTags(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .distinct()
                .toList();
    }
}
