package com.qamigrate.compiler.extraction;

import com.qamigrate.compiler.analysis.StepTarget;
import com.qamigrate.compiler.analysis.SymbolTable;
import com.qamigrate.compiler.ast.AstNode;
import com.qamigrate.compiler.ast.AstProperties;
import com.qamigrate.compiler.ast.PropertyValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the call sites of one statement into action steps, in evaluation order.
 *
 * A call is an action when its member is a known UI interaction, or when it is
 * qualified by anything other than an infrastructure object. The second branch is
 * what picks up page-object calls such as {@code loginPage.enterEmail(...)}.
 * Element lookups, waits and timeout configuration are never actions; neither are
 * {@code assert*} calls, which belong to {@link AssertionMapper}.
 */
public class ActionMapper {

    static final Set<String> SUPPORTED_ACTIONS = Set.of(
        "click", "sendKeys", "submit", "clear", "doubleClick", "contextClick",
        "getText", "waitForVisible", "navigate"
    );

    static final Set<String> UTILITY_MEMBERS = Set.of(
        "findElement", "findElements", "until", "implicitlyWait", "pageLoadTimeout",
        "setScriptTimeout", "scriptTimeout", "timeouts", "manage"
    );

    static final Set<String> INFRASTRUCTURE_QUALIFIERS = Set.of(
        "Duration", "ExpectedConditions", "By", "driver", "wait"
    );

    public List<ExtractedStep> map(AstNode statement, SymbolTable symbolTable) {
        List<ExtractedStep> steps = new ArrayList<>();
        for (AstNode node : statement.walkPostOrder()) {
            String member = node.property(AstProperties.MEMBER);
            if (member == null || !isAction(member, node.property(AstProperties.QUALIFIER))) {
                continue;
            }
            Optional<StepTarget> target = symbolTable.resolveStepTarget(node);
            steps.add(new ExtractedStep(
                StepKind.ACTION,
                member,
                target.map(StepTarget::targetName).orElse(null),
                target.map(StepTarget::nodeId).orElse(null),
                parametersOf(node)
            ));
        }
        return steps;
    }

    static boolean isAction(String member, String qualifier) {
        if (UTILITY_MEMBERS.contains(member) || member.startsWith("assert")) {
            return false;
        }
        if (SUPPORTED_ACTIONS.contains(member)) {
            return true;
        }
        return qualifier != null && !INFRASTRUCTURE_QUALIFIERS.contains(qualifier);
    }

    // First literal argument wins; otherwise the first plain reference.
    private static Map<String, String> parametersOf(AstNode call) {
        List<AstNode> arguments = argumentsOf(call);
        Map<String, String> parameters = new LinkedHashMap<>();

        for (AstNode argument : arguments) {
            if (AstProperties.ROLE_LITERAL.equals(argument.property(AstProperties.ROLE))) {
                String text = argument.propertyValue(AstProperties.VALUE).asText();
                if (text != null) {
                    parameters.put("value", text);
                    return parameters;
                }
            }
        }

        String qualifier = call.property(AstProperties.QUALIFIER);
        for (AstNode argument : arguments) {
            if (!AstProperties.ROLE_REFERENCE.equals(argument.property(AstProperties.ROLE))) continue;
            String name = argument.property(AstProperties.NAME);
            if (name != null && !name.equals(qualifier)) {
                parameters.put("reference", name);
                return parameters;
            }
        }
        return parameters;
    }

    private static List<AstNode> argumentsOf(AstNode call) {
        List<AstNode> children = call.getChildren();
        PropertyValue count = call.propertyValue(AstProperties.ARGUMENTS);
        if (count.asNumber() == null) {
            return children;
        }
        int n = Math.min(count.asNumber().intValue(), children.size());
        return children.subList(children.size() - n, children.size());
    }
}
