package com.qamigrate.compiler.analysis;

import java.util.List;
import java.util.Optional;

/**
 * Naming-convention rule inferring a target name from a page-object method name:
 * {@code enterEmail} with rule (enter, Input) gives {@code emailInput}.
 *
 * Any name longer than the prefix matches, so {@code entertain} gives {@code tainInput}.
 */
public record MethodTargetRule(String prefix, String suffix) {

    /** Applied in order; the first matching rule wins. */
    public static final List<MethodTargetRule> DEFAULT_RULES = List.of(
        new MethodTargetRule("enter", "Input"),
        new MethodTargetRule("click", "Button"),
        new MethodTargetRule("select", "Select"),
        new MethodTargetRule("check", "Checkbox"),
        new MethodTargetRule("fill", "Input")
    );

    public Optional<String> apply(String methodName) {
        if (methodName == null || !methodName.startsWith(prefix) || methodName.length() == prefix.length()) {
            return Optional.empty();
        }
        String rest = methodName.substring(prefix.length());
        return Optional.of(Character.toLowerCase(rest.charAt(0)) + rest.substring(1) + suffix);
    }

    public static Optional<String> inferTarget(List<MethodTargetRule> rules, String methodName) {
        for (MethodTargetRule rule : rules) {
            Optional<String> inferred = rule.apply(methodName);
            if (inferred.isPresent()) {
                return inferred;
            }
        }
        return Optional.empty();
    }
}
