package com.qamigrate.compiler.ir.builder;

import com.qamigrate.compiler.extraction.ExtractedTarget;
import com.qamigrate.compiler.ir.IrIds;
import com.qamigrate.compiler.ir.IrModel.SelectorStrategy;
import com.qamigrate.compiler.ir.IrModel.TargetContext;
import com.qamigrate.compiler.ir.IrModel.TargetIr;
import com.qamigrate.compiler.ir.IrModel.TargetSemantic;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds targets from normalized pages and locators.
 *
 * Selector strategies are renamed to their neutral form ({@code cssSelector -> css}) and
 * scored by how well they survive UI changes. The semantic role comes from the target
 * name's suffix ({@code loginButton -> button}).
 */
public class TargetsIrBuilder {

    static final double UNKNOWN_STRATEGY_SCORE = 0.50;

    private static final Map<String, String> STRATEGY_ALIASES = Map.of(
        "cssSelector", "css",
        "cssselector", "css"
    );

    private static final Map<String, Double> STABILITY_SCORES = Map.of(
        "id", 0.98,
        "name", 0.92,
        "css", 0.90,
        "linkText", 0.80,
        "partialLinkText", 0.75,
        "className", 0.70,
        "xpath", 0.65,
        "tagName", 0.60
    );

    // Checked in order; first matching suffix wins.
    private static final List<Map.Entry<String, String>> ROLE_SUFFIXES = List.of(
        Map.entry("Input", "textbox"),
        Map.entry("Field", "textbox"),
        Map.entry("Button", "button"),
        Map.entry("Btn", "button"),
        Map.entry("Select", "combobox"),
        Map.entry("Dropdown", "combobox"),
        Map.entry("Checkbox", "checkbox"),
        Map.entry("Link", "link")
    );

    public List<TargetIr> build(List<ExtractedTarget> targets) {
        List<TargetIr> built = new ArrayList<>(targets.size());
        for (ExtractedTarget target : targets) {
            built.add(build(target));
        }
        return built;
    }

    public TargetIr build(ExtractedTarget target) {
        List<SelectorStrategy> strategies = new ArrayList<>();
        String page;
        String role;
        if (target.isLocator()) {
            String strategy = normalizeStrategy(target.strategy());
            strategies.add(new SelectorStrategy(strategy, target.locatorValue(), stabilityScore(strategy)));
            page = target.pageName();
            role = roleOf(target.name());
        } else {
            page = target.name();
            role = "page";
        }

        String preferred = strategies.stream()
                .max(Comparator.comparingDouble(SelectorStrategy::stabilityScore))
                .map(SelectorStrategy::strategy)
                .orElse(null);

        return new TargetIr(
            IrIds.target(target.type(), target.name()),
            target.name(),
            target.type(),
            new TargetContext(page, null, null),
            new TargetSemantic(role, businessName(target.name())),
            strategies,
            preferred,
            target.filePath()
        );
    }

    static String normalizeStrategy(String strategy) {
        if (strategy == null) return null;
        return STRATEGY_ALIASES.getOrDefault(strategy, strategy);
    }

    static double stabilityScore(String normalizedStrategy) {
        return normalizedStrategy == null ? UNKNOWN_STRATEGY_SCORE
                : STABILITY_SCORES.getOrDefault(normalizedStrategy, UNKNOWN_STRATEGY_SCORE);
    }

    static String roleOf(String name) {
        if (name == null) return "element";
        for (Map.Entry<String, String> suffix : ROLE_SUFFIXES) {
            if (name.endsWith(suffix.getKey())) {
                return suffix.getValue();
            }
        }
        return "element";
    }

    /** {@code emailInput -> Email Input}. */
    static String businessName(String name) {
        if (name == null || name.isEmpty()) return name;
        String[] words = name.split("(?<=[a-z0-9])(?=[A-Z])|_+");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
        }
        return sb.toString();
    }
}
