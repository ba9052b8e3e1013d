package com.qamigrate.compiler.extraction;

import com.qamigrate.compiler.ast.AstNode;
import com.qamigrate.compiler.ast.AstProperties;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One assertion step per distinct {@code assert*} member in a statement; first occurrence wins.
 */
public class AssertionMapper {

    public List<ExtractedStep> map(AstNode statement) {
        Set<String> seen = new LinkedHashSet<>();
        List<ExtractedStep> steps = new ArrayList<>();
        for (AstNode node : statement.walk()) {
            String member = node.property(AstProperties.MEMBER);
            if (member != null && member.startsWith("assert") && seen.add(member)) {
                steps.add(new ExtractedStep(StepKind.ASSERTION, member, null, null, Map.of()));
            }
        }
        return steps;
    }
}
