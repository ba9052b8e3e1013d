package com.qamigrate.compiler.extraction;

import com.qamigrate.compiler.ast.AstNode;
import com.qamigrate.compiler.ast.AstProperties;
import com.qamigrate.compiler.ast.AstTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Every class-level {@code suite} node is a candidate page object.
 */
public class PageObjectExtractor {

    public List<ExtractedPage> extract(AstTree tree) {
        List<ExtractedPage> pages = new ArrayList<>();
        for (AstNode node : tree.walk()) {
            if (node.hasType(AstProperties.TYPE_SUITE)) {
                pages.add(new ExtractedPage(node.getId(), node.getName(), tree.getFilePath()));
            }
        }
        return pages;
    }
}
