package com.qamigrate.compiler.ast;

import java.util.List;

/**
 * One source file's canonical AST.
 */
public final class AstTree {

    private final AstNode root;
    private final String language;
    private final String filePath;

    public AstTree(AstNode root, String language, String filePath) {
        if (root == null) {
            throw new AstStructureException("AstTree must have a root node");
        }
        if (filePath == null || filePath.isEmpty()) {
            throw new AstStructureException("AstTree.filePath cannot be empty");
        }
        this.root = root;
        this.language = language;
        this.filePath = filePath;
    }

    public AstNode getRoot() { return root; }
    public String getLanguage() { return language; }
    public String getFilePath() { return filePath; }

    public List<AstNode> walk() {
        return root.walk();
    }

    public int nodeCount() {
        return walk().size();
    }
}
