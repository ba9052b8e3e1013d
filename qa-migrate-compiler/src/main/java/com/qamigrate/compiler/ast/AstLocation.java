package com.qamigrate.compiler.ast;

/**
 * Source position of a node. Every component is optional.
 */
public record AstLocation(
    String filePath,
    Integer startLine,
    Integer startColumn,
    Integer endLine,
    Integer endColumn
) {
    public static AstLocation ofFile(String filePath) {
        return new AstLocation(filePath, null, null, null, null);
    }
}
