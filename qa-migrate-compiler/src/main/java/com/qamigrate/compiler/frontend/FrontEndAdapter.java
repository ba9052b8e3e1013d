package com.qamigrate.compiler.frontend;

import com.qamigrate.compiler.ast.AstNode;

import java.nio.file.Path;

/**
 * Converts a language-native parse tree into the canonical AST.
 * Implementations use a fresh {@link com.qamigrate.compiler.ast.AstBuilder} per call so ids
 * depend only on the file being adapted.
 */
public interface FrontEndAdapter<T> {

    /** Language tag recorded on the resulting tree, e.g. {@code java}. */
    String language();

    AstNode adapt(T parsed, Path sourceFile);
}
