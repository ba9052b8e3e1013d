package com.qamigrate.compiler.ast;

/**
 * Raised when a canonical AST would violate a structural invariant
 * (empty id or type, self-parenting, re-parenting, duplicate ids, missing file path).
 * Always indicates a defective front-end adapter; never recovered from.
 */
public class AstStructureException extends RuntimeException {
    public AstStructureException(String message) { super(message); }
}
