package com.qamigrate.compiler.ir;

import com.qamigrate.compiler.ast.AstHasher;

/**
 * Deterministic IR identifiers: the first 12 hex characters of the SHA-256 of a composite key.
 */
public final class IrIds {

    private IrIds() {}

    static final int ID_LENGTH = 12;

    public static String hash(String key) {
        return AstHasher.sha256(key).substring(0, ID_LENGTH);
    }

    public static String project(String name)   { return hash("project::" + name); }
    public static String suite(String name)     { return hash("suite::" + name); }
    public static String test(String name)      { return hash("test::" + name); }
    public static String environment(String name) { return hash("env::" + name); }
    public static String data(String name)      { return hash("data::" + name); }

    public static String target(String type, String name) {
        return hash("target::" + type + "::" + name);
    }

    /** The index keeps two same-named steps of one test apart. */
    public static String step(String testId, int index, String stepName) {
        return hash(testId + "::step::" + index + "::" + stepName);
    }
}
