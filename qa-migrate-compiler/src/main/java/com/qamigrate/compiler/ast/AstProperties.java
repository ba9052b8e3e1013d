package com.qamigrate.compiler.ast;

/**
 * Canonical node types and property keys shared by front-end adapters and the analysis layers.
 */
public final class AstProperties {

    private AstProperties() {}

    // Canonical node types
    public static final String TYPE_SUITE = "suite";
    public static final String TYPE_TEST = "test";
    public static final String TYPE_FIELD = "field";
    public static final String TYPE_VARIABLE = "variable";
    public static final String TYPE_PARAMETER = "parameter";
    public static final String TYPE_NODE = "node";

    // Property keys
    public static final String NAME = "name";
    /** Receiver of a call, as written (e.g. {@code By}, {@code driver}). */
    public static final String QUALIFIER = "qualifier";
    /** Invoked method name. Only call sites carry it. */
    public static final String MEMBER = "member";
    /** Argument count of a call; arguments are the call's last children. */
    public static final String ARGUMENTS = "arguments";
    public static final String VALUE = "value";
    /** Source-language node kind, e.g. {@code MethodCallExpr}. */
    public static final String KIND = "kind";
    public static final String ROLE = "role";
    /** Comma-separated tag list on suites and tests. */
    public static final String TAGS = "tags";
    public static final String DESCRIPTION = "description";
    /** Name of the data set feeding a parameterized test. */
    public static final String DATA_SOURCE = "dataSource";

    // Values of ROLE
    public static final String ROLE_METHOD = "method";
    public static final String ROLE_CALL = "call";
    public static final String ROLE_LITERAL = "literal";
    public static final String ROLE_REFERENCE = "reference";

    /** Qualifier marking a locator-constructor call such as {@code By.cssSelector(...)}. */
    public static final String LOCATOR_QUALIFIER = "By";
}
