package com.qamigrate.compiler.ir;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable IR records, schema 1.0.
 * Collections are copied on construction; {@code null} marks an unresolved link.
 */
public final class IrModel {

    private IrModel() {}

    public static final String SCHEMA_VERSION = "1.0";

    public record IrDocument(
        @SerializedName("project")      ProjectIr project,
        @SerializedName("tests")        List<TestIr> tests,
        @SerializedName("suites")       List<SuiteIr> suites,
        @SerializedName("targets")      List<TargetIr> targets,
        @SerializedName("data")         List<TestDataIr> data,
        @SerializedName("environments") List<EnvironmentIr> environments
    ) {
        public IrDocument {
            tests = List.copyOf(tests);
            suites = List.copyOf(suites);
            targets = List.copyOf(targets);
            data = List.copyOf(data);
            environments = List.copyOf(environments);
        }
    }

    public record ProjectMetadata(
        @SerializedName("name")             String name,
        @SerializedName("version")          String version,
        @SerializedName("generated_at")     String generatedAt,
        @SerializedName("source_language")  String sourceLanguage,
        @SerializedName("compiler_version") String compilerVersion
    ) {}

    public record ProjectIr(
        @SerializedName("id")            String id,
        @SerializedName("schemaVersion") String schemaVersion,
        @SerializedName("metadata")      ProjectMetadata metadata,
        @SerializedName("environments")  List<String> environments,
        @SerializedName("suites")        List<String> suites,
        @SerializedName("tests")         List<String> tests
    ) {
        public ProjectIr {
            environments = copyNullable(environments);
            suites = copyNullable(suites);
            tests = copyNullable(tests);
        }
    }

    public record SuiteIr(
        @SerializedName("id")          String id,
        @SerializedName("name")        String name,
        @SerializedName("description") String description,
        @SerializedName("parentId")    String parentId,
        @SerializedName("tests")       List<String> tests
    ) {
        public SuiteIr {
            tests = List.copyOf(tests);
        }
    }

    public record StepIr(
        @SerializedName("id")           String id,
        @SerializedName("kind")         String kind,          // action | assertion
        @SerializedName("name")         String name,
        @SerializedName("targetId")     String targetId,
        @SerializedName("targetNameId") String targetNameId,
        @SerializedName("targetNodeId") String targetNodeId,
        @SerializedName("parameters")   Map<String, String> parameters
    ) {
        public StepIr {
            parameters = copyMap(parameters);
        }
    }

    public record TestIr(
        @SerializedName("id")            String id,
        @SerializedName("name")          String name,
        @SerializedName("description")   String description,
        @SerializedName("suiteId")       String suiteId,
        @SerializedName("environmentId") String environmentId,
        @SerializedName("dataId")        String dataId,
        @SerializedName("tags")          List<String> tags,
        @SerializedName("steps")         List<StepIr> steps
    ) {
        public TestIr {
            tags = List.copyOf(tags);
            steps = List.copyOf(steps);
        }
    }

    public record TargetContext(
        @SerializedName("page")      String page,
        @SerializedName("component") String component,
        @SerializedName("frame")     String frame
    ) {}

    public record TargetSemantic(
        @SerializedName("role")         String role,
        @SerializedName("businessName") String businessName
    ) {}

    public record SelectorStrategy(
        @SerializedName("strategy")       String strategy,
        @SerializedName("value")          String value,
        @SerializedName("stabilityScore") double stabilityScore
    ) {}

    public record TargetIr(
        @SerializedName("id")                 String id,
        @SerializedName("name")               String name,
        @SerializedName("type")               String type,   // page | locator
        @SerializedName("context")            TargetContext context,
        @SerializedName("semantic")           TargetSemantic semantic,
        @SerializedName("selectorStrategies") List<SelectorStrategy> selectorStrategies,
        @SerializedName("preferredStrategy")  String preferredStrategy,
        @SerializedName("sourceFile")         String sourceFile
    ) {
        public TargetIr {
            selectorStrategies = List.copyOf(selectorStrategies);
        }
    }

    public record Timeouts(
        @SerializedName("implicit") Integer implicit,
        @SerializedName("explicit") Integer explicit,
        @SerializedName("pageLoad") Integer pageLoad
    ) {}

    public record RetryPolicy(
        @SerializedName("enabled")    boolean enabled,
        @SerializedName("maxRetries") int maxRetries
    ) {}

    public record EnvironmentIr(
        @SerializedName("id")            String id,
        @SerializedName("name")          String name,
        @SerializedName("baseUrl")       String baseUrl,
        @SerializedName("variables")     Map<String, String> variables,
        @SerializedName("browsers")      List<String> browsers,
        @SerializedName("executionMode") String executionMode,
        @SerializedName("timeouts")      Timeouts timeouts,
        @SerializedName("retryPolicy")   RetryPolicy retryPolicy
    ) {
        public EnvironmentIr {
            variables = copyMap(variables);
            browsers = copyNullable(browsers);
        }
    }

    public record TestDataIr(
        @SerializedName("id")      String id,
        @SerializedName("name")    String name,
        @SerializedName("type")    String type,
        @SerializedName("records") List<Map<String, Object>> records
    ) {
        public TestDataIr {
            records = records == null ? List.of()
                    : records.stream().map(IrModel::copyMap).toList();
        }
    }

    private static <T> List<T> copyNullable(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    // Keeps insertion order and tolerates null values, unlike Map.copyOf.
    private static <V> Map<String, V> copyMap(Map<String, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
