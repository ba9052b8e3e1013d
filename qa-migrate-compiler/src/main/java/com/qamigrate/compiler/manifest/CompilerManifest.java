package com.qamigrate.compiler.manifest;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Deserialized form of a project's manifest.json.
 */
public class CompilerManifest {

    static final String DEFAULT_OUTPUT = "build/qa-ir/project_ir.json";
    static final String DEFAULT_COMPILER_VERSION = "0.1.0";

    @SerializedName("project_name")
    private String projectName;

    /** Front end to use (default: "java"). */
    @SerializedName("source_language")
    private String sourceLanguage;

    /**
     * Source directories relative to the manifest. When absent they are resolved
     * from the project's build file.
     */
    @SerializedName("source_roots")
    private List<String> sourceRoots;

    @SerializedName("output")
    private String output;

    @SerializedName("compiler_version")
    private String compilerVersion;

    /** Environment bound to every test; must name an entry of {@code environments}. */
    @SerializedName("default_environment")
    private String defaultEnvironment;

    @SerializedName("environments")
    private List<EnvironmentConfig> environments;

    @SerializedName("data_sets")
    private List<DataSetConfig> dataSets;

    public String getProjectName()     { return projectName; }
    public String getSourceLanguage()  { return sourceLanguage != null ? sourceLanguage : "java"; }
    public List<String> getSourceRoots() { return sourceRoots != null ? sourceRoots : Collections.emptyList(); }
    public String getOutput()          { return output != null ? output : DEFAULT_OUTPUT; }
    public String getCompilerVersion() { return compilerVersion != null ? compilerVersion : DEFAULT_COMPILER_VERSION; }
    public String getDefaultEnvironment() { return defaultEnvironment; }
    public List<EnvironmentConfig> getEnvironments() {
        return environments != null ? environments : Collections.emptyList();
    }
    public List<DataSetConfig> getDataSets() {
        return dataSets != null ? dataSets : Collections.emptyList();
    }

    public static class EnvironmentConfig {
        @SerializedName("name")           private String name;
        @SerializedName("base_url")       private String baseUrl;
        @SerializedName("variables")      private Map<String, String> variables;
        @SerializedName("browsers")       private List<String> browsers;
        @SerializedName("execution_mode") private String executionMode;
        @SerializedName("timeouts")       private TimeoutsConfig timeouts;
        @SerializedName("retry")          private RetryConfig retry;

        public String getName()    { return name; }
        public String getBaseUrl() { return baseUrl; }
        public Map<String, String> getVariables() { return variables != null ? variables : Collections.emptyMap(); }
        public List<String> getBrowsers() { return browsers != null ? browsers : List.of("chrome"); }
        public String getExecutionMode()  { return executionMode != null ? executionMode : "local"; }
        public TimeoutsConfig getTimeouts() { return timeouts != null ? timeouts : new TimeoutsConfig(); }
        public RetryConfig getRetry()       { return retry != null ? retry : new RetryConfig(); }
    }

    /** Seconds; absent values stay {@code null}. */
    public static class TimeoutsConfig {
        @SerializedName("implicit")  private Integer implicit;
        @SerializedName("explicit")  private Integer explicit;
        @SerializedName("page_load") private Integer pageLoad;

        public Integer getImplicit() { return implicit; }
        public Integer getExplicit() { return explicit; }
        public Integer getPageLoad() { return pageLoad; }
    }

    public static class RetryConfig {
        @SerializedName("enabled")     private Boolean enabled;
        @SerializedName("max_retries") private Integer maxRetries;

        public boolean isEnabled()  { return enabled != null && enabled; }
        public int getMaxRetries()  { return maxRetries != null ? maxRetries : 0; }
    }

    public static class DataSetConfig {
        @SerializedName("name")    private String name;
        @SerializedName("type")    private String type;
        @SerializedName("records") private List<Map<String, Object>> records;

        public String getName() { return name; }
        public String getType() { return type != null ? type : "inline"; }
        public List<Map<String, Object>> getRecords() {
            return records != null ? records : Collections.emptyList();
        }
    }
}
