package com.qamigrate.compiler.manifest;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class ManifestReader {

    // Data-set records keep integral numbers as Long
    private static final Gson GSON = new GsonBuilder()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .create();

    /**
     * Reads and validates manifest.json from the given path.
     *
     * @throws ManifestReadException if the file is missing, malformed or names no project
     */
    public CompilerManifest read(Path manifestPath) {
        if (!Files.isRegularFile(manifestPath)) {
            throw new ManifestReadException("Manifest file not found: " + manifestPath);
        }
        CompilerManifest manifest;
        try (Reader reader = Files.newBufferedReader(manifestPath, StandardCharsets.UTF_8)) {
            manifest = GSON.fromJson(reader, CompilerManifest.class);
        } catch (JsonParseException e) {
            throw new ManifestReadException("Malformed manifest " + manifestPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ManifestReadException("Failed to read manifest " + manifestPath + ": " + e.getMessage(), e);
        }
        if (manifest == null) {
            throw new ManifestReadException("Manifest file is empty or invalid JSON: " + manifestPath);
        }
        validate(manifest, manifestPath);
        return manifest;
    }

    private static void validate(CompilerManifest manifest, Path manifestPath) {
        if (manifest.getProjectName() == null || manifest.getProjectName().isBlank()) {
            throw new ManifestReadException("project_name is required: " + manifestPath);
        }
        for (CompilerManifest.EnvironmentConfig env : manifest.getEnvironments()) {
            if (env == null || env.getName() == null || env.getName().isBlank()) {
                throw new ManifestReadException("Every environment needs a name: " + manifestPath);
            }
        }
        for (CompilerManifest.DataSetConfig dataSet : manifest.getDataSets()) {
            if (dataSet == null || dataSet.getName() == null || dataSet.getName().isBlank()) {
                throw new ManifestReadException("Every data set needs a name: " + manifestPath);
            }
        }
        String defaultEnv = manifest.getDefaultEnvironment();
        if (defaultEnv != null && manifest.getEnvironments().stream().noneMatch(e -> defaultEnv.equals(e.getName()))) {
            throw new ManifestReadException("default_environment '" + defaultEnv
                    + "' is not declared in environments: " + manifestPath);
        }
    }

    public static class ManifestReadException extends RuntimeException {
        public ManifestReadException(String message) { super(message); }
        public ManifestReadException(String message, Throwable cause) { super(message, cause); }
    }
}
