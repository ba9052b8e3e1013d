package com.qamigrate.compiler.frontend;

import org.apache.maven.model.Build;
import org.apache.maven.model.Model;
import org.apache.maven.model.io.xpp3.MavenXpp3Reader;
import org.codehaus.plexus.util.xml.pull.XmlPullParserException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the source directories of a Maven or Gradle test project.
 *
 * UI tests usually live under the test sources and their page objects under either
 * tree, so both are returned: test sources first, then main sources.
 */
public class SourceRootResolver {

    static final String DEFAULT_TEST_SOURCES = "src/test/java";
    static final String DEFAULT_MAIN_SOURCES = "src/main/java";

    public static class UnsupportedBuildToolException extends RuntimeException {
        public UnsupportedBuildToolException(String message) { super(message); }
    }

    /**
     * Detect build tool and resolve source roots.
     *
     * @param projectRoot path to the project root directory
     */
    public SourceRoots resolve(Path projectRoot) {
        Path pomFile = projectRoot.resolve("pom.xml");
        Path gradleFile = projectRoot.resolve("build.gradle");
        Path gradleKts = projectRoot.resolve("build.gradle.kts");

        if (Files.exists(pomFile)) {
            return resolveMaven(projectRoot, pomFile);
        } else if (Files.exists(gradleFile) || Files.exists(gradleKts)) {
            return new SourceRoots("gradle", List.of(
                projectRoot.resolve(DEFAULT_TEST_SOURCES).toAbsolutePath().normalize(),
                projectRoot.resolve(DEFAULT_MAIN_SOURCES).toAbsolutePath().normalize()
            ));
        } else {
            throw new UnsupportedBuildToolException(
                "No pom.xml or build.gradle found in: " + projectRoot +
                ". Supported build tools: Maven, Gradle. Set source_roots in the manifest otherwise."
            );
        }
    }

    /** Roots listed in the manifest, relative to the project root. */
    public SourceRoots fromManifest(Path projectRoot, List<String> sourceRoots) {
        List<Path> roots = new ArrayList<>();
        for (String root : sourceRoots) {
            roots.add(projectRoot.resolve(root).toAbsolutePath().normalize());
        }
        return new SourceRoots("manifest", roots);
    }

    private SourceRoots resolveMaven(Path projectRoot, Path pomFile) {
        String testSourceDir = DEFAULT_TEST_SOURCES;
        String sourceDir = DEFAULT_MAIN_SOURCES;
        try (Reader reader = Files.newBufferedReader(pomFile, StandardCharsets.UTF_8)) {
            Model model = new MavenXpp3Reader().read(reader);
            Build build = model.getBuild();
            if (build != null) {
                if (build.getTestSourceDirectory() != null) testSourceDir = build.getTestSourceDirectory();
                if (build.getSourceDirectory() != null) sourceDir = build.getSourceDirectory();
            }
        } catch (IOException | XmlPullParserException e) {
            System.err.println("[qa-migrate] WARNING: could not parse pom.xml, using default source roots: "
                    + e.getMessage());
        }
        return new SourceRoots("maven", List.of(
            projectRoot.resolve(testSourceDir).toAbsolutePath().normalize(),
            projectRoot.resolve(sourceDir).toAbsolutePath().normalize()
        ));
    }
}
