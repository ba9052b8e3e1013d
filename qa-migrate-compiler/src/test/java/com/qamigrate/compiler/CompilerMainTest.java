package com.qamigrate.compiler;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompilerMainTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void missingSubcommandIsAUsageError() {
        assertThrows(CompilerMain.UsageException.class, () -> CompilerMain.run(new String[0], FIXED));
    }

    @Test
    void unknownSubcommandIsAUsageError() {
        assertThrows(CompilerMain.UsageException.class,
                () -> CompilerMain.run(new String[]{"build"}, FIXED));
    }

    @Test
    void manifestFlagIsRequired() {
        CompilerMain.UsageException e = assertThrows(CompilerMain.UsageException.class,
                () -> CompilerMain.run(new String[]{"compile"}, FIXED));
        assertTrue(e.getMessage().contains("--manifest"));
    }

    @Test
    void flagWithoutValueIsAUsageError() {
        assertThrows(CompilerMain.UsageException.class,
                () -> CompilerMain.run(new String[]{"compile", "--manifest"}, FIXED));
        assertThrows(CompilerMain.UsageException.class,
                () -> CompilerMain.run(new String[]{"compile", "--verbose"}, FIXED));
    }

    @Test
    void compilesFixtureToRequestedOutput(@TempDir Path tempDir) throws IOException {
        Path output = tempDir.resolve("out/project_ir.json");
        String manifest = AstFixtures.ECOMMERCE_FIXTURE.resolve("manifest.json").toString();

        Path written = CompilerMain.run(new String[]{"compile", "--manifest", manifest,
                "--output", output.toString()}, FIXED);

        assertEquals(output.toAbsolutePath(), written);
        JsonObject ir = JsonParser.parseString(Files.readString(output)).getAsJsonObject();
        assertEquals(List.of("data", "environments", "project", "suites", "targets", "tests"),
                new ArrayList<>(ir.keySet()));
        assertEquals("2024-05-01T12:00:00Z",
                ir.getAsJsonObject("project").getAsJsonObject("metadata").get("generated_at").getAsString());
        assertEquals(4, ir.getAsJsonArray("tests").size());
    }

    @Test
    void outputDefaultsToManifestSetting(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("manifest.json"),
                "{\"project_name\": \"tiny\", \"source_roots\": [\"tests\"], \"output\": \"ir/tiny.json\"}");
        Path tests = Files.createDirectories(tempDir.resolve("tests"));
        Files.writeString(tests.resolve("TinyTest.java"), "class TinyTest { @Test void ok() { } }\n");

        Path written = CompilerMain.run(new String[]{"compile", "--manifest",
                tempDir.resolve("manifest.json").toString()}, FIXED);

        assertEquals(tempDir.toAbsolutePath().resolve("ir/tiny.json"), written);
        assertTrue(Files.exists(written));
    }

    @Test
    void unsupportedLanguageIsAUsageError(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("manifest.json"),
                "{\"project_name\": \"py\", \"source_language\": \"python\"}");

        CompilerMain.UsageException e = assertThrows(CompilerMain.UsageException.class,
                () -> CompilerMain.run(new String[]{"compile", "--manifest",
                        tempDir.resolve("manifest.json").toString()}, FIXED));
        assertTrue(e.getMessage().contains("python"));
        assertFalse(Files.exists(tempDir.resolve("build")));
    }
}
