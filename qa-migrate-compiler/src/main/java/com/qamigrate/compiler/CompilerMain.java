package com.qamigrate.compiler;

import com.qamigrate.compiler.ir.IrWriter;
import com.qamigrate.compiler.manifest.CompilerManifest;
import com.qamigrate.compiler.manifest.ManifestReader;
import com.qamigrate.compiler.pipeline.IrGenerationPipeline;
import com.qamigrate.compiler.pipeline.PipelineResult;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Entry point of the qa-migrate compiler.
 *
 * Usage:
 *   java -jar qa-migrate-compiler.jar compile \
 *     --manifest <path-to-manifest.json> \
 *     [--output  <ir-file>]
 *
 * The project root is the directory containing the manifest. Without {@code --output}
 * the IR goes to the manifest's {@code output}, resolved against the project root.
 */
public class CompilerMain {

    public static void main(String[] args) {
        try {
            run(args, Clock.systemUTC());
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[qa-migrate] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar qa-migrate-compiler.jar compile --manifest <path> [--output <file>]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[qa-migrate] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static Path run(String[] args, Clock clock) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("compile")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        String manifestPath = null;
        String outputPath = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--manifest" -> manifestPath = requireNext(args, i++, "--manifest");
                case "--output"   -> outputPath   = requireNext(args, i++, "--output");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (manifestPath == null) throw new UsageException("--manifest is required");

        Path manifest = Paths.get(manifestPath).toAbsolutePath();

        // 1. Read manifest
        System.err.println("[qa-migrate] Reading manifest: " + manifest);
        CompilerManifest config = new ManifestReader().read(manifest);

        // Project root = directory containing manifest.json
        Path projectRoot = manifest.getParent();
        Path output = outputPath != null
                ? Paths.get(outputPath).toAbsolutePath()
                : projectRoot.resolve(config.getOutput());

        // 2. Parse, extract and assemble
        PipelineResult result = switch (config.getSourceLanguage()) {
            case "java" -> IrGenerationPipeline.forJava(clock).run(config, projectRoot);
            default -> throw new UsageException("Unsupported source_language: " + config.getSourceLanguage());
        };

        // 3. Write
        new IrWriter().write(output, result.document());
        System.err.println("[qa-migrate] Done.");
        return output;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
