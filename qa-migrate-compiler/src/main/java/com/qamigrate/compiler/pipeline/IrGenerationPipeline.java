package com.qamigrate.compiler.pipeline;

import com.github.javaparser.ast.CompilationUnit;
import com.qamigrate.compiler.ast.AstNode;
import com.qamigrate.compiler.ast.AstTree;
import com.qamigrate.compiler.extraction.ExtractionResult;
import com.qamigrate.compiler.extraction.IrExtractor;
import com.qamigrate.compiler.frontend.FrontEndAdapter;
import com.qamigrate.compiler.frontend.JavaAstAdapter;
import com.qamigrate.compiler.frontend.JavaSourceParser;
import com.qamigrate.compiler.frontend.SourceFileCollector;
import com.qamigrate.compiler.frontend.SourceParser;
import com.qamigrate.compiler.frontend.SourceRootResolver;
import com.qamigrate.compiler.frontend.SourceRoots;
import com.qamigrate.compiler.ir.IrAssembler;
import com.qamigrate.compiler.ir.IrModel.IrDocument;
import com.qamigrate.compiler.ir.builder.ProjectIrBuilder;
import com.qamigrate.compiler.manifest.CompilerManifest;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Parser -> canonical AST -> extraction -> IR, over all files of one project.
 *
 * Files are processed one at a time in sorted path order, each with its own builder,
 * index and symbol table; results are appended in that order. Any parse or structural
 * failure aborts the run: a partial IR that silently omits a file is never produced.
 *
 * @param <T> parse tree type of the front end
 */
public class IrGenerationPipeline<T> {

    private final SourceParser<T> parser;
    private final FrontEndAdapter<T> adapter;
    private final IrExtractor extractor;
    private final IrAssembler assembler;

    public IrGenerationPipeline(SourceParser<T> parser, FrontEndAdapter<T> adapter,
                                IrExtractor extractor, IrAssembler assembler) {
        this.parser = parser;
        this.adapter = adapter;
        this.extractor = extractor;
        this.assembler = assembler;
    }

    public static IrGenerationPipeline<CompilationUnit> forJava(Clock clock) {
        return new IrGenerationPipeline<>(
            new JavaSourceParser(),
            new JavaAstAdapter(),
            new IrExtractor(),
            new IrAssembler(new ProjectIrBuilder(clock))
        );
    }

    /**
     * Resolves the project's source roots (manifest first, then the build file) and runs
     * over every source file found.
     */
    public PipelineResult run(CompilerManifest manifest, Path projectRoot) {
        SourceRootResolver resolver = new SourceRootResolver();
        SourceRoots roots = manifest.getSourceRoots().isEmpty()
                ? resolver.resolve(projectRoot)
                : resolver.fromManifest(projectRoot, manifest.getSourceRoots());
        System.err.println("[qa-migrate] Source roots (" + roots.buildTool() + "): " + roots.roots());

        List<Path> sourceFiles = new SourceFileCollector().collect(roots);
        return run(manifest, projectRoot, sourceFiles);
    }

    public PipelineResult run(CompilerManifest manifest, Path projectRoot, List<Path> sourceFiles) {
        String projectName = manifest.getProjectName();
        String language = adapter.language();
        Path base = projectRoot.toAbsolutePath().normalize();

        List<Path> ordered = new ArrayList<>(sourceFiles);
        ordered.sort(Comparator.comparing(Path::toString));

        System.err.println("[qa-migrate] Compiling project: " + projectName
                + " (" + ordered.size() + " source files)");

        List<ExtractionResult> results = new ArrayList<>();
        for (Path file : ordered) {
            Path absolute = base.resolve(file).toAbsolutePath().normalize();
            String relativePath = relativePath(base, absolute);
            System.err.println("[qa-migrate] Processing file: " + relativePath);

            T parsed = parser.parse(absolute);
            AstNode root = adapter.adapt(parsed, absolute);
            AstTree tree = new AstTree(root, language, relativePath);

            ExtractionResult result = extractor.extract(tree, projectName, language);
            results.add(result);
            System.err.println("[qa-migrate] Extracted " + relativePath
                    + ": tests=" + result.tests().size()
                    + " suites=" + result.suites().size()
                    + " targets=" + result.targets().size());
        }

        IrDocument document = assembler.assemble(results, manifest);
        System.err.println("[qa-migrate] IR assembled: "
                + document.tests().size() + " tests, "
                + document.suites().size() + " suites, "
                + document.targets().size() + " targets, "
                + document.environments().size() + " environments, "
                + document.data().size() + " data sets");
        return new PipelineResult(document, results, ordered);
    }

    // Forward slashes keep the IR identical across platforms.
    static String relativePath(Path base, Path file) {
        Path relative = file.startsWith(base) ? base.relativize(file) : file;
        return relative.toString().replace('\\', '/');
    }
}
