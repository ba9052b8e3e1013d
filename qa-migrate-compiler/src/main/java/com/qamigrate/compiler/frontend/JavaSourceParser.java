package com.qamigrate.compiler.frontend;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * Parses Java source files with JavaParser. No symbol resolution is configured; the
 * canonical AST only needs syntax.
 */
public class JavaSourceParser implements SourceParser<CompilationUnit> {

    public static class SourceParseException extends RuntimeException {
        public SourceParseException(String message) { super(message); }
        public SourceParseException(String message, Throwable cause) { super(message, cause); }
    }

    private final JavaParser parser;

    public JavaSourceParser() {
        ParserConfiguration config = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setCharacterEncoding(StandardCharsets.UTF_8);
        this.parser = new JavaParser(config);
    }

    @Override
    public CompilationUnit parse(Path sourceFile) {
        String source;
        try {
            source = Files.readString(sourceFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceParseException("Could not read " + sourceFile + ": " + e.getMessage(), e);
        }
        return parse(source, sourceFile);
    }

    /** Parses in-memory source; {@code origin} is only used in error messages. */
    public CompilationUnit parse(String source, Path origin) {
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .collect(Collectors.joining("; "));
            throw new SourceParseException("Failed to parse " + origin + ": " + problems);
        }
        return result.getResult().get();
    }
}
