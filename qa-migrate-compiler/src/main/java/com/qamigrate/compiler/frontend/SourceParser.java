package com.qamigrate.compiler.frontend;

import java.nio.file.Path;

/**
 * Turns one source file into a language-native parse tree.
 *
 * @param <T> parse tree type of the front end
 */
public interface SourceParser<T> {

    /**
     * @throws RuntimeException describing the file and the syntax problems when the file cannot be parsed
     */
    T parse(Path sourceFile);
}
