package org.portlang.compiler.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface of the portfolio compiler.
 */
public interface ICompiler {

    /**
     * Compiles the given source text. Every problem found in the source is reported as a
     * diagnostic in the result; this method does not throw for malformed input.
     *
     * @param source The complete portfolio source.
     * @return The parsed document (if any) together with all diagnostics.
     */
    CompilationResult compile(String source);

    /**
     * Compiles the portfolio source stored in a UTF-8 file.
     *
     * @param sourceFile The path to the source file.
     * @return The compilation result.
     * @throws CompilationException if the file cannot be read.
     */
    default CompilationResult compileFile(Path sourceFile) throws CompilationException {
        return compile(readSource(sourceFile));
    }

    /**
     * Reads a UTF-8 portfolio source file.
     *
     * @param sourceFile The path to the source file.
     * @return The file content.
     * @throws CompilationException if the file cannot be read.
     */
    static String readSource(Path sourceFile) throws CompilationException {
        try {
            return Files.readString(sourceFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CompilationException("Cannot read portfolio source " + sourceFile, e);
        }
    }
}
