package org.kaleido.compiler.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public, clean interface of the Kaleido front end.
 */
public interface IFrontEnd {

    /**
     * Reads the given source code into top-level items.
     *
     * @param sourceLines A list of strings representing the lines of the source code.
     * @param programName A name for the program, used in diagnostics.
     * @return A {@link ParsedProgram} holding the items in source order.
     * @throws CompilationException if the source contains lexical or syntax errors.
     */
    ParsedProgram parse(List<String> sourceLines, String programName) throws CompilationException;

    /**
     * Reads the source code from a file.
     * @param programPath The path to the source file.
     * @return A {@link ParsedProgram} holding the items in source order.
     * @throws CompilationException if the source contains lexical or syntax errors.
     * @throws IOException if the file cannot be read.
     */
    default ParsedProgram parse(Path programPath) throws CompilationException, IOException {
        return parse(Files.readAllLines(programPath), programPath.toString().replace('\\', '/'));
    }
}
