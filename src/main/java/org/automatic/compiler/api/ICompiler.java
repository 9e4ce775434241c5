package org.automatic.compiler.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public, clean interface for the autoMATic compiler.
 */
public interface ICompiler {

    /**
     * Compiles the given source code.
     *
     * @param source The text of the main unit.
     * @param programName The logical name of the main unit, used in diagnostics and for relative includes.
     * @return A {@link ProgramArtifact} containing the generated IR module.
     * @throws CompilationException if an error aborts the compilation.
     */
    ProgramArtifact compile(String source, String programName) throws CompilationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=ERROR up to 4=TRACE).
     */
    void setVerbosity(int level);

    /**
     * Compiles the source code from a file.
     * @param programPath The path to the main source file.
     * @return A {@link ProgramArtifact} containing the generated IR module.
     * @throws CompilationException if an error aborts the compilation.
     * @throws IOException if the file cannot be read.
     */
    default ProgramArtifact compile(Path programPath) throws CompilationException, IOException {
        String source = String.join("\n", Files.readAllLines(programPath, StandardCharsets.UTF_8)) + "\n";
        return compile(source, programPath.toString().replace('\\', '/'));
    }
}
