package org.syntaxscript.compiler.api;

import org.syntaxscript.compiler.backend.export.ExportedDescriptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Defines the public interface of the Syntax Script compiler.
 * <p>
 * Declaration files must be compiled before the usage files importing them: usage compilation reads
 * imported descriptors from the compiler's cache only.
 */
public interface ICompiler {

    /**
     * Compiles a declaration file and stores its descriptors, replacing an earlier entry for the same file.
     *
     * @param file    The path of the declaration file.
     * @param content The file content.
     * @return The descriptors of the exported statements, in source order.
     * @throws CompilationException if the file does not parse or an export cannot be compiled.
     */
    List<ExportedDescriptor> compileDeclaration(Path file, String content) throws CompilationException;

    /**
     * Compiles a usage file into the configured target format.
     *
     * @param file    The path of the usage file, used to resolve its imports.
     * @param content The file content.
     * @return The generated text.
     * @throws CompilationException if the file does not parse, an import is unresolved or ambiguous,
     *                              or an imported declaration has no output for the target format.
     */
    String compileUsage(Path file, String content) throws CompilationException;

    /**
     * Compiles a usage file and writes the result below the output directory.
     *
     * @param file    The path of the usage file.
     * @param content The file content.
     * @return The path of the written file.
     * @throws CompilationException if compilation fails or the output cannot be written.
     */
    Path compileUsageToFile(Path file, String content) throws CompilationException;

    /**
     * Returns the cached descriptors of a declaration file.
     *
     * @param declarationFile The path of the declaration file.
     * @return The descriptors, or empty if the file has not been compiled.
     */
    Optional<List<ExportedDescriptor>> getExports(Path declarationFile);

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE).
     */
    void setVerbosity(int level);

    /**
     * Compiles a declaration file read from disk.
     * @param file The path of the declaration file.
     * @return The descriptors of the exported statements.
     * @throws CompilationException if compilation fails.
     * @throws IOException if the file cannot be read.
     */
    default List<ExportedDescriptor> compileDeclaration(Path file) throws CompilationException, IOException {
        return compileDeclaration(file, Files.readString(file));
    }

    /**
     * Compiles a usage file read from disk and writes the result.
     * @param file The path of the usage file.
     * @return The path of the written file.
     * @throws CompilationException if compilation fails.
     * @throws IOException if the file cannot be read.
     */
    default Path compileUsageToFile(Path file) throws CompilationException, IOException {
        return compileUsageToFile(file, Files.readString(file));
    }
}
