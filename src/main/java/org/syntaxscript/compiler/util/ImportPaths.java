package org.syntaxscript.compiler.util;

import java.net.URI;
import java.nio.file.Path;

/**
 * Resolution of {@code import} paths, shared by the unresolved-import check and the compiler.
 */
public final class ImportPaths {

    /** The extension of declaration files. */
    public static final String DECLARATION_EXTENSION = ".syx";

    private ImportPaths() {}

    /**
     * Converts a file reference to a path. Editors hand over {@code file:} URIs, build tools plain paths.
     * @param file The file reference.
     * @return The path.
     */
    public static Path toPath(String file) {
        if (file.startsWith("file:")) {
            return Path.of(URI.create(file));
        }
        return Path.of(file);
    }

    /**
     * Resolves an import path relative to the directory of the importing file. {@code .syx} is appended
     * unless the path already ends with it, so {@code ./math.v2} names {@code math.v2.syx}.
     * @param importingFile The file containing the import.
     * @param importPath    The path as written in the import statement.
     * @return The absolute, normalized path of the imported file.
     */
    public static Path resolve(Path importingFile, String importPath) {
        String withExtension = importPath.endsWith(DECLARATION_EXTENSION) ? importPath : importPath + DECLARATION_EXTENSION;
        Path directory = importingFile.toAbsolutePath().getParent();
        return directory.resolve(withExtension).normalize();
    }

}
