package org.syntaxscript.compiler;

import org.syntaxscript.compiler.api.CompilationException;
import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.api.ParseException;
import org.syntaxscript.compiler.backend.export.ExportType;
import org.syntaxscript.compiler.backend.export.ExportedDescriptor;
import org.syntaxscript.compiler.config.CompilerOptions;
import org.syntaxscript.compiler.diagnostics.CompilerLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * End-to-end tests for the {@link SyntaxScriptCompiler}: declaration files are compiled into the
 * descriptor cache, then usage files importing them are rewritten into the target format.
 */
public class SyntaxScriptCompilerTest {

    private static final String ADDITION = String.join("\n",
            "export operator <int> +s '+' +s <int> {",
            "    compile(ts) int|0 +s '+' +s int|1;",
            "}");

    @TempDir
    Path tempDir;

    private Path src;
    private SyntaxScriptCompiler compiler;

    @BeforeEach
    void setUp() {
        src = tempDir.resolve("src");
        compiler = new SyntaxScriptCompiler(new CompilerOptions(src, tempDir.resolve("out"), "ts", CompilerLogger.WARN));
    }

    /**
     * Verifies that an imported addition operator rewrites the usage body and that no import line
     * is added when the operator needs no module.
     */
    @Test
    @Tag("integration")
    void testOperatorRewritesBody() throws CompilationException {
        // Arrange
        compiler.compileDeclaration(src.resolve("math.syx"), ADDITION);

        // Act
        String output = compiler.compileUsage(src.resolve("main.sys"), "import './math';:::3+4");

        // Assert
        assertThat(output).isEqualTo("3 + 4");
    }

    /**
     * Verifies that required modules are prepended once each, in the order they are first needed.
     */
    @Test
    @Tag("integration")
    void testImportsArePrepended() throws CompilationException {
        // Arrange
        String declarations = String.join("\n",
                "export operator <int> '**' <int> {",
                "    compile(ts) 'pow(' int|0 ', ' int|1 ')';",
                "    imports(ts) './ops';",
                "}",
                "export function randomizer <int> <int> {",
                "    compile(ts) 'Random.between';",
                "    imports(ts) './random';",
                "}",
                "export operator <int> '%%' <int> {",
                "    compile(ts) 'mod(' int|0 ', ' int|1 ')';",
                "    imports(ts) './ops';",
                "}");
        compiler.compileDeclaration(src.resolve("lib.syx"), declarations);

        // Act
        String output = compiler.compileUsage(src.resolve("main.sys"),
                "import './lib';\n:::\nlet x = 2**3 + randomizer(1,6) + 7%%2;");

        // Assert
        assertThat(output).isEqualTo(String.join("\n",
                "import ./ops",
                "import ./random",
                "",
                "let x = pow(2, 3) + Random.between(1,6) + mod(7, 2);"));
    }

    /**
     * Verifies that a function call is renamed only when its arguments match without whitespace.
     */
    @Test
    @Tag("integration")
    void testFunctionRename() throws CompilationException {
        // Arrange
        compiler.compileDeclaration(src.resolve("io.syx"), "export function print <string> { compile(ts) 'console.log'; }");

        // Act
        String output = compiler.compileUsage(src.resolve("main.sys"),
                "import './io';:::print('hi'); print( 'spaced' );");

        // Assert
        assertThat(output).isEqualTo("console.log('hi'); print( 'spaced' );");
    }

    /**
     * Verifies that the members of an exported global are applied.
     */
    @Test
    @Tag("integration")
    void testGlobalMembersAreApplied() throws CompilationException {
        // Arrange
        String declarations = String.join("\n",
                "export global numbers {",
                "    export operator <int> '!' { compile(ts) 'fact(' int|0 ')'; }",
                "}");
        compiler.compileDeclaration(src.resolve("numbers.syx"), declarations);

        // Act
        String output = compiler.compileUsage(src.resolve("main.sys"), "import './numbers';:::5!");

        // Assert
        assertThat(output).isEqualTo("fact(5)");
    }

    /**
     * Verifies that replacement text is inserted literally, even when it contains group reference syntax.
     */
    @Test
    @Tag("integration")
    void testReplacementIsLiteral() throws CompilationException {
        // Arrange
        compiler.compileDeclaration(src.resolve("money.syx"), "export operator <int> 'usd' { compile(ts) '$1' int|0; }");

        // Act
        String output = compiler.compileUsage(src.resolve("main.sys"), "import './money';:::5usd");

        // Assert
        assertThat(output).isEqualTo("$15");
    }

    /**
     * Verifies that importing a declaration file that has not been compiled fails.
     */
    @Test
    @Tag("integration")
    void testUncompiledImport() {
        // Act
        CompilationException error = catchThrowableOfType(
                () -> compiler.compileUsage(src.resolve("main.sys"), "import './math';:::3+4"), CompilationException.class);

        // Assert
        assertThat(error.getCode()).isEqualTo(CompilerErrorCode.UNRESOLVED_IMPORT);
        assertThat(error.getMessage()).contains("math.syx");
    }

    /**
     * Verifies that two imported operators with the same pattern are rejected.
     */
    @Test
    @Tag("integration")
    void testDuplicateOperatorImport() throws CompilationException {
        // Arrange
        compiler.compileDeclaration(src.resolve("a.syx"), ADDITION);
        compiler.compileDeclaration(src.resolve("b.syx"), ADDITION);

        // Act
        CompilationException error = catchThrowableOfType(
                () -> compiler.compileUsage(src.resolve("main.sys"), "import './a';\nimport './b';:::3+4"),
                CompilationException.class);

        // Assert
        assertThat(error.getCode()).isEqualTo(CompilerErrorCode.DUPLICATE_OPERATOR_IMPORT);
    }

    /**
     * Verifies that an operator without output for the target format cannot be applied.
     */
    @Test
    @Tag("integration")
    void testMissingTargetFormat() throws CompilationException {
        // Arrange
        compiler.compileDeclaration(src.resolve("math.syx"), "export operator <int> '!' { compile(js) int|0; }");

        // Act & Assert
        assertThatThrownBy(() -> compiler.compileUsage(src.resolve("main.sys"), "import './math';:::1!"))
                .isInstanceOf(CompilationException.class)
                .hasMessage("Can't compile operator to target language (ts).");
    }

    /**
     * Verifies that a function without a rename for the target format cannot be applied.
     */
    @Test
    @Tag("integration")
    void testMissingFunctionTargetFormat() throws CompilationException {
        // Arrange
        compiler.compileDeclaration(src.resolve("io.syx"), "export function print <string> { compile(js) 'console.log'; }");

        // Act
        CompilationException error = catchThrowableOfType(
                () -> compiler.compileUsage(src.resolve("main.sys"), "import './io';:::print('hi');"), CompilationException.class);

        // Assert
        assertThat(error.getCode()).isEqualTo(CompilerErrorCode.MISSING_TARGET_FORMAT);
        assertThat(error.getMessage()).isEqualTo("Can't compile function to target language (ts).");
    }

    /**
     * Verifies that an import of a dotted file name gets the declaration extension appended.
     */
    @Test
    @Tag("integration")
    void testDottedImportName() throws CompilationException {
        // Arrange
        compiler.compileDeclaration(src.resolve("math.v2.syx"), "export operator <int> '!' { compile(ts) 'fact(' int|0 ')'; }");

        // Act
        String output = compiler.compileUsage(src.resolve("main.sys"), "import './math.v2';:::5!");

        // Assert
        assertThat(output).isEqualTo("fact(5)");
    }

    /**
     * Verifies that a declaration file read from disk is compiled and cached under its path.
     */
    @Test
    @Tag("integration")
    void testCompileDeclarationFromDisk() throws CompilationException, IOException {
        // Arrange
        Path declaration = src.resolve("words.syx");
        Files.createDirectories(src);
        Files.writeString(declaration, "export keyword ruleish;");

        // Act
        List<ExportedDescriptor> exports = compiler.compileDeclaration(declaration);

        // Assert
        assertThat(exports).extracting(ExportedDescriptor::exportType).containsExactly(ExportType.KEYWORD);
        assertThat(compiler.getExports(declaration)).contains(exports);
        assertThatThrownBy(() -> compiler.compileDeclaration(src.resolve("missing.syx")))
                .isInstanceOf(IOException.class);
    }

    /**
     * Verifies that a usage file without definition end marker compiles to an empty body.
     */
    @Test
    @Tag("integration")
    void testMissingDefinitionEnd() throws CompilationException {
        // Arrange
        compiler.compileDeclaration(src.resolve("math.syx"), ADDITION);

        // Act
        String output = compiler.compileUsage(src.resolve("main.sys"), "import './math';");

        // Assert
        assertThat(output).isEmpty();
    }

    /**
     * Verifies that parse errors propagate to the caller.
     */
    @Test
    @Tag("integration")
    void testParseErrorPropagates() {
        assertThatThrownBy(() -> compiler.compileDeclaration(src.resolve("bad.syx"), "keyword a"))
                .isInstanceOf(ParseException.class);
    }

    /**
     * Verifies the descriptor cache: lookups by equivalent paths hit, recompiling replaces the entry.
     */
    @Test
    @Tag("integration")
    void testExportCache() throws CompilationException {
        // Arrange
        Path file = src.resolve("words.syx");

        // Act
        compiler.compileDeclaration(file, "export keyword a;");
        compiler.compileDeclaration(src.resolve("sub/../words.syx"), "export keyword a;\nexport keyword b;");

        // Assert
        assertThat(compiler.getExports(file)).hasValueSatisfying(exports -> assertThat(exports).hasSize(2));
        assertThat(compiler.getExports(src.resolve("other.syx"))).isEmpty();
    }

    /**
     * Verifies that the output mirrors the usage file's place below the root directory and gets the
     * format as extension.
     */
    @Test
    @Tag("integration")
    void testCompileUsageToFile() throws CompilationException, IOException {
        // Arrange
        compiler.compileDeclaration(src.resolve("math.syx"), ADDITION);
        Path usage = src.resolve("nested/main.sys");
        Files.createDirectories(usage.getParent());
        Files.writeString(usage, "import '../math';\n:::\n1+2");

        // Act
        Path written = compiler.compileUsageToFile(usage);

        // Assert
        assertThat(written).isEqualTo(tempDir.resolve("out/nested/main.ts").toAbsolutePath().normalize());
        assertThat(Files.readString(written)).isEqualTo("\n1 + 2");
    }

    /**
     * Verifies that files outside the root directory are written directly into the output directory.
     */
    @Test
    @Tag("unit")
    void testOutputPathOutsideRoot() {
        assertThat(compiler.outputPathFor(tempDir.resolve("elsewhere/main.sys")))
                .isEqualTo(tempDir.resolve("out/main.ts").toAbsolutePath().normalize());
    }

    /**
     * Verifies that compiling the same inputs twice yields identical output.
     */
    @Test
    @Tag("integration")
    void testCompilationIsRepeatable() throws CompilationException {
        // Arrange
        String usage = "import './math';\n:::\nconst a = 1+2;\nconst b = 30 + 12;\n";

        // Act
        List<ExportedDescriptor> first = compiler.compileDeclaration(src.resolve("math.syx"), ADDITION);
        String firstOutput = compiler.compileUsage(src.resolve("main.sys"), usage);
        SyntaxScriptCompiler fresh = new SyntaxScriptCompiler(new CompilerOptions(src, tempDir.resolve("out"), "ts", -1));
        fresh.compileDeclaration(src.resolve("math.syx"), ADDITION);
        String secondOutput = fresh.compileUsage(src.resolve("main.sys"), usage);

        // Assert
        assertThat(first).extracting(ExportedDescriptor::exportType).containsExactly(ExportType.OPERATOR);
        assertThat(secondOutput).isEqualTo(firstOutput).isEqualTo("\nconst a = 1 + 2;\nconst b = 30 + 12;\n");
    }
}
