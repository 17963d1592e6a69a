package org.syntaxscript.compiler;

import org.syntaxscript.compiler.api.CompilationException;
import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.api.ICompiler;
import org.syntaxscript.compiler.backend.export.DeclarationExporter;
import org.syntaxscript.compiler.backend.export.ExportConverterRegistry;
import org.syntaxscript.compiler.backend.export.ExportedDescriptor;
import org.syntaxscript.compiler.backend.export.ExportedFunction;
import org.syntaxscript.compiler.backend.export.ExportedGlobal;
import org.syntaxscript.compiler.backend.export.ExportedOperator;
import org.syntaxscript.compiler.backend.pattern.OutputTemplate;
import org.syntaxscript.compiler.config.CompilerOptions;
import org.syntaxscript.compiler.diagnostics.CompilerLogger;
import org.syntaxscript.compiler.frontend.lexer.Lexer;
import org.syntaxscript.compiler.frontend.lexer.LexerMode;
import org.syntaxscript.compiler.frontend.lexer.Token;
import org.syntaxscript.compiler.frontend.parser.Parser;
import org.syntaxscript.compiler.frontend.parser.ast.ImportStatement;
import org.syntaxscript.compiler.frontend.parser.ast.ProgramStatement;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;
import org.syntaxscript.compiler.util.ImportPaths;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * The main compiler implementation. It orchestrates the phases of a compilation:
 * <ol>
 *     <li>Lexing: source text into tokens.</li>
 *     <li>Parsing: tokens into a {@link ProgramStatement}.</li>
 *     <li>Export: exported declarations into {@link ExportedDescriptor}s, cached per file.</li>
 *     <li>Generation: usage file bodies rewritten with the imported descriptors.</li>
 * </ol>
 * It is not thread-safe: the descriptor cache is shared by all calls on one instance.
 */
public class SyntaxScriptCompiler implements ICompiler {

    private final CompilerOptions options;
    private final DeclarationExporter exporter;
    private final Map<Path, List<ExportedDescriptor>> exportData = new HashMap<>();
    private int verbosity;

    /**
     * Constructs a compiler with the default export converters.
     * @param options The compiler options.
     */
    public SyntaxScriptCompiler(CompilerOptions options) {
        this.options = options;
        this.exporter = new DeclarationExporter(ExportConverterRegistry.initializeWithDefaults());
        this.verbosity = options.verbosity();
    }

    @Override
    public List<ExportedDescriptor> compileDeclaration(Path file, String content) throws CompilationException {
        applyVerbosity();
        String filePath = file.toString();

        List<Token> tokens = new Lexer(content, LexerMode.DECLARATION).scanTokens();
        CompilerLogger.trace(filePath, "lexed {} tokens", tokens.size());
        ProgramStatement program = new Parser(tokens, filePath, Parser.Grammar.DECLARATION).parse();

        List<ExportedDescriptor> descriptors = exporter.export(program, filePath);
        exportData.put(cacheKey(file), descriptors);
        CompilerLogger.info(filePath, "compiled declaration file with {} export(s)", descriptors.size());
        return descriptors;
    }

    @Override
    public String compileUsage(Path file, String content) throws CompilationException {
        applyVerbosity();
        String filePath = file.toString();

        List<Token> tokens = new Lexer(content, LexerMode.USAGE).scanTokens();
        ProgramStatement program = new Parser(tokens, filePath, Parser.Grammar.USAGE).parse();

        List<ExportedDescriptor> imported = resolveImports(file, program);
        String body = bodyOf(content, filePath);

        String format = options.format();
        Set<String> imports = new LinkedHashSet<>();
        for (ExportedDescriptor descriptor : imported) {
            if (descriptor instanceof ExportedOperator operator) {
                OutputTemplate template = operator.outputGenerators().get(format);
                if (template == null) {
                    throw new CompilationException(CompilerErrorCode.MISSING_TARGET_FORMAT,
                            "Can't compile operator to target language (" + format + ").");
                }
                body = operator.pattern().toPattern().matcher(body)
                        .replaceAll(match -> Matcher.quoteReplacement(template.render(match)));
                addImport(imports, operator.imports().get(format));
            } else if (descriptor instanceof ExportedFunction function) {
                String rename = function.formatNames().get(format);
                if (rename == null) {
                    throw new CompilationException(CompilerErrorCode.MISSING_TARGET_FORMAT,
                            "Can't compile function to target language (" + format + ").");
                }
                body = function.callPattern().matcher(body).replaceAll(match ->
                        Matcher.quoteReplacement(rename + match.group().substring(function.name().length())));
                addImport(imports, function.imports().get(format));
            }
        }

        CompilerLogger.info(filePath, "compiled usage file with {} imported declaration(s)", imported.size());
        if (imports.isEmpty()) {
            return body;
        }
        StringBuilder output = new StringBuilder();
        for (String module : imports) {
            if (output.length() > 0) {
                output.append('\n');
            }
            output.append("import ").append(module);
        }
        return output.append('\n').append(body).toString();
    }

    @Override
    public Path compileUsageToFile(Path file, String content) throws CompilationException {
        String output = compileUsage(file, content);
        Path target = outputPathFor(file);
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, output, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CompilationException(CompilerErrorCode.IO_ERROR, "Could not write '" + target + "': " + e.getMessage(), e);
        }
        CompilerLogger.debug(file.toString(), "wrote {}", target);
        return target;
    }

    @Override
    public Optional<List<ExportedDescriptor>> getExports(Path declarationFile) {
        return Optional.ofNullable(exportData.get(cacheKey(declarationFile)));
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    /**
     * Computes where the output of a usage file goes: its place below the root directory mirrored
     * below the output directory, with the target format as extension. Files outside the root
     * directory are placed directly in the output directory.
     * @param file The usage file.
     * @return The output path.
     */
    public Path outputPathFor(Path file) {
        Path root = options.rootDir().toAbsolutePath().normalize();
        Path source = file.toAbsolutePath().normalize();
        Path relative = source.startsWith(root) ? root.relativize(source) : source.getFileName();

        String name = relative.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String baseName = dot > 0 ? name.substring(0, dot) : name;
        return options.outDir().toAbsolutePath().normalize()
                .resolve(relative)
                .resolveSibling(baseName + "." + options.format());
    }

    private List<ExportedDescriptor> resolveImports(Path file, ProgramStatement program) throws CompilationException {
        String filePath = file.toString();
        List<ExportedDescriptor> imported = new ArrayList<>();
        Set<String> operatorPatterns = new HashSet<>();

        for (Statement statement : program.body()) {
            if (!(statement instanceof ImportStatement importStatement)) {
                continue;
            }
            Path target = ImportPaths.resolve(file, importStatement.path());
            List<ExportedDescriptor> exports = exportData.get(target);
            if (exports == null) {
                throw new CompilationException(CompilerErrorCode.UNRESOLVED_IMPORT,
                        "File '" + target + "' imported from '" + filePath + "' was not compiled.",
                        importStatement.range(), filePath);
            }
            for (ExportedDescriptor descriptor : flatten(exports)) {
                if (descriptor instanceof ExportedOperator operator && !operatorPatterns.add(operator.pattern().source())) {
                    throw new CompilationException(CompilerErrorCode.DUPLICATE_OPERATOR_IMPORT,
                            "There are more than one operators with the same syntax imported to '" + filePath + "'.",
                            importStatement.range(), filePath);
                }
                imported.add(descriptor);
            }
            CompilerLogger.debug(filePath, "imported {} export(s) from {}", exports.size(), target);
        }
        return imported;
    }

    private static List<ExportedDescriptor> flatten(List<ExportedDescriptor> descriptors) {
        List<ExportedDescriptor> flat = new ArrayList<>();
        for (ExportedDescriptor descriptor : descriptors) {
            if (descriptor instanceof ExportedGlobal global) {
                flat.addAll(flatten(global.members()));
            } else {
                flat.add(descriptor);
            }
        }
        return flat;
    }

    private static String bodyOf(String content, String filePath) {
        int marker = content.indexOf(Lexer.DEFINITION_END);
        if (marker < 0) {
            CompilerLogger.warn(filePath, "no '{}' marker, compiling an empty body", Lexer.DEFINITION_END);
            return "";
        }
        return content.substring(marker + Lexer.DEFINITION_END.length());
    }

    private static void addImport(Set<String> imports, String module) {
        if (module != null) {
            imports.add(module);
        }
    }

    private static Path cacheKey(Path file) {
        return file.toAbsolutePath().normalize();
    }

    private void applyVerbosity() {
        if (this.verbosity >= 0) {
            CompilerLogger.setLevel(this.verbosity);
        }
    }
}
