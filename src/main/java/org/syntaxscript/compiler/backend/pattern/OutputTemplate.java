package org.syntaxscript.compiler.backend.pattern;

import org.syntaxscript.compiler.api.CompilationException;
import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.frontend.parser.ast.CompileStatement;
import org.syntaxscript.compiler.frontend.parser.ast.Expression;
import org.syntaxscript.compiler.frontend.parser.ast.StringExpression;
import org.syntaxscript.compiler.frontend.parser.ast.VariableExpression;
import org.syntaxscript.compiler.frontend.parser.ast.WhitespaceIdentifierExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.MatchResult;

/**
 * The output generator of an operator for one target format.
 * <p>
 * Capture references are resolved against the operator's {@link CompiledPattern} when the template is
 * built, so rendering only reads groups of the original match.
 */
public final class OutputTemplate {

    private sealed interface Part permits Literal, Group {}

    private record Literal(String text) implements Part {}

    private record Group(int number) implements Part {}

    private final List<Part> parts;

    private OutputTemplate(List<Part> parts) {
        this.parts = List.copyOf(parts);
    }

    /**
     * Builds the template of a compile statement.
     * @param statement The compile statement.
     * @param pattern   The pattern of the operator owning the statement.
     * @param filePath  The declaration file, used in errors.
     * @return The template.
     * @throws CompilationException if the template references a capture the pattern does not have.
     */
    public static OutputTemplate of(CompileStatement statement, CompiledPattern pattern, String filePath) throws CompilationException {
        List<Part> parts = new ArrayList<>();
        for (Expression expression : statement.body()) {
            if (expression instanceof StringExpression string) {
                parts.add(new Literal(string.value()));
            } else if (expression instanceof WhitespaceIdentifierExpression) {
                parts.add(new Literal(" "));
            } else if (expression instanceof VariableExpression variable) {
                CompiledPattern.Capture capture = pattern.find(variable.value(), variable.index()).orElseThrow(() ->
                        new CompilationException(CompilerErrorCode.UNKNOWN_CAPTURE,
                                "Unknown capture '" + variable.value() + "|" + variable.index() + "' in compile statement.",
                                variable.range(), filePath));
                parts.add(new Group(capture.group()));
            } else {
                throw new CompilationException(CompilerErrorCode.UNKNOWN_CAPTURE,
                        "Unexpected expression in compile statement: '" + expression.value() + "'.", expression.range(), filePath);
            }
        }
        return new OutputTemplate(parts);
    }

    /**
     * Renders the template for one match of the operator pattern.
     * @param match The match.
     * @return The generated text.
     */
    public String render(MatchResult match) {
        StringBuilder out = new StringBuilder();
        for (Part part : parts) {
            if (part instanceof Literal literal) {
                out.append(literal.text());
            } else if (part instanceof Group group) {
                out.append(Objects.toString(match.group(group.number()), ""));
            }
        }
        return out.toString();
    }
}
