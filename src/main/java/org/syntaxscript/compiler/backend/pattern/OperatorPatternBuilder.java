package org.syntaxscript.compiler.backend.pattern;

import org.syntaxscript.compiler.dictionary.PrimitiveType;
import org.syntaxscript.compiler.frontend.parser.ast.Expression;
import org.syntaxscript.compiler.frontend.parser.ast.PrimitiveTypeExpression;
import org.syntaxscript.compiler.frontend.parser.ast.StringExpression;
import org.syntaxscript.compiler.frontend.parser.ast.WhitespaceIdentifierExpression;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Concatenates the fragments of an operator pattern into one regular expression.
 * <p>
 * Primitive types contribute their fixed pattern, {@code +s} contributes {@code \s*} and strings
 * contribute their escaped text. While concatenating, the builder counts the capture groups opened so far
 * to record which group each placeholder produced.
 */
public final class OperatorPatternBuilder {

    private static final String REGEX_METACHARACTERS = ".*+?^${}()|[]\\";

    private OperatorPatternBuilder() {}

    /**
     * Builds the pattern of an operator.
     * @param fragments The operator's pattern fragments in source order.
     * @return The compiled pattern with capture provenance.
     * @throws IllegalArgumentException if a fragment is of a kind patterns cannot contain.
     */
    public static CompiledPattern build(List<Expression> fragments) {
        StringBuilder source = new StringBuilder();
        List<CompiledPattern.Capture> captures = new ArrayList<>();
        Map<String, Integer> ordinals = new HashMap<>();
        int groups = 0;

        for (Expression fragment : fragments) {
            if (fragment instanceof PrimitiveTypeExpression placeholder) {
                PrimitiveType type = PrimitiveType.fromName(placeholder.value())
                        .orElseThrow(() -> new IllegalArgumentException("Unknown primitive type: " + placeholder.value()));
                int ordinal = ordinals.merge(type.typeName(), 1, Integer::sum) - 1;
                captures.add(new CompiledPattern.Capture(type.typeName(), ordinal, groups + 1));
                groups += type.groupCount();
                source.append(type.pattern());
            } else if (fragment instanceof WhitespaceIdentifierExpression) {
                source.append(PrimitiveType.WHITESPACE_PATTERN);
            } else if (fragment instanceof StringExpression literal) {
                source.append(escape(literal.value()));
            } else {
                throw new IllegalArgumentException("Expression cannot be part of an operator pattern: " + fragment.type());
            }
        }
        return new CompiledPattern(source.toString(), captures);
    }

    /**
     * Escapes every regular expression metacharacter of a literal with a backslash.
     * @param literal The literal text.
     * @return The escaped text, matching the literal exactly.
     */
    public static String escape(String literal) {
        StringBuilder escaped = new StringBuilder(literal.length());
        for (char c : literal.toCharArray()) {
            if (REGEX_METACHARACTERS.indexOf(c) >= 0) escaped.append('\\');
            escaped.append(c);
        }
        return escaped.toString();
    }
}
