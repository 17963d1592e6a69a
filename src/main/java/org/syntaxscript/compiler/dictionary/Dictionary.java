package org.syntaxscript.compiler.dictionary;

import org.syntaxscript.compiler.frontend.parser.ast.NodeType;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only registry of the rules, primitive types and node type sets the compiler knows about.
 */
public final class Dictionary {

    /** All known rules, in declaration order. */
    public static final List<RuleDefinition> RULES = List.of(
            new RuleDefinition("imports-keyword", RuleValueType.KEYWORD, "import", List.of(),
                    "Determines which keyword is used to import the modules declared in imports statements."),
            new RuleDefinition("function-value-return-enabled", RuleValueType.BOOLEAN, "false", List.of(),
                    "Determines whether a function can return a value using a keyword."),
            new RuleDefinition("function-value-return-keyword", RuleValueType.KEYWORD, "return", List.of(),
                    "Determines the keyword used to return a value from a function. Only has an effect when function-value-return-enabled is true."),
            new RuleDefinition("enforce-single-string-quotes", RuleValueType.BOOLEAN, "false", List.of("enforce-double-string-quotes"),
                    "Enforces single quotes around string values in the output."),
            new RuleDefinition("enforce-double-string-quotes", RuleValueType.BOOLEAN, "false", List.of("enforce-single-string-quotes"),
                    "Enforces double quotes around string values in the output.")
    );

    /** The names usable in {@code <type>} placeholders. */
    public static final List<String> PRIMITIVE_TYPES = Arrays.stream(PrimitiveType.values()).map(PrimitiveType::typeName).toList();

    /** The keywords that start statements. */
    public static final List<String> RESERVED_KEYWORDS = List.of("export", "rule", "keyword", "import", "imports", "operator", "function", "global", "compile", "class");

    /** Node types that may carry an {@code export} modifier. */
    public static final Set<NodeType> EXPORTABLE_NODE_TYPES = Collections.unmodifiableSet(
            EnumSet.of(NodeType.FUNCTION, NodeType.OPERATOR, NodeType.KEYWORD, NodeType.RULE, NodeType.GLOBAL));

    /** Node types whose statement has a body of nested statements. */
    public static final Set<NodeType> NODE_TYPES_WITH_BODY = Collections.unmodifiableSet(
            EnumSet.of(NodeType.OPERATOR, NodeType.FUNCTION, NodeType.GLOBAL));

    private Dictionary() {}

    /**
     * Looks up a rule by its exact name.
     * @param name The rule name.
     * @return The rule, or empty if no rule has that name.
     */
    public static Optional<RuleDefinition> findRule(String name) {
        return RULES.stream().filter(r -> r.name().equals(name)).findFirst();
    }

    /**
     * Checks whether two rules conflict. A conflict declared by either rule counts for both.
     * @param first  The name of the first rule.
     * @param second The name of the second rule.
     * @return {@code true} if the rules must not be set together.
     */
    public static boolean conflicting(String first, String second) {
        return declaresConflict(first, second) || declaresConflict(second, first);
    }

    private static boolean declaresConflict(String rule, String other) {
        return findRule(rule).map(r -> r.conflicts().contains(other)).orElse(false);
    }

    /**
     * @param type The node type.
     * @return {@code true} if statements of the type may be exported.
     */
    public static boolean isExportable(NodeType type) {
        return EXPORTABLE_NODE_TYPES.contains(type);
    }
}
