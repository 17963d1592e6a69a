package org.syntaxscript.compiler.dictionary;

import java.util.Arrays;
import java.util.Optional;

/**
 * The primitive types usable in {@code <type>} placeholders, with the pattern each one matches.
 */
public enum PrimitiveType {
    INT("int", "([0-9]+)", 1),
    STRING("string", "('[\\u0000-\\uffff]*'|\"[\\u0000-\\uffff]*\")", 1),
    BOOLEAN("boolean", "(true|false)", 1),
    DECIMAL("decimal", "([0-9]+(\\.[0-9]+)?)", 2);

    /** The pattern a {@code +s} whitespace identifier stands for. */
    public static final String WHITESPACE_PATTERN = "\\s*";

    private final String typeName;
    private final String pattern;
    private final int groupCount;

    PrimitiveType(String typeName, String pattern, int groupCount) {
        this.typeName = typeName;
        this.pattern = pattern;
        this.groupCount = groupCount;
    }

    /**
     * @return The name written between the diamonds.
     */
    public String typeName() {
        return typeName;
    }

    /**
     * @return The regular expression source of the type. The whole value is capture group 1 of the pattern.
     */
    public String pattern() {
        return pattern;
    }

    /**
     * @return The number of capture groups the pattern opens.
     */
    public int groupCount() {
        return groupCount;
    }

    /**
     * Looks up a primitive type by name.
     * @param name The type name, case-sensitive.
     * @return The type, or empty if the name is not a primitive type.
     */
    public static Optional<PrimitiveType> fromName(String name) {
        return Arrays.stream(values()).filter(t -> t.typeName.equals(name)).findFirst();
    }
}
