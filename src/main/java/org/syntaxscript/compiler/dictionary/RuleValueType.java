package org.syntaxscript.compiler.dictionary;

import java.util.regex.Pattern;

/**
 * The kind of value a rule accepts.
 */
public enum RuleValueType {
    /** {@code true} or {@code false}. */
    BOOLEAN(Pattern.compile("^(true|false)$")),
    /** The word of a keyword declared in the same file. */
    KEYWORD(Pattern.compile("^[a-zA-Z]+$"));

    private final Pattern valuePattern;

    RuleValueType(Pattern valuePattern) {
        this.valuePattern = valuePattern;
    }

    /**
     * Checks the shape of a value. Keyword values must additionally name a declared keyword.
     * @param value The value as written.
     * @return {@code true} if the value has the right shape.
     */
    public boolean accepts(String value) {
        return valuePattern.matcher(value).matches();
    }
}
