package org.syntaxscript.compiler.dictionary;

import java.util.List;

/**
 * A rule known to the compiler.
 *
 * @param name         The rule name as written in {@code rule 'name': value;}.
 * @param valueType    The kind of value the rule takes.
 * @param defaultValue The value used when a file does not set the rule.
 * @param conflicts    The names of rules that must not be set together with this one.
 * @param description  A human-readable description.
 */
public record RuleDefinition(
        String name,
        RuleValueType valueType,
        String defaultValue,
        List<String> conflicts,
        String description
) {
    public RuleDefinition {
        conflicts = List.copyOf(conflicts);
    }
}
