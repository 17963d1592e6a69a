package org.syntaxscript.compiler.backend.pattern;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The regular expression an operator compiles to, together with the provenance of its capture groups.
 * <p>
 * Two operators are considered duplicates when their {@link #source()} strings are equal.
 *
 * @param source   The regular expression source.
 * @param captures One entry per {@code <type>} placeholder, in source order.
 */
public record CompiledPattern(String source, List<Capture> captures) {

    /**
     * The capture group a {@code <type>} placeholder produced.
     *
     * @param typeName The primitive type of the placeholder.
     * @param ordinal  The 0-based index among the placeholders of the same type.
     * @param group    The capture group number in the compiled pattern.
     */
    public record Capture(String typeName, int ordinal, int group) {
    }

    public CompiledPattern {
        captures = List.copyOf(captures);
    }

    /**
     * Looks up the capture referenced by {@code typeName|ordinal} in a compile template.
     * @param typeName The primitive type name.
     * @param ordinal  The index among the placeholders of that type.
     * @return The capture, or empty if the pattern has no such placeholder.
     */
    public Optional<Capture> find(String typeName, int ordinal) {
        return captures.stream()
                .filter(c -> c.typeName().equals(typeName) && c.ordinal() == ordinal)
                .findFirst();
    }

    /**
     * @return The compiled {@link Pattern}.
     */
    public Pattern toPattern() {
        return Pattern.compile(source);
    }
}
