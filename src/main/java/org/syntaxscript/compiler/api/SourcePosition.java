package org.syntaxscript.compiler.api;

/**
 * A position inside a source file.
 * <p>
 * Inside the compiler positions are 1-based. Diagnostics handed to editors are converted
 * with {@link #toZeroBased()}.
 *
 * @param line      The line number.
 * @param character The character offset within the line.
 */
public record SourcePosition(int line, int character) implements Comparable<SourcePosition> {

    /**
     * Returns a copy of this position moved by the given number of characters on the same line.
     * @param delta The number of characters to move, may be negative.
     * @return The shifted position.
     */
    public SourcePosition shift(int delta) {
        return new SourcePosition(line, character + delta);
    }

    /**
     * Converts a 1-based position into the 0-based form used by language clients.
     * Coordinates that are already zero stay at zero.
     * @return The 0-based position.
     */
    public SourcePosition toZeroBased() {
        return new SourcePosition(Math.max(0, line - 1), Math.max(0, character - 1));
    }

    @Override
    public int compareTo(SourcePosition other) {
        if (line != other.line) return Integer.compare(line, other.line);
        return Integer.compare(character, other.character);
    }

    @Override
    public String toString() {
        return line + ":" + character;
    }
}
