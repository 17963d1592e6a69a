package org.syntaxscript.compiler.api;

/**
 * A half-open region of a source file, from {@code start} up to {@code end}.
 *
 * @param start The first position covered by the range.
 * @param end   The position right after the last covered character.
 */
public record SourceRange(SourcePosition start, SourcePosition end) {

    /** The empty range at the origin, used when no better location is known. */
    public static final SourceRange ORIGIN = new SourceRange(new SourcePosition(0, 0), new SourcePosition(0, 0));

    public SourceRange {
        if (start.compareTo(end) > 0) {
            throw new IllegalArgumentException("Range start " + start + " is after its end " + end);
        }
    }

    /**
     * Creates a range on a single line.
     * @param line  The line number.
     * @param from  The first character.
     * @param to    The character after the last one.
     * @return The range.
     */
    public static SourceRange of(int line, int from, int to) {
        return new SourceRange(new SourcePosition(line, from), new SourcePosition(line, to));
    }

    /**
     * Combines the start of the first range with the end of the second.
     * @param starter The range providing the start.
     * @param ender   The range providing the end.
     * @return The combined range.
     */
    public static SourceRange span(SourceRange starter, SourceRange ender) {
        return new SourceRange(starter.start(), ender.end());
    }

    /**
     * Returns a copy whose end is moved by the given number of characters.
     * @param characters The number of characters to add to the end.
     * @return The extended range.
     */
    public SourceRange extendEnd(int characters) {
        return new SourceRange(start, end.shift(characters));
    }

    /**
     * @return This range with both ends converted to 0-based coordinates.
     */
    public SourceRange toZeroBased() {
        return new SourceRange(start.toZeroBased(), end.toZeroBased());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
