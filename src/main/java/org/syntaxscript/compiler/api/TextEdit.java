package org.syntaxscript.compiler.api;

/**
 * A textual replacement of a source range.
 *
 * @param range   The range to replace.
 * @param newText The replacement text; empty to delete the range.
 */
public record TextEdit(SourceRange range, String newText) {

    /**
     * Creates an edit deleting the given range.
     * @param range The range to delete.
     * @return The edit.
     */
    public static TextEdit delete(SourceRange range) {
        return new TextEdit(range, "");
    }

    /**
     * @return This edit with its range converted to 0-based coordinates.
     */
    public TextEdit toZeroBased() {
        return new TextEdit(range.toZeroBased(), newText);
    }
}
