package org.syntaxscript.compiler.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A machine-applicable quick fix attached to a diagnostic or a parse error.
 *
 * @param title   The title shown to the user.
 * @param kind    The action kind, always {@link #QUICK_FIX} for actions produced by the compiler.
 * @param changes The edits to apply, keyed by the file they belong to.
 */
public record CodeAction(String title, String kind, Map<String, List<TextEdit>> changes) {

    /** The kind of every action the compiler offers. */
    public static final String QUICK_FIX = "quickfix";

    public CodeAction {
        changes = Map.copyOf(changes);
    }

    /**
     * Creates a quick fix consisting of a single edit in one file.
     * @param title The title of the fix.
     * @param file  The file the edit applies to.
     * @param edit  The edit.
     * @return The code action.
     */
    public static CodeAction quickFix(String title, String file, TextEdit edit) {
        return new CodeAction(title, QUICK_FIX, Map.of(file, List.of(edit)));
    }

    /**
     * @return This action with every edit range converted to 0-based coordinates.
     */
    public CodeAction toZeroBased() {
        Map<String, List<TextEdit>> converted = new LinkedHashMap<>();
        changes.forEach((file, edits) -> converted.put(file, edits.stream().map(TextEdit::toZeroBased).toList()));
        return new CodeAction(title, kind, converted);
    }
}
