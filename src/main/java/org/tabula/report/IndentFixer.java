package org.tabula.report;

import org.tabula.api.IndentViolation;
import org.tabula.api.TextEdit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies the fixes of indentation violations to a text.
 */
public final class IndentFixer {

    private IndentFixer() {}

    /**
     * @param source The original text.
     * @param violations The violations found in it.
     * @return The text with every violation's fix applied.
     */
    public static String fix(String source, List<IndentViolation> violations) {
        List<TextEdit> edits = new ArrayList<>(violations.size());
        for (IndentViolation violation : violations) {
            edits.add(violation.fix());
        }
        return apply(source, edits);
    }

    /**
     * Applies non-overlapping edits.
     * @param source The original text.
     * @param edits Edits with offsets into the original text, in any order.
     * @return The edited text.
     * @throws IllegalArgumentException if two edits overlap or an edit lies outside the text.
     */
    public static String apply(String source, List<TextEdit> edits) {
        List<TextEdit> sorted = new ArrayList<>(edits);
        sorted.sort(Comparator.comparingInt(TextEdit::start).thenComparingInt(TextEdit::end));

        StringBuilder result = new StringBuilder(source.length());
        int copied = 0;
        for (TextEdit edit : sorted) {
            if (edit.start() < copied) {
                throw new IllegalArgumentException("Overlapping edit at offset " + edit.start());
            }
            if (edit.end() > source.length()) {
                throw new IllegalArgumentException("Edit beyond the end of the text: " + edit);
            }
            result.append(source, copied, edit.start()).append(edit.replacement());
            copied = edit.end();
        }
        result.append(source, copied, source.length());
        return result.toString();
    }
}
