package org.tabula.report;

import org.tabula.indent.IndentStyle;

/**
 * Builds the text of indentation violations, e.g.
 * {@code Expected indentation of 4 spaces but found 2.}
 */
public final class ViolationMessages {

    private ViolationMessages() {}

    /**
     * @param style The expected indentation unit.
     * @param expectedWidth The expected number of indentation characters.
     * @param actualSpaces The number of spaces found.
     * @param actualTabs The number of tabs found.
     * @return The message. The found count omits its unit when it is the expected one.
     */
    public static String create(IndentStyle style, int expectedWidth, int actualSpaces, int actualTabs) {
        String expected = expectedWidth + " " + plural(style.unitName(), expectedWidth);
        String found;
        if (actualSpaces > 0) {
            found = style.usesTabs() ? actualSpaces + " " + plural("space", actualSpaces) : Integer.toString(actualSpaces);
        } else if (actualTabs > 0) {
            found = style.usesTabs() ? Integer.toString(actualTabs) : actualTabs + " " + plural("tab", actualTabs);
        } else {
            found = "0";
        }
        return "Expected indentation of " + expected + " but found " + found + ".";
    }

    private static String plural(String word, int count) {
        return count == 1 ? word : word + "s";
    }
}
