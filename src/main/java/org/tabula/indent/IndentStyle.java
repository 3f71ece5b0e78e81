package org.tabula.indent;

/**
 * The unit of indentation: a character and how many of them make up one level.
 *
 * @param unitChar Either a space or a tab.
 * @param unitSize The number of characters per level, at least 1.
 */
public record IndentStyle(char unitChar, int unitSize) {

    public IndentStyle {
        if (unitChar != ' ' && unitChar != '\t') {
            throw new IllegalArgumentException("Indentation must use spaces or tabs.");
        }
        if (unitSize < 1) {
            throw new IllegalArgumentException("Indentation size must be positive: " + unitSize);
        }
    }

    /**
     * @param size The number of spaces per level.
     * @return A space based style.
     */
    public static IndentStyle spaces(int size) {
        return new IndentStyle(' ', size);
    }

    /**
     * @return One tab per level.
     */
    public static IndentStyle tabs() {
        return new IndentStyle('\t', 1);
    }

    public boolean usesTabs() {
        return unitChar == '\t';
    }

    /**
     * @param width The number of unit characters.
     * @return The indentation string of that width.
     */
    public String render(int width) {
        return String.valueOf(unitChar).repeat(width);
    }

    /**
     * @return "space" or "tab".
     */
    public String unitName() {
        return usesTabs() ? "tab" : "space";
    }
}
