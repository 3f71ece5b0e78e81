package org.tabula.rules;

/**
 * How the elements of a delimited list are indented: a number of levels from the
 * opening delimiter, aligned with the first element, or not checked at all.
 *
 * @param mode The kind of offset.
 * @param level The number of levels the list interior is offset from its opener.
 */
public record ElementListOffset(Mode mode, int level) {

    /**
     * The kinds of list offset.
     */
    public enum Mode {
        LEVELS,
        FIRST,
        OFF
    }

    /** Later elements that start a line are aligned with the first element. */
    public static final ElementListOffset FIRST = new ElementListOffset(Mode.FIRST, 1);

    /** The first token of every element keeps its actual indentation. */
    public static final ElementListOffset OFF = new ElementListOffset(Mode.OFF, 1);

    public ElementListOffset {
        if (level < 0) {
            throw new IllegalArgumentException("Offset level must not be negative: " + level);
        }
    }

    /**
     * @param level The number of levels, not negative.
     * @return A fixed offset.
     */
    public static ElementListOffset levels(int level) {
        return new ElementListOffset(Mode.LEVELS, level);
    }

    public boolean isFirst() {
        return mode == Mode.FIRST;
    }

    public boolean isOff() {
        return mode == Mode.OFF;
    }

    @Override
    public String toString() {
        return mode == Mode.LEVELS ? Integer.toString(level) : mode.name().toLowerCase();
    }
}
