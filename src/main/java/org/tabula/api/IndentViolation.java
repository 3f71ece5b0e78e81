package org.tabula.api;

/**
 * A line whose indentation differs from the expected one.
 *
 * @param source Where the first token of the line is.
 * @param expectedUnits The expected indentation in levels.
 * @param expectedWidth The expected indentation in characters.
 * @param actualSpaces The number of spaces found before the token.
 * @param actualTabs The number of tabs found before the token.
 * @param message The human readable description.
 * @param fix The edit that corrects the line.
 */
public record IndentViolation(
        SourceInfo source,
        int expectedUnits,
        int expectedWidth,
        int actualSpaces,
        int actualTabs,
        String message,
        TextEdit fix
) {}
