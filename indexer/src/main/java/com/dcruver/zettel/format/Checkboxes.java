package com.dcruver.zettel.format;

import lombok.experimental.UtilityClass;

import java.util.Optional;

/**
 * Helpers for checklist lines of the shape {@code <indent>- [?] ...}.
 */
@UtilityClass
public class Checkboxes {

    public static final char CHECKED = 'x';
    public static final char UNCHECKED = ' ';

    public static boolean isTodoLine(String line) {
        return getState(line).isPresent();
    }

    /**
     * State character between the brackets, if the line is a checklist item
     */
    public static Optional<Character> getState(String line) {
        String t = line.stripLeading();
        if (t.length() >= 5 && t.startsWith("- [") && t.charAt(4) == ']') {
            return Optional.of(t.charAt(3));
        }
        return Optional.empty();
    }

    /**
     * True for {@code [x]} and {@code [X]}
     */
    public static boolean isChecked(String line) {
        return getState(line).map(c -> c == 'x' || c == 'X').orElse(false);
    }

    public static int indentOf(String line) {
        return line.length() - line.stripLeading().length();
    }

    /**
     * The line with its state character replaced, or empty if it is not a checklist item
     */
    public static Optional<String> replaceState(String line, char newState) {
        if (!isTodoLine(line)) {
            return Optional.empty();
        }
        int statePos = indentOf(line) + 3;
        return Optional.of(line.substring(0, statePos) + newState + line.substring(statePos + 1));
    }

    public static char stateFor(boolean done) {
        return done ? CHECKED : UNCHECKED;
    }
}
