package com.dcruver.zettel.io;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Line splitting and joining that keeps a note's trailing newline intact.
 */
@UtilityClass
public class TextLines {

    /**
     * Mutable list of the lines of {@code content}, without terminators
     */
    public static List<String> split(String content) {
        return new ArrayList<>(content.lines().toList());
    }

    /**
     * Join lines with {@code \n}, ending with a newline iff {@code original} did
     */
    public static String join(List<String> lines, String original) {
        String out = String.join("\n", lines);
        if (original.endsWith("\n")) {
            out += "\n";
        }
        return out;
    }

    /**
     * Apply full-line edits; edits pointing past the last line are ignored
     */
    public static String applyEdits(String content, List<TextEdit> edits) {
        List<String> lines = split(content);
        for (TextEdit edit : edits) {
            if (edit.getLine() >= 0 && edit.getLine() < lines.size()) {
                lines.set(edit.getLine(), edit.getNewText());
            }
        }
        return join(lines, content);
    }
}
