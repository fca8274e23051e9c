package com.dcruver.zettel.io;

import lombok.Builder;
import lombok.Data;

/**
 * Replacement of a single line. Character offsets are UTF-16 code units.
 */
@Data
@Builder
public class TextEdit {
    private final int line;
    private final int startChar;
    private final int endChar;
    private final String newText;

    /**
     * Edit replacing the whole of {@code currentLine} with {@code newText}
     */
    public static TextEdit replaceLine(int line, String currentLine, String newText) {
        return TextEdit.builder()
            .line(line)
            .startChar(0)
            .endChar(currentLine.length())
            .newText(newText)
            .build();
    }
}
