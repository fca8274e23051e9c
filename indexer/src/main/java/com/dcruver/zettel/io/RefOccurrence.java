package com.dcruver.zettel.io;

import lombok.Builder;
import lombok.Data;

/**
 * One {@code @<id>} token inside a line.
 * Offsets are UTF-8 byte offsets within the line; convert with
 * {@link NoteParser#byteToUtf16(String, int)} before they leave the index.
 */
@Data
@Builder
public class RefOccurrence {
    private final String id;
    private final int line;
    private final int startByte;
    private final int endByte;
}
