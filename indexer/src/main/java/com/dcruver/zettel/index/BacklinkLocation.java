package com.dcruver.zettel.index;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Where a note is referenced. Character offsets are UTF-16 code units.
 */
@Data
@Builder
public class BacklinkLocation {
    private final Path file;
    private final int line;
    private final int startChar;
    private final int endChar;
}
