package com.dcruver.zettel.io;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Facts parsed from the preamble of one note.
 * Produced fresh on every parse and never mutated.
 */
@Data
@Builder
public class NoteHeader {
    private final String id;
    private final String title;

    // Tag line flags
    private final boolean archived;
    private final boolean legacy;

    // Link line: successor when archived, newer insight when legacy
    private final String altId;
    private final String evoId;

    // Metadata block
    private final List<String> aliases;
    private final List<String> keywords;
    private final String abstractText;

    // 0-based line indices
    private final int titleLineIdx;
    private final int tagLineIdx;
}
