package com.dcruver.zettel.lint;

import com.dcruver.zettel.index.BacklinkLocation;
import com.dcruver.zettel.index.NoteIndex;
import com.dcruver.zettel.io.NoteFiles;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Finds the note a line is about and everything that references it.
 */
@Component
@RequiredArgsConstructor
public class ReferenceLookup {

    private final NoteIndex index;

    public List<BacklinkLocation> findReferences(String lineText) {
        return idOnLine(lineText)
            .map(index::getBacklinks)
            .orElse(List.of());
    }

    /**
     * The {@code <id>} label of a title line, else the first {@code @id} on the line
     */
    public static Optional<String> idOnLine(String line) {
        Optional<String> label = angleId(line);
        return label.isPresent() ? label : atId(line);
    }

    private static Optional<String> angleId(String line) {
        int start = line.lastIndexOf('<');
        if (start < 0) {
            return Optional.empty();
        }
        int end = line.indexOf('>', start);
        if (end < 0) {
            return Optional.empty();
        }
        String candidate = line.substring(start + 1, end);
        return NoteFiles.isNoteId(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    private static Optional<String> atId(String line) {
        int at = line.indexOf('@');
        if (at < 0) {
            return Optional.empty();
        }
        int end = at + 1;
        while (end < line.length() && Character.isDigit(line.charAt(end))) {
            end++;
        }
        String candidate = line.substring(at + 1, end);
        return NoteFiles.isNoteId(candidate) ? Optional.of(candidate) : Optional.empty();
    }
}
