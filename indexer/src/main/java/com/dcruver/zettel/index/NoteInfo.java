package com.dcruver.zettel.index;

import com.dcruver.zettel.io.NoteHeader;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.nio.file.Path;
import java.util.List;

/**
 * Index entry for one note: header facts plus the file they came from.
 * Overwritten, never merged, when the note is re-indexed.
 */
@Data
@Builder
@With
public class NoteInfo {
    private final String id;
    private final String title;
    private final boolean archived;
    private final boolean legacy;
    private final String altId;
    private final String evoId;
    private final List<String> aliases;
    private final List<String> keywords;
    private final String abstractText;
    private final Path path;

    public static NoteInfo from(NoteHeader header, Path path) {
        return NoteInfo.builder()
            .id(header.getId())
            .title(header.getTitle())
            .archived(header.isArchived())
            .legacy(header.isLegacy())
            .altId(header.getAltId())
            .evoId(header.getEvoId())
            .aliases(List.copyOf(header.getAliases()))
            .keywords(List.copyOf(header.getKeywords()))
            .abstractText(header.getAbstractText())
            .path(path)
            .build();
    }

    /**
     * Case-insensitive substring match over title, id, aliases, keywords and abstract
     */
    public boolean matches(String lowerCaseQuery) {
        return contains(title, lowerCaseQuery)
            || id.contains(lowerCaseQuery)
            || aliases.stream().anyMatch(a -> contains(a, lowerCaseQuery))
            || keywords.stream().anyMatch(k -> contains(k, lowerCaseQuery))
            || contains(abstractText, lowerCaseQuery);
    }

    private static boolean contains(String field, String lowerCaseQuery) {
        return field != null && field.toLowerCase().contains(lowerCaseQuery);
    }
}
