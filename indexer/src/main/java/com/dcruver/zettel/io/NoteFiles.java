package com.dcruver.zettel.io;

import lombok.experimental.UtilityClass;

import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * File naming contract: a note lives in {@code <noteDir>/<10-digit id>.typ}.
 */
@UtilityClass
public class NoteFiles {

    public static final String EXTENSION = "typ";

    private static final Pattern NOTE_ID = Pattern.compile("\\d{10}");

    public static boolean isNoteId(String candidate) {
        return candidate != null && NOTE_ID.matcher(candidate).matches();
    }

    public static boolean isNoteFile(Path path) {
        return idOf(path).isPresent();
    }

    /**
     * Filename stem of a note file, if the name follows the contract
     */
    public static Optional<String> idOf(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }
        String name = path.getFileName().toString();
        String suffix = "." + EXTENSION;
        if (!name.endsWith(suffix)) {
            return Optional.empty();
        }
        String stem = name.substring(0, name.length() - suffix.length());
        return isNoteId(stem) ? Optional.of(stem) : Optional.empty();
    }

    public static Path pathFor(Path noteDir, String id) {
        return noteDir.resolve(id + "." + EXTENSION);
    }
}
