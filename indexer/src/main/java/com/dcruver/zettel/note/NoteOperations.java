package com.dcruver.zettel.note;

import com.dcruver.zettel.config.WikiProperties;
import com.dcruver.zettel.index.NoteIndex;
import com.dcruver.zettel.io.NoteFiles;
import com.dcruver.zettel.io.NoteParser;
import com.dcruver.zettel.link.LinkRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Creates and deletes notes, keeping the link registry and the index in step.
 */
@Component
@Slf4j
public class NoteOperations {

    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyMMddHHmm");

    private static final String METADATA_BLOCK = """
        /* Metadata:
        Aliases:\s
        Abstract:\s
        Keyword:\s
        Generated: true
        */
        """;

    private final Path noteDir;
    private final LinkRegistry linkRegistry;
    private final NoteIndex index;
    private final Clock clock;

    @Autowired
    public NoteOperations(WikiProperties properties, LinkRegistry linkRegistry, NoteIndex index) {
        this(properties.getNoteDir(), linkRegistry, index, Clock.systemDefaultZone());
    }

    public NoteOperations(Path noteDir, LinkRegistry linkRegistry, NoteIndex index, Clock clock) {
        this.noteDir = noteDir;
        this.linkRegistry = linkRegistry;
        this.index = index;
        this.clock = clock;
    }

    /**
     * Create a note whose id is the current minute. An existing file with that id
     * is left as it is.
     *
     * @return path of the note
     */
    public Path createNote(boolean withMetadata) throws IOException {
        String id = LocalDateTime.now(clock).format(ID_FORMAT);
        Files.createDirectories(noteDir);

        Path path = NoteFiles.pathFor(noteDir, id);
        if (!Files.exists(path)) {
            Files.writeString(path, template(id, withMetadata));
            log.info("Created note {}", path);
        } else {
            log.info("Note {} already exists", path);
        }

        linkRegistry.addEntry(id);
        index.updateFile(path);
        return path;
    }

    /**
     * Delete a note and remove its registry entry
     *
     * @throws IllegalArgumentException if {@code id} is not a 10-digit note id
     */
    public void deleteNote(String id) throws IOException {
        if (!NoteFiles.isNoteId(id)) {
            throw new IllegalArgumentException("Not a note id: " + id);
        }
        Path path = NoteFiles.pathFor(noteDir, id);
        if (Files.deleteIfExists(path)) {
            log.info("Deleted note {}", path);
        }
        linkRegistry.removeEntry(id);
        index.removeByPath(path);
    }

    static String template(String id, boolean withMetadata) {
        String body = NoteParser.IMPORT_LINE + "\n#show: zettel\n\n=  <" + id + ">\n#tag.\n\n";
        return withMetadata ? METADATA_BLOCK + body : body;
    }
}
