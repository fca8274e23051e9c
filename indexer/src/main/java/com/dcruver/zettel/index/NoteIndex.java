package com.dcruver.zettel.index;

import com.dcruver.zettel.config.WikiProperties;
import com.dcruver.zettel.io.NoteFiles;
import com.dcruver.zettel.io.NoteParser;
import com.dcruver.zettel.io.RefOccurrence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Live index of the note directory: note id to metadata, and note id to the
 * locations that reference it.
 *
 * Both maps allow independent per-key mutation, so the watcher and request
 * handlers can update different files without contending. No lock spans a
 * sequence of mutations: {@link #updateFile(Path)} purges and then re-adds in
 * two steps, and {@link #rebuildFull()} clears before repopulating. Readers may
 * observe those intermediate states.
 */
@Component
@Slf4j
public class NoteIndex {

    private final Path noteDir;

    private final Map<String, NoteInfo> notes = new ConcurrentHashMap<>();
    // Lists are immutable snapshots, replaced per key
    private final Map<String, List<BacklinkLocation>> backlinks = new ConcurrentHashMap<>();

    @Autowired
    public NoteIndex(WikiProperties properties) {
        this(properties.getNoteDir());
    }

    public NoteIndex(Path noteDir) {
        this.noteDir = noteDir.toAbsolutePath().normalize();
    }

    public Path getNoteDir() {
        return noteDir;
    }

    /**
     * Rebuild the full index by scanning all notes in the note directory.
     * A file that cannot be read or parsed is skipped; it never aborts the rebuild.
     *
     * @return number of notes indexed
     * @throws IOException if the note directory cannot be listed
     */
    public int rebuildFull() throws IOException {
        notes.clear();
        backlinks.clear();

        if (!Files.isDirectory(noteDir)) {
            log.warn("Note directory does not exist: {}", noteDir);
            return 0;
        }

        List<Path> paths;
        try (Stream<Path> entries = Files.list(noteDir)) {
            paths = entries
                .filter(Files::isRegularFile)
                .filter(NoteFiles::isNoteFile)
                .map(NoteIndex::normalize)
                .toList();
        }

        log.info("Indexing {} note files in {}", paths.size(), noteDir);
        for (Path path : paths) {
            indexFile(path);
        }

        log.info("Index built: {} notes, {} referenced ids", notes.size(), backlinks.size());
        return notes.size();
    }

    /**
     * Re-index one file after its content changed on disk.
     * The file's previous metadata and backlink contributions are purged first.
     *
     * @return true if the file could be read
     */
    public boolean updateFile(Path path) {
        Path file = normalize(path);
        removeNotesFrom(file);
        removeBacklinksFrom(file);
        return indexFile(file);
    }

    /**
     * Forget a deleted file: the metadata entry it was indexed under and every
     * backlink location it contributed.
     */
    public void removeByPath(Path path) {
        Path file = normalize(path);
        removeNotesFrom(file);
        removeBacklinksFrom(file);
    }

    public Optional<NoteInfo> get(String id) {
        return Optional.ofNullable(notes.get(id));
    }

    /**
     * All known locations referencing {@code id}; empty if none
     */
    public List<BacklinkLocation> getBacklinks(String id) {
        return backlinks.getOrDefault(id, List.of());
    }

    /**
     * Case-insensitive substring search over title, id, aliases, keywords and abstract.
     * Unranked.
     */
    public List<NoteInfo> search(String query) {
        String q = query.toLowerCase();
        return notes.values().stream()
            .filter(note -> note.matches(q))
            .toList();
    }

    public int size() {
        return notes.size();
    }

    public Collection<NoteInfo> allNotes() {
        return List.copyOf(notes.values());
    }

    /**
     * Ids that currently have at least one backlink
     */
    public int referencedIdCount() {
        return backlinks.size();
    }

    // Header metadata and backlink contributions are extracted independently:
    // a file without a valid header still contributes its references.
    private boolean indexFile(Path file) {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            log.warn("Failed to read note {}: {}", file, e.getMessage());
            return false;
        }

        NoteParser.parseHeader(content).ifPresentOrElse(
            header -> notes.put(header.getId(), NoteInfo.from(header, file)),
            () -> log.debug("No note header in {}", file));

        List<String> lines = content.lines().toList();
        for (RefOccurrence ref : NoteParser.findAllRefs(content)) {
            String lineText = ref.getLine() < lines.size() ? lines.get(ref.getLine()) : "";
            BacklinkLocation location = BacklinkLocation.builder()
                .file(file)
                .line(ref.getLine())
                .startChar(NoteParser.byteToUtf16(lineText, ref.getStartByte()))
                .endChar(NoteParser.byteToUtf16(lineText, ref.getEndByte()))
                .build();
            backlinks.compute(ref.getId(), (id, existing) -> append(existing, location));
        }
        return true;
    }

    // Keyed by the header id, which need not match the filename stem
    private void removeNotesFrom(Path file) {
        notes.entrySet().removeIf(entry -> {
            if (!entry.getValue().getPath().equals(file)) {
                return false;
            }
            log.debug("Removed note {} from index", entry.getKey());
            return true;
        });
    }

    private void removeBacklinksFrom(Path file) {
        for (String target : backlinks.keySet()) {
            // Returning null drops the key, so no target is left with an empty list
            backlinks.computeIfPresent(target, (id, locations) -> {
                List<BacklinkLocation> kept = locations.stream()
                    .filter(loc -> !loc.getFile().equals(file))
                    .toList();
                if (kept.isEmpty()) {
                    return null;
                }
                return kept.size() == locations.size() ? locations : kept;
            });
        }
    }

    private static List<BacklinkLocation> append(List<BacklinkLocation> existing, BacklinkLocation location) {
        List<BacklinkLocation> updated = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
        updated.add(location);
        return List.copyOf(updated);
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
