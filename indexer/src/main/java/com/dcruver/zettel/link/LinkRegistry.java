package com.dcruver.zettel.link;

import com.dcruver.zettel.config.WikiProperties;
import com.dcruver.zettel.io.NoteFiles;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Maintains {@code link.typ}, which includes every note so that {@code @<id>}
 * references resolve across the whole wiki.
 *
 * Entries look like {@code #include "note/2602082037.typ"} and are kept sorted by id.
 * Other non-blank lines keep their place above or below the block of entries;
 * lines found between entries move below it.
 */
@Component
@Slf4j
public class LinkRegistry {

    private static final Pattern ENTRY = Pattern.compile("^#include \"(?:.*/)?(\\d{10})\\.typ\"$");

    private final Path linkFile;
    private final Path noteDir;
    private final String noteDirPrefix;

    @Autowired
    public LinkRegistry(WikiProperties properties) {
        this(properties.getLinkFile(), properties.getNoteDir());
    }

    public LinkRegistry(Path linkFile, Path noteDir) {
        this.linkFile = linkFile.toAbsolutePath().normalize();
        this.noteDir = noteDir.toAbsolutePath().normalize();
        Path parent = this.linkFile.getParent();
        String relative = parent != null ? parent.relativize(this.noteDir).toString() : this.noteDir.toString();
        this.noteDirPrefix = relative.replace('\\', '/');
    }

    public Path getLinkFile() {
        return linkFile;
    }

    /**
     * Register a note; no-op if it is already listed
     */
    public synchronized void addEntry(String id) throws IOException {
        Registry registry = load();
        if (registry.ids.add(id)) {
            save(registry);
            log.debug("Added {} to {}", id, linkFile.getFileName());
        }
    }

    /**
     * Deregister a note; no-op if it is not listed
     */
    public synchronized void removeEntry(String id) throws IOException {
        Registry registry = load();
        if (registry.ids.remove(id)) {
            save(registry);
            log.debug("Removed {} from {}", id, linkFile.getFileName());
        }
    }

    /**
     * Rewrite the registry from the notes currently in the note directory
     *
     * @return number of entries written
     */
    public synchronized int regenerate() throws IOException {
        Registry registry = load();
        registry.ids.clear();
        if (Files.isDirectory(noteDir)) {
            try (Stream<Path> entries = Files.list(noteDir)) {
                entries.map(NoteFiles::idOf)
                    .flatMap(Optional::stream)
                    .forEach(registry.ids::add);
            }
        }
        save(registry);
        log.info("Regenerated {} with {} entries", linkFile, registry.ids.size());
        return registry.ids.size();
    }

    public synchronized List<String> listIds() throws IOException {
        return List.copyOf(load().ids);
    }

    String entryLine(String id) {
        return "#include \"" + noteDirPrefix + "/" + id + "." + NoteFiles.EXTENSION + "\"";
    }

    private Registry load() throws IOException {
        Registry registry = new Registry();
        if (!Files.exists(linkFile)) {
            return registry;
        }
        for (String line : Files.readAllLines(linkFile)) {
            Matcher matcher = ENTRY.matcher(line.trim());
            if (matcher.matches()) {
                registry.ids.add(matcher.group(1));
            } else if (!line.isBlank()) {
                (registry.ids.isEmpty() ? registry.preamble : registry.trailer).add(line);
            }
        }
        return registry;
    }

    private void save(Registry registry) throws IOException {
        StringBuilder sb = new StringBuilder();
        for (String line : registry.preamble) {
            sb.append(line).append("\n");
        }
        for (String id : registry.ids) {
            sb.append(entryLine(id)).append("\n");
        }
        for (String line : registry.trailer) {
            sb.append(line).append("\n");
        }
        Path parent = linkFile.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(linkFile, sb.toString());
    }

    private static class Registry {
        private final List<String> preamble = new ArrayList<>();
        private final TreeSet<String> ids = new TreeSet<>();
        private final List<String> trailer = new ArrayList<>();
    }
}
