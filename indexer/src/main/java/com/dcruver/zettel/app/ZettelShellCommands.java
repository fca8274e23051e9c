package com.dcruver.zettel.app;

import com.dcruver.zettel.config.WikiProperties;
import com.dcruver.zettel.format.NoteFormatter;
import com.dcruver.zettel.format.TagPropagator;
import com.dcruver.zettel.format.WorkspaceEdit;
import com.dcruver.zettel.format.WorkspaceEditApplier;
import com.dcruver.zettel.index.BacklinkLocation;
import com.dcruver.zettel.index.NoteIndex;
import com.dcruver.zettel.index.NoteInfo;
import com.dcruver.zettel.io.NoteBackupWriter;
import com.dcruver.zettel.io.NoteFiles;
import com.dcruver.zettel.io.NoteHeader;
import com.dcruver.zettel.io.NoteParser;
import com.dcruver.zettel.io.StatusTag;
import com.dcruver.zettel.link.LinkRegistry;
import com.dcruver.zettel.lint.ReferenceChecker;
import com.dcruver.zettel.lint.ReferenceDiagnostic;
import com.dcruver.zettel.lint.ReferenceHints;
import com.dcruver.zettel.lint.ReferenceLookup;
import com.dcruver.zettel.note.NoteOperations;
import com.dcruver.zettel.watch.NoteWatcher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Spring Shell commands for the Zettelkasten index.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class ZettelShellCommands {

    private final IndexBootstrap bootstrap;
    private final NoteIndex index;
    private final NoteWatcher watcher;
    private final WikiProperties properties;
    private final NoteFormatter formatter;
    private final TagPropagator propagator;
    private final WorkspaceEditApplier applier;
    private final NoteBackupWriter backupWriter;
    private final LinkRegistry linkRegistry;
    private final NoteOperations noteOperations;
    private final ReferenceChecker referenceChecker;
    private final ReferenceHints referenceHints;
    private final ReferenceLookup referenceLookup;
    private final ObjectMapper objectMapper;

    @ShellMethod(key = "rebuild", value = "Rebuild the index from the note directory")
    public String rebuild() {
        log.info("Rebuilding index...");
        try {
            bootstrap.awaitIndex();
            int count = index.rebuildFull();
            return String.format("Indexed %d notes (%d referenced ids)", count, index.referencedIdCount());
        } catch (Exception e) {
            log.error("Rebuild failed", e);
            return "Rebuild failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "status", value = "Show index status")
    public String status() {
        try {
            bootstrap.awaitIndex();

            StringBuilder sb = new StringBuilder();
            sb.append("Index Status:\n");
            sb.append(String.format("- Wiki root: %s\n", properties.getRootPath()));
            sb.append(String.format("- Note directory: %s\n", index.getNoteDir()));
            sb.append(String.format("- Notes: %d\n", index.size()));
            sb.append(String.format("- Archived: %d\n", index.allNotes().stream().filter(NoteInfo::isArchived).count()));
            sb.append(String.format("- Legacy: %d\n", index.allNotes().stream().filter(NoteInfo::isLegacy).count()));
            sb.append(String.format("- Referenced ids: %d\n", index.referencedIdCount()));
            sb.append(String.format("- Watcher: %s\n", watcher.isRunning() ? "running" : "stopped"));
            return sb.toString();
        } catch (Exception e) {
            log.error("Failed to get status", e);
            return "Failed to get status: " + e.getMessage();
        }
    }

    @ShellMethod(key = "show", value = "Show a note's metadata")
    public String show(@ShellOption String id) {
        try {
            bootstrap.awaitIndex();
            Optional<NoteInfo> note = index.get(id);
            if (note.isEmpty()) {
                return "Note not found: " + id;
            }
            NoteInfo info = note.get();

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("%s  %s\n", info.getId(), info.getTitle()));
            sb.append(String.format("Path: %s\n", info.getPath()));
            if (info.isArchived()) {
                sb.append("Archived").append(info.getAltId() != null ? " -> @" + info.getAltId() : "").append("\n");
            }
            if (info.isLegacy()) {
                sb.append("Legacy").append(info.getEvoId() != null ? " -> @" + info.getEvoId() : "").append("\n");
            }
            if (!info.getAliases().isEmpty()) {
                sb.append("Aliases: ").append(String.join(", ", info.getAliases())).append("\n");
            }
            if (!info.getKeywords().isEmpty()) {
                sb.append("Keywords: ").append(String.join(", ", info.getKeywords())).append("\n");
            }
            if (info.getAbstractText() != null) {
                sb.append("Abstract: ").append(info.getAbstractText()).append("\n");
            }
            sb.append(String.format("Backlinks: %d\n", index.getBacklinks(id).size()));
            return sb.toString();
        } catch (Exception e) {
            log.error("Failed to show note {}", id, e);
            return "Failed to show note: " + e.getMessage();
        }
    }

    @ShellMethod(key = "search", value = "Search notes by title, id, alias, keyword or abstract")
    public String search(@ShellOption String query,
                         @ShellOption(defaultValue = "false") boolean json) {
        try {
            bootstrap.awaitIndex();
            List<NoteInfo> results = index.search(query).stream()
                .sorted(Comparator.comparing(NoteInfo::getId))
                .toList();

            if (json) {
                return toJson(results.stream().map(ZettelShellCommands::noteView).toList());
            }
            if (results.isEmpty()) {
                return "No notes match: " + query;
            }
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("%d notes:\n", results.size()));
            for (NoteInfo info : results) {
                sb.append(String.format("  @%s  %s\n", info.getId(), info.getTitle()));
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Search failed", e);
            return "Search failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "backlinks", value = "List locations referencing a note")
    public String backlinks(@ShellOption String id,
                            @ShellOption(defaultValue = "false") boolean json) {
        try {
            bootstrap.awaitIndex();
            return renderLocations(index.getBacklinks(id), json, "No references to @" + id);
        } catch (Exception e) {
            log.error("Failed to list backlinks of {}", id, e);
            return "Failed to list backlinks: " + e.getMessage();
        }
    }

    @ShellMethod(key = "refs", value = "Find references to the note named on a line of a file")
    public String refs(@ShellOption String file, @ShellOption int line) {
        try {
            bootstrap.awaitIndex();
            List<String> lines = Files.readString(resolve(file)).lines().toList();
            if (line < 0 || line >= lines.size()) {
                return "Line out of range: " + line;
            }
            String text = lines.get(line);
            if (ReferenceLookup.idOnLine(text).isEmpty()) {
                return "No note id on line " + line;
            }
            return renderLocations(referenceLookup.findReferences(text), false, "No references found");
        } catch (Exception e) {
            log.error("Failed to find references", e);
            return "Failed to find references: " + e.getMessage();
        }
    }

    @ShellMethod(key = "check", value = "Report references to archived and legacy notes")
    public String check(@ShellOption String file) {
        try {
            bootstrap.awaitIndex();
            Path path = resolve(file);
            List<ReferenceDiagnostic> diagnostics = referenceChecker.check(Files.readString(path));
            if (diagnostics.isEmpty()) {
                return "No issues in " + path.getFileName();
            }

            StringBuilder sb = new StringBuilder();
            for (ReferenceDiagnostic diagnostic : diagnostics) {
                sb.append(String.format("%d:%d-%d %s %s\n",
                    diagnostic.getLine() + 1, diagnostic.getStartChar(), diagnostic.getEndChar(),
                    diagnostic.getSeverity(), diagnostic.getMessage()));
                for (ReferenceDiagnostic.QuickFix fix : diagnostic.quickFixes()) {
                    sb.append("    ").append(fix.getTitle()).append("\n");
                }
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Check failed", e);
            return "Check failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "hints", value = "Show the titles of notes referenced in a file")
    public String hints(@ShellOption String file) {
        try {
            bootstrap.awaitIndex();
            String content = Files.readString(resolve(file));
            List<ReferenceHints.TitleHint> hints = referenceHints.titleHints(content, 0, Integer.MAX_VALUE);
            if (hints.isEmpty()) {
                return "No references to indexed notes";
            }
            StringBuilder sb = new StringBuilder();
            for (ReferenceHints.TitleHint hint : hints) {
                sb.append(String.format("%d:%d %s\n", hint.getLine() + 1, hint.getCharacter(), hint.getLabel()));
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Failed to compute hints", e);
            return "Failed to compute hints: " + e.getMessage();
        }
    }

    @ShellMethod(key = "format", value = "Normalize checkboxes and the status tag of a note")
    public String format(@ShellOption String file,
                         @ShellOption(defaultValue = "false") boolean write,
                         @ShellOption(defaultValue = "false") boolean diff) {
        try {
            Path path = resolve(file);
            String original = Files.readString(path);
            String formatted = formatter.formatContent(original);

            if (formatted.equals(original)) {
                return "Already formatted: " + path.getFileName();
            }

            StringBuilder sb = new StringBuilder();
            if (diff) {
                sb.append(backupWriter.generateDiff(original, formatted, path.getFileName().toString()));
            }
            if (write) {
                backupWriter.write(path, formatted);
                sb.append("Formatted ").append(path.getFileName()).append("\n");
            } else if (!diff) {
                sb.append(formatted);
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Format failed", e);
            return "Format failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "propagate", value = "Push a note's status to the checklists referencing it")
    public String propagate(@ShellOption String id) {
        try {
            bootstrap.awaitIndex();
            Path path = NoteFiles.pathFor(index.getNoteDir(), id);
            String content = Files.readString(path);
            Optional<NoteHeader> header = NoteParser.parseHeader(content);
            if (header.isEmpty()) {
                return "Not a note: " + path;
            }
            Optional<StatusTag> tag = NoteParser.computeStatusTag(
                NoteParser.countTodos(content), header.get().isArchived());
            if (tag.isEmpty()) {
                return "Note @" + id + " has no checklist items";
            }

            WorkspaceEdit edit = propagator.propagateTagChange(id, tag.get());
            if (edit.isEmpty()) {
                return "Nothing to propagate for @" + id + " (" + tag.get() + ")";
            }
            List<Path> updated = applier.apply(edit);
            return String.format("Propagated %s of @%s: %d edits in %d files",
                tag.get(), id, edit.editCount(), updated.size());
        } catch (Exception e) {
            log.error("Propagation failed for {}", id, e);
            return "Propagation failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "new", value = "Create a new note")
    public String newNote(@ShellOption(defaultValue = "false") boolean metadata) {
        try {
            bootstrap.awaitIndex();
            Path created = noteOperations.createNote(metadata);
            return "Created " + created;
        } catch (Exception e) {
            log.error("Failed to create note", e);
            return "Failed to create note: " + e.getMessage();
        }
    }

    @ShellMethod(key = "remove", value = "Delete a note and its link entry")
    public String remove(@ShellOption String id) {
        try {
            bootstrap.awaitIndex();
            noteOperations.deleteNote(id);
            return "Removed @" + id;
        } catch (Exception e) {
            log.error("Failed to remove note {}", id, e);
            return "Failed to remove note: " + e.getMessage();
        }
    }

    @ShellMethod(key = "generate", value = "Regenerate the link file from the note directory")
    public String generate() {
        try {
            int count = linkRegistry.regenerate();
            return String.format("Wrote %d entries to %s", count, linkRegistry.getLinkFile());
        } catch (Exception e) {
            log.error("Failed to regenerate link file", e);
            return "Failed to regenerate link file: " + e.getMessage();
        }
    }

    // A bare note id names the note in the configured note directory
    private Path resolve(String fileOrId) {
        if (NoteFiles.isNoteId(fileOrId)) {
            return NoteFiles.pathFor(properties.getNoteDir(), fileOrId);
        }
        return Path.of(fileOrId).toAbsolutePath().normalize();
    }

    private String renderLocations(List<BacklinkLocation> locations, boolean json, String emptyMessage)
            throws JsonProcessingException {
        List<BacklinkLocation> sorted = locations.stream()
            .sorted(Comparator.comparing((BacklinkLocation loc) -> loc.getFile().toString())
                .thenComparingInt(BacklinkLocation::getLine)
                .thenComparingInt(BacklinkLocation::getStartChar))
            .toList();

        if (json) {
            return toJson(sorted.stream().map(ZettelShellCommands::locationView).toList());
        }
        if (sorted.isEmpty()) {
            return emptyMessage;
        }
        StringBuilder sb = new StringBuilder();
        for (BacklinkLocation loc : sorted) {
            sb.append(String.format("%s:%d:%d\n", loc.getFile(), loc.getLine() + 1, loc.getStartChar()));
        }
        return sb.toString();
    }

    private String toJson(Object value) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }

    private static Map<String, Object> noteView(NoteInfo info) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", info.getId());
        view.put("title", info.getTitle());
        view.put("path", info.getPath().toString());
        view.put("archived", info.isArchived());
        view.put("legacy", info.isLegacy());
        view.put("altId", info.getAltId());
        view.put("evoId", info.getEvoId());
        view.put("aliases", info.getAliases());
        view.put("keywords", info.getKeywords());
        view.put("abstract", info.getAbstractText());
        return view;
    }

    private static Map<String, Object> locationView(BacklinkLocation loc) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("file", loc.getFile().toString());
        view.put("line", loc.getLine());
        view.put("startChar", loc.getStartChar());
        view.put("endChar", loc.getEndChar());
        return view;
    }
}
