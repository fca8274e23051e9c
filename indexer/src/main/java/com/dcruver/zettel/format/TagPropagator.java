package com.dcruver.zettel.format;

import com.dcruver.zettel.index.BacklinkLocation;
import com.dcruver.zettel.index.NoteIndex;
import com.dcruver.zettel.io.StatusTag;
import com.dcruver.zettel.io.TextEdit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pushes a note's new status into the checklist items of the notes that
 * reference it. Only lines that mention {@code @<id>} directly are touched;
 * nested aggregation is left to each note's own formatting.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TagPropagator {

    private final NoteIndex index;

    public WorkspaceEdit propagateTagChange(String noteId, StatusTag newTag) {
        boolean done = newTag == StatusTag.DONE;
        String pattern = "@" + noteId;

        Set<Path> candidates = new LinkedHashSet<>();
        for (BacklinkLocation location : index.getBacklinks(noteId)) {
            candidates.add(location.getFile());
        }

        WorkspaceEdit workspaceEdit = new WorkspaceEdit();
        for (Path file : candidates) {
            String content;
            try {
                content = Files.readString(file);
            } catch (IOException e) {
                log.warn("Skipping propagation into {}: {}", file, e.getMessage());
                continue;
            }

            List<TextEdit> edits = new ArrayList<>();
            List<String> lines = content.lines().toList();
            for (int lineNum = 0; lineNum < lines.size(); lineNum++) {
                String line = lines.get(lineNum);
                if (!line.contains(pattern) || !Checkboxes.isTodoLine(line)) {
                    continue;
                }
                if (Checkboxes.isChecked(line) == done) {
                    continue;
                }
                int row = lineNum;
                Checkboxes.replaceState(line, Checkboxes.stateFor(done))
                    .ifPresent(newLine -> edits.add(TextEdit.replaceLine(row, line, newLine)));
            }
            if (!edits.isEmpty()) {
                workspaceEdit.put(file, edits);
            }
        }

        log.debug("Propagating {} of note {}: {} edits in {} files",
            newTag, noteId, workspaceEdit.editCount(), workspaceEdit.getChanges().size());
        return workspaceEdit;
    }
}
