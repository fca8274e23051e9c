package com.dcruver.zettel.format;

import com.dcruver.zettel.io.NoteFiles;
import com.dcruver.zettel.io.NoteParser;
import com.dcruver.zettel.io.RefOccurrence;
import com.dcruver.zettel.io.TextLines;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks or clears {@code - [ ] @<id>} items from the status of the notes they reference.
 * A line is checked only if every note it references is effectively done.
 */
@Component
@Slf4j
public class ReferenceCheckboxResolver {

    public String updateRefCheckboxes(String content, Path noteDir) {
        List<String> lines = TextLines.split(content);
        boolean changed = false;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (!Checkboxes.isTodoLine(line)) {
                continue;
            }
            Set<String> ids = new LinkedHashSet<>();
            for (RefOccurrence ref : NoteParser.findAllRefs(line)) {
                ids.add(ref.getId());
            }
            if (ids.isEmpty()) {
                continue;
            }

            boolean allDone = true;
            for (String id : ids) {
                if (!isEffectivelyDone(NoteFiles.pathFor(noteDir, id))) {
                    allDone = false;
                    break;
                }
            }

            if (Checkboxes.isChecked(line) != allDone) {
                lines.set(i, Checkboxes.replaceState(line, Checkboxes.stateFor(allDone)).orElse(line));
                changed = true;
            }
        }

        return changed ? TextLines.join(lines, content) : content;
    }

    /**
     * Whether the note at {@code path} would carry {@code #tag.done} once its tag
     * line is reconciled with its own checklist. A stale on-disk tag is not trusted.
     * Unreadable or unparsable notes count as not done.
     */
    public boolean isEffectivelyDone(Path path) {
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            log.debug("Referenced note {} unreadable, treating as not done: {}", path, e.getMessage());
            return false;
        }
        return TagEditor.effectiveTagLine(content)
            .map(line -> line.contains("#tag.done"))
            .orElse(false);
    }
}
