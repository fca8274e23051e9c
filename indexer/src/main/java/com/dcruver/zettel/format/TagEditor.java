package com.dcruver.zettel.format;

import com.dcruver.zettel.io.NoteHeader;
import com.dcruver.zettel.io.NoteParser;
import com.dcruver.zettel.io.StatusTag;
import com.dcruver.zettel.io.TextEdit;
import com.dcruver.zettel.io.TextLines;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Optional;

/**
 * Decides what a note's tag line should say given its own checklist.
 * Every place that needs a note's status goes through {@link #computeTagEdit(String)}.
 */
@UtilityClass
public class TagEditor {

    /**
     * Edit needed to bring the tag line in line with the checklist.
     *
     * @return empty when the note has no header, no checklist items, or already
     *     carries the right status token
     */
    public static Optional<TextEdit> computeTagEdit(String content) {
        Optional<NoteHeader> parsed = NoteParser.parseHeader(content);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        NoteHeader header = parsed.get();

        Optional<StatusTag> newTag = NoteParser.computeStatusTag(NoteParser.countTodos(content), header.isArchived());
        if (newTag.isEmpty()) {
            return Optional.empty();
        }
        String newTagText = newTag.get().getTagText();

        List<String> lines = content.lines().toList();
        if (header.getTagLineIdx() >= lines.size()) {
            return Optional.empty();
        }
        String tagLine = lines.get(header.getTagLineIdx());

        Optional<String> currentTagText = currentStatusToken(tagLine);
        if (currentTagText.isPresent() && currentTagText.get().equals(newTagText)) {
            return Optional.empty();
        }

        String newLine = currentTagText
            .map(old -> tagLine.replace(old, newTagText))
            .orElse(tagLine + " " + newTagText);

        return Optional.of(TextEdit.replaceLine(header.getTagLineIdx(), tagLine, newLine));
    }

    /**
     * {@code content} with the tag edit applied, or unchanged if none is needed
     */
    public static String applyTagEdit(String content) {
        return computeTagEdit(content)
            .map(edit -> TextLines.applyEdits(content, List.of(edit)))
            .orElse(content);
    }

    /**
     * Tag line text after reconciliation: the edited line if an edit is due, otherwise
     * the line as it stands. Empty when the note has no header.
     */
    public static Optional<String> effectiveTagLine(String content) {
        Optional<NoteHeader> header = NoteParser.parseHeader(content);
        if (header.isEmpty()) {
            return Optional.empty();
        }
        Optional<TextEdit> edit = computeTagEdit(content);
        if (edit.isPresent()) {
            return Optional.of(edit.get().getNewText());
        }
        List<String> lines = content.lines().toList();
        int idx = header.get().getTagLineIdx();
        return Optional.of(idx < lines.size() ? lines.get(idx) : "");
    }

    // Checked in order done, wip, todo
    private static Optional<String> currentStatusToken(String tagLine) {
        for (StatusTag tag : List.of(StatusTag.DONE, StatusTag.WIP, StatusTag.TODO)) {
            if (tagLine.contains(tag.getTagText())) {
                return Optional.of(tag.getTagText());
            }
        }
        return Optional.empty();
    }
}
