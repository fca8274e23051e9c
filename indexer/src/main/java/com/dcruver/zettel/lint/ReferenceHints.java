package com.dcruver.zettel.lint;

import com.dcruver.zettel.index.NoteIndex;
import com.dcruver.zettel.io.NoteParser;
import com.dcruver.zettel.io.RefOccurrence;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Titles of referenced notes, to show next to each {@code @<id>}.
 */
@Component
@RequiredArgsConstructor
public class ReferenceHints {

    private final NoteIndex index;

    /**
     * One hint per reference to an indexed note on lines {@code fromLine..toLine} (inclusive)
     */
    public List<TitleHint> titleHints(String content, int fromLine, int toLine) {
        List<TitleHint> hints = new ArrayList<>();
        List<String> lines = content.lines().toList();

        for (RefOccurrence ref : NoteParser.findAllRefs(content)) {
            if (ref.getLine() < fromLine || ref.getLine() > toLine) {
                continue;
            }
            index.get(ref.getId()).ifPresent(info -> hints.add(new TitleHint(
                ref.getLine(),
                NoteParser.byteToUtf16(lines.get(ref.getLine()), ref.getEndByte()),
                info.getTitle())));
        }
        return hints;
    }

    @Data
    public static class TitleHint {
        private final int line;
        private final int character;
        private final String label;
    }
}
