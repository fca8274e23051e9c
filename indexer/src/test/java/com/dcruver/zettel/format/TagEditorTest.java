package com.dcruver.zettel.format;

import com.dcruver.zettel.io.TextEdit;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for reconciling a note's tag line with its own checklist.
 */
class TagEditorTest {

    @Test
    void testAppendsTodoWhenNoStatusToken() {
        String content = note("#tag.idea", "- [ ] first\n- [ ] second");

        TextEdit edit = TagEditor.computeTagEdit(content).orElseThrow();

        assertEquals(4, edit.getLine());
        assertEquals(0, edit.getStartChar());
        assertEquals("#tag.idea".length(), edit.getEndChar());
        assertEquals("#tag.idea #tag.todo", edit.getNewText());
    }

    @Test
    void testReplacesTokenInPlaceWhenAllDone() {
        String content = note("#tag.idea #tag.todo #tag.typst", "- [x] first\n- [X] second");

        String updated = TagEditor.applyTagEdit(content);

        assertTrue(updated.contains("\n#tag.idea #tag.done #tag.typst\n"));
        assertFalse(updated.contains("#tag.todo"));
    }

    @Test
    void testWipWhenPartlyDone() {
        String content = note("#tag.done", "- [x] first\n- [ ] second");

        assertEquals("#tag.wip", TagEditor.computeTagEdit(content).orElseThrow().getNewText());
    }

    @Test
    void testNoEditWhenAlreadyCorrect() {
        assertEquals(Optional.empty(), TagEditor.computeTagEdit(note("#tag.wip", "- [x] a\n- [ ] b")));
    }

    @Test
    void testNoEditWithoutChecklist() {
        String content = note("#tag.todo", "Nothing to do here.");

        assertEquals(Optional.empty(), TagEditor.computeTagEdit(content));
        assertEquals(content, TagEditor.applyTagEdit(content));
    }

    @Test
    void testArchivedNoteIsDone() {
        String content = note("#tag.archived #tag.todo", "- [ ] never finished");

        assertEquals("#tag.archived #tag.done", TagEditor.computeTagEdit(content).orElseThrow().getNewText());
    }

    @Test
    void testNoEditWithoutHeader() {
        assertEquals(Optional.empty(), TagEditor.computeTagEdit("- [ ] loose item\n"));
        assertEquals(Optional.empty(), TagEditor.effectiveTagLine("- [ ] loose item\n"));
    }

    @Test
    void testEffectiveTagLineIgnoresStaleTag() {
        assertEquals(Optional.of("#tag.done"), TagEditor.effectiveTagLine(note("#tag.todo", "- [x] a")));
        assertEquals(Optional.of("#tag.done"), TagEditor.effectiveTagLine(note("#tag.done", "plain")));
        assertEquals(Optional.of("#tag.todo"), TagEditor.effectiveTagLine(note("#tag.done", "- [ ] a")));
    }

    static String note(String tagLine, String body) {
        return "#import \"../include.typ\": *\n"
            + "#show: zettel\n"
            + "\n"
            + "= Note <0000000001>\n"
            + tagLine + "\n"
            + "\n"
            + body + "\n";
    }
}
