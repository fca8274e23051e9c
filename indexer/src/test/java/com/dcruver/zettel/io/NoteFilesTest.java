package com.dcruver.zettel.io;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class NoteFilesTest {

    @Test
    void testIdOfFollowsNamingContract() {
        assertEquals(Optional.of("2602082037"), NoteFiles.idOf(Path.of("/wiki/note/2602082037.typ")));
        assertTrue(NoteFiles.idOf(Path.of("/wiki/note/260208203.typ")).isEmpty());
        assertTrue(NoteFiles.idOf(Path.of("/wiki/note/2602082037.md")).isEmpty());
        assertTrue(NoteFiles.idOf(Path.of("/wiki/note/2602082037.typ.swp")).isEmpty());
        assertTrue(NoteFiles.idOf(Path.of("/wiki/note/include.typ")).isEmpty());
    }

    @Test
    void testPathFor() {
        assertEquals(Path.of("/wiki/note/2602082037.typ"), NoteFiles.pathFor(Path.of("/wiki/note"), "2602082037"));
    }

    @Test
    void testApplyEditsKeepsTrailingNewline() {
        String content = "a\nb\nc\n";
        List<TextEdit> edits = List.of(TextEdit.replaceLine(1, "b", "B"), TextEdit.replaceLine(7, "", "ignored"));

        assertEquals("a\nB\nc\n", TextLines.applyEdits(content, edits));
        assertEquals("a\nB", TextLines.applyEdits("a\nb", edits));
    }
}
