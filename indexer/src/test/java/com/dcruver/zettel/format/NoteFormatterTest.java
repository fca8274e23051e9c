package com.dcruver.zettel.format;

import com.dcruver.zettel.config.WikiProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the full formatting pipeline.
 */
class NoteFormatterTest {

    @TempDir
    Path wikiRoot;

    private NoteFormatter formatter;

    @BeforeEach
    void setUp() throws Exception {
        WikiProperties properties = new WikiProperties();
        properties.setWikiRoot(wikiRoot.toString());
        Files.createDirectories(properties.getNoteDir());
        formatter = new NoteFormatter(new ReferenceCheckboxResolver(), properties);
    }

    @Test
    void testReferencesThenNestingThenTag() throws Exception {
        Path noteDir = wikiRoot.resolve("note");
        Files.writeString(noteDir.resolve("0000000002.typ"),
            TagEditorTest.note("#tag.todo", "- [x] all done").replace("0000000001", "0000000002"));

        String content = TagEditorTest.note("#tag.todo", """
            - [ ] release
              - [ ] @0000000002
              - [x] changelog""");

        String formatted = formatter.formatContent(content);

        assertTrue(formatted.contains("\n#tag.done\n"), formatted);
        assertTrue(formatted.contains("- [x] release\n  - [x] @0000000002\n  - [x] changelog\n"), formatted);
    }

    @Test
    void testFormattingIsIdempotent() {
        String content = TagEditorTest.note("#tag.idea", "- [ ] parent\n  - [x] child\n- [ ] @0000000099");

        String once = formatter.formatContent(content);
        String twice = formatter.formatContent(once);

        assertEquals(once, twice);
        assertTrue(once.contains("\n#tag.idea #tag.wip\n"), once);
    }
}
