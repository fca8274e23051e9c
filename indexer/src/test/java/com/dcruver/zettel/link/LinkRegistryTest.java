package com.dcruver.zettel.link;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for maintaining the link file.
 */
class LinkRegistryTest {

    @TempDir
    Path wikiRoot;

    private Path linkFile;
    private Path noteDir;
    private LinkRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        linkFile = wikiRoot.resolve("link.typ");
        noteDir = Files.createDirectories(wikiRoot.resolve("note"));
        registry = new LinkRegistry(linkFile, noteDir);
    }

    @Test
    void testEntriesAreSortedAndUnique() throws Exception {
        registry.addEntry("0000000003");
        registry.addEntry("0000000001");
        registry.addEntry("0000000003");

        assertEquals("""
            #include "note/0000000001.typ"
            #include "note/0000000003.typ"
            """, Files.readString(linkFile));
        assertEquals(List.of("0000000001", "0000000003"), registry.listIds());
    }

    @Test
    void testRemoveEntry() throws Exception {
        registry.addEntry("0000000001");
        registry.addEntry("0000000002");

        registry.removeEntry("0000000001");
        registry.removeEntry("0000000099");

        assertEquals(List.of("0000000002"), registry.listIds());
    }

    @Test
    void testPreambleIsPreserved() throws Exception {
        Files.writeString(linkFile, """
            // Generated index of notes
            #include "note/0000000002.typ"
            """);

        registry.addEntry("0000000001");

        assertEquals("""
            // Generated index of notes
            #include "note/0000000001.typ"
            #include "note/0000000002.typ"
            """, Files.readString(linkFile));
    }

    @Test
    void testLinesAfterEntriesArePreserved() throws Exception {
        Files.writeString(linkFile, """
            // Generated index of notes
            #include "note/0000000002.typ"
            #include "note/0000000004.typ"
            #include "extra/glossary.typ"
            // end of notes
            """);

        registry.addEntry("0000000003");
        registry.removeEntry("0000000004");

        assertEquals("""
            // Generated index of notes
            #include "note/0000000002.typ"
            #include "note/0000000003.typ"
            #include "extra/glossary.typ"
            // end of notes
            """, Files.readString(linkFile));
    }

    @Test
    void testRegenerateFromNoteDirectory() throws Exception {
        registry.addEntry("0000000009");
        Files.writeString(noteDir.resolve("0000000002.typ"), "");
        Files.writeString(noteDir.resolve("0000000001.typ"), "");
        Files.writeString(noteDir.resolve("notes.md"), "");

        assertEquals(2, registry.regenerate());
        assertEquals(List.of("0000000001", "0000000002"), registry.listIds());
    }

    @Test
    void testMissingLinkFileIsEmpty() throws Exception {
        assertTrue(registry.listIds().isEmpty());
        assertEquals("#include \"note/0000000001.typ\"", registry.entryLine("0000000001"));
    }
}
