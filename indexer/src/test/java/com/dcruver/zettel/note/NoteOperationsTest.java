package com.dcruver.zettel.note;

import com.dcruver.zettel.index.NoteIndex;
import com.dcruver.zettel.io.NoteParser;
import com.dcruver.zettel.link.LinkRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for creating and deleting notes.
 */
class NoteOperationsTest {

    @TempDir
    Path wikiRoot;

    private Path noteDir;
    private NoteIndex index;
    private LinkRegistry linkRegistry;
    private NoteOperations operations;

    @BeforeEach
    void setUp() {
        noteDir = wikiRoot.resolve("note");
        index = new NoteIndex(noteDir);
        linkRegistry = new LinkRegistry(wikiRoot.resolve("link.typ"), noteDir);
        Clock clock = Clock.fixed(Instant.parse("2026-02-08T20:37:42Z"), ZoneOffset.UTC);
        operations = new NoteOperations(noteDir, linkRegistry, index, clock);
    }

    @Test
    void testCreateNoteUsesMinuteId() throws Exception {
        Path created = operations.createNote(false);

        assertEquals(noteDir.resolve("2602082037.typ"), created);
        String content = Files.readString(created);
        assertTrue(content.startsWith(NoteParser.IMPORT_LINE + "\n#show: zettel\n\n=  <2602082037>\n"));
        assertEquals(List.of("2602082037"), linkRegistry.listIds());
        assertTrue(index.get("2602082037").isPresent());
    }

    @Test
    void testCreateNoteWithMetadata() throws Exception {
        Path created = operations.createNote(true);

        String content = Files.readString(created);
        assertTrue(content.startsWith("/* Metadata:\nAliases: \nAbstract: \nKeyword: \nGenerated: true\n*/\n"));
        assertEquals("2602082037", NoteParser.parseHeader(content).orElseThrow().getId());
    }

    @Test
    void testCreateKeepsExistingNote() throws Exception {
        Files.createDirectories(noteDir);
        Path existing = Files.writeString(noteDir.resolve("2602082037.typ"), "keep me\n");

        operations.createNote(false);

        assertEquals("keep me\n", Files.readString(existing));
    }

    @Test
    void testDeleteNote() throws Exception {
        Path created = operations.createNote(false);

        operations.deleteNote("2602082037");

        assertFalse(Files.exists(created));
        assertTrue(linkRegistry.listIds().isEmpty());
        assertTrue(index.get("2602082037").isEmpty());
    }

    @Test
    void testDeleteRejectsInvalidId() {
        assertThrows(IllegalArgumentException.class, () -> operations.deleteNote("../link"));
        assertThrows(IllegalArgumentException.class, () -> operations.deleteNote("123"));
    }
}
