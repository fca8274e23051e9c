package com.dcruver.zettel.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class WikiPropertiesTest {

    @Test
    void testPathsResolveUnderWikiRoot() {
        WikiProperties properties = new WikiProperties();
        properties.setWikiRoot("/srv/wiki/../wiki");

        assertEquals(Path.of("/srv/wiki"), properties.getRootPath());
        assertEquals(Path.of("/srv/wiki/note"), properties.getNoteDir());
        assertEquals(Path.of("/srv/wiki/link.typ"), properties.getLinkFile());
    }

    @Test
    void testDefaults() {
        WikiProperties properties = new WikiProperties();

        assertTrue(properties.getWikiRoot().endsWith("/wiki"));
        assertTrue(properties.getWatcher().isEnabled());
        assertEquals(300, properties.getWatcher().getDebounceMs());
        assertFalse(properties.getWatcher().isPropagateOnChange());
        assertEquals(".zettel/backups", properties.getBackup().getDir());
    }
}
