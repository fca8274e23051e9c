package com.dcruver.zettel.watch;

import com.dcruver.zettel.format.TagPropagator;
import com.dcruver.zettel.format.WorkspaceEditApplier;
import com.dcruver.zettel.index.NoteIndex;
import com.dcruver.zettel.io.NoteBackupWriter;
import com.dcruver.zettel.link.LinkRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests against the platform watch service.
 */
class NoteWatcherTest {

    private static final long TIMEOUT_MILLIS = 15_000;

    @TempDir
    Path wikiRoot;

    private Path noteDir;
    private NoteIndex index;
    private LinkRegistry linkRegistry;
    private ExecutorService executor;
    private NoteWatcher watcher;

    @BeforeEach
    void setUp() throws Exception {
        noteDir = Files.createDirectories(wikiRoot.resolve("note"));
        index = new NoteIndex(noteDir);
        linkRegistry = new LinkRegistry(wikiRoot.resolve("link.typ"), noteDir);
        ChangeReconciler reconciler = new ChangeReconciler(index, linkRegistry, new TagPropagator(index),
            new WorkspaceEditApplier(new NoteBackupWriter(false, wikiRoot.resolve("backups"),
                Clock.systemDefaultZone()), index),
            false);
        executor = Executors.newSingleThreadExecutor();
        watcher = new NoteWatcher(noteDir, 50, 16, reconciler, executor);
    }

    @AfterEach
    void tearDown() {
        watcher.stop();
        executor.shutdownNow();
    }

    @Test
    void testStartRequiresNoteDirectory() {
        NoteWatcher missing = new NoteWatcher(wikiRoot.resolve("absent"), 50, 16, null, executor);

        assertThrows(IOException.class, missing::start);
        assertFalse(missing.isRunning());
    }

    @Test
    void testCreateModifyDeleteReachTheIndex() throws Exception {
        watcher.start();
        assertTrue(watcher.isRunning());

        Path note = ChangeReconcilerTest.write(noteDir, "0000000001", "#tag.todo", "- [ ] @0000000002");
        awaitTrue(() -> index.get("0000000001").isPresent());
        awaitTrue(() -> index.getBacklinks("0000000002").size() == 1);
        awaitTrue(() -> linkIds().contains("0000000001"));

        Files.writeString(note, Files.readString(note).replace("@0000000002", "@0000000003"));
        awaitTrue(() -> index.getBacklinks("0000000003").size() == 1);
        assertTrue(index.getBacklinks("0000000002").isEmpty());

        Files.delete(note);
        awaitTrue(() -> index.get("0000000001").isEmpty());
        awaitTrue(() -> index.getBacklinks("0000000003").isEmpty());
        awaitTrue(() -> !linkIds().contains("0000000001"));
    }

    @Test
    void testStopIsIdempotent() throws Exception {
        watcher.start();
        watcher.stop();
        watcher.stop();

        assertFalse(watcher.isRunning());
    }

    @Test
    void testRestartRightAfterStopStillDeliversChanges() throws Exception {
        watcher.start();
        watcher.stop();
        watcher.start();
        assertTrue(watcher.isRunning());

        ChangeReconcilerTest.write(noteDir, "0000000001", "#tag.todo", "");

        awaitTrue(() -> index.get("0000000001").isPresent());
    }

    @Test
    void testLosingTheDirectoryEndsTheSession() throws Exception {
        watcher.start();

        Files.delete(noteDir);
        awaitTrue(() -> !watcher.isRunning());

        Files.createDirectories(noteDir);
        watcher.start();
        assertTrue(watcher.isRunning());
        ChangeReconcilerTest.write(noteDir, "0000000002", "#tag.todo", "");
        awaitTrue(() -> index.get("0000000002").isPresent());
    }

    private String linkIds() {
        try {
            return String.join(",", linkRegistry.listIds());
        } catch (IOException e) {
            return "";
        }
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TIMEOUT_MILLIS;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within " + TIMEOUT_MILLIS + "ms");
            }
            Thread.sleep(50);
        }
    }
}
