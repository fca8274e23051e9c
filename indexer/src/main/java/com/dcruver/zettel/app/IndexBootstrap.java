package com.dcruver.zettel.app;

import com.dcruver.zettel.config.TaskExecutorConfiguration;
import com.dcruver.zettel.config.WikiProperties;
import com.dcruver.zettel.index.NoteIndex;
import com.dcruver.zettel.watch.NoteWatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Builds the index in the background once the context is up, then starts
 * the watcher, which stops itself on shutdown. Commands wait on {@link #awaitIndex()} before querying.
 *
 * Listens for {@link ApplicationStartedEvent} because the shell runner
 * blocks before the ready event is published.
 */
@Component
@Slf4j
public class IndexBootstrap {

    private final NoteIndex index;
    private final NoteWatcher watcher;
    private final WikiProperties properties;
    private final Executor executor;

    private final CompletableFuture<Integer> ready = new CompletableFuture<>();

    public IndexBootstrap(NoteIndex index, NoteWatcher watcher, WikiProperties properties,
                          @Qualifier(TaskExecutorConfiguration.NOTE_TASK_EXECUTOR) Executor executor) {
        this.index = index;
        this.watcher = watcher;
        this.properties = properties;
        this.executor = executor;
    }

    @EventListener(ApplicationStartedEvent.class)
    public void onStarted() {
        log.info("Wiki root: {}", properties.getRootPath());
        CompletableFuture.runAsync(this::buildAndWatch, executor);
    }

    /**
     * Block until the initial build has finished.
     *
     * @return number of notes indexed by the initial build
     * @throws java.util.concurrent.CompletionException if the build failed
     */
    public int awaitIndex() {
        return ready.join();
    }

    private void buildAndWatch() {
        try {
            int count = index.rebuildFull();
            ready.complete(count);
        } catch (IOException e) {
            log.error("Initial index build failed", e);
            ready.completeExceptionally(new UncheckedIOException(e));
            return;
        } catch (RuntimeException e) {
            log.error("Initial index build failed", e);
            ready.completeExceptionally(e);
            return;
        }

        if (!properties.getWatcher().isEnabled()) {
            log.info("File watcher disabled");
            return;
        }
        if (!Files.isDirectory(index.getNoteDir())) {
            log.warn("Not watching {}: directory does not exist", index.getNoteDir());
            return;
        }
        try {
            watcher.start();
        } catch (IOException e) {
            log.error("Failed to start file watcher on {}", index.getNoteDir(), e);
        }
    }
}
