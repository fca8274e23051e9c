package com.dcruver.zettel.watch;

import com.dcruver.zettel.config.TaskExecutorConfiguration;
import com.dcruver.zettel.config.WikiProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Watches the note directory and feeds debounced batches of changed paths
 * to the {@link ChangeReconciler}.
 *
 * Blocking watch calls run on a dedicated daemon thread so they never tie up
 * the task executor. Batches travel over a bounded queue to a consumer task
 * on the executor. Every {@link #start()} opens a fresh {@link Session} with
 * its own watch service and queue, so a consumer still draining after
 * {@link #stop()} never takes batches from the next session.
 */
@Component
@Slf4j
public class NoteWatcher {

    private static final long IDLE_POLL_MILLIS = 1000;

    private final Path noteDir;
    private final long debounceMillis;
    private final int queueCapacity;
    private final ChangeReconciler reconciler;
    private final Executor executor;

    private Session session;

    @Autowired
    public NoteWatcher(WikiProperties properties, ChangeReconciler reconciler,
                       @Qualifier(TaskExecutorConfiguration.NOTE_TASK_EXECUTOR) Executor executor) {
        this(properties.getNoteDir(), properties.getWatcher().getDebounceMs(),
            properties.getWatcher().getQueueCapacity(), reconciler, executor);
    }

    public NoteWatcher(Path noteDir, long debounceMillis, int queueCapacity,
                       ChangeReconciler reconciler, Executor executor) {
        this.noteDir = noteDir.toAbsolutePath().normalize();
        this.debounceMillis = debounceMillis;
        this.queueCapacity = queueCapacity;
        this.reconciler = reconciler;
        this.executor = executor;
    }

    public synchronized void start() throws IOException {
        if (isRunning()) {
            return;
        }
        if (session != null) {
            session.close();
        }
        if (!Files.isDirectory(noteDir)) {
            throw new IOException("Note directory does not exist: " + noteDir);
        }

        WatchService watchService = noteDir.getFileSystem().newWatchService();
        try {
            noteDir.register(watchService,
                StandardWatchEventKinds.ENTRY_CREATE,
                StandardWatchEventKinds.ENTRY_MODIFY,
                StandardWatchEventKinds.ENTRY_DELETE);
        } catch (IOException e) {
            watchService.close();
            throw e;
        }

        Session started = new Session(watchService, new ArrayBlockingQueue<>(queueCapacity));
        session = started;
        started.observer.start();
        CompletableFuture.runAsync(started::consume, executor);

        log.info("Watching {} (quiet period {}ms)", noteDir, debounceMillis);
    }

    @PreDestroy
    public synchronized void stop() {
        if (session == null) {
            return;
        }
        session.close();
        session = null;
        log.info("Stopped watching {}", noteDir);
    }

    public synchronized boolean isRunning() {
        return session != null && session.active;
    }

    /**
     * One start/stop cycle: a watch service, the daemon thread observing it,
     * and the queue its consumer drains.
     */
    private class Session {

        private final WatchService watchService;
        private final BlockingQueue<List<Path>> batches;
        private final Thread observer;
        private volatile boolean active = true;

        private Session(WatchService watchService, BlockingQueue<List<Path>> batches) {
            this.watchService = watchService;
            this.batches = batches;
            this.observer = new Thread(this::observe, "note-watcher");
            this.observer.setDaemon(true);
        }

        private void close() {
            active = false;
            observer.interrupt();
            closeWatchService();
        }

        private void closeWatchService() {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Failed to close watch service: {}", e.getMessage());
            }
        }

        private void observe() {
            ChangeDebouncer debouncer = new ChangeDebouncer(debounceMillis);
            try {
                while (active) {
                    long timeout = debouncer.isAccumulating()
                        ? debouncer.remainingMillis(System.currentTimeMillis())
                        : IDLE_POLL_MILLIS;
                    WatchKey key = watchService.poll(timeout, TimeUnit.MILLISECONDS);
                    if (key != null) {
                        for (WatchEvent<?> event : key.pollEvents()) {
                            if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                                log.warn("Watch events overflowed for {}; some changes may be missed", noteDir);
                                continue;
                            }
                            Path changed = noteDir.resolve((Path) event.context());
                            debouncer.offer(changed, System.currentTimeMillis());
                        }
                        if (!key.reset()) {
                            log.error("Watch key for {} is no longer valid", noteDir);
                            active = false;
                        }
                    }
                    var batch = debouncer.drainIfDue(System.currentTimeMillis());
                    if (batch.isPresent()) {
                        batches.put(batch.get());
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ClosedWatchServiceException e) {
                log.debug("Watch service closed");
            } finally {
                active = false;
                closeWatchService();
            }
        }

        private void consume() {
            try {
                while (active || !batches.isEmpty()) {
                    List<Path> batch = batches.poll(IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
                    if (batch == null) {
                        continue;
                    }
                    try {
                        reconciler.reconcile(batch);
                    } catch (RuntimeException e) {
                        log.error("Failed to reconcile batch of {} paths", batch.size(), e);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
