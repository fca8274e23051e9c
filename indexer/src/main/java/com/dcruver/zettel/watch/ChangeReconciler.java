package com.dcruver.zettel.watch;

import com.dcruver.zettel.config.WikiProperties;
import com.dcruver.zettel.format.TagPropagator;
import com.dcruver.zettel.format.WorkspaceEdit;
import com.dcruver.zettel.format.WorkspaceEditApplier;
import com.dcruver.zettel.index.NoteIndex;
import com.dcruver.zettel.io.NoteFiles;
import com.dcruver.zettel.io.NoteHeader;
import com.dcruver.zettel.io.NoteParser;
import com.dcruver.zettel.io.StatusTag;
import com.dcruver.zettel.link.LinkRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Applies a batch of changed paths to the index and the link registry.
 *
 * Watch events do not reliably say whether a file was created, modified or
 * deleted, so existence is checked at consumption time: a present file is
 * re-indexed and registered, a missing one is removed and deregistered.
 */
@Component
@Slf4j
public class ChangeReconciler {

    private final NoteIndex index;
    private final LinkRegistry linkRegistry;
    private final TagPropagator propagator;
    private final WorkspaceEditApplier applier;
    private final boolean propagateOnChange;

    @Autowired
    public ChangeReconciler(NoteIndex index, LinkRegistry linkRegistry, TagPropagator propagator,
                            WorkspaceEditApplier applier, WikiProperties properties) {
        this(index, linkRegistry, propagator, applier, properties.getWatcher().isPropagateOnChange());
    }

    public ChangeReconciler(NoteIndex index, LinkRegistry linkRegistry, TagPropagator propagator,
                            WorkspaceEditApplier applier, boolean propagateOnChange) {
        this.index = index;
        this.linkRegistry = linkRegistry;
        this.propagator = propagator;
        this.applier = applier;
        this.propagateOnChange = propagateOnChange;
    }

    public void reconcile(List<Path> batch) {
        for (Path path : batch) {
            Optional<String> id = NoteFiles.idOf(path);
            if (id.isEmpty()) {
                continue;
            }
            try {
                if (Files.exists(path)) {
                    log.info("Note changed/created: {}", path);
                    index.updateFile(path);
                    linkRegistry.addEntry(id.get());
                    if (propagateOnChange) {
                        propagateFrom(path);
                    }
                } else {
                    log.info("Note removed: {}", path);
                    index.removeByPath(path);
                    linkRegistry.removeEntry(id.get());
                }
            } catch (IOException e) {
                log.error("Failed to reconcile change to {}", path, e);
            }
        }
    }

    private void propagateFrom(Path path) throws IOException {
        String content = Files.readString(path);
        Optional<NoteHeader> header = NoteParser.parseHeader(content);
        if (header.isEmpty()) {
            return;
        }
        Optional<StatusTag> tag = NoteParser.computeStatusTag(
            NoteParser.countTodos(content), header.get().isArchived());
        if (tag.isEmpty() || tag.get() == StatusTag.TODO) {
            return;
        }
        WorkspaceEdit edit = propagator.propagateTagChange(header.get().getId(), tag.get());
        if (!edit.isEmpty()) {
            applier.apply(edit);
        }
    }
}
