package com.dcruver.zettel.format;

import com.dcruver.zettel.index.NoteIndex;
import com.dcruver.zettel.io.NoteBackupWriter;
import com.dcruver.zettel.io.TextEdit;
import com.dcruver.zettel.io.TextLines;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link WorkspaceEdit} to disk and re-indexes every file it touched.
 * A file that fails is reported and the rest are still written.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WorkspaceEditApplier {

    private final NoteBackupWriter writer;
    private final NoteIndex index;

    /**
     * @return the files that were written
     */
    public List<Path> apply(WorkspaceEdit workspaceEdit) {
        List<Path> written = new ArrayList<>();
        for (Map.Entry<Path, List<TextEdit>> entry : workspaceEdit.getChanges().entrySet()) {
            Path file = entry.getKey();
            try {
                String content = Files.readString(file);
                String updated = TextLines.applyEdits(content, entry.getValue());
                if (updated.equals(content)) {
                    continue;
                }
                writer.write(file, updated);
                index.updateFile(file);
                written.add(file);
                log.info("Applied {} edits to {}", entry.getValue().size(), file.getFileName());
            } catch (IOException e) {
                log.error("Failed to apply edits to {}", file, e);
            }
        }
        return written;
    }
}
