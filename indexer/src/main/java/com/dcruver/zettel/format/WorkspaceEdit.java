package com.dcruver.zettel.format;

import com.dcruver.zettel.io.TextEdit;
import lombok.Data;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A batch of line edits grouped by file.
 */
@Data
public class WorkspaceEdit {
    private final Map<Path, List<TextEdit>> changes = new LinkedHashMap<>();

    public void put(Path file, List<TextEdit> edits) {
        changes.put(file, List.copyOf(edits));
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public int editCount() {
        return changes.values().stream().mapToInt(List::size).sum();
    }
}
