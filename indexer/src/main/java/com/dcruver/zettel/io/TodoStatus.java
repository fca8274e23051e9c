package com.dcruver.zettel.io;

import lombok.Builder;
import lombok.Data;

/**
 * Checklist marker counts of a note, fenced code blocks excluded.
 */
@Data
@Builder
public class TodoStatus {
    private final int completed;
    private final int incomplete;

    public boolean hasItems() {
        return completed > 0 || incomplete > 0;
    }
}
