package com.dcruver.zettel.format;

import com.dcruver.zettel.config.WikiProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Normalizes a note: reference-based checkbox resolution, then nested
 * checkbox aggregation, then tag-line correction.
 */
@Component
@RequiredArgsConstructor
public class NoteFormatter {

    private final ReferenceCheckboxResolver referenceResolver;
    private final WikiProperties properties;

    /**
     * Format against the configured note directory
     */
    public String formatContent(String content) {
        return formatContent(content, properties.getNoteDir());
    }

    public String formatContent(String content, Path noteDir) {
        String afterRefs = referenceResolver.updateRefCheckboxes(content, noteDir);
        String afterNested = NestedCheckboxAggregator.updateNestedCheckboxes(afterRefs);
        return TagEditor.applyTagEdit(afterNested);
    }
}
