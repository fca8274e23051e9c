package com.dcruver.zettel.lint;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A reference to a note that has been superseded. Offsets are UTF-16 code units.
 */
@Data
@Builder
public class ReferenceDiagnostic {
    private final Kind kind;
    private final Severity severity;
    private final int line;
    private final int startChar;
    private final int endChar;
    private final String message;
    private final String oldId;
    // Successor (archived) or newer insight (legacy), if the note names one
    private final String newId;

    public enum Kind {
        ARCHIVED,
        LEGACY
    }

    public enum Severity {
        WARNING,
        INFORMATION
    }

    /**
     * Replacements for the reference's range; none without a successor id
     */
    public List<QuickFix> quickFixes() {
        List<QuickFix> fixes = new ArrayList<>();
        if (newId == null) {
            return fixes;
        }
        String oldText = "@" + oldId;
        String newText = "@" + newId;
        fixes.add(new QuickFix("Fix: Replace " + oldText + " with " + newText, newText));
        if (kind == Kind.LEGACY) {
            fixes.add(new QuickFix(
                "Fix: Append new insight (" + oldText + " " + newText + ")",
                oldText + " " + newText));
        }
        return fixes;
    }

    @Data
    public static class QuickFix {
        private final String title;
        private final String newText;
    }
}
