package com.dcruver.zettel.lint;

import com.dcruver.zettel.index.NoteIndex;
import com.dcruver.zettel.index.NoteInfo;
import com.dcruver.zettel.io.NoteParser;
import com.dcruver.zettel.io.RefOccurrence;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags references to archived and legacy notes.
 *
 * A legacy reference is not flagged when it is immediately followed by a
 * reference to the note's evolution, e.g. {@code @old @new}.
 */
@Component
@RequiredArgsConstructor
public class ReferenceChecker {

    private static final Pattern NEXT_REF = Pattern.compile("^\\s*@(\\d+)");

    private final NoteIndex index;

    public List<ReferenceDiagnostic> check(String content) {
        List<ReferenceDiagnostic> diagnostics = new ArrayList<>();
        List<String> lines = content.lines().toList();

        for (RefOccurrence ref : NoteParser.findAllRefs(content)) {
            Optional<NoteInfo> target = index.get(ref.getId());
            if (target.isEmpty()) {
                continue;
            }
            NoteInfo info = target.get();
            String line = lines.get(ref.getLine());
            int start = NoteParser.byteToUtf16(line, ref.getStartByte());
            int end = NoteParser.byteToUtf16(line, ref.getEndByte());

            if (info.isArchived()) {
                String message = "Note @" + ref.getId() + " is archived.";
                if (info.getAltId() != null) {
                    message += " New version: @" + info.getAltId();
                }
                diagnostics.add(diagnostic(ReferenceDiagnostic.Kind.ARCHIVED, ReferenceDiagnostic.Severity.WARNING,
                    ref, start, end, message, info.getAltId()));
            } else if (info.isLegacy()) {
                if (info.getEvoId() != null && info.getEvoId().equals(nextRefId(line, end))) {
                    continue;
                }
                String message = "Note @" + ref.getId() + " is legacy.";
                if (info.getEvoId() != null) {
                    message += " Newer insights: @" + info.getEvoId();
                }
                diagnostics.add(diagnostic(ReferenceDiagnostic.Kind.LEGACY, ReferenceDiagnostic.Severity.INFORMATION,
                    ref, start, end, message, info.getEvoId()));
            }
        }
        return diagnostics;
    }

    private static String nextRefId(String line, int afterChar) {
        Matcher matcher = NEXT_REF.matcher(line.substring(afterChar));
        return matcher.find() ? matcher.group(1) : null;
    }

    private static ReferenceDiagnostic diagnostic(ReferenceDiagnostic.Kind kind, ReferenceDiagnostic.Severity severity,
                                                  RefOccurrence ref, int start, int end, String message, String newId) {
        return ReferenceDiagnostic.builder()
            .kind(kind)
            .severity(severity)
            .line(ref.getLine())
            .startChar(start)
            .endChar(end)
            .message(message)
            .oldId(ref.getId())
            .newId(newId)
            .build();
    }
}
