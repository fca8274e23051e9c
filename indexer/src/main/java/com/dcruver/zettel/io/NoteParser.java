package com.dcruver.zettel.io;

import lombok.experimental.UtilityClass;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless parsing of Zettelkasten note headers and content.
 *
 * A note looks like:
 * <pre>
 * /* Metadata:
 * Aliases: ZK LSP
 * Abstract: A test note.
 * Keyword: test, rust
 * *&#47;
 * #import "../include.typ": *
 * #show: zettel
 *
 * = Test Note &lt;2602082037&gt;
 * #tag.archived #tag.done
 * #alternative_link(&lt;2602131642&gt;)
 * </pre>
 * The title, tag and link lines sit at fixed offsets (+3, +4, +5) from the import line.
 */
@UtilityClass
public class NoteParser {

    public static final String IMPORT_LINE = "#import \"../include.typ\": *";

    private static final int TITLE_OFFSET = 3;
    private static final int TAG_OFFSET = 4;
    private static final int LINK_OFFSET = 5;

    private static final Pattern ID_REF = Pattern.compile("@(\\d{10})(?!\\d)");
    private static final Pattern TITLE = Pattern.compile("^=\\s+.*<(\\d{10})>");
    private static final Pattern EVOLUTION_LINK = Pattern.compile("#evolution_link\\s*\\(\\s*<(\\d{10})>\\s*\\)");
    private static final Pattern ALTERNATIVE_LINK = Pattern.compile("#alternative_link\\s*\\(\\s*<(\\d{10})>\\s*\\)");

    private static final String METADATA_START = "/* Metadata:";
    private static final String METADATA_END = "*/";

    /**
     * Parse the header of a note.
     *
     * @return the header, or empty if the import line is missing or the title line
     *     does not carry a 10-digit id; absence means "not a note", never an error
     */
    public static Optional<NoteHeader> parseHeader(String content) {
        List<String> lines = content.lines().toList();

        int importIdx = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).trim().equals(IMPORT_LINE)) {
                importIdx = i;
                break;
            }
        }
        if (importIdx < 0) {
            return Optional.empty();
        }

        int titleLineIdx = importIdx + TITLE_OFFSET;
        int tagLineIdx = importIdx + TAG_OFFSET;
        if (titleLineIdx >= lines.size()) {
            return Optional.empty();
        }

        Matcher titleMatcher = TITLE.matcher(lines.get(titleLineIdx));
        if (!titleMatcher.find()) {
            return Optional.empty();
        }
        String id = titleMatcher.group(1);
        String title = extractTitle(titleMatcher.group(0));

        String tagLine = lineAt(lines, tagLineIdx);
        String linkLine = lineAt(lines, importIdx + LINK_OFFSET);

        NoteHeader.NoteHeaderBuilder header = NoteHeader.builder()
            .id(id)
            .title(title)
            .archived(tagLine.contains("#tag.archived"))
            .legacy(tagLine.contains("#tag.legacy"))
            .evoId(firstGroup(EVOLUTION_LINK, linkLine))
            .altId(firstGroup(ALTERNATIVE_LINK, linkLine))
            .aliases(List.of())
            .keywords(List.of())
            .titleLineIdx(titleLineIdx)
            .tagLineIdx(tagLineIdx);

        parseMetadataBlock(lines.subList(0, importIdx), header);

        return Optional.of(header.build());
    }

    /**
     * Count checklist items, skipping fenced code blocks.
     */
    public static TodoStatus countTodos(String content) {
        int completed = 0;
        int incomplete = 0;
        boolean inCodeBlock = false;

        for (String line : content.lines().toList()) {
            String trimmed = line.stripLeading();
            if (trimmed.startsWith("```")) {
                inCodeBlock = !inCodeBlock;
                continue;
            }
            if (inCodeBlock) {
                continue;
            }
            Character marker = checklistMarker(trimmed);
            if (marker == null) {
                continue;
            }
            if (marker == 'x' || marker == 'X') {
                completed++;
            } else if (marker == ' ') {
                incomplete++;
            }
        }

        return TodoStatus.builder()
            .completed(completed)
            .incomplete(incomplete)
            .build();
    }

    /**
     * Find every {@code @<10 digits>} token, line-major and left to right.
     * Offsets in the result are byte offsets within the line.
     */
    public static List<RefOccurrence> findAllRefs(String content) {
        List<RefOccurrence> refs = new ArrayList<>();
        List<String> lines = content.lines().toList();

        for (int lineNum = 0; lineNum < lines.size(); lineNum++) {
            String line = lines.get(lineNum);
            Matcher matcher = ID_REF.matcher(line);
            while (matcher.find()) {
                refs.add(RefOccurrence.builder()
                    .id(matcher.group(1))
                    .line(lineNum)
                    .startByte(utf8Length(line, 0, matcher.start()))
                    .endByte(utf8Length(line, 0, matcher.end()))
                    .build());
            }
        }
        return refs;
    }

    /**
     * Status tag implied by the checklist counts; empty when the note has no items.
     */
    public static Optional<StatusTag> computeStatusTag(TodoStatus todos, boolean archived) {
        if (!todos.hasItems()) {
            return Optional.empty();
        }
        if (archived) {
            return Optional.of(StatusTag.DONE);
        }
        if (todos.getIncomplete() == 0) {
            return Optional.of(StatusTag.DONE);
        }
        if (todos.getCompleted() > 0) {
            return Optional.of(StatusTag.WIP);
        }
        return Optional.of(StatusTag.TODO);
    }

    /**
     * Convert a UTF-8 byte offset within {@code line} to a UTF-16 code-unit offset.
     * An offset falling inside a multi-byte character counts only the characters before it.
     */
    public static int byteToUtf16(String line, int byteOffset) {
        int bytes = 0;
        int units = 0;
        int i = 0;
        while (i < line.length()) {
            int codePoint = line.codePointAt(i);
            int width = utf8Width(codePoint);
            if (bytes + width > byteOffset) {
                break;
            }
            bytes += width;
            int chars = Character.charCount(codePoint);
            units += chars;
            i += chars;
        }
        return units;
    }

    /**
     * State character of a checklist line ({@code - [?]} after optional indentation), or null
     */
    static Character checklistMarker(String leftTrimmed) {
        if (leftTrimmed.length() >= 5 && leftTrimmed.startsWith("- [") && leftTrimmed.charAt(4) == ']') {
            return leftTrimmed.charAt(3);
        }
        return null;
    }

    private static String extractTitle(String heading) {
        int start = 0;
        while (start < heading.length() && heading.charAt(start) == '=') {
            start++;
        }
        String rest = heading.substring(start).trim();
        int lt = rest.lastIndexOf('<');
        return lt >= 0 ? rest.substring(0, lt).trim() : "";
    }

    private static void parseMetadataBlock(List<String> preamble, NoteHeader.NoteHeaderBuilder header) {
        boolean inMetadata = false;
        for (String line : preamble) {
            String trimmed = line.trim();
            if (trimmed.equals(METADATA_START)) {
                inMetadata = true;
                continue;
            }
            if (trimmed.equals(METADATA_END)) {
                break;
            }
            if (!inMetadata) {
                continue;
            }
            if (line.startsWith("Aliases:")) {
                header.aliases(splitList(line.substring("Aliases:".length())));
            } else if (line.startsWith("Abstract:")) {
                String value = line.substring("Abstract:".length()).trim();
                header.abstractText(value.isEmpty() ? null : value);
            } else if (line.startsWith("Keyword:")) {
                header.keywords(splitList(line.substring("Keyword:".length())));
            }
        }
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static String lineAt(List<String> lines, int idx) {
        return idx < lines.size() ? lines.get(idx) : "";
    }

    private static int utf8Length(String s, int from, int to) {
        return s.substring(from, to).getBytes(StandardCharsets.UTF_8).length;
    }

    private static int utf8Width(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }
}
