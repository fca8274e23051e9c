package com.dcruver.zettel.format;

import com.dcruver.zettel.io.TextLines;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives a parent checklist item's state from the items nested under it.
 *
 * Items form a forest keyed by indentation. An item's descendants are the
 * checklist lines that follow it with strictly greater indentation, up to the
 * next line at equal or lesser indentation. Items are processed deepest-first,
 * so a parent sees its children's freshly computed state. Leaves are untouched;
 * a parent is checked iff all of its descendants are.
 */
@UtilityClass
public class NestedCheckboxAggregator {

    public static String updateNestedCheckboxes(String content) {
        List<String> lines = TextLines.split(content);

        List<int[]> items = new ArrayList<>();
        for (int idx = 0; idx < lines.size(); idx++) {
            String line = lines.get(idx);
            if (Checkboxes.isTodoLine(line)) {
                items.add(new int[]{idx, Checkboxes.indentOf(line)});
            }
        }

        boolean changed = false;
        for (int i = items.size() - 1; i >= 0; i--) {
            int lineIdx = items.get(i)[0];
            int indent = items.get(i)[1];

            boolean hasDescendants = false;
            boolean allDone = true;
            for (int j = i + 1; j < items.size(); j++) {
                if (items.get(j)[1] <= indent) {
                    break;
                }
                hasDescendants = true;
                if (!Checkboxes.isChecked(lines.get(items.get(j)[0]))) {
                    allDone = false;
                }
            }
            if (!hasDescendants) {
                continue;
            }

            String line = lines.get(lineIdx);
            if (Checkboxes.isChecked(line) != allDone) {
                lines.set(lineIdx, Checkboxes.replaceState(line, Checkboxes.stateFor(allDone)).orElse(line));
                changed = true;
            }
        }

        return changed ? TextLines.join(lines, content) : content;
    }
}
