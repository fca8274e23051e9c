package com.dcruver.zettel.io;

/**
 * Derived classification of a note from its checklist contents.
 */
public enum StatusTag {
    TODO("#tag.todo"),
    WIP("#tag.wip"),
    DONE("#tag.done");

    private final String tagText;

    StatusTag(String tagText) {
        this.tagText = tagText;
    }

    /**
     * Literal token written on a note's tag line
     */
    public String getTagText() {
        return tagText;
    }
}
