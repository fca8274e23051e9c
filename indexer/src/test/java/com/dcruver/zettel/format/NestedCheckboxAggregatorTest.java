package com.dcruver.zettel.format;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NestedCheckboxAggregatorTest {

    @Test
    void testThreeLevelsAggregateBottomUp() {
        String content = """
            - [ ] A
              - [ ] B
                - [x] C
            """;

        String expected = """
            - [x] A
              - [x] B
                - [x] C
            """;
        assertEquals(expected, NestedCheckboxAggregator.updateNestedCheckboxes(content));
    }

    @Test
    void testParentUncheckedWhenAnyDescendantOpen() {
        String content = """
            - [x] parent
              - [x] done child
              - [ ] open child
            - [x] sibling leaf
            """;

        String expected = """
            - [ ] parent
              - [x] done child
              - [ ] open child
            - [x] sibling leaf
            """;
        assertEquals(expected, NestedCheckboxAggregator.updateNestedCheckboxes(content));
    }

    @Test
    void testDeepDescendantCounts() {
        String content = """
            - [x] top
              - [x] middle
                - [ ] deep
            """;

        String updated = NestedCheckboxAggregator.updateNestedCheckboxes(content);

        assertTrue(updated.startsWith("- [ ] top\n  - [ ] middle\n"));
    }

    @Test
    void testAggregationIsIdempotent() {
        String content = """
            - [ ] root
              - [X] first branch
                - [x] leaf
                - [ ] open leaf
              - [ ] second branch
                - [X] deep
                  - [x] deeper
            text between lists
            - [x] other root
                - [ ] oddly indented child
              - [x] sibling at lower depth
            - [X] lone leaf
            """;

        String once = NestedCheckboxAggregator.updateNestedCheckboxes(content);
        String twice = NestedCheckboxAggregator.updateNestedCheckboxes(once);

        assertEquals(once, twice);
        assertTrue(once.contains("\n  - [ ] first branch\n"), once);
        assertTrue(once.contains("\n  - [x] second branch\n"), once);
        assertTrue(once.startsWith("- [ ] root\n"), once);
        assertTrue(once.contains("\n- [ ] other root\n"), once);
        assertTrue(once.endsWith("- [X] lone leaf\n"), once);
    }

    @Test
    void testLeavesAreUntouched() {
        String content = "- [ ] one\n- [x] two\nplain text";

        assertSame(content, NestedCheckboxAggregator.updateNestedCheckboxes(content));
    }

    @Test
    void testUppercaseXCountsAsChecked() {
        String content = "- [X] parent\n  - [X] child\n";

        assertSame(content, NestedCheckboxAggregator.updateNestedCheckboxes(content));
    }
}
