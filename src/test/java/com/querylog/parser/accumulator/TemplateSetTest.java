package com.querylog.parser.accumulator;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TemplateSetTest {

    @Test
    public void testIncrementMovesTemplateAheadOfLowerCounts() {
        TemplateSet set = new TemplateSet();
        set.add("A");
        set.add("B");
        set.add("C");

        set.increment(2);

        List<Template> ordered = set.byDescendingCount();
        assertEquals("C", ordered.get(0).getText());
        assertEquals("A", ordered.get(1).getText());
        assertEquals("B", ordered.get(2).getText());
    }

    @Test
    public void testEqualCountsKeepCreationOrder() {
        TemplateSet set = new TemplateSet();
        set.add("A");
        set.add("B");
        set.increment(0);
        set.increment(1);

        assertEquals("A", set.get(0).getText());
        assertEquals("B", set.get(1).getText());
        assertEquals(2, set.get(1).getCount());
        assertEquals(4, set.getTotalCount());
    }

    @Test
    public void testOrderIsNonIncreasing() {
        TemplateSet set = new TemplateSet();
        for (int i = 0; i < 5; i++) {
            set.add("T" + i);
        }
        int[] hits = { 4, 4, 2, 3, 1, 3, 4, 0 };
        for (int text : hits) {
            for (int i = 0; i < set.size(); i++) {
                if (set.get(i).getText().equals("T" + text)) {
                    set.increment(i);
                    break;
                }
            }
        }

        List<Template> ordered = set.byDescendingCount();
        for (int i = 1; i < ordered.size(); i++) {
            assertTrue(ordered.get(i - 1).getCount() >= ordered.get(i).getCount());
        }
        assertEquals("T4", ordered.get(0).getText());
        assertEquals(4, ordered.get(0).getCount());
        assertThrows(UnsupportedOperationException.class, () -> ordered.remove(0));
    }
}
