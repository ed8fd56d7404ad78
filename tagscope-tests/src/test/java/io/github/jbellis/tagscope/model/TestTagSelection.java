package io.github.jbellis.tagscope.model;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TestTagSelection {
    @Test
    public void testParseSplitsOnCommas() {
        var selection = TagSelection.parse("music,gaming");
        assertEquals(List.of("music", "gaming"), selection.queries());
        assertEquals("music,gaming", selection.toString());
    }

    @Test
    public void testParseDropsEmptyItems() {
        assertEquals(List.of("music", "gaming"), TagSelection.parse(",music,,gaming,").queries());
    }

    @Test
    public void testParseKeepsWhitespace() {
        assertEquals(List.of("music", " gaming"), TagSelection.parse("music, gaming").queries());
    }

    @Test
    public void testParseKeepsDuplicates() {
        assertEquals(List.of("pop", "pop"), TagSelection.parse("pop,pop").queries());
    }

    @Test
    public void testEmptyInput() {
        assertTrue(TagSelection.parse("").isEmpty());
        assertTrue(TagSelection.parse(null).isEmpty());
        assertTrue(TagSelection.parse(",,").isEmpty());
        assertEquals(TagSelection.empty(), TagSelection.of());
    }
}
