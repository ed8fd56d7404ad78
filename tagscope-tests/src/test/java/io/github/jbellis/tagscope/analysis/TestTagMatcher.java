package io.github.jbellis.tagscope.analysis;

import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestTagMatcher {
    @Test
    public void testSubstringMatches() {
        assertTrue(TagMatcher.matches("musical", "music"));
        assertTrue(TagMatcher.matches("livemusic", "music"));
        assertTrue(TagMatcher.matches("music", "music"));
    }

    @Test
    public void testQueryLongerThanTagDoesNotMatch() {
        assertFalse(TagMatcher.matches("pop", "popular"));
    }

    @Test
    public void testCaseSensitive() {
        assertFalse(TagMatcher.matches("Music", "music"));
    }

    @Test
    public void testEmptyQueryMatchesEverything() {
        assertTrue(TagMatcher.matches("anything", ""));
        assertTrue(TagMatcher.matches("", ""));
    }
}
