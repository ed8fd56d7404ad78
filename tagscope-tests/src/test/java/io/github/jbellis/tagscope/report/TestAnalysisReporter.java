package io.github.jbellis.tagscope.report;

import io.github.jbellis.tagscope.analysis.HashAggregationEngine;
import io.github.jbellis.tagscope.analysis.HeapRankingEngine;
import io.github.jbellis.tagscope.model.TagSelection;
import io.github.jbellis.tagscope.model.VideoRecord;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static io.github.jbellis.tagscope.TestUtil.video;
import static org.junit.Assert.assertEquals;

public class TestAnalysisReporter {
    private static final List<VideoRecord> RECORDS = List.of(
            video("Song A", 1000, 50, "music"),
            video("Song B", 100, 20, "musical"),
            video("Unwatched", 0, 3, "gaming"));

    @Test
    public void testRankingLines() {
        var lines = AnalysisReporter.rankingLines(HeapRankingEngine.rank(RECORDS, TagSelection.of("music")));

        assertEquals(List.of(
                "Top 10 videos by like/view ratio for selected tags:",
                "1. Song B (ratio: 0.2)",
                "2. Song A (ratio: 0.05)"), lines);
    }

    @Test
    public void testAggregationLines() {
        var lines = AnalysisReporter.aggregationLines(
                HashAggregationEngine.aggregate(RECORDS, TagSelection.of("music", "cooking", "gaming")));

        assertEquals(List.of(
                "Average like/view ratio for each selected tag:",
                " - music: 0.125",
                "Tag 'cooking' not found.",
                " - gaming: 0"), lines);
    }

    @Test
    public void testEmptyRankingPrintsHeaderOnly() {
        var bytes = new ByteArrayOutputStream();
        var reporter = new AnalysisReporter(new PrintStream(bytes, true, StandardCharsets.UTF_8));
        reporter.reportRanking(HeapRankingEngine.rank(RECORDS, TagSelection.of("cooking")));

        String expected = System.lineSeparator()
                + "Top 10 videos by like/view ratio for selected tags:" + System.lineSeparator();
        assertEquals(expected, bytes.toString(StandardCharsets.UTF_8));
    }
}
