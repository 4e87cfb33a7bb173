package com.teknolojikpanda.codereview.core;

import com.teknolojikpanda.codereview.model.FileReview;
import com.teknolojikpanda.codereview.model.Finding;
import com.teknolojikpanda.codereview.model.FindingCategory;
import com.teknolojikpanda.codereview.model.FindingKind;
import com.teknolojikpanda.codereview.model.ReviewSummary;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ResultAggregatorTest {

    private final ResultAggregator aggregator = new ResultAggregator();

    @Test
    public void summarizesCountsAndTallies() {
        List<FileReview> reviews = Arrays.asList(
                new FileReview("a.js", Arrays.asList(
                        finding(FindingKind.WARNING, FindingCategory.READABILITY),
                        finding(FindingKind.INFO, FindingCategory.MAINTAINABILITY)), "Found 2"),
                FileReview.failed("b.js", "Review failed: boom"),
                new FileReview("c.py", Collections.singletonList(
                        finding(FindingKind.WARNING, FindingCategory.SECURITY)), "Found 1"));

        ReviewSummary summary = aggregator.summarize(reviews);

        assertEquals(3, summary.getTotalFiles());
        assertEquals(3, summary.getTotalFindings());
        assertEquals(2, summary.getFilesWithFindings());
        assertEquals(2, summary.countFor(FindingKind.WARNING));
        assertEquals(1, summary.countFor(FindingKind.INFO));
        assertEquals(1, summary.countFor(FindingCategory.SECURITY));
        assertFalse(summary.getFindingsByKind().containsKey(FindingKind.ERROR));
        assertFalse(summary.getFindingsByCategory().containsKey(FindingCategory.PERFORMANCE));
    }

    @Test
    public void totalsMatchPerFileFindings() {
        List<FileReview> reviews = Arrays.asList(
                new FileReview("a.js", Collections.nCopies(4, finding(FindingKind.STYLE, FindingCategory.MAINTAINABILITY)), ""),
                new FileReview("b.js", Collections.nCopies(3, finding(FindingKind.ERROR, FindingCategory.SECURITY)), ""));

        ReviewSummary summary = aggregator.summarize(reviews);

        int sum = reviews.stream().mapToInt(review -> review.getFindings().size()).sum();
        assertEquals(sum, summary.getTotalFindings());
        int kindTotal = summary.getFindingsByKind().values().stream().mapToInt(Integer::intValue).sum();
        assertEquals(sum, kindTotal);
    }

    @Test
    public void emptySessionHasEmptySummary() {
        ReviewSummary summary = aggregator.summarize(Collections.emptyList());

        assertEquals(0, summary.getTotalFiles());
        assertEquals(0, summary.getTotalFindings());
        assertTrue(summary.getFindingsByKind().isEmpty());
    }

    private static Finding finding(FindingKind kind, FindingCategory category) {
        return Finding.builder()
                .line(1)
                .kind(kind)
                .category(category)
                .message("m")
                .build();
    }
}
