package com.teknolojikpanda.codereview.core;

import com.teknolojikpanda.codereview.model.FileReview;
import com.teknolojikpanda.codereview.model.Finding;
import com.teknolojikpanda.codereview.model.ReviewSummary;

import javax.annotation.Nonnull;
import javax.inject.Named;
import java.util.List;

/**
 * Summarizes per-file reviews. Kinds and categories that never occur are left out of the tallies.
 */
@Named
public class ResultAggregator {

    @Nonnull
    public ReviewSummary summarize(@Nonnull List<FileReview> reviews) {
        ReviewSummary.Builder builder = ReviewSummary.builder().totalFiles(reviews.size());
        int totalFindings = 0;
        int filesWithFindings = 0;
        for (FileReview review : reviews) {
            if (!review.hasFindings()) {
                continue;
            }
            filesWithFindings++;
            totalFindings += review.getFindings().size();
            for (Finding finding : review.getFindings()) {
                builder.addKindCount(finding.getKind(), 1);
                builder.addCategoryCount(finding.getCategory(), 1);
            }
        }
        return builder.totalFindings(totalFindings)
                .filesWithFindings(filesWithFindings)
                .build();
    }
}
