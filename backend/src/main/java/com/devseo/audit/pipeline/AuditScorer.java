package com.devseo.audit.pipeline;

import com.devseo.audit.analysis.IssueType;
import com.devseo.audit.analysis.SeoIssue;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Every category starts at 100 and loses a fixed penalty per issue of the types it owns, floored at 0.
 * Overall is the rounded mean of the four categories.
 */
@Component
public class AuditScorer {
    private static final Map<IssueType, Penalty> PENALTIES = new EnumMap<>(Map.of(
        IssueType.MISSING_META_DESCRIPTION, new Penalty(ScoreCategory.META, 25),
        IssueType.MISSING_H1, new Penalty(ScoreCategory.CONTENT, 20),
        IssueType.MULTIPLE_H1, new Penalty(ScoreCategory.CONTENT, 10),
        IssueType.THIN_CONTENT, new Penalty(ScoreCategory.CONTENT, 15),
        IssueType.DUPLICATE_TITLES, new Penalty(ScoreCategory.META, 15),
        IssueType.MISSING_ALT_TAGS, new Penalty(ScoreCategory.PERFORMANCE, 10),
        IssueType.NO_SCHEMA, new Penalty(ScoreCategory.TECHNICAL, 10),
        IssueType.ORPHAN_PAGE, new Penalty(ScoreCategory.TECHNICAL, 10)
    ));

    public CategoryScores score(List<SeoIssue> issues) {
        Map<ScoreCategory, Integer> scores = new EnumMap<>(ScoreCategory.class);
        for (ScoreCategory category : ScoreCategory.values()) {
            scores.put(category, 100);
        }
        for (SeoIssue issue : issues) {
            Penalty penalty = PENALTIES.get(issue.issueType());
            if (penalty == null) {
                continue;
            }
            scores.merge(penalty.category(), penalty.amount(), (current, amount) -> Math.max(0, current - amount));
        }
        int meta = scores.get(ScoreCategory.META);
        int content = scores.get(ScoreCategory.CONTENT);
        int performance = scores.get(ScoreCategory.PERFORMANCE);
        int technical = scores.get(ScoreCategory.TECHNICAL);
        int overall = (int) Math.round((meta + content + performance + technical) / 4.0);
        return new CategoryScores(meta, content, performance, technical, overall);
    }

    private record Penalty(ScoreCategory category, int amount) {
    }
}
