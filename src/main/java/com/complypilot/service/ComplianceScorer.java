package com.complypilot.service;

import com.complypilot.catalog.QuestionCatalog;
import com.complypilot.model.Answer;
import com.complypilot.model.ComplianceCategory;
import com.complypilot.model.Gap;
import com.complypilot.model.Priority;
import com.complypilot.model.Question;
import com.complypilot.model.RiskLevel;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted scoring of health-check answers against the question catalog.
 * <p>
 * Rules:
 * <ul>
 *   <li>every catalog question adds its weight to its category maximum, answered or not</li>
 *   <li>a "yes" adds the weight to the achieved score</li>
 *   <li>a "no" produces a {@link Gap}; unanswered questions produce nothing</li>
 *   <li>an answer without a yes/no value counts as unanswered</li>
 *   <li>answers to unknown question ids are ignored</li>
 * </ul>
 * Gaps are ordered HIGH, MEDIUM, LOW and keep catalog order within a priority.
 */
@Service
public class ComplianceScorer {

    private static final Comparator<Gap> GAP_ORDER = Comparator.comparingInt(g -> g.priority().rank());

    private final QuestionCatalog catalog;

    public ComplianceScorer(QuestionCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Scores the answers. The answer list may be partial; for a repeated question id the last answer wins.
     *
     * @param answers submitted answers, in any order
     * @return percentages, risk level and prioritized gaps
     */
    public ScoreCard score(List<Answer> answers) {
        Map<String, Answer> answersById = new HashMap<>();
        for (Answer answer : answers) {
            if (answer != null && answer.questionId() != null && answer.answer() != null) {
                answersById.put(answer.questionId(), answer);
            }
        }

        Map<ComplianceCategory, int[]> totals = new EnumMap<>(ComplianceCategory.class);
        for (ComplianceCategory category : ComplianceCategory.values()) {
            totals.put(category, new int[2]);
        }

        List<Gap> gaps = new ArrayList<>();
        for (Question question : catalog.questions()) {
            int[] bucket = totals.get(question.category());
            bucket[1] += question.weight();

            Answer answer = answersById.get(question.id());
            if (answer == null) continue;
            if (answer.answer()) {
                bucket[0] += question.weight();
            } else {
                gaps.add(Gap.of(question));
            }
        }
        // List.sort is stable: equal priorities stay in catalog order
        gaps.sort(GAP_ORDER);

        int achieved = totals.values().stream().mapToInt(t -> t[0]).sum();
        int max = totals.values().stream().mapToInt(t -> t[1]).sum();
        int overall = percentage(achieved, max);

        int[] gdpr = totals.get(ComplianceCategory.GDPR);
        int[] cyber = totals.get(ComplianceCategory.CYBER_ESSENTIALS);
        return new ScoreCard(
                percentage(gdpr[0], gdpr[1]),
                percentage(cyber[0], cyber[1]),
                overall,
                RiskLevel.fromScore(overall),
                List.copyOf(gaps));
    }

    /**
     * Rounds achieved/max to a whole percentage, half to even. Returns 0 when nothing can be achieved.
     */
    static int percentage(int achieved, int max) {
        if (max <= 0) return 0;
        return (int) Math.rint((double) achieved / max * 100);
    }

    /**
     * Result of scoring one submission.
     */
    public record ScoreCard(
            int gdprScore,
            int cyberEssentialsScore,
            int overallScore,
            RiskLevel riskLevel,
            List<Gap> gaps
    ) {
        public long count(Priority priority) {
            return gaps.stream().filter(g -> g.priority() == priority).count();
        }
    }
}
