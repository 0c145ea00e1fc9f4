package com.complypilot.service;

import com.complypilot.catalog.QuestionCatalog;
import com.complypilot.model.Answer;
import com.complypilot.model.Assessment;
import com.complypilot.model.Priority;
import com.complypilot.model.Question;
import com.complypilot.repository.AssessmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Health-check submissions: scores answers and appends the result to the subject's history.
 */
@Service
public class AssessmentService {

    private static final Logger log = LoggerFactory.getLogger(AssessmentService.class);

    private final QuestionCatalog catalog;
    private final ComplianceScorer scorer;
    private final AssessmentRepository repository;
    private final Clock clock;

    public AssessmentService(QuestionCatalog catalog, ComplianceScorer scorer,
                             AssessmentRepository repository, Clock clock) {
        this.catalog = catalog;
        this.scorer = scorer;
        this.repository = repository;
        this.clock = clock;
    }

    public CatalogView catalog() {
        return new CatalogView(catalog.questions(), catalog.questions().size(), catalog.countsByCategory());
    }

    /**
     * Scores the answers and stores a new assessment. Earlier assessments are never modified.
     */
    public Assessment submit(String subjectId, List<Answer> answers) {
        // null entries are dropped like answers to unknown questions
        List<Answer> submitted = answers != null
                ? answers.stream().filter(Objects::nonNull).toList()
                : List.of();
        ComplianceScorer.ScoreCard card = scorer.score(submitted);

        Assessment assessment = new Assessment(
                UUID.randomUUID().toString(),
                subjectId,
                submitted,
                card.overallScore(),
                card.gdprScore(),
                card.cyberEssentialsScore(),
                card.riskLevel(),
                card.gaps(),
                card.gaps().size(),
                Instant.now(clock));
        repository.save(assessment);

        log.info("Assessment {} for {}: overall {}% (GDPR {}%, CE {}%), risk {}, gaps {} ({} high)",
                assessment.id(), subjectId, card.overallScore(), card.gdprScore(),
                card.cyberEssentialsScore(), card.riskLevel().value(), card.gaps().size(),
                card.count(Priority.HIGH));
        return assessment;
    }

    /** Newest first, at most 100. */
    public List<Assessment> history(String subjectId) {
        return repository.findTop100BySubjectIdOrderByCreatedAtDesc(subjectId);
    }

    public Optional<Assessment> latest(String subjectId) {
        return repository.findFirstBySubjectIdOrderByCreatedAtDesc(subjectId);
    }

    /**
     * The questionnaire as served to clients.
     */
    public record CatalogView(List<Question> questions, int totalQuestions, Map<String, Long> categories) {}
}
