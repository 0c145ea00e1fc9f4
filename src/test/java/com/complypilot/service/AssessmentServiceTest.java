package com.complypilot.service;

import com.complypilot.catalog.QuestionCatalog;
import com.complypilot.model.Answer;
import com.complypilot.model.Assessment;
import com.complypilot.model.RiskLevel;
import com.complypilot.repository.AssessmentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AssessmentServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:15:30Z");

    private AssessmentRepository repository;
    private AssessmentService service;

    @BeforeEach
    void setUp() {
        repository = mock(AssessmentRepository.class);
        when(repository.save(any(Assessment.class))).thenAnswer(inv -> inv.getArgument(0));
        QuestionCatalog catalog = QuestionCatalog.ukSme();
        service = new AssessmentService(catalog, new ComplianceScorer(catalog), repository,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void storesNewAssessmentOnEverySubmission() {
        List<Answer> answers = List.of(new Answer("gdpr_1", true, "kept in a spreadsheet"),
                new Answer("ce_7", false, null));

        Assessment first = service.submit("user_1", answers);
        Assessment second = service.submit("user_1", answers);

        assertNotEquals(first.id(), second.id());
        ArgumentCaptor<Assessment> saved = ArgumentCaptor.forClass(Assessment.class);
        verify(repository, times(2)).save(saved.capture());
        Assessment stored = saved.getAllValues().get(0);
        assertEquals("user_1", stored.subjectId());
        assertEquals(answers, stored.responses());
        assertEquals(NOW, stored.createdAt());
        assertEquals(1, stored.totalGaps());
        assertEquals("ce_7", stored.gaps().get(0).questionId());
        assertEquals(9, stored.gdprScore());
        assertEquals(0, stored.cyberEssentialsScore());
    }

    @Test
    void treatsMissingAnswerListAsEmpty() {
        Assessment assessment = service.submit("user_1", null);

        assertEquals(0, assessment.complianceScore());
        assertEquals(RiskLevel.CRITICAL, assessment.riskLevel());
        assertTrue(assessment.responses().isEmpty());
        assertTrue(assessment.gaps().isEmpty());
    }

    @Test
    void dropsNullEntriesFromAnswerList() {
        List<Answer> answers = new ArrayList<>();
        answers.add(null);
        answers.add(new Answer("gdpr_1", true, null));

        Assessment assessment = service.submit("user_1", answers);

        assertEquals(List.of(new Answer("gdpr_1", true, null)), assessment.responses());
        assertTrue(assessment.gdprScore() > 0);
    }

    @Test
    void exposesCatalogWithCategoryTotals() {
        AssessmentService.CatalogView view = service.catalog();

        assertEquals(30, view.totalQuestions());
        assertEquals(15L, view.categories().get("GDPR"));
        assertEquals(15L, view.categories().get("Cyber Essentials"));
    }
}
