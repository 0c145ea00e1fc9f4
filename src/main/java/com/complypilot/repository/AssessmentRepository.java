package com.complypilot.repository;

import com.complypilot.model.Assessment;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Append-only history of health-check assessments (collection health_checks).
 */
public interface AssessmentRepository extends MongoRepository<Assessment, String> {

    List<Assessment> findTop100BySubjectIdOrderByCreatedAtDesc(String subjectId);

    Optional<Assessment> findFirstBySubjectIdOrderByCreatedAtDesc(String subjectId);
}
