package com.complypilot.repository;

import com.complypilot.model.PolicyDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.util.List;
import java.util.Optional;

/**
 * Uploaded policy documents (collection documents). All lookups are scoped to the owner.
 * Listing queries leave out the raw content; only single-document lookups load it.
 */
public interface PolicyDocumentRepository extends MongoRepository<PolicyDocument, String> {

    String WITHOUT_CONTENT = "{ 'content': 0 }";

    Optional<PolicyDocument> findByIdAndSubjectId(String id, String subjectId);

    @Query(fields = WITHOUT_CONTENT)
    List<PolicyDocument> findTop100BySubjectIdOrderByCreatedAtDesc(String subjectId);

    @Query(fields = WITHOUT_CONTENT)
    List<PolicyDocument> findTop10BySubjectIdOrderByCreatedAtDesc(String subjectId);

    long deleteByIdAndSubjectId(String id, String subjectId);
}
