package com.complypilot.repository;

import com.complypilot.model.RiskRegister;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface RiskRegisterRepository extends MongoRepository<RiskRegister, String> {

    Optional<RiskRegister> findFirstBySubjectId(String subjectId);

    long deleteBySubjectId(String subjectId);
}
