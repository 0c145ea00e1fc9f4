package com.complypilot.repository;

import com.complypilot.model.UserSession;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface UserSessionRepository extends MongoRepository<UserSession, String> {

    long deleteByUserId(String userId);
}
