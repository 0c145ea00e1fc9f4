package com.complypilot.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Bearer session issued after a successful identity exchange.
 */
@Document(collection = "user_sessions")
public record UserSession(
        @Id String sessionToken,
        String userId,
        Instant expiresAt,
        Instant createdAt
) {
    public boolean isExpired(Instant now) {
        return expiresAt == null || expiresAt.isBefore(now);
    }
}
