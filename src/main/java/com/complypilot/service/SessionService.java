package com.complypilot.service;

import com.complypilot.config.ComplyPilotProperties;
import com.complypilot.exception.UnauthenticatedException;
import com.complypilot.model.IdentityProfile;
import com.complypilot.model.User;
import com.complypilot.model.UserSession;
import com.complypilot.repository.UserRepository;
import com.complypilot.repository.UserSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Session issuance and lookup.
 * <p>
 * A successful identity exchange creates the user on first sight of the email (or refreshes
 * name and picture), drops the user's previous sessions and issues a bearer token valid for
 * the configured TTL.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final IdentityProvider identityProvider;
    private final UserRepository userRepository;
    private final UserSessionRepository sessionRepository;
    private final Clock clock;
    private final Duration ttl;

    public SessionService(IdentityProvider identityProvider,
                          UserRepository userRepository,
                          UserSessionRepository sessionRepository,
                          Clock clock,
                          ComplyPilotProperties properties) {
        this.identityProvider = identityProvider;
        this.userRepository = userRepository;
        this.sessionRepository = sessionRepository;
        this.clock = clock;
        this.ttl = properties.session().ttl();
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * Exchanges a login session id for a session token.
     */
    public IssuedSession exchange(String sessionId) {
        IdentityProfile identity = identityProvider.exchange(sessionId);
        Instant now = Instant.now(clock);

        User user = userRepository.findByEmail(identity.email())
                .map(existing -> userRepository.save(existing.withIdentity(identity.name(), identity.picture())))
                .orElseGet(() -> {
                    User created = new User(newUserId(), identity.email(), identity.name(), identity.picture(),
                            null, null, null, null, now);
                    log.info("Created user {} for {}", created.userId(), created.email());
                    return userRepository.save(created);
                });

        String token = identity.sessionToken() != null && !identity.sessionToken().isBlank()
                ? identity.sessionToken()
                : "session_" + UUID.randomUUID().toString().replace("-", "");

        sessionRepository.deleteByUserId(user.userId());
        UserSession session = sessionRepository.save(new UserSession(token, user.userId(), now.plus(ttl), now));
        log.info("Issued session for {} expiring {}", user.userId(), session.expiresAt());
        return new IssuedSession(session, user);
    }

    /**
     * Resolves the user owning a session token.
     *
     * @throws UnauthenticatedException if the token is missing, unknown or expired
     */
    public User authenticate(String token) {
        if (token == null || token.isBlank()) {
            throw new UnauthenticatedException("Not authenticated");
        }
        UserSession session = sessionRepository.findById(token)
                .orElseThrow(() -> new UnauthenticatedException("Invalid session"));
        if (session.isExpired(Instant.now(clock))) {
            throw new UnauthenticatedException("Session expired");
        }
        return userRepository.findById(session.userId())
                .orElseThrow(() -> new UnauthenticatedException("User not found"));
    }

    public void logout(String token) {
        if (token == null || token.isBlank()) return;
        sessionRepository.deleteById(token);
    }

    private static String newUserId() {
        return "user_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    public record IssuedSession(UserSession session, User user) {}
}
