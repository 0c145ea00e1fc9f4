package com.complypilot.service;

import com.complypilot.config.ComplyPilotProperties;
import com.complypilot.exception.UnauthenticatedException;
import com.complypilot.model.IdentityProfile;
import com.complypilot.model.User;
import com.complypilot.model.UserSession;
import com.complypilot.repository.UserRepository;
import com.complypilot.repository.UserSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SessionServiceTest {

    private static final Instant NOW = Instant.parse("2026-06-01T12:00:00Z");

    private IdentityProvider identityProvider;
    private UserRepository userRepository;
    private UserSessionRepository sessionRepository;
    private SessionService service;

    @BeforeEach
    void setUp() {
        identityProvider = mock(IdentityProvider.class);
        userRepository = mock(UserRepository.class);
        sessionRepository = mock(UserSessionRepository.class);
        when(userRepository.save(any(User.class))).thenAnswer(inv -> inv.getArgument(0));
        when(sessionRepository.save(any(UserSession.class))).thenAnswer(inv -> inv.getArgument(0));

        ComplyPilotProperties properties = new ComplyPilotProperties(null,
                new ComplyPilotProperties.Session(Duration.ofDays(7), "session_token"), null);
        service = new SessionService(identityProvider, userRepository, sessionRepository,
                Clock.fixed(NOW, ZoneOffset.UTC), properties);
    }

    @Test
    void exchangeCreatesUserOnFirstLogin() {
        when(identityProvider.exchange("sid-1"))
                .thenReturn(new IdentityProfile("new@shop.co.uk", "New Owner", "https://img/p.png", "tok-1"));
        when(userRepository.findByEmail("new@shop.co.uk")).thenReturn(Optional.empty());

        SessionService.IssuedSession issued = service.exchange("sid-1");

        User user = issued.user();
        assertTrue(user.userId().matches("user_[0-9a-f]{12}"), user.userId());
        assertEquals("new@shop.co.uk", user.email());
        assertEquals("New Owner", user.name());
        assertEquals(NOW, user.createdAt());

        UserSession session = issued.session();
        assertEquals("tok-1", session.sessionToken());
        assertEquals(user.userId(), session.userId());
        assertEquals(NOW.plus(Duration.ofDays(7)), session.expiresAt());
    }

    @Test
    void exchangeRefreshesReturningUserAndReplacesSessions() {
        User existing = new User("user_aaaaaaaaaaaa", "back@shop.co.uk", "Old Name", null,
                "Shop Ltd", "retail", 8, null, Instant.EPOCH);
        when(identityProvider.exchange("sid-2"))
                .thenReturn(new IdentityProfile("back@shop.co.uk", "New Name", "pic", null));
        when(userRepository.findByEmail("back@shop.co.uk")).thenReturn(Optional.of(existing));

        SessionService.IssuedSession issued = service.exchange("sid-2");

        assertEquals("user_aaaaaaaaaaaa", issued.user().userId());
        assertEquals("New Name", issued.user().name());
        assertEquals("Shop Ltd", issued.user().companyName());
        assertTrue(issued.session().sessionToken().matches("session_[0-9a-f]{32}"));

        InOrder inOrder = inOrder(sessionRepository);
        inOrder.verify(sessionRepository).deleteByUserId("user_aaaaaaaaaaaa");
        inOrder.verify(sessionRepository).save(any(UserSession.class));
    }

    @Test
    void authenticateResolvesUser() {
        User user = new User("user_1", "a@b.c", "A", null, null, null, null, null, Instant.EPOCH);
        when(sessionRepository.findById("tok")).thenReturn(Optional.of(
                new UserSession("tok", "user_1", NOW.plusSeconds(60), NOW)));
        when(userRepository.findById("user_1")).thenReturn(Optional.of(user));

        assertEquals(user, service.authenticate("tok"));
    }

    @Test
    void authenticateRejectsMissingToken() {
        assertEquals("Not authenticated",
                assertThrows(UnauthenticatedException.class, () -> service.authenticate(null)).getMessage());
        assertThrows(UnauthenticatedException.class, () -> service.authenticate(" "));
    }

    @Test
    void authenticateRejectsUnknownToken() {
        when(sessionRepository.findById("nope")).thenReturn(Optional.empty());

        assertEquals("Invalid session",
                assertThrows(UnauthenticatedException.class, () -> service.authenticate("nope")).getMessage());
    }

    @Test
    void authenticateRejectsExpiredSession() {
        when(sessionRepository.findById("old")).thenReturn(Optional.of(
                new UserSession("old", "user_1", NOW.minusSeconds(1), NOW.minus(Duration.ofDays(8)))));

        assertEquals("Session expired",
                assertThrows(UnauthenticatedException.class, () -> service.authenticate("old")).getMessage());
        verify(userRepository, never()).findById(any());
    }

    @Test
    void logoutDeletesSession() {
        service.logout("tok");
        service.logout(null);

        verify(sessionRepository, times(1)).deleteById("tok");
    }
}
