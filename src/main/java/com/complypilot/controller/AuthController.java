package com.complypilot.controller;

import com.complypilot.config.ComplyPilotProperties;
import com.complypilot.model.User;
import com.complypilot.service.SessionService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Map;

/**
 * Session exchange with the identity provider, current user and logout.
 */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final SessionService sessionService;
    private final String cookieName;

    public AuthController(SessionService sessionService, ComplyPilotProperties properties) {
        this.sessionService = sessionService;
        this.cookieName = properties.session().cookieName();
    }

    /**
     * Exchanges the identity provider's session id for a session token, returned as an
     * http-only cookie.
     *
     * <p>Endpoint: POST /api/auth/session
     */
    @PostMapping("/session")
    public ResponseEntity<Map<String, Object>> createSession(@RequestBody SessionRequest request) {
        SessionService.IssuedSession issued = sessionService.exchange(request.sessionId());
        ResponseCookie cookie = sessionCookie(issued.session().sessionToken(), sessionService.ttl());
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookie.toString())
                .body(Map.of("message", "Session created", "user", issued.user()));
    }

    @GetMapping("/me")
    public User me(@CurrentUser User user) {
        return user;
    }

    @PostMapping("/logout")
    public ResponseEntity<Map<String, String>> logout(HttpServletRequest request) {
        sessionService.logout(SessionTokens.extract(request, cookieName));
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookie("", Duration.ZERO).toString())
                .body(Map.of("message", "Logged out successfully"));
    }

    private ResponseCookie sessionCookie(String value, Duration maxAge) {
        return ResponseCookie.from(cookieName, value)
                .httpOnly(true)
                .secure(true)
                .sameSite("None")
                .maxAge(maxAge)
                .path("/")
                .build();
    }

    public record SessionRequest(String sessionId) {}
}
