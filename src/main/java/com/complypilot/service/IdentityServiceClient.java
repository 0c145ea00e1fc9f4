package com.complypilot.service;

import com.complypilot.config.ComplyPilotProperties;
import com.complypilot.exception.UnauthenticatedException;
import com.complypilot.exception.UnavailableException;
import com.complypilot.model.IdentityProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Map;

/**
 * HTTP client for the external identity provider.
 * Calls {@code GET /session-data} with the login session id in the {@code X-Session-ID} header.
 */
@Service
public class IdentityServiceClient implements IdentityProvider {

    private static final Logger log = LoggerFactory.getLogger(IdentityServiceClient.class);

    private final RestClient restClient;

    public IdentityServiceClient(ComplyPilotProperties properties) {
        ComplyPilotProperties.Identity identity = properties.identity();
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(identity.connectTimeout());
        factory.setReadTimeout(identity.readTimeout());

        this.restClient = RestClient.builder()
                .baseUrl(identity.baseUrl())
                .requestFactory(factory)
                .build();
    }

    @Override
    public IdentityProfile exchange(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new UnauthenticatedException("Invalid session ID");
        }
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> body = restClient.get()
                    .uri("/session-data")
                    .header("X-Session-ID", sessionId)
                    .retrieve()
                    .body(Map.class);

            if (body == null || !(body.get("email") instanceof String email) || email.isBlank()) {
                throw new UnauthenticatedException("Invalid session ID");
            }
            return new IdentityProfile(
                    email,
                    body.get("name") instanceof String name ? name : email,
                    body.get("picture") instanceof String picture ? picture : null,
                    body.get("session_token") instanceof String token ? token : null);

        } catch (RestClientResponseException e) {
            log.warn("Identity provider rejected session id: HTTP {}", e.getStatusCode().value());
            throw new UnauthenticatedException("Invalid session ID");
        } catch (RestClientException e) {
            log.error("Error contacting identity provider: {}", e.getMessage());
            throw new UnavailableException("Authentication service unavailable", e);
        }
    }
}
