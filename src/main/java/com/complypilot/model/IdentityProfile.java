package com.complypilot.model;

/**
 * User data returned by the identity provider for a session id.
 *
 * @param sessionToken Token issued by the provider, may be {@code null}
 */
public record IdentityProfile(
        String email,
        String name,
        String picture,
        String sessionToken
) {}
