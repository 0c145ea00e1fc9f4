package com.complypilot.service;

import com.complypilot.model.IdentityProfile;

/**
 * Exchanges a one-time login session id for the user's identity.
 */
public interface IdentityProvider {

    /**
     * @throws com.complypilot.exception.UnauthenticatedException if the provider rejects the session id
     * @throws com.complypilot.exception.UnavailableException      if the provider cannot be reached
     */
    IdentityProfile exchange(String sessionId);
}
