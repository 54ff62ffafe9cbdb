package com.di.datapipe.security;

/**
 * Verifies the identity token attached to a push delivery.
 */
public interface PushAuthenticator {

    /**
     * @param authorizationHeader raw {@code Authorization} header value, may be null
     * @return the verified principal (service account email)
     * @throws com.di.datapipe.exception.UnauthenticatedPushException when the token is missing or invalid
     */
    String authenticate(String authorizationHeader);
}
