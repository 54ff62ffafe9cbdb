package com.di.datapipe.security;

import com.di.datapipe.exception.PermissionDeniedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Trust boundary for push endpoints: the token must verify and its principal must be the
 * invoker configured for that endpoint.
 */
@Slf4j
@RequiredArgsConstructor
public class PushEndpointGuard {

    private final PushAuthenticator authenticator;

    /**
     * @return the verified principal
     * @throws com.di.datapipe.exception.UnauthenticatedPushException when the token does not verify
     * @throws PermissionDeniedException when the principal is not {@code expectedInvoker}
     */
    public String verify(String authorizationHeader, String expectedInvoker) {
        String principal = authenticator.authenticate(authorizationHeader);
        if (expectedInvoker == null || !expectedInvoker.equalsIgnoreCase(principal)) {
            log.error("[PUSH] rejected principal={} expected={}", principal, expectedInvoker);
            throw new PermissionDeniedException("Principal " + principal + " is not the expected invoker");
        }
        return principal;
    }
}
