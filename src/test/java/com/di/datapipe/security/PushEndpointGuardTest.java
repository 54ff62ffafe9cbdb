package com.di.datapipe.security;

import com.di.datapipe.exception.PermissionDeniedException;
import com.di.datapipe.exception.UnauthenticatedPushException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PushEndpointGuard Tests")
class PushEndpointGuardTest {

    private static final String INGESTION_SA = "ingestion-invoker@proj.iam.gserviceaccount.com";
    private static final String LOADER_SA = "loader-invoker@proj.iam.gserviceaccount.com";

    /** Accepts "Bearer <email>" and returns the email as the principal. */
    private final PushAuthenticator fakeAuthenticator = header -> {
        if (header == null || !header.startsWith("Bearer ")) {
            throw new UnauthenticatedPushException("no token");
        }
        return header.substring("Bearer ".length());
    };

    private final PushEndpointGuard guard = new PushEndpointGuard(fakeAuthenticator);

    @Test
    @DisplayName("Should accept the configured invoker")
    void testVerify_ExpectedInvoker() {
        assertEquals(INGESTION_SA, guard.verify("Bearer " + INGESTION_SA, INGESTION_SA));
    }

    @Test
    @DisplayName("Should reject a valid token from another stage's invoker")
    void testVerify_WrongPrincipal() {
        assertThrows(PermissionDeniedException.class, () -> guard.verify("Bearer " + LOADER_SA, INGESTION_SA));
    }

    @Test
    @DisplayName("Should reject when no invoker is configured")
    void testVerify_NoExpectedInvoker() {
        assertThrows(PermissionDeniedException.class, () -> guard.verify("Bearer " + LOADER_SA, null));
    }

    @Test
    @DisplayName("Should propagate authentication failures")
    void testVerify_Unauthenticated() {
        assertThrows(UnauthenticatedPushException.class, () -> guard.verify(null, INGESTION_SA));
    }
}
