package com.di.datapipe.security;

import com.di.datapipe.exception.UnauthenticatedPushException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GoogleOidcPushAuthenticator Tests")
class GoogleOidcPushAuthenticatorTest {

    private final GoogleOidcPushAuthenticator authenticator =
            new GoogleOidcPushAuthenticator("https://datapipe.example.com");

    @Test
    @DisplayName("Should reject a missing Authorization header")
    void testMissingHeader() {
        assertThrows(UnauthenticatedPushException.class, () -> authenticator.authenticate(null));
    }

    @Test
    @DisplayName("Should reject a non-bearer scheme")
    void testNonBearer() {
        assertThrows(UnauthenticatedPushException.class, () -> authenticator.authenticate("Basic dXNlcjpwYXNz"));
    }

    @Test
    @DisplayName("Should reject a token that is not a signed JWT")
    void testUnparseableToken() {
        assertThrows(UnauthenticatedPushException.class, () -> authenticator.authenticate("Bearer not-a-jwt"));
    }
}
