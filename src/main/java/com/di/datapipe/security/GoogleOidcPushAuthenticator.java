package com.di.datapipe.security;

import com.di.datapipe.exception.UnauthenticatedPushException;
import com.google.api.client.json.webtoken.JsonWebSignature;
import com.google.auth.oauth2.TokenVerifier;
import lombok.extern.slf4j.Slf4j;

/**
 * Verifies Google-signed OIDC tokens that Pub/Sub attaches to authenticated push requests.
 * Signature, issuer, audience and expiry are checked by {@link TokenVerifier}; the principal is
 * the token's {@code email} claim, which must be verified.
 */
@Slf4j
public class GoogleOidcPushAuthenticator implements PushAuthenticator {

    private static final String BEARER = "Bearer ";
    private static final String GOOGLE_ISSUER = "https://accounts.google.com";

    private final TokenVerifier verifier;

    public GoogleOidcPushAuthenticator(String audience) {
        this(TokenVerifier.newBuilder()
                .setAudience(audience)
                .setIssuer(GOOGLE_ISSUER)
                .build());
    }

    GoogleOidcPushAuthenticator(TokenVerifier verifier) {
        this.verifier = verifier;
    }

    @Override
    public String authenticate(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER)) {
            throw new UnauthenticatedPushException("Push request carries no bearer token");
        }
        String token = authorizationHeader.substring(BEARER.length()).trim();
        JsonWebSignature jws;
        try {
            jws = verifier.verify(token);
        } catch (TokenVerifier.VerificationException e) {
            throw new UnauthenticatedPushException("Push token verification failed: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new UnauthenticatedPushException("Push token is not a signed JWT", e);
        }
        Object email = jws.getPayload().get("email");
        Object emailVerified = jws.getPayload().get("email_verified");
        if (!(email instanceof String) || !Boolean.TRUE.equals(emailVerified)) {
            throw new UnauthenticatedPushException("Push token has no verified email claim");
        }
        return (String) email;
    }
}
