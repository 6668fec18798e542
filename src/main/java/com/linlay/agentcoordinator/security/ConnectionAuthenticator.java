package com.linlay.agentcoordinator.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Date;

import com.linlay.agentcoordinator.config.AppAuthProperties;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Handshake identity checks. Clients may connect anonymously; a client that presents a token must
 * present a valid HS256 JWT carrying {@code sub} and {@code user_id}. Agents must present the shared
 * API key. With {@code coordinator.auth.enabled=false} every handshake is accepted anonymously.
 */
@Component
public class ConnectionAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(ConnectionAuthenticator.class);
    private static final int MIN_SECRET_BYTES = 32;
    static final String USER_ID_CLAIM = "user_id";

    private final AppAuthProperties authProperties;

    private volatile MACVerifier verifier;

    public ConnectionAuthenticator(AppAuthProperties authProperties) {
        this.authProperties = authProperties;
    }

    @PostConstruct
    void initialize() {
        if (!authProperties.isEnabled()) {
            log.warn("Connection authentication is disabled");
            return;
        }
        String secret = authProperties.getClientTokenSecret();
        if (!StringUtils.hasText(secret)) {
            throw new IllegalStateException("coordinator.auth.client-token-secret must be configured when auth is enabled");
        }
        byte[] secretBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("coordinator.auth.client-token-secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        if (!StringUtils.hasText(authProperties.getAgentApiKey())) {
            throw new IllegalStateException("coordinator.auth.agent-api-key must be configured when auth is enabled");
        }
        try {
            verifier = new MACVerifier(secretBytes);
        } catch (JOSEException ex) {
            throw new IllegalStateException("coordinator.auth.client-token-secret is not a valid HMAC key", ex);
        }
    }

    public ClientIdentity authenticateClient(String token) {
        if (!authProperties.isEnabled() || !StringUtils.hasText(token)) {
            return ClientIdentity.anonymous();
        }

        SignedJWT jwt;
        JWTClaimsSet claims;
        try {
            jwt = SignedJWT.parse(token.trim());
            claims = jwt.getJWTClaimsSet();
        } catch (Exception ex) {
            log.debug("Rejected unparsable client token: {}", ex.getMessage());
            return ClientIdentity.rejected();
        }

        if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm()) || !verifySignature(jwt)) {
            return ClientIdentity.rejected();
        }
        if (!validateClaims(claims)) {
            return ClientIdentity.rejected();
        }

        String userId = toStringClaim(claims, USER_ID_CLAIM);
        if (!StringUtils.hasText(userId)) {
            return ClientIdentity.rejected();
        }
        return ClientIdentity.authenticated(userId, claims.getSubject());
    }

    public boolean authenticateAgent(String apiKey) {
        if (!authProperties.isEnabled()) {
            return true;
        }
        if (!StringUtils.hasText(apiKey)) {
            return false;
        }
        byte[] expected = authProperties.getAgentApiKey().getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, apiKey.trim().getBytes(StandardCharsets.UTF_8));
    }

    private boolean validateClaims(JWTClaimsSet claims) {
        if (claims == null) {
            return false;
        }

        Date expiration = claims.getExpirationTime();
        if (expiration == null || expiration.toInstant().isBefore(Instant.now())) {
            return false;
        }

        if (StringUtils.hasText(authProperties.getIssuer())) {
            String issuer = claims.getIssuer();
            if (!StringUtils.hasText(issuer) || !authProperties.getIssuer().equals(issuer)) {
                return false;
            }
        }

        return StringUtils.hasText(claims.getSubject());
    }

    private boolean verifySignature(SignedJWT jwt) {
        MACVerifier current = verifier;
        if (current == null) {
            return false;
        }
        try {
            return jwt.verify(current);
        } catch (JOSEException ex) {
            return false;
        }
    }

    private String toStringClaim(JWTClaimsSet claims, String key) {
        Object raw = claims.getClaim(key);
        return raw == null ? null : String.valueOf(raw);
    }

    public record ClientIdentity(
        boolean accepted,
        String userId,
        String subject
    ) {
        public static ClientIdentity anonymous() {
            return new ClientIdentity(true, null, null);
        }

        public static ClientIdentity rejected() {
            return new ClientIdentity(false, null, null);
        }

        public static ClientIdentity authenticated(String userId, String subject) {
            return new ClientIdentity(true, userId, subject);
        }
    }
}
