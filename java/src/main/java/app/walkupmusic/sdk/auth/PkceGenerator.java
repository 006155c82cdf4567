package app.walkupmusic.sdk.auth;

import app.walkupmusic.sdk.ValidationException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;

/**
 * PKCE (Proof Key for Code Exchange) verifier, challenge and state generator.
 * RFC 7636: https://datatracker.ietf.org/doc/html/rfc7636
 */
public final class PkceGenerator {

    public static final int MIN_VERIFIER_LENGTH = 43;
    public static final int MAX_VERIFIER_LENGTH = 128;
    public static final int DEFAULT_VERIFIER_LENGTH = MAX_VERIFIER_LENGTH;
    public static final String CHALLENGE_METHOD = "S256";

    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SecureRandom random;

    public PkceGenerator() {
        this(new SecureRandom());
    }

    public PkceGenerator(SecureRandom random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public String generateCodeVerifier() {
        return generateCodeVerifier(DEFAULT_VERIFIER_LENGTH);
    }

    /**
     * Generates a base64url verifier of exactly {@code length} characters drawn from {@code [A-Za-z0-9-_]}.
     *
     * @throws ValidationException when {@code length} is outside [43, 128].
     */
    public String generateCodeVerifier(int length) {
        if (length < MIN_VERIFIER_LENGTH || length > MAX_VERIFIER_LENGTH) {
            throw new ValidationException("Code verifier length must be between 43 and 128 characters");
        }
        // every 3 random bytes encode to 4 characters
        byte[] bytes = new byte[(length * 3 + 3) / 4];
        random.nextBytes(bytes);
        return URL_ENCODER.encodeToString(bytes).substring(0, length);
    }

    /**
     * Computes {@code BASE64URL(SHA-256(ASCII(verifier)))} without padding.
     */
    public String generateCodeChallenge(String verifier) {
        Objects.requireNonNull(verifier, "verifier");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return URL_ENCODER.encodeToString(hash);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    /**
     * Anti-CSRF nonce round-tripped through the authorization redirect.
     */
    public String generateState() {
        return generateCodeVerifier(MIN_VERIFIER_LENGTH);
    }
}
