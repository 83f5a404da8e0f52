package tech.streamingenhancement.platforms.auth;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.streamingenhancement.platforms.config.PlatformsConfig;
import tech.streamingenhancement.platforms.support.StateGenerator;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;

/**
 * PKCE (RFC 7636) code verifiers, bound to the authorization state they were issued with.
 */
@ApplicationScoped
public class PkceManager {

    public static final String CHALLENGE_METHOD = "S256";

    static final int VERIFIER_LENGTH = 64;

    private final Cache<String, String> verifiers;

    @Inject
    public PkceManager(PlatformsConfig config) {
        this(config.oauth().pkceTtl(), Ticker.systemTicker());
    }

    PkceManager(Duration ttl, Ticker ticker) {
        this.verifiers = Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .ticker(ticker)
            .build();
    }

    /**
     * 64 character base64url verifier (48 random bytes).
     */
    public String generateVerifier() {
        return StateGenerator.randomToken(VERIFIER_LENGTH * 3 / 4);
    }

    /**
     * S256 challenge: unpadded base64url of SHA-256 over the verifier.
     */
    public String challenge(String verifier) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public void store(String state, String verifier) {
        verifiers.put(state, verifier);
    }

    public Optional<String> find(String state) {
        if (state == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(verifiers.getIfPresent(state));
    }

    public void clear(String state) {
        verifiers.invalidate(state);
    }
}
