package com.bulwark.core.crypto;

import org.bouncycastle.crypto.generators.SCrypt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.codec.Hex;
import org.springframework.security.crypto.keygen.KeyGenerators;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Secure token generation and scrypt password hashing.
 *
 * <p>
 * Hashing is CPU and memory heavy. Request threads should use the
 * {@code *Async} variants, which run on the executor given at construction.
 * </p>
 */
public class CredentialVault {

    private static final Logger log = LoggerFactory.getLogger(CredentialVault.class);

    public static final int DEFAULT_TOKEN_BYTES = 32;
    public static final int SALT_BYTES = 16;
    public static final int KEY_LENGTH = 64;

    // Same cost parameters as Node's crypto.scrypt defaults
    private static final int COST = 16384;
    private static final int BLOCK_SIZE = 8;
    private static final int PARALLELISM = 1;

    private final Executor executor;

    public CredentialVault(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public String generateSecureToken() {
        return generateSecureToken(DEFAULT_TOKEN_BYTES);
    }

    /**
     * @param byteLength Number of random bytes; the token is twice as many hex characters
     */
    public String generateSecureToken(int byteLength) {
        if (byteLength <= 0) {
            throw new IllegalArgumentException("byteLength must be positive: " + byteLength);
        }
        return new String(Hex.encode(KeyGenerators.secureRandom(byteLength).generateKey()));
    }

    public PasswordHashResult hashPassword(String password) {
        return hashPassword(password, null);
    }

    /**
     * Hash a password with scrypt.
     *
     * @param password The password
     * @param salt     Hex salt to reuse, or null/empty to generate 16 random bytes
     */
    public PasswordHashResult hashPassword(String password, String salt) {
        Objects.requireNonNull(password, "password");
        String effectiveSalt = (salt == null || salt.isEmpty()) ? generateSecureToken(SALT_BYTES) : salt;

        byte[] derived = SCrypt.generate(
                password.getBytes(StandardCharsets.UTF_8),
                effectiveSalt.getBytes(StandardCharsets.UTF_8),
                COST, BLOCK_SIZE, PARALLELISM, KEY_LENGTH);

        return new PasswordHashResult(new String(Hex.encode(derived)), effectiveSalt);
    }

    /**
     * Check a password against a stored hash using a constant-time comparison.
     * Never throws: any failure is logged and reported as a mismatch.
     */
    public boolean verifyPassword(String password, String hash, String salt) {
        try {
            if (salt == null || salt.isEmpty()) {
                log.warn("[Bulwark] Password verification attempted without a salt");
                return false;
            }
            byte[] expected = Hex.decode(hash);
            byte[] actual = Hex.decode(hashPassword(password, salt).getHash());
            return MessageDigest.isEqual(actual, expected);
        } catch (Exception e) {
            log.error("[Bulwark] Password verification failed: {}", e.getMessage());
            return false;
        }
    }

    public CompletableFuture<PasswordHashResult> hashPasswordAsync(String password, String salt) {
        return CompletableFuture.supplyAsync(() -> hashPassword(password, salt), executor);
    }

    public CompletableFuture<Boolean> verifyPasswordAsync(String password, String hash, String salt) {
        return CompletableFuture.supplyAsync(() -> verifyPassword(password, hash, salt), executor);
    }
}
