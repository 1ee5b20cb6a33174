package com.bulwark.core.crypto;

/**
 * Hex-encoded scrypt hash plus the hex salt it was derived with.
 */
public class PasswordHashResult {

    private final String hash;
    private final String salt;

    public PasswordHashResult(String hash, String salt) {
        this.hash = hash;
        this.salt = salt;
    }

    public String getHash() {
        return hash;
    }

    public String getSalt() {
        return salt;
    }

    @Override
    public String toString() {
        // never print the hash itself
        return "PasswordHashResult{salt='" + salt + "'}";
    }
}
