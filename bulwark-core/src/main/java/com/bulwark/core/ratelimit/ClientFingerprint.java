package com.bulwark.core.ratelimit;

import org.springframework.security.crypto.codec.Hex;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Derives the rate-limit key of a client: SHA-256 of its address and user agent.
 * The value is one-way and only used as a map key.
 */
public final class ClientFingerprint {

    private ClientFingerprint() {
    }

    /**
     * @param forwardedFor          Raw X-Forwarded-For header, may be null
     * @param remoteAddress         Socket peer address, may be null
     * @param userAgent             User-Agent header, may be null
     * @param trustForwardedHeaders Whether an upstream proxy sets X-Forwarded-For
     */
    public static String of(String forwardedFor, String remoteAddress, String userAgent,
            boolean trustForwardedHeaders) {
        return of(resolveClientAddress(forwardedFor, remoteAddress, trustForwardedHeaders), userAgent);
    }

    public static String of(String clientAddress, String userAgent) {
        String raw = (clientAddress != null ? clientAddress : "") + ":" + (userAgent != null ? userAgent : "");
        return sha256(raw);
    }

    /**
     * Header-supplied addresses are client controlled, so they only count when
     * the host explicitly trusts its proxy. Then the right-most entry is used: it is the
     * one the trusted proxy appended, while everything to its left came from the client.
     */
    static String resolveClientAddress(String forwardedFor, String remoteAddress,
            boolean trustForwardedHeaders) {
        if (trustForwardedHeaders && forwardedFor != null && !forwardedFor.isBlank()) {
            String[] hops = forwardedFor.split(",");
            String lastHop = hops[hops.length - 1].trim();
            if (!lastHop.isEmpty()) {
                return lastHop;
            }
        }
        return remoteAddress != null ? remoteAddress : "";
    }

    private static String sha256(String raw) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return new String(Hex.encode(md.digest(raw.getBytes(StandardCharsets.UTF_8))));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Fingerprint error", e);
        }
    }
}
