package com.bulwark.core.model;

import org.springframework.security.crypto.codec.Hex;
import org.springframework.security.crypto.keygen.BytesKeyGenerator;
import org.springframework.security.crypto.keygen.KeyGenerators;

/**
 * Random hex identifiers for findings, vulnerabilities and reports.
 */
public final class Identifiers {

    private static final BytesKeyGenerator REPORT_IDS = KeyGenerators.secureRandom(8);
    private static final BytesKeyGenerator ISSUE_IDS = KeyGenerators.secureRandom(4);

    private Identifiers() {
    }

    /** 16 random hex characters. */
    public static String randomHex() {
        return new String(Hex.encode(REPORT_IDS.generateKey()));
    }

    /** {@code prefix-} followed by 8 random hex characters. */
    public static String withPrefix(String prefix) {
        return prefix + "-" + new String(Hex.encode(ISSUE_IDS.generateKey()));
    }
}
