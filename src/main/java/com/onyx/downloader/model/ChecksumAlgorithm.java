package com.onyx.downloader.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ChecksumAlgorithm {
    MD5("MD5", 32),
    SHA1("SHA-1", 40),
    SHA256("SHA-256", 64),
    SHA512("SHA-512", 128);

    private final String jcaName;
    private final int hexLength;

    ChecksumAlgorithm(String jcaName, int hexLength) {
        this.jcaName = jcaName;
        this.hexLength = hexLength;
    }

    public String getJcaName() {
        return jcaName;
    }

    public int getHexLength() {
        return hexLength;
    }

    public static Optional<ChecksumAlgorithm> fromHexLength(int length) {
        return Arrays.stream(values())
                .filter(algorithm -> algorithm.hexLength == length)
                .findFirst();
    }

    /**
     * Accepts {@code sha256}, {@code SHA-256}, {@code sha-1} and similar spellings.
     */
    public static Optional<ChecksumAlgorithm> fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace("-", "");
        return Arrays.stream(values())
                .filter(algorithm -> algorithm.name().equals(normalized))
                .findFirst();
    }
}
