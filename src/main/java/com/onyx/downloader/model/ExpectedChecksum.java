package com.onyx.downloader.model;

import lombok.Value;

import java.util.HexFormat;
import java.util.Locale;

@Value
public class ExpectedChecksum {
    ChecksumAlgorithm algorithm;
    String hexDigest;

    /**
     * Parses {@code <algorithm>:<hex>} or a bare hex digest whose algorithm is inferred from its length.
     *
     * @throws IllegalArgumentException when the value is not a hex digest of a supported algorithm
     */
    public static ExpectedChecksum parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Checksum must not be empty");
        }

        String trimmed = value.trim();
        int separator = trimmed.indexOf(':');
        String hex = (separator >= 0 ? trimmed.substring(separator + 1) : trimmed).toLowerCase(Locale.ROOT);

        if (!isHex(hex)) {
            throw new IllegalArgumentException("Checksum is not a hex digest: " + value);
        }

        ChecksumAlgorithm algorithm = separator >= 0
                ? ChecksumAlgorithm.fromName(trimmed.substring(0, separator))
                        .orElseThrow(() -> new IllegalArgumentException("Unsupported checksum algorithm: " + value))
                : ChecksumAlgorithm.fromHexLength(hex.length())
                        .orElseThrow(() -> new IllegalArgumentException("Unsupported checksum format: " + value));

        if (hex.length() != algorithm.getHexLength()) {
            throw new IllegalArgumentException("Expected " + algorithm.getHexLength() + " hex digits for "
                    + algorithm.getJcaName() + ", got " + hex.length());
        }
        return new ExpectedChecksum(algorithm, hex);
    }

    public boolean matches(String actualHex) {
        return hexDigest.equalsIgnoreCase(actualHex);
    }

    private static boolean isHex(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!HexFormat.isHexDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
