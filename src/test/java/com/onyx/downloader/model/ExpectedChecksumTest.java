package com.onyx.downloader.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpectedChecksumTest {

    @Test
    void infersAlgorithmFromHexLength() {
        assertEquals(ChecksumAlgorithm.MD5, ExpectedChecksum.parse("5eb63bbbe01eeed093cb22bb8f5acdc3").getAlgorithm());
        assertEquals(ChecksumAlgorithm.SHA1, ExpectedChecksum.parse("2aae6c35c94fcfb415dbe95f408b9ce91ee846ed").getAlgorithm());
        assertEquals(ChecksumAlgorithm.SHA256,
                ExpectedChecksum.parse("b94d27b9934d3e08a52e52d7da7dabfac484efe37a5380ee9088f7ace2efcde9").getAlgorithm());
    }

    @Test
    void acceptsExplicitAlgorithmPrefix() {
        ExpectedChecksum checksum = ExpectedChecksum.parse("sha256:B94D27B9934D3E08A52E52D7DA7DABFAC484EFE37A5380EE9088F7ACE2EFCDE9");

        assertEquals(ChecksumAlgorithm.SHA256, checksum.getAlgorithm());
        assertEquals("b94d27b9934d3e08a52e52d7da7dabfac484efe37a5380ee9088f7ace2efcde9", checksum.getHexDigest());
        assertTrue(checksum.matches("B94D27B9934D3E08A52E52D7DA7DABFAC484EFE37A5380EE9088F7ACE2EFCDE9"));
    }

    @Test
    void rejectsMalformedValues() {
        assertThrows(IllegalArgumentException.class, () -> ExpectedChecksum.parse(""));
        assertThrows(IllegalArgumentException.class, () -> ExpectedChecksum.parse("xyz"));
        assertThrows(IllegalArgumentException.class, () -> ExpectedChecksum.parse("abc123"));
        assertThrows(IllegalArgumentException.class, () -> ExpectedChecksum.parse("md5:b94d27b9934d3e08a52e52d7da7dabfac484efe37a5380ee9088f7ace2efcde9"));
        assertThrows(IllegalArgumentException.class, () -> ExpectedChecksum.parse("crc32:5eb63bbbe01eeed093cb22bb8f5acdc3"));
    }
}
