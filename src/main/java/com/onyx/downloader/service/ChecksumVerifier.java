package com.onyx.downloader.service;

import com.onyx.downloader.exception.DownloadException;
import com.onyx.downloader.model.ChecksumAlgorithm;
import com.onyx.downloader.model.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

@Component
@Slf4j
public class ChecksumVerifier {

    private static final int READ_BUFFER_SIZE = 64 * 1024;

    public StreamingDigest newStreamingDigest(ChecksumAlgorithm algorithm) {
        return new StreamingDigest(newDigest(algorithm));
    }

    /**
     * Digest of the assembled file, used whenever the bytes did not arrive as one ordered stream.
     */
    public String digestFile(Path file, ChecksumAlgorithm algorithm) throws DownloadException {
        MessageDigest digest = newDigest(algorithm);
        byte[] buffer = new byte[READ_BUFFER_SIZE];

        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new DownloadException(ErrorKind.DISK, "Cannot read " + file + " for verification: " + e.getMessage(), e);
        }

        String hex = HexFormat.of().formatHex(digest.digest());
        log.debug("Computed {} of {}: {}", algorithm.getJcaName(), file, hex);
        return hex;
    }

    static MessageDigest newDigest(ChecksumAlgorithm algorithm) {
        try {
            return MessageDigest.getInstance(algorithm.getJcaName());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm.getJcaName() + " not available", e);
        }
    }

    /**
     * Running digest fed in write order by a single stream. Invalidated as soon as bytes
     * arrive out of order, after which the file has to be hashed instead.
     */
    public static final class StreamingDigest {

        private final MessageDigest digest;
        private long position;
        private boolean valid = true;

        private StreamingDigest(MessageDigest digest) {
            this.digest = digest;
        }

        public void update(long offset, byte[] buffer, int length) {
            if (!valid) {
                return;
            }
            if (offset != position) {
                valid = false;
                return;
            }
            digest.update(buffer, 0, length);
            position += length;
        }

        public void reset() {
            digest.reset();
            position = 0;
            valid = true;
        }

        public void invalidate() {
            valid = false;
        }

        public boolean isValid() {
            return valid;
        }

        public long getPosition() {
            return position;
        }

        public String hex() {
            return HexFormat.of().formatHex(digest.digest());
        }
    }
}
