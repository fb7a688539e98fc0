package com.onyx.downloader.service;

import com.onyx.downloader.config.DownloadProperties;
import com.onyx.downloader.model.DownloadTask;
import com.onyx.downloader.model.ProbeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Chooses the output path of a task before anything is written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NameResolver {

    static final String FALLBACK_NAME = "download";

    private static final Pattern EXTENDED_FILENAME =
            Pattern.compile("filename\\*\\s*=\\s*UTF-8''([^;]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUOTED_FILENAME =
            Pattern.compile("filename\\s*=\\s*\"([^\"]+)\"", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_FILENAME =
            Pattern.compile("filename\\s*=\\s*([^;]+)", Pattern.CASE_INSENSITIVE);

    private static final String INVALID_CHARS = "<>:\"/\\|?*";
    private static final String[] MOJIBAKE_MARKERS = {"Ã", "Ð", "Ñ", "Ò", "Â"};

    private final ResumeStore resumeStore;
    private final DownloadProperties properties;

    private final Set<Path> reserved = new HashSet<>();

    /**
     * Picks the output path and reserves it until {@link #release(Path)}, so that concurrent tasks
     * deriving the same name never share a file.
     */
    public Path resolve(DownloadTask task, ProbeResult probe) {
        Path candidate = task.getDestinationPath() != null
                ? task.getDestinationPath()
                : outputDirectory(task).resolve(deriveName(task.getUrl(), probe));

        if (!task.isResume() && resumeStore.exists(task.getUrl(), candidate)) {
            log.info("Resume not requested, dropping stale resume record for {}", candidate);
            resumeStore.delete(ResumeStore.recordKey(task.getUrl(), candidate));
        }

        synchronized (reserved) {
            boolean free = !isReserved(candidate)
                    && (task.isOverwrite() || !Files.exists(candidate) || isResumeTarget(task, candidate));
            if (free) {
                reserved.add(key(candidate));
                return candidate;
            }

            Path unique = withNumericSuffix(candidate);
            reserved.add(key(unique));
            log.info("Output {} already exists or is in use, writing to {}", candidate, unique);
            return unique;
        }
    }

    public void release(Path path) {
        synchronized (reserved) {
            reserved.remove(key(path));
        }
    }

    private boolean isReserved(Path path) {
        return reserved.contains(key(path));
    }

    private boolean isResumeTarget(DownloadTask task, Path candidate) {
        return task.isResume() && resumeStore.exists(task.getUrl(), candidate);
    }

    public String deriveName(String url, ProbeResult probe) {
        if (probe != null && probe.getSuggestedName() != null) {
            return probe.getSuggestedName();
        }
        if (probe != null && probe.getFinalUrl() != null) {
            String fromFinal = nameFromUrl(probe.getFinalUrl());
            if (!FALLBACK_NAME.equals(fromFinal)) {
                return fromFinal;
            }
        }
        return nameFromUrl(url);
    }

    /**
     * Extracts a file name from a Content-Disposition header, preferring the RFC 6266 {@code filename*} form.
     *
     * @return the sanitised name, or {@code null} if the header carries none
     */
    public static String parseContentDisposition(String disposition) {
        if (disposition == null || disposition.isBlank()) {
            return null;
        }

        Matcher matcher = EXTENDED_FILENAME.matcher(disposition);
        if (matcher.find()) {
            return sanitize(repairMojibake(decode(stripQuotes(matcher.group(1).trim()))));
        }
        matcher = QUOTED_FILENAME.matcher(disposition);
        if (matcher.find()) {
            return sanitize(repairMojibake(decode(matcher.group(1))));
        }
        matcher = BARE_FILENAME.matcher(disposition);
        if (matcher.find()) {
            return sanitize(repairMojibake(decode(stripQuotes(matcher.group(1).trim()))));
        }
        return null;
    }

    public static String nameFromUrl(String url) {
        String path;
        try {
            path = new URI(url).getRawPath();
        } catch (URISyntaxException e) {
            return FALLBACK_NAME;
        }
        if (path == null || path.isEmpty()) {
            return FALLBACK_NAME;
        }

        String segment = decode(path.substring(path.lastIndexOf('/') + 1));
        if (segment.isEmpty() || !segment.contains(".")) {
            return FALLBACK_NAME;
        }
        return sanitize(segment);
    }

    public static String sanitize(String name) {
        StringBuilder cleaned = new StringBuilder(name.length());
        for (char ch : name.toCharArray()) {
            cleaned.append(INVALID_CHARS.indexOf(ch) >= 0 || Character.isISOControl(ch) ? '_' : ch);
        }

        int start = 0;
        int end = cleaned.length();
        while (start < end && (cleaned.charAt(start) == ' ' || cleaned.charAt(start) == '.')) {
            start++;
        }
        while (end > start && (cleaned.charAt(end - 1) == ' ' || cleaned.charAt(end - 1) == '.')) {
            end--;
        }
        String result = cleaned.substring(start, end);
        return result.isEmpty() ? FALLBACK_NAME : result;
    }

    /**
     * Undoes UTF-8 text that was decoded as ISO-8859-1 somewhere along the way.
     */
    static String repairMojibake(String text) {
        for (String marker : MOJIBAKE_MARKERS) {
            if (text.contains(marker)) {
                String repaired = new String(text.getBytes(StandardCharsets.ISO_8859_1), StandardCharsets.UTF_8);
                return repaired.indexOf('\uFFFD') >= 0 || repaired.isEmpty() ? text : repaired;
            }
        }
        return text;
    }

    private Path withNumericSuffix(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";

        for (int i = 1; ; i++) {
            Path candidate = path.resolveSibling(base + "_" + i + extension);
            if (!Files.exists(candidate) && !isReserved(candidate)) {
                return candidate;
            }
        }
    }

    private static Path key(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private Path outputDirectory(DownloadTask task) {
        return task.getOutputDirectory() != null ? task.getOutputDirectory() : properties.getDownloadDirectory();
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }

    private static String stripQuotes(String value) {
        String result = value;
        if (result.startsWith("\"")) {
            result = result.substring(1);
        }
        if (result.endsWith("\"")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
