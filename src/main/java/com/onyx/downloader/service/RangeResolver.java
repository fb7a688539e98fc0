package com.onyx.downloader.service;

import com.onyx.downloader.config.DownloadProperties;
import com.onyx.downloader.exception.DownloadException;
import com.onyx.downloader.model.ProbeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.HttpURLConnection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Learns a resource's size, range support and suggested name before planning.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RangeResolver {

    private static final int HTTP_PARTIAL_CONTENT = 206;
    private static final int HTTP_METHOD_NOT_ALLOWED = 405;
    private static final int HTTP_NOT_IMPLEMENTED = 501;

    private static final Pattern CONTENT_RANGE_TOTAL = Pattern.compile("bytes\\s+[^/]+/(\\d+|\\*)", Pattern.CASE_INSENSITIVE);

    private final HttpConnector connector;
    private final BackoffPolicy backoffPolicy;
    private final DownloadProperties properties;

    public ProbeResult probe(String url, Map<String, String> headers, CancellationToken token)
            throws DownloadException, InterruptedException {
        for (int attempt = 1; ; attempt++) {
            if (token.isCancelled()) {
                throw DownloadException.cancelled("Probe cancelled: " + url);
            }
            try {
                ProbeResult result = probeOnce(url, headers);
                log.debug("Probe result for {}: size={}, supportsRange={}, suggestedName={}",
                        url, result.getSize(), result.isSupportsRange(), result.getSuggestedName());
                return result;
            } catch (DownloadException e) {
                if (!e.isRetryable() || attempt >= properties.getProbeAttempts()) {
                    throw e;
                }
                log.warn("Probe attempt {}/{} for {} failed: {}", attempt, properties.getProbeAttempts(), url, e.getMessage());
                if (!backoffPolicy.waitForRetry(attempt, token)) {
                    throw DownloadException.cancelled("Probe cancelled: " + url);
                }
            }
        }
    }

    private ProbeResult probeOnce(String url, Map<String, String> headers) throws DownloadException {
        HttpURLConnection connection = connector.open(url, "HEAD", headers);
        try {
            int status = connector.connect(connection);
            if (status == HTTP_METHOD_NOT_ALLOWED || status == HTTP_NOT_IMPLEMENTED) {
                log.debug("HEAD not allowed for {} (HTTP {}), probing with a ranged GET", url, status);
                return probeWithRangedGet(url, headers);
            }
            connector.ensureSuccess(status, url);

            long contentLength = connection.getContentLengthLong();
            String acceptRanges = connection.getHeaderField("Accept-Ranges");
            boolean supportsRange = acceptRanges != null && acceptRanges.trim().equalsIgnoreCase("bytes");

            return new ProbeResult(
                    contentLength >= 0 ? contentLength : null,
                    supportsRange,
                    NameResolver.parseContentDisposition(connection.getHeaderField("Content-Disposition")),
                    connection.getURL().toString());
        } finally {
            connection.disconnect();
        }
    }

    private ProbeResult probeWithRangedGet(String url, Map<String, String> headers) throws DownloadException {
        Map<String, String> rangedHeaders = new LinkedHashMap<>(headers);
        rangedHeaders.put("Range", "bytes=0-0");

        HttpURLConnection connection = connector.open(url, "GET", rangedHeaders);
        try {
            int status = connector.connect(connection);
            connector.ensureSuccess(status, url);

            String suggestedName = NameResolver.parseContentDisposition(connection.getHeaderField("Content-Disposition"));
            String finalUrl = connection.getURL().toString();

            if (status == HTTP_PARTIAL_CONTENT) {
                return new ProbeResult(parseTotal(connection.getHeaderField("Content-Range")), true, suggestedName, finalUrl);
            }

            long contentLength = connection.getContentLengthLong();
            return new ProbeResult(contentLength >= 0 ? contentLength : null, false, suggestedName, finalUrl);
        } finally {
            connection.disconnect();
        }
    }

    static Long parseTotal(String contentRange) {
        if (contentRange == null) {
            return null;
        }
        Matcher matcher = CONTENT_RANGE_TOTAL.matcher(contentRange.trim());
        if (!matcher.matches() || matcher.group(1).equals("*")) {
            return null;
        }
        return Long.parseLong(matcher.group(1));
    }
}
