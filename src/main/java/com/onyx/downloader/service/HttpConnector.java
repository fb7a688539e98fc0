package com.onyx.downloader.service;

import com.onyx.downloader.config.DownloadProperties;
import com.onyx.downloader.exception.DownloadException;
import com.onyx.downloader.model.ErrorKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.NoRouteToHostException;
import java.net.URL;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Map;

/**
 * Opens configured {@link HttpURLConnection}s and maps transport and status failures to {@link ErrorKind}s.
 */
@Component
@RequiredArgsConstructor
public class HttpConnector {

    private final DownloadProperties properties;

    public HttpURLConnection open(String url, String method, Map<String, String> headers) throws DownloadException {
        URL target;
        try {
            target = new URL(url);
        } catch (MalformedURLException e) {
            throw new DownloadException(ErrorKind.HTTP_CLIENT, "Invalid URL: " + url, e);
        }

        String protocol = target.getProtocol().toLowerCase(Locale.ROOT);
        if (!protocol.equals("http") && !protocol.equals("https")) {
            throw new DownloadException(ErrorKind.HTTP_CLIENT, "Unsupported protocol: " + protocol);
        }

        try {
            HttpURLConnection connection = (HttpURLConnection) target.openConnection();
            connection.setRequestMethod(method);
            connection.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
            connection.setReadTimeout((int) properties.getReadTimeout().toMillis());
            connection.setInstanceFollowRedirects(true);
            connection.setUseCaches(false);
            connection.setRequestProperty("User-Agent", properties.getUserAgent());
            connection.setRequestProperty("Accept-Encoding", "identity");
            headers.forEach(connection::setRequestProperty);
            return connection;
        } catch (IOException e) {
            throw new DownloadException(ErrorKind.NETWORK, "Cannot open connection to " + url + ": " + e.getMessage(), e);
        }
    }

    /**
     * Sends the request and returns the response status.
     */
    public int connect(HttpURLConnection connection) throws DownloadException {
        String url = connection.getURL().toString();
        try {
            return connection.getResponseCode();
        } catch (ConnectException | UnknownHostException | NoRouteToHostException e) {
            throw new DownloadException(ErrorKind.UNREACHABLE, "Unreachable: " + url + " (" + e.getMessage() + ")", e);
        } catch (IOException e) {
            throw new DownloadException(ErrorKind.NETWORK, "Request to " + url + " failed: " + e.getMessage(), e);
        }
    }

    public void ensureSuccess(int status, String url) throws DownloadException {
        if (status < 200 || status >= 300) {
            throw DownloadException.forStatus(status, url);
        }
    }
}
