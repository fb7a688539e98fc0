package com.onyx.downloader.service;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-process HTTP server serving byte arrays with optional range support and scripted faults.
 */
public final class RangeServer implements AutoCloseable {

    private static final int WRITE_SLICE = 8 * 1024;

    private final HttpServer server;
    private final ExecutorService executor;
    private final Map<String, Resource> resources = new ConcurrentHashMap<>();
    private final List<String> requests = new CopyOnWriteArrayList<>();

    private RangeServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        executor = Executors.newCachedThreadPool();
        server.createContext("/", this::handle);
        server.setExecutor(executor);
        server.start();
    }

    public static RangeServer start() throws IOException {
        return new RangeServer();
    }

    public Resource serve(String path, byte[] content) {
        Resource resource = new Resource(content);
        resources.put(path, resource);
        return resource;
    }

    public String url(String path) {
        return "http://localhost:" + server.getAddress().getPort() + path;
    }

    /**
     * Request log lines of the form {@code "GET /file.bin bytes=0-99"}, {@code "-"} when no range was sent.
     */
    public List<String> requests() {
        return List.copyOf(requests);
    }

    public List<String> rangesRequested(String path) {
        return requests.stream()
                .filter(line -> line.startsWith("GET " + path + " "))
                .map(line -> line.substring(("GET " + path + " ").length()))
                .collect(Collectors.toList());
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private void handle(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getPath();
        String range = exchange.getRequestHeaders().getFirst("Range");
        requests.add(method + " " + path + " " + (range != null ? range : "-"));

        Resource resource = resources.get(path);
        if (resource == null) {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
            return;
        }

        if ("HEAD".equals(method)) {
            handleHead(exchange, resource);
            return;
        }

        handleGet(exchange, resource, range);
    }

    private void handleHead(HttpExchange exchange, Resource resource) throws IOException {
        if (!resource.headAllowed) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }
        if (resource.status != 200) {
            exchange.sendResponseHeaders(resource.status, -1);
            exchange.close();
            return;
        }

        Headers headers = exchange.getResponseHeaders();
        addCommonHeaders(headers, resource);
        if (resource.declareLength) {
            headers.add("Content-Length", String.valueOf(resource.content.length));
        }
        exchange.sendResponseHeaders(200, -1);
        exchange.close();
    }

    private void handleGet(HttpExchange exchange, Resource resource, String range) throws IOException {
        if (resource.status != 200) {
            exchange.sendResponseHeaders(resource.status, -1);
            exchange.close();
            return;
        }
        if (resource.failuresRemaining.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            exchange.sendResponseHeaders(resource.failureStatus, -1);
            exchange.close();
            return;
        }

        byte[] content = resource.content;
        Headers headers = exchange.getResponseHeaders();
        addCommonHeaders(headers, resource);

        if (!resource.declareLength) {
            exchange.sendResponseHeaders(200, 0);
            writeBody(exchange, resource, 0, content.length);
            return;
        }

        boolean honourRange = range != null && range.startsWith("bytes=") && resource.acceptRanges && !resource.ignoreRanges;
        if (!honourRange) {
            exchange.sendResponseHeaders(200, content.length);
            writeBody(exchange, resource, 0, content.length);
            return;
        }

        String[] bounds = range.substring("bytes=".length()).trim().split("-", 2);
        long start = Long.parseLong(bounds[0]);
        long end = bounds[1].isEmpty() ? content.length - 1 : Math.min(Long.parseLong(bounds[1]), content.length - 1);
        if (start >= content.length || resource.rangeNotSatisfiable.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            headers.add("Content-Range", "bytes */" + content.length);
            exchange.sendResponseHeaders(416, -1);
            exchange.close();
            return;
        }

        if (resource.misplaceRanges) {
            end = end - start;
            start = 0;
        }

        long length = end - start + 1;
        headers.add("Content-Range", "bytes " + start + "-" + end + "/" + content.length);
        exchange.sendResponseHeaders(206, length);
        writeBody(exchange, resource, start, end + 1);
    }

    private void writeBody(HttpExchange exchange, Resource resource, long from, long to) {
        long stopAt = to;
        long cutOffAt = resource.cutOffAt;
        boolean cut = cutOffAt >= from && cutOffAt < to && resource.cutOffsRemaining.getAndUpdate(n -> Math.max(0, n - 1)) > 0;
        if (cut) {
            stopAt = cutOffAt;
        }

        try {
            OutputStream body = exchange.getResponseBody();
            for (long position = from; position < stopAt; position += WRITE_SLICE) {
                int length = (int) Math.min(WRITE_SLICE, stopAt - position);
                body.write(resource.content, (int) position, length);
                if (resource.sliceDelayMillis > 0) {
                    body.flush();
                    Thread.sleep(resource.sliceDelayMillis);
                }
            }
            body.flush();
            exchange.close();
        } catch (IOException e) {
            // A cut-off response or a client that went away.
            exchange.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exchange.close();
        }
    }

    private static void addCommonHeaders(Headers headers, Resource resource) {
        if (resource.acceptRanges) {
            headers.add("Accept-Ranges", "bytes");
        }
        if (resource.contentDisposition != null) {
            headers.add("Content-Disposition", resource.contentDisposition);
        }
    }

    /**
     * One served file. Fields are mutable so a test can change server behaviour between runs.
     */
    public static final class Resource {
        private final byte[] content;
        private volatile boolean acceptRanges = true;
        private volatile boolean ignoreRanges;
        private volatile boolean misplaceRanges;
        private volatile boolean headAllowed = true;
        private volatile boolean declareLength = true;
        private volatile String contentDisposition;
        private volatile int status = 200;
        private volatile int failureStatus = 503;
        private volatile long cutOffAt = -1;
        private volatile long sliceDelayMillis;
        private final AtomicInteger failuresRemaining = new AtomicInteger();
        private final AtomicInteger cutOffsRemaining = new AtomicInteger();
        private final AtomicInteger rangeNotSatisfiable = new AtomicInteger();

        private Resource(byte[] content) {
            this.content = content;
        }

        public Resource withoutRangeSupport() {
            this.acceptRanges = false;
            return this;
        }

        /**
         * Advertises ranges but answers every ranged GET with the full body and {@code 200}.
         */
        public Resource ignoringRanges() {
            this.ignoreRanges = true;
            return this;
        }

        /**
         * Answers ranged GETs with {@code 206} and the right length, but always with bytes from offset 0.
         */
        public Resource misplacingRanges() {
            this.misplaceRanges = true;
            return this;
        }

        public Resource withoutHead() {
            this.headAllowed = false;
            return this;
        }

        public Resource withoutLength() {
            this.declareLength = false;
            return this;
        }

        public Resource withContentDisposition(String value) {
            this.contentDisposition = value;
            return this;
        }

        public Resource withStatus(int status) {
            this.status = status;
            return this;
        }

        public Resource failingGets(int count, int status) {
            this.failuresRemaining.set(count);
            this.failureStatus = status;
            return this;
        }

        /**
         * Drops the connection once a response reaches {@code offset}, for the next {@code times} such responses.
         */
        public Resource cuttingOffAt(long offset, int times) {
            this.cutOffAt = offset;
            this.cutOffsRemaining.set(times);
            return this;
        }

        public Resource healthy() {
            this.cutOffsRemaining.set(0);
            this.failuresRemaining.set(0);
            this.rangeNotSatisfiable.set(0);
            this.ignoreRanges = false;
            this.misplaceRanges = false;
            this.status = 200;
            return this;
        }

        public Resource rejectingRanges(int times) {
            this.rangeNotSatisfiable.set(times);
            return this;
        }

        public Resource withSliceDelay(long millis) {
            this.sliceDelayMillis = millis;
            return this;
        }
    }
}
