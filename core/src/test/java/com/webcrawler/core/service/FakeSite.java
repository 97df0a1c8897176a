package com.webcrawler.core.service;

import com.webcrawler.core.api.IOutputWriter;
import com.webcrawler.core.api.IPageFetcher;
import com.webcrawler.core.http.FetchException;
import com.webcrawler.core.model.FetchResponse;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/** 맵 기반 가짜 사이트: URL → HTML 바이트. 없는 URL 은 404. fetch/write 호출 기록. */
final class FakeSite implements IPageFetcher {

    private final Map<URI, byte[]> pages = new ConcurrentHashMap<>();
    private final Map<URI, String> contentTypes = new ConcurrentHashMap<>();
    final Map<URI, AtomicInteger> fetchCounts = new ConcurrentHashMap<>();
    volatile long delayMs = 0;

    /** 본문 + 링크 페이지 등록 */
    FakeSite page(String url, String text, String... links) {
        String anchors = Arrays.stream(links)
                .map(l -> "<a href=\"" + l + "\">link</a>")
                .collect(Collectors.joining());
        pages.put(URI.create(url),
                ("<html><body><main><p>" + text + "</p>" + anchors + "</main></body></html>")
                        .getBytes(StandardCharsets.UTF_8));
        return this;
    }

    FakeSite raw(String url, String body, String contentType) {
        return raw(url, body.getBytes(StandardCharsets.UTF_8), contentType);
    }

    FakeSite raw(String url, byte[] body, String contentType) {
        pages.put(URI.create(url), body);
        if (contentType != null) contentTypes.put(URI.create(url), contentType);
        return this;
    }

    int fetched(String url) {
        AtomicInteger n = fetchCounts.get(URI.create(url));
        return n == null ? 0 : n.get();
    }

    @Override
    public FetchResponse fetch(URI url) throws FetchException {
        fetchCounts.computeIfAbsent(url, k -> new AtomicInteger()).incrementAndGet();
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchException(url, "interrupted", e);
            }
        }
        byte[] body = pages.get(url);
        if (body == null) throw new FetchException(url, 404, "HTTP 404");
        return FetchResponse.builder()
                .url(url)
                .statusCode(200)
                .body(body)
                .contentType(contentTypes.getOrDefault(url, "text/html; charset=utf-8"))
                .build();
    }

    /** 메모리 기록기. failOn 에 든 URL 은 IOException. */
    static final class MemoryWriter implements IOutputWriter {
        final Map<URI, String> written = new ConcurrentHashMap<>();
        final Set<URI> failOn = ConcurrentHashMap.newKeySet();

        @Override
        public Path write(URI url, String text) throws IOException {
            if (failOn.contains(url)) throw new IOException("disk full");
            written.put(url, text);
            return Path.of(url.getHost() + ".txt");
        }
    }
}
