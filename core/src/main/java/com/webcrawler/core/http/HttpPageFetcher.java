package com.webcrawler.core.http;

import com.webcrawler.core.api.IPageFetcher;
import com.webcrawler.core.model.CrawlConfig;
import com.webcrawler.core.model.FetchResponse;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/**
 * JDK HttpClient 기반 fetch 능력.
 * - 2xx 만 성공으로 반환, non-2xx 는 상태코드를 담아 FetchException
 * - 네트워크 오류/타임아웃은 statusCode -1 FetchException
 * - 본문은 바이트 그대로 반환(문자셋은 헤더/meta 기준으로 추출기가 판별)
 * - 재시도 없음(실패한 작업은 호출자가 버림)
 */
public class HttpPageFetcher implements IPageFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final CrawlConfig config;
    private final HttpSender sender;

    public HttpPageFetcher(CrawlConfig config) {
        this(config, HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build());
    }

    public HttpPageFetcher(CrawlConfig config, HttpClient client) {
        this(config, senderOf(client));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(CrawlConfig config, HttpSender sender) {
        this.config = Objects.requireNonNull(config, "config");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    @Override
    public FetchResponse fetch(URI url) throws FetchException {
        Objects.requireNonNull(url, "url");
        long start = System.nanoTime();

        HttpRequest req = HttpRequest.newBuilder(url)
                .timeout(config.getTimeout())
                .header("User-Agent", config.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.5")
                .GET()
                .build();

        HttpResponse<byte[]> resp;
        try {
            resp = sender.send(req);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, "interrupted", e);
        } catch (IOException e) {
            throw new FetchException(url, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new FetchException(url, status, "HTTP " + status);
        }

        HttpHeaders hh = resp.headers();
        return FetchResponse.builder()
                .url(url)
                .statusCode(status)
                .headers(hh.map())
                .body(resp.body())
                .contentType(hh.firstValue("Content-Type").orElse(null))
                .responseTimeMs(elapsedMs)
                .build();
    }

    private static HttpSender senderOf(HttpClient client) {
        Objects.requireNonNull(client, "client");
        return req -> client.send(req, HttpResponse.BodyHandlers.ofByteArray());
    }
}
