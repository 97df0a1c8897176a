package com.webcrawler.core.http;

import com.sun.net.httpserver.HttpServer;
import com.webcrawler.core.crawler.JsoupContentExtractor;
import com.webcrawler.core.model.CrawlConfig;
import com.webcrawler.core.model.FetchResponse;
import com.webcrawler.core.model.PageResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class HttpPageFetcherTest {

    private HttpServer server;
    private String base;
    private final AtomicReference<String> seenUserAgent = new AtomicReference<>();

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ok", ex -> {
            seenUserAgent.set(ex.getRequestHeaders().getFirst("User-Agent"));
            byte[] body = "<html><body><p>hi</p></body></html>".getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
            ex.sendResponseHeaders(200, body.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(body); }
        });
        server.createContext("/latin1", ex -> {
            byte[] body = "<html><head><meta charset=\"iso-8859-1\"></head><body><main><p>café</p></main></body></html>"
                    .getBytes(StandardCharsets.ISO_8859_1);
            ex.getResponseHeaders().add("Content-Type", "text/html");
            ex.sendResponseHeaders(200, body.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(body); }
        });
        server.createContext("/missing", ex -> {
            ex.sendResponseHeaders(404, -1);
            ex.close();
        });
        server.createContext("/moved", ex -> {
            ex.getResponseHeaders().add("Location", "/ok");
            ex.sendResponseHeaders(302, -1);
            ex.close();
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    @Test
    void success_returns_body_and_content_type() throws Exception {
        CrawlConfig cfg = CrawlConfig.defaults().setUserAgent("test-agent/1");
        FetchResponse r = new HttpPageFetcher(cfg).fetch(URI.create(base + "/ok"));

        assertThat(r.getStatusCode()).isEqualTo(200);
        assertThat(r.isSuccess()).isTrue();
        assertThat(r.isHtml()).isTrue();
        assertThat(new String(r.getBody(), StandardCharsets.UTF_8)).contains("<p>hi</p>");
        assertThat(r.getCharset()).isEqualTo("UTF-8");
        assertThat(seenUserAgent.get()).isEqualTo("test-agent/1");
    }

    @Test
    @DisplayName("헤더에 charset 이 없으면 원시 바이트 그대로, <meta charset> 으로 본문 디코딩")
    void body_bytes_keep_meta_declared_charset() throws Exception {
        URI url = URI.create(base + "/latin1");
        FetchResponse r = new HttpPageFetcher(CrawlConfig.defaults()).fetch(url);

        assertThat(r.getCharset()).isNull();
        assertThat(r.getBody()).contains((byte) 0xE9); // ISO-8859-1 'é'

        PageResult page = new JsoupContentExtractor().extract(r.getBody(), r.getCharset(), url);
        assertThat(page.mainText()).isEqualTo("café");
    }

    @Test
    void non_2xx_is_fetch_failure_with_status() {
        FetchException e = catchThrowableOfType(
                () -> new HttpPageFetcher(CrawlConfig.defaults()).fetch(URI.create(base + "/missing")),
                FetchException.class);

        assertThat(e.getStatusCode()).isEqualTo(404);
        assertThat(e.isNetworkError()).isFalse();
        assertThat(e.getUrl()).isEqualTo(URI.create(base + "/missing"));
    }

    @Test
    void redirects_follow_config() throws Exception {
        FetchResponse followed = new HttpPageFetcher(CrawlConfig.defaults().setFollowRedirects(true))
                .fetch(URI.create(base + "/moved"));
        assertThat(followed.getStatusCode()).isEqualTo(200);

        assertThatThrownBy(() -> new HttpPageFetcher(CrawlConfig.defaults().setFollowRedirects(false))
                .fetch(URI.create(base + "/moved")))
                .isInstanceOf(FetchException.class)
                .hasMessageContaining("302");
    }

    @Test
    void network_error_is_fetch_failure_without_status() {
        HttpPageFetcher.HttpSender refusing = req -> { throw new ConnectException("refused"); };
        FetchException e = catchThrowableOfType(
                () -> new HttpPageFetcher(CrawlConfig.defaults(), refusing).fetch(URI.create("http://nowhere.test/")),
                FetchException.class);

        assertThat(e.getStatusCode()).isEqualTo(-1);
        assertThat(e.isNetworkError()).isTrue();
        assertThat(e).hasCauseInstanceOf(ConnectException.class);
    }

    @Test
    void interrupt_is_restored() {
        HttpPageFetcher.HttpSender interrupted = req -> { throw new InterruptedException("stop"); };
        try {
            assertThatThrownBy(() -> new HttpPageFetcher(CrawlConfig.defaults(), interrupted)
                    .fetch(URI.create("http://nowhere.test/")))
                    .isInstanceOf(FetchException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted(); // 다음 테스트에 플래그 남기지 않기
        }
    }
}
