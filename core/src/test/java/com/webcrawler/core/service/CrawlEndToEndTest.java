package com.webcrawler.core.service;

import com.sun.net.httpserver.HttpServer;
import com.webcrawler.core.model.CrawlConfig;
import com.webcrawler.core.model.CrawlSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/** 로컬 HttpServer 로 실제 HTTP → jsoup → 파일 기록 경로 전체를 검증 */
@Timeout(30)
class CrawlEndToEndTest {

    private static final Map<String, String> SITE = Map.of(
            "/", "<html><body><nav><a href='/docs/'>Docs</a></nav>"
                    + "<main><h1>Home</h1><p>Welcome.</p><a href='/about'>About</a>"
                    + "<a href='mailto:me@example.com'>mail</a><a href='/gone'>gone</a></main></body></html>",
            "/about", "<html><body><main><p>About us.</p><a href='/'>home</a></main></body></html>",
            "/docs/", "<html><body><article><p>Docs index.</p><a href='/docs/deep/page'>deep</a></article></body></html>",
            "/docs/deep/page", "<html><body><main><p>Too deep.</p></main></body></html>");

    private HttpServer server;
    private String base;

    @TempDir
    Path tmp;

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ex -> {
            String html = SITE.get(ex.getRequestURI().getPath());
            if (html == null) {
                ex.sendResponseHeaders(404, -1);
                ex.close();
                return;
            }
            byte[] body = html.getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
            ex.sendResponseHeaders(200, body.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(body); }
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    @Test
    void crawls_local_site_and_writes_records() throws Exception {
        Path out = tmp.resolve("crawled_pages");
        CrawlConfig cfg = CrawlConfig.defaults()
                .setStartUrls(List.of(base + "/"))
                .setMaxDepth(1)
                .setConcurrency(2)
                .setOutputDir(out);

        CrawlSummary s = new CrawlScheduler(cfg).run();

        assertThat(s.pagesFetched()).isEqualTo(3);     // /, /about, /docs/
        assertThat(s.pagesWritten()).isEqualTo(3);
        assertThat(s.fetchFailures()).isEqualTo(1);    // /gone
        assertThat(s.invalidUrls()).isEqualTo(1);      // mailto
        assertThat(s.overDepthSkipped()).isEqualTo(1); // /docs/deep/page
        assertThat(s.duplicatesSkipped()).isEqualTo(1); // /about → /

        // 127.0.0.1_<port> 뒤 첫 경로 세그먼트까지가 파일명
        String port = String.valueOf(server.getAddress().getPort());
        Path root = out.resolve("127.0.0.1_" + port + ".txt");
        Path about = out.resolve("127.0.0.1_" + port + "_about.txt");
        Path docs = out.resolve("127.0.0.1_" + port + "_docs.txt");
        assertThat(root).exists();
        assertThat(about).exists();
        assertThat(docs).exists();

        String home = Files.readString(root);
        assertThat(home).contains("URL: " + base + "/").contains("Home\nWelcome.").doesNotContain("Docs\n");
        assertThat(Files.readString(docs)).contains("Docs index.");

        try (Stream<Path> files = Files.list(out)) {
            assertThat(files.count()).isEqualTo(3);
        }
    }
}
