package com.webcrawler.app.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.webcrawler.core.model.CrawlConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonConfigLoaderTest {

    @TempDir
    Path tmp;

    private final JsonConfigLoader loader = new JsonConfigLoader();

    @Test
    void reads_minimal_config_and_keeps_defaults() throws Exception {
        Path f = tmp.resolve("config.json");
        Files.writeString(f, """
                { "start_urls": ["https://example.com/", "https://example.com/", "https://example.org/"],
                  "max_depth": 2 }
                """);

        CrawlConfig c = loader.load(f);

        assertEquals(List.of("https://example.com/", "https://example.org/"), c.getStartUrls());
        assertEquals(2, c.getMaxDepth());
        assertEquals(4, c.getConcurrency());
        assertEquals(Path.of("crawled_pages"), c.getOutputDir());
    }

    @Test
    void reads_all_keys_and_ignores_unknown() throws Exception {
        CrawlConfig c = loader.parse("""
                { "start_urls": ["http://a.test/"], "max_depth": 0, "concurrency": 9,
                  "timeout_ms": 1500, "follow_redirects": false, "user_agent": "ua/1",
                  "same_domain_only": false, "output_dir": "out/pages", "max_segments": 2,
                  "clean_output_on_start": true, "log_dir": "out/logs", "comment": "ignored" }
                """);

        assertEquals(0, c.getMaxDepth());
        assertEquals(9, c.getConcurrency());
        assertEquals(Duration.ofMillis(1500), c.getTimeout());
        assertFalse(c.isFollowRedirects());
        assertEquals("ua/1", c.getUserAgent());
        assertFalse(c.isSameDomainOnly());
        assertEquals(Path.of("out/pages"), c.getOutputDir());
        assertEquals(2, c.getMaxSegments());
        assertTrue(c.isCleanOutputOnStart());
        assertEquals(Path.of("out/logs"), c.getLogDir());
    }

    @Test
    void invalid_values_and_syntax_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> loader.parse("{ \"max_depth\": -1 }"));
        assertThrows(JsonProcessingException.class, () -> loader.parse("{ \"max_depth\": "));
        assertThrows(IOException.class, () -> loader.load(tmp.resolve("missing.json")));
    }
}
