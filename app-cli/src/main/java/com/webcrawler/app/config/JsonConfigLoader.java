package com.webcrawler.app.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.webcrawler.core.model.CrawlConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * config.json → CrawlConfig (snake_case 키, 모르는 키는 무시).
 * <pre>
 * { "start_urls": ["https://example.com/"], "max_depth": 5,
 *   "concurrency": 4, "timeout_ms": 10000, "follow_redirects": true,
 *   "user_agent": "...", "same_domain_only": true,
 *   "output_dir": "crawled_pages", "max_segments": 3,
 *   "clean_output_on_start": false, "log_dir": "logs" }
 * </pre>
 * 없는 키는 CrawlConfig 기본값 유지.
 */
public final class JsonConfigLoader {

    private final ObjectMapper om = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public CrawlConfig load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) {
            throw new IOException("config not found at: " + file.toAbsolutePath());
        }
        return toConfig(om.readValue(file.toFile(), ConfigFile.class));
    }

    /** JSON 문자열에서 변환(테스트용) */
    public CrawlConfig parse(String json) throws JsonProcessingException {
        return toConfig(om.readValue(json, ConfigFile.class));
    }

    private static CrawlConfig toConfig(ConfigFile f) {
        CrawlConfig cfg = CrawlConfig.defaults();
        if (f == null) {
            cfg.validate();
            return cfg;
        }
        if (f.startUrls != null) cfg.setStartUrls(f.startUrls);
        if (f.maxDepth != null) cfg.setMaxDepth(f.maxDepth);
        if (f.concurrency != null) cfg.setConcurrency(f.concurrency);
        if (f.timeoutMs != null && f.timeoutMs > 0) cfg.setTimeoutMs(f.timeoutMs);
        if (f.followRedirects != null) cfg.setFollowRedirects(f.followRedirects);
        if (f.userAgent != null) cfg.setUserAgent(f.userAgent);
        if (f.sameDomainOnly != null) cfg.setSameDomainOnly(f.sameDomainOnly);
        if (f.outputDir != null) cfg.setOutputDir(Path.of(f.outputDir));
        if (f.maxSegments != null) cfg.setMaxSegments(f.maxSegments);
        if (f.cleanOutputOnStart != null) cfg.setCleanOutputOnStart(f.cleanOutputOnStart);
        if (f.logDir != null) cfg.setLogDir(Path.of(f.logDir));
        cfg.validate();
        return cfg;
    }

    /** 파일 매핑 전용 DTO(null = 미지정) */
    static final class ConfigFile {
        public List<String> startUrls;
        public Integer maxDepth;
        public Integer concurrency;
        public Long timeoutMs;
        public Boolean followRedirects;
        public String userAgent;
        public Boolean sameDomainOnly;
        public String outputDir;
        public Integer maxSegments;
        public Boolean cleanOutputOnStart;
        public String logDir;
    }
}
