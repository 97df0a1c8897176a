package com.webcrawler.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml / config.json 매핑 대상). 순수 설정 보관용.
 * 로딩은 YamlConfigLoader(코어) / JsonConfigLoader(app-cli) 담당.
 */
public final class CrawlConfig {

    public static final int DEFAULT_MAX_DEPTH = 5;
    public static final int DEFAULT_MAX_SEGMENTS = 3;

    // ---------- 기본 필드 ----------
    private List<String> startUrls = List.of();   // 시드(빈 목록이면 즉시 빈 요약)
    private int maxDepth = DEFAULT_MAX_DEPTH;      // 크롤링 최대 깊이(시드 = 0)
    private int concurrency = 4;                   // 동시 fetch 워커 수
    private Duration timeout = Duration.ofSeconds(10);
    private boolean followRedirects = true;
    private String userAgent = "webcrawler/1.0 (+bounded)";
    private boolean sameDomainOnly = true;         // 페이지와 같은 host 링크만 따라감

    // ---------- 출력 ----------
    private Path outputDir = Path.of("crawled_pages");
    private int maxSegments = DEFAULT_MAX_SEGMENTS; // 파일명에 쓰는 URL 세그먼트 상한
    private boolean cleanOutputOnStart = false;     // true 면 시작 시 outputDir 비움

    private Path logDir = Path.of("logs");

    // ---------- getters ----------
    public List<String> getStartUrls() { return startUrls; }
    public int getMaxDepth() { return maxDepth; }
    public int getConcurrency() { return concurrency; }
    public Duration getTimeout() { return timeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public boolean isSameDomainOnly() { return sameDomainOnly; }
    public Path getOutputDir() { return outputDir; }
    public int getMaxSegments() { return maxSegments; }
    public boolean isCleanOutputOnStart() { return cleanOutputOnStart; }
    public Path getLogDir() { return logDir; }

    // ---------- fluent setters ----------

    /** 순서를 유지한 채 중복 제거, 공백/빈 항목은 버림 */
    public CrawlConfig setStartUrls(List<String> urls) {
        if (urls == null) {
            this.startUrls = List.of();
            return this;
        }
        LinkedHashSet<String> dedup = new LinkedHashSet<>();
        for (String u : urls) {
            if (u != null && !u.isBlank()) dedup.add(u.strip());
        }
        this.startUrls = List.copyOf(new ArrayList<>(dedup));
        return this;
    }

    public CrawlConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlConfig setConcurrency(int concurrency) { this.concurrency = concurrency; return this; }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlConfig setUserAgent(String userAgent) {
        if (userAgent != null && !userAgent.isBlank()) this.userAgent = userAgent;
        return this;
    }
    public CrawlConfig setSameDomainOnly(boolean v) { this.sameDomainOnly = v; return this; }
    public CrawlConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public CrawlConfig setMaxSegments(int maxSegments) { this.maxSegments = maxSegments; return this; }
    public CrawlConfig setCleanOutputOnStart(boolean v) { this.cleanOutputOnStart = v; return this; }
    public CrawlConfig setLogDir(Path logDir) { this.logDir = logDir; return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(startUrls, "startUrls");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (maxSegments < 1) throw new IllegalArgumentException("maxSegments must be >= 1");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(logDir, "logDir");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public CrawlConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }
}
