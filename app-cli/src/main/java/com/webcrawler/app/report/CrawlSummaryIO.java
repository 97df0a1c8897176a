package com.webcrawler.app.report;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.webcrawler.core.model.CrawlSummary;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** 크롤 요약을 crawl-summary.json 으로 내보내기/읽기 */
public final class CrawlSummaryIO {

    public static final String FILE_NAME = "crawl-summary.json";

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS); // ISO-8601

    /** 파일 포맷: 실행 메타 + 요약 */
    public record Report(String v, Instant finishedAt, List<String> startUrls, int maxDepth,
                         String outputDir, CrawlSummary summary) {}

    public Path export(Report report, Path file) throws IOException {
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(file, "file");
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        om.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
        return file;
    }

    public Report read(Path file) throws IOException {
        Report r = om.readValue(file.toFile(), Report.class);
        if (!"1".equals(r.v())) {
            throw new IllegalArgumentException("Unsupported summary version: " + r.v());
        }
        return r;
    }
}
