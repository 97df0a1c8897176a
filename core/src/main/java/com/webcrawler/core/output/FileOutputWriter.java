package com.webcrawler.core.output;

import com.webcrawler.core.api.IOutputWriter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Comparator;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * 추출 텍스트를 outputDir 아래 파일에 append 한다.
 * - 대상 파일은 OutputNaming 으로 결정, 없으면 생성
 * - 레코드마다 구분선 + URL 헤더를 앞에 붙여 같은 파일에 모인 여러 URL 을 구분
 * - 다른 파일끼리는 병렬, 같은 파일은 파일별 락으로 직렬화(레코드가 섞이지 않음)
 */
public final class FileOutputWriter implements IOutputWriter {

    public static final String RULE = "=".repeat(40);

    private final Path outputDir;
    private final int maxSegments;
    private final ConcurrentHashMap<Path, Object> locks = new ConcurrentHashMap<>();

    public FileOutputWriter(Path outputDir, int maxSegments) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        if (maxSegments < 1) throw new IllegalArgumentException("maxSegments must be >= 1");
        this.maxSegments = maxSegments;
    }

    public Path getOutputDir() { return outputDir; }

    /** url 이 기록될 파일(절대/outputDir 기준) */
    public Path targetOf(URI url) {
        return outputDir.resolve(OutputNaming.targetFor(url, maxSegments));
    }

    @Override
    public Path write(URI url, String text) throws IOException {
        Objects.requireNonNull(url, "url");
        Path target = targetOf(url);
        String record = formatRecord(url, text);

        Object lock = locks.computeIfAbsent(target, k -> new Object());
        synchronized (lock) {
            Files.createDirectories(outputDir);
            try (BufferedWriter w = Files.newBufferedWriter(target, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                w.write(record);
            }
        }
        return target;
    }

    /** 레코드 포맷: 빈 줄 2개 + 구분선 + URL + 구분선 + 본문 + 개행 */
    public static String formatRecord(URI url, String text) {
        StringBuilder sb = new StringBuilder((text == null ? 0 : text.length()) + 128);
        sb.append("\n\n").append(RULE).append('\n')
          .append("URL: ").append(url).append('\n')
          .append(RULE).append('\n');
        if (text != null) sb.append(text);
        sb.append('\n');
        return sb.toString();
    }

    /** 디렉터리를 통째로 비우고 다시 만든다(cleanOutputOnStart 용). */
    public static void clean(Path dir) throws IOException {
        Objects.requireNonNull(dir, "dir");
        if (Files.exists(dir)) {
            try (Stream<Path> walk = Files.walk(dir)) {
                for (Path p : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                    Files.delete(p);
                }
            }
        }
        Files.createDirectories(dir);
    }
}
