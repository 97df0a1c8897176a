package com.webcrawler.core.util;

import com.webcrawler.core.model.CrawlConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * crawl.yml 을 읽어 CrawlConfig 로 변환.
 *
 * 예상 YAML 키:
 * startUrls:
 *   - "https://example.com/"
 * maxDepth: 5
 * concurrency: 4
 * timeoutMs: 10000
 * followRedirects: true
 * userAgent: "webcrawler/1.0"
 * sameDomainOnly: true
 * scope:              # 평면 키보다 우선
 *   maxDepth: 2
 *   sameDomainOnly: true
 * output:
 *   dir: "crawled_pages"
 *   maxSegments: 3
 *   clean: false
 * logDir: "logs"
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CrawlConfig loadDefault() throws IOException {
        return load(Path.of("crawl.yml"));
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("config not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            return fromObject(yaml.load(in));
        }
    }

    /** YAML 문자열에서 변환(테스트/임베드용) */
    public static CrawlConfig parse(String yamlText) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        return fromObject(yaml.load(yamlText == null ? "" : yamlText));
    }

    private static CrawlConfig fromObject(Object root) {
        CrawlConfig cfg = CrawlConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setStringList(map, "startUrls", cfg::setStartUrls);
        setInt(map, "maxDepth", cfg::setMaxDepth);
        setInt(map, "concurrency", cfg::setConcurrency);
        setIntAsDurationMs(map, "timeoutMs", cfg::setTimeout);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setString(map, "userAgent", cfg::setUserAgent);
        setBoolean(map, "sameDomainOnly", cfg::setSameDomainOnly);
        setPath(map, "logDir", cfg::setLogDir);

        // 2) scope.*
        Map<String, Object> scope = getMap(map, "scope");
        if (scope != null) {
            setInt(scope, "maxDepth", cfg::setMaxDepth);
            setBoolean(scope, "sameDomainOnly", cfg::setSameDomainOnly);
        }

        // 3) output.*
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setPath(output, "dir", cfg::setOutputDir);
            setInt(output, "maxSegments", cfg::setMaxSegments);
            setBoolean(output, "clean", cfg::setCleanOutputOnStart);
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(out);
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setIntAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }
}
