package com.webcrawler.app.app;

import com.webcrawler.app.config.JsonConfigLoader;
import com.webcrawler.app.logging.LogSetup;
import com.webcrawler.app.report.CrawlSummaryIO;
import com.webcrawler.core.model.CrawlConfig;
import com.webcrawler.core.model.CrawlSummary;
import com.webcrawler.core.output.FileOutputWriter;
import com.webcrawler.core.service.CrawlScheduler;
import com.webcrawler.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 명령행 진입점.
 * <pre>
 *   java -jar webcrawler-app-cli.jar [config-file]   (기본 config.json, .yml/.yaml 은 YAML)
 * </pre>
 * 종료코드: 0 완료, 1 실행 중 예기치 못한 오류, 2 설정 오류.
 */
public final class CrawlerApp {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlerApp.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_CONFIG = 2;

    static final String DEFAULT_CONFIG = "config.json";

    private CrawlerApp() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /** main 본체(테스트에서 System.exit 없이 호출) */
    static int run(String[] args, PrintStream out) {
        Path configPath = Path.of(args != null && args.length > 0 ? args[0] : DEFAULT_CONFIG);

        CrawlConfig cfg;
        try {
            cfg = loadConfig(configPath);
        } catch (IOException | RuntimeException e) {
            LogSetup.init(CrawlConfig.defaults().getLogDir());
            LOG.error("Failed to load config {}: {}", configPath, e.getMessage());
            return EXIT_CONFIG;
        }

        LogSetup.init(cfg.getLogDir());
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught on {}", t.getName(), e));

        if (cfg.getStartUrls().isEmpty()) {
            LOG.warn("No start URLs configured in {}", configPath);
        }

        try {
            if (cfg.isCleanOutputOnStart()) {
                FileOutputWriter.clean(cfg.getOutputDir());
                LOG.info("Cleaned output dir {}", cfg.getOutputDir().toAbsolutePath());
            }
        } catch (IOException e) {
            LOG.error("Failed to clean output dir {}: {}", cfg.getOutputDir(), e.toString());
            return EXIT_FAILURE;
        }

        // Ctrl+C → 새 작업 중단, 처리 중인 페이지까지만 마무리
        AtomicBoolean cancel = new AtomicBoolean(false);
        CountDownLatch done = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            cancel.set(true);
            try {
                done.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }, "crawl-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        CrawlSummary summary;
        try {
            summary = new CrawlScheduler(cfg).run(cancel);
        } catch (RuntimeException e) {
            LOG.error("Crawl aborted", e);
            return EXIT_FAILURE;
        } finally {
            done.countDown();
            removeHook(hook);
        }

        out.println(format(summary));

        Path summaryFile = summaryFileFor(cfg.getOutputDir());
        try {
            new CrawlSummaryIO().export(new CrawlSummaryIO.Report("1", Instant.now(), cfg.getStartUrls(),
                    cfg.getMaxDepth(), cfg.getOutputDir().toString(), summary), summaryFile);
            LOG.info("Summary written to {}", summaryFile.toAbsolutePath());
        } catch (IOException e) {
            // 요약 파일은 부가물: 크롤 결과는 이미 기록됨
            LOG.warn("Failed to write summary {}: {}", summaryFile, e.toString());
        }
        return EXIT_OK;
    }

    static CrawlConfig loadConfig(Path path) throws IOException {
        String name = String.valueOf(path.getFileName()).toLowerCase(Locale.ROOT);
        if (name.endsWith(".yml") || name.endsWith(".yaml")) {
            return YamlConfigLoader.load(path);
        }
        return new JsonConfigLoader().load(path);
    }

    /** 출력 디렉터리 옆(같은 부모)에 둔다 */
    static Path summaryFileFor(Path outputDir) {
        return outputDir.toAbsolutePath().resolveSibling(CrawlSummaryIO.FILE_NAME);
    }

    static String format(CrawlSummary s) {
        return String.format(Locale.ROOT,
                "Crawl %s in %d ms%n"
                        + "  pages fetched   : %d%n"
                        + "  pages written   : %d%n"
                        + "  fetch failures  : %d%n"
                        + "  parse failures  : %d%n"
                        + "  write failures  : %d%n"
                        + "  invalid urls    : %d%n"
                        + "  duplicates      : %d%n"
                        + "  over depth      : %d%n"
                        + "  off site        : %d%n"
                        + "  peak concurrency: %d",
                s.state().name().toLowerCase(Locale.ROOT), s.elapsedMs(),
                s.pagesFetched(), s.pagesWritten(), s.fetchFailures(), s.parseFailures(), s.writeFailures(),
                s.invalidUrls(), s.duplicatesSkipped(), s.overDepthSkipped(), s.offSiteSkipped(),
                s.maxObservedConcurrency());
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // 이미 종료 중: 훅이 실행 중이므로 그대로 둔다
            LOG.debug("Shutdown in progress, hook kept");
        }
    }
}
