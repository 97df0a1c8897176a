package com.webcrawler.core.service;

import com.webcrawler.core.api.IContentExtractor;
import com.webcrawler.core.api.IOutputWriter;
import com.webcrawler.core.api.IPageFetcher;
import com.webcrawler.core.crawler.Frontier;
import com.webcrawler.core.crawler.JsoupContentExtractor;
import com.webcrawler.core.crawler.ParseFailureException;
import com.webcrawler.core.crawler.VisitedSet;
import com.webcrawler.core.http.FetchException;
import com.webcrawler.core.http.HttpPageFetcher;
import com.webcrawler.core.model.CrawlConfig;
import com.webcrawler.core.model.CrawlEvent;
import com.webcrawler.core.model.CrawlStats;
import com.webcrawler.core.model.CrawlSummary;
import com.webcrawler.core.model.FetchResponse;
import com.webcrawler.core.model.PageResult;
import com.webcrawler.core.model.WorkItem;
import com.webcrawler.core.output.FileOutputWriter;
import com.webcrawler.core.util.CrawlListener;
import com.webcrawler.core.util.InvalidUrlException;
import com.webcrawler.core.util.StructuredLog;
import com.webcrawler.core.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.webcrawler.core.model.CrawlEvent.Type.*;

/**
 * 크롤 오케스트레이터:
 *  - 시드 정규화/claim → Frontier(depth 0)
 *  - 고정 스레드풀(동시성=concurrency) 워커가 Frontier 가 drained 될 때까지
 *    fetch → extract → write → 자식 enqueue 반복
 *  - 모든 복구 가능 오류는 카운트 + 이벤트로 드러내고 크롤은 계속
 *  - DI 생성자는 테스트/스텁 주입용
 */
public final class CrawlScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlScheduler.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlScheduler.class);

    private final CrawlConfig config;
    private final IPageFetcher fetcher;
    private final IContentExtractor extractor;
    private final IOutputWriter writer;
    private final CrawlListener listener;

    /** 기본 구현(HttpClient + jsoup + 파일 출력) */
    public CrawlScheduler(CrawlConfig config) {
        this(config,
                new HttpPageFetcher(config),
                new JsoupContentExtractor(),
                new FileOutputWriter(config.getOutputDir(), config.getMaxSegments()));
    }

    /** DI/테스트용 */
    public CrawlScheduler(CrawlConfig config, IPageFetcher fetcher, IContentExtractor extractor, IOutputWriter writer) {
        this(config, fetcher, extractor, writer, CrawlListener.NONE);
    }

    public CrawlScheduler(CrawlConfig config, IPageFetcher fetcher, IContentExtractor extractor,
                          IOutputWriter writer, CrawlListener listener) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.listener = (listener != null) ? listener : CrawlListener.NONE;
    }

    /* =========================
       실행 API
       ========================= */

    /** 설정값(startUrls/maxDepth/concurrency)으로 실행 */
    public CrawlSummary run() {
        return run(config.getStartUrls(), config.getMaxDepth(), config.getConcurrency(), null);
    }

    /** 설정값 + 취소 플래그 */
    public CrawlSummary run(AtomicBoolean cancelFlag) {
        return run(config.getStartUrls(), config.getMaxDepth(), config.getConcurrency(), cancelFlag);
    }

    public CrawlSummary run(List<String> seeds, int maxDepth, int concurrency) {
        return run(seeds, maxDepth, concurrency, null);
    }

    /**
     * 한 번의 크롤. 방문 집합/프론티어/카운터는 실행마다 새로 만든다.
     *
     * @param cancelFlag true 가 되면 새 작업을 시작하지 않고 빠르게 마무리(null 허용)
     */
    public CrawlSummary run(List<String> seeds, int maxDepth, int concurrency, AtomicBoolean cancelFlag) {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");

        final long t0 = System.nanoTime();
        final Run run = new Run(maxDepth, cancelFlag);
        final List<String> seedList = (seeds == null) ? List.of() : seeds;

        LOG.info("Crawl start: seeds={}, maxDepth={}, cc={}", seedList.size(), maxDepth, concurrency);
        SLOG.info("crawl-start",
                "seeds", seedList.size(),
                "maxDepth", maxDepth,
                "cc", concurrency,
                "sameDomainOnly", config.isSameDomainOnly());

        // ---- 0) 시드 ----
        int seeded = seed(run, seedList);
        if (seeded == 0) {
            return finish(run, t0);
        }

        // ---- 1) 고정 스레드풀 ----
        ExecutorService exec = new ThreadPoolExecutor(
                concurrency, concurrency,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("crawl-worker"));

        List<Future<?>> workers = new ArrayList<>(concurrency);
        try {
            for (int i = 0; i < concurrency; i++) {
                workers.add(exec.submit(() -> workerLoop(run)));
            }
            // ---- 2) 종료 대기 ----
            for (Future<?> f : workers) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    LOG.error("Crawl worker died: {}", cause.toString());
                    SLOG.error("worker-failed", cause, "cause", cause.toString());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    run.frontier.stop();
                    break;
                }
            }
        } finally {
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        return finish(run, t0);
    }

    /* =========================
       단계별 처리
       ========================= */

    private int seed(Run run, List<String> seeds) {
        int pushed = 0;
        for (String raw : seeds) {
            URI url;
            try {
                url = UrlNormalizer.normalize(raw);
            } catch (InvalidUrlException e) {
                run.stats.invalidUrl();
                LOG.warn("Invalid seed skipped: {} ({})", raw, e.getMessage());
                emit(CrawlEvent.of(LINK_INVALID, null, 0, e.getMessage()));
                continue;
            }
            if (!run.visited.tryClaim(url)) {
                run.stats.duplicateSkipped();
                emit(CrawlEvent.of(SKIP_DUPLICATE, url, 0));
                continue;
            }
            if (run.frontier.push(WorkItem.seed(url))) pushed++;
        }
        return pushed;
    }

    private void workerLoop(Run run) {
        while (true) {
            if (run.isCancelled()) {
                run.frontier.stop();
                return;
            }
            Optional<WorkItem> next;
            try {
                next = run.frontier.take();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                run.frontier.stop();
                return;
            }
            if (next.isEmpty()) return; // drained 또는 stop

            WorkItem item = next.get();
            int cur = run.active.incrementAndGet();
            run.stats.observeConcurrency(cur);
            try {
                process(run, item);
            } catch (RuntimeException e) {
                // 단계별 catch 밖(자식 enqueue 등)에서 난 예외: 이 작업만 버린다
                unexpected("enqueue", item, e);
            } finally {
                run.active.decrementAndGet();
                run.frontier.complete(item); // 자식 push 이후
            }
        }
    }

    /** fetch → extract → write → enqueue-children (이 순서 보장) */
    private void process(Run run, WorkItem item) {
        URI url = item.url();
        LOG.info("Crawling: {} (depth {})", url, item.depth());

        // 1) fetch
        FetchResponse resp;
        try {
            resp = Objects.requireNonNull(fetcher.fetch(url), "fetcher returned null");
        } catch (FetchException e) {
            run.stats.fetchFailed();
            LOG.warn("Failed to fetch {}: {}", url, e.getMessage());
            emit(CrawlEvent.of(FETCH_FAILED, url, item.depth(), e.getMessage()));
            return;
        } catch (RuntimeException e) {
            run.stats.fetchFailed();
            unexpected("fetch", item, e);
            emit(CrawlEvent.of(FETCH_FAILED, url, item.depth(), e.toString()));
            return;
        }
        run.stats.pageFetched();
        emit(CrawlEvent.of(FETCH_OK, url, item.depth(), "status=" + resp.getStatusCode()));

        // 2) extract
        if (!resp.isHtml()) {
            run.stats.parseFailed();
            emit(CrawlEvent.of(EXTRACT_FAILED, url, item.depth(), "unsupported content type: " + resp.getContentType()));
            return;
        }
        PageResult page;
        try {
            page = Objects.requireNonNull(extractor.extract(resp.getBody(), resp.getCharset(), url), "extractor returned null");
        } catch (ParseFailureException e) {
            run.stats.parseFailed();
            LOG.warn("Failed to extract {}: {}", url, e.getMessage());
            emit(CrawlEvent.of(EXTRACT_FAILED, url, item.depth(), e.getMessage()));
            return;
        } catch (RuntimeException e) {
            run.stats.parseFailed();
            unexpected("extract", item, e);
            emit(CrawlEvent.of(EXTRACT_FAILED, url, item.depth(), e.toString()));
            return;
        }
        run.stats.invalidUrls(page.invalidLinks());
        emit(CrawlEvent.of(EXTRACT_OK, url, item.depth(), "links=" + page.links().size()));

        // 3) write (본문이 없으면 기록하지 않음)
        if (page.hasText()) {
            try {
                Path target = writer.write(url, page.mainText());
                run.stats.pageWritten();
                emit(CrawlEvent.of(PAGE_WRITTEN, url, item.depth(), String.valueOf(target)));
            } catch (IOException e) {
                run.stats.writeFailed();
                LOG.warn("Failed to write {}: {}", url, e.toString());
                emit(CrawlEvent.of(WRITE_FAILED, url, item.depth(), e.toString()));
            } catch (RuntimeException e) {
                run.stats.writeFailed();
                unexpected("write", item, e);
                emit(CrawlEvent.of(WRITE_FAILED, url, item.depth(), e.toString()));
            }
        } else {
            LOG.debug("No main text on {}", url);
        }

        // 4) children
        enqueueChildren(run, item, page.links());
    }

    // fetcher/extractor/writer 구현의 unchecked 예외. 집계는 호출 측 단계가 한다
    private void unexpected(String stage, WorkItem item, RuntimeException e) {
        LOG.error("Unexpected {} failure on {}: {}", stage, item.url(), e.toString());
        SLOG.error("task-failed", e, "stage", stage, "url", item.url().toString(), "depth", item.depth());
    }

    /**
     * 링크별: same-site → 이미 방문 → 깊이 초과 → claim → push.
     * 깊이 초과 링크는 claim 하지 않는다(더 얕은 경로로 다시 발견되면 방문 가능).
     */
    private void enqueueChildren(Run run, WorkItem parent, List<URI> links) {
        int childDepth = parent.depth() + 1;
        for (URI link : links) {
            if (run.isCancelled()) return;

            if (config.isSameDomainOnly() && !UrlNormalizer.isSameSite(parent.url(), link)) {
                run.stats.offSiteSkipped();
                emit(CrawlEvent.of(SKIP_OFF_SITE, link, childDepth));
                continue;
            }
            if (run.visited.contains(link)) {
                run.stats.duplicateSkipped();
                emit(CrawlEvent.of(SKIP_DUPLICATE, link, childDepth));
                continue;
            }
            if (!run.frontier.accepts(childDepth)) {
                run.stats.overDepthSkipped();
                emit(CrawlEvent.of(SKIP_OVER_DEPTH, link, childDepth));
                continue;
            }
            if (!run.visited.tryClaim(link)) { // 다른 워커가 방금 가져감
                run.stats.duplicateSkipped();
                emit(CrawlEvent.of(SKIP_DUPLICATE, link, childDepth));
                continue;
            }
            run.frontier.push(parent.child(link));
        }
    }

    private CrawlSummary finish(Run run, long t0) {
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        CrawlSummary s = run.stats.snapshot(elapsedMs, run.frontier.state());

        LOG.info("Crawl done. fetched={}, written={}, fetchFailures={}, parseFailures={}, writeFailures={}, "
                        + "duplicates={}, overDepth={}, offSite={}, invalidUrls={}, maxObservedCC={}, elapsedMs={}",
                s.pagesFetched(), s.pagesWritten(), s.fetchFailures(), s.parseFailures(), s.writeFailures(),
                s.duplicatesSkipped(), s.overDepthSkipped(), s.offSiteSkipped(), s.invalidUrls(),
                s.maxObservedConcurrency(), s.elapsedMs());
        SLOG.info("crawl-done",
                "pagesFetched", s.pagesFetched(),
                "pagesWritten", s.pagesWritten(),
                "fetchFailures", s.fetchFailures(),
                "parseFailures", s.parseFailures(),
                "writeFailures", s.writeFailures(),
                "invalidUrls", s.invalidUrls(),
                "duplicatesSkipped", s.duplicatesSkipped(),
                "overDepthSkipped", s.overDepthSkipped(),
                "offSiteSkipped", s.offSiteSkipped(),
                "maxObservedCC", s.maxObservedConcurrency(),
                "elapsedMs", s.elapsedMs(),
                "state", s.state().name());
        emitToListener(CrawlEvent.of(CRAWL_DONE, null, 0, "state=" + s.state()));
        return s;
    }

    /* =========================
       공용 유틸
       ========================= */

    private void emit(CrawlEvent e) {
        SLOG.event(e);
        emitToListener(e);
    }

    private void emitToListener(CrawlEvent e) {
        try {
            listener.onEvent(e);
        } catch (RuntimeException ex) {
            LOG.warn("Crawl listener failed on {}: {}", e.type(), ex.toString());
        }
    }

    /** 실행 1회분 상태(실행 간 공유하지 않음) */
    private static final class Run {
        final Frontier frontier;
        final VisitedSet visited = new VisitedSet();
        final CrawlStats stats = new CrawlStats();
        final AtomicInteger active = new AtomicInteger(0);
        final AtomicBoolean cancel;

        Run(int maxDepth, AtomicBoolean cancel) {
            this.frontier = new Frontier(maxDepth);
            this.cancel = cancel;
        }

        boolean isCancelled() {
            return Thread.currentThread().isInterrupted() || (cancel != null && cancel.get());
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
