package com.webcrawler.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 크롤 런타임 카운터 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong pagesFetched      = new AtomicLong(0); // 2xx 응답
    private final AtomicLong pagesWritten      = new AtomicLong(0);
    private final AtomicLong fetchFailures     = new AtomicLong(0); // 네트워크 오류 + non-2xx
    private final AtomicLong parseFailures     = new AtomicLong(0);
    private final AtomicLong writeFailures     = new AtomicLong(0);
    private final AtomicLong invalidUrls       = new AtomicLong(0);
    private final AtomicLong duplicatesSkipped = new AtomicLong(0);
    private final AtomicLong overDepthSkipped  = new AtomicLong(0);
    private final AtomicLong offSiteSkipped    = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void pageFetched()      { pagesFetched.incrementAndGet(); }
    public void pageWritten()      { pagesWritten.incrementAndGet(); }
    public void fetchFailed()      { fetchFailures.incrementAndGet(); }
    public void parseFailed()      { parseFailures.incrementAndGet(); }
    public void writeFailed()      { writeFailures.incrementAndGet(); }
    public void invalidUrl()       { invalidUrls.incrementAndGet(); }
    public void invalidUrls(long n) { if (n > 0) invalidUrls.addAndGet(n); }
    public void duplicateSkipped() { duplicatesSkipped.incrementAndGet(); }
    public void overDepthSkipped() { overDepthSkipped.incrementAndGet(); }
    public void offSiteSkipped()   { offSiteSkipped.incrementAndGet(); }

    /** 현재 동시 처리 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public CrawlSummary snapshot(long elapsedMs, CrawlState state) {
        return new CrawlSummary(
                pagesFetched.get(),
                pagesWritten.get(),
                fetchFailures.get(),
                parseFailures.get(),
                writeFailures.get(),
                invalidUrls.get(),
                duplicatesSkipped.get(),
                overDepthSkipped.get(),
                offSiteSkipped.get(),
                maxObservedConcurrency.get(),
                elapsedMs,
                state);
    }
}
