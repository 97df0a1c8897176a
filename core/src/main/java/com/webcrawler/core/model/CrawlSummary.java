package com.webcrawler.core.model;

/** 크롤 1회 결과 요약(불변). 복구 가능한 오류는 모두 여기 카운트로 드러난다. */
public record CrawlSummary(
        long pagesFetched,
        long pagesWritten,
        long fetchFailures,
        long parseFailures,
        long writeFailures,
        long invalidUrls,
        long duplicatesSkipped,
        long overDepthSkipped,
        long offSiteSkipped,
        int maxObservedConcurrency,
        long elapsedMs,
        CrawlState state
) {
    /** 시드가 하나도 없을 때 */
    public static CrawlSummary empty() {
        return new CrawlSummary(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, CrawlState.TERMINATED);
    }

    public long totalFailures() {
        return fetchFailures + parseFailures + writeFailures;
    }
}
