package com.webcrawler.core.model;

import java.net.URI;
import java.util.Objects;

/** 코어가 내보내는 구조화 이벤트. 어디로 보낼지는 리스너 몫. */
public record CrawlEvent(Type type, URI url, int depth, String detail) {

    public enum Type {
        FETCH_OK,
        FETCH_FAILED,
        EXTRACT_OK,
        EXTRACT_FAILED,
        PAGE_WRITTEN,
        WRITE_FAILED,
        LINK_INVALID,
        SKIP_DUPLICATE,
        SKIP_OVER_DEPTH,
        SKIP_OFF_SITE,
        CRAWL_DONE;

        /** 집계상 실패로 보는 이벤트 */
        public boolean isFailure() {
            return this == FETCH_FAILED || this == EXTRACT_FAILED || this == WRITE_FAILED;
        }
    }

    public CrawlEvent {
        Objects.requireNonNull(type, "type");
    }

    public static CrawlEvent of(Type type, URI url, int depth) {
        return new CrawlEvent(type, url, depth, null);
    }

    public static CrawlEvent of(Type type, URI url, int depth, String detail) {
        return new CrawlEvent(type, url, depth, detail);
    }
}
