package com.webcrawler.core.model;

import java.net.URI;
import java.util.Objects;

/**
 * 프론티어 작업 단위: 정규화된 URL + 발견 깊이.
 * 시드는 depth 0, 링크 발견 시 부모 depth + 1. 생성 후 불변.
 */
public record WorkItem(URI url, int depth) {
    public WorkItem {
        Objects.requireNonNull(url, "url");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
    }

    public static WorkItem seed(URI url) { return new WorkItem(url, 0); }

    /** 이 페이지에서 발견한 링크의 작업 단위 */
    public WorkItem child(URI link) { return new WorkItem(link, depth + 1); }
}
