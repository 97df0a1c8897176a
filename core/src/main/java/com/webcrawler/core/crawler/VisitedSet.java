package com.webcrawler.core.crawler;

import java.net.URI;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 이미 스케줄된 정규화 URL 집합. 한 크롤 실행 동안만 존재하고 줄어들지 않는다.
 * tryClaim 은 test-and-set 한 번으로 끝나므로 동시 워커 중 정확히 하나만 이긴다.
 */
public final class VisitedSet {
    private final Set<URI> claimed = ConcurrentHashMap.newKeySet();

    /** 처음 호출이면 기록 후 true, 이후 같은 URL 은 항상 false */
    public boolean tryClaim(URI url) {
        return claimed.add(Objects.requireNonNull(url, "url"));
    }

    public boolean contains(URI url) {
        return url != null && claimed.contains(url);
    }

    public int size() {
        return claimed.size();
    }
}
