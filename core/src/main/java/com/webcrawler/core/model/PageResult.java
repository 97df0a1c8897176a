package com.webcrawler.core.model;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * 한 페이지 추출 결과. mainText 는 Writer 로, links 는 Frontier 로 넘어가고 보관하지 않는다.
 * links 는 정규화 완료 + 페이지 내 중복 제거 + 문서 순서 유지.
 * invalidLinks 는 정규화에서 거부된 href 수(집계용).
 */
public record PageResult(URI url, String mainText, List<URI> links, int invalidLinks) {
    public PageResult {
        Objects.requireNonNull(url, "url");
        mainText = (mainText == null) ? "" : mainText;
        links = (links == null) ? List.of() : List.copyOf(links);
        if (invalidLinks < 0) invalidLinks = 0;
    }

    public boolean hasText() { return !mainText.isBlank(); }
}
