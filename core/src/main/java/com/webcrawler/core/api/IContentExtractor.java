package com.webcrawler.core.api;

import com.webcrawler.core.crawler.ParseFailureException;
import com.webcrawler.core.model.PageResult;

import java.net.URI;

/** 페이지 본문에서 본문 텍스트와 정규화된 링크 목록을 뽑는 전략 인터페이스. */
@FunctionalInterface
public interface IContentExtractor {
    /**
     * @param body        응답 본문(원시 바이트)
     * @param charsetName Content-Type 헤더의 charset, 없으면 null(BOM/meta 로 판별)
     * @param pageUrl     페이지 자신의 URL(상대 링크 해석 기준)
     */
    PageResult extract(byte[] body, String charsetName, URI pageUrl) throws ParseFailureException;
}
