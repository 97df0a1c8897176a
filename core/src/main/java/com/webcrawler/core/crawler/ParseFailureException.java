package com.webcrawler.core.crawler;

import java.net.URI;

/** 본문 추출 실패. 해당 페이지의 링크는 버리고 크롤은 계속한다. */
public class ParseFailureException extends Exception {
    private final URI url;

    public ParseFailureException(URI url, String message) {
        super(message);
        this.url = url;
    }

    public ParseFailureException(URI url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public URI getUrl() { return url; }
}
