package com.webcrawler.core.http;

import java.net.URI;

/** fetch 실패(네트워크 오류 또는 non-2xx). statusCode 는 응답이 없으면 -1. */
public class FetchException extends Exception {
    private final URI url;
    private final int statusCode;

    public FetchException(URI url, int statusCode, String message) {
        super(message);
        this.url = url;
        this.statusCode = statusCode;
    }

    public FetchException(URI url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = -1;
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }

    /** 응답 자체를 못 받은 경우 */
    public boolean isNetworkError() { return statusCode < 0; }
}
