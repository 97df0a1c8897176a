package com.webcrawler.core.api;

import com.webcrawler.core.http.FetchException;
import com.webcrawler.core.model.FetchResponse;

import java.net.URI;

/** fetch 능력 최소 계약: URL → (status, body). 네트워크 실패는 FetchException. */
@FunctionalInterface
public interface IPageFetcher {
    FetchResponse fetch(URI url) throws FetchException;
}
