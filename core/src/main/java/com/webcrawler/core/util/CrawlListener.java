package com.webcrawler.core.util;

import com.webcrawler.core.model.CrawlEvent;

/**
 * 크롤 이벤트 수신자. 워커 스레드에서 동시에 호출되므로 구현은 스레드 세이프해야 한다.
 * 리스너 예외는 크롤을 멈추지 않는다(스케줄러가 로그만 남김).
 */
@FunctionalInterface
public interface CrawlListener {
    void onEvent(CrawlEvent event);

    CrawlListener NONE = e -> {};
}
