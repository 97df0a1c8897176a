package com.webcrawler.core.model;

/**
 * 크롤 전체 상태.
 * RUNNING → DRAINING → TERMINATED, TERMINATED 는 최종(되돌아가지 않음).
 */
public enum CrawlState {
    /** 큐에 작업이 있음(또는 아직 아무 워커도 가져가지 않음) */
    RUNNING,
    /** 큐는 비었지만 처리 중인 워커가 있어 자식이 더 들어올 수 있음 */
    DRAINING,
    /** 큐 비어있고 처리 중 0 (또는 stop) */
    TERMINATED
}
