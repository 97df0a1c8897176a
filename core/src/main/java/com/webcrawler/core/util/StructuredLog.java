package com.webcrawler.core.util;

import com.webcrawler.core.model.CrawlEvent;

import java.time.Instant;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 크롤 이벤트용 JSON 한 줄 로거(JUL).
 * 핸들러(콘솔/파일) 구성은 app-cli LogSetup 몫.
 * 크롤 시작/종료는 info, 작업/워커 실패는 error, 페이지 단위 이벤트는 {@link #event(CrawlEvent)}.
 */
public final class StructuredLog {
    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void info(String event, Object... kvs) {
        log(Level.INFO, event, null, kvs);
    }

    public void error(String event, Throwable t, Object... kvs) {
        log(Level.SEVERE, event, t, kvs);
    }

    /** FETCH_FAILED → "fetch-failed" 처럼 타입 이름을 이벤트명으로 */
    public void event(CrawlEvent e) {
        String name = e.type().name().toLowerCase(Locale.ROOT).replace('_', '-');
        log(levelOf(e.type()), name, null,
                "url", e.url() == null ? null : e.url().toString(),
                "depth", e.depth(),
                "detail", e.detail());
    }

    /** 실패는 WARNING, 스킵/링크 단위는 FINE, 나머지 INFO */
    static Level levelOf(CrawlEvent.Type type) {
        if (type.isFailure()) return Level.WARNING;
        switch (type) {
            case SKIP_DUPLICATE:
            case SKIP_OVER_DEPTH:
            case SKIP_OFF_SITE:
            case LINK_INVALID:
            case EXTRACT_OK:
                return Level.FINE;
            default:
                return Level.INFO;
        }
    }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    /** kvs 는 key, value 교대. 홀수 개면 마지막 key 는 버리고 _kv_mismatch 표시 */
    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        StringBuilder sb = new StringBuilder(160).append('{');
        field(sb, "ts", Instant.now().toString());
        field(sb, "lvl", lvl.getName());
        field(sb, "comp", comp);
        field(sb, "thread", Thread.currentThread().getName());
        field(sb, "event", event);
        int n = (kvs == null) ? 0 : kvs.length;
        for (int i = 0; i + 1 < n; i += 2) {
            field(sb, String.valueOf(kvs[i]), kvs[i + 1]);
        }
        if (n % 2 == 1) field(sb, "_kv_mismatch", true);
        if (t != null) {
            field(sb, "error", t.getClass().getSimpleName());
            field(sb, "message", t.getMessage());
        }
        sb.setLength(sb.length() - 1); // 마지막 콤마
        return sb.append('}').toString();
    }

    private static void field(StringBuilder sb, String key, Object value) {
        quote(sb, key).append(':');
        if (value == null) sb.append("null");
        else if (value instanceof Number || value instanceof Boolean) sb.append(value);
        else quote(sb, String.valueOf(value));
        sb.append(',');
    }

    private static StringBuilder quote(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':  sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n");  break;
                case '\r': sb.append("\\r");  break;
                case '\t': sb.append("\\t");  break;
                default:
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
            }
        }
        return sb.append('"');
    }
}
