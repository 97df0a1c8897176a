package com.webcrawler.core.model;

import java.net.URI;
import java.nio.charset.Charset;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** fetch 결과 캡처(본문은 원시 바이트, 문자셋 판별은 추출기 몫). 상태 코드 판정은 호출자가 한다. */
public final class FetchResponse {
    private static final byte[] EMPTY = new byte[0];
    private static final Pattern CHARSET = Pattern.compile("(?i)\\bcharset\\s*=\\s*[\"']?([^\\s;\"']+)");

    private final URI url;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final String contentType;
    private final long responseTimeMs;

    private FetchResponse(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? EMPTY : b.body;
        this.contentType = b.contentType;
        this.responseTimeMs = b.responseTimeMs;
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public byte[] getBody() { return body; }
    public String getContentType() { return contentType; }
    public long getResponseTimeMs() { return responseTimeMs; }

    /** 2xx 만 성공 */
    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /** text/html, application/xhtml+xml 또는 Content-Type 미상이면 HTML 로 취급 */
    public boolean isHtml() {
        if (contentType == null || contentType.isBlank()) return true;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("html");
    }

    /** Content-Type 헤더의 charset. 없거나 JVM 이 모르는 이름이면 null(본문 meta/BOM 으로 판별) */
    public String getCharset() {
        if (contentType == null) return null;
        Matcher m = CHARSET.matcher(contentType);
        if (!m.find()) return null;
        String name = m.group(1).trim();
        try {
            return Charset.isSupported(name) ? Charset.forName(name).name() : null;
        } catch (IllegalArgumentException e) {
            return null; // 잘못된 charset 이름
        }
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private int statusCode;
        private Map<String, List<String>> headers;
        private byte[] body;
        private String contentType;
        private long responseTimeMs;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(byte[] body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }

        public FetchResponse build() {
            Objects.requireNonNull(url, "url");
            return new FetchResponse(this);
        }
    }
}
