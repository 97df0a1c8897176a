package com.webcrawler.core.util;

import org.jsoup.internal.StringUtil;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * URL 정규화 + same-site 판정 유틸.
 *
 * 정규화 규칙(중복 판정 키로 사용되므로 결정적이어야 함):
 * - 상대 URL은 base(페이지 자신의 URL) 기준으로 해석
 * - scheme/host 소문자
 * - 기본 포트 제거(http:80, https:443)
 * - fragment(#...) 제거, userinfo 제거
 * - 빈 경로는 "/", 중복 슬래시 축소, "."/".." 세그먼트 정리
 * - trailing slash 는 입력 그대로 유지("/docs" 와 "/docs/"는 다른 페이지)
 * - 쿼리는 원문 유지
 *
 * http/https 외 스킴(mailto:, javascript:, tel: ...)과 형식 오류는 {@link InvalidUrlException}.
 */
public final class UrlNormalizer {
    private UrlNormalizer() {}

    /** 절대 URL 정규화(시드용). */
    public static URI normalize(String raw) throws InvalidUrlException {
        return normalize(raw, null);
    }

    /** 이미 URI 형태인 값을 다시 정규화. normalize(normalize(u)) == normalize(u) */
    public static URI normalize(URI uri) throws InvalidUrlException {
        if (uri == null) throw new InvalidUrlException("null", "empty url");
        return canonical(uri, uri.toString());
    }

    /**
     * raw 를 base 기준으로 해석 후 정규화. 해석은 jsoup 과 같은 RFC 3986 규칙
     * ("?q" 는 base 경로 유지, "" 와 "#frag" 는 base 자신).
     *
     * @param raw  href 원문 또는 절대 URL
     * @param base 페이지 URL(null 이면 raw 는 절대 URL이어야 함)
     */
    public static URI normalize(String raw, URI base) throws InvalidUrlException {
        if (raw == null) throw new InvalidUrlException("null", "empty url");
        String s = raw.strip();
        if (base == null && s.isEmpty()) throw new InvalidUrlException(raw, "empty url");

        if (base != null) {
            // 해석 불가면 빈 문자열. javascript:, tel: 등은 원문 그대로 돌아와 아래 opaque 검사에서 걸림
            s = StringUtil.resolve(base.toString(), s);
            if (s.isEmpty()) throw new InvalidUrlException(raw, "unresolvable url");
        }

        URI ref;
        try {
            ref = new URI(s);
        } catch (URISyntaxException e) {
            // 흔한 케이스(공백 미인코딩)만 구제
            try {
                ref = new URI(s.replace(" ", "%20"));
            } catch (URISyntaxException e2) {
                throw new InvalidUrlException(raw, "malformed url", e);
            }
        }

        // mailto:/javascript: 같은 opaque URI
        if (ref.isOpaque()) throw new InvalidUrlException(raw, "unsupported scheme");
        if (!ref.isAbsolute()) throw new InvalidUrlException(raw, "relative url without base");
        return canonical(ref, raw);
    }

    /** host 기준 동일 사이트 판정(소문자 비교, scheme/port 무시) */
    public static boolean isSameSite(URI a, URI b) {
        if (a == null || b == null) return false;
        String ha = a.getHost() == null ? "" : a.getHost().toLowerCase(Locale.ROOT);
        String hb = b.getHost() == null ? "" : b.getHost().toLowerCase(Locale.ROOT);
        return !ha.isEmpty() && ha.equals(hb);
    }

    private static URI canonical(URI u, String original) throws InvalidUrlException {
        String scheme = u.getScheme();
        if (scheme == null) throw new InvalidUrlException(original, "missing scheme");
        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new InvalidUrlException(original, "unsupported scheme");
        }

        String host = u.getHost();
        if (host == null || host.isEmpty()) throw new InvalidUrlException(original, "missing host");
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1; // 기본 포트 제거
        }

        String path = u.getRawPath();
        path = (path == null || path.isEmpty()) ? "/" : removeDotSegments(path);

        StringBuilder sb = new StringBuilder(64);
        sb.append(scheme).append("://").append(host);
        if (port != -1) sb.append(':').append(port);
        sb.append(path);
        String query = u.getRawQuery();
        if (query != null) sb.append('?').append(query);

        try {
            return new URI(sb.toString());
        } catch (URISyntaxException e) {
            throw new InvalidUrlException(original, "malformed url", e);
        }
    }

    /** "." / ".." 세그먼트와 빈 세그먼트("//") 정리. 마지막 슬래시는 유지. */
    static String removeDotSegments(String path) {
        if (!path.startsWith("/")) path = "/" + path;
        String[] parts = path.split("/", -1);
        Deque<String> out = new ArrayDeque<>();
        for (int i = 1; i < parts.length; i++) {
            String p = parts[i];
            boolean last = (i == parts.length - 1);
            if (p.equals(".")) {
                if (last) out.addLast("");
                continue;
            }
            if (p.equals("..")) {
                if (!out.isEmpty()) out.removeLast();
                if (last) out.addLast("");
                continue;
            }
            if (p.isEmpty() && !last) continue; // 중복 슬래시 축소
            out.addLast(p);
        }
        return "/" + String.join("/", out);
    }
}
