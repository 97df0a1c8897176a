package com.webcrawler.core.output;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * URL → 출력 파일 경로(상대) 매핑. 순수 함수.
 *
 * 규칙: 스킴 제거 → 영숫자/'.' 이외 문자는 '_' → '_' 로 분리(빈 세그먼트 제거)
 * → 앞에서 maxSegments 개만 '_' 로 연결 → ".txt".
 * 예) http://ex.test/docs/a/b?x=1 → ex.test_docs_a.txt (maxSegments=3)
 *
 * 앞 세그먼트가 같은 URL 들은 같은 파일로 모인다(충돌 허용, Writer 가 append 로 구분).
 */
public final class OutputNaming {
    private OutputNaming() {}

    public static final String EXTENSION = ".txt";
    public static final String EMPTY_NAME = "index";
    static final int MAX_NAME_LENGTH = 200;

    public static Path targetFor(URI url, int maxSegments) {
        Objects.requireNonNull(url, "url");
        if (maxSegments < 1) throw new IllegalArgumentException("maxSegments must be >= 1");
        return Path.of(fileNameFor(url.toString(), maxSegments));
    }

    static String fileNameFor(String url, int maxSegments) {
        String s = stripScheme(url);

        StringBuilder sanitized = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            sanitized.append(Character.isLetterOrDigit(c) || c == '.' ? c : '_');
        }

        List<String> segments = new ArrayList<>();
        for (String seg : sanitized.toString().split("_")) {
            if (seg.isEmpty()) continue;
            segments.add(seg);
            if (segments.size() == maxSegments) break;
        }

        String name = segments.isEmpty() ? EMPTY_NAME : String.join("_", segments);
        // 점만으로 된 이름("." / "..")은 경로로 해석되므로 금지
        if (name.chars().allMatch(ch -> ch == '.')) name = EMPTY_NAME;
        if (name.length() > MAX_NAME_LENGTH) name = name.substring(0, MAX_NAME_LENGTH);
        return name + EXTENSION;
    }

    private static String stripScheme(String url) {
        int i = url.indexOf("://");
        return (i >= 0) ? url.substring(i + 3) : url;
    }
}
