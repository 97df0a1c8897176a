package com.webcrawler.core.crawler;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * 본문 텍스트 선택 규칙(고정, 열거 가능).
 * 1) 루트: main → article → [role=main] → body 순으로 처음 매칭되는 요소
 * 2) 루트 안의 잡음 요소 제거(스크립트/스타일/내비게이션 등)
 * 3) 블록 요소 텍스트를 문서 순서대로 수집(중첩 블록은 바깥 것만), 하나도 없으면 루트 전체 텍스트
 */
public final class MainTextRules {
    private MainTextRules() {}

    public static final List<String> ROOT_CANDIDATES = List.of("main", "article", "[role=main]");

    public static final String NOISE =
            "script, style, noscript, template, nav, header, footer, aside, form, iframe, svg, [aria-hidden=true]";

    public static final String BLOCKS =
            "p, h1, h2, h3, h4, h5, h6, li, pre, blockquote, td, th, dt, dd, figcaption, caption";

    /** 문서에서 본문 루트 선택(항상 non-null) */
    public static Element selectRoot(Document doc) {
        for (String css : ROOT_CANDIDATES) {
            Element e = doc.selectFirst(css);
            if (e != null) return e;
        }
        return doc.body() != null ? doc.body() : doc;
    }

    /**
     * 본문 텍스트. 문서를 변경(잡음 제거)하므로 링크 추출 뒤에 호출할 것.
     */
    public static String mainText(Document doc) {
        Element root = selectRoot(doc);
        root.select(NOISE).remove();

        List<String> blocks = new ArrayList<>();
        for (Element el : root.select(BLOCKS)) {
            if (el == root || hasBlockAncestor(el, root)) continue;
            String t = el.is("pre") ? el.wholeText().strip() : el.text().strip();
            if (!t.isEmpty()) blocks.add(t);
        }
        if (blocks.isEmpty()) {
            return root.text().strip();
        }
        return String.join("\n", blocks);
    }

    private static boolean hasBlockAncestor(Element el, Element root) {
        for (Element p = el.parent(); p != null && p != root; p = p.parent()) {
            if (p.is(BLOCKS)) return true;
        }
        return false;
    }
}
