package com.webcrawler.core.crawler;

import com.webcrawler.core.api.IContentExtractor;
import com.webcrawler.core.model.PageResult;
import com.webcrawler.core.util.InvalidUrlException;
import com.webcrawler.core.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 기본 JSoup 기반 추출기.
 * 문자셋은 헤더 charset 우선, 없으면 jsoup 이 BOM/&lt;meta charset&gt; 으로 판별.
 * 링크는 jsoup 절대화(abs:href, &lt;base href&gt; 반영) 후 UrlNormalizer 로 정규화, 본문은 MainTextRules.
 */
public class JsoupContentExtractor implements IContentExtractor {

    @Override
    public PageResult extract(byte[] body, String charsetName, URI pageUrl) throws ParseFailureException {
        if (pageUrl == null) throw new ParseFailureException(null, "pageUrl is null");
        if (isBlank(body)) throw new ParseFailureException(pageUrl, "empty body");

        Document doc;
        try {
            doc = Jsoup.parse(new ByteArrayInputStream(body), charsetName, pageUrl.toString());
        } catch (IOException | UncheckedIOException e) {
            throw new ParseFailureException(pageUrl, "html read failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ParseFailureException(pageUrl, "html parse failed: " + e.getMessage(), e);
        }

        // 링크 먼저(본문 선택이 nav 등을 지우므로)
        Set<URI> links = new LinkedHashSet<>();
        int invalid = 0;
        for (Element a : doc.select("a[href]")) {
            String abs = a.absUrl("href"); // 해석 불가면 ""
            try {
                links.add(UrlNormalizer.normalize(abs));
            } catch (InvalidUrlException e) {
                invalid++; // mailto:, javascript:, 깨진 href 등은 버림
            }
        }

        String text = MainTextRules.mainText(doc);
        return new PageResult(pageUrl, text, List.copyOf(links), invalid);
    }

    // 공백 바이트만 있는 본문(ASCII 기준)
    private static boolean isBlank(byte[] body) {
        if (body == null) return true;
        for (byte b : body) {
            if (b != ' ' && b != '\t' && b != '\n' && b != '\r' && b != '\f') return false;
        }
        return true;
    }
}
