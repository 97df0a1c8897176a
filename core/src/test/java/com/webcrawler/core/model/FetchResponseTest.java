package com.webcrawler.core.model;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class FetchResponseTest {

    private static FetchResponse withType(String contentType) {
        return FetchResponse.builder()
                .url(URI.create("http://ex.test/"))
                .statusCode(200)
                .contentType(contentType)
                .build();
    }

    @Test
    void charset_is_read_from_content_type() {
        assertEquals("UTF-8", withType("text/html; charset=utf-8").getCharset());
        assertEquals("ISO-8859-1", withType("text/html;Charset=\"iso-8859-1\"").getCharset());
    }

    @Test
    void missing_or_unknown_charset_is_null() {
        assertNull(withType("text/html").getCharset());
        assertNull(withType(null).getCharset());
        assertNull(withType("text/html; charset=x-no-such-charset").getCharset());
    }

    @Test
    void body_defaults_to_empty_bytes() {
        FetchResponse r = withType("text/html");
        assertEquals(0, r.getBody().length);
        assertTrue(r.isHtml());
        assertFalse(withType("application/pdf").isHtml());
    }
}
