package dev;

import com.sun.net.httpserver.*;

import java.io.*;
import java.net.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.Executors;

/**
 * 수동 스모크용 로컬 사이트(http://localhost:8080, 포트는 첫 인자로 변경 가능).
 * 순환 링크 그래프 + 404 링크 + mailto + 외부 링크 + 비HTML 응답을 한 번에 제공한다.
 */
public class SmokeTarget {

  // path → 본문(<main> 포함). 링크는 서로 되돌아가는 순환 구조
  static final Map<String, String> PAGES = new LinkedHashMap<>();
  static {
    PAGES.put("/", page("Smoke Index",
        "<p>Entry point for crawler smoke runs.</p>" +
        "<ul>" +
        "  <li><a href=\"/docs\">Docs</a></li>" +
        "  <li><a href=\"/about#team\">About</a></li>" +
        "  <li><a href=\"/missing\">Broken link (404)</a></li>" +
        "  <li><a href=\"/data.json\">Data (not HTML)</a></li>" +
        "  <li><a href=\"mailto:owner@localhost\">Mail</a></li>" +
        "  <li><a href=\"https://example.org/\">External</a></li>" +
        "</ul>"));
    PAGES.put("/about", page("About",
        "<p>Same page reachable with and without a fragment.</p>" +
        "<a href=\"/\">Home</a> <a href=\"/about\">Self</a>"));
    PAGES.put("/docs", page("Docs",
        "<p>Documentation index.</p>" +
        "<a href=\"/docs/a\">A</a> <a href=\"docs/b\">B (relative)</a> <a href=\"/\">Home</a>"));
    PAGES.put("/docs/a", page("Doc A",
        "<p>Links back to B and up.</p>" +
        "<a href=\"b\">B</a> <a href=\"../docs\">Up</a> <a href=\"/docs/a/deep\">Deeper</a>"));
    PAGES.put("/docs/b", page("Doc B",
        "<pre>code block\n  keeps indentation</pre>" +
        "<a href=\"a\">A</a> <a href=\"/docs/../\">Home (dot segments)</a>"));
    PAGES.put("/docs/a/deep", page("Deep",
        "<p>Only reached with maxDepth of 3 or more.</p><a href=\"/docs/a/deep/er\">Deeper still</a>"));
    PAGES.put("/docs/a/deep/er", page("Deeper", "<p>Bottom of the chain.</p><a href=\"/\">Home</a>"));
  }

  public static void main(String[] args) throws Exception {
    int port = (args.length > 0) ? Integer.parseInt(args[0]) : 8080;
    HttpServer http = HttpServer.create(new InetSocketAddress(port), 0);
    wireEndpoints(http);
    http.setExecutor(Executors.newFixedThreadPool(8));
    http.start();
    System.out.println("[smoke] HTTP server on http://localhost:" + port + "  (" + PAGES.size() + " pages)");
  }

  static void wireEndpoints(HttpServer s) {
    s.createContext("/", ex -> {
      String path = ex.getRequestURI().getPath();
      if ("/data.json".equals(path)) {
        resp(ex, 200, "application/json", "{\"pages\":" + PAGES.size() + "}");
        return;
      }
      String html = PAGES.get(path);
      if (html == null) {
        resp(ex, 404, "text/html", page("Not found", "<p>" + escape(path) + "</p>"));
        return;
      }
      resp(ex, 200, "text/html", html);
    });
  }

  static String page(String title, String mainHtml) {
    return "<!doctype html><html><head><title>" + title + "</title></head><body>" +
        "<header><nav><a href=\"/\">Home</a> | <a href=\"/docs\">Docs</a></nav></header>" +
        "<main><h1>" + title + "</h1>" + mainHtml + "</main>" +
        "<footer><p>smoke-target</p></footer>" +
        "</body></html>";
  }

  static String escape(String s) {
    return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
  }

  static void resp(HttpExchange ex, int code, String ct, String body) throws IOException {
    byte[] b = body.getBytes(StandardCharsets.UTF_8);
    ex.getResponseHeaders().set("Content-Type", ct + "; charset=utf-8");
    ex.sendResponseHeaders(code, b.length);
    try (OutputStream os = ex.getResponseBody()) { os.write(b); }
  }
}
