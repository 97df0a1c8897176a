package com.webcrawler.core.api;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;

/** 추출 텍스트 영속화 계약. 같은 URL 은 항상 같은 대상에 append. */
@FunctionalInterface
public interface IOutputWriter {
    /** @return 실제로 기록된 파일 경로 */
    Path write(URI url, String text) throws IOException;
}
