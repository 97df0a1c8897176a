package com.webcrawler.core.util;

/** 정규화 불가 URL(형식 오류, http/https 외 스킴, host 누락). 해당 링크만 버리고 크롤은 계속한다. */
public class InvalidUrlException extends Exception {
    private final String input;

    public InvalidUrlException(String input, String reason) {
        super(reason + ": " + input);
        this.input = input;
    }

    public InvalidUrlException(String input, String reason, Throwable cause) {
        super(reason + ": " + input, cause);
        this.input = input;
    }

    /** 거부된 원본 문자열 */
    public String getInput() { return input; }
}
