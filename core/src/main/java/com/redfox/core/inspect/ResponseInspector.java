package com.redfox.core.inspect;

import com.redfox.core.http.HttpStatusTable;
import com.redfox.core.model.RawResponse;

import java.util.Objects;

/**
 * 수신한 응답 문자열에 대한 무상태 유틸.
 * 구조화된 헤더 파서가 아니라 공백 토큰/부분 문자열 기반이다(본문에 같은 문자열이 있으면 오탐 가능).
 */
public final class ResponseInspector {
    private ResponseInspector() {}

    public static final String DEFAULT_STATUS = "200 OK";
    static final String MOVED = "301 Moved Permanently";
    static final String FOUND = "302 Found";
    static final String LOCATION = "Location:";

    private static final String HEADER_END = "\r\n\r\n";

    /** 공백 기준 두 번째 토큰을 상태 코드로 읽는다. 예: "HTTP/1.1 404 Not Found" → 404 */
    public static int statusLine(String response) {
        String[] tokens = tokens(response);
        if (tokens.length < 2) {
            throw new MalformedResponseException("response has no status token");
        }
        try {
            return Integer.parseInt(tokens[1]);
        } catch (NumberFormatException e) {
            throw new MalformedResponseException("status token is not numeric: " + tokens[1], e);
        }
    }

    /** "&lt;HTTP Response: 200 OK&gt;" 형식. 표에 없는 코드는 reason 생략. */
    public static String describe(String response) {
        int code = statusLine(response);
        return HttpStatusTable.reasonOf(code)
                .map(reason -> "<HTTP Response: " + code + " " + reason + ">")
                .orElse("<HTTP Response: " + code + ">");
    }

    public static boolean containsStatus(String response) {
        return containsStatus(response, DEFAULT_STATUS);
    }

    /** 응답 전체에서 code 문자열(예: "404 Not Found") 단순 포함 검사 */
    public static boolean containsStatus(String response, String code) {
        Objects.requireNonNull(code, "code");
        return String.valueOf(response).contains(code);
    }

    /**
     * 301/302 응답에서 "Location:" 을 포함한 토큰 바로 다음 토큰을 꺼낸다.
     * URL 에 공백이 있으면 첫 조각만 잡힌다.
     */
    public static Redirect redirectLocation(String response) {
        if (!containsStatus(response, MOVED) && !containsStatus(response, FOUND)) {
            return Redirect.notRedirect();
        }
        String[] tokens = tokens(response);
        for (int i = 0; i < tokens.length; i++) {
            if (tokens[i].contains(LOCATION)) {
                return (i + 1 < tokens.length) ? Redirect.found(tokens[i + 1]) : Redirect.locationMissing();
            }
        }
        return Redirect.locationMissing();
    }

    /**
     * "HTTP/x.y NNN" 으로 시작하는지. statusLine/describe 는 입력을 검증하지 않으므로 호출 전에 여기로 거른다.
     */
    public static boolean looksLikeHttp(String response) {
        if (response == null || !response.startsWith("HTTP/")) return false;
        String[] t = response.split("\\s+", 3);
        return t.length >= 2 && t[1].matches("\\d{3}");
    }

    /** 첫 빈 줄(CRLFCRLF) 이후. 없으면 빈 문자열. */
    public static String body(String response) {
        if (response == null) return "";
        int idx = response.indexOf(HEADER_END);
        return (idx < 0) ? "" : response.substring(idx + HEADER_END.length());
    }

    // ----- RawResponse 오버로드 -----
    public static int statusLine(RawResponse response) { return statusLine(text(response)); }
    public static String describe(RawResponse response) { return describe(text(response)); }
    public static boolean containsStatus(RawResponse response, String code) { return containsStatus(text(response), code); }
    public static Redirect redirectLocation(RawResponse response) { return redirectLocation(text(response)); }
    public static String body(RawResponse response) { return body(text(response)); }

    private static String text(RawResponse response) {
        return Objects.requireNonNull(response, "response").asText();
    }

    // \s 는 ASCII 공백만 본다(NBSP 등 유니코드 공백은 토큰 안에 남음). HTTP 헤더 구분자는 ASCII 라 충분하다.
    private static String[] tokens(String response) {
        if (response == null) return new String[0];
        String trimmed = response.strip();
        return trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
    }
}
