package com.redfox.core.http;

import com.redfox.core.model.RequestContext;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * RequestContext + 호출 파라미터 → 전송할 요청 문자열(바이트 그대로).
 * <p>
 * 헤더 순서와 CRLF 는 고정이다. method/connection 검증이나 CR/LF 필터링은 하지 않는다:
 * 비정상 요청을 그대로 보내는 것이 목적이므로 호출자를 신뢰한다.
 * overridePath 가 비어 있으면 request-target 으로 상대 경로가 아닌 {@link RequestContext#getUrl()} 전체를 쓴다.
 */
public final class RequestBuilder {
    private RequestBuilder() {}

    public static final String DEFAULT_METHOD = "GET";
    public static final String DEFAULT_CONNECTION = "close";

    private static final String CRLF = "\r\n";

    public static String build(RequestContext ctx) {
        return build(ctx, DEFAULT_METHOD, "", DEFAULT_CONNECTION, "");
    }

    public static String build(RequestContext ctx, String method) {
        return build(ctx, method, "", DEFAULT_CONNECTION, "");
    }

    public static String build(RequestContext ctx, String method, String overridePath) {
        return build(ctx, method, overridePath, DEFAULT_CONNECTION, "");
    }

    /**
     * @param method       요청 메서드(null 이면 GET)
     * @param overridePath request-target. null/빈 값이면 ctx.url
     * @param connection   Connection 헤더 값(null 이면 close)
     * @param body         인코딩 전 본문. Content-Length 는 인코딩 후 길이
     * @return 빌드된 요청. ctx 에도 저장된다.
     */
    public static String build(RequestContext ctx, String method, String overridePath,
                               String connection, String body) {
        Objects.requireNonNull(ctx, "ctx");
        String m = (method == null) ? DEFAULT_METHOD : method;
        String target = (overridePath == null || overridePath.isEmpty()) ? ctx.getUrl() : overridePath;
        String conn = (connection == null) ? DEFAULT_CONNECTION : connection;
        String encoded = FormEncoding.quotePlus(body);

        String request = m + " " + target + " HTTP/1.1" + CRLF
                + "Host: " + ctx.getHost() + ":" + ctx.getPort() + CRLF
                + "Accept: */*" + CRLF
                + "Accept-Language: en-US" + CRLF
                + "User-Agent: " + ctx.getUserAgent() + CRLF
                + "Connection: " + conn + CRLF
                + "Content-Type: " + ctx.getContentType() + CRLF
                + "Content-Length: " + encoded.getBytes(StandardCharsets.US_ASCII).length + CRLF
                + CRLF
                + encoded;

        ctx.rememberRequest(request);
        return request;
    }
}
