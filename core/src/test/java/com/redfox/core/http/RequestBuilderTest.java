package com.redfox.core.http;

import com.redfox.core.model.RequestContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RequestBuilderTest {

    @Test
    @DisplayName("기본 GET: request-target 은 ctx.url 전체, 헤더 순서/CRLF 고정")
    void defaultGetUsesAbsoluteUrlAndFixedHeaderOrder() {
        RequestContext ctx = RequestContext.of("rit.edu");

        String req = RequestBuilder.build(ctx);

        assertThat(req).isEqualTo(
                "GET http://rit.edu/ HTTP/1.1\r\n"
                        + "Host: rit.edu:80\r\n"
                        + "Accept: */*\r\n"
                        + "Accept-Language: en-US\r\n"
                        + "User-Agent: Mozilla/5.0\r\n"
                        + "Connection: close\r\n"
                        + "Content-Type: application/x-www-form-urlencoded\r\n"
                        + "Content-Length: 0\r\n"
                        + "\r\n");
        assertThat(ctx.lastRequest()).isEqualTo(req);
    }

    @Test
    @DisplayName("본문은 form 인코딩되고 Content-Length 는 인코딩 후 길이")
    void bodyIsFormEncodedAndLengthMatchesEncodedBytes() {
        RequestContext ctx = RequestContext.of("rit.edu", "/", 443, "fox", false);

        String req = RequestBuilder.build(ctx, "POST", "/login", "keep-alive", "a b&c");

        assertThat(req).startsWith("POST /login HTTP/1.1\r\nHost: rit.edu:443\r\n");
        assertThat(req).contains("User-Agent: fox\r\n", "Connection: keep-alive\r\n", "Content-Length: 7\r\n");
        assertThat(req).endsWith("\r\n\r\na+b%26c");
    }

    @Test
    @DisplayName("비 ASCII 본문도 인코딩 후 길이(원문 글자 수가 아님)")
    void nonAsciiBodyLengthIsEncodedLength() {
        String req = RequestBuilder.build(RequestContext.of("h"), "POST", "/", "close", "é");

        assertThat(req).contains("Content-Length: 6\r\n").endsWith("%C3%A9");
    }

    @Test
    @DisplayName("method/connection 은 검증 없이 그대로, null 이면 기본값")
    void methodAndConnectionArePassedThrough() {
        RequestContext ctx = RequestContext.of("h");

        assertThat(RequestBuilder.build(ctx, "BREW", "*")).startsWith("BREW * HTTP/1.1\r\n");
        assertThat(RequestBuilder.build(ctx, null, null, null, null))
                .startsWith("GET http://h/ HTTP/1.1\r\n")
                .contains("Connection: close\r\n", "Content-Length: 0\r\n");
    }

    @Test
    void latestBuildWins() {
        RequestContext ctx = RequestContext.of("h");
        RequestBuilder.build(ctx, "GET");
        String second = RequestBuilder.build(ctx, "HEAD");
        assertThat(ctx.lastRequest()).isSameAs(second);
    }
}
