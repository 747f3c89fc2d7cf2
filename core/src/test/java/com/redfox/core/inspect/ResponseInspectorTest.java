package com.redfox.core.inspect;

import com.redfox.core.model.RawResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseInspectorTest {

    static final String OK = "HTTP/1.1 200 OK\r\nContent-Type: text/html\r\n\r\n<html>hi</html>";
    static final String NOT_FOUND = "HTTP/1.1 404 Not Found\r\nContent-Length: 0\r\n\r\n";
    static final String TEAPOT = "HTTP/1.1 418 Teapot\r\n\r\n";
    static final String MOVED = "HTTP/1.1 301 Moved Permanently\r\nLocation: http://example.com/x\r\n\r\n";

    @Nested
    class StatusAndDescribe {
        @Test
        void readsSecondToken() {
            assertThat(ResponseInspector.statusLine(NOT_FOUND)).isEqualTo(404);
            assertThat(ResponseInspector.statusLine("  HTTP/1.0   302 Found")).isEqualTo(302);
        }

        @Test
        @DisplayName("표에 있는 코드는 reason 포함, 없는 코드는 숫자만")
        void describeKnownAndUnknown() {
            assertThat(ResponseInspector.describe(OK)).isEqualTo("<HTTP Response: 200 OK>");
            assertThat(ResponseInspector.describe(TEAPOT)).isEqualTo("<HTTP Response: 418>");
        }

        @Test
        @DisplayName("토큰이 모자라거나 숫자가 아니면 MalformedResponseException")
        void malformedInputIsACallerError() {
            assertThatThrownBy(() -> ResponseInspector.statusLine("HTTP/1.1"))
                    .isInstanceOf(MalformedResponseException.class);
            assertThatThrownBy(() -> ResponseInspector.statusLine(""))
                    .isInstanceOf(MalformedResponseException.class);
            assertThatThrownBy(() -> ResponseInspector.describe("<html> body"))
                    .isInstanceOf(MalformedResponseException.class)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("body");
        }
    }

    @Nested
    class ContainsStatus {
        @Test
        void substringMatch() {
            assertThat(ResponseInspector.containsStatus(NOT_FOUND, "404 Not Found")).isTrue();
            assertThat(ResponseInspector.containsStatus(NOT_FOUND, "200 OK")).isFalse();
            assertThat(ResponseInspector.containsStatus(OK)).isTrue();
        }

        @Test
        @DisplayName("본문에 같은 문자열이 있어도 true (구조화 파싱이 아님)")
        void bodyOccurrenceAlsoMatches() {
            String r = "HTTP/1.1 500 Internal\r\n\r\nwe said 200 OK earlier";
            assertThat(ResponseInspector.containsStatus(r)).isTrue();
        }
    }

    @Nested
    class RedirectLocation {
        @Test
        void extractsTokenAfterLocation() {
            Redirect r = ResponseInspector.redirectLocation(MOVED);
            assertThat(r.isFound()).isTrue();
            assertThat(r.location()).hasValue("http://example.com/x");
        }

        @Test
        void notARedirectOn200() {
            assertThat(ResponseInspector.redirectLocation(OK)).isEqualTo(Redirect.notRedirect());
        }

        @Test
        void redirectWithoutLocationIsMissing() {
            Redirect r = ResponseInspector.redirectLocation("HTTP/1.1 302 Found\r\nServer: x\r\n\r\n");
            assertThat(r.kind()).isEqualTo(Redirect.Kind.LOCATION_MISSING);
            assertThat(r.location()).isEmpty();
        }

        @Test
        void locationAsLastTokenIsMissing() {
            Redirect r = ResponseInspector.redirectLocation("HTTP/1.1 302 Found\r\nLocation:");
            assertThat(r.kind()).isEqualTo(Redirect.Kind.LOCATION_MISSING);
        }

        @Test
        @DisplayName("공백이 든 Location 은 첫 조각만")
        void spaceInLocationKeepsFirstPiece() {
            Redirect r = ResponseInspector.redirectLocation("HTTP/1.1 302 Found\r\nLocation: /a b\r\n\r\n");
            assertThat(r.location()).hasValue("/a");
        }

        @Test
        @DisplayName("Location: 뒤 공백이 없으면 다음 토큰(다음 헤더 이름)이 잡힌다")
        void glueTokenTakesFollowingToken() {
            Redirect r = ResponseInspector.redirectLocation("HTTP/1.1 301 Moved Permanently\r\nLocation:/x\r\nServer: y\r\n");
            assertThat(r.location()).hasValue("Server:");
        }
    }

    @Test
    @DisplayName("토큰 구분은 ASCII 공백만: NBSP 는 토큰을 나누지 않는다")
    void onlyAsciiWhitespaceSeparatesTokens() {
        assertThatThrownBy(() -> ResponseInspector.statusLine("HTTP/1.1\u00A0200 OK\r\n\r\n"))
                .isInstanceOf(MalformedResponseException.class);
        assertThat(ResponseInspector.statusLine("HTTP/1.1\t200 \u00A0OK")).isEqualTo(200);
        assertThat(ResponseInspector.redirectLocation("HTTP/1.1 302 Found\r\nLocation:\u00A0/x\r\n").kind())
                .isEqualTo(Redirect.Kind.LOCATION_MISSING);
    }

    @Test
    void looksLikeHttpNeedsVersionAndThreeDigits() {
        assertThat(ResponseInspector.looksLikeHttp(OK)).isTrue();
        assertThat(ResponseInspector.looksLikeHttp("HTTP/1.1 OK")).isFalse();
        assertThat(ResponseInspector.looksLikeHttp("SSH-2.0-OpenSSH")).isFalse();
        assertThat(ResponseInspector.looksLikeHttp(null)).isFalse();
    }

    @Test
    void bodyIsEverythingAfterBlankLine() {
        assertThat(ResponseInspector.body(OK)).isEqualTo("<html>hi</html>");
        assertThat(ResponseInspector.body("HTTP/1.1 200 OK\r\nX: y")).isEmpty();
    }

    @Test
    @DisplayName("RawResponse 오버로드: 디코드 실패한 바이트도 그대로 검사")
    void rawResponseOverloads() {
        RawResponse bytes = new RawResponse.Bytes(MOVED.getBytes(StandardCharsets.US_ASCII));
        assertThat(ResponseInspector.statusLine(bytes)).isEqualTo(301);
        assertThat(ResponseInspector.describe(bytes)).isEqualTo("<HTTP Response: 301 Moved Permanently>");
        assertThat(ResponseInspector.redirectLocation(bytes).location()).hasValue("http://example.com/x");

        RawResponse text = new RawResponse.Text(OK, StandardCharsets.UTF_8);
        assertThat(ResponseInspector.containsStatus(text, "200 OK")).isTrue();
        assertThat(ResponseInspector.body(text)).isEqualTo("<html>hi</html>");
    }
}
