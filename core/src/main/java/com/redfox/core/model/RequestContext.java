package com.redfox.core.model;

import java.util.Objects;

/**
 * 요청 대상 묶음(host/path/port/agent/TLS). 생성 시 한 번 결정되고 이후 바뀌지 않는다.
 * - port 443 이면 호출자가 tls=false 를 넘겨도 TLS 강제
 * - url 은 scheme + host + path (빌더가 기본 request-target 으로 사용)
 * - 마지막으로 빌드한 요청 문자열만 예외적으로 갱신된다(Transceiver 재사용용)
 */
public final class RequestContext {

    public static final String DEFAULT_PATH = "/";
    public static final int DEFAULT_PORT = 80;
    public static final int TLS_PORT = 443;
    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0";
    /** 요청별 오버라이드 없음 */
    public static final String CONTENT_TYPE = "application/x-www-form-urlencoded";

    private final String host;
    private final String path;
    private final int port;
    private final String userAgent;
    private final boolean useTls;
    private final String url;

    private volatile String lastRequest;

    private RequestContext(Builder b) {
        this.host = b.host;
        this.path = (b.path == null) ? DEFAULT_PATH : b.path;
        this.port = b.port;
        this.userAgent = (b.userAgent == null) ? DEFAULT_USER_AGENT : b.userAgent;
        this.useTls = b.tls || b.port == TLS_PORT; // 단방향 오버라이드
        this.url = (useTls ? "https://" : "http://") + host + this.path;
    }

    public static RequestContext of(String host) {
        return builder(host).build();
    }

    public static RequestContext of(String host, String path, int port, String userAgent, boolean tls) {
        return builder(host).path(path).port(port).userAgent(userAgent).tls(tls).build();
    }

    public String getHost() { return host; }
    public String getPath() { return path; }
    public int getPort() { return port; }
    public String getUserAgent() { return userAgent; }
    public boolean useTls() { return useTls; }
    public String getUrl() { return url; }
    public String getContentType() { return CONTENT_TYPE; }
    public String getScheme() { return useTls ? "https" : "http"; }

    /** RequestBuilder 가 마지막으로 만든 요청. 아직 없으면 null. */
    public String lastRequest() { return lastRequest; }

    public void rememberRequest(String request) { this.lastRequest = request; }

    @Override
    public String toString() {
        return "RequestContext{" + url + ", port=" + port + ", tls=" + useTls + "}";
    }

    // ----- 빌더 -----
    public static Builder builder(String host) { return new Builder(host); }

    public static final class Builder {
        private final String host;
        private String path = DEFAULT_PATH;
        private int port = DEFAULT_PORT;
        private String userAgent = DEFAULT_USER_AGENT;
        private boolean tls;

        private Builder(String host) { this.host = host; }

        public Builder path(String path) { this.path = path; return this; }
        public Builder port(int port) { this.port = port; return this; }
        public Builder userAgent(String userAgent) { this.userAgent = userAgent; return this; }
        public Builder tls(boolean tls) { this.tls = tls; return this; }

        public RequestContext build() {
            Objects.requireNonNull(host, "host");
            if (host.isBlank()) throw new IllegalArgumentException("host must not be blank");
            if (port < 1 || port > 65_535) throw new IllegalArgumentException("port out of range: " + port);
            return new RequestContext(this);
        }
    }
}
