package com.redfox.core.model;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Objects;

/**
 * 크롤 설정 (redfox.yml 매핑 대상). 순수 설정 보관용.
 * 범위 제한은 URL 경로 깊이(UrlUtils.depth)와 도메인 부분 문자열 포함 여부로 판단한다.
 */
public final class CrawlConfig {

    private String target;                       // 시작 URL (필수)
    private String domain;                       // null 이면 target 의 host
    private String userAgent = RequestContext.DEFAULT_USER_AGENT;
    private int timeoutSeconds = 10;             // 0 = 무기한
    private String encoding = "utf-8";

    private int maxDepth = 2;                    // URL 경로 깊이 상한
    private int maxPages = 100;
    private int maxRedirects = 5;                // 페이지당 따라갈 301/302 횟수

    private Path outputDir = Path.of("out");

    // ---------- getters ----------
    public String getTarget() { return target; }
    public String getUserAgent() { return userAgent; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public String getEncoding() { return encoding; }
    public int getMaxDepth() { return maxDepth; }
    public int getMaxPages() { return maxPages; }
    public int getMaxRedirects() { return maxRedirects; }
    public Path getOutputDir() { return outputDir; }

    /** 설정값 그대로(null 가능). 실제 판정에는 {@link #effectiveDomain()} 사용 */
    public String getDomain() { return domain; }

    /** domain 미지정이면 target 의 host */
    public String effectiveDomain() {
        if (domain != null && !domain.isBlank()) return domain;
        String host = (target == null) ? null : URI.create(target).getHost();
        return (host == null) ? "" : host.toLowerCase();
    }

    // ---------- fluent setters ----------
    public CrawlConfig setTarget(String target) { this.target = target; return this; }
    public CrawlConfig setDomain(String domain) { this.domain = domain; return this; }
    public CrawlConfig setUserAgent(String userAgent) {
        this.userAgent = (userAgent != null ? userAgent : RequestContext.DEFAULT_USER_AGENT);
        return this;
    }
    public CrawlConfig setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; return this; }
    public CrawlConfig setEncoding(String encoding) { this.encoding = encoding; return this; }
    public CrawlConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlConfig setMaxPages(int maxPages) { this.maxPages = maxPages; return this; }
    public CrawlConfig setMaxRedirects(int maxRedirects) { this.maxRedirects = maxRedirects; return this; }
    public CrawlConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(target, "target");
        URI t;
        try {
            t = URI.create(target);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("target is not a valid URL: " + target, e);
        }
        if (t.getHost() == null) throw new IllegalArgumentException("target must be an absolute http(s) URL: " + target);
        String scheme = t.getScheme() == null ? "" : t.getScheme().toLowerCase();
        if (!scheme.equals("http") && !scheme.equals("https"))
            throw new IllegalArgumentException("target scheme must be http or https: " + target);

        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        if (maxRedirects < 0) throw new IllegalArgumentException("maxRedirects must be >= 0");
        if (timeoutSeconds < 0) throw new IllegalArgumentException("timeoutSeconds must be >= 0");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(encoding, "encoding");
        if (!Charset.isSupported(encoding)) throw new IllegalArgumentException("unsupported encoding: " + encoding);
    }

    public static CrawlConfig defaults() { return new CrawlConfig(); }
}
