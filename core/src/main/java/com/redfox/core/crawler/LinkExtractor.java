package com.redfox.core.crawler;

import java.net.URI;
import java.util.Set;

/** 응답 본문(HTML)에서 절대 URL 을 추출하는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * base 페이지의 html 에서 링크를 추출해 절대 URI 집합으로 반환.
     * 파싱 예외는 호출자가 정책적으로 처리.
     */
    Set<URI> extract(URI base, String html) throws Exception;
}
