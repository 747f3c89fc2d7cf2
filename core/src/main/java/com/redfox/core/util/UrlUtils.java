package com.redfox.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/** URL depth / 도메인 포함 판정 + 크롤러용 정규화 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * '/' 로 나눈 조각 수 - 3 (scheme, "//" 사이 빈 조각, host 몫).
     * 마지막 조각이 비어 있으면 하나만 버린다.
     * 예) http://rit.edu/study/undergraduate → 2, http://rit.edu/ → 0
     * <p>
     * scheme 유무는 보지 않는다: 모든 입력을 절대 URL 로 취급하므로 "rit.edu/a" 같은 입력은 음수가 나온다.
     */
    public static int depth(String url) {
        Objects.requireNonNull(url, "url");
        String[] s = url.split("/", -1); // 뒤쪽 빈 조각 유지
        int count = s.length;
        if (count > 0 && s[count - 1].isEmpty()) count--;
        return count - 3;
    }

    /** domain 이 url 어딘가에 부분 문자열로 있으면 true (host 접미사 비교가 아님) */
    public static boolean inDomain(String url, String domain) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(domain, "domain");
        return url.contains(domain);
    }

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈/누락 경로를 "/"로, 중복 슬래시 축소
     */
    public static URI normalize(URI u) {
        if (u == null) return null;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase();
        String host = u.getHost() != null ? u.getHost() : u.getAuthority();
        if (host == null) host = "";
        host = host.toLowerCase();

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        String path = (u.getPath() == null || u.getPath().isEmpty()) ? "/" : u.getPath();
        path = path.replaceAll("/{2,}", "/");

        try {
            return new URI(scheme, null, host, port, path, u.getQuery(), null);
        } catch (URISyntaxException e) {
            return u;
        }
    }

    /** base 기준으로 href 를 절대 URL 로. http/https 가 아니거나 파싱 실패면 null. */
    public static URI resolve(URI base, String href) {
        if (base == null || href == null || href.isBlank()) return null;
        try {
            URI abs = base.resolve(href.trim());
            String s = abs.getScheme();
            if (s == null || !(s.equalsIgnoreCase("http") || s.equalsIgnoreCase("https"))) return null;
            if (abs.getHost() == null) return null;
            return normalize(abs);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
