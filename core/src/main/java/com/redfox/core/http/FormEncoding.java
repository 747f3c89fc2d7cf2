package com.redfox.core.http;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * application/x-www-form-urlencoded 인코딩(quote_plus 규칙).
 * 공백 → '+', 영숫자와 "_.-~" 외에는 UTF-8 퍼센트 이스케이프.
 */
public final class FormEncoding {
    private FormEncoding() {}

    public static String quotePlus(String raw) {
        if (raw == null || raw.isEmpty()) return "";
        // URLEncoder 는 '*' 를 그대로 두고 '~' 를 이스케이프한다 → 규칙에 맞게 보정
        return URLEncoder.encode(raw, StandardCharsets.UTF_8)
                .replace("*", "%2A")
                .replace("%7E", "~");
    }
}
