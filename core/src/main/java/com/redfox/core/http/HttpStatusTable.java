package com.redfox.core.http;

import java.util.Map;
import java.util.Optional;

/** 알려진 상태 코드 → reason phrase. 일부러 일부만 담는다(모르는 코드는 정상 케이스). */
public final class HttpStatusTable {
    private HttpStatusTable() {}

    private static final Map<Integer, String> REASONS = Map.of(
            200, "OK",
            301, "Moved Permanently",
            302, "Found",
            400, "Bad Request",
            403, "Forbidden",
            404, "Not Found"
    );

    public static Optional<String> reasonOf(int code) {
        return Optional.ofNullable(REASONS.get(code));
    }

    public static boolean isKnown(int code) {
        return REASONS.containsKey(code);
    }

    public static Map<Integer, String> asMap() {
        return REASONS;
    }
}
