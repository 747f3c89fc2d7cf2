package com.redfox.core.inspect;

import java.util.Objects;
import java.util.Optional;

/** {@link ResponseInspector#redirectLocation} 의 3-way 결과. */
public final class Redirect {

    public enum Kind {
        /** 301/302 상태 문자열 없음 */
        NOT_REDIRECT,
        /** 301/302 이지만 Location: 토큰을 못 찾음 */
        LOCATION_MISSING,
        FOUND
    }

    private static final Redirect NONE = new Redirect(Kind.NOT_REDIRECT, null);
    private static final Redirect MISSING = new Redirect(Kind.LOCATION_MISSING, null);

    private final Kind kind;
    private final String location;

    private Redirect(Kind kind, String location) {
        this.kind = kind;
        this.location = location;
    }

    public static Redirect notRedirect() { return NONE; }
    public static Redirect locationMissing() { return MISSING; }
    public static Redirect found(String location) {
        return new Redirect(Kind.FOUND, Objects.requireNonNull(location, "location"));
    }

    public Kind kind() { return kind; }
    public boolean isFound() { return kind == Kind.FOUND; }
    public Optional<String> location() { return Optional.ofNullable(location); }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Redirect r)) return false;
        return kind == r.kind && Objects.equals(location, r.location);
    }
    @Override public int hashCode() { return Objects.hash(kind, location); }
    @Override public String toString() {
        return (kind == Kind.FOUND) ? "Redirect[" + location + "]" : "Redirect[" + kind + "]";
    }
}
