package com.redfox.core.model;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * 수신한 응답 전체. 디코드 성공 시 {@link Text}, 디코드를 끄거나 실패하면 {@link Bytes}.
 * 스트리밍 없이 EOF 까지 모두 모은 뒤 만들어진다.
 */
public sealed interface RawResponse permits RawResponse.Text, RawResponse.Bytes {

    /** 인스펙터용 문자열 뷰. Bytes 는 ISO-8859-1 로 1:1 매핑(손실 없음, 비ASCII 는 깨져 보임). */
    String asText();

    /** 원본 바이트. Text 는 디코드에 쓴 charset 으로 다시 인코딩한다. */
    byte[] bytes();

    default boolean isDecoded() { return this instanceof Text; }

    default int length() { return bytes().length; }

    record Text(String value, Charset charset) implements RawResponse {
        public Text {
            Objects.requireNonNull(value, "value");
            charset = (charset == null) ? StandardCharsets.UTF_8 : charset;
        }
        @Override public String asText() { return value; }
        @Override public byte[] bytes() { return value.getBytes(charset); }
        @Override public String toString() { return value; }
    }

    record Bytes(byte[] value) implements RawResponse {
        public Bytes {
            value = (value == null) ? new byte[0] : value.clone();
        }
        @Override public byte[] value() { return value.clone(); }
        @Override public String asText() { return new String(value, StandardCharsets.ISO_8859_1); }
        @Override public byte[] bytes() { return value.clone(); }

        @Override public boolean equals(Object o) {
            return o instanceof Bytes b && Arrays.equals(value, b.value);
        }
        @Override public int hashCode() { return Arrays.hashCode(value); }
        @Override public String toString() { return "Bytes[" + value.length + "]"; }
    }
}
