package com.redfox.core.inspect;

/** 인스펙터가 기대한 토큰 구조가 없는 입력. 호출자가 먼저 HTTP 응답인지 확인해야 한다. */
public class MalformedResponseException extends IllegalArgumentException {
    public MalformedResponseException(String message) {
        super(message);
    }
    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
