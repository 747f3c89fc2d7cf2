package com.redfox.core.model;

/** 한 번의 교환이 실패한 이유. 어떤 경우에도 자동 재시도는 없다. */
public enum FailureKind {
    /** 상대가 연결을 거절(RST) */
    CONNECTION_REFUSED,
    /** 호스트 이름 해석 실패 */
    NAME_RESOLUTION,
    /** connect/read 타임아웃 */
    TIMEOUT,
    TLS_HANDSHAKE,
    /** 그 밖의 소켓 I/O 오류(리셋 등) */
    IO_ERROR
}
