package com.redfox.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Transceiver 한 번 호출의 결과: 성공(응답 포함) 또는 실패(종류 포함).
 * 연결 계층 예외는 밖으로 던지지 않고 여기로 변환된다.
 */
public sealed interface ExchangeResult permits ExchangeResult.Success, ExchangeResult.Failure {

    boolean isSuccess();

    /** 성공이면 응답, 실패면 empty */
    default Optional<RawResponse> maybeResponse() {
        return (this instanceof Success s) ? Optional.of(s.response()) : Optional.empty();
    }

    /**
     * @param decodeError 디코드를 요청했는데 실패한 경우의 사유. 그 외엔 null(이때 response 는 Bytes).
     */
    record Success(RawResponse response, long elapsedMs, int bytesRead, String decodeError) implements ExchangeResult {
        public Success {
            Objects.requireNonNull(response, "response");
        }
        @Override public boolean isSuccess() { return true; }

        public boolean decodeFailed() { return decodeError != null; }
    }

    record Failure(FailureKind kind, String message) implements ExchangeResult {
        public Failure {
            Objects.requireNonNull(kind, "kind");
        }
        @Override public boolean isSuccess() { return false; }
    }
}
