// ITransceiver.java
package com.redfox.core.api;

import com.redfox.core.model.ExchangeResult;
import com.redfox.core.model.RequestContext;

/** 소켓 한 개로 요청 하나를 보내고 EOF 까지 받는 최소 계약. */
public interface ITransceiver {
    String DEFAULT_ENCODING = "utf-8";

    /**
     * @param timeoutSeconds 0 이면 무기한(플랫폼 기본), 양수면 connect/read 타임아웃
     * @param encoding       요청 인코딩 겸 응답 디코드 charset
     * @param decode         false 면 응답을 바이트 그대로 반환
     */
    ExchangeResult execute(RequestContext ctx, int timeoutSeconds, String encoding, boolean decode);

    default ExchangeResult execute(RequestContext ctx) {
        return execute(ctx, 0, DEFAULT_ENCODING, true);
    }
}
