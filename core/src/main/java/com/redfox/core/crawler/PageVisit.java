package com.redfox.core.crawler;

import com.redfox.core.model.FailureKind;

import java.time.Instant;
import java.util.List;

/**
 * 한 페이지 방문 결과.
 *
 * @param url           큐에서 꺼낸 URL
 * @param pathDepth     UrlUtils.depth(url)
 * @param statusCode    응답 상태 코드. 교환 실패 또는 HTTP 응답이 아니면 null
 * @param description   ResponseInspector.describe 결과(없으면 null)
 * @param redirectChain 따라간 Location 값들(순서대로)
 * @param failure       교환 실패 종류. 성공이면 null
 * @param bytesRead     마지막 응답 크기
 */
public record PageVisit(String url,
                        int pathDepth,
                        Integer statusCode,
                        String description,
                        List<String> redirectChain,
                        FailureKind failure,
                        String failureMessage,
                        int bytesRead,
                        int linksFound,
                        Instant fetchedAt) {

    public PageVisit {
        redirectChain = (redirectChain == null) ? List.of() : List.copyOf(redirectChain);
    }

    public boolean failed() { return failure != null; }

    public boolean redirected() { return !redirectChain.isEmpty(); }
}
