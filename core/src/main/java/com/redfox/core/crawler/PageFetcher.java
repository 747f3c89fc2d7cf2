package com.redfox.core.crawler;

import com.redfox.core.model.ExchangeResult;

import java.net.URI;

/** 크롤러 송신 훅: URL 하나를 가져온다. 테스트에서는 고정 응답을 주입한다. */
@FunctionalInterface
public interface PageFetcher {
    ExchangeResult fetch(URI url);
}
