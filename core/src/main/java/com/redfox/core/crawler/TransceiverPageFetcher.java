package com.redfox.core.crawler;

import com.redfox.core.api.ITransceiver;
import com.redfox.core.http.RequestBuilder;
import com.redfox.core.model.CrawlConfig;
import com.redfox.core.model.ExchangeResult;
import com.redfox.core.model.RequestContext;

import java.net.URI;
import java.util.Objects;

/** URL → RequestContext → GET(Connection: close) → Transceiver. 프로덕션 경로. */
public class TransceiverPageFetcher implements PageFetcher {

    private final CrawlConfig config;
    private final ITransceiver transceiver;

    public TransceiverPageFetcher(CrawlConfig config, ITransceiver transceiver) {
        this.config = Objects.requireNonNull(config, "config");
        this.transceiver = Objects.requireNonNull(transceiver, "transceiver");
    }

    @Override
    public ExchangeResult fetch(URI url) {
        RequestContext ctx = contextFor(url, config.getUserAgent());
        RequestBuilder.build(ctx);
        return transceiver.execute(ctx, config.getTimeoutSeconds(), config.getEncoding(), true);
    }

    /** scheme 으로 TLS/기본 포트를 정하고, 경로에는 query 까지 붙인다. */
    public static RequestContext contextFor(URI url, String userAgent) {
        Objects.requireNonNull(url, "url");
        boolean tls = "https".equalsIgnoreCase(url.getScheme());
        int port = (url.getPort() > 0) ? url.getPort() : (tls ? RequestContext.TLS_PORT : RequestContext.DEFAULT_PORT);
        String path = (url.getRawPath() == null || url.getRawPath().isEmpty()) ? "/" : url.getRawPath();
        if (url.getRawQuery() != null) path = path + "?" + url.getRawQuery();
        return RequestContext.builder(url.getHost())
                .path(path)
                .port(port)
                .userAgent(userAgent)
                .tls(tls)
                .build();
    }
}
