package com.redfox.core.crawler;

import com.redfox.core.api.ICrawler;
import com.redfox.core.http.Transceiver;
import com.redfox.core.inspect.Redirect;
import com.redfox.core.inspect.ResponseInspector;
import com.redfox.core.model.CrawlConfig;
import com.redfox.core.model.ExchangeResult;
import com.redfox.core.model.RawResponse;
import com.redfox.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.util.*;

/**
 * BFS 기반 Crawler (raw socket 클라이언트 위에서 동작)
 * - 범위: UrlUtils.inDomain(url, domain) && UrlUtils.depth(url) <= maxDepth
 * - 301/302 는 Location 토큰을 따라 maxRedirects 까지, 범위(도메인/깊이) 밖으로는 따라가지 않음
 * - 교환 실패는 방문 기록에 남기고 계속 진행(재시도 없음)
 * - 링크 추출은 LinkExtractor에 위임
 */
public class Crawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);

    private final CrawlConfig config;
    private final PageFetcher fetcher;
    private final LinkExtractor extractor;

    public Crawler(CrawlConfig config) {
        this(config, new TransceiverPageFetcher(config, new Transceiver()), new JsoupLinkExtractor());
    }

    public Crawler(CrawlConfig config, PageFetcher fetcher, LinkExtractor extractor) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    @Override
    public List<PageVisit> crawl() {
        config.validate();
        URI seed = UrlUtils.normalize(URI.create(config.getTarget()));
        String domain = config.effectiveDomain();
        LOG.info("crawl start target={} domain={} maxDepth={} maxPages={}",
                seed, domain, config.getMaxDepth(), config.getMaxPages());

        Set<URI> seen = new LinkedHashSet<>();      // 중복 방지 전용
        List<PageVisit> visits = new ArrayList<>();
        Deque<URI> q = new ArrayDeque<>();
        seen.add(seed);
        q.addLast(seed);

        while (!q.isEmpty() && visits.size() < config.getMaxPages()) {
            URI cur = q.pollFirst();
            Fetched f = fetchFollowingRedirects(cur, domain, seen);
            Set<URI> links = extractLinks(f);
            visits.add(f.toVisit(cur, links.size()));

            for (URI n : links) {
                if (inScope(n, domain) && seen.add(n)) q.addLast(n);
            }
        }
        long failures = visits.stream().filter(PageVisit::failed).count();
        LOG.info("crawl done pages={} failures={} queued={}", visits.size(), failures, q.size());
        return visits;
    }

    private Fetched fetchFollowingRedirects(URI start, String domain, Set<URI> seen) {
        URI at = start;
        List<String> chain = new ArrayList<>();
        while (true) {
            ExchangeResult r = fetcher.fetch(at);
            if (!(r instanceof ExchangeResult.Success ok)) {
                return new Fetched(at, chain, (ExchangeResult.Failure) r, null, 0);
            }
            RawResponse resp = ok.response();
            String text = resp.asText();
            if (!ResponseInspector.looksLikeHttp(text)) {
                LOG.debug("non-HTTP response from {} ({} bytes)", at, ok.bytesRead());
                return new Fetched(at, chain, null, null, ok.bytesRead());
            }
            if (chain.size() >= config.getMaxRedirects()) {
                return new Fetched(at, chain, null, text, ok.bytesRead());
            }
            Redirect red = ResponseInspector.redirectLocation(text);
            if (!red.isFound()) {
                return new Fetched(at, chain, null, text, ok.bytesRead());
            }
            String location = red.location().orElseThrow();
            URI next = UrlUtils.resolve(at, location);
            chain.add(location);
            if (next == null || !inScope(next, domain)) {
                LOG.debug("not following redirect {} -> {}", at, location);
                return new Fetched(at, chain, null, text, ok.bytesRead());
            }
            seen.add(next);
            at = next;
        }
    }

    /** 링크 큐잉과 리다이렉트 추적에 같은 범위 규칙을 쓴다 */
    private boolean inScope(URI u, String domain) {
        String s = u.toString();
        return UrlUtils.inDomain(s, domain) && UrlUtils.depth(s) <= config.getMaxDepth();
    }

    private Set<URI> extractLinks(Fetched f) {
        if (f.text == null) return Set.of();
        try {
            return extractor.extract(f.finalUrl, ResponseInspector.body(f.text));
        } catch (Exception e) {
            LOG.warn("link extraction failed url={} error={}", f.finalUrl, e.toString());
            return Set.of();
        }
    }

    private static final class Fetched {
        final URI finalUrl;
        final List<String> chain;
        final ExchangeResult.Failure failure;
        final String text;     // HTTP 응답일 때만
        final int bytesRead;

        Fetched(URI finalUrl, List<String> chain, ExchangeResult.Failure failure, String text, int bytesRead) {
            this.finalUrl = finalUrl; this.chain = chain; this.failure = failure;
            this.text = text; this.bytesRead = bytesRead;
        }

        PageVisit toVisit(URI url, int linksFound) {
            String s = url.toString();
            Integer code = (text == null) ? null : ResponseInspector.statusLine(text);
            String desc = (text == null) ? null : ResponseInspector.describe(text);
            return new PageVisit(s, UrlUtils.depth(s), code, desc, chain,
                    failure == null ? null : failure.kind(),
                    failure == null ? null : failure.message(),
                    bytesRead, linksFound, Instant.now());
        }
    }
}
