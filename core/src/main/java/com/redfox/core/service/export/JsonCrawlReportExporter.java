package com.redfox.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.redfox.core.crawler.PageVisit;
import com.redfox.core.model.CrawlConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 크롤 보고서(JSON) Exporter.
 * 구조: meta(대상/범위/시각) · counts(pages/failures/redirects) · pages(방문 기록)
 */
public class JsonCrawlReportExporter implements ReportExporter {

    public static final String REPORT_VERSION = "1.0";

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);   // ISO-8601

    public record Meta(String reportVersion, String target, String domain, String userAgent,
                       int maxDepth, int maxPages, int maxRedirects, int timeoutSeconds,
                       Instant startedAt, Instant generatedAt) {}

    public record Counts(int pages, long failures, long redirects) {}

    public record CrawlReport(Meta meta, Counts counts, List<PageVisit> pages) {}

    @Override
    public Path export(Path baseDir, CrawlConfig cfg, List<PageVisit> visits, Instant startedAt) throws IOException {
        Objects.requireNonNull(cfg, "cfg");
        List<PageVisit> pages = (visits == null) ? List.of() : visits;
        Instant started = (startedAt == null) ? Instant.now() : startedAt;

        Path out = ReportNaming.jsonPath(baseDir, cfg.getTarget(), started);
        Files.createDirectories(out.getParent());
        om.writerWithDefaultPrettyPrinter().writeValue(out.toFile(), toReport(cfg, pages, started));
        return out;
    }

    CrawlReport toReport(CrawlConfig cfg, List<PageVisit> pages, Instant started) {
        Meta meta = new Meta(REPORT_VERSION, cfg.getTarget(), cfg.effectiveDomain(), cfg.getUserAgent(),
                cfg.getMaxDepth(), cfg.getMaxPages(), cfg.getMaxRedirects(), cfg.getTimeoutSeconds(),
                started, Instant.now());
        Counts counts = new Counts(pages.size(),
                pages.stream().filter(PageVisit::failed).count(),
                pages.stream().filter(PageVisit::redirected).count());
        return new CrawlReport(meta, counts, pages);
    }

    public ObjectMapper mapper() { return om; }
}
