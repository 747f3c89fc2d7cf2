package com.redfox.core.service.export;

import java.net.URI;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** 보고서 경로 규칙: {baseDir}/reports/crawl-{host}-{yyyyMMdd-HHmmss}.json */
public final class ReportNaming {
    private ReportNaming() {}

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneId.systemDefault());

    public static Path reportsDir(Path baseDir) {
        return (baseDir == null ? Path.of("out") : baseDir).resolve("reports");
    }

    public static Path jsonPath(Path baseDir, String target, Instant startedAt) {
        return reportsDir(baseDir).resolve("crawl-" + hostSlug(target) + "-" + TS_FMT.format(startedAt) + ".json");
    }

    static String hostSlug(String target) {
        try {
            String h = URI.create(target).getHost();
            return (h == null ? "unknown-host" : h.toLowerCase(Locale.ROOT)).replaceAll("[^a-z0-9._-]", "-");
        } catch (IllegalArgumentException | NullPointerException e) {
            return "unknown-host";
        }
    }
}
