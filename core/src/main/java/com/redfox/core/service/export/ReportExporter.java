package com.redfox.core.service.export;

import com.redfox.core.crawler.PageVisit;
import com.redfox.core.model.CrawlConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/** 크롤 결과를 보고서 파일로 내보내는 책임 */
public interface ReportExporter {
    /**
     * @param baseDir   출력 루트 (null이면 "out")
     * @param cfg       크롤 설정(타깃/범위를 meta 에 포함)
     * @param visits    방문 기록
     * @param startedAt 크롤 시작 시각
     * @return 생성된 파일의 경로
     */
    Path export(Path baseDir, CrawlConfig cfg, List<PageVisit> visits, Instant startedAt) throws IOException;
}
