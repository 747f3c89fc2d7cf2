// ICrawler.java
package com.redfox.core.api;

import com.redfox.core.crawler.PageVisit;

import java.util.List;

/** 크롤러 최소 계약: 방문한 페이지 기록을 방문 순서대로 돌려준다. */
public interface ICrawler {
    List<PageVisit> crawl();
}
