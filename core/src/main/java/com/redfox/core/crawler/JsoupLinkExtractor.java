package com.redfox.core.crawler;

import com.redfox.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.Set;

/** 기본 JSoup 기반 링크 추출기: a[href] → abs:href 수집. 네트워크는 쓰지 않고 받은 본문만 파싱한다. */
public class JsoupLinkExtractor implements LinkExtractor {

    @Override
    public Set<URI> extract(URI base, String html) {
        Set<URI> out = new LinkedHashSet<>();
        if (base == null || html == null || html.isBlank()) return out;

        Document doc = Jsoup.parse(html, base.toString());
        for (Element a : doc.select("a[href]")) {
            String abs = a.attr("abs:href");
            if (abs.isBlank()) abs = a.attr("href");
            URI u = UrlUtils.resolve(base, abs);
            if (u != null) out.add(u);
        }
        return out;
    }
}
