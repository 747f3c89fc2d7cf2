package com.redfox.core.crawler;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class JsoupLinkExtractorTest {

    private final JsoupLinkExtractor extractor = new JsoupLinkExtractor();

    @Test
    void resolvesAndNormalizesAnchors() {
        String html = "<html><body>"
                + "<a href='/a'>a</a>"
                + "<a href='b/c#top'>bc</a>"
                + "<a href='HTTPS://Other.COM:443/x'>x</a>"
                + "<a href='mailto:fox@ex.com'>mail</a>"
                + "<a href='/a'>dup</a>"
                + "<a>no href</a>"
                + "</body></html>";

        assertThat(extractor.extract(URI.create("http://ex.com/dir/page"), html))
                .extracting(URI::toString)
                .containsExactly("http://ex.com/a", "http://ex.com/dir/b/c", "https://other.com/x");
    }

    @Test
    void blankBodyHasNoLinks() {
        assertThat(extractor.extract(URI.create("http://ex.com/"), "")).isEmpty();
        assertThat(extractor.extract(URI.create("http://ex.com/"), null)).isEmpty();
    }
}
