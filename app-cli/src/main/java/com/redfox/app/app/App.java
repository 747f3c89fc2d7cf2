package com.redfox.app.app;

import com.redfox.app.logging.LogSetup;
import com.redfox.core.api.ITransceiver;
import com.redfox.core.crawler.Crawler;
import com.redfox.core.crawler.JsoupLinkExtractor;
import com.redfox.core.crawler.PageVisit;
import com.redfox.core.crawler.TransceiverPageFetcher;
import com.redfox.core.http.RequestBuilder;
import com.redfox.core.http.Transceiver;
import com.redfox.core.inspect.Redirect;
import com.redfox.core.inspect.ResponseInspector;
import com.redfox.core.model.CrawlConfig;
import com.redfox.core.model.ExchangeResult;
import com.redfox.core.model.RawResponse;
import com.redfox.core.model.RequestContext;
import com.redfox.core.service.export.JsonCrawlReportExporter;
import com.redfox.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * RedFox 명령행 진입점.
 * <pre>
 * redfox fetch &lt;url&gt; [-X METHOD] [-d BODY] [--path P] [--connection C] [--agent A]
 *                      [--timeout S] [--encoding E] [--raw] [--show-request]
 * redfox crawl [--config redfox.yml] [--out DIR] [&lt;url&gt;]
 * </pre>
 */
public final class App {
    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_EXCHANGE_FAILED = 2;
    static final int EXIT_USAGE = 64;

    private App() {}

    public static void main(String[] args) {
        // 로그 초기화 (-Drf.out.dir 없으면 "out")
        Path outRoot = Paths.get(System.getProperty("rf.out.dir", "out"));
        LogSetup.configure(outRoot);

        int code = run(args, System.out, System.err, new Transceiver());
        System.exit(code);
    }

    /** 테스트 가능하도록 출력 스트림과 Transceiver 를 주입받는다. */
    static int run(String[] args, PrintStream out, PrintStream err, ITransceiver transceiver) {
        if (args == null || args.length == 0) {
            usage(err);
            return EXIT_USAGE;
        }
        Deque<String> rest = new ArrayDeque<>(Arrays.asList(args).subList(1, args.length));
        try {
            switch (args[0]) {
                case "fetch": return fetch(rest, out, err, transceiver);
                case "crawl": return crawl(rest, out, err, transceiver);
                case "-h":
                case "--help":
                    usage(out);
                    return EXIT_OK;
                default:
                    err.println("unknown command: " + args[0]);
                    usage(err);
                    return EXIT_USAGE;
            }
        } catch (UsageException e) {
            err.println(e.getMessage());
            usage(err);
            return EXIT_USAGE;
        }
    }

    // ---------------- fetch ----------------
    private static int fetch(Deque<String> args, PrintStream out, PrintStream err, ITransceiver transceiver) {
        String url = null, method = RequestBuilder.DEFAULT_METHOD, body = "", path = "";
        String connection = RequestBuilder.DEFAULT_CONNECTION, agent = RequestContext.DEFAULT_USER_AGENT;
        String encoding = ITransceiver.DEFAULT_ENCODING;
        int timeout = 0;
        boolean raw = false, showRequest = false;

        while (!args.isEmpty()) {
            String a = args.pollFirst();
            switch (a) {
                case "-X": method = value(a, args); break;
                case "-d": body = value(a, args); break;
                case "--path": path = value(a, args); break;
                case "--connection": connection = value(a, args); break;
                case "--agent": agent = value(a, args); break;
                case "--encoding": encoding = value(a, args); break;
                case "--timeout": timeout = intValue(a, args); break;
                case "--raw": raw = true; break;
                case "--show-request": showRequest = true; break;
                default:
                    if (a.startsWith("-")) throw new UsageException("unknown option: " + a);
                    if (url != null) throw new UsageException("only one URL is allowed");
                    url = a;
            }
        }
        if (url == null) throw new UsageException("fetch needs a URL");

        RequestContext ctx = TransceiverPageFetcher.contextFor(parseUrl(url), agent);
        String request = RequestBuilder.build(ctx, method, path, connection, body);
        if (showRequest) {
            err.print(request);
            err.println();
            err.println("----");
        }

        ExchangeResult result;
        try {
            result = transceiver.execute(ctx, timeout, encoding, !raw);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
        if (result instanceof ExchangeResult.Failure f) {
            err.println("[!] could not connect to " + ctx.getHost() + ": " + f.kind() + " (" + f.message() + ")");
            return EXIT_EXCHANGE_FAILED;
        }

        ExchangeResult.Success ok = (ExchangeResult.Success) result;
        RawResponse resp = ok.response();
        if (resp instanceof RawResponse.Text t) {
            out.print(t.value());
            out.flush();
        } else {
            byte[] bytes = resp.bytes();
            out.write(bytes, 0, bytes.length);
            out.flush();
            if (ok.decodeFailed()) err.println("[!] could not decode the response: " + ok.decodeError());
        }
        summarize(resp.asText(), err);
        return EXIT_OK;
    }

    private static void summarize(String text, PrintStream err) {
        if (!ResponseInspector.looksLikeHttp(text)) {
            err.println("[!] response does not look like HTTP");
            return;
        }
        err.println(ResponseInspector.describe(text));
        Redirect r = ResponseInspector.redirectLocation(text);
        switch (r.kind()) {
            case FOUND: err.println("redirect -> " + r.location().orElse("")); break;
            case LOCATION_MISSING: err.println("redirect without Location header"); break;
            default: break;
        }
    }

    // ---------------- crawl ----------------
    private static int crawl(Deque<String> args, PrintStream out, PrintStream err, ITransceiver transceiver) {
        Path configPath = null;
        Path outDir = null;
        String url = null;
        while (!args.isEmpty()) {
            String a = args.pollFirst();
            switch (a) {
                case "--config": configPath = Path.of(value(a, args)); break;
                case "--out": outDir = Path.of(value(a, args)); break;
                default:
                    if (a.startsWith("-")) throw new UsageException("unknown option: " + a);
                    url = a;
            }
        }

        CrawlConfig cfg;
        try {
            cfg = loadConfig(configPath);
        } catch (IOException e) {
            err.println("[!] could not read config: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (url != null) cfg.setTarget(url);
        if (outDir != null) cfg.setOutputDir(outDir);
        try {
            cfg.validate();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new UsageException("invalid crawl config: " + e.getMessage());
        }

        Instant started = Instant.now();
        Crawler crawler = new Crawler(cfg, new TransceiverPageFetcher(cfg, transceiver), new JsoupLinkExtractor());
        List<PageVisit> visits = crawler.crawl();
        for (PageVisit v : visits) {
            out.println(line(v));
        }

        try {
            Path report = new JsonCrawlReportExporter().export(cfg.getOutputDir(), cfg, visits, started);
            err.println("report: " + report.toAbsolutePath());
        } catch (IOException e) {
            LOG.error("report export failed dir={}", cfg.getOutputDir(), e);
            err.println("[!] could not write report: " + e.getMessage());
        }
        return EXIT_OK;
    }

    /** 명시 경로 → 없으면 ./redfox.yml → 그것도 없으면 기본값 */
    private static CrawlConfig loadConfig(Path configPath) throws IOException {
        Path p = (configPath != null) ? configPath : Path.of(YamlConfigLoader.DEFAULT_FILE);
        if (configPath == null && !Files.exists(p)) return CrawlConfig.defaults();
        if (!Files.exists(p)) throw new IOException(p + " not found");
        try (InputStream in = Files.newInputStream(p)) {
            return YamlConfigLoader.parse(in);
        }
    }

    private static String line(PageVisit v) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(v.pathDepth()).append("] ").append(v.url()).append(' ');
        if (v.failed()) sb.append("FAILED ").append(v.failure());
        else sb.append(v.description() == null ? "<no HTTP response>" : v.description());
        if (v.redirected()) sb.append(" -> ").append(String.join(" -> ", v.redirectChain()));
        return sb.toString();
    }

    // ---------------- args ----------------
    private static URI parseUrl(String url) {
        try {
            URI u = URI.create(url);
            if (u.getHost() == null) throw new UsageException("URL must be absolute (http://host/...): " + url);
            return u;
        } catch (IllegalArgumentException e) {
            throw new UsageException("invalid URL: " + url);
        }
    }

    private static String value(String opt, Deque<String> args) {
        String v = args.pollFirst();
        if (v == null) throw new UsageException(opt + " needs a value");
        return v;
    }

    private static int intValue(String opt, Deque<String> args) {
        String v = value(opt, args);
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new UsageException(opt + " needs an integer: " + v);
        }
    }

    private static void usage(PrintStream s) {
        s.println("usage: redfox fetch <url> [-X METHOD] [-d BODY] [--path P] [--connection C] [--agent A]");
        s.println("                          [--timeout S] [--encoding E] [--raw] [--show-request]");
        s.println("       redfox crawl [--config redfox.yml] [--out DIR] [<url>]");
    }

    static final class UsageException extends RuntimeException {
        UsageException(String message) { super(message); }
    }
}
