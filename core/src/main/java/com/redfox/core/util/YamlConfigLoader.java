package com.redfox.core.util;

import com.redfox.core.model.CrawlConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * redfox.yml 을 읽어 CrawlConfig 로 변환. 모르는 키는 무시한다.
 *
 * 예상 YAML 키:
 * target: "http://rit.edu/"
 * domain: "rit.edu"
 * userAgent: "Mozilla/5.0"
 * timeoutSeconds: 5
 * encoding: "utf-8"
 * scope:
 *   maxDepth: 2
 *   maxPages: 100
 *   maxRedirects: 5
 * output:
 *   dir: "out"
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "redfox.yml";

    private YamlConfigLoader() {}

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    /** 검증까지 끝난 설정. target 이 없으면 validate 에서 실패. */
    public static CrawlConfig load(InputStream in) {
        CrawlConfig cfg = parse(in);
        cfg.validate();
        return cfg;
    }

    /** 검증 없이 매핑만(CLI 가 target 을 덮어쓴 뒤 validate 할 때 사용) */
    public static CrawlConfig parse(InputStream in) {
        Objects.requireNonNull(in, "in");
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        CrawlConfig cfg = CrawlConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return cfg;
        }

        // 1) 평면 키
        setString(map, "target", cfg::setTarget);
        setString(map, "domain", cfg::setDomain);
        setString(map, "userAgent", cfg::setUserAgent);
        setInt(map, "timeoutSeconds", cfg::setTimeoutSeconds);
        setString(map, "encoding", cfg::setEncoding);

        // 2) scope.*
        Map<String, Object> scope = getMap(map, "scope");
        if (scope != null) {
            setInt(scope, "maxDepth", cfg::setMaxDepth);
            setInt(scope, "maxPages", cfg::setMaxPages);
            setInt(scope, "maxRedirects", cfg::setMaxRedirects);
        }

        // 3) output.dir
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            Object dir = output.get("dir");
            if (dir != null) cfg.setOutputDir(Path.of(String.valueOf(dir)));
        }
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof Number n) {
            setter.accept(n.intValue());
            return;
        }
        try {
            setter.accept(Integer.parseInt(String.valueOf(v).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + v, e);
        }
    }
}
