package org.resourcefinder.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 把资源路径模式（glob）编译成 {@link CompiledGlob}。
 * <p>
 * 规则：
 * <ul>
 *   <li>顶层 {@code |} 表示多个候选，例如 {@code *.js|*.ts|*.json}、{@code src/*.js|test/*.ts}；每个候选会先 trim。</li>
 *   <li>以 {@code /} 结尾的候选视为目录模式：{@code src/} 等价于 {@code src/**}。</li>
 *   <li>开头的 {@code ./} 与 {@code /} 会被去掉，路径始终相对项目根目录。</li>
 *   <li>Windows 风格的 {@code \} 分隔符会被统一成 {@code /}。</li>
 * </ul>
 * 编译永远不会抛异常：拆分后没有任何有效候选时（例如 {@code "|"}），整个输入按字面量处理。
 */
public final class GlobCompiler {

    private static final Logger log = LoggerFactory.getLogger(GlobCompiler.class);

    private GlobCompiler() {
    }

    public static CompiledGlob compile(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return CompiledGlob.nothing();
        }

        List<CompiledGlob.Alternative> alternatives = new ArrayList<>();
        for (String raw : pattern.split("\\|")) {
            CompiledGlob.Alternative alternative = compileAlternative(raw);
            if (alternative != null) {
                alternatives.add(alternative);
            }
        }

        if (alternatives.isEmpty()) {
            // 无法拆出任何候选（例如只有分隔符）：退化为字面量，最多只会匹配同名文件
            String literal = pattern.trim();
            log.debug("资源模式无有效候选，按字面量处理：{}", literal);
            alternatives.add(new CompiledGlob.Alternative(literal, List.of(literal), true, true));
        }
        return new CompiledGlob(pattern, alternatives);
    }

    private static CompiledGlob.Alternative compileAlternative(String raw) {
        String text = raw.trim().replace('\\', '/');
        while (text.startsWith("./")) {
            text = text.substring(2);
        }
        while (text.startsWith("/")) {
            text = text.substring(1);
        }
        if (text.isEmpty()) {
            return null;
        }
        if (text.endsWith("/")) {
            text = text + "**";
        }

        if (text.indexOf('/') < 0) {
            return new CompiledGlob.Alternative(text, List.of(text), true, false);
        }

        List<String> segments = new ArrayList<>();
        for (String segment : text.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            // 相邻的 ** 语义等价，合并以减少回溯分支
            if ("**".equals(segment) && !segments.isEmpty() && "**".equals(segments.get(segments.size() - 1))) {
                continue;
            }
            segments.add(segment);
        }
        if (segments.isEmpty()) {
            return null;
        }
        return new CompiledGlob.Alternative(String.join("/", segments), List.copyOf(segments), false, false);
    }

    /**
     * 把多个 glob 编译成一个（等价于用 {@code |} 连接）。
     */
    public static CompiledGlob compileAll(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return CompiledGlob.nothing();
        }
        List<CompiledGlob.Alternative> alternatives = new ArrayList<>();
        for (String pattern : patterns) {
            if (pattern == null) {
                continue;
            }
            for (String raw : pattern.split("\\|")) {
                CompiledGlob.Alternative alternative = compileAlternative(raw);
                if (alternative != null) {
                    alternatives.add(alternative);
                }
            }
        }
        return new CompiledGlob(String.join("|", patterns), alternatives);
    }
}
