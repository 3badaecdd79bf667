package org.resourcefinder.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 遍历时需要跳过的路径规则。
 * <p>
 * 规则使用与资源模式相同的 glob 语法（见 {@link GlobCompiler}）；目录命中规则时整棵子树都会被跳过。
 * 默认不排除任何路径。可选地读取项目根目录下的 {@code .gitignore} 与 {@code tags.ignore}：
 * 只支持逐行 glob，{@code #} 开头的注释与 {@code !} 开头的否定规则会被忽略。
 */
public final class ExcludeRules {

    private static final Logger log = LoggerFactory.getLogger(ExcludeRules.class);

    static final List<String> IGNORE_FILES = List.of(".gitignore", "tags.ignore");

    private static final ExcludeRules NONE = new ExcludeRules(List.of());

    private final List<String> patterns;
    private final CompiledGlob glob;

    private ExcludeRules(List<String> patterns) {
        this.patterns = List.copyOf(patterns);
        this.glob = GlobCompiler.compileAll(this.patterns);
    }

    public static ExcludeRules none() {
        return NONE;
    }

    public static ExcludeRules of(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return NONE;
        }
        return new ExcludeRules(patterns);
    }

    /**
     * 合并配置中的规则与项目根目录下 ignore 文件中的规则。
     */
    public static ExcludeRules forProject(Path projectRoot, List<String> configured, boolean respectIgnoreFiles) {
        Set<String> merged = new LinkedHashSet<>();
        if (configured != null) {
            merged.addAll(configured);
        }
        if (respectIgnoreFiles) {
            for (String name : IGNORE_FILES) {
                merged.addAll(readIgnoreFile(projectRoot.resolve(name)));
            }
        }
        return of(new ArrayList<>(merged));
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    public List<String> patterns() {
        return patterns;
    }

    public boolean excludes(String relativePath) {
        return !patterns.isEmpty() && glob.matches(relativePath);
    }

    static List<String> readIgnoreFile(Path file) {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                if (trimmed.startsWith("!")) {
                    log.debug("暂不支持否定规则，已忽略：{}（{}）", trimmed, file);
                    continue;
                }
                result.add(trimmed);
            }
        } catch (IOException e) {
            log.warn("读取忽略规则文件失败，已跳过：{}（{}）", file, e.getMessage());
        }
        return result;
    }
}
