package org.resourcefinder.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.regex.Pattern;

/**
 * 资源查找的编排入口：路径 glob → 元数据 → 内容，逐个候选短路判断。
 * <p>
 * 设计要点：
 * <ul>
 *   <li>内容正则在任何文件 IO 之前只编译一次；不合法时返回“0 个命中 + 原始诊断信息”，不抛异常。</li>
 *   <li>只有通过路径与元数据检查的候选才会打开文件读取内容；文件句柄按候选获取、用完立即释放。</li>
 *   <li>单个候选读取失败只会让该候选被排除，唯一的致命错误是根目录不存在（{@link RootNotFoundException}）。</li>
 *   <li>每次调用的状态都在方法内部，同一个实例可以被并发调用。</li>
 * </ul>
 * 配置了 {@code contentExecutor} 时内容扫描会并行执行，但结果仍按遍历顺序收集。
 */
public class SearchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SearchCoordinator.class);

    public static final int DEFAULT_MAX_WARNINGS = 50;

    private final DirectoryWalker walker;
    private final StreamingContentSearcher contentSearcher;
    private final ContentMatchExtractor matchExtractor;
    private final List<String> excludePatterns;
    private final boolean respectIgnoreFiles;
    private final int maxWarnings;
    private final ExecutorService contentExecutor;

    public SearchCoordinator(
            DirectoryWalker walker,
            StreamingContentSearcher contentSearcher,
            ContentMatchExtractor matchExtractor,
            List<String> excludePatterns,
            boolean respectIgnoreFiles,
            int maxWarnings,
            ExecutorService contentExecutor
    ) {
        this.walker = walker;
        this.contentSearcher = contentSearcher;
        this.matchExtractor = matchExtractor;
        this.excludePatterns = (excludePatterns == null) ? List.of() : List.copyOf(excludePatterns);
        this.respectIgnoreFiles = respectIgnoreFiles;
        this.maxWarnings = maxWarnings;
        this.contentExecutor = contentExecutor;
    }

    /**
     * 不排除任何文件、顺序扫描的默认组合。
     */
    public static SearchCoordinator defaults() {
        return new SearchCoordinator(
                DirectoryWalker.defaults(),
                new StreamingContentSearcher(),
                new ContentMatchExtractor(400, 10L * 1024 * 1024),
                List.of(),
                false,
                DEFAULT_MAX_WARNINGS,
                null
        );
    }

    /**
     * 在项目根目录下查找满足全部条件的资源。
     *
     * @throws RootNotFoundException 根目录不存在或不是目录
     */
    public SearchResult search(Path projectRoot, SearchCriteria criteria) {
        String description = describe(criteria);
        if (projectRoot == null || !Files.isDirectory(projectRoot)) {
            throw new RootNotFoundException(projectRoot);
        }
        log.info("开始查找资源：root={}，条件：{}", projectRoot, description);

        Pattern pattern = null;
        if (criteria.hasContentPattern()) {
            try {
                pattern = StreamingContentSearcher.compile(criteria.contentPattern(), criteria.caseSensitive());
            } catch (InvalidPatternException e) {
                log.error("内容正则不合法：{}（{}）", criteria.contentPattern(), e.getMessage());
                return SearchResult.failed(description, e.getMessage(), List.of());
            }
        }
        CompiledGlob glob = criteria.hasResourcePattern() ? GlobCompiler.compile(criteria.resourcePattern()) : null;
        ExcludeRules excludes = ExcludeRules.forProject(projectRoot, excludePatterns, respectIgnoreFiles);
        SearchWarnings warnings = new SearchWarnings(maxWarnings);

        List<FileCandidate> accepted = new ArrayList<>();
        List<Future<Boolean>> pending = new ArrayList<>();
        final Pattern contentPattern = pattern;

        DirectoryWalker.WalkSummary summary = walker.walk(projectRoot, glob, excludes, warnings, candidate -> {
            if (glob != null && !glob.matches(candidate.relativePath())) {
                return true;
            }
            if (!MetadataFilter.accepts(candidate, criteria)) {
                return true;
            }
            if (contentPattern == null) {
                accepted.add(candidate);
            } else if (contentExecutor != null) {
                accepted.add(candidate);
                pending.add(contentExecutor.submit(() -> contentMatches(candidate, contentPattern, warnings)));
            } else if (contentMatches(candidate, contentPattern, warnings)) {
                accepted.add(candidate);
            }
            return true;
        });

        List<FileCandidate> matched = pending.isEmpty() ? accepted : collect(accepted, pending, warnings);

        List<String> paths = new ArrayList<>(matched.size());
        for (FileCandidate candidate : matched) {
            paths.add(candidate.relativePath());
        }
        List<ResourceContentMatches> contentMatches = (contentPattern != null && criteria.includeContent())
                ? extractContentMatches(matched, contentPattern, criteria, warnings)
                : List.of();

        log.info("资源查找完成：命中 {} 个，遍历 {} 个文件{}", paths.size(), summary.filesVisited(),
                summary.truncated() ? "（已达到扫描上限）" : "");
        return new SearchResult(
                paths,
                paths.size(),
                description,
                null,
                warnings.snapshot(),
                summary.truncated(),
                contentMatches
        );
    }

    /**
     * 渲染条件描述：按固定顺序、用 {@code ", "} 连接已提供的条件。
     * 该格式会被原样拼接到回复中，调用方依赖其逐字一致。
     */
    public static String describe(SearchCriteria criteria) {
        List<String> parts = new ArrayList<>(7);
        if (criteria.hasContentPattern()) {
            parts.add("content pattern \"" + criteria.contentPattern() + "\"");
            parts.add(criteria.caseSensitive() ? "case-sensitive" : "case-insensitive");
        }
        if (criteria.hasResourcePattern()) {
            parts.add("resource pattern \"" + criteria.resourcePattern() + "\"");
        }
        if (criteria.dateAfter() != null) {
            parts.add("modified after " + criteria.dateAfter());
        }
        if (criteria.dateBefore() != null) {
            parts.add("modified before " + criteria.dateBefore());
        }
        if (criteria.sizeMin() != null) {
            parts.add("minimum size " + criteria.sizeMin() + " bytes");
        }
        if (criteria.sizeMax() != null) {
            parts.add("maximum size " + criteria.sizeMax() + " bytes");
        }
        return String.join(", ", parts);
    }

    private boolean contentMatches(FileCandidate candidate, Pattern pattern, SearchWarnings warnings) {
        try {
            return contentSearcher.containsMatch(candidate.absolutePath(), pattern);
        } catch (CharacterCodingException e) {
            log.debug("文件不是合法的 UTF-8 文本，视为不匹配：{}", candidate.relativePath());
            return false;
        } catch (IOException e) {
            log.warn("读取文件失败，已跳过：{}（{}）", candidate.relativePath(), e.getMessage());
            warnings.add("跳过无法读取的文件：" + candidate.relativePath() + "（" + e.getMessage() + "）");
            return false;
        }
    }

    private static List<FileCandidate> collect(List<FileCandidate> submitted, List<Future<Boolean>> pending, SearchWarnings warnings) {
        List<FileCandidate> matched = new ArrayList<>();
        for (int i = 0; i < pending.size(); i++) {
            FileCandidate candidate = submitted.get(i);
            try {
                if (pending.get(i).get()) {
                    matched.add(candidate);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.forEach(f -> f.cancel(true));
                throw new IllegalStateException("资源查找被中断", e);
            } catch (ExecutionException e) {
                Throwable cause = (e.getCause() != null) ? e.getCause() : e;
                log.warn("内容扫描失败，已跳过：{}", candidate.relativePath(), cause);
                warnings.add("跳过无法搜索的文件：" + candidate.relativePath() + "（" + cause.getMessage() + "）");
            }
        }
        return matched;
    }

    private List<ResourceContentMatches> extractContentMatches(
            List<FileCandidate> matched,
            Pattern pattern,
            SearchCriteria criteria,
            SearchWarnings warnings
    ) {
        List<ResourceContentMatches> result = new ArrayList<>(matched.size());
        for (FileCandidate candidate : matched) {
            try {
                List<ContentMatch> matches = matchExtractor.extract(
                        candidate.absolutePath(),
                        pattern,
                        criteria.contextLines(),
                        criteria.maxMatchesPerFile()
                );
                if (!matches.isEmpty()) {
                    result.add(new ResourceContentMatches(candidate.relativePath(), matches));
                }
            } catch (IOException e) {
                warnings.add("提取内容片段失败：" + candidate.relativePath() + "（" + e.getMessage() + "）");
            }
        }
        return result;
    }
}
