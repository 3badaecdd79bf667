package org.resourcefinder.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.FileSystemLoopException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

/**
 * 递归遍历项目根目录，把每个普通文件作为 {@link FileCandidate} 交给 {@link CandidateSink}。
 * <p>
 * 安全与健壮性：
 * <ul>
 *   <li>默认不跟随符号链接；开启 {@code allowSymlink} 后会跟随，但会校验真实路径仍在根目录内并记录已访问目录防止循环。</li>
 *   <li>单个目录/文件访问失败（权限不足、遍历过程中被删除等）只记录告警并跳过，不会中止整个遍历。</li>
 *   <li>目录本身从不作为候选返回。</li>
 * </ul>
 * 遍历顺序由文件系统决定，调用方不能依赖。
 */
public class DirectoryWalker {

    private static final Logger log = LoggerFactory.getLogger(DirectoryWalker.class);

    private final boolean includeHidden;
    private final boolean allowSymlink;
    private final int maxFiles;

    /**
     * @param includeHidden 是否包含隐藏文件/目录
     * @param allowSymlink  是否跟随符号链接
     * @param maxFiles      最多产出多少个候选（{@code <= 0} 表示不限制）
     */
    public DirectoryWalker(boolean includeHidden, boolean allowSymlink, int maxFiles) {
        this.includeHidden = includeHidden;
        this.allowSymlink = allowSymlink;
        this.maxFiles = maxFiles;
    }

    /**
     * 不排除任何文件、不跟随符号链接、不限数量。
     */
    public static DirectoryWalker defaults() {
        return new DirectoryWalker(true, false, 0);
    }

    /**
     * 遍历 {@code root} 下的所有普通文件。
     *
     * @param root      项目根目录（必须存在且为目录）
     * @param pruneGlob 可选：用于跳过不可能包含匹配的子树（仅为优化，最终仍需由调用方用完整路径复核）
     * @param excludes  需要跳过的路径规则
     * @param warnings  非致命告警收集器
     * @param sink      候选接收者；返回 false 时提前结束遍历
     * @return 遍历摘要
     */
    public WalkSummary walk(Path root, CompiledGlob pruneGlob, ExcludeRules excludes, SearchWarnings warnings, CandidateSink sink) {
        final Path rootReal;
        try {
            rootReal = root.toRealPath();
        } catch (IOException e) {
            throw new RootNotFoundException(root);
        }
        if (!Files.isDirectory(rootReal)) {
            throw new RootNotFoundException(root);
        }

        TreeVisitor visitor = visitor(rootReal, pruneGlob, excludes, warnings, sink);
        EnumSet<FileVisitOption> options = allowSymlink
                ? EnumSet.of(FileVisitOption.FOLLOW_LINKS)
                : EnumSet.noneOf(FileVisitOption.class);
        try {
            Files.walkFileTree(rootReal, options, Integer.MAX_VALUE, visitor);
        } catch (IOException e) {
            throw new IllegalStateException("遍历项目目录失败：" + root, e);
        }
        return new WalkSummary(visitor.produced, visitor.truncated);
    }

    TreeVisitor visitor(Path rootReal, CompiledGlob pruneGlob, ExcludeRules excludes, SearchWarnings warnings, CandidateSink sink) {
        return new TreeVisitor(rootReal, pruneGlob, (excludes == null) ? ExcludeRules.none() : excludes, warnings, sink);
    }

    /**
     * 单次遍历的访问器：状态只属于这一次遍历。
     */
    final class TreeVisitor extends SimpleFileVisitor<Path> {

        private final Path rootReal;
        private final CompiledGlob pruneGlob;
        private final ExcludeRules rules;
        private final SearchWarnings warnings;
        private final CandidateSink sink;
        private final Set<Path> visitedRealDirs = new HashSet<>();
        private int produced;
        private boolean truncated;

        private TreeVisitor(Path rootReal, CompiledGlob pruneGlob, ExcludeRules rules, SearchWarnings warnings, CandidateSink sink) {
            this.rootReal = rootReal;
            this.pruneGlob = pruneGlob;
            this.rules = rules;
            this.warnings = warnings;
            this.sink = sink;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (dir.equals(rootReal)) {
                visitedRealDirs.add(rootReal);
                return FileVisitResult.CONTINUE;
            }
            String rel = relativePath(rootReal, dir);
            if (!includeHidden && isHidden(dir)) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            if (rules.excludes(rel)) {
                log.debug("目录命中排除规则，已跳过：{}", rel);
                return FileVisitResult.SKIP_SUBTREE;
            }
            if (pruneGlob != null && !pruneGlob.couldMatchUnder(rel)) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            if (allowSymlink) {
                // 跟随链接时：真实路径必须仍在根目录内，且同一真实目录只访问一次
                Path real;
                try {
                    real = dir.toRealPath();
                } catch (IOException e) {
                    warnings.add("目录无法解析，已跳过：" + rel + "（" + e.getMessage() + "）");
                    return FileVisitResult.SKIP_SUBTREE;
                }
                if (!real.startsWith(rootReal)) {
                    warnings.add("已跳过根目录范围外的目录：" + rel);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                if (!visitedRealDirs.add(real)) {
                    warnings.add("疑似存在循环引用，已跳过目录：" + rel);
                    return FileVisitResult.SKIP_SUBTREE;
                }
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            String rel = relativePath(rootReal, file);
            if (attrs.isSymbolicLink()) {
                // 未开启 allowSymlink 时链接本身不作为候选（链接到目录时也不会深入）
                log.debug("已跳过符号链接：{}", rel);
                return FileVisitResult.CONTINUE;
            }
            if (!attrs.isRegularFile()) {
                return FileVisitResult.CONTINUE;
            }
            if (!includeHidden && isHidden(file)) {
                return FileVisitResult.CONTINUE;
            }
            if (rules.excludes(rel)) {
                return FileVisitResult.CONTINUE;
            }
            if (allowSymlink && !withinRoot(rootReal, file)) {
                warnings.add("已跳过根目录范围外的文件：" + rel);
                return FileVisitResult.CONTINUE;
            }

            if (maxFiles > 0 && produced >= maxFiles) {
                truncated = true;
                warnings.add("已达到最大扫描文件数上限（maxFiles=" + maxFiles + "），提前结束遍历。");
                return FileVisitResult.TERMINATE;
            }
            produced++;

            Instant lastModified = (attrs.lastModifiedTime() != null) ? attrs.lastModifiedTime().toInstant() : null;
            FileCandidate candidate = new FileCandidate(rel, file, attrs.size(), lastModified);
            return sink.accept(candidate) ? FileVisitResult.CONTINUE : FileVisitResult.TERMINATE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            String rel = relativePath(rootReal, file);
            if (exc instanceof FileSystemLoopException) {
                warnings.add("检测到符号链接循环，已跳过：" + rel);
            } else {
                warnings.add("访问失败：" + rel + "（" + exc.getMessage() + "）");
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            if (exc != null) {
                warnings.add("目录遍历中断：" + relativePath(rootReal, dir) + "（" + exc.getMessage() + "）");
            }
            return FileVisitResult.CONTINUE;
        }
    }

    static String relativePath(Path root, Path path) {
        try {
            return root.relativize(path).toString().replace('\\', '/');
        } catch (IllegalArgumentException e) {
            return path.toString().replace('\\', '/');
        }
    }

    private static boolean withinRoot(Path rootReal, Path file) {
        try {
            return file.toRealPath().startsWith(rootReal);
        } catch (IOException e) {
            return false;
        }
    }

    private static boolean isHidden(Path path) {
        Path name = path.getFileName();
        String text = (name != null) ? name.toString() : "";
        try {
            return Files.isHidden(path) || text.startsWith(".");
        } catch (IOException e) {
            return text.startsWith(".");
        }
    }

    /**
     * 候选接收者。
     */
    @FunctionalInterface
    public interface CandidateSink {

        /**
         * @return 继续遍历返回 true；希望提前结束返回 false
         */
        boolean accept(FileCandidate candidate);
    }

    /**
     * 遍历摘要。
     *
     * @param filesVisited 产出的候选数
     * @param truncated    是否因为达到 maxFiles 而提前结束
     */
    public record WalkSummary(int filesVisited, boolean truncated) {
    }
}
