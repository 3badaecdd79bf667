package org.resourcefinder.project;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * 资源查找 MCP Server 的业务配置（{@code app.finder.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定可查找的项目根目录，工具只会在这些目录内遍历。</li>
 *   <li>默认不排除任何文件；需要时通过 {@link #excludePatterns} 或 {@link #respectIgnoreFiles} 收窄范围。</li>
 *   <li>内容扫描的分块大小与衔接窗口可调，决定了跨读取边界能可靠识别的最长匹配。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.finder")
public class FinderProperties {

    /**
     * 项目根目录列表。
     * <p>
     * 说明：
     * <ul>
     *   <li>普通写法 {@code /path/to/project}：自动分配 rootId（root0、root1...）。</li>
     *   <li>{@code name=/path/to/project}：显式指定 rootId。</li>
     * </ul>
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 是否包含隐藏文件/目录（如 .git、.idea）。
     */
    private boolean includeHidden = true;

    /**
     * 是否跟随符号链接。
     * <p>
     * 默认 false：链接既不作为候选，也不会深入链接目录；开启后会校验真实路径仍在根目录内并防止循环。
     */
    private boolean allowSymlink = false;

    /**
     * 遍历时跳过的 glob 规则（语法与 resourcePattern 相同），例如 {@code .git/}、{@code node_modules/}。
     */
    @NotNull
    private List<String> excludePatterns = List.of();

    /**
     * 是否额外读取项目根目录下的 {@code .gitignore}、{@code tags.ignore} 作为排除规则。
     */
    private boolean respectIgnoreFiles = false;

    /**
     * 单次查找最多遍历的文件数（0 表示不限制，默认不限制）。
     */
    @Min(0)
    @Max(100_000_000)
    private int maxFiles = 0;

    /**
     * 内容扫描每次读取的字节数。
     */
    @NotNull
    private DataSize contentChunkSize = DataSize.ofKilobytes(64);

    /**
     * 内容扫描的衔接窗口大小（按字符计）：跨读取边界能可靠识别的最长匹配。
     */
    @NotNull
    private DataSize contentOverlapSize = DataSize.ofKilobytes(32);

    /**
     * 内容扫描并发线程数（1 表示顺序扫描）。
     */
    @Min(1)
    @Max(256)
    private int contentSearchThreads = 1;

    /**
     * 内容片段单行最大字符数。
     */
    @Min(20)
    @Max(100_000)
    private int maxLineLength = 400;

    /**
     * 提取内容片段时允许读入内存的最大文件大小（超过则只报告命中，不返回片段）。
     */
    @NotNull
    private DataSize contentExtractMaxBytes = DataSize.ofMegabytes(10);

    /**
     * 单次查找最多返回的告警条数。
     */
    @Min(1)
    @Max(10_000)
    private int maxWarnings = 50;

    /**
     * 内容扫描分块大小允许的范围。
     */
    static final DataSize MIN_CONTENT_CHUNK_SIZE = DataSize.ofBytes(16);
    static final DataSize MAX_CONTENT_BUFFER_SIZE = DataSize.ofMegabytes(64);

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public boolean isIncludeHidden() {
        return includeHidden;
    }

    public void setIncludeHidden(boolean includeHidden) {
        this.includeHidden = includeHidden;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public void setExcludePatterns(List<String> excludePatterns) {
        this.excludePatterns = excludePatterns;
    }

    public boolean isRespectIgnoreFiles() {
        return respectIgnoreFiles;
    }

    public void setRespectIgnoreFiles(boolean respectIgnoreFiles) {
        this.respectIgnoreFiles = respectIgnoreFiles;
    }

    public int getMaxFiles() {
        return maxFiles;
    }

    public void setMaxFiles(int maxFiles) {
        this.maxFiles = maxFiles;
    }

    public DataSize getContentChunkSize() {
        return contentChunkSize;
    }

    public void setContentChunkSize(DataSize contentChunkSize) {
        this.contentChunkSize = contentChunkSize;
    }

    public DataSize getContentOverlapSize() {
        return contentOverlapSize;
    }

    public void setContentOverlapSize(DataSize contentOverlapSize) {
        this.contentOverlapSize = contentOverlapSize;
    }

    public int getContentSearchThreads() {
        return contentSearchThreads;
    }

    public void setContentSearchThreads(int contentSearchThreads) {
        this.contentSearchThreads = contentSearchThreads;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public void setMaxLineLength(int maxLineLength) {
        this.maxLineLength = maxLineLength;
    }

    public DataSize getContentExtractMaxBytes() {
        return contentExtractMaxBytes;
    }

    public void setContentExtractMaxBytes(DataSize contentExtractMaxBytes) {
        this.contentExtractMaxBytes = contentExtractMaxBytes;
    }

    public int getMaxWarnings() {
        return maxWarnings;
    }

    public void setMaxWarnings(int maxWarnings) {
        this.maxWarnings = maxWarnings;
    }

    @AssertTrue(message = "app.finder.content-chunk-size 必须在 16B 到 64MB 之间")
    public boolean isContentChunkSizeInRange() {
        return contentChunkSize == null
                || (contentChunkSize.compareTo(MIN_CONTENT_CHUNK_SIZE) >= 0
                && contentChunkSize.compareTo(MAX_CONTENT_BUFFER_SIZE) <= 0);
    }

    @AssertTrue(message = "app.finder.content-overlap-size 必须在 0 到 64MB 之间")
    public boolean isContentOverlapSizeInRange() {
        return contentOverlapSize == null
                || (!contentOverlapSize.isNegative() && contentOverlapSize.compareTo(MAX_CONTENT_BUFFER_SIZE) <= 0);
    }
}
