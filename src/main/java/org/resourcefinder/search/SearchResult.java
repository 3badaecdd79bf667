package org.resourcefinder.search;

import java.util.List;

/**
 * 一次资源查找的结果。
 * <p>
 * 不变式：{@code count == paths.size()}；paths 中的路径统一使用 / 分隔，顺序即遍历顺序。
 *
 * @param paths          命中的相对路径
 * @param count          命中数量
 * @param description    条件描述片段（格式固定，调用方会原样拼接到回复中）
 * @param errorMessage   条件本身不可用时的诊断信息（例如正则不合法）；正常为 null
 * @param warnings       非致命告警（跳过的目录/文件）；没有时为空列表
 * @param truncated      是否因为达到扫描文件数上限而提前结束
 * @param contentMatches 内容片段（仅在请求 includeContent 时填充）
 */
public record SearchResult(
        List<String> paths,
        int count,
        String description,
        String errorMessage,
        List<String> warnings,
        boolean truncated,
        List<ResourceContentMatches> contentMatches
) {

    public SearchResult {
        paths = List.copyOf(paths);
        count = paths.size();
        warnings = (warnings == null) ? List.of() : List.copyOf(warnings);
        contentMatches = (contentMatches == null) ? List.of() : List.copyOf(contentMatches);
    }

    public static SearchResult failed(String description, String errorMessage, List<String> warnings) {
        return new SearchResult(List.of(), 0, description, errorMessage, warnings, false, List.of());
    }

    public boolean hasError() {
        return errorMessage != null;
    }
}
