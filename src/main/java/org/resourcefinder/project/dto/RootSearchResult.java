package org.resourcefinder.project.dto;

import org.resourcefinder.search.ResourceContentMatches;

import java.util.List;

/**
 * 单个项目根目录的查找结果。
 *
 * @param rootId         根目录标识
 * @param count          命中数量
 * @param paths          命中的相对路径（统一使用 / 分隔）
 * @param errorMessage   该根目录的错误信息（正则不合法、根目录不存在等）；正常为 null
 * @param truncated      是否因为达到扫描上限而提前结束
 * @param warnings       非致命告警；没有时为 null
 * @param contentMatches 内容片段；未请求或没有时为 null
 */
public record RootSearchResult(
        String rootId,
        int count,
        List<String> paths,
        String errorMessage,
        boolean truncated,
        List<String> warnings,
        List<ResourceContentMatches> contentMatches
) {
}
