package org.resourcefinder.project.dto;

import java.util.List;

/**
 * {@code find_resources} 的返回结果。
 * <p>
 * {@code toolResults} 是给模型阅读的完整文本（含 {@code <resources>} 列表），
 * {@code toolResponse} 是一句话摘要；结构化字段便于客户端直接使用。
 *
 * @param description   条件描述片段
 * @param count         所有根目录的命中总数
 * @param searchedRoots 实际查找过的 rootId
 * @param notFoundRoots 未知的 rootId
 * @param results       各根目录的查找结果
 * @param toolResults   完整文本结果
 * @param toolResponse  一句话摘要
 */
public record FindResourcesResult(
        String description,
        int count,
        List<String> searchedRoots,
        List<String> notFoundRoots,
        List<RootSearchResult> results,
        String toolResults,
        String toolResponse
) {
}
