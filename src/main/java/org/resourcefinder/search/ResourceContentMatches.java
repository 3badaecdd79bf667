package org.resourcefinder.search;

import java.util.List;

/**
 * 某个命中文件的内容片段集合。
 *
 * @param resourcePath   相对路径（统一使用 / 分隔）
 * @param contentMatches 命中片段（最多 maxMatchesPerFile 条）
 */
public record ResourceContentMatches(String resourcePath, List<ContentMatch> contentMatches) {
}
