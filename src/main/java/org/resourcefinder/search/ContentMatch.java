package org.resourcefinder.search;

import java.util.List;

/**
 * 文件内的单条内容命中（{@code includeContent=true} 时返回）。
 *
 * @param lineNumber    命中起始行号（1-based）
 * @param content       命中所在行（超长时围绕命中位置截取）
 * @param contextBefore 命中行之前的上下文行
 * @param contextAfter  命中行之后的上下文行
 * @param matchStart    命中在 content 中的起始位置（0-based）
 * @param matchEnd      命中在 content 中的结束位置（不含）
 */
public record ContentMatch(
        int lineNumber,
        String content,
        List<String> contextBefore,
        List<String> contextAfter,
        int matchStart,
        int matchEnd
) {
}
