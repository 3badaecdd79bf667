package org.resourcefinder.search;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 为已确认命中的文件提取“行号 + 上下文”片段。
 * <p>
 * 与 {@link StreamingContentSearcher} 不同，这里需要完整的行信息，因此会把文件整体读入内存；
 * 超过 {@code maxBytes} 的文件不提取片段（文件本身仍然算命中）。
 * <ul>
 *   <li>正则里含换行（{@code \n}）时按全文匹配，片段定位到命中起始行。</li>
 *   <li>否则逐行匹配，与 {@code grep -n} 的体验一致。</li>
 * </ul>
 */
public class ContentMatchExtractor {

    private final int maxLineLength;
    private final long maxBytes;

    /**
     * @param maxLineLength 单行片段最大字符数（超出时围绕命中位置截取）
     * @param maxBytes      参与提取的最大文件字节数
     */
    public ContentMatchExtractor(int maxLineLength, long maxBytes) {
        this.maxLineLength = Math.max(20, maxLineLength);
        this.maxBytes = maxBytes;
    }

    /**
     * @return 命中片段；文件过大时返回空列表
     */
    public List<ContentMatch> extract(Path file, Pattern pattern, int contextLines, int maxMatches) throws IOException {
        if (Files.size(file) > maxBytes) {
            return List.of();
        }
        String content = decodeUtf8BestEffort(Files.readAllBytes(file));
        List<String> lines = splitLines(content);
        if (isMultiLinePattern(pattern)) {
            return extractFromWholeText(content, lines, pattern, contextLines, maxMatches);
        }
        return extractByLine(lines, pattern, contextLines, maxMatches);
    }

    static boolean isMultiLinePattern(Pattern pattern) {
        String source = pattern.pattern();
        return source.contains("\\n") || source.indexOf('\n') >= 0;
    }

    private List<ContentMatch> extractByLine(List<String> lines, Pattern pattern, int contextLines, int maxMatches) {
        List<ContentMatch> matches = new ArrayList<>();
        for (int i = 0; i < lines.size() && matches.size() < maxMatches; i++) {
            Matcher m = pattern.matcher(lines.get(i));
            while (m.find() && matches.size() < maxMatches) {
                matches.add(toMatch(lines, i, m.start(), m.end(), contextLines));
            }
        }
        return matches;
    }

    private List<ContentMatch> extractFromWholeText(String content, List<String> lines, Pattern pattern, int contextLines, int maxMatches) {
        List<ContentMatch> matches = new ArrayList<>();
        int[] lineStarts = lineStarts(content, lines.size());
        Matcher m = pattern.matcher(content);
        while (matches.size() < maxMatches && m.find()) {
            int lineIndex = lineIndexOf(lineStarts, m.start());
            int startInLine = m.start() - lineStarts[lineIndex];
            int lineLength = lines.get(lineIndex).length();
            int endInLine = Math.min(lineLength, startInLine + (m.end() - m.start()));
            matches.add(toMatch(lines, lineIndex, startInLine, endInLine, contextLines));
        }
        return matches;
    }

    private ContentMatch toMatch(List<String> lines, int lineIndex, int matchStart, int matchEnd, int contextLines) {
        Excerpt excerpt = buildExcerpt(lines.get(lineIndex), matchStart, matchEnd, maxLineLength);
        List<String> before = new ArrayList<>();
        for (int i = Math.max(0, lineIndex - contextLines); i < lineIndex; i++) {
            before.add(truncateLineHead(lines.get(i), maxLineLength));
        }
        List<String> after = new ArrayList<>();
        for (int i = lineIndex + 1; i < Math.min(lines.size(), lineIndex + 1 + contextLines); i++) {
            after.add(truncateLineHead(lines.get(i), maxLineLength));
        }
        return new ContentMatch(
                lineIndex + 1,
                excerpt.text(),
                before,
                after,
                excerpt.matchStart(),
                excerpt.matchEnd()
        );
    }

    private static List<String> splitLines(String content) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                int end = (i > start && content.charAt(i - 1) == '\r') ? i - 1 : i;
                lines.add(content.substring(start, end));
                start = i + 1;
            }
        }
        lines.add(content.substring(start));
        return lines;
    }

    private static int[] lineStarts(String content, int lineCount) {
        int[] starts = new int[lineCount];
        int line = 1;
        for (int i = 0; i < content.length() && line < lineCount; i++) {
            if (content.charAt(i) == '\n') {
                starts[line++] = i + 1;
            }
        }
        return starts;
    }

    private static int lineIndexOf(int[] lineStarts, int offset) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }

    /**
     * 生成“围绕匹配位置”的片段：既控制长度，又尽量把命中内容包含在片段中。
     */
    static Excerpt buildExcerpt(String line, int matchStart, int matchEnd, int maxLineLength) {
        int originalLength = line.length();
        if (originalLength <= maxLineLength) {
            return new Excerpt(line, matchStart, matchEnd);
        }

        // prefix/suffix 各预留 1 个省略号字符（…），保证最终长度不超过 maxLineLength
        int available = Math.max(1, maxLineLength - 2);
        int desiredStart = matchStart - available / 2;
        int start = Math.max(0, Math.min(desiredStart, originalLength - available));
        int end = Math.min(originalLength, start + available);

        StringBuilder sb = new StringBuilder(maxLineLength);
        int shift = -start;
        if (start > 0) {
            sb.append('…');
            shift++;
        }
        sb.append(line, start, end);
        if (end < originalLength) {
            sb.append('…');
        }
        int newStart = clamp(matchStart + shift, 0, sb.length());
        int newEnd = clamp(matchEnd + shift, newStart, sb.length());
        return new Excerpt(sb.toString(), newStart, newEnd);
    }

    static String truncateLineHead(String line, int maxLineLength) {
        if (line.length() <= maxLineLength) {
            return line;
        }
        return line.substring(0, maxLineLength - 1) + "…";
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private static String decodeUtf8BestEffort(byte[] bytes) {
        // 非法字节用替换字符兜底：命中判断已经由严格解码完成，这里只负责展示
        return new String(bytes, StandardCharsets.UTF_8);
    }

    record Excerpt(String text, int matchStart, int matchEnd) {
    }
}
