package org.resourcefinder.search;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * 把工具调用传入的“松散”参数解析并校验成 {@link SearchCriteria}。
 * <p>
 * 所有格式校验都在这里完成，查找核心只接收已经类型化的条件。
 */
public final class SearchCriteriaParser {

    public static final int MAX_CONTEXT_LINES = 10;
    public static final int MAX_MATCHES_PER_FILE = 20;

    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    private SearchCriteriaParser() {
    }

    /**
     * @throws IllegalArgumentException 日期格式不正确、大小为负数或大小范围颠倒
     */
    public static SearchCriteria parse(RawCriteria raw) {
        LocalDate after = parseDate("dateAfter", raw.dateAfter());
        LocalDate before = parseDate("dateBefore", raw.dateBefore());
        Long sizeMin = checkSize("sizeMin", raw.sizeMin());
        Long sizeMax = checkSize("sizeMax", raw.sizeMax());
        if (sizeMin != null && sizeMax != null && sizeMin > sizeMax) {
            throw new IllegalArgumentException("参数错误：sizeMin（" + sizeMin + "）不能大于 sizeMax（" + sizeMax + "）");
        }

        int contextLines = (raw.contextLines() == null) ? SearchCriteria.DEFAULT_CONTEXT_LINES
                : clamp(raw.contextLines(), 0, MAX_CONTEXT_LINES);
        int maxMatchesPerFile = (raw.maxMatchesPerFile() == null) ? SearchCriteria.DEFAULT_MAX_MATCHES_PER_FILE
                : clamp(raw.maxMatchesPerFile(), 1, MAX_MATCHES_PER_FILE);

        return SearchCriteria.builder()
                .contentPattern(raw.contentPattern())
                .caseSensitive(Boolean.TRUE.equals(raw.caseSensitive()))
                .resourcePattern(raw.resourcePattern())
                .dateAfter(after)
                .dateBefore(before)
                .sizeMin(sizeMin)
                .sizeMax(sizeMax)
                .includeContent(resolveIncludeContent(raw))
                .contextLines(contextLines)
                .maxMatchesPerFile(maxMatchesPerFile)
                .build();
    }

    /**
     * 未显式指定时，有内容正则就返回片段。
     */
    private static boolean resolveIncludeContent(RawCriteria raw) {
        if (raw.includeContent() != null) {
            return raw.includeContent();
        }
        return raw.contentPattern() != null && !raw.contentPattern().isEmpty();
    }

    static LocalDate parseDate(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim(), ISO_DATE);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("参数错误：" + field + " 必须是 YYYY-MM-DD 格式的日期：" + value, e);
        }
    }

    private static Long checkSize(String field, Long value) {
        if (value != null && value < 0) {
            throw new IllegalArgumentException("参数错误：" + field + " 不能为负数：" + value);
        }
        return value;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * 未经校验的原始参数（全部可为空）。
     */
    public record RawCriteria(
            String contentPattern,
            Boolean caseSensitive,
            String resourcePattern,
            String dateAfter,
            String dateBefore,
            Long sizeMin,
            Long sizeMax,
            Boolean includeContent,
            Integer contextLines,
            Integer maxMatchesPerFile
    ) {
    }
}
