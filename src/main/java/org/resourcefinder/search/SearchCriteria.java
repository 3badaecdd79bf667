package org.resourcefinder.search;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * 一次资源查找的全部条件（不可变）。
 * <p>
 * 所有条件之间是 AND 关系；为 {@code null}（或空白字符串）的条件视为未提供，不做任何限制。
 * 日期在边界层已解析为 {@link LocalDate}，比较时按 UTC 零点换算成时间戳。
 *
 * @param contentPattern    内容正则（为空表示不做内容搜索）
 * @param caseSensitive     内容正则是否区分大小写（默认 false）
 * @param resourcePattern   路径 glob，可用 {@code |} 分隔多个候选
 * @param dateAfter         修改时间下界（不含）
 * @param dateBefore        修改时间上界（不含）
 * @param sizeMin           最小字节数（含）
 * @param sizeMax           最大字节数（含）
 * @param includeContent    是否为命中文件提取“行号 + 上下文”片段
 * @param contextLines      每个片段前后的上下文行数
 * @param maxMatchesPerFile 每个文件最多返回的片段数
 */
public record SearchCriteria(
        String contentPattern,
        boolean caseSensitive,
        String resourcePattern,
        LocalDate dateAfter,
        LocalDate dateBefore,
        Long sizeMin,
        Long sizeMax,
        boolean includeContent,
        int contextLines,
        int maxMatchesPerFile
) {

    public static final int DEFAULT_CONTEXT_LINES = 2;
    public static final int DEFAULT_MAX_MATCHES_PER_FILE = 5;

    public SearchCriteria {
        contentPattern = (contentPattern == null || contentPattern.isEmpty()) ? null : contentPattern;
        resourcePattern = (resourcePattern == null || resourcePattern.isBlank()) ? null : resourcePattern;
        contextLines = Math.max(0, contextLines);
        maxMatchesPerFile = Math.max(1, maxMatchesPerFile);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasContentPattern() {
        return contentPattern != null;
    }

    public boolean hasResourcePattern() {
        return resourcePattern != null;
    }

    public Instant dateAfterInstant() {
        return toUtcMidnight(dateAfter);
    }

    public Instant dateBeforeInstant() {
        return toUtcMidnight(dateBefore);
    }

    private static Instant toUtcMidnight(LocalDate date) {
        return (date == null) ? null : date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public static final class Builder {
        private String contentPattern;
        private boolean caseSensitive;
        private String resourcePattern;
        private LocalDate dateAfter;
        private LocalDate dateBefore;
        private Long sizeMin;
        private Long sizeMax;
        private boolean includeContent;
        private int contextLines = DEFAULT_CONTEXT_LINES;
        private int maxMatchesPerFile = DEFAULT_MAX_MATCHES_PER_FILE;

        private Builder() {
        }

        public Builder contentPattern(String contentPattern) {
            this.contentPattern = contentPattern;
            return this;
        }

        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        public Builder resourcePattern(String resourcePattern) {
            this.resourcePattern = resourcePattern;
            return this;
        }

        public Builder dateAfter(LocalDate dateAfter) {
            this.dateAfter = dateAfter;
            return this;
        }

        public Builder dateBefore(LocalDate dateBefore) {
            this.dateBefore = dateBefore;
            return this;
        }

        public Builder sizeMin(Long sizeMin) {
            this.sizeMin = sizeMin;
            return this;
        }

        public Builder sizeMax(Long sizeMax) {
            this.sizeMax = sizeMax;
            return this;
        }

        public Builder includeContent(boolean includeContent) {
            this.includeContent = includeContent;
            return this;
        }

        public Builder contextLines(int contextLines) {
            this.contextLines = contextLines;
            return this;
        }

        public Builder maxMatchesPerFile(int maxMatchesPerFile) {
            this.maxMatchesPerFile = maxMatchesPerFile;
            return this;
        }

        public SearchCriteria build() {
            return new SearchCriteria(
                    contentPattern,
                    caseSensitive,
                    resourcePattern,
                    dateAfter,
                    dateBefore,
                    sizeMin,
                    sizeMax,
                    includeContent,
                    contextLines,
                    maxMatchesPerFile
            );
        }
    }
}
