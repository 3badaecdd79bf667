package org.resourcefinder.search;

import java.time.Instant;

/**
 * 基于文件元数据（大小、修改时间）的过滤条件，全部为纯函数。
 */
public final class MetadataFilter {

    private MetadataFilter() {
    }

    /**
     * 大小范围：两端都是闭区间（{@code sizeMax=0} 可以匹配空文件）。
     */
    public static boolean sizeInRange(long size, Long min, Long max) {
        if (min != null && size < min) {
            return false;
        }
        return max == null || size <= max;
    }

    /**
     * 修改时间范围：两端都是开区间（{@code after < mtime < before}）。
     * 提供了任一边界而文件没有修改时间时，视为不满足。
     */
    public static boolean mtimeInRange(Instant mtime, Instant after, Instant before) {
        if (after == null && before == null) {
            return true;
        }
        if (mtime == null) {
            return false;
        }
        if (after != null && !mtime.isAfter(after)) {
            return false;
        }
        return before == null || mtime.isBefore(before);
    }

    public static boolean accepts(FileCandidate candidate, SearchCriteria criteria) {
        return sizeInRange(candidate.size(), criteria.sizeMin(), criteria.sizeMax())
                && mtimeInRange(candidate.lastModified(), criteria.dateAfterInstant(), criteria.dateBeforeInstant());
    }
}
