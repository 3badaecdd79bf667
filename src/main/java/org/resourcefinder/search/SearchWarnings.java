package org.resourcefinder.search;

import java.util.ArrayList;
import java.util.List;

/**
 * 有上限的非致命告警收集器（线程安全）。
 * <p>
 * 跳过大量文件时告警可能非常多，超过上限后只追加一条省略提示，避免结果体膨胀。
 */
public final class SearchWarnings {

    static final String OVERFLOW_MARKER = "告警过多，已省略后续告警…";

    private final int maxWarnings;
    private final List<String> warnings = new ArrayList<>();
    private boolean overflowed;

    public SearchWarnings(int maxWarnings) {
        this.maxWarnings = Math.max(1, maxWarnings);
    }

    public synchronized void add(String message) {
        if (warnings.size() < maxWarnings) {
            warnings.add(message);
            return;
        }
        if (!overflowed) {
            warnings.add(OVERFLOW_MARKER);
            overflowed = true;
        }
    }

    public synchronized List<String> snapshot() {
        return List.copyOf(warnings);
    }
}
