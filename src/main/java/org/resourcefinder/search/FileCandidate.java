package org.resourcefinder.search;

import java.nio.file.Path;
import java.time.Instant;

/**
 * 目录遍历得到的候选文件。
 *
 * @param relativePath 相对项目根目录的路径（统一使用 / 分隔）
 * @param absolutePath 用于实际读写的绝对路径
 * @param size         文件字节数
 * @param lastModified 最后修改时间（文件系统不提供时为 null）
 */
public record FileCandidate(
        String relativePath,
        Path absolutePath,
        long size,
        Instant lastModified
) {
}
