package org.resourcefinder.search;

/**
 * 内容正则无法编译。
 * <p>
 * 只在查找开始前（任何文件 IO 之前）抛出一次，由 {@link SearchCoordinator} 转换成“0 个命中 + 诊断信息”的结果。
 */
public class InvalidPatternException extends RuntimeException {

    public InvalidPatternException(String message, Throwable cause) {
        super(message, cause);
    }
}
