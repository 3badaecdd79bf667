package org.resourcefinder.project.dto;

/**
 * 可查找的项目根目录。
 *
 * @param id   根目录标识（root0、root1... 或配置中显式指定的名称）
 * @param path 根目录的绝对路径
 */
public record ProjectRoot(String id, String path) {
}
