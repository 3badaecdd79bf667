package org.resourcefinder.project.dto;

import java.util.List;

/**
 * {@code list_project_roots} 的返回结果。
 *
 * @param roots 已配置的项目根目录
 */
public record ProjectRootsResult(List<ProjectRoot> roots) {
}
