package org.resourcefinder.project;

import org.resourcefinder.project.dto.ProjectRoot;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 项目根目录注册表：把 {@code app.finder.roots} 解析成“rootId -> 绝对路径”。
 * <p>
 * 说明：
 * <ul>
 *   <li>rootId 默认按顺序分配（root0、root1...），也可以用 {@code name=path} 显式指定。</li>
 *   <li>这里只做规范化，不校验目录是否存在；不存在的根目录在查找时以 RootNotFound 报告。</li>
 *   <li>工具调用传入 {@code all} 表示全部根目录，传空表示第一个根目录。</li>
 * </ul>
 */
public class ProjectRootRegistry {

    public static final String ALL = "all";

    private final Map<String, Path> roots;

    public ProjectRootRegistry(FinderProperties properties) {
        this.roots = normalizeRoots(properties.getRoots());
    }

    public List<ProjectRoot> listRoots() {
        List<ProjectRoot> result = new ArrayList<>(roots.size());
        roots.forEach((id, path) -> result.add(new ProjectRoot(id, path.toString())));
        return result;
    }

    /**
     * 按 rootId 选择要查找的根目录。
     *
     * @param rootIds 为空时选第一个根目录；包含 {@code all} 时选全部
     * @return 已找到的根目录与未知的 rootId
     */
    public Selection select(List<String> rootIds) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置项目根目录（app.finder.roots）");
        }
        Map<String, Path> selected = new LinkedHashMap<>();
        List<String> notFound = new ArrayList<>();
        if (rootIds == null || rootIds.isEmpty()) {
            Map.Entry<String, Path> first = roots.entrySet().iterator().next();
            selected.put(first.getKey(), first.getValue());
            return new Selection(selected, notFound);
        }
        for (String id : rootIds) {
            if (id == null || id.isBlank()) {
                continue;
            }
            String trimmed = id.trim();
            if (ALL.equalsIgnoreCase(trimmed)) {
                selected.putAll(roots);
                continue;
            }
            Path path = roots.get(trimmed);
            if (path == null) {
                notFound.add(trimmed);
            } else {
                selected.put(trimmed, path);
            }
        }
        return new Selection(selected, notFound);
    }

    private static Map<String, Path> normalizeRoots(List<String> configured) {
        Map<String, Path> result = new LinkedHashMap<>();
        if (configured == null) {
            return result;
        }
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.finder.roots[" + i + "] 不能为空").trim();
            String id = "root" + i;
            int eq = value.indexOf('=');
            if (eq > 0) {
                id = value.substring(0, eq).trim();
                value = value.substring(eq + 1).trim();
            }
            if (result.containsKey(id)) {
                throw new IllegalStateException("项目根目录 rootId 重复：" + id);
            }
            result.put(id, Path.of(value).toAbsolutePath().normalize());
        }
        return result;
    }

    /**
     * @param roots    选中的根目录（rootId -> 绝对路径，保持配置顺序）
     * @param notFound 未知的 rootId
     */
    public record Selection(Map<String, Path> roots, List<String> notFound) {
    }
}
