package org.resourcefinder.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.resourcefinder.project.ProjectRootRegistry;
import org.resourcefinder.project.dto.FindResourcesResult;
import org.resourcefinder.project.dto.ProjectRootsResult;
import org.resourcefinder.project.dto.RootSearchResult;
import org.resourcefinder.search.ResourceContentMatches;
import org.resourcefinder.search.RootNotFoundException;
import org.resourcefinder.search.SearchCoordinator;
import org.resourcefinder.search.SearchCriteria;
import org.resourcefinder.search.SearchCriteriaParser;
import org.resourcefinder.search.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 资源查找 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列出可查找的项目根目录（{@code list_project_roots}）。</li>
 *   <li>按路径 glob、修改时间、大小、内容正则组合查找资源（{@code find_resources}）。</li>
 * </ul>
 * 查找本身由 {@link SearchCoordinator} 完成，这里只负责参数解析、多根目录汇总与结果文本拼装。
 */
@Component
public class ResourceFinderMcpTools {

    private static final Logger log = LoggerFactory.getLogger(ResourceFinderMcpTools.class);

    /**
     * dataSourceIds 解析与 enhanced-results 序列化用的 JSON 工具。
     */
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final ProjectRootRegistry rootRegistry;
    private final SearchCoordinator coordinator;

    public ResourceFinderMcpTools(ProjectRootRegistry rootRegistry, SearchCoordinator coordinator) {
        this.rootRegistry = rootRegistry;
        this.coordinator = coordinator;
    }

    @Tool(
            name = "list_project_roots",
            description = "列出可查找的项目根目录（id + path）；find_resources 的 dataSourceIds 使用这里的 id。"
    )
    public ProjectRootsResult listProjectRoots() {
        return new ProjectRootsResult(rootRegistry.listRoots());
    }

    /**
     * 查找资源。
     * <p>
     * 规则：
     * <ul>
     *   <li>内容正则不合法时，该根目录返回 0 个命中并在 Errors 中给出诊断信息，不会中断其它根目录。</li>
     *   <li>根目录不存在同样记录到 Errors；未知的 rootId 体现在 toolResponse 的状态行里。</li>
     *   <li>传入的 rootId 全部未知时没有可查找的根目录，直接抛 {@link IllegalArgumentException}。</li>
     *   <li>日期、大小等参数格式错误直接抛 {@link IllegalArgumentException}，由框架转换成工具错误。</li>
     * </ul>
     */
    @Tool(
            name = "find_resources",
            description = "在项目根目录中查找资源：可组合路径 glob（resourcePattern）、内容正则（contentPattern）、"
                    + "修改日期（dateAfter/dateBefore，YYYY-MM-DD）与文件大小（sizeMin/sizeMax，字节）；全部条件都满足才算命中。"
    )
    public FindResourcesResult findResources(
            @ToolParam(required = false, description = "要查找的根目录 id，JSON 数组或逗号分隔（例如 [\"root0\"]；all 表示全部；为空默认第一个根目录）") String dataSourceIds,
            @ToolParam(required = false, description = "内容正则（Java 正则语法，默认忽略大小写，^/$ 按行匹配）") String contentPattern,
            @ToolParam(required = false, description = "内容正则是否区分大小写（默认 false）") Boolean caseSensitive,
            @ToolParam(required = false, description = "路径 glob，例如 *.ts、src/**/*.java、**/*.md|**/*.txt；不含 / 时匹配任意深度的文件名") String resourcePattern,
            @ToolParam(required = false, description = "只包含在此日期之后修改的文件（YYYY-MM-DD，不含当天零点）") String dateAfter,
            @ToolParam(required = false, description = "只包含在此日期之前修改的文件（YYYY-MM-DD）") String dateBefore,
            @ToolParam(required = false, description = "最小文件大小（字节，包含）") Long sizeMin,
            @ToolParam(required = false, description = "最大文件大小（字节，包含）") Long sizeMax,
            @ToolParam(required = false, description = "是否返回内容命中片段（需要 contentPattern；默认：提供 contentPattern 时为 true）") Boolean includeContent,
            @ToolParam(required = false, description = "片段上下文行数（默认 2，上限 10）") Integer contextLines,
            @ToolParam(required = false, description = "每个文件最多返回的片段数（默认 5，上限 20）") Integer maxMatchesPerFile
    ) {
        SearchCriteria criteria = SearchCriteriaParser.parse(new SearchCriteriaParser.RawCriteria(
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
        ));
        ProjectRootRegistry.Selection selection = rootRegistry.select(parseIds(dataSourceIds));
        if (selection.roots().isEmpty()) {
            throw new IllegalArgumentException("No valid data sources found: [" + String.join(", ", selection.notFound()) + "]");
        }
        String description = SearchCoordinator.describe(criteria);

        List<String> searched = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        List<String> resources = new ArrayList<>();
        List<ResourceContentMatches> enhancedMatches = new ArrayList<>();
        List<RootSearchResult> results = new ArrayList<>();

        for (Map.Entry<String, Path> entry : selection.roots().entrySet()) {
            String rootId = entry.getKey();
            SearchResult result;
            try {
                result = coordinator.search(entry.getValue(), criteria);
            } catch (RootNotFoundException e) {
                log.warn("项目根目录不可用：{} -> {}", rootId, e.getRoot());
                errors.add("[" + rootId + "]: " + e.getMessage());
                results.add(new RootSearchResult(rootId, 0, List.of(), e.getMessage(), false, null, null));
                continue;
            }
            searched.add(rootId);
            if (result.hasError()) {
                errors.add("[" + rootId + "]: " + result.errorMessage());
            }
            for (String path : result.paths()) {
                resources.add("[" + rootId + "] " + path);
            }
            for (ResourceContentMatches matches : result.contentMatches()) {
                enhancedMatches.add(new ResourceContentMatches("[" + rootId + "] " + matches.resourcePath(), matches.contentMatches()));
            }
            results.add(new RootSearchResult(
                    rootId,
                    result.count(),
                    result.paths(),
                    result.errorMessage(),
                    result.truncated(),
                    result.warnings().isEmpty() ? null : result.warnings(),
                    result.contentMatches().isEmpty() ? null : result.contentMatches()
            ));
        }

        String toolResults = composeToolResults(searched, errors, resources, enhancedMatches, description);
        String status = selection.notFound().isEmpty()
                ? "All data sources searched"
                : "Could not find data source for: [" + String.join(", ", selection.notFound()) + "]";
        String toolResponse = status + "\nFound " + resources.size() + " resources matching the search criteria: " + description;

        return new FindResourcesResult(
                description,
                resources.size(),
                searched,
                selection.notFound(),
                results,
                toolResults,
                toolResponse
        );
    }

    static String composeToolResults(
            List<String> searched,
            List<String> errors,
            List<String> resources,
            List<ResourceContentMatches> enhancedMatches,
            String description
    ) {
        StringBuilder sb = new StringBuilder();
        sb.append("Searched data sources: [").append(String.join(", ", searched)).append("]\n");
        if (!errors.isEmpty()) {
            sb.append("Errors:\n").append(String.join("\n", errors)).append("\n\n");
        }
        sb.append(resources.size()).append(" resources match the search criteria: ").append(description);
        if (!enhancedMatches.isEmpty()) {
            sb.append("\n\n<enhanced-results>\n")
                    .append(toJson(Map.of("matches", enhancedMatches)))
                    .append("\n</enhanced-results>");
        }
        if (!resources.isEmpty()) {
            sb.append("\n\n<resources>\n").append(String.join("\n", resources)).append("\n</resources>");
        }
        return sb.toString();
    }

    /**
     * 解析 dataSourceIds：支持 JSON 数组（{@code ["root0","root1"]}）、逗号分隔或单个 id。
     */
    static List<String> parseIds(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        String text = raw.trim();
        List<String> ids = new ArrayList<>();
        if (text.startsWith("[")) {
            JsonNode node;
            try {
                node = OBJECT_MAPPER.readTree(text);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("参数错误：dataSourceIds 不是合法的 JSON 数组：" + e.getOriginalMessage(), e);
            }
            if (node == null || !node.isArray()) {
                throw new IllegalArgumentException("参数错误：dataSourceIds 必须是字符串数组");
            }
            for (JsonNode item : node) {
                if (!item.isTextual()) {
                    throw new IllegalArgumentException("参数错误：dataSourceIds 只能包含字符串：" + item);
                }
                ids.add(item.asText());
            }
            return ids;
        }
        for (String part : text.split(",")) {
            if (!part.isBlank()) {
                ids.add(part.trim());
            }
        }
        return ids;
    }

    private static String toJson(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("序列化内容命中片段失败", e);
        }
    }
}
