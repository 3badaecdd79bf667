package org.resourcefinder.mcp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.resourcefinder.project.FinderProperties;
import org.resourcefinder.project.ProjectRootRegistry;
import org.resourcefinder.project.dto.FindResourcesResult;
import org.resourcefinder.project.dto.ProjectRoot;
import org.resourcefinder.project.dto.RootSearchResult;
import org.resourcefinder.search.SearchCoordinator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceFinderMcpToolsTest {

    @TempDir
    Path tempDir;

    private Path app;
    private Path docs;
    private ResourceFinderMcpTools tools;

    @BeforeEach
    void setUp() throws IOException {
        app = Files.createDirectories(tempDir.resolve("app"));
        docs = Files.createDirectories(tempDir.resolve("docs"));
        Files.writeString(app.resolve("file1.txt"), "Hello, World!");
        Files.createDirectories(app.resolve("subdir"));
        Files.writeString(app.resolve("subdir/file3.txt"), "Hello from subdir");
        Files.writeString(app.resolve("file2.js"), "console.log('hi');");
        Files.writeString(docs.resolve("guide.md"), "# Hello docs");

        FinderProperties properties = new FinderProperties();
        properties.setRoots(List.of(app.toString(), "docs=" + docs, "gone=" + tempDir.resolve("gone")));
        tools = new ResourceFinderMcpTools(new ProjectRootRegistry(properties), SearchCoordinator.defaults());
    }

    @Test
    void listProjectRoots_returnsConfiguredRoots() {
        assertThat(tools.listProjectRoots().roots())
                .extracting(ProjectRoot::id)
                .containsExactly("root0", "docs", "gone");
    }

    @Test
    void findResources_composesResultTextForDefaultRoot() {
        FindResourcesResult result = find(null, "Hello", "*.txt", false);

        assertThat(result.count()).isEqualTo(2);
        assertThat(result.searchedRoots()).containsExactly("root0");
        assertThat(result.toolResults())
                .startsWith("Searched data sources: [root0]\n2 resources match the search criteria: "
                        + "content pattern \"Hello\", case-insensitive, resource pattern \"*.txt\"\n\n<resources>\n")
                .contains("[root0] file1.txt", "[root0] subdir/file3.txt")
                .endsWith("</resources>")
                .doesNotContain("Errors:");
        assertThat(result.toolResponse()).isEqualTo("All data sources searched\n"
                + "Found 2 resources matching the search criteria: content pattern \"Hello\", case-insensitive, resource pattern \"*.txt\"");
    }

    @Test
    void findResources_aggregatesAcrossRootsAndReportsProblems() {
        FindResourcesResult result = find("[\"all\", \"nope\"]", "hello", null, false);

        assertThat(result.searchedRoots()).containsExactly("root0", "docs");
        assertThat(result.notFoundRoots()).containsExactly("nope");
        assertThat(result.count()).isEqualTo(3);
        assertThat(result.toolResults())
                .contains("Errors:\n[gone]: ")
                .contains("[docs] guide.md");
        assertThat(result.results()).extracting(RootSearchResult::rootId).containsExactly("root0", "docs", "gone");
        assertThat(result.toolResponse()).startsWith("Could not find data source for: [nope]\nFound 3 resources");
    }

    @Test
    void findResources_invalidRegexBecomesErrorLine() {
        FindResourcesResult result = find("root0", "[", null, false);

        assertThat(result.count()).isZero();
        assertThat(result.toolResults())
                .contains("Errors:\n[root0]: Invalid regular expression: /[/")
                .contains("0 resources match the search criteria: content pattern \"[\", case-insensitive")
                .doesNotContain("<resources>");
        assertThat(result.results().get(0).errorMessage()).startsWith("Invalid regular expression");
    }

    @Test
    void findResources_includeContentAddsEnhancedResults() {
        FindResourcesResult result = find("docs", "hello", null, true);

        assertThat(result.toolResults())
                .contains("<enhanced-results>")
                .contains("\"resourcePath\" : \"[docs] guide.md\"")
                .contains("\"lineNumber\" : 1");
        assertThat(result.results().get(0).contentMatches()).hasSize(1);
    }

    @Test
    void findResources_returnsExcerptsByDefaultForContentPattern() {
        FindResourcesResult result = tools.findResources("docs", "hello", null, null, null, null, null, null, null, null, null);

        assertThat(result.toolResults()).contains("<enhanced-results>", "\"resourcePath\" : \"[docs] guide.md\"");
    }

    @Test
    void findResources_rejectsSelectionWithoutAnyKnownRoot() {
        assertThatThrownBy(() -> find("[\"nope\", \"missing\"]", "hello", null, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No valid data sources found: [nope, missing]");
    }

    @Test
    void findResources_rejectsMalformedArguments() {
        assertThatThrownBy(() -> tools.findResources(null, null, null, null, "yesterday", null, null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dateAfter");
        assertThatThrownBy(() -> find("[1]", null, null, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dataSourceIds");
    }

    @Test
    void parseIds_acceptsJsonArrayOrCommaList() {
        assertThat(ResourceFinderMcpTools.parseIds("[\"root0\",\"docs\"]")).containsExactly("root0", "docs");
        assertThat(ResourceFinderMcpTools.parseIds("root0, docs")).containsExactly("root0", "docs");
        assertThat(ResourceFinderMcpTools.parseIds("  ")).isEmpty();
        assertThatThrownBy(() -> ResourceFinderMcpTools.parseIds("[\"root0\""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private FindResourcesResult find(String ids, String contentPattern, String resourcePattern, boolean includeContent) {
        return tools.findResources(ids, contentPattern, null, resourcePattern, null, null, null, null, includeContent, null, null);
    }
}
