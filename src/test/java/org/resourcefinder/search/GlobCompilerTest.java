package org.resourcefinder.search;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class GlobCompilerTest {

    @Test
    void compile_alternationMatchesAnyAlternative() {
        CompiledGlob glob = GlobCompiler.compile("*.js|*.ts");

        assertThat(glob.matches("a.js")).isTrue();
        assertThat(glob.matches("src/b.ts")).isTrue();
        assertThat(glob.matches("c.json")).isFalse();
    }

    @Test
    void compile_trimsAlternativesAndSkipsEmptyOnes() {
        CompiledGlob glob = GlobCompiler.compile(" *.md || src/*.js ");

        assertThat(glob.alternativeCount()).isEqualTo(2);
        assertThat(glob.matches("docs/readme.md")).isTrue();
        assertThat(glob.matches("src/app.js")).isTrue();
        assertThat(glob.matches("lib/app.js")).isFalse();
    }

    @Test
    void compile_directoryGlobstarMatchesEveryDepthBelowPrefix() {
        CompiledGlob glob = GlobCompiler.compile("deploy/Kubernetes/**/*");

        assertThat(glob.matches("deploy/Kubernetes/service.yaml")).isTrue();
        assertThat(glob.matches("deploy/Kubernetes/prod/eu/service.yaml")).isTrue();
        assertThat(glob.matches("deploy/Kubernetes")).isFalse();
        assertThat(glob.matches("deploy/Helm/service.yaml")).isFalse();
    }

    @Test
    void compile_leadingGlobstarMatchesFileNameAtAnyDepth() {
        CompiledGlob glob = GlobCompiler.compile("**/findResources*test.ts");

        assertThat(glob.matches("findResources.test.ts")).isTrue();
        assertThat(glob.matches("tools/findResources_test.ts")).isTrue();
        assertThat(glob.matches("api/src/tools/findResourcesTool.test.ts")).isTrue();
        assertThat(glob.matches("api/findResources.test.tsx")).isFalse();
    }

    @Test
    void compile_multipleGlobstarsBacktrackAcrossAllSplits() {
        CompiledGlob glob = GlobCompiler.compile("src/**/utils/**/*.ts");

        assertThat(glob.matches("src/utils/a.ts")).isTrue();
        assertThat(glob.matches("src/x/utils/y/z/a.ts")).isTrue();
        assertThat(glob.matches("src/x/utils/y/utils/a.ts")).isTrue();
        assertThat(glob.matches("src/x/a.ts")).isFalse();
    }

    @Test
    void compile_dualGlobstarMatchesInsideNamedDirectoryAtAnyDepth() {
        CompiledGlob glob = GlobCompiler.compile("**/findResources*/**/*.test.ts");

        assertThat(glob.matches("findResources.tool/tool.test.ts")).isTrue();
        assertThat(glob.matches("api/src/findResources.tool/tests/deep/nested/search.test.ts")).isTrue();
        assertThat(glob.matches("api/src/otherTool/tests/search.test.ts")).isFalse();
        assertThat(glob.matches("api/findResources.tool/search.ts")).isFalse();
    }

    @Test
    void compile_bareNameMatchesAtAnyDepthButNotAsSuffix() {
        CompiledGlob glob = GlobCompiler.compile("file2.js");

        assertThat(glob.matches("file2.js")).isTrue();
        assertThat(glob.matches("sub/dir/file2.js")).isTrue();
        assertThat(glob.matches("afile2.js")).isFalse();
        assertThat(glob.matches("file2.json")).isFalse();
    }

    @Test
    void compile_singleStarStaysWithinOneSegment() {
        CompiledGlob glob = GlobCompiler.compile("./src/*.js");

        assertThat(glob.matches("src/a.js")).isTrue();
        assertThat(glob.matches("src/nested/a.js")).isFalse();
    }

    @Test
    void compile_questionMarkMatchesExactlyOneCharacter() {
        CompiledGlob glob = GlobCompiler.compile("?.txt");

        assertThat(glob.matches("a.txt")).isTrue();
        assertThat(glob.matches("ab.txt")).isFalse();
    }

    @Test
    void compile_trailingSlashMeansWholeDirectory() {
        CompiledGlob glob = GlobCompiler.compile("src/");

        assertThat(glob.matches("src/a.js")).isTrue();
        assertThat(glob.matches("src/x/y.js")).isTrue();
        assertThat(glob.matches("srcx/a.js")).isFalse();
        assertThat(glob.matches("other/src/a.js")).isFalse();
    }

    @Test
    void compile_normalizesBackslashSeparators() {
        assertThat(GlobCompiler.compile("src\\*.js").matches("src/a.js")).isTrue();
    }

    @Test
    void compile_isCaseSensitive() {
        assertThat(GlobCompiler.compile("*.TXT").matches("a.txt")).isFalse();
    }

    @Test
    void compile_onlySeparatorsFallsBackToLiteral() {
        CompiledGlob glob = GlobCompiler.compile("|");

        assertThat(glob.isEmpty()).isFalse();
        assertThat(glob.matches("|")).isTrue();
        assertThat(glob.matches("a.txt")).isFalse();
    }

    @Test
    void compile_blankPatternMatchesNothing() {
        CompiledGlob glob = GlobCompiler.compile("   ");

        assertThat(glob.isEmpty()).isTrue();
        assertThat(glob.matches("a.txt")).isFalse();
    }

    @Test
    void compile_neverThrowsOnOddInput() {
        for (String pattern : List.of("[", "{a,b}", "*(", "**/**", "a/**/", "\\", "./", "/")) {
            assertThatCode(() -> GlobCompiler.compile(pattern).matches("a/b/c.txt")).doesNotThrowAnyException();
        }
    }

    @Test
    void couldMatchUnder_prunesOnlyImpossibleSubtrees() {
        CompiledGlob anchored = GlobCompiler.compile("deploy/Kubernetes/*");
        assertThat(anchored.couldMatchUnder("deploy")).isTrue();
        assertThat(anchored.couldMatchUnder("deploy/Kubernetes")).isTrue();
        assertThat(anchored.couldMatchUnder("deploy/Kubernetes/prod")).isFalse();
        assertThat(anchored.couldMatchUnder("docs")).isFalse();

        CompiledGlob deep = GlobCompiler.compile("src/**/*.ts");
        assertThat(deep.couldMatchUnder("src/a/b/c")).isTrue();
        assertThat(deep.couldMatchUnder("test")).isFalse();

        assertThat(GlobCompiler.compile("*.ts").couldMatchUnder("anything/at/all")).isTrue();
    }

    @Test
    void compileAll_combinesPatternsAsAlternatives() {
        CompiledGlob glob = GlobCompiler.compileAll(List.of("node_modules/", "*.log"));

        assertThat(glob.matches("node_modules/x/index.js")).isTrue();
        assertThat(glob.matches("logs/app.log")).isTrue();
        assertThat(glob.matches("src/app.js")).isFalse();
    }
}
