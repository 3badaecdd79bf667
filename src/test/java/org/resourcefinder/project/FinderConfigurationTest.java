package org.resourcefinder.project;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.resourcefinder.search.SearchCoordinator;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.util.unit.DataSize;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FinderConfigurationTest {

    @TempDir
    Path tempDir;

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(TestConfiguration.class);

    @Test
    void bindsPropertiesAndWiresCoordinator() {
        runner.withPropertyValues(
                "app.finder.roots[0]=docs=" + tempDir,
                "app.finder.content-chunk-size=16KB",
                "app.finder.content-search-threads=4"
        ).run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(SearchCoordinator.class);
            FinderProperties properties = context.getBean(FinderProperties.class);
            assertThat(properties.getContentChunkSize()).isEqualTo(DataSize.ofKilobytes(16));
            assertThat(properties.isIncludeHidden()).isTrue();
            assertThat(context.getBean(ProjectRootRegistry.class).listRoots())
                    .singleElement()
                    .satisfies(root -> assertThat(root.id()).isEqualTo("docs"));
        });
    }

    @Test
    void rejectsOutOfRangeValues() {
        runner.withPropertyValues("app.finder.max-line-length=5")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void rejectsContentBuffersThatDoNotFitInMemory() {
        runner.withPropertyValues("app.finder.content-overlap-size=4GB")
                .run(context -> assertThat(context).hasFailed());
        runner.withPropertyValues("app.finder.content-chunk-size=8B")
                .run(context -> assertThat(context).hasFailed());
        runner.withPropertyValues("app.finder.content-overlap-size=64MB")
                .run(context -> assertThat(context).hasNotFailed());
    }

    @Test
    void maxFilesIsUnlimitedByDefault() {
        runner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context.getBean(FinderProperties.class).getMaxFiles()).isZero();
        });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(FinderProperties.class)
    @Import(FinderConfiguration.class)
    static class TestConfiguration {
    }
}
