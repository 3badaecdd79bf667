package org.resourcefinder.project;

import org.resourcefinder.search.ContentMatchExtractor;
import org.resourcefinder.search.DirectoryWalker;
import org.resourcefinder.search.SearchCoordinator;
import org.resourcefinder.search.StreamingContentSearcher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 资源查找服务的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>把配置 {@link FinderProperties} 注入到根目录注册表与查找引擎中。</li>
 *   <li>这里不引入任何数据库/外部依赖，全部基于本地文件系统。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class FinderConfiguration {

    @Bean
    public ProjectRootRegistry projectRootRegistry(FinderProperties properties) {
        return new ProjectRootRegistry(properties);
    }

    /**
     * 内容扫描线程池：线程按需创建，{@code app.finder.content-search-threads} 为 1 时不会被使用。
     * <p>
     * 队列有界，满了由调用线程自己执行，避免同时打开过多文件句柄。
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService contentSearchExecutor(FinderProperties properties) {
        int threads = Math.max(2, properties.getContentSearchThreads());
        AtomicInteger counter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread thread = new Thread(r, "content-search-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(
                threads,
                threads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(threads * 64),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    @Bean
    public SearchCoordinator searchCoordinator(FinderProperties properties, @Qualifier("contentSearchExecutor") ExecutorService executor) {
        DirectoryWalker walker = new DirectoryWalker(
                properties.isIncludeHidden(),
                properties.isAllowSymlink(),
                properties.getMaxFiles()
        );
        StreamingContentSearcher contentSearcher = new StreamingContentSearcher(
                Math.toIntExact(properties.getContentChunkSize().toBytes()),
                Math.toIntExact(properties.getContentOverlapSize().toBytes())
        );
        ContentMatchExtractor matchExtractor = new ContentMatchExtractor(
                properties.getMaxLineLength(),
                properties.getContentExtractMaxBytes().toBytes()
        );
        return new SearchCoordinator(
                walker,
                contentSearcher,
                matchExtractor,
                properties.getExcludePatterns(),
                properties.isRespectIgnoreFiles(),
                properties.getMaxWarnings(),
                properties.getContentSearchThreads() > 1 ? executor : null
        );
    }
}
