package org.resourcefinder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ResourceFinderApplication {
    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(ResourceFinderApplication.class, args);
    }

    /**
     * 提前创建日志目录，规则与 logback-spring.xml 一致：系统属性/环境变量 LOG_PATH，默认 ./logs。
     * <p>
     * stdout 是 MCP 的传输通道，失败时只能写 stderr。
     */
    static Path ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        Path dir = Path.of(logPath);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            System.err.println("创建日志目录失败，文件日志可能不可用：" + dir + "（" + e.getMessage() + "）");
        }
        return dir;
    }
}
