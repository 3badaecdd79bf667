package org.resourcefinder.search;

import java.nio.file.Path;

/**
 * 项目根目录不存在或不是目录：唯一会中止整次查找的错误。
 */
public class RootNotFoundException extends RuntimeException {

    private final transient Path root;

    public RootNotFoundException(Path root) {
        super("项目根目录不存在或不是目录：" + root);
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }
}
