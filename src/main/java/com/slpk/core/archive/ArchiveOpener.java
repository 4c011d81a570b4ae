package com.slpk.core.archive;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 打开压缩包
 */
@FunctionalInterface
public interface ArchiveOpener {
    
    /**
     * @param archivePath 压缩包路径
     * @return 新打开的压缩包，调用方负责关闭
     * @throws IOException 文件不可读或不是合法的压缩包
     */
    PackageArchive open(Path archivePath) throws IOException;
}
