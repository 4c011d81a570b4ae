package com.slpk.core.archive;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 基于 {@link ZipFile} 的压缩包，条目顺序与中央目录一致
 */
public class ZipPackageArchive implements PackageArchive {
    private static final Logger logger = LoggerFactory.getLogger(ZipPackageArchive.class);
    
    /** 未标记UTF-8的旧压缩包，条目名按ZIP规范的默认编码解析 */
    static final Charset LEGACY_NAME_CHARSET = Charset.forName("IBM437");
    
    private final ZipFile zipFile;
    private final List<? extends ZipEntry> entries;
    
    private ZipPackageArchive(ZipFile zipFile) {
        this.zipFile = zipFile;
        this.entries = Collections.list(zipFile.entries());
    }
    
    /**
     * 以只读方式打开ZIP文件
     * 
     * 条目名先按UTF-8解析；不是合法UTF-8时改用CP437重新打开。
     */
    public static ZipPackageArchive open(Path archivePath) throws IOException {
        ZipFile zipFile;
        try {
            zipFile = new ZipFile(archivePath.toFile());
        } catch (ZipException e) {
            logger.debug("[!] 按UTF-8打开失败，改用CP437解析条目名: {} ({})", archivePath, e.getMessage());
            try {
                zipFile = new ZipFile(archivePath.toFile(), LEGACY_NAME_CHARSET);
            } catch (ZipException legacyFailure) {
                legacyFailure.addSuppressed(e);
                throw legacyFailure;
            }
        }
        try {
            return new ZipPackageArchive(zipFile);
        } catch (RuntimeException e) {
            zipFile.close();
            throw e;
        }
    }
    
    @Override
    public int size() {
        return entries.size();
    }
    
    @Override
    public ArchiveEntry entryAt(int index) throws IOException {
        if (index < 0 || index >= entries.size()) {
            throw new IOException("条目索引越界: " + index + "，条目总数: " + entries.size());
        }
        ZipEntry entry = entries.get(index);
        return new ArchiveEntry(index, entry.getName(),
            new BufferedInputStream(zipFile.getInputStream(entry)));
    }
    
    @Override
    public void close() throws IOException {
        zipFile.close();
    }
}
