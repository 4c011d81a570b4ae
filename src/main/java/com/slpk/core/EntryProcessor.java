package com.slpk.core;

import com.slpk.core.archive.ArchiveEntry;
import com.slpk.util.FileNames;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.zip.GZIPInputStream;

/**
 * 把一个压缩包条目写到解包目录下
 * 
 * .gz 条目解压后写出（去掉 .gz 后缀），其中 .json.gz 还会格式化为两空格缩进的JSON；
 * 其他条目原样复制。
 */
public class EntryProcessor {
    private static final Logger logger = LoggerFactory.getLogger(EntryProcessor.class);
    
    private static final String GZIP_EXTENSION = "gz";
    private static final String JSON_EXTENSION = "json";
    
    private final boolean verbose;
    
    public EntryProcessor(boolean verbose) {
        this.verbose = verbose;
    }
    
    /**
     * 处理一个条目
     *
     * @param entry 压缩包条目，数据流由调用方关闭
     * @param unpackFolder 解包目录
     * @return 处理结果
     * @throws UnpackException 路径不安全，或写文件、解压、格式化失败
     */
    public EntryOutcome process(ArchiveEntry entry, Path unpackFolder) throws UnpackException {
        Path entryPath = toPath(entry);
        Path parent = entryPath.getParent();
        Path fileName = entryPath.getFileName();
        
        if (parent != null && parent.isAbsolute()) {
            throw new UnpackException(UnpackException.Reason.ABSOLUTE_ENTRY_PATH,
                "不解压绝对路径的条目: " + entry.getName());
        }
        
        if (parent == null && (fileName == null || fileName.toString().isEmpty())) {
            // TODO: 空条目名可能意味着压缩包损坏，考虑改为报错
            logger.debug("[!] 跳过空条目名: {}", entry);
            return EntryOutcome.SKIPPED;
        }
        
        Path root = unpackFolder.toAbsolutePath().normalize();
        Path targetFolder = parent == null ? root : root.resolve(parent).normalize();
        
        try {
            if (entry.isDirectory()) {
                Path directory = checkInsideRoot(entry, root, targetFolder.resolve(fileName));
                Files.createDirectories(directory);
                return EntryOutcome.DIRECTORY_CREATED;
            }
            
            String name = fileName.toString();
            if (GZIP_EXTENSION.equals(FileNames.extensionOf(name))) {
                String plainName = FileNames.stripExtension(name);
                Path target = checkInsideRoot(entry, root, targetFolder.resolve(plainName));
                createParentFolder(root, targetFolder);
                return decompress(entry, plainName, target);
            }
            
            Path target = checkInsideRoot(entry, root, targetFolder.resolve(name));
            createParentFolder(root, targetFolder);
            return copy(entry, target);
        } catch (IOException e) {
            throw new UnpackException(UnpackException.Reason.ENTRY_FAILED,
                "解包条目失败 " + entry.getName() + ": " + e.getMessage(), e);
        }
    }
    
    private EntryOutcome decompress(ArchiveEntry entry, String plainName, Path target) throws IOException {
        if (verbose) {
            logger.info("[+] 解压: {} -> {}", entry.getName(), target);
        }
        
        try (InputStream gzipStream = new GZIPInputStream(entry.getStream());
             OutputStream out = new BufferedOutputStream(Files.newOutputStream(target))) {
            
            // JSON文件格式化输出
            if (JSON_EXTENSION.equals(FileNames.extensionOf(plainName))) {
                JsonReformatter.reformat(gzipStream, out);
                return EntryOutcome.JSON_REFORMATTED;
            }
            
            IOUtils.copy(gzipStream, out);
            return EntryOutcome.DECOMPRESSED;
        }
    }
    
    private EntryOutcome copy(ArchiveEntry entry, Path target) throws IOException {
        if (verbose) {
            logger.info("[+] 复制: {} -> {}", entry.getName(), target);
        }
        
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(target))) {
            IOUtils.copy(entry.getStream(), out);
        }
        return EntryOutcome.COPIED;
    }
    
    /**
     * 创建条目的父目录；目录已存在（包括被其他线程同时创建）视为成功
     */
    private static void createParentFolder(Path root, Path targetFolder) throws IOException {
        if (!targetFolder.equals(root)) {
            Files.createDirectories(targetFolder);
        }
    }
    
    /**
     * 防止ZIP路径遍历：目标必须位于解包目录内部（条目路径已去掉 .. 段，这里兜底）
     */
    private static Path checkInsideRoot(ArchiveEntry entry, Path root, Path target) throws UnpackException {
        Path normalized = target.normalize();
        if (!normalized.startsWith(root) || normalized.equals(root)) {
            throw new UnpackException(UnpackException.Reason.ENTRY_OUTSIDE_OUTPUT_ROOT,
                "条目路径越出解包目录: " + entry.getName());
        }
        return normalized;
    }
    
    private static Path toPath(ArchiveEntry entry) throws UnpackException {
        try {
            return Paths.get(entry.getPath());
        } catch (InvalidPathException e) {
            throw new UnpackException(UnpackException.Reason.INVALID_ENTRY_NAME,
                "非法的条目名: " + entry.getName(), e);
        }
    }
}
