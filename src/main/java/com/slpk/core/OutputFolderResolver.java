package com.slpk.core;

import com.slpk.util.FileNames;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 计算并准备解包目录
 * 
 * 解包目录与SLPK文件同级，名称为去掉扩展名的文件名，例如 a/b/pkg.slpk 解包到 a/b/pkg。
 */
public class OutputFolderResolver {
    private static final Logger logger = LoggerFactory.getLogger(OutputFolderResolver.class);
    
    /**
     * 计算解包目录并创建一个空目录
     * 
     * 已存在的同名目录会被整体删除后重建，重复解包同一个文件结果一致。
     * 已存在同名的普通文件时不会覆盖。
     *
     * @param archivePath SLPK文件路径
     * @return 新建的空解包目录
     * @throws UnpackException 文件没有扩展名、目标位置被文件占用或目录操作失败
     */
    public Path resolve(Path archivePath) throws UnpackException {
        Path fileName = archivePath.getFileName();
        String extension = fileName == null ? null : FileNames.extensionOf(fileName.toString());
        if (extension == null) {
            throw new UnpackException(UnpackException.Reason.NO_EXTENSION,
                "SLPK文件没有扩展名，无法确定解包目录: " + archivePath);
        }
        
        Path unpackFolder = archivePath.resolveSibling(FileNames.stripExtension(fileName.toString()));
        
        try {
            if (Files.isDirectory(unpackFolder)) {
                logger.info("[+] 删除已有目录: {}", unpackFolder);
                FileUtils.deleteDirectory(unpackFolder.toFile());
            } else if (Files.exists(unpackFolder)) {
                // 不覆盖无关文件
                throw new UnpackException(UnpackException.Reason.OUTPUT_IS_FILE,
                    "解包目录已被同名文件占用: " + unpackFolder);
            }
            
            Files.createDirectory(unpackFolder);
        } catch (IOException e) {
            throw new UnpackException(UnpackException.Reason.OUTPUT_FOLDER_FAILED,
                "无法准备解包目录 " + unpackFolder + ": " + e.getMessage(), e);
        }
        
        return unpackFolder;
    }
}
