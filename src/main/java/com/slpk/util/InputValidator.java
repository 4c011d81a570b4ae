package com.slpk.util;

import java.io.File;

/**
 * 输入验证工具类
 * 验证用户输入的文件路径
 */
public class InputValidator {
    
    /**
     * 验证SLPK文件路径
     * 
     * @param archivePath SLPK文件路径
     * @throws IllegalArgumentException 如果验证失败
     */
    public static void validateArchiveFile(String archivePath) {
        if (archivePath == null || archivePath.trim().isEmpty()) {
            throw new IllegalArgumentException("SLPK文件路径不能为空");
        }
        
        File file = new File(archivePath);
        
        // 1. 检查文件是否存在
        if (!file.exists()) {
            throw new IllegalArgumentException("文件不存在: " + archivePath);
        }
        
        // 2. 检查是否是文件（不是目录）
        if (!file.isFile()) {
            throw new IllegalArgumentException("路径不是文件: " + archivePath);
        }
        
        // 3. 检查文件是否可读
        if (!file.canRead()) {
            throw new IllegalArgumentException("文件不可读: " + archivePath);
        }
    }
}
