package com.slpk.util;

/**
 * 文件名扩展名处理
 * 
 * 扩展名是最后一个点之后的部分；以点开头且没有其他点的名字（如 .slpk）视为没有扩展名。
 */
public final class FileNames {
    
    private FileNames() {
    }
    
    /**
     * @return 扩展名（不含点），没有扩展名时返回 null
     */
    public static String extensionOf(String fileName) {
        int dot = lastDot(fileName);
        return dot < 0 ? null : fileName.substring(dot + 1);
    }
    
    /**
     * @return 去掉最后一个扩展名后的文件名，没有扩展名时原样返回
     */
    public static String stripExtension(String fileName) {
        int dot = lastDot(fileName);
        return dot < 0 ? fileName : fileName.substring(0, dot);
    }
    
    private static int lastDot(String fileName) {
        if (fileName == null) {
            return -1;
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? dot : -1;
    }
}
