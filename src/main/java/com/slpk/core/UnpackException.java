package com.slpk.core;

import com.slpk.SlpkException;

/**
 * 解包失败
 * 
 * 通过 {@link Reason} 区分失败原因。多线程解包失败时，
 * {@link #getEntriesUnpacked()} 记录各线程已成功写出的条目数。
 */
public class UnpackException extends SlpkException {
    
    public enum Reason {
        /** SLPK文件没有扩展名，无法确定解包目录 */
        NO_EXTENSION,
        /** 解包目录位置已存在同名文件 */
        OUTPUT_IS_FILE,
        /** 无法创建或清理解包目录 */
        OUTPUT_FOLDER_FAILED,
        /** 无法打开或读取压缩包 */
        INVALID_ARCHIVE,
        /** 条目的父路径是绝对路径 */
        ABSOLUTE_ENTRY_PATH,
        /** 条目路径越出解包目录 */
        ENTRY_OUTSIDE_OUTPUT_ROOT,
        /** 条目名无法转换为本地路径 */
        INVALID_ENTRY_NAME,
        /** 写文件、解压或JSON格式化失败 */
        ENTRY_FAILED
    }
    
    private final Reason reason;
    private volatile int entriesUnpacked;
    
    public UnpackException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
    
    public UnpackException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
    
    public Reason getReason() {
        return reason;
    }
    
    /**
     * 失败前所有线程共写出的条目数
     */
    public int getEntriesUnpacked() {
        return entriesUnpacked;
    }
    
    void setEntriesUnpacked(int entriesUnpacked) {
        this.entriesUnpacked = entriesUnpacked;
    }
}
