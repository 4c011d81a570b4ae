package com.slpk.core;

/**
 * 单个条目的处理结果
 */
public enum EntryOutcome {
    /** 原样复制 */
    COPIED,
    /** gzip解压后原样写出 */
    DECOMPRESSED,
    /** gzip解压并格式化为JSON */
    JSON_REFORMATTED,
    /** 目录条目，仅创建目录 */
    DIRECTORY_CREATED,
    /** 条目名为空，未写出任何文件 */
    SKIPPED;
    
    /**
     * 是否计入解包数量
     */
    public boolean isUnpacked() {
        return this != SKIPPED;
    }
}
