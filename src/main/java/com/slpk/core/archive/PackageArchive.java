package com.slpk.core.archive;

import java.io.Closeable;
import java.io.IOException;

/**
 * 可按索引随机读取条目的压缩包
 * 
 * 同一个实例不保证线程安全，每个解包线程应各自打开一个。
 * 对同一文件打开的多个实例，条目数量和顺序一致。
 */
public interface PackageArchive extends Closeable {
    
    /**
     * @return 条目数量
     */
    int size();
    
    /**
     * 读取指定位置的条目
     *
     * @param index 从0开始的条目索引
     * @return 条目，调用方负责关闭
     * @throws IOException 索引越界或条目数据损坏
     */
    ArchiveEntry entryAt(int index) throws IOException;
}
