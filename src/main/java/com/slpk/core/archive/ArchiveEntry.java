package com.slpk.core.archive;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * 压缩包中的一个条目
 * 
 * 数据流只能读取一次，用完即关闭，不做缓存。
 */
public class ArchiveEntry implements Closeable {
    private final int index;
    private final String name;
    private final InputStream stream;
    
    public ArchiveEntry(int index, String name, InputStream stream) {
        this.index = index;
        this.name = name;
        this.stream = stream;
    }
    
    public int getIndex() {
        return index;
    }
    
    /**
     * 压缩包中存储的原始条目名
     */
    public String getName() {
        return name;
    }
    
    /**
     * 规范化后的条目路径
     * 
     * Windows分隔符\统一为/，去掉空段、"." 和 ".." 段，保留开头的 /，
     * 例如 ../a/./b.txt 变为 a/b.txt，/etc/passwd 保持不变。
     */
    public String getPath() {
        String normalized = name.replace('\\', '/');
        StringBuilder path = new StringBuilder();
        if (normalized.startsWith("/")) {
            path.append('/');
        }
        for (String segment : normalized.split("/")) {
            if (segment.isEmpty() || ".".equals(segment) || "..".equals(segment)) {
                continue;
            }
            if (path.length() > 0 && path.charAt(path.length() - 1) != '/') {
                path.append('/');
            }
            path.append(segment);
        }
        return path.toString();
    }
    
    /**
     * ZIP中目录条目以/结尾
     */
    public boolean isDirectory() {
        String normalized = name.replace('\\', '/');
        return normalized.length() > 1 && normalized.endsWith("/");
    }
    
    public InputStream getStream() {
        return stream;
    }
    
    @Override
    public void close() throws IOException {
        stream.close();
    }
    
    @Override
    public String toString() {
        return String.format("#%d %s", index, name);
    }
}
