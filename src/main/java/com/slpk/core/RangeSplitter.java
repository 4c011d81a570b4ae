package com.slpk.core;

import java.util.ArrayList;
import java.util.List;

/**
 * 将条目索引切分为连续、均衡的区间，每个解包线程一个
 */
public class RangeSplitter {
    
    /**
     * 把 [0, total) 切分为 workers 个区间
     * 
     * 每个区间大小为 total/workers 或再多一个，较大的区间排在前面。
     * total 小于 workers 时后面的区间为空。
     * 
     * @param total 条目总数
     * @param workers 线程数
     * @return 按顺序排列的区间，首尾相接
     */
    public static List<IndexRange> split(int total, int workers) {
        if (total < 0) {
            throw new IllegalArgumentException("条目数不能为负数: " + total);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("线程数至少为1: " + workers);
        }
        
        int baseSize = total / workers;
        int remainder = total % workers;
        
        List<IndexRange> ranges = new ArrayList<>(workers);
        int start = 0;
        for (int i = 0; i < workers; i++) {
            int size = i < remainder ? baseSize + 1 : baseSize;
            ranges.add(new IndexRange(start, start + size));
            start += size;
        }
        return ranges;
    }
}
