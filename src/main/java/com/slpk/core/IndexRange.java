package com.slpk.core;

/**
 * 条目索引区间 [start, end)
 */
public final class IndexRange {
    private final int start;
    private final int end;
    
    public IndexRange(int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("非法区间: [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }
    
    public int getStart() {
        return start;
    }
    
    public int getEnd() {
        return end;
    }
    
    public int size() {
        return end - start;
    }
    
    public boolean isEmpty() {
        return start == end;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndexRange)) {
            return false;
        }
        IndexRange other = (IndexRange) o;
        return start == other.start && end == other.end;
    }
    
    @Override
    public int hashCode() {
        return 31 * start + end;
    }
    
    @Override
    public String toString() {
        return String.format("[%d, %d)", start, end);
    }
}
