package com.slpk.core;

/**
 * 一个解包线程的结果：已写出的条目数，以及可能出现的第一个错误
 */
final class WorkerResult {
    private final IndexRange range;
    private final int entriesUnpacked;
    private final UnpackException failure;
    
    private WorkerResult(IndexRange range, int entriesUnpacked, UnpackException failure) {
        this.range = range;
        this.entriesUnpacked = entriesUnpacked;
        this.failure = failure;
    }
    
    static WorkerResult success(IndexRange range, int entriesUnpacked) {
        return new WorkerResult(range, entriesUnpacked, null);
    }
    
    static WorkerResult failure(IndexRange range, int entriesUnpacked, UnpackException failure) {
        return new WorkerResult(range, entriesUnpacked, failure);
    }
    
    IndexRange getRange() {
        return range;
    }
    
    int getEntriesUnpacked() {
        return entriesUnpacked;
    }
    
    boolean isFailed() {
        return failure != null;
    }
    
    UnpackException getFailure() {
        return failure;
    }
}
