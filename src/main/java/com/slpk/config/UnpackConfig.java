package com.slpk.config;

/**
 * 解包配置，启动时确定一次后不再变化
 */
public final class UnpackConfig {
    private final int workerCount;
    private final boolean verbose;
    
    public UnpackConfig(int workerCount, boolean verbose) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("线程数至少为1: " + workerCount);
        }
        this.workerCount = workerCount;
        this.verbose = verbose;
    }
    
    /**
     * 每个CPU核心一个线程
     */
    static int availableProcessors() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }
    
    public int getWorkerCount() {
        return workerCount;
    }
    
    public boolean isVerbose() {
        return verbose;
    }
    
    public UnpackConfig withVerbose(boolean verbose) {
        return new UnpackConfig(workerCount, verbose);
    }
    
    @Override
    public String toString() {
        return String.format("workers=%d, verbose=%s", workerCount, verbose);
    }
}
