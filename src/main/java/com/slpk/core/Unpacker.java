package com.slpk.core;

import com.slpk.config.UnpackConfig;
import com.slpk.core.archive.ArchiveEntry;
import com.slpk.core.archive.ArchiveOpener;
import com.slpk.core.archive.PackageArchive;
import com.slpk.core.archive.ZipPackageArchive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 多线程解包SLPK文件
 * 
 * 条目按索引切分给固定数量的线程，每个线程各自打开一份压缩包，
 * 按升序处理自己的区间。所有线程结束后汇总结果：全部成功返回解包总数，
 * 否则抛出第一个错误（其余错误作为 suppressed 附加）。
 */
public class Unpacker {
    private static final Logger logger = LoggerFactory.getLogger(Unpacker.class);
    
    private final UnpackConfig config;
    private final ArchiveOpener archiveOpener;
    private final OutputFolderResolver folderResolver;
    private final EntryProcessor entryProcessor;
    
    public Unpacker(UnpackConfig config) {
        this(config, ZipPackageArchive::open);
    }
    
    public Unpacker(UnpackConfig config, ArchiveOpener archiveOpener) {
        this(config, archiveOpener, new OutputFolderResolver(), new EntryProcessor(config.isVerbose()));
    }
    
    Unpacker(UnpackConfig config, ArchiveOpener archiveOpener,
             OutputFolderResolver folderResolver, EntryProcessor entryProcessor) {
        this.config = config;
        this.archiveOpener = archiveOpener;
        this.folderResolver = folderResolver;
        this.entryProcessor = entryProcessor;
    }
    
    /**
     * 解包SLPK文件到同级的同名目录
     *
     * @param archivePath SLPK文件路径
     * @return 解包的条目数
     * @throws UnpackException 压缩包无法打开、解包目录无法准备，或有条目处理失败
     * @throws FatalUnpackException 解包线程异常终止
     */
    public int unpack(Path archivePath) throws UnpackException {
        logger.info("[+] 解包SLPK文件: {}", archivePath);
        
        int entryCount;
        try (PackageArchive archive = openArchive(archivePath)) {
            entryCount = archive.size();
        } catch (IOException e) {
            throw new UnpackException(UnpackException.Reason.INVALID_ARCHIVE,
                "无法读取压缩包 " + archivePath + ": " + e.getMessage(), e);
        }
        
        Path unpackFolder = folderResolver.resolve(archivePath);
        
        List<IndexRange> ranges = RangeSplitter.split(entryCount, config.getWorkerCount());
        logger.debug("[+] {} 个条目，切分为 {}", entryCount, ranges);
        
        List<WorkerResult> results = runWorkers(archivePath, unpackFolder, ranges);
        
        int totalUnpacked = 0;
        UnpackException firstFailure = null;
        for (WorkerResult result : results) {
            totalUnpacked += result.getEntriesUnpacked();
            if (!result.isFailed()) {
                continue;
            }
            logger.error("[!] 区间 {} 解包失败: {}", result.getRange(), result.getFailure().getMessage());
            if (firstFailure == null) {
                firstFailure = result.getFailure();
            } else {
                firstFailure.addSuppressed(result.getFailure());
            }
        }
        
        if (firstFailure != null) {
            firstFailure.setEntriesUnpacked(totalUnpacked);
            throw firstFailure;
        }
        
        logger.info("[+] 共解包 {} 个文件", totalUnpacked);
        return totalUnpacked;
    }
    
    private List<WorkerResult> runWorkers(Path archivePath, Path unpackFolder, List<IndexRange> ranges) {
        List<IndexRange> work = new ArrayList<>();
        for (IndexRange range : ranges) {
            if (!range.isEmpty()) {
                work.add(range);
            }
        }
        if (work.isEmpty()) {
            return new ArrayList<>();
        }
        
        ExecutorService executor = Executors.newFixedThreadPool(work.size(), new WorkerThreadFactory());
        try {
            List<Future<WorkerResult>> futures = new ArrayList<>(work.size());
            for (IndexRange range : work) {
                futures.add(executor.submit(() -> unpackRange(archivePath, unpackFolder, range)));
            }
            
            // 等待所有线程结束，不提前取消
            List<WorkerResult> results = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    throw new FatalUnpackException("解包线程异常终止，区间 " + work.get(i), e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new FatalUnpackException("等待解包线程时被中断", e);
                }
            }
            return results;
        } finally {
            executor.shutdown();
        }
    }
    
    private WorkerResult unpackRange(Path archivePath, Path unpackFolder, IndexRange range) {
        int unpacked = 0;
        int index = range.getStart();
        
        // 每个线程使用独立的压缩包句柄
        try (PackageArchive archive = openArchive(archivePath)) {
            for (; index < range.getEnd(); index++) {
                try (ArchiveEntry entry = archive.entryAt(index)) {
                    if (entryProcessor.process(entry, unpackFolder).isUnpacked()) {
                        unpacked++;
                    }
                }
            }
            return WorkerResult.success(range, unpacked);
        } catch (UnpackException e) {
            return WorkerResult.failure(range, unpacked, e);
        } catch (IOException e) {
            return WorkerResult.failure(range, unpacked, new UnpackException(
                UnpackException.Reason.INVALID_ARCHIVE,
                "读取第 " + index + " 个条目失败: " + e.getMessage(), e));
        }
    }
    
    private PackageArchive openArchive(Path archivePath) throws IOException {
        return archiveOpener.open(archivePath);
    }
    
    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();
        
        @Override
        public Thread newThread(Runnable r) {
            return new Thread(r, "slpk-unpack-" + counter.incrementAndGet());
        }
    }
}
