package com.slpk.core;

import com.slpk.TestArchives;
import com.slpk.config.UnpackConfig;
import com.slpk.core.archive.ArchiveEntry;
import com.slpk.core.archive.PackageArchive;
import com.slpk.core.archive.ZipPackageArchive;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@DisplayName("多线程解包测试")
public class UnpackerTest {
    
    @TempDir
    Path tempDir;
    
    private static final String LAYER_JSON = "{\"id\":0,\"layerType\":\"IntegratedMesh\",\"store\":{\"version\":\"1.8\"}}";
    
    private Path buildSceneLayerPackage(String fileName, int nodeCount) throws IOException {
        TestArchives archive = TestArchives.builder()
            .add("metadata.json", "{\"folderPattern\":\"basic\"}")
            .addGzip("3dSceneLayer.json.gz", LAYER_JSON);
        for (int i = 0; i < nodeCount; i++) {
            archive.addGzip("nodes/" + i + "/3dNodeIndexDocument.json.gz", "{\"id\":\"" + i + "\",\"level\":" + (i % 4) + "}");
            archive.addGzip("nodes/" + i + "/geometries/0.bin.gz", new byte[] {(byte) i, 1, 2, 3});
        }
        return archive.writeTo(tempDir.resolve(fileName));
    }
    
    private static Map<String, String> snapshot(Path folder) throws IOException {
        Map<String, String> tree = new TreeMap<>();
        try (Stream<Path> paths = Files.walk(folder)) {
            for (Path path : paths.filter(Files::isRegularFile).collect(Collectors.toList())) {
                tree.put(folder.relativize(path).toString().replace('\\', '/'),
                    new String(Files.readAllBytes(path), StandardCharsets.ISO_8859_1));
            }
        }
        return tree;
    }
    
    @Test
    @DisplayName("所有条目都被解包到同名目录")
    public void testUnpackWholePackage() throws Exception {
        Path slpk = buildSceneLayerPackage("city.slpk", 20);
        
        int unpacked = new Unpacker(new UnpackConfig(4, false)).unpack(slpk);
        
        assertEquals(42, unpacked);
        Path folder = tempDir.resolve("city");
        Map<String, String> tree = snapshot(folder);
        assertEquals(42, tree.size());
        assertEquals("{\"folderPattern\":\"basic\"}", tree.get("metadata.json"), "未压缩的文件应原样复制");
        assertTrue(tree.get("3dSceneLayer.json").startsWith("{\n  \"id\": 0,"));
        assertTrue(tree.containsKey("nodes/19/3dNodeIndexDocument.json"));
        assertArrayEquals(new byte[] {19, 1, 2, 3},
            Files.readAllBytes(folder.resolve("nodes/19/geometries/0.bin")));
    }
    
    @Test
    @DisplayName("线程数多于条目数时结果不变")
    public void testMoreWorkersThanEntries() throws Exception {
        Path slpk = buildSceneLayerPackage("small.slpk", 1);
        assertEquals(4, new Unpacker(new UnpackConfig(16, true)).unpack(slpk));
    }
    
    @Test
    @DisplayName("空压缩包只创建空目录")
    public void testEmptyArchive() throws Exception {
        Path slpk = TestArchives.builder().writeTo(tempDir.resolve("empty.slpk"));
        
        assertEquals(0, new Unpacker(new UnpackConfig(3, false)).unpack(slpk));
        assertTrue(Files.isDirectory(tempDir.resolve("empty")));
    }
    
    @Test
    @DisplayName("重复解包结果一致")
    public void testUnpackTwiceIsIdempotent() throws Exception {
        Path slpk = buildSceneLayerPackage("twice.slpk", 10);
        Unpacker unpacker = new Unpacker(new UnpackConfig(3, false));
        
        unpacker.unpack(slpk);
        Map<String, String> first = snapshot(tempDir.resolve("twice"));
        Files.write(tempDir.resolve("twice/extra.txt"), new byte[] {9});
        unpacker.unpack(slpk);
        Map<String, String> second = snapshot(tempDir.resolve("twice"));
        
        assertEquals(first, second);
    }
    
    @Test
    @DisplayName("一个线程失败时其他线程照常完成，并报告失败")
    public void testFailingWorkerDoesNotStopOthers() throws Exception {
        // 两个线程：[0, 2) 中 blocker 是文件，blocker/x.txt 无法创建目录；[2, 4) 正常
        Path slpk = TestArchives.builder()
            .add("blocker", "file")
            .add("blocker/x.txt", "x")
            .add("a.txt", "a")
            .add("b.txt", "b")
            .writeTo(tempDir.resolve("partial.slpk"));
        
        UnpackException e = assertThrows(UnpackException.class,
            () -> new Unpacker(new UnpackConfig(2, false)).unpack(slpk));
        
        assertEquals(UnpackException.Reason.ENTRY_FAILED, e.getReason());
        assertEquals(3, e.getEntriesUnpacked(), "失败前写出的条目数应少于条目总数");
        Path folder = tempDir.resolve("partial");
        assertEquals("a", new String(Files.readAllBytes(folder.resolve("a.txt")), StandardCharsets.UTF_8));
        assertEquals("b", new String(Files.readAllBytes(folder.resolve("b.txt")), StandardCharsets.UTF_8));
    }
    
    @Test
    @DisplayName("多个线程失败时返回第一个错误，其余作为suppressed")
    public void testFirstFailureWins() throws Exception {
        Path slpk = TestArchives.builder()
            .add("/abs/one.txt", "1")
            .add("ok.txt", "ok")
            .add("/abs/two.txt", "2")
            .writeTo(tempDir.resolve("bad.slpk"));
        
        UnpackException e = assertThrows(UnpackException.class,
            () -> new Unpacker(new UnpackConfig(3, false)).unpack(slpk));
        
        assertEquals(UnpackException.Reason.ABSOLUTE_ENTRY_PATH, e.getReason());
        assertTrue(e.getMessage().contains("/abs/one.txt"), "应返回第一个区间的错误");
        assertEquals(1, e.getSuppressed().length);
        assertTrue(e.getSuppressed()[0].getMessage().contains("/abs/two.txt"));
        assertEquals(1, e.getEntriesUnpacked());
        assertFalse(Files.exists(tempDir.resolve("bad/abs")));
    }
    
    @Test
    @DisplayName("带..的条目写在解包目录内，同一线程的后续条目照常处理")
    public void testDotDotEntryDoesNotStopRange() throws Exception {
        Path slpk = TestArchives.builder()
            .add("../escape.txt", "e")
            .add("a.txt", "a")
            .add("b.txt", "b")
            .writeTo(tempDir.resolve("dots.slpk"));
        
        assertEquals(3, new Unpacker(new UnpackConfig(1, false)).unpack(slpk));
        
        Path folder = tempDir.resolve("dots");
        assertEquals("e", new String(Files.readAllBytes(folder.resolve("escape.txt")), StandardCharsets.UTF_8));
        assertTrue(Files.isRegularFile(folder.resolve("a.txt")));
        assertTrue(Files.isRegularFile(folder.resolve("b.txt")));
        assertFalse(Files.exists(tempDir.resolve("escape.txt")));
    }
    
    @Test
    @DisplayName("无法打开压缩包时不创建解包目录")
    public void testInvalidArchive() throws Exception {
        Path notZip = Files.write(tempDir.resolve("broken.slpk"), "not a zip".getBytes(StandardCharsets.UTF_8));
        
        UnpackException e = assertThrows(UnpackException.class,
            () -> new Unpacker(new UnpackConfig(2, false)).unpack(notZip));
        
        assertEquals(UnpackException.Reason.INVALID_ARCHIVE, e.getReason());
        assertFalse(Files.exists(tempDir.resolve("broken")));
    }
    
    @Test
    @DisplayName("解包目录无法准备时不启动线程")
    public void testSetupFailureStartsNoWorkers() throws Exception {
        Path slpk = buildSceneLayerPackage("noext", 2);
        AtomicInteger opened = new AtomicInteger();
        
        UnpackException e = assertThrows(UnpackException.class,
            () -> new Unpacker(new UnpackConfig(2, false), path -> {
                opened.incrementAndGet();
                return ZipPackageArchive.open(path);
            }).unpack(slpk));
        
        assertEquals(UnpackException.Reason.NO_EXTENSION, e.getReason());
        assertEquals(1, opened.get(), "只应打开一次压缩包用于统计条目数");
    }
    
    @Test
    @DisplayName("每个线程各自打开压缩包")
    public void testEachWorkerOpensOwnArchive() throws Exception {
        Path slpk = buildSceneLayerPackage("handles.slpk", 8);
        AtomicInteger opened = new AtomicInteger();
        
        new Unpacker(new UnpackConfig(3, false), path -> {
            opened.incrementAndGet();
            return ZipPackageArchive.open(path);
        }).unpack(slpk);
        
        assertEquals(4, opened.get(), "一次统计条目数，加上三个线程各一次");
    }
    
    @Test
    @DisplayName("线程异常终止视为致命错误")
    public void testCrashingWorkerIsFatal() throws Exception {
        Path slpk = buildSceneLayerPackage("crash.slpk", 2);
        
        FatalUnpackException e = assertThrows(FatalUnpackException.class,
            () -> new Unpacker(new UnpackConfig(2, false), path -> new CrashingArchive(6)).unpack(slpk));
        
        assertTrue(e.getCause() instanceof IllegalStateException);
    }
    
    private static class CrashingArchive implements PackageArchive {
        private final int size;
        
        CrashingArchive(int size) {
            this.size = size;
        }
        
        @Override
        public int size() {
            return size;
        }
        
        @Override
        public ArchiveEntry entryAt(int index) {
            throw new IllegalStateException("crash at " + index);
        }
        
        @Override
        public void close() {
        }
    }
}
