package com.slpk;

import com.slpk.config.ConfigLoader;
import com.slpk.config.UnpackConfig;
import com.slpk.core.FatalUnpackException;
import com.slpk.core.Unpacker;
import com.slpk.util.InputValidator;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLPK解包工具主程序
 */
public class SlpkMain {
    private static final Logger logger = LoggerFactory.getLogger(SlpkMain.class);
    
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FATAL = 3;
    
    public static void main(String[] args) {
        System.exit(run(args));
    }
    
    static int run(String[] args) {
        UnpackConfig config = ConfigLoader.load();
        List<String> archivePaths = new ArrayList<>();
        
        // 解析命令行参数
        for (String arg : args) {
            if ("-v".equals(arg) || "--verbose".equals(arg)) {
                config = config.withVerbose(true);
            } else if ("-q".equals(arg) || "--quiet".equals(arg)) {
                config = config.withVerbose(false);
            } else if (arg.startsWith("-")) {
                System.err.println("[!] 未知参数: " + arg);
                printUsage();
                return EXIT_USAGE;
            } else {
                archivePaths.add(arg);
            }
        }
        
        if (archivePaths.isEmpty()) {
            printUsage();
            return EXIT_USAGE;
        }
        
        logger.debug("[+] 配置: {}", config);
        Unpacker unpacker = new Unpacker(config);
        int exitCode = EXIT_OK;
        
        for (String archivePath : archivePaths) {
            try {
                // 输入验证
                InputValidator.validateArchiveFile(archivePath);
                unpacker.unpack(Paths.get(archivePath));
                
            } catch (SlpkException e) {
                logger.error("[!] {}", e.getMessage());
                if (System.getProperty("debug") != null) {
                    logger.error("详细错误信息", e);
                }
                exitCode = EXIT_FAILED;
            } catch (IllegalArgumentException e) {
                logger.error("[!] 输入验证失败: {}", e.getMessage());
                exitCode = EXIT_FAILED;
            } catch (FatalUnpackException e) {
                // 线程状态未知，不再继续
                logger.error("[!] 致命错误: {}", e.getMessage(), e);
                return EXIT_FATAL;
            }
        }
        
        return exitCode;
    }
    
    private static void printUsage() {
        System.err.println("用法:");
        System.err.println("  java -jar slpk-unpack.jar [-v|--verbose] [-q|--quiet] <文件.slpk>...");
        System.err.println("\n示例:");
        System.err.println("  java -jar slpk-unpack.jar city.slpk");
        System.err.println("  java -jar slpk-unpack.jar -v a.slpk b.slpk");
    }
}
