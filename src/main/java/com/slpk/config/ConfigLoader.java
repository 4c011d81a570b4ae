package com.slpk.config;

import java.io.InputStream;
import java.util.Map;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 配置加载器
 * 
 * 优先读取classpath下的 slpk.properties：
 * <pre>
 * unpack.workers=0      # 0 表示按CPU核数
 * unpack.verbose=false
 * </pre>
 * 配置文件不存在或无法读取时，改从环境变量 SLPK_UNPACK_WORKERS / SLPK_UNPACK_VERBOSE 读取。
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    
    static final String CONFIG_RESOURCE = "/slpk.properties";
    static final String WORKERS_KEY = "unpack.workers";
    static final String VERBOSE_KEY = "unpack.verbose";
    static final String WORKERS_ENV = "SLPK_UNPACK_WORKERS";
    static final String VERBOSE_ENV = "SLPK_UNPACK_VERBOSE";
    
    public static UnpackConfig load() {
        try (InputStream is = ConfigLoader.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is == null) {
                return fromEnvironment(System.getenv());
            }
            
            Properties props = new Properties();
            props.load(is);
            logger.debug("[+] 成功加载配置文件");
            return fromProperties(props);
        } catch (Exception e) {
            logger.warn("[!] 加载配置文件失败，尝试从环境变量读取: {}", e.getMessage());
            return fromEnvironment(System.getenv());
        }
    }
    
    static UnpackConfig fromProperties(Properties props) {
        return build(props.getProperty(WORKERS_KEY), props.getProperty(VERBOSE_KEY));
    }
    
    static UnpackConfig fromEnvironment(Map<String, String> env) {
        return build(env.get(WORKERS_ENV), env.get(VERBOSE_ENV));
    }
    
    private static UnpackConfig build(String workers, String verbose) {
        return new UnpackConfig(parseWorkers(workers), Boolean.parseBoolean(trim(verbose)));
    }
    
    private static int parseWorkers(String value) {
        String trimmed = trim(value);
        if (trimmed == null || trimmed.isEmpty()) {
            return UnpackConfig.availableProcessors();
        }
        
        try {
            int workers = Integer.parseInt(trimmed);
            if (workers < 0) {
                logger.warn("[!] 线程数不能为负数: {}，使用CPU核数", value);
                return UnpackConfig.availableProcessors();
            }
            return workers == 0 ? UnpackConfig.availableProcessors() : workers;
        } catch (NumberFormatException e) {
            logger.warn("[!] 无效的线程数: {}，使用CPU核数", value);
            return UnpackConfig.availableProcessors();
        }
    }
    
    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
