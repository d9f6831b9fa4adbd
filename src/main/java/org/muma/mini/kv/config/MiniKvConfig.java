package org.muma.mini.kv.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * 全局配置中心
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (minikv.properties) > 默认值
 */
@Getter
@Setter
public class MiniKvConfig {

    private static final Logger log = LoggerFactory.getLogger(MiniKvConfig.class);
    private static final MiniKvConfig INSTANCE = new MiniKvConfig();

    public static final String DEFAULT_CONFIG_FILE = "minikv.properties";

    // --- Core Settings ---
    private int port = 6379;
    private int workerThreads = 0; // 0 = Netty default
    private int readTimeoutSeconds = 0; // 0 = no read timeout

    // --- Protocol Limits ---
    private int maxNestingDepth = 32;
    private int maxArrayElements = 1_000_000;
    private long maxBulkLength = 512L * 1024 * 1024;
    private int maxLineLength = 64 * 1024;

    private String configFilePath = DEFAULT_CONFIG_FILE;

    // 命令行参数收集到这里，最后覆盖
    private final Properties argOverrides = new Properties();

    // --- Singleton Access ---
    MiniKvConfig() {
    }

    public static MiniKvConfig getInstance() {
        return INSTANCE;
    }

    // --- Loading Logic ---

    /**
     * 启动时的完整加载流程: 先读命令行，{@code --config} 才能指定配置文件，
     * 但命令行的值在配置文件和环境变量之后才生效
     */
    public void load(String[] args) {
        parseArgs(args);
        loadConfig(configFilePath, System.getenv());
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) && i + 1 < args.length) {
                this.configFilePath = args[++i];
            } else if ("--port".equals(arg) && i + 1 < args.length) {
                argOverrides.setProperty("server.port", args[++i]);
            } else {
                log.warn("Ignoring unknown argument: {}", arg);
            }
        }
    }

    public void loadConfig(String path, Map<String, String> env) {
        Properties props = loadProperties(path);

        // 1. Env Vars Override
        applyEnvOverrides(props, env);

        // 2. Command line
        props.putAll(argOverrides);

        // 3. Core
        this.port = getInt(props, "server.port", this.port);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);
        this.readTimeoutSeconds = getInt(props, "server.read_timeout_seconds", this.readTimeoutSeconds);

        // 4. Protocol limits
        this.maxNestingDepth = getInt(props, "proto.max_nesting_depth", this.maxNestingDepth);
        this.maxArrayElements = getInt(props, "proto.max_array_elements", this.maxArrayElements);
        this.maxLineLength = getInt(props, "proto.max_line_length", this.maxLineLength);

        String bulkLen = props.getProperty("proto.max_bulk_length");
        if (bulkLen != null) {
            try {
                this.maxBulkLength = parseSize(bulkLen);
            } catch (NumberFormatException e) {
                log.warn("Invalid proto.max_bulk_length '{}', using {}.", bulkLen, this.maxBulkLength);
            }
        }

        log.info("MiniKvConfig initialized: {}", this);
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                // 尝试作为文件系统路径加载
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.warn("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    private void applyEnvOverrides(Properties props, Map<String, String> env) {
        String envPort = env.get("MINIKV_PORT");
        if (envPort != null) {
            props.setProperty("server.port", envPort);
            log.info("Port overridden by ENV: {}", envPort);
        }
    }

    // 辅助：解析带单位的大小 (64mb, 1gb)，也接受纯字节数
    long parseSize(String sizeStr) {
        String s = sizeStr.toLowerCase().trim();
        long multiplier = 1;
        if (s.endsWith("kb")) {
            multiplier = 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("mb")) {
            multiplier = 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("gb")) {
            multiplier = 1024 * 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("b")) {
            s = s.substring(0, s.length() - 1);
        }
        return Long.parseLong(s.trim()) * multiplier;
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', using default {}.", key, val, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "Config{port=" + port + ", workers=" + workerThreads + ", readTimeout=" + readTimeoutSeconds
                + "s, maxDepth=" + maxNestingDepth + ", maxElements=" + maxArrayElements
                + ", maxBulk=" + maxBulkLength + ", maxLine=" + maxLineLength + "}";
    }
}
