package org.muma.mini.kv.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
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
    private String bind = "0.0.0.0";
    private int port = 6379;
    private int workerThreads = 0; // 0 = Netty default

    private String configFilePath = DEFAULT_CONFIG_FILE;

    // --- Singleton Access ---
    MiniKvConfig() {
    }

    public static MiniKvConfig getInstance() {
        return INSTANCE;
    }

    // --- Loading Logic ---

    /**
     * 依次应用配置文件、环境变量、命令行参数
     */
    public void load(String[] args) {
        // --config 必须先于文件加载解析出来
        this.configFilePath = findConfigPath(args);
        loadConfig(configFilePath);
        applyEnvOverrides();
        parseArgs(args);
        log.info("MiniKvConfig initialized: {}", this);
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i + 1 >= args.length) {
                log.warn("Missing value for argument: {}", arg);
                break;
            }
            switch (arg) {
                case "--config" -> this.configFilePath = args[++i];
                case "--port" -> this.port = parseInt(args[++i], "--port", this.port);
                case "--bind" -> this.bind = args[++i];
                case "--workers" -> this.workerThreads = parseInt(args[++i], "--workers", this.workerThreads);
                default -> log.warn("Unknown argument: {}", arg);
            }
        }
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        this.bind = props.getProperty("server.bind", this.bind);
        this.port = getInt(props, "server.port", this.port);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);
    }

    void applyEnvOverrides() {
        String envPort = System.getenv("MINIKV_PORT");
        if (envPort != null) {
            this.port = parseInt(envPort, "MINIKV_PORT", this.port);
            log.info("Port overridden by ENV: {}", this.port);
        }
    }

    private String findConfigPath(String[] args) {
        for (int i = 0; i + 1 < args.length; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return configFilePath;
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 如果是 classpath 资源
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

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parseInt(val.trim(), key, defaultValue) : defaultValue;
    }

    private int parseInt(String value, String source, int defaultValue) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', using {}.", source, value, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "Config{bind=" + bind + ", port=" + port + ", workers=" + workerThreads + "}";
    }
}
