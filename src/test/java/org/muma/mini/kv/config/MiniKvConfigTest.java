package org.muma.mini.kv.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MiniKvConfigTest {

    @Test
    void testDefaults() {
        MiniKvConfig config = new MiniKvConfig();
        assertEquals("0.0.0.0", config.getBind());
        assertEquals(6379, config.getPort());
        assertEquals(0, config.getWorkerThreads());
    }

    @Test
    void testLoadFromClasspath() {
        MiniKvConfig config = new MiniKvConfig();
        config.loadConfig("minikv-test.properties");

        assertEquals("127.0.0.1", config.getBind());
        assertEquals(16379, config.getPort());
        // 非法数值保留原值
        assertEquals(0, config.getWorkerThreads());
    }

    @Test
    void testMissingFileKeepsDefaults() {
        MiniKvConfig config = new MiniKvConfig();
        config.loadConfig("/no/such/minikv.properties");

        assertEquals(6379, config.getPort());
        assertEquals("0.0.0.0", config.getBind());
    }

    @Test
    void testParseArgs() {
        MiniKvConfig config = new MiniKvConfig();
        config.parseArgs(new String[]{"--port", "7000", "--bind", "localhost", "--workers", "4", "--unknown", "x"});

        assertEquals(7000, config.getPort());
        assertEquals("localhost", config.getBind());
        assertEquals(4, config.getWorkerThreads());

        config.parseArgs(new String[]{"--port", "abc"});
        assertEquals(7000, config.getPort());
    }

    @Test
    void testArgsOverrideConfigFile() {
        MiniKvConfig config = new MiniKvConfig();
        config.load(new String[]{"--config", "minikv-test.properties", "--port", "17000"});

        assertEquals("minikv-test.properties", config.getConfigFilePath());
        assertEquals("127.0.0.1", config.getBind());
        // MINIKV_PORT 环境变量也会被命令行覆盖
        assertEquals(17000, config.getPort());
    }
}
