package org.muma.redis.cli.config;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.muma.redis.cli.client.ConnectionOptions;
import org.muma.redis.cli.protocol.Hello;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * 客户端配置中心
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (redis-cli.properties) > 默认值
 */
@Getter
@Setter
public class ClientConfig {

    private static final Logger log = LoggerFactory.getLogger(ClientConfig.class);
    private static final ClientConfig INSTANCE = new ClientConfig();

    public static final String DEFAULT_CONFIG_FILE = "redis-cli.properties";
    public static final String USAGE = "usage: mini-redis-cli host [port [password]] [--user <name>] [--resp2] [--config <path>]";

    // --- Server ---
    private String host = "127.0.0.1";
    private int port = 6379;

    // --- Handshake ---
    private String username = null;
    private String password = null;
    private String clientName = Hello.DEFAULT_CLIENT_NAME;
    private int protocolVersion = Hello.RESP3;

    // --- Connection tuning ---
    private int bufferSize = ConnectionOptions.DEFAULT_BUFFER_SIZE;
    private int connectTimeoutMs = 3000;
    private int soTimeoutMs = 0;
    private boolean tcpNoDelay = true;
    private boolean keepAlive = true;

    // --- REPL ---
    private boolean hintsEnabled = true;

    private String configFilePath = DEFAULT_CONFIG_FILE;

    // 测试时替换环境变量来源
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.PACKAGE)
    private Function<String, String> env = System::getenv;

    ClientConfig() {
    }

    public static ClientConfig getInstance() {
        return INSTANCE;
    }

    // --- Loading Logic ---

    /**
     * 完整加载流程：先找 --config，依次应用配置文件、环境变量、命令行参数
     *
     * @throws IllegalArgumentException 命令行参数不合法
     */
    public void load(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                this.configFilePath = args[i + 1];
            }
        }
        loadConfig(configFilePath);
        parseArgs(args);
    }

    /**
     * 位置参数沿用 host [port [password]] 的约定，其余用 --flag
     */
    public void parseArgs(String[] args) {
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) && i + 1 < args.length) {
                this.configFilePath = args[++i];
            } else if ("--user".equals(arg) && i + 1 < args.length) {
                this.username = args[++i];
            } else if ("--resp2".equals(arg)) {
                this.protocolVersion = Hello.RESP2;
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("Unknown option: " + arg);
            } else {
                positional.add(arg);
            }
        }

        if (positional.size() > 3) {
            throw new IllegalArgumentException("Too many arguments");
        }
        if (positional.size() >= 1) {
            this.host = positional.get(0);
        }
        if (positional.size() >= 2) {
            this.port = parsePort(positional.get(1));
        }
        if (positional.size() == 3) {
            this.password = positional.get(2);
        }
        log.debug("Config loaded from args: host={}, port={}, resp={}", host, port, protocolVersion);
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        // 1. Server
        this.host = getString(props, "host", this.host);
        this.port = getInt(props, "port", this.port);

        // 2. Handshake
        this.username = getString(props, "username", this.username);
        this.password = getString(props, "password", this.password);
        this.clientName = getString(props, "client.name", this.clientName);
        int proto = getInt(props, "protocol", this.protocolVersion);
        if (proto == Hello.RESP2 || proto == Hello.RESP3) {
            this.protocolVersion = proto;
        } else {
            log.warn("Invalid protocol value '{}', using RESP{}.", proto, this.protocolVersion);
        }

        // 3. Connection
        String size = props.getProperty("buffer.size");
        if (size != null) {
            try {
                this.bufferSize = Math.toIntExact(parseSize(size));
            } catch (RuntimeException e) {
                log.warn("Invalid buffer.size '{}', using default {}.", size, this.bufferSize);
            }
        }
        this.connectTimeoutMs = getInt(props, "socket.connect_timeout_ms", this.connectTimeoutMs);
        this.soTimeoutMs = getInt(props, "socket.timeout_ms", this.soTimeoutMs);
        this.tcpNoDelay = getBool(props, "socket.tcp_nodelay", this.tcpNoDelay);
        this.keepAlive = getBool(props, "socket.keepalive", this.keepAlive);

        // 4. REPL
        this.hintsEnabled = getBool(props, "cli.hints", this.hintsEnabled);

        // 5. Env Vars Override
        applyEnvOverrides();

        log.debug("ClientConfig initialized: {}", this);
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 如果是 classpath 资源
            if (is != null) {
                props.load(is);
                log.debug("Loaded config from classpath: {}", path);
            } else {
                // 尝试作为文件系统路径加载
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.debug("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.debug("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    private void applyEnvOverrides() {
        String envHost = env.apply("REDIS_HOST");
        if (envHost != null && !envHost.isBlank()) {
            this.host = envHost;
            log.debug("Host overridden by ENV: {}", this.host);
        }

        String envPort = env.apply("REDIS_PORT");
        if (envPort != null) {
            try {
                this.port = parsePort(envPort);
                log.debug("Port overridden by ENV: {}", this.port);
            } catch (IllegalArgumentException e) {
                log.warn("Invalid REDIS_PORT '{}', keeping {}.", envPort, this.port);
            }
        }

        String envPassword = env.apply("REDIS_PASSWORD");
        if (envPassword != null) {
            this.password = envPassword;
        }
    }

    public Hello toHello() {
        return new Hello(username, password, clientName, protocolVersion);
    }

    public ConnectionOptions toConnectionOptions() {
        ConnectionOptions options = new ConnectionOptions();
        options.setBufferSize(bufferSize);
        options.setConnectTimeoutMs(connectTimeoutMs);
        options.setSoTimeoutMs(soTimeoutMs);
        options.setTcpNoDelay(tcpNoDelay);
        options.setKeepAlive(keepAlive);
        return options;
    }

    // 辅助：解析带单位的大小 (512kb, 4mb, 1gb)
    static long parseSize(String sizeStr) {
        String s = sizeStr.toLowerCase(Locale.ROOT).trim();
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
        long size = Long.parseLong(s.trim()) * multiplier;
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive: " + sizeStr);
        }
        return size;
    }

    private static int parsePort(String value) {
        int p;
        try {
            p = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + value);
        }
        if (p <= 0 || p > 65535) {
            throw new IllegalArgumentException("Port out of range: " + value);
        }
        return p;
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

    private boolean getBool(Properties props, String key, boolean defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        String v = val.trim();
        return "yes".equalsIgnoreCase(v) || "true".equalsIgnoreCase(v);
    }

    private String getString(Properties props, String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    @Override
    public String toString() {
        return "ClientConfig{host=" + host + ", port=" + port + ", resp=" + protocolVersion
                + ", user=" + username + ", auth=" + (password != null) + ", buffer=" + bufferSize + "}";
    }
}
