package org.muma.redis.cli.protocol;

import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 握手描述 (HELLO 命令)
 * 构造后不可变，连接时只使用一次。
 */
@Getter
public final class Hello {

    public static final int RESP2 = 2;
    public static final int RESP3 = 3;

    public static final String DEFAULT_CLIENT_NAME = "mini_redis_cli";
    private static final String DEFAULT_USERNAME = "default";

    private final String username;
    private final String password;
    private final String clientName;
    private final int protocolVersion;

    public Hello(String username, String password, String clientName, int protocolVersion) {
        if (protocolVersion != RESP2 && protocolVersion != RESP3) {
            throw new IllegalArgumentException("Unsupported protocol version: " + protocolVersion);
        }
        if (clientName == null || clientName.isBlank()) {
            throw new IllegalArgumentException("client name must not be blank");
        }
        this.username = username;
        this.password = password;
        this.clientName = clientName;
        this.protocolVersion = protocolVersion;
    }

    public static Hello noAuth() {
        return new Hello(null, null, DEFAULT_CLIENT_NAME, RESP3);
    }

    public static Hello withPassword(String username, String password) {
        return new Hello(username, password, DEFAULT_CLIENT_NAME, RESP3);
    }

    /**
     * HELLO &lt;ver&gt; [AUTH &lt;user&gt; &lt;pass&gt;] SETNAME &lt;name&gt;\r\n
     * <p>
     * 固定格式的命令，直接按文本发送，不经过数组编码。
     * 只有设置了密码才带 AUTH，缺省用户名为 default。
     */
    public byte[] encode() {
        StringBuilder sb = new StringBuilder("HELLO ").append(protocolVersion);
        if (password != null) {
            sb.append(" AUTH ")
                    .append(username != null ? username : DEFAULT_USERNAME)
                    .append(' ')
                    .append(password);
        }
        sb.append(" SETNAME ").append(clientName).append("\r\n");
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    // 日志里不能出现密码
    @Override
    public String toString() {
        return "Hello{proto=" + protocolVersion + ", user=" + username
                + ", auth=" + (password != null) + ", name=" + clientName + "}";
    }
}
