package org.muma.redis.cli.client;

import lombok.Getter;
import org.muma.redis.cli.buffer.StreamBuffer;
import org.muma.redis.cli.command.CommandLineEncoder;
import org.muma.redis.cli.protocol.DecodeResult;
import org.muma.redis.cli.protocol.Hello;
import org.muma.redis.cli.protocol.RedisArray;
import org.muma.redis.cli.protocol.RedisMessage;
import org.muma.redis.cli.protocol.RespDecoder;
import org.muma.redis.cli.protocol.RespEncoder;
import org.muma.redis.cli.protocol.RespText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * 到 Redis 的单条阻塞连接
 * <p>
 * 独占一个 {@link StreamBuffer} 和一个 Socket。每次 send 都是完全同步的：
 * 先写完请求，再循环 "解码 -> 不够就读一次 -> 再解码" 直到拿到一个完整回复。
 * 不支持流水线，也不是线程安全的，多个线程共用时需要外部加锁。
 * <p>
 * IO 错误、对端关闭、协议错误都是致命的：连接进入 CLOSED，调用方需要重新 connect。
 */
public class RedisConnection implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(RedisConnection.class);

    private final String address;
    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final StreamBuffer buffer;

    @Getter
    private volatile ConnState state = ConnState.UNCONNECTED;

    // 握手返回的服务端信息 (RESP3 下是一个 Map)
    @Getter
    private RedisMessage handshakeReply;

    RedisConnection(String address, Socket socket, InputStream in, OutputStream out, StreamBuffer buffer) {
        this.address = address;
        this.socket = socket;
        this.in = in;
        this.out = out;
        this.buffer = buffer;
    }

    public static RedisConnection connect(String host, int port, Hello hello) throws IOException {
        return connect(host, port, hello, new ConnectionOptions());
    }

    /**
     * 建立 TCP 连接并完成 HELLO 握手
     *
     * @throws HandshakeRejectedException 服务端对 HELLO 返回了错误
     */
    public static RedisConnection connect(String host, int port, Hello hello, ConnectionOptions options) throws IOException {
        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(options.isTcpNoDelay());
            socket.setKeepAlive(options.isKeepAlive());
            socket.setSoTimeout(options.getSoTimeoutMs());
            socket.connect(new InetSocketAddress(host, port), options.getConnectTimeoutMs());
        } catch (IOException e) {
            socket.close();
            throw e;
        }

        RedisConnection connection = new RedisConnection(host + ":" + port, socket,
                socket.getInputStream(), socket.getOutputStream(), new StreamBuffer(options.getBufferSize()));
        connection.handshake(hello);
        return connection;
    }

    /**
     * 发送 HELLO 并读取一个回复，失败时连接直接关闭
     */
    void handshake(Hello hello) throws IOException {
        if (state != ConnState.UNCONNECTED) {
            throw new IllegalStateException("Handshake already performed, state: " + state);
        }
        log.debug("Sending handshake to {}: {}", address, hello);

        RedisMessage reply = roundTrip(() -> buffer.putBytes(hello.encode()));
        if (reply.isError()) {
            String error = RespText.errorText(reply);
            log.warn("Handshake with {} rejected: {}", address, error);
            close();
            throw new HandshakeRejectedException(error);
        }

        this.handshakeReply = reply;
        this.state = ConnState.CONNECTED;
        log.info("Connected to {} using RESP{}", address, hello.getProtocolVersion());
    }

    /**
     * 把一行命令文本按空白切分后发送 (不支持引号)
     */
    public RedisMessage send(String commandLine) throws IOException {
        return send(CommandLineEncoder.encode(commandLine));
    }

    public RedisMessage send(RedisArray command) throws IOException {
        if (state != ConnState.CONNECTED) {
            throw new IllegalStateException("Connection to " + address + " is not usable, state: " + state);
        }

        // 没有流水线，正常情况下这里不会有残留数据
        if (buffer.hasRemaining()) {
            log.warn("Discarding {} unread bytes from {} before next request", buffer.remaining(), address);
            buffer.skipRemaining();
        }
        buffer.compact();

        return roundTrip(() -> RespEncoder.encode(command, buffer));
    }

    private RedisMessage roundTrip(Runnable encodeRequest) throws IOException {
        try {
            try {
                encodeRequest.run();
            } catch (IndexOutOfBoundsException e) {
                // 请求写不进固定容量的缓冲区，已写入的半帧不会发出
                throw new RedisClientException("Request exceeds buffer capacity of " + buffer.capacity() + " bytes", e);
            }
            buffer.drainTo(out);
            return readReply();
        } catch (IOException | RuntimeException e) {
            log.warn("Connection to {} failed: {}", address, e.toString());
            close();
            throw e;
        }
    }

    /**
     * 解码循环：只有 Incomplete 会触发再读一次，其余结果直接返回或抛出
     */
    private RedisMessage readReply() throws IOException {
        while (true) {
            DecodeResult result = RespDecoder.decode(buffer);
            if (result instanceof DecodeResult.Complete complete) {
                return complete.value();
            }
            if (result instanceof DecodeResult.Malformed malformed) {
                throw new ProtocolException("Malformed reply from " + address + ": " + malformed.reason());
            }

            if (buffer.freeSpace() == 0) {
                buffer.compact();
                if (buffer.freeSpace() == 0) {
                    throw new ProtocolException("Reply frame exceeds buffer capacity of " + buffer.capacity() + " bytes");
                }
            }

            int count = buffer.fillFrom(in);
            if (count == 0) {
                throw new ConnectionClosedException("Connection closed by " + address + " while waiting for reply");
            }
            log.trace("Read {} bytes from {}, {} buffered", count, address, buffer.remaining());
        }
    }

    public String getAddress() {
        return address;
    }

    public boolean isConnected() {
        return state == ConnState.CONNECTED;
    }

    @Override
    public void close() {
        if (state == ConnState.CLOSED) {
            return;
        }
        state = ConnState.CLOSED;
        try {
            if (socket != null) {
                socket.close();
            } else {
                in.close();
                out.close();
            }
            log.debug("Connection to {} closed", address);
        } catch (IOException e) {
            log.debug("Error while closing connection to {}", address, e);
        }
    }
}
