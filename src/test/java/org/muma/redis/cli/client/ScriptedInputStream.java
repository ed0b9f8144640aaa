package org.muma.redis.cli.client;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 每次 read 最多返回一个预设分片，用来模拟 TCP 的拆包；分片用完后返回 EOF
 */
class ScriptedInputStream extends InputStream {

    private final Deque<byte[]> chunks = new ArrayDeque<>();
    private int reads;

    ScriptedInputStream(String... chunks) {
        for (String chunk : chunks) {
            this.chunks.add(chunk.getBytes(StandardCharsets.UTF_8));
        }
    }

    int reads() {
        return reads;
    }

    @Override
    public int read() {
        byte[] one = new byte[1];
        int n = read(one, 0, 1);
        return n < 0 ? -1 : one[0] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) {
        reads++;
        byte[] chunk = chunks.poll();
        if (chunk == null) {
            return -1;
        }
        int n = Math.min(len, chunk.length);
        System.arraycopy(chunk, 0, b, off, n);
        if (n < chunk.length) {
            byte[] rest = new byte[chunk.length - n];
            System.arraycopy(chunk, n, rest, 0, rest.length);
            chunks.push(rest);
        }
        return n;
    }
}
