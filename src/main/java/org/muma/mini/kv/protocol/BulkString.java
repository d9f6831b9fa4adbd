package org.muma.mini.kv.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 4. Bulk string ($)
 * 内容是不透明的字节序列，{@code null} 内容表示 Null Bulk String ({@code $-1})
 */
public record BulkString(byte[] content) implements RedisMessage {

    public static final BulkString NULL = new BulkString((byte[]) null);

    public BulkString {
        content = content == null ? null : content.clone();
    }

    public BulkString(String s) {
        this(s == null ? null : s.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] content() {
        return content == null ? null : content.clone();
    }

    public boolean isNull() {
        return content == null;
    }

    public int length() {
        return content == null ? -1 : content.length;
    }

    public String asString() {
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof BulkString other && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return content == null ? "BulkString[null]" : "BulkString[" + asString() + "]";
    }
}
