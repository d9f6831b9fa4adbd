package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;

/**
 * RESP 序列化工具
 * 每种 {@link RedisMessage} 只有一种线上格式，数组递归写出
 */
public final class RespSerializer {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_LENGTH = "-1".getBytes(StandardCharsets.US_ASCII);

    private RespSerializer() {
    }

    public static byte[] encode(RedisMessage msg) {
        ByteBuf out = Unpooled.buffer(64);
        try {
            write(out, msg);
            return ByteBufUtil.getBytes(out);
        } finally {
            out.release();
        }
    }

    public static void write(ByteBuf out, RedisMessage msg) {
        if (msg instanceof SimpleString s) {
            writeLine(out, '+', s.content());
        } else if (msg instanceof ErrorMessage e) {
            writeLine(out, '-', e.content());
        } else if (msg instanceof RedisInteger i) {
            writeLine(out, ':', String.valueOf(i.value()));
        } else if (msg instanceof BulkString b) {
            writeBulkString(out, b);
        } else if (msg instanceof RedisArray a) {
            writeArray(out, a);
        } else {
            throw new IllegalArgumentException("Unsupported message type: " + msg);
        }
    }

    private static void writeLine(ByteBuf out, char prefix, String content) {
        out.writeByte(prefix);
        out.writeCharSequence(content, StandardCharsets.UTF_8);
        out.writeBytes(CRLF);
    }

    private static void writeBulkString(ByteBuf out, BulkString b) {
        out.writeByte('$');
        if (b.isNull()) {
            out.writeBytes(NULL_LENGTH);
            out.writeBytes(CRLF);
            return;
        }
        byte[] content = b.content();
        out.writeCharSequence(String.valueOf(content.length), StandardCharsets.US_ASCII);
        out.writeBytes(CRLF);
        out.writeBytes(content);
        out.writeBytes(CRLF);
    }

    private static void writeArray(ByteBuf out, RedisArray a) {
        out.writeByte('*');
        if (a.isNull()) {
            out.writeBytes(NULL_LENGTH);
            out.writeBytes(CRLF);
            return;
        }
        RedisMessage[] elements = a.elements();
        out.writeCharSequence(String.valueOf(elements.length), StandardCharsets.US_ASCII);
        out.writeBytes(CRLF);
        for (RedisMessage element : elements) {
            write(out, element);
        }
    }
}
