package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import org.muma.mini.kv.config.MiniKvConfig;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 流式 RESP 解析器
 * <p>
 * 基于当前已缓冲的数据给出三种结果之一: 完整的帧及其占用的字节数、{@link ParseResult#INCOMPLETE}、
 * 或者抛出 {@link RespProtocolException}。解析过程不移动 readerIndex，数据不够时可以等更多字节到达后重试。
 * <p>
 * {@link #scan(ByteBuf, ScanState)} 只测量帧边界、不构建对象，并且在多次调用之间保留进度，
 * 解码器用它判断帧是否已经完整，完整后才调用一次 {@link #parse(ByteBuf)}。
 */
public class RespParser {

    // RESP 协议常量
    private static final byte PLUS_BYTE = '+';
    private static final byte MINUS_BYTE = '-';
    private static final byte COLON_BYTE = ':';
    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';

    // 回车换行
    private static final byte CR = '\r';
    private static final byte LF = '\n';

    // 预分配上限，声明的元素个数再大也不会一次性分配巨大的数组
    private static final int MAX_PREALLOCATED_ELEMENTS = 1024;

    private final int maxNestingDepth;
    private final int maxArrayElements;
    private final long maxBulkLength;
    private final int maxLineLength;

    public RespParser(int maxNestingDepth, int maxArrayElements, long maxBulkLength, int maxLineLength) {
        this.maxNestingDepth = maxNestingDepth;
        this.maxArrayElements = maxArrayElements;
        this.maxBulkLength = maxBulkLength;
        this.maxLineLength = maxLineLength;
    }

    public RespParser(MiniKvConfig config) {
        this(config.getMaxNestingDepth(), config.getMaxArrayElements(),
                config.getMaxBulkLength(), config.getMaxLineLength());
    }

    /**
     * 解析从 {@code in} 的 readerIndex 开始的一个帧
     */
    public ParseResult parse(ByteBuf in) {
        return parseAt(in, in.readerIndex(), 0);
    }

    /**
     * 增量扫描 readerIndex 处的帧，校验规则与 {@link #parse(ByteBuf)} 相同。
     * 已经扫描过的元素记录在 {@code state} 中，下次调用从断点继续。
     *
     * @return 帧完整时返回帧的字节数 (同时重置 state)，否则返回 -1
     */
    int scan(ByteBuf in, ScanState state) {
        int start = in.readerIndex();
        while (true) {
            int offset = start + state.scanned;
            if (offset >= in.writerIndex()) {
                return -1;
            }

            byte typeByte = in.getByte(offset);
            if (typeByte == ASTERISK_BYTE) {
                checkDepth(state.depth + 1);
                int lineEnd = findLineEnd(in, offset + 1);
                if (lineEnd < 0) return -1;

                long count = readArrayCount(in, offset + 1, lineEnd);
                state.scanned += lineEnd + 2 - offset;
                if (count > 0) {
                    state.push(count);
                    continue;
                }
                // 空数组和 Null 数组本身就是一个完整元素
            } else {
                int length = scalarLength(in, offset, typeByte);
                if (length < 0) return -1;
                state.scanned += length;
            }

            // 一个元素结束，逐层关闭已经收齐的数组
            while (state.depth > 0 && --state.remaining[state.depth - 1] == 0) {
                state.depth--;
            }
            if (state.depth == 0) {
                int frameLength = state.scanned;
                state.reset();
                return frameLength;
            }
        }
    }

    private ParseResult parseAt(ByteBuf in, int offset, int depth) {
        if (offset >= in.writerIndex()) {
            return ParseResult.INCOMPLETE;
        }

        // 1. 读取类型标识字节
        byte typeByte = in.getByte(offset);

        // 2. 根据类型分发处理
        return switch (typeByte) {
            case PLUS_BYTE -> parseSimpleString(in, offset);
            case MINUS_BYTE -> parseError(in, offset);
            case COLON_BYTE -> parseInteger(in, offset);
            case DOLLAR_BYTE -> parseBulkString(in, offset);
            case ASTERISK_BYTE -> parseArray(in, offset, depth + 1);
            default -> throw unknownType(typeByte);
        };
    }

    // +<text>\r\n
    private ParseResult parseSimpleString(ByteBuf in, int offset) {
        int lineEnd = findLineEnd(in, offset + 1);
        if (lineEnd < 0) return ParseResult.INCOMPLETE;

        String text = readText(in, offset + 1, lineEnd);
        return ParseResult.complete(new SimpleString(text), lineEnd + 2 - offset);
    }

    // -<text>\r\n
    private ParseResult parseError(ByteBuf in, int offset) {
        int lineEnd = findLineEnd(in, offset + 1);
        if (lineEnd < 0) return ParseResult.INCOMPLETE;

        String text = readText(in, offset + 1, lineEnd);
        return ParseResult.complete(new ErrorMessage(text), lineEnd + 2 - offset);
    }

    // :<number>\r\n
    private ParseResult parseInteger(ByteBuf in, int offset) {
        int lineEnd = findLineEnd(in, offset + 1);
        if (lineEnd < 0) return ParseResult.INCOMPLETE;

        long value = readLong(in, offset + 1, lineEnd, RespError.INVALID_INTEGER);
        return ParseResult.complete(new RedisInteger(value), lineEnd + 2 - offset);
    }

    // 解析 BulkString: $<length>\r\n<data>\r\n，或者 $-1\r\n
    private ParseResult parseBulkString(ByteBuf in, int offset) {
        int lineEnd = findLineEnd(in, offset + 1);
        if (lineEnd < 0) return ParseResult.INCOMPLETE;

        long length = readLong(in, offset + 1, lineEnd, RespError.INVALID_LENGTH);
        int headerLength = lineEnd + 2 - offset;
        if (length < 0) {
            return ParseResult.complete(BulkString.NULL, headerLength); // Null Bulk String
        }

        int payloadStart = lineEnd + 2;
        if (!bulkPayloadReady(in, payloadStart, length)) {
            return ParseResult.INCOMPLETE;
        }

        byte[] payload = new byte[(int) length];
        in.getBytes(payloadStart, payload);
        return ParseResult.complete(new BulkString(payload), headerLength + (int) length + 2);
    }

    // 解析 Array: *<count>\r\n<element1>...<elementN>，或者 *-1\r\n
    private ParseResult parseArray(ByteBuf in, int offset, int depth) {
        checkDepth(depth);

        int lineEnd = findLineEnd(in, offset + 1);
        if (lineEnd < 0) return ParseResult.INCOMPLETE;

        long count = readArrayCount(in, offset + 1, lineEnd);
        int position = lineEnd + 2;
        if (count < 0) {
            return ParseResult.complete(RedisArray.NULL, position - offset); // Null Array
        }

        List<RedisMessage> elements = new ArrayList<>((int) Math.min(count, MAX_PREALLOCATED_ELEMENTS));
        for (long i = 0; i < count; i++) {
            ParseResult child = parseAt(in, position, depth);
            if (!child.isComplete()) {
                // 整个数组到齐之前不消费任何字节
                return ParseResult.INCOMPLETE;
            }
            elements.add(child.message());
            position += child.consumed();
        }
        return ParseResult.complete(new RedisArray(elements.toArray(new RedisMessage[0])), position - offset);
    }

    /**
     * 非数组元素的总长度，校验与 parse 一致但不构建对象
     *
     * @return 元素字节数，数据不够时返回 -1
     */
    private int scalarLength(ByteBuf in, int offset, byte typeByte) {
        if (typeByte != PLUS_BYTE && typeByte != MINUS_BYTE && typeByte != COLON_BYTE && typeByte != DOLLAR_BYTE) {
            throw unknownType(typeByte);
        }

        int lineEnd = findLineEnd(in, offset + 1);
        if (lineEnd < 0) return -1;
        int headerLength = lineEnd + 2 - offset;

        if (typeByte == COLON_BYTE) {
            readLong(in, offset + 1, lineEnd, RespError.INVALID_INTEGER);
        } else if (typeByte == DOLLAR_BYTE) {
            long length = readLong(in, offset + 1, lineEnd, RespError.INVALID_LENGTH);
            if (length >= 0) {
                return bulkPayloadReady(in, lineEnd + 2, length) ? headerLength + (int) length + 2 : -1;
            }
        }
        return headerLength;
    }

    /**
     * 检查长度上限和结尾的 CRLF。
     * 结尾的两个字节一到达就检查，不必等另一个字节。
     *
     * @return payload 和 CRLF 都已缓冲时返回 true
     */
    private boolean bulkPayloadReady(ByteBuf in, int payloadStart, long length) {
        if (length > maxBulkLength) {
            throw new RespProtocolException(RespError.LIMIT_EXCEEDED,
                    "bulk length " + length + " exceeds limit " + maxBulkLength);
        }

        long terminator = payloadStart + length;
        int available = in.writerIndex();
        if (terminator < available && in.getByte((int) terminator) != CR) {
            throw malformedBulk(length);
        }
        if (terminator + 1 < available && in.getByte((int) terminator + 1) != LF) {
            throw malformedBulk(length);
        }
        return terminator + 2 <= available;
    }

    private void checkDepth(int depth) {
        if (depth > maxNestingDepth) {
            throw new RespProtocolException(RespError.LIMIT_EXCEEDED,
                    "array nesting exceeds limit " + maxNestingDepth);
        }
    }

    private long readArrayCount(ByteBuf in, int from, int to) {
        long count = readLong(in, from, to, RespError.INVALID_LENGTH);
        if (count > maxArrayElements) {
            throw new RespProtocolException(RespError.LIMIT_EXCEEDED,
                    "array length " + count + " exceeds limit " + maxArrayElements);
        }
        return count;
    }

    /**
     * 查找从 {@code from} 开始的这一行结尾 CRLF 中 CR 的位置
     *
     * @return CR 的下标，还没有收到 LF 时返回 -1
     */
    private int findLineEnd(ByteBuf in, int from) {
        int lf = in.indexOf(from, in.writerIndex(), LF);
        if (lf < 0) {
            if (in.writerIndex() - from > maxLineLength) {
                throw new RespProtocolException(RespError.LIMIT_EXCEEDED,
                        "line exceeds limit " + maxLineLength + " without CRLF");
            }
            return -1;
        }
        if (lf == from || in.getByte(lf - 1) != CR) {
            throw new RespProtocolException(RespError.MALFORMED_LINE, "LF without preceding CR");
        }

        int lineEnd = lf - 1;
        if (lineEnd - from > maxLineLength) {
            throw new RespProtocolException(RespError.LIMIT_EXCEEDED,
                    "line exceeds limit " + maxLineLength);
        }
        if (in.indexOf(from, lineEnd, CR) >= 0) {
            throw new RespProtocolException(RespError.MALFORMED_LINE, "CR inside line");
        }
        return lineEnd;
    }

    private String readText(ByteBuf in, int from, int to) {
        return in.toString(from, to - from, StandardCharsets.UTF_8);
    }

    private long readLong(ByteBuf in, int from, int to, RespError error) {
        String line = in.toString(from, to - from, StandardCharsets.US_ASCII);
        try {
            // RESP 只允许可选的负号，Long.parseLong 还会接受 '+'
            if (line.startsWith("+")) {
                throw new NumberFormatException(line);
            }
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            String what = error == RespError.INVALID_INTEGER ? "integer" : "length";
            throw new RespProtocolException(error, "invalid " + what + " '" + printable(line) + "'");
        }
    }

    private RespProtocolException unknownType(byte typeByte) {
        return new RespProtocolException(RespError.UNKNOWN_TYPE, "unknown type prefix " + describe(typeByte));
    }

    private RespProtocolException malformedBulk(long length) {
        return new RespProtocolException(RespError.MALFORMED_BULK_STRING,
                "bulk string of declared length " + length + " is not followed by CRLF");
    }

    private static String describe(byte b) {
        if (b >= 0x21 && b <= 0x7e) {
            return "'" + (char) b + "'";
        }
        return String.format("0x%02x", b & 0xff);
    }

    private static String printable(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            sb.append(c >= 0x20 && c <= 0x7e ? c : '?');
        }
        return sb.toString();
    }

    /**
     * 一个连接上未完成帧的扫描进度，偏移量相对 readerIndex
     */
    static final class ScanState {

        // 每层未关闭数组还差的元素个数
        private long[] remaining = new long[8];
        private int depth;
        private int scanned;

        int scannedBytes() {
            return scanned;
        }

        void reset() {
            depth = 0;
            scanned = 0;
        }

        private void push(long count) {
            if (depth == remaining.length) {
                remaining = Arrays.copyOf(remaining, depth * 2);
            }
            remaining[depth++] = count;
        }
    }
}
