package org.muma.mini.kv.protocol;

/**
 * 一次解析的结果: 完整的帧加上它占用的字节数，或者需要更多数据时的 {@link #INCOMPLETE}
 */
public record ParseResult(RedisMessage message, int consumed) {

    public static final ParseResult INCOMPLETE = new ParseResult(null, 0);

    public static ParseResult complete(RedisMessage message, int consumed) {
        return new ParseResult(message, consumed);
    }

    public boolean isComplete() {
        return message != null;
    }
}
