package org.muma.mini.kv.protocol;

/**
 * 已缓冲的字节不可能再组成合法帧时由 {@link RespParser} 抛出。
 * 数据不够 (半包) 不算错误，不会抛出这个异常
 */
public class RespProtocolException extends RuntimeException {

    private final RespError error;

    public RespProtocolException(RespError error, String message) {
        super(message);
        this.error = error;
    }

    public RespError getError() {
        return error;
    }
}
